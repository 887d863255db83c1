package com.pairarb.config;

import java.math.BigDecimal;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration for the in-memory paper broker.
 *
 * <p>Properties prefix: {@code pairarb.paper.*}
 */
@Data
@Component
@ConfigurationProperties(prefix = "pairarb.paper")
public class PaperBrokerProperties {

    /** Fee charged per fill as a fraction of the fill's notional (0.001 = 10 bps). */
    private BigDecimal feeRate = new BigDecimal("0.001");

    /** When true, market orders fill immediately at the current taker price. Otherwise they rest until filled manually. */
    private boolean autoFill = true;
}
