package com.pairarb.config;

import com.pairarb.domain.enums.MatchingStrategy;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the execution core.
 *
 * <p>Properties prefix: {@code pairarb.execution.*}
 */
@Configuration
@ConfigurationProperties(prefix = "pairarb.execution")
@Getter
@Setter
public class ExecutionProperties {

    /** Timeout applied to targets created without an explicit one. Runs from the first valid tick. */
    private Duration defaultTimeout = Duration.ofMinutes(5);

    /** Matching variant. AUTO_DETECT probes order book depth on every call. */
    private MatchingStrategy matchingStrategy = MatchingStrategy.AUTO_DETECT;

    /** Whether market tick events trigger execution of the targets trading the ticked instrument. */
    private boolean tickDriven = true;
}
