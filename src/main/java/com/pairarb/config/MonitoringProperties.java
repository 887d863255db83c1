package com.pairarb.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration for the execution history recorder.
 *
 * <p>Properties prefix: {@code pairarb.monitoring.*}. In batch mode only terminal
 * transitions are recorded; in realtime mode every transition is.
 */
@Data
@Component
@ConfigurationProperties(prefix = "pairarb.monitoring")
public class MonitoringProperties {

    private boolean batchMode = false;

    /** Maximum number of snapshots kept in memory; the oldest are evicted first. */
    private int historyCapacity = 1000;
}
