package com.example.DnsQueryLog.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "querylog")
public class QueryLogProperties {

    private boolean enabled = true;

    // active log file; the rotated copy lives next to it with a ".1" suffix
    private String file = "data/querylog.json";

    private String settingsFile = "data/querylog-settings.json";

    // how long history is kept: log file rotation period and startup replay window
    private int intervalHours = 24;

    // entries kept in memory for the log view
    private int memorySize = 1000;

    // pending entries that trigger a write to the log file
    private int bufferSize = 5000;

    // keys kept per counter per hour
    private int topSize = 500;

    // hours of top statistics kept
    private int topHours = 24;

    private Duration flushPeriod = Duration.ofSeconds(30);
}
