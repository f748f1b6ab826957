package com.example.medialibrary.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.scan")
public class AppScanProperties {

    /**
     * Emit a LIBRARY_SCAN_PROGRESS log line every N accepted files. 0 disables it.
     */
    private int progressLogInterval = 200;

    /**
     * Warn once per scan when this many progress events are waiting for the consumer.
     */
    private int eventBacklogWarnThreshold = 10000;

    /**
     * Upper bound for a single drain of buffered progress events.
     */
    private int maxEventsPerDrain = 500;
}
