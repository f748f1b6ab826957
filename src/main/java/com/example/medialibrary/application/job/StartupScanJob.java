package com.example.medialibrary.application.job;

import com.example.medialibrary.api.response.ScanSessionResponse;
import com.example.medialibrary.application.service.ScanTaskService;
import com.example.medialibrary.common.config.AppLibraryProperties;
import com.example.medialibrary.common.exception.BusinessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Starts one background scan over every library folder when {@code app.library.rescan-on-startup} is set.
 */
@Service
public class StartupScanJob {

    private static final Logger log = LoggerFactory.getLogger(StartupScanJob.class);

    private final AppLibraryProperties appLibraryProperties;
    private final ScanTaskService scanTaskService;

    public StartupScanJob(AppLibraryProperties appLibraryProperties, ScanTaskService scanTaskService) {
        this.appLibraryProperties = appLibraryProperties;
        this.scanTaskService = scanTaskService;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void run() {
        if (!appLibraryProperties.isRescanOnStartup()) {
            log.debug("Startup scan skipped: rescan-on-startup disabled");
            return;
        }
        try {
            ScanSessionResponse session = scanTaskService.startScan(null);
            log.info("STARTUP_SCAN_TRIGGERED sessionId={} roots={}", session.getSessionId(), session.getRoots());
        } catch (BusinessException e) {
            if ("409".equals(e.getCode())) {
                log.info("Startup scan skipped due to active scan");
            } else {
                log.warn("Startup scan not started, code={}, msg={}", e.getCode(), e.getMessage());
            }
        } catch (Exception e) {
            log.warn("Startup scan failed unexpectedly", e);
        }
    }
}
