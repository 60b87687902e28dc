package com.propertyintel.listings.scheduler;

import com.propertyintel.listings.config.ListingCollectorProperties;
import com.propertyintel.listings.model.ScanMode;
import com.propertyintel.listings.service.ScanJobService;
import com.propertyintel.listings.store.JdbcListingStore;
import com.propertyintel.listings.store.ScanLedgerWriter;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Manages scheduled and on-startup scans.
 *
 * Default schedule: incremental every day at 06:00 UTC, full scan Sundays at 03:00 UTC.
 * Set either cron to "-" to disable it.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ScanScheduler {

    private final ScanJobService jobService;
    private final JdbcListingStore listingStore;
    private final ScanLedgerWriter ledgerWriter;
    private final ListingCollectorProperties properties;

    /**
     * On application startup:
     *  1. Always ensure the database schema exists
     *  2. Optionally run one scan if RUN_ON_STARTUP=true
     */
    @PostConstruct
    public void onStartup() {
        try {
            listingStore.ensureSchema();
            ledgerWriter.ensureSchema();
        } catch (Exception e) {
            log.warn("Could not initialise database schema: {}", e.getMessage());
        }

        ListingCollectorProperties.Scheduling scheduling = properties.getScheduling();
        if (scheduling.isRunOnStartup()) {
            ScanMode mode = scheduling.getStartupMode();
            log.info("RUN_ON_STARTUP=true, running {}", mode.jobType());
            try {
                jobService.run(mode);
            } catch (Exception e) {
                log.error("Startup scan failed: {}", e.getMessage(), e);
            }
        } else {
            log.info("Collector ready. Incremental cron: {}, full scan cron: {}",
                    scheduling.getIncrementalCron(), scheduling.getFullScanCron());
        }
    }

    @Scheduled(cron = "${listing-collector.scheduling.incremental-cron:0 0 6 * * ?}", zone = "UTC")
    public void scheduledIncremental() {
        log.info("Scheduled incremental scan triggered");
        try {
            jobService.runIncremental();
        } catch (Exception e) {
            log.error("Scheduled incremental scan failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(cron = "${listing-collector.scheduling.full-scan-cron:0 0 3 ? * SUN}", zone = "UTC")
    public void scheduledFullScan() {
        log.info("Scheduled full scan triggered");
        try {
            jobService.runFullScan();
        } catch (Exception e) {
            log.error("Scheduled full scan failed: {}", e.getMessage(), e);
        }
    }
}
