package com.propertyintel.listings.output;

import com.propertyintel.listings.model.ScanMode;
import com.propertyintel.listings.model.ScanRun;
import com.propertyintel.listings.model.ScanSummary;
import com.propertyintel.listings.store.ScanLedgerWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Emits the end-of-scan summary: log line, archived _meta.json and a scan_runs row.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JobMetadataReporter {

    private final ArchiveRouter archiveRouter;
    private final ScanLedgerWriter ledgerWriter;

    public void reportSuccess(ScanMode mode, ScanSummary summary) {
        log.info("{} completed: job={} duration={}s pages={} properties={} actions={} deactivated={} stats={}",
                mode.jobType(), summary.getJobId(), summary.getDurationSeconds(), summary.getTotalPages(),
                summary.getTotalProperties(), summary.getActions(), summary.getDeactivatedCount(),
                summary.getDatabaseStats());

        LocalDate collectionDate = LocalDate.ofInstant(summary.getStartTime(), ZoneOffset.UTC);
        archiveRouter.archiveMetadata(collectionDate, mode, summary);

        ledgerWriter.writeScanRun(ScanRun.builder()
                .jobId(summary.getJobId())
                .jobType(summary.getJobType())
                .startedAt(summary.getStartTime())
                .completedAt(summary.getEndTime())
                .status("SUCCESS")
                .totalPages(summary.getTotalPages())
                .totalProperties(summary.getTotalProperties())
                .deactivatedCount(summary.getDeactivatedCount())
                .build());
    }

    public void reportFailure(ScanRun run) {
        log.error("{} failed: job={} after {} pages / {} properties: {}",
                run.getJobType(), run.getJobId(), run.getTotalPages(), run.getTotalProperties(),
                run.getErrorMessage());
        ledgerWriter.writeScanRun(run);
    }
}
