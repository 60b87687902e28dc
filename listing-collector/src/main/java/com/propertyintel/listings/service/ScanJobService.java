package com.propertyintel.listings.service;

import com.propertyintel.listings.model.ScanMode;
import com.propertyintel.listings.model.ScanSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Entry point for running a scan job, whoever triggers it.
 *
 * Only one job runs per process at a time. Incremental and full scans against
 * the same database from different processes are not coordinated.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScanJobService {

    private static final DateTimeFormatter JOB_ID_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss-SSS").withZone(ZoneOffset.UTC);

    private final ScanCoordinator coordinator;
    private final Clock clock;

    private final AtomicReference<String> runningJob = new AtomicReference<>();

    public ScanSummary runIncremental() {
        return run(ScanMode.INCREMENTAL);
    }

    public ScanSummary runFullScan() {
        return run(ScanMode.FULL_SCAN);
    }

    public ScanSummary run(ScanMode mode) {
        return execute(mode, claim(mode));
    }

    /**
     * Claim the run slot up front, then execute on a background thread.
     * Used by HTTP triggers.
     *
     * @return id of the job that was started
     */
    public String startAsync(ScanMode mode) {
        String jobId = claim(mode);
        Thread worker = new Thread(() -> {
            try {
                execute(mode, jobId);
            } catch (Exception e) {
                log.error("Triggered {} failed: {}", jobId, e.getMessage(), e);
            }
        }, "manual-" + jobId);
        worker.start();
        return jobId;
    }

    public Optional<String> currentJob() {
        return Optional.ofNullable(runningJob.get());
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private String claim(ScanMode mode) {
        String jobId = newJobId(mode);
        if (!runningJob.compareAndSet(null, jobId)) {
            throw new ScanAlreadyRunningException("Scan " + runningJob.get() + " is already running");
        }
        return jobId;
    }

    /** e.g. weekly-20240512-030007-123-9f3a; the suffix keeps ids unique within one millisecond */
    String newJobId(ScanMode mode) {
        return mode.jobIdPrefix() + "-" + JOB_ID_FORMAT.format(clock.instant())
                + "-" + UUID.randomUUID().toString().substring(0, 4);
    }

    private ScanSummary execute(ScanMode mode, String jobId) {
        try {
            log.info("Job starting: {} ({})", jobId, mode.jobType());
            return coordinator.run(mode, jobId);
        } finally {
            runningJob.set(null);
        }
    }
}
