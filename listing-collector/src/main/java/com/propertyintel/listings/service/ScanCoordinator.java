package com.propertyintel.listings.service;

import com.propertyintel.listings.config.ListingCollectorProperties;
import com.propertyintel.listings.model.ActionTally;
import com.propertyintel.listings.model.ListingStatistics;
import com.propertyintel.listings.model.ReconcileResult;
import com.propertyintel.listings.model.ScanMode;
import com.propertyintel.listings.model.ScanRun;
import com.propertyintel.listings.model.ScanSummary;
import com.propertyintel.listings.model.SearchPage;
import com.propertyintel.listings.model.SearchQuery;
import com.propertyintel.listings.output.ArchiveRouter;
import com.propertyintel.listings.output.JobMetadataReporter;
import com.propertyintel.listings.store.ListingStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Map;

/**
 * Drives one paginated sweep of the search API.
 *
 * Each page is archived, then every element is reconciled inside a single
 * transaction that commits before the next page is requested. A failure rolls
 * back only the page in flight; pages already committed stay, and re-running
 * the job reprocesses them idempotently.
 *
 * Full scans finish by deactivating every active listing whose last_seen_at is
 * older than the scan start. The watermark is taken before the first request,
 * so nothing observed during the scan can fall behind it.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScanCoordinator {

    private final ListingFetcher fetcher;
    private final ListingReconciler reconciler;
    private final ListingStore store;
    private final ArchiveRouter archiveRouter;
    private final JobMetadataReporter reporter;
    private final TransactionOperations transactionOperations;
    private final ListingCollectorProperties properties;
    private final Clock clock;

    public ScanSummary run(ScanMode mode, String jobId) {
        Instant scanStart = now();
        LocalDate collectionDate = LocalDate.ofInstant(scanStart, ZoneOffset.UTC);
        log.info("{} started: job={} watermark={}", mode.jobType(), jobId, scanStart);

        if (!store.isReachable()) {
            log.error("Database health check failed, aborting job {}", jobId);
            throw new StoreUnavailableException("Database unavailable, job " + jobId + " not started");
        }

        ScanProgress progress = new ScanProgress();
        try {
            paginate(mode, jobId, collectionDate, progress);

            Integer deactivated = null;
            if (mode.deactivatesUnseen()) {
                deactivated = transactionOperations.execute(status ->
                        store.markInactiveNotSeenSince(scanStart, LocalDate.ofInstant(now(), ZoneOffset.UTC)));
                log.info("Deactivation complete: {} listings not seen since {}", deactivated, scanStart);
            }

            ListingStatistics stats = store.statistics();
            Instant endTime = now();
            ScanSummary summary = ScanSummary.builder()
                    .jobId(jobId)
                    .jobType(mode.jobType())
                    .scanStartTimestamp(mode.deactivatesUnseen() ? scanStart : null)
                    .startTime(scanStart)
                    .endTime(endTime)
                    .durationSeconds(Duration.between(scanStart, endTime).toMillis() / 1000.0)
                    .totalPages(progress.pages)
                    .totalProperties(progress.properties)
                    .actions(progress.actions.asMap())
                    .deactivatedCount(deactivated)
                    .databaseStats(stats)
                    .build();

            reporter.reportSuccess(mode, summary);
            return summary;

        } catch (RuntimeException e) {
            reporter.reportFailure(ScanRun.builder()
                    .jobId(jobId)
                    .jobType(mode.jobType())
                    .startedAt(scanStart)
                    .completedAt(now())
                    .status("FAILED")
                    .totalPages(progress.pages)
                    .totalProperties(progress.properties)
                    .errorMessage(e.getMessage())
                    .build());
            throw e;
        }
    }

    /**
     * Query for a mode: incremental runs ask for recent publications newest first,
     * full scans ask for everything cheapest first.
     */
    SearchQuery queryFor(ScanMode mode) {
        ListingCollectorProperties.Scan scan = properties.getScan();
        return switch (mode) {
            case INCREMENTAL -> new SearchQuery(scan.getOperation(), scan.getPropertyType(), scan.getLocationId(),
                    scan.getIncrementalSinceDate(), scan.getMaxItems(), "publicationDate", "desc");
            case FULL_SCAN -> new SearchQuery(scan.getOperation(), scan.getPropertyType(), scan.getLocationId(),
                    null, scan.getMaxItems(), "price", "asc");
        };
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void paginate(ScanMode mode, String jobId, LocalDate collectionDate, ScanProgress progress) {
        SearchQuery query = queryFor(mode);
        Integer maxPages = properties.getScan().getMaxPages();
        int pageNumber = 1;

        while (true) {
            if (maxPages != null && pageNumber > maxPages) {
                log.info("Max pages limit reached ({})", maxPages);
                break;
            }

            SearchPage page = fetcher.fetchPage(query, pageNumber, jobId);
            if (page.isEmpty()) {
                log.info("No more results at page {}", pageNumber);
                break;
            }

            archiveRouter.archivePage(collectionDate, mode, pageNumber, page.payload());

            ActionTally pageTally = transactionOperations.execute(status -> reconcilePage(page));
            progress.pages++;
            progress.properties += page.elements().size();
            if (pageTally != null) {
                progress.actions.addAll(pageTally);
            }
            log.info("Page {}/{} committed: {} properties, {}",
                    pageNumber, page.totalPages(), page.elements().size(), pageTally);

            if (pageNumber >= page.totalPages()) {
                break;
            }
            pageNumber++;
        }

        log.info("Pagination complete: {} pages, {} properties", progress.pages, progress.properties);
    }

    private ActionTally reconcilePage(SearchPage page) {
        ActionTally tally = new ActionTally();
        for (Map<String, Object> element : page.elements()) {
            ReconcileResult result = reconciler.reconcile(element, now());
            tally.increment(result.action());
        }
        return tally;
    }

    /** Microsecond precision so values round-trip through a PostgreSQL timestamp unchanged */
    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }

    private static final class ScanProgress {
        private int pages;
        private int properties;
        private final ActionTally actions = new ActionTally();
    }
}
