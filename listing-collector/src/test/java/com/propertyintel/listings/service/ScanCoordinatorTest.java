package com.propertyintel.listings.service;

import com.propertyintel.listings.config.ListingCollectorProperties;
import com.propertyintel.listings.model.Listing;
import com.propertyintel.listings.model.ListingDetails;
import com.propertyintel.listings.model.ScanMode;
import com.propertyintel.listings.model.ScanRun;
import com.propertyintel.listings.model.ScanSummary;
import com.propertyintel.listings.model.SearchPage;
import com.propertyintel.listings.model.SearchQuery;
import com.propertyintel.listings.output.ArchiveRouter;
import com.propertyintel.listings.output.JobMetadataReporter;
import com.propertyintel.listings.store.InMemoryListingStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScanCoordinatorTest {

    private static final String JOB = "weekly-20240512-030000";
    private static final Instant NOW = Instant.parse("2024-05-12T03:00:00Z");

    @Mock
    private ListingFetcher fetcher;
    @Mock
    private ArchiveRouter archiveRouter;
    @Mock
    private JobMetadataReporter reporter;

    private InMemoryListingStore store;
    private ListingCollectorProperties properties;
    private ScanCoordinator coordinator;

    @BeforeEach
    void setUp() {
        store = new InMemoryListingStore();
        properties = new ListingCollectorProperties();
        coordinator = new ScanCoordinator(fetcher, new ListingReconciler(store), store, archiveRouter, reporter,
                TransactionOperations.withoutTransaction(), properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void followsPagesUntilTotalPagesReached() {
        when(fetcher.fetchPage(any(), eq(1), eq(JOB))).thenReturn(page(1, 2, "A1", "A2"));
        when(fetcher.fetchPage(any(), eq(2), eq(JOB))).thenReturn(page(2, 2, "A3"));

        ScanSummary summary = coordinator.run(ScanMode.INCREMENTAL, JOB);

        assertThat(summary.getTotalPages()).isEqualTo(2);
        assertThat(summary.getTotalProperties()).isEqualTo(3);
        assertThat(summary.getActions()).containsEntry("new", 3).containsEntry("active", 0);
        assertThat(summary.getDatabaseStats().totalListings()).isEqualTo(3);
        verify(fetcher, times(2)).fetchPage(any(), anyInt(), eq(JOB));
        verify(archiveRouter).archivePage(eq(LocalDate.parse("2024-05-12")), eq(ScanMode.INCREMENTAL), eq(1), any());
        verify(archiveRouter).archivePage(eq(LocalDate.parse("2024-05-12")), eq(ScanMode.INCREMENTAL), eq(2), any());
        verify(reporter).reportSuccess(ScanMode.INCREMENTAL, summary);
    }

    @Test
    void stopsAtFirstEmptyPage() {
        when(fetcher.fetchPage(any(), eq(1), eq(JOB))).thenReturn(page(1, 5, "A1"));
        when(fetcher.fetchPage(any(), eq(2), eq(JOB))).thenReturn(page(2, 5));

        ScanSummary summary = coordinator.run(ScanMode.INCREMENTAL, JOB);

        assertThat(summary.getTotalPages()).isEqualTo(1);
        assertThat(summary.getTotalProperties()).isEqualTo(1);
        verify(archiveRouter, never()).archivePage(any(), any(), eq(2), any());
    }

    @Test
    void honoursMaxPagesCap() {
        properties.getScan().setMaxPages(1);
        when(fetcher.fetchPage(any(), eq(1), eq(JOB))).thenReturn(page(1, 10, "A1", "A2"));

        ScanSummary summary = coordinator.run(ScanMode.FULL_SCAN, JOB);

        assertThat(summary.getTotalPages()).isEqualTo(1);
        verify(fetcher, times(1)).fetchPage(any(), anyInt(), eq(JOB));
    }

    @Test
    void skippedRecordsAreCountedAndDoNotStopThePage() {
        SearchPage mixed = SearchPage.fromPayload(Map.of(
                "total", 3, "totalPages", 1, "actualPage", 1,
                "elementList", List.of(
                        element("A1", 100),
                        Map.of("price", 100),
                        element("A2", 0))));
        when(fetcher.fetchPage(any(), eq(1), eq(JOB))).thenReturn(mixed);

        ScanSummary summary = coordinator.run(ScanMode.INCREMENTAL, JOB);

        assertThat(summary.getTotalProperties()).isEqualTo(3);
        assertThat(summary.getActions()).containsEntry("new", 1).containsEntry("skipped", 2);
    }

    @Test
    void fullScanDeactivatesListingsNotSeenSinceWatermark() {
        seed("GONE", NOW.minusSeconds(86400));
        seed("A1", NOW.minusSeconds(86400));
        when(fetcher.fetchPage(any(), eq(1), eq(JOB))).thenReturn(page(1, 1, "A1"));

        ScanSummary summary = coordinator.run(ScanMode.FULL_SCAN, JOB);

        assertThat(summary.getDeactivatedCount()).isEqualTo(1);
        assertThat(summary.getScanStartTimestamp()).isEqualTo(NOW);
        assertThat(summary.getActions()).containsEntry("active", 1);
        Listing gone = store.findListing("GONE").orElseThrow();
        assertThat(gone.isActive()).isFalse();
        assertThat(gone.getSoldOrWithdrawnAt()).isEqualTo(LocalDate.parse("2024-05-12"));
        assertThat(store.findListing("A1").orElseThrow().isActive()).isTrue();
    }

    @Test
    void incrementalScanNeverDeactivates() {
        seed("OLD", NOW.minusSeconds(86400 * 30L));
        when(fetcher.fetchPage(any(), eq(1), eq(JOB))).thenReturn(page(1, 1, "A1"));

        ScanSummary summary = coordinator.run(ScanMode.INCREMENTAL, JOB);

        assertThat(summary.getDeactivatedCount()).isNull();
        assertThat(summary.getScanStartTimestamp()).isNull();
        assertThat(store.findListing("OLD").orElseThrow().isActive()).isTrue();
    }

    @Test
    void unreachableStoreAbortsBeforeAnyFetch() {
        store.setReachable(false);

        assertThatThrownBy(() -> coordinator.run(ScanMode.FULL_SCAN, JOB))
                .isInstanceOf(StoreUnavailableException.class);

        verifyNoInteractions(fetcher, archiveRouter);
    }

    @Test
    void failureMidScanIsReportedAndKeepsEarlierPages() {
        seed("GONE", NOW.minusSeconds(86400));
        when(fetcher.fetchPage(any(), eq(1), eq(JOB))).thenReturn(page(1, 3, "A1"));
        when(fetcher.fetchPage(any(), eq(2), eq(JOB))).thenThrow(new ServerErrorException("Server error 503", 503));

        assertThatThrownBy(() -> coordinator.run(ScanMode.FULL_SCAN, JOB))
                .isInstanceOf(ServerErrorException.class);

        ArgumentCaptor<ScanRun> run = ArgumentCaptor.forClass(ScanRun.class);
        verify(reporter).reportFailure(run.capture());
        assertThat(run.getValue().getStatus()).isEqualTo("FAILED");
        assertThat(run.getValue().getTotalPages()).isEqualTo(1);
        assertThat(run.getValue().getErrorMessage()).contains("503");
        verify(reporter, never()).reportSuccess(any(), any());

        assertThat(store.findListing("A1")).isPresent();
        assertThat(store.findListing("GONE").orElseThrow().isActive()).isTrue();
    }

    @Test
    void queryDependsOnMode() {
        SearchQuery incremental = coordinator.queryFor(ScanMode.INCREMENTAL);
        assertThat(incremental.sinceDate()).isEqualTo("Y");
        assertThat(incremental.order()).isEqualTo("publicationDate");
        assertThat(incremental.sort()).isEqualTo("desc");

        SearchQuery full = coordinator.queryFor(ScanMode.FULL_SCAN);
        assertThat(full.sinceDate()).isNull();
        assertThat(full.order()).isEqualTo("price");
        assertThat(full.sort()).isEqualTo("asc");
        assertThat(full.locationId()).isEqualTo("0-EU-ES-28");
    }

    // ── Fixtures ──────────────────────────────────────────────────────────────

    private void seed(String code, Instant lastSeen) {
        store.insertListing(Listing.builder()
                .propertyCode(code)
                .firstSeenAt(lastSeen)
                .lastSeenAt(lastSeen)
                .active(true)
                .build());
        store.insertDetails(ListingDetails.builder()
                .propertyCode(code)
                .price(100)
                .previousPrices(new TreeMap<>())
                .allFields(element(code, 100))
                .build());
    }

    private static SearchPage page(int number, int totalPages, String... codes) {
        List<Map<String, Object>> elements = new ArrayList<>();
        for (String code : codes) {
            elements.add(element(code, 100));
        }
        return SearchPage.fromPayload(Map.of(
                "total", codes.length,
                "totalPages", totalPages,
                "actualPage", number,
                "elementList", elements));
    }

    private static Map<String, Object> element(String code, Object price) {
        return Map.of("propertyCode", code, "price", price);
    }
}
