package com.propertyintel.listings.service;

import com.propertyintel.listings.model.ScanMode;
import com.propertyintel.listings.model.ScanSummary;
import com.propertyintel.listings.model.SearchPage;
import com.propertyintel.listings.store.ListingStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

/**
 * Runs scans through the real page transactions on the embedded database.
 */
@SpringBootTest
@ActiveProfiles("test")
class ScanCoordinatorDatabaseTest {

    @MockBean
    private ListingFetcher fetcher;

    @Autowired
    private ScanCoordinator coordinator;

    @Autowired
    private ListingStore store;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Test
    void storageErrorRollsBackOnlyTheFailingPage() {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        String committed = "P1-" + suffix;
        String rolledBack = "P2-" + suffix;
        String tooLong = "P2-" + suffix + "-code-longer-than-the-column";

        when(fetcher.fetchPage(any(), eq(1), anyString())).thenReturn(page(1, committed));
        when(fetcher.fetchPage(any(), eq(2), anyString())).thenReturn(page(2, rolledBack, tooLong));

        assertThatThrownBy(() -> coordinator.run(ScanMode.INCREMENTAL, "daily-" + suffix))
                .isInstanceOf(DataAccessException.class);

        assertThat(store.findListing(committed)).isPresent();
        assertThat(store.findDetails(committed)).isPresent();
        assertThat(store.findListing(rolledBack)).isEmpty();
        assertThat(store.findDetails(rolledBack)).isEmpty();

        String status = jdbcTemplate.queryForObject(
                "SELECT status FROM scan_runs WHERE job_id = ?", String.class, "daily-" + suffix);
        assertThat(status).isEqualTo("FAILED");
    }

    @Test
    void repeatedCodeSeesEarlierUpdatesWithinAndAcrossPages() {
        String code = "DUP-" + UUID.randomUUID().toString().substring(0, 8);
        when(fetcher.fetchPage(any(), eq(1), anyString())).thenReturn(pricedPage(1,
                Map.of("propertyCode", code, "price", 100),
                Map.of("propertyCode", code, "price", 90)));
        when(fetcher.fetchPage(any(), eq(2), anyString())).thenReturn(pricedPage(2,
                Map.of("propertyCode", code, "price", 90)));

        ScanSummary summary = coordinator.run(ScanMode.INCREMENTAL, "daily-" + code);

        assertThat(summary.getTotalProperties()).isEqualTo(3);
        assertThat(summary.getActions())
                .containsEntry("new", 1)
                .containsEntry("price_change", 1)
                .containsEntry("active", 1)
                .containsEntry("republished", 0);
        String today = LocalDate.ofInstant(summary.getStartTime(), ZoneOffset.UTC).toString();
        assertThat(store.findDetails(code).orElseThrow().getPreviousPrices())
                .containsExactly(Map.entry(today, 100L));
        assertThat(store.findDetails(code).orElseThrow().getPrice()).isEqualTo(90L);
    }

    @SafeVarargs
    private static SearchPage pricedPage(int number, Map<String, Object>... elements) {
        return SearchPage.fromPayload(Map.of(
                "total", 3, "totalPages", 2, "actualPage", number, "elementList", List.of(elements)));
    }

    private static SearchPage page(int number, String... codes) {
        List<Map<String, Object>> elements = Arrays.stream(codes)
                .map(code -> Map.<String, Object>of("propertyCode", code, "price", 150000))
                .toList();
        return SearchPage.fromPayload(Map.of(
                "total", 3, "totalPages", 2, "actualPage", number, "elementList", elements));
    }
}
