package com.propertyintel.listings.config;

import com.propertyintel.listings.model.ListingDetails;
import com.propertyintel.listings.model.ScanMode;
import com.propertyintel.listings.service.ScanJobService;
import com.propertyintel.listings.store.ListingStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class ScanController {

    private final ScanJobService jobService;
    private final ListingStore listingStore;

    // ── Scan triggers ─────────────────────────────────────────────────────────

    /**
     * Start a scan in the background.
     *
     * POST /scan/trigger/incremental or POST /scan/trigger/full
     *
     * 409 if another scan is already running in this process.
     */
    @PostMapping("/scan/trigger/{mode}")
    public ResponseEntity<Map<String, String>> trigger(@PathVariable String mode) {
        ScanMode scanMode;
        try {
            scanMode = ScanMode.fromPath(mode);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "mode must be incremental or full"));
        }
        String jobId = jobService.startAsync(scanMode);
        log.info("Manual {} accepted as {}", scanMode.jobType(), jobId);
        return ResponseEntity.accepted().body(Map.of(
                "status", "accepted",
                "job_type", scanMode.jobType(),
                "job_id", jobId));
    }

    @GetMapping("/scan/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", "property-intel-listing-collector");
        body.put("version", "1.0.0");
        body.put("running", jobService.currentJob().isPresent());
        body.put("current_job", jobService.currentJob().orElse(null));
        return ResponseEntity.ok(body);
    }

    // ── Listing query API ─────────────────────────────────────────────────────

    @GetMapping("/listings/stats")
    public ResponseEntity<?> stats() {
        try {
            return ResponseEntity.ok(listingStore.statistics());
        } catch (Exception e) {
            log.error("Listing stats query failed: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    /**
     * Lifecycle state and current price for one property.
     *
     * GET /listings/12345678
     */
    @GetMapping("/listings/{propertyCode}")
    public ResponseEntity<?> listing(@PathVariable String propertyCode) {
        return listingStore.findListing(propertyCode)
                .<ResponseEntity<?>>map(listing -> {
                    ListingDetails details = listingStore.findDetails(propertyCode).orElse(null);
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("listing", listing);
                    body.put("details", details);
                    return ResponseEntity.ok(body);
                })
                .orElseGet(() -> ResponseEntity.status(404)
                        .body(Map.of("error", "listing not found", "property_code", propertyCode)));
    }
}
