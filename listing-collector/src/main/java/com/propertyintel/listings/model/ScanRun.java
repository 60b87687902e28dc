package com.propertyintel.listings.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Tracks each scan job for observability.
 * Stored in the scan_runs table.
 */
@Data
@Builder
public class ScanRun {

    private String jobId;
    private String jobType;         // daily_new_listings | weekly_full_scan
    private Instant startedAt;
    private Instant completedAt;
    private String status;          // RUNNING | SUCCESS | FAILED
    private int totalPages;
    private int totalProperties;
    private Integer deactivatedCount;
    private String errorMessage;    // null on success
}
