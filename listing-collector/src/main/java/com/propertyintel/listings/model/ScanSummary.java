package com.propertyintel.listings.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Aggregate metadata emitted at the end of a scan.
 * Serialised to {prefix}_meta.json next to the archived pages.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ScanSummary {

    String jobId;
    String jobType;

    /** Deactivation watermark, only meaningful for full scans */
    Instant scanStartTimestamp;

    Instant startTime;
    Instant endTime;
    double durationSeconds;
    int totalPages;
    int totalProperties;
    Map<String, Integer> actions;

    /** Null for incremental runs, which never deactivate */
    Integer deactivatedCount;

    ListingStatistics databaseStats;
}
