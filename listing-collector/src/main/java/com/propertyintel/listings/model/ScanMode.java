package com.propertyintel.listings.model;

/**
 * The two collection jobs. They share the reconciliation path and differ only
 * in the search query and whether unseen listings are deactivated afterwards.
 */
public enum ScanMode {

    /** Recently published listings only; it can never prove a listing is gone */
    INCREMENTAL("daily_new_listings", "daily", "new_listings", false),

    /** Every listing for the location, ordered by price for stable paging */
    FULL_SCAN("weekly_full_scan", "weekly", "full_scan", true);

    private final String jobType;
    private final String jobIdPrefix;
    private final String archivePrefix;
    private final boolean deactivatesUnseen;

    ScanMode(String jobType, String jobIdPrefix, String archivePrefix, boolean deactivatesUnseen) {
        this.jobType = jobType;
        this.jobIdPrefix = jobIdPrefix;
        this.archivePrefix = archivePrefix;
        this.deactivatesUnseen = deactivatesUnseen;
    }

    public String jobType() {
        return jobType;
    }

    public String jobIdPrefix() {
        return jobIdPrefix;
    }

    public String archivePrefix() {
        return archivePrefix;
    }

    public boolean deactivatesUnseen() {
        return deactivatesUnseen;
    }

    /**
     * Resolve a path segment such as "incremental" or "full".
     */
    public static ScanMode fromPath(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Scan mode is required");
        }
        return switch (value.trim().toLowerCase()) {
            case "incremental", "daily", "daily_new_listings" -> INCREMENTAL;
            case "full", "full-scan", "full_scan", "weekly", "weekly_full_scan" -> FULL_SCAN;
            default -> throw new IllegalArgumentException("Unknown scan mode: " + value);
        };
    }
}
