package com.propertyintel.listings.model;

/**
 * Classification plus the state left behind. listing and details are null for SKIPPED;
 * details may also be null for a legacy listing that has no details row.
 */
public record ReconcileResult(ReconcileAction action, Listing listing, ListingDetails details) {

    public static ReconcileResult skipped() {
        return new ReconcileResult(ReconcileAction.SKIPPED, null, null);
    }
}
