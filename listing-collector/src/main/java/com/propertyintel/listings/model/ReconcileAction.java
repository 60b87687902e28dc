package com.propertyintel.listings.model;

/**
 * Outcome of reconciling one search result against stored state.
 */
public enum ReconcileAction {

    NEW("new"),
    PRICE_CHANGE("price_change"),
    REPUBLISHED("republished"),
    ACTIVE("active"),
    SKIPPED("skipped");

    private final String key;

    ReconcileAction(String key) {
        this.key = key;
    }

    /** Key used in job metadata and logs */
    public String key() {
        return key;
    }
}
