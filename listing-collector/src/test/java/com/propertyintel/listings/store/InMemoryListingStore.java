package com.propertyintel.listings.store;

import com.propertyintel.listings.model.Listing;
import com.propertyintel.listings.model.ListingDetails;
import com.propertyintel.listings.model.ListingStatistics;

import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Map-backed store for unit tests. Rows are copied on the way in and out,
 * so callers only see changes they explicitly wrote back.
 */
public class InMemoryListingStore implements ListingStore {

    private final Map<String, Listing> listings = new LinkedHashMap<>();
    private final Map<String, ListingDetails> details = new HashMap<>();
    private boolean reachable = true;
    private int writes;

    public void setReachable(boolean reachable) {
        this.reachable = reachable;
    }

    /** Number of insert/update calls made so far */
    public int writes() {
        return writes;
    }

    @Override
    public boolean isReachable() {
        return reachable;
    }

    @Override
    public Optional<Listing> findListing(String propertyCode) {
        return Optional.ofNullable(listings.get(propertyCode)).map(InMemoryListingStore::copy);
    }

    @Override
    public Optional<ListingDetails> findDetails(String propertyCode) {
        return Optional.ofNullable(details.get(propertyCode)).map(InMemoryListingStore::copy);
    }

    @Override
    public void insertListing(Listing listing) {
        if (listings.containsKey(listing.getPropertyCode())) {
            throw new IllegalStateException("Duplicate listing " + listing.getPropertyCode());
        }
        writes++;
        listings.put(listing.getPropertyCode(), copy(listing));
    }

    @Override
    public void insertDetails(ListingDetails row) {
        writes++;
        details.put(row.getPropertyCode(), copy(row));
    }

    @Override
    public void updateListing(Listing listing) {
        writes++;
        listings.put(listing.getPropertyCode(), copy(listing));
    }

    @Override
    public void updateDetails(ListingDetails row) {
        writes++;
        details.put(row.getPropertyCode(), copy(row));
    }

    @Override
    public int markInactiveNotSeenSince(Instant watermark, LocalDate deactivatedOn) {
        int count = 0;
        for (Listing listing : listings.values()) {
            if (listing.isActive() && listing.getLastSeenAt().isBefore(watermark)) {
                listing.setActive(false);
                listing.setSoldOrWithdrawnAt(deactivatedOn);
                count++;
            }
        }
        return count;
    }

    @Override
    public ListingStatistics statistics() {
        long active = listings.values().stream().filter(Listing::isActive).count();
        long republished = listings.values().stream().filter(Listing::isRepublished).count();
        return new ListingStatistics(listings.size(), active, listings.size() - active, republished);
    }

    private static Listing copy(Listing l) {
        return l.toBuilder().build();
    }

    private static ListingDetails copy(ListingDetails d) {
        return d.toBuilder()
                .previousPrices(d.getPreviousPrices() == null ? null : new TreeMap<>(d.getPreviousPrices()))
                .allFields(d.getAllFields() == null ? null : new LinkedHashMap<>(d.getAllFields()))
                .build();
    }
}
