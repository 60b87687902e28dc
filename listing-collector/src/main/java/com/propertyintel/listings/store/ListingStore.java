package com.propertyintel.listings.store;

import com.propertyintel.listings.model.Listing;
import com.propertyintel.listings.model.ListingDetails;
import com.propertyintel.listings.model.ListingStatistics;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Persistence operations the reconciler and scan coordinator rely on.
 *
 * Implementations join whatever transaction is active on the calling thread and
 * never commit on their own; the scan coordinator owns the commit boundary.
 */
public interface ListingStore {

    /** Connectivity check run before a scan starts */
    boolean isReachable();

    Optional<Listing> findListing(String propertyCode);

    Optional<ListingDetails> findDetails(String propertyCode);

    void insertListing(Listing listing);

    void insertDetails(ListingDetails details);

    void updateListing(Listing listing);

    void updateDetails(ListingDetails details);

    /**
     * Bulk-flag every active listing whose last_seen_at is strictly before the watermark.
     *
     * @return number of listings deactivated
     */
    int markInactiveNotSeenSince(Instant watermark, LocalDate deactivatedOn);

    ListingStatistics statistics();
}
