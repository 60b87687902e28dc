package com.propertyintel.listings.service;

import com.propertyintel.listings.model.Listing;
import com.propertyintel.listings.model.ListingDetails;
import com.propertyintel.listings.model.ReconcileAction;
import com.propertyintel.listings.model.ReconcileResult;
import com.propertyintel.listings.store.ListingStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Classifies one search result against stored state and applies the change.
 *
 * Rules are checked in priority order, first match wins:
 * <ol>
 *   <li>NEW: no listing for the property code</li>
 *   <li>PRICE_CHANGE: stored price differs; old price recorded under today's date</li>
 *   <li>REPUBLISHED: price unchanged but the listing is inactive</li>
 *   <li>ACTIVE: nothing changed, only last_seen_at moves</li>
 * </ol>
 *
 * A price change on an inactive listing is classified PRICE_CHANGE and leaves the
 * listing inactive.
 *
 * Writes go through the caller's transaction; nothing is committed here.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ListingReconciler {

    static final String FIELD_PROPERTY_CODE = "propertyCode";
    static final String FIELD_PRICE = "price";

    private final ListingStore store;

    /**
     * Reconcile a raw element from the search response.
     * Property code and price are pulled out of the map; everything else is pass-through.
     */
    public ReconcileResult reconcile(Map<String, Object> record, Instant now) {
        if (record == null) {
            log.warn("Skipping null listing record");
            return ReconcileResult.skipped();
        }
        Object code = record.get(FIELD_PROPERTY_CODE);
        return reconcile(code == null ? null : code.toString(), parsePrice(record.get(FIELD_PRICE)),
                record, null, now);
    }

    /**
     * @param propertyCode    Idealista property id; blank means malformed
     * @param price           current asking price; null or zero means malformed
     * @param rawFields       full element, stored verbatim
     * @param publicationDate optional, only applied to new listings
     * @param now             observation time, shared by every field this call sets
     */
    public ReconcileResult reconcile(String propertyCode,
                                     Long price,
                                     Map<String, Object> rawFields,
                                     LocalDate publicationDate,
                                     Instant now) {
        if (propertyCode == null || propertyCode.isBlank() || price == null || price == 0L) {
            log.warn("Invalid property data (propertyCode={}, price={}), skipping", propertyCode, price);
            return ReconcileResult.skipped();
        }

        Optional<Listing> existing = store.findListing(propertyCode);
        if (existing.isEmpty()) {
            return insertNew(propertyCode, price, rawFields, publicationDate, now);
        }

        Listing listing = existing.get();
        ListingDetails details = store.findDetails(propertyCode).orElse(null);

        if (details != null && details.getPrice() != price) {
            return applyPriceChange(listing, details, price, rawFields, now);
        }

        if (!listing.isActive()) {
            return applyRepublished(listing, details, rawFields, now);
        }

        listing.setLastSeenAt(now);
        store.updateListing(listing);
        refreshFields(details, rawFields);
        return new ReconcileResult(ReconcileAction.ACTIVE, listing, details);
    }

    // ── Transitions ──────────────────────────────────────────────────────────

    private ReconcileResult insertNew(String propertyCode,
                                      long price,
                                      Map<String, Object> rawFields,
                                      LocalDate publicationDate,
                                      Instant now) {
        Listing listing = Listing.builder()
                .propertyCode(propertyCode)
                .firstSeenAt(now)
                .lastSeenAt(now)
                .publicationDate(publicationDate)
                .active(true)
                .republished(false)
                .build();
        store.insertListing(listing);

        ListingDetails details = ListingDetails.builder()
                .propertyCode(propertyCode)
                .price(price)
                .previousPrices(new TreeMap<>())
                .allFields(rawFields)
                .build();
        store.insertDetails(details);

        log.info("New listing inserted: {} at {}", propertyCode, price);
        return new ReconcileResult(ReconcileAction.NEW, listing, details);
    }

    private ReconcileResult applyPriceChange(Listing listing,
                                             ListingDetails details,
                                             long newPrice,
                                             Map<String, Object> rawFields,
                                             Instant now) {
        long oldPrice = details.getPrice();
        Map<String, Long> previousPrices = details.getPreviousPrices() == null
                ? new TreeMap<>()
                : new TreeMap<>(details.getPreviousPrices());
        previousPrices.put(today(now).toString(), oldPrice);

        details.setPrice(newPrice);
        details.setPreviousPrices(previousPrices);
        details.setAllFields(rawFields);
        store.updateDetails(details);

        listing.setLastSeenAt(now);
        store.updateListing(listing);

        log.info("Price change detected: {} {} -> {}", listing.getPropertyCode(), oldPrice, newPrice);
        return new ReconcileResult(ReconcileAction.PRICE_CHANGE, listing, details);
    }

    private ReconcileResult applyRepublished(Listing listing,
                                             ListingDetails details,
                                             Map<String, Object> rawFields,
                                             Instant now) {
        listing.setActive(true);
        listing.setSoldOrWithdrawnAt(null);
        listing.setRepublished(true);
        listing.setRepublishedAt(now);
        listing.setLastSeenAt(now);
        store.updateListing(listing);
        refreshFields(details, rawFields);

        log.info("Listing republished: {}", listing.getPropertyCode());
        return new ReconcileResult(ReconcileAction.REPUBLISHED, listing, details);
    }

    private void refreshFields(ListingDetails details, Map<String, Object> rawFields) {
        if (details == null) {
            return;
        }
        details.setAllFields(rawFields);
        store.updateDetails(details);
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static LocalDate today(Instant now) {
        return LocalDate.ofInstant(now, ZoneOffset.UTC);
    }

    /**
     * Idealista sends prices as JSON numbers, usually with a ".0". Whole euro amounts
     * are accepted as numbers or numeric strings; a fractional amount is rejected,
     * like any other non-numeric value, and the record is skipped.
     */
    static Long parsePrice(Object raw) {
        String text;
        if (raw instanceof Number n) {
            text = n.toString();
        } else if (raw instanceof String s && !s.isBlank()) {
            text = s.trim();
        } else {
            return null;
        }
        try {
            return new BigDecimal(text).longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            log.debug("Unusable price value {}", raw);
            return null;
        }
    }
}
