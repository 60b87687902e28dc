package com.propertyintel.listings.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.TreeMap;

/**
 * Current price snapshot and price history for a listing.
 *
 * previousPrices maps the ISO date a change was detected (yyyy-MM-dd) to the
 * price that was replaced. The current price is never in the map.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ListingDetails {

    private String propertyCode;

    private long price;

    @Builder.Default
    private Map<String, Long> previousPrices = new TreeMap<>();

    /** Full element from the latest search response, passed through untouched */
    private Map<String, Object> allFields;
}
