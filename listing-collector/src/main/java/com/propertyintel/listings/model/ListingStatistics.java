package com.propertyintel.listings.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ListingStatistics(
        long totalListings,
        long activeListings,
        long inactiveListings,
        long republishedListings) {
}
