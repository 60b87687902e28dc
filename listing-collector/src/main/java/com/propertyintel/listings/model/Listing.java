package com.propertyintel.listings.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Lifecycle record for one Idealista property, stored in the listings table.
 *
 * Rows are never deleted. A listing that drops out of a full scan is flagged
 * inactive and gets a sold/withdrawn date; if it shows up again it is flipped
 * back and marked as republished.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Listing {

    /** Idealista property id, stable across observations */
    private String propertyCode;

    private Instant firstSeenAt;

    /** Advanced on every observation; drives end-of-scan deactivation */
    private Instant lastSeenAt;

    /** Not provided by the search API today, kept for schema compatibility */
    private LocalDate publicationDate;

    private boolean active;

    /** Date the listing was last deactivated; cleared on republication */
    private LocalDate soldOrWithdrawnAt;

    private boolean republished;

    private Instant republishedAt;
}
