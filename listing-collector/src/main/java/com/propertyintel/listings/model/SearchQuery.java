package com.propertyintel.listings.model;

/**
 * Parameters for an Idealista /search call, minus the page number.
 *
 * @param sinceDate publication window filter ("Y" = last 2 days), null for none
 * @param order     sort field, e.g. "publicationDate" or "price"
 * @param sort      "asc" or "desc"
 */
public record SearchQuery(
        String operation,
        String propertyType,
        String locationId,
        String sinceDate,
        int maxItems,
        String order,
        String sort) {
}
