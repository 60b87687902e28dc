package com.propertyintel.listings.service;

import com.propertyintel.listings.model.SearchPage;
import com.propertyintel.listings.model.SearchQuery;

/**
 * Source of paginated search results. Retrying and rate limiting are the
 * implementation's concern; callers see either a page or an exception.
 */
public interface ListingFetcher {

    /**
     * @param pageNumber 1-based page index
     */
    SearchPage fetchPage(SearchQuery query, int pageNumber, String jobId);
}
