package com.propertyintel.listings.service;

/**
 * The database failed its pre-scan connectivity check. Thrown before the API is contacted,
 * so no state has been touched.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message) {
        super(message);
    }
}
