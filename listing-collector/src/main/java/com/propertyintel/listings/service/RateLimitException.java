package com.propertyintel.listings.service;

/** 429 from Idealista, retried with backoff. */
public class RateLimitException extends IdealistaApiException {

    public RateLimitException(String message) {
        super(message, 429);
    }
}
