package com.propertyintel.listings.service;

/**
 * Non-retryable failure talking to Idealista (4xx other than 429, unreadable body, ...).
 */
public class IdealistaApiException extends RuntimeException {

    private final Integer statusCode;

    public IdealistaApiException(String message, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public IdealistaApiException(String message, Integer statusCode) {
        this(message, statusCode, null);
    }

    /** HTTP status, or null when no response was received */
    public Integer getStatusCode() {
        return statusCode;
    }
}
