package com.propertyintel.listings.service;

/** 5xx from Idealista, retried with backoff. */
public class ServerErrorException extends IdealistaApiException {

    public ServerErrorException(String message, int statusCode) {
        super(message, statusCode);
    }
}
