package com.propertyintel.listings.output;

public class ArchiveWriteException extends RuntimeException {

    public ArchiveWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
