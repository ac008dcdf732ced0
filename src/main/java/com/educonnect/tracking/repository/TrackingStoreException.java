package com.educonnect.tracking.repository;

public class TrackingStoreException extends RuntimeException {
    public TrackingStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
