package com.abba.pillnow.domain.service;

public class CloudSyncException extends IllegalStateException {

    public CloudSyncException(String message) {
        super(message);
    }

    public CloudSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
