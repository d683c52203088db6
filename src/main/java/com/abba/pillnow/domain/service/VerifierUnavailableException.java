package com.abba.pillnow.domain.service;

public class VerifierUnavailableException extends IllegalStateException {

    public VerifierUnavailableException(String message) {
        super(message);
    }

    public VerifierUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
