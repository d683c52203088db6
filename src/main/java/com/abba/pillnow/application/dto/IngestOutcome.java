package com.abba.pillnow.application.dto;

import com.abba.pillnow.domain.model.VerificationResult;

public record IngestOutcome(
        Status status,
        VerificationResult result,
        boolean alertPublished,
        String message
) {

    public enum Status {
        VERIFIED,
        VERIFIER_UNREACHABLE
    }

    public static IngestOutcome verified(VerificationResult result, boolean alertPublished) {
        return new IngestOutcome(Status.VERIFIED, result, alertPublished, null);
    }

    public static IngestOutcome verifierUnreachable(String message) {
        return new IngestOutcome(Status.VERIFIER_UNREACHABLE, null, false, message);
    }

    public boolean isVerified() {
        return status == Status.VERIFIED;
    }
}
