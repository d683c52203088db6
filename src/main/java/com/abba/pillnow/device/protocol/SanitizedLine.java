package com.abba.pillnow.device.protocol;

public record SanitizedLine(String text, String rejectReason, double validRatio) {

    public static SanitizedLine accepted(String text, double validRatio) {
        return new SanitizedLine(text, null, validRatio);
    }

    public static SanitizedLine rejected(String reason, double validRatio) {
        return new SanitizedLine(null, reason, validRatio);
    }

    public boolean isAccepted() {
        return text != null;
    }
}
