package com.abba.pillnow.domain.model;

public enum NotificationType {
    VERIFICATION,
    MISMATCH,
    SCHEDULE,
    PUBLISH_FAILURE,
    REMINDER
}
