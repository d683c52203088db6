package com.abba.pillnow.domain.model;

public enum FireStage {
    PRE_CAPTURE,
    ALARM,
    REMINDER
}
