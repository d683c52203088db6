package com.abba.pillnow.device.schedule;

public enum AddResult {
    ADDED,
    ADDED_PREFIRED,
    FIRE_NOW,
    FULL,
    INVALID
}
