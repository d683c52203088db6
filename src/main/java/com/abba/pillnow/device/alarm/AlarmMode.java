package com.abba.pillnow.device.alarm;

public enum AlarmMode {
    IDLE,
    ALARMING,
    LOCATING
}
