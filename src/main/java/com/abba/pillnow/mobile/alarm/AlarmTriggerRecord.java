package com.abba.pillnow.mobile.alarm;

public record AlarmTriggerRecord(int container, String time, String date, long triggeredAt) {
}
