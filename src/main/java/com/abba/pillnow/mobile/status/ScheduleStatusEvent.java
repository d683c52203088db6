package com.abba.pillnow.mobile.status;

public record ScheduleStatusEvent(int container, String time, String date, String status, String scheduleId) {
}
