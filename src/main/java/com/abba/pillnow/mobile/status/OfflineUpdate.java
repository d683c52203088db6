package com.abba.pillnow.mobile.status;

public record OfflineUpdate(int container, String time, String date, String status, String scheduleId, long updatedAt) {
}
