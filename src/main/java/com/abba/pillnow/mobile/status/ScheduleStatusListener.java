package com.abba.pillnow.mobile.status;

@FunctionalInterface
public interface ScheduleStatusListener {

    void onStatusChanged(ScheduleStatusEvent event);
}
