package com.abba.pillnow.device.alarm;

public record StopEvent(AlarmMode stoppedMode, Integer container, Reason reason) {

    public enum Reason {
        STOPPED,
        TIMEOUT
    }

    public boolean endedAlarm() {
        return stoppedMode == AlarmMode.ALARMING && container != null;
    }
}
