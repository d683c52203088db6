package com.abba.pillnow.device.bridge;

public interface BackendClient {

    boolean alarmStopped(String containerId);
}
