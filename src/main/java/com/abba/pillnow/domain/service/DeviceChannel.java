package com.abba.pillnow.domain.service;

public interface DeviceChannel {

    boolean isConnected(String deviceId);

    boolean send(String topic, String payload);

    boolean retain(String topic, String payload);
}
