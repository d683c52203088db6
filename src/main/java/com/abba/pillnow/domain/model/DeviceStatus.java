package com.abba.pillnow.domain.model;

import lombok.Data;

import java.time.OffsetDateTime;

@Data
public class DeviceStatus {

    private String deviceId;
    private boolean online;
    private String ip;
    private String ssid;
    private String brokerHost;
    private OffsetDateTime lastSeen;
}
