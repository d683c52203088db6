package com.abba.pillnow.domain.service;

import com.abba.pillnow.domain.model.DeviceCommand;

import java.util.Map;

public interface CommandBus {

    boolean publish(String deviceId, DeviceCommand command);

    boolean publishToContainer(int containerId, DeviceCommand command);

    String resolveDeviceId(int containerId);

    boolean publishConfig(String deviceId, Map<String, Object> config);
}
