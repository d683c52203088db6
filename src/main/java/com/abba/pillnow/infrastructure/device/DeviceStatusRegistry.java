package com.abba.pillnow.infrastructure.device;

import com.abba.pillnow.domain.model.DeviceStatus;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
@Slf4j
@RequiredArgsConstructor
public class DeviceStatusRegistry {

    private final Clock clock;
    private final Map<String, DeviceStatus> statuses = new ConcurrentHashMap<>();

    public DeviceStatus update(String deviceId, JsonNode heartbeat) {
        DeviceStatus status = statuses.computeIfAbsent(deviceId, id -> {
            DeviceStatus created = new DeviceStatus();
            created.setDeviceId(id);
            return created;
        });
        status.setOnline(heartbeat.path("online").asBoolean(true));
        status.setIp(text(heartbeat, "ip", status.getIp()));
        status.setSsid(text(heartbeat, "ssid", status.getSsid()));
        status.setBrokerHost(text(heartbeat, "broker", status.getBrokerHost()));
        status.setLastSeen(OffsetDateTime.now(clock));
        log.debug("Heartbeat device={} online={} ip={}", deviceId, status.isOnline(), status.getIp());
        return status;
    }

    public void markOffline(String deviceId) {
        DeviceStatus status = statuses.get(deviceId);
        if (status != null) {
            status.setOnline(false);
        }
    }

    public List<DeviceStatus> all() {
        List<DeviceStatus> result = new ArrayList<>(statuses.values());
        result.sort(Comparator.comparing(DeviceStatus::getDeviceId));
        return result;
    }

    private static String text(JsonNode node, String field, String fallback) {
        String value = node.path(field).asText(null);
        return value == null || value.isBlank() ? fallback : value;
    }
}
