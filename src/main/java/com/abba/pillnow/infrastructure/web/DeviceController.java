package com.abba.pillnow.infrastructure.web;

import com.abba.pillnow.domain.model.ContainerIds;
import com.abba.pillnow.domain.service.CommandBus;
import com.abba.pillnow.infrastructure.device.DeviceStatusRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@RestController
@Slf4j
@RequiredArgsConstructor
public class DeviceController {

    private final CommandBus commandBus;
    private final DeviceStatusRegistry deviceStatusRegistry;

    @Value("${server.port:5001}")
    private int serverPort;

    @GetMapping("/current-ip")
    public ResponseEntity<Map<String, Object>> currentIp() {
        List<String> addresses = lanAddresses();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", !addresses.isEmpty());
        body.put("ip", addresses.isEmpty() ? null : addresses.get(0));
        body.put("addresses", addresses);
        body.put("port", serverPort);
        return ResponseEntity.ok(body);
    }

    @PostMapping("/device-config")
    public ResponseEntity<Map<String, Object>> deviceConfig(@RequestBody Map<String, Object> body) {
        if (body == null || body.isEmpty()) {
            throw new IllegalArgumentException("config body is required");
        }
        Map<String, Object> config = new LinkedHashMap<>(body);
        Object target = config.remove("deviceId");

        Set<String> devices = new LinkedHashSet<>();
        if (target != null && !target.toString().isBlank()) {
            devices.add(target.toString().trim());
        } else {
            for (int id = ContainerIds.MIN_CONTAINER; id <= ContainerIds.MAX_CONTAINER; id++) {
                devices.add(commandBus.resolveDeviceId(id));
            }
        }
        List<String> published = new ArrayList<>();
        for (String deviceId : devices) {
            if (commandBus.publishConfig(deviceId, config)) {
                published.add(deviceId);
            }
        }
        return ResponseEntity.ok(Map.of("ok", !published.isEmpty(), "devices", published));
    }

    @GetMapping("/devices/status")
    public ResponseEntity<Map<String, Object>> devicesStatus() {
        return ResponseEntity.ok(Map.of("ok", true, "devices", deviceStatusRegistry.all()));
    }

    private static List<String> lanAddresses() {
        List<String> addresses = new ArrayList<>();
        try {
            for (NetworkInterface nic : Collections.list(NetworkInterface.getNetworkInterfaces())) {
                if (!nic.isUp() || nic.isLoopback() || nic.isVirtual()) {
                    continue;
                }
                for (InetAddress address : Collections.list(nic.getInetAddresses())) {
                    if (address instanceof Inet4Address && !address.isLoopbackAddress()) {
                        addresses.add(address.getHostAddress());
                    }
                }
            }
        } catch (SocketException e) {
            log.warn("Could not enumerate network interfaces: {}", e.getMessage());
        }
        return addresses;
    }
}
