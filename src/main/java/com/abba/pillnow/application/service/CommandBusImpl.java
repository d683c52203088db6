package com.abba.pillnow.application.service;

import com.abba.pillnow.domain.model.CommandAction;
import com.abba.pillnow.domain.model.ContainerIds;
import com.abba.pillnow.domain.model.DeviceCommand;
import com.abba.pillnow.domain.service.CommandBus;
import com.abba.pillnow.domain.service.DeviceChannel;
import com.abba.pillnow.infrastructure.config.DeviceProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Service
@Slf4j
public class CommandBusImpl implements CommandBus {

    private final DeviceChannel deviceChannel;
    private final DeviceProperties deviceProperties;
    private final ObjectMapper objectMapper;
    private final RelayMetrics metrics;
    private final Clock clock;

    private final Map<String, Instant> captureDebounce = new ConcurrentHashMap<>();

    public CommandBusImpl(DeviceChannel deviceChannel,
                          DeviceProperties deviceProperties,
                          ObjectMapper objectMapper,
                          RelayMetrics metrics,
                          Clock clock) {
        this.deviceChannel = deviceChannel;
        this.deviceProperties = deviceProperties;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public boolean publish(String deviceId, DeviceCommand command) {
        if (!deviceChannel.isConnected(deviceId)) {
            log.warn("Device channel disconnected, not publishing action={} device={} container={}",
                    command.getAction(), deviceId, command.getContainer());
            metrics.publishFailed();
            return false;
        }

        Instant claimed = null;
        String debounceKey = null;
        if (command.getAction() == CommandAction.CAPTURE) {
            debounceKey = debounceKey(deviceId, command);
            claimed = claimCapture(debounceKey);
            if (claimed == null) {
                log.debug("Capture debounced device={} key={}", deviceId, debounceKey);
                metrics.captureDebounced();
                return true;
            }
        }

        boolean sent = send(topic(deviceId, "cmd"), command);
        if (!sent && claimed != null) {
            captureDebounce.remove(debounceKey, claimed);
        }
        if (sent) {
            metrics.published();
            log.info("Published action={} device={} container={}", command.getAction(), deviceId, command.getContainer());
        } else {
            metrics.publishFailed();
        }
        return sent;
    }

    @Override
    public boolean publishToContainer(int containerId, DeviceCommand command) {
        if (command.getContainer() == null) {
            command.setContainer(ContainerIds.name(containerId));
        }
        return publish(resolveDeviceId(containerId), command);
    }

    @Override
    public String resolveDeviceId(int containerId) {
        String override = deviceProperties.getSingleDeviceId();
        if (override != null && !override.isBlank()) {
            return override.trim();
        }
        return ContainerIds.name(containerId);
    }

    @Override
    public boolean publishConfig(String deviceId, Map<String, Object> config) {
        try {
            String payload = objectMapper.writeValueAsString(config);
            boolean delivered = deviceChannel.retain(topic(deviceId, "config"), payload);
            log.info("Retained config for device={} delivered={}", deviceId, delivered);
            return true;
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize config for device={}", deviceId, e);
            return false;
        }
    }

    private boolean send(String topic, DeviceCommand command) {
        try {
            return deviceChannel.send(topic, objectMapper.writeValueAsString(command));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize command {} for topic {}", command.getAction(), topic, e);
            return false;
        } catch (RuntimeException e) {
            log.warn("Publish to {} failed: {}", topic, e.getMessage());
            return false;
        }
    }

    private Instant claimCapture(String key) {
        Instant now = clock.instant();
        Duration window = deviceProperties.getCaptureDebounce();
        synchronized (captureDebounce) {
            Instant last = captureDebounce.get(key);
            if (last != null && Duration.between(last, now).compareTo(window) < 0) {
                return null;
            }
            captureDebounce.put(key, now);
            return now;
        }
    }

    private String debounceKey(String deviceId, DeviceCommand command) {
        return command.getContainer() != null && !command.getContainer().isBlank()
                ? command.getContainer()
                : deviceId;
    }

    private String topic(String deviceId, String channel) {
        return deviceProperties.getTopicPrefix() + "/" + deviceId + "/" + channel;
    }
}
