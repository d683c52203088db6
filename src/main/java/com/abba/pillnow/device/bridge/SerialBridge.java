package com.abba.pillnow.device.bridge;

import com.abba.pillnow.device.SerialLink;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Slf4j
public class SerialBridge {

    public static final long STOP_THROTTLE_MS = 5_000;

    private static final Pattern CONTAINER_TAG = Pattern.compile("C(\\d+)");

    private final SerialLink deviceLink;
    private final BackendClient backend;
    private final ObjectMapper objectMapper;
    private final LongSupplier millis;
    private final Map<String, Long> lastStopAt = new ConcurrentHashMap<>();

    public SerialBridge(SerialLink deviceLink, BackendClient backend, ObjectMapper objectMapper, LongSupplier millis) {
        this.deviceLink = deviceLink;
        this.backend = backend;
        this.objectMapper = objectMapper;
        this.millis = millis;
    }

    public void onCommand(String payload) {
        JsonNode command;
        try {
            command = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.warn("Dropping malformed command payload: {}", e.getOriginalMessage());
            return;
        }
        translate(command).ifPresentOrElse(line -> {
            log.info("Serial -> {}", line);
            deviceLink.writeLine(line);
        }, () -> log.debug("No serial form for command {}", command));
    }

    public Optional<String> translate(JsonNode command) {
        String action = command.path("action").asText("");
        switch (action) {
            case "alert" -> {
                String n = digits(command.path("container"), "0");
                return Optional.of("PILLALERT C" + n);
            }
            case "alarm_triggered" -> {
                String n = digits(command.path("container"), "1");
                String date = command.path("date").asText("");
                String time = command.path("time").asText("00:00");
                return Optional.of(date.isEmpty()
                        ? "ALARM_TRIGGERED C" + n + " " + time
                        : "ALARM_TRIGGERED C" + n + " " + date + " " + time);
            }
            default -> {
                return Optional.empty();
            }
        }
    }

    public void onDeviceLine(String line) {
        if (line == null || line.isBlank()) {
            return;
        }
        String upper = line.toUpperCase(Locale.ROOT);
        log.debug("Serial <- {}", line);
        if (!upper.contains("ALARM_STOPPED")) {
            return;
        }
        Matcher matcher = CONTAINER_TAG.matcher(upper.replace("ALARM_STOPPED", ""));
        int container = matcher.find() ? Integer.parseInt(matcher.group(1)) : 0;
        String containerId = "container" + (container > 0 ? container : 1);

        long now = millis.getAsLong();
        Long last = lastStopAt.get(containerId);
        if (last != null && now - last < STOP_THROTTLE_MS) {
            log.info("Ignoring duplicate ALARM_STOPPED for {}", containerId);
            return;
        }
        lastStopAt.put(containerId, now);
        log.info("ALARM_STOPPED for {}, notifying backend", containerId);
        backend.alarmStopped(containerId);
    }

    private static String digits(JsonNode container, String fallback) {
        if (container.isIntegralNumber()) {
            return String.valueOf(container.asInt());
        }
        String d = container.asText("").replaceAll("\\D", "");
        return d.isEmpty() ? fallback : d;
    }
}
