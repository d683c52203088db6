package com.abba.pillnow.mobile.alarm;

import com.abba.pillnow.mobile.store.KeyValueStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
public class AlarmTriggerTracker {

    public static final String STORAGE_KEY = "alarm_trigger_timestamps";
    public static final Duration GRACE_PERIOD = Duration.ofSeconds(60);

    private static final TypeReference<LinkedHashMap<String, AlarmTriggerRecord>> TRIGGERS = new TypeReference<>() {
    };

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Map<String, AlarmTriggerRecord> triggers = new ConcurrentHashMap<>();

    public AlarmTriggerTracker(KeyValueStore store, ObjectMapper objectMapper, Clock clock) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public void initialize() {
        try {
            Optional<String> stored = store.get(STORAGE_KEY);
            if (stored.isEmpty()) {
                return;
            }
            Map<String, AlarmTriggerRecord> loaded = objectMapper.readValue(stored.get(), TRIGGERS);
            loaded.forEach((key, record) -> {
                if (!expired(record)) {
                    triggers.put(key, record);
                }
            });
            persist();
            log.info("Initialized with {} active grace period(s)", triggers.size());
        } catch (IOException | RuntimeException e) {
            log.error("Failed to load alarm triggers", e);
        }
    }

    public void recordAlarmTrigger(int container, String time, String date) {
        String key = key(container, time, date);
        triggers.put(key, new AlarmTriggerRecord(container, normalize(time), date, clock.millis()));
        persist();
        log.info("Recorded alarm trigger container={} time={} date={}", container, time, date);
    }

    public boolean isWithinGracePeriod(int container, String time, String date) {
        String key = key(container, time, date);
        AlarmTriggerRecord record = triggers.get(key);
        if (record == null && date != null) {
            key = key(container, time, null);
            record = triggers.get(key);
        }
        if (record == null && date == null) {
            key = key(container, time, LocalDate.now(clock).toString());
            record = triggers.get(key);
        }
        if (record == null) {
            return false;
        }
        if (expired(record)) {
            triggers.remove(key);
            persist();
            return false;
        }
        return true;
    }

    public Duration getRemainingGracePeriod(int container, String time, String date) {
        String key = key(container, time, date);
        AlarmTriggerRecord record = triggers.get(key);
        if (record == null) {
            return Duration.ZERO;
        }
        long remaining = GRACE_PERIOD.toMillis() - (clock.millis() - record.triggeredAt());
        if (remaining <= 0) {
            triggers.remove(key);
            persist();
            return Duration.ZERO;
        }
        return Duration.ofMillis(remaining);
    }

    public void clearTrigger(int container, String time, String date) {
        if (triggers.remove(key(container, time, date)) != null) {
            persist();
        }
    }

    public int cleanupExpired() {
        int before = triggers.size();
        triggers.values().removeIf(this::expired);
        int cleaned = before - triggers.size();
        if (cleaned > 0) {
            persist();
            log.info("Cleaned up {} expired trigger(s)", cleaned);
        }
        return cleaned;
    }

    private boolean expired(AlarmTriggerRecord record) {
        return clock.millis() - record.triggeredAt() >= GRACE_PERIOD.toMillis();
    }

    private void persist() {
        try {
            store.put(STORAGE_KEY, objectMapper.writeValueAsString(new LinkedHashMap<>(triggers)));
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("Failed to persist alarm triggers", e);
        }
    }

    private static String key(int container, String time, String date) {
        return date == null ? container + "|" + normalize(time) : container + "|" + date + "|" + normalize(time);
    }

    private static String normalize(String time) {
        return time.length() > 5 ? time.substring(0, 5) : time;
    }
}
