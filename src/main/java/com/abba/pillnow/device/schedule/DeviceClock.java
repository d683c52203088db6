package com.abba.pillnow.device.schedule;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.function.LongSupplier;

public class DeviceClock {

    private static final DateTimeFormatter WITH_SECONDS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final DateTimeFormatter WITHOUT_SECONDS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final LongSupplier millis;
    private LocalDateTime base;
    private long baseMillis;

    public DeviceClock(LongSupplier millis) {
        this.millis = millis;
    }

    public void set(LocalDateTime time) {
        base = time;
        baseMillis = millis.getAsLong();
    }

    public LocalDateTime set(String timestamp) {
        String normalized = timestamp.trim().replace('T', ' ');
        LocalDateTime parsed;
        try {
            parsed = LocalDateTime.parse(normalized, WITH_SECONDS);
        } catch (DateTimeParseException e) {
            try {
                parsed = LocalDateTime.parse(normalized, WITHOUT_SECONDS);
            } catch (DateTimeParseException again) {
                throw new IllegalArgumentException("Not a timestamp: " + timestamp, again);
            }
        }
        set(parsed);
        return parsed;
    }

    public boolean isSet() {
        return base != null;
    }

    /**
     * @return the current device time, or {@code null} before the first {@code SETTIME}
     */
    public LocalDateTime now() {
        if (base == null) {
            return null;
        }
        return base.plusNanos((millis.getAsLong() - baseMillis) * 1_000_000L);
    }
}
