package com.abba.pillnow.device.alarm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.function.LongSupplier;

public class AlarmStateMachine {

    public static final long ALARM_TOGGLE_MS = 400;
    public static final long LOCATE_TOGGLE_MS = 500;
    public static final long ALARM_MAX_DURATION_MS = 60_000;

    private static final Logger log = LoggerFactory.getLogger(AlarmStateMachine.class);

    private final Actuator actuator;
    private final LongSupplier millis;

    private AlarmMode mode = AlarmMode.IDLE;
    private Integer container;
    private long startedAt;
    private long lastToggleAt;
    private boolean buzzerOn;

    public AlarmStateMachine(Actuator actuator, LongSupplier millis) {
        this.actuator = actuator;
        this.millis = millis;
    }

    public void startAlarm(int container) {
        if (mode == AlarmMode.ALARMING && this.container != null && this.container != container) {
            actuator.setContainerLed(this.container, false);
        }
        long now = millis.getAsLong();
        mode = AlarmMode.ALARMING;
        this.container = container;
        startedAt = now;
        lastToggleAt = now;
        setBuzzer(true);
        actuator.setContainerLed(container, true);
        log.info("Alarm started container={}", container);
    }

    public void startLocate() {
        if (mode == AlarmMode.ALARMING) {
            log.info("Locate cancels alarm container={}", container);
            actuator.allLedsOff();
        }
        long now = millis.getAsLong();
        mode = AlarmMode.LOCATING;
        container = null;
        startedAt = now;
        lastToggleAt = now;
        setBuzzer(true);
    }

    public Optional<StopEvent> stop() {
        return end(StopEvent.Reason.STOPPED);
    }

    public Optional<StopEvent> tick() {
        if (mode == AlarmMode.IDLE) {
            return Optional.empty();
        }
        long now = millis.getAsLong();
        if (mode == AlarmMode.ALARMING && now - startedAt >= ALARM_MAX_DURATION_MS) {
            log.info("Alarm ceiling reached container={}", container);
            return end(StopEvent.Reason.TIMEOUT);
        }
        long interval = mode == AlarmMode.ALARMING ? ALARM_TOGGLE_MS : LOCATE_TOGGLE_MS;
        if (now - lastToggleAt >= interval) {
            setBuzzer(!buzzerOn);
            lastToggleAt = now;
        }
        if (mode == AlarmMode.ALARMING) {
            actuator.setContainerLed(container, true);
        }
        return Optional.empty();
    }

    public AlarmMode mode() {
        return mode;
    }

    public Optional<Integer> alarmingContainer() {
        return mode == AlarmMode.ALARMING ? Optional.of(container) : Optional.empty();
    }

    public boolean isIdle() {
        return mode == AlarmMode.IDLE;
    }

    private Optional<StopEvent> end(StopEvent.Reason reason) {
        if (mode == AlarmMode.IDLE) {
            return Optional.empty();
        }
        StopEvent event = new StopEvent(mode, container, reason);
        mode = AlarmMode.IDLE;
        container = null;
        setBuzzer(false);
        actuator.allLedsOff();
        log.info("Stopped {} reason={}", event.stoppedMode(), reason);
        return Optional.of(event);
    }

    private void setBuzzer(boolean on) {
        buzzerOn = on;
        actuator.setBuzzer(on);
    }
}
