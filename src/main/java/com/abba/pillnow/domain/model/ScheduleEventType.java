package com.abba.pillnow.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ScheduleEventType {
    ALARM_TRIGGERED("alarm_triggered", "Alarm Triggered", "Container %d alarm has been triggered"),
    ALARM_STOPPED("alarm_stopped", "Alarm Stopped", "Container %d alarm has been stopped"),
    SCHEDULE_ADDED("schedule_added", "Schedule Added", "New schedule added for Container %d"),
    SCHEDULE_DELETED("schedule_deleted", "Schedule Deleted", "Schedule deleted for Container %d"),
    SCHEDULE_UPDATED("schedule_updated", "Schedule Updated", "Schedule updated for Container %d");

    private final String code;
    private final String title;
    private final String messageTemplate;

    ScheduleEventType(String code, String title, String messageTemplate) {
        this.code = code;
        this.title = title;
        this.messageTemplate = messageTemplate;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getTitle() {
        return title;
    }

    public String defaultMessage(int containerId) {
        return messageTemplate.formatted(containerId);
    }

    @JsonCreator
    public static ScheduleEventType fromCode(String code) {
        for (ScheduleEventType type : values()) {
            if (type.code.equalsIgnoreCase(code) || type.name().equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown schedule event type: " + code);
    }
}
