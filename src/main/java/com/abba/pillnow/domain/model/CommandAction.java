package com.abba.pillnow.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum CommandAction {
    CAPTURE("capture"),
    ALARM_TRIGGERED("alarm_triggered"),
    ALERT("alert");

    private final String code;

    CommandAction(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static CommandAction fromCode(String code) {
        for (CommandAction action : values()) {
            if (action.code.equalsIgnoreCase(code)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown command action: " + code);
    }
}
