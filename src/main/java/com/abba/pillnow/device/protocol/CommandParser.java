package com.abba.pillnow.device.protocol;

import java.util.Optional;
import java.util.regex.Matcher;

public class CommandParser {

    public Optional<SerialCommand> parse(String line) {
        if (line == null || line.isBlank()) {
            return Optional.empty();
        }
        for (SerialCommandType type : SerialCommandType.values()) {
            Matcher matcher = type.matchStrict(line);
            if (matcher != null) {
                SerialCommand command = build(type, matcher, line, false);
                if (command != null) {
                    return Optional.of(command);
                }
            }
        }
        for (SerialCommandType type : SerialCommandType.values()) {
            Matcher matcher = type.matchFallback(line);
            if (matcher != null) {
                SerialCommand command = build(type, matcher, line, true);
                if (command != null) {
                    return Optional.of(command);
                }
            }
        }
        return Optional.empty();
    }

    private static SerialCommand build(SerialCommandType type, Matcher m, String line, boolean recovered) {
        return switch (type) {
            case ALARM_TRIGGERED -> validTime(m.group(3), m.group(4))
                    ? new SerialCommand(type, Integer.parseInt(m.group(1)), Integer.parseInt(m.group(3)),
                    Integer.parseInt(m.group(4)), m.group(2), null, line, recovered)
                    : null;
            case SCHED_ADD -> validTime(m.group(1), m.group(2))
                    ? new SerialCommand(type, Integer.parseInt(m.group(3)), Integer.parseInt(m.group(1)),
                    Integer.parseInt(m.group(2)), null, null, line, recovered)
                    : null;
            case PILLALERT -> new SerialCommand(type, Integer.parseInt(m.group(1)), null, null, null, null, line, recovered);
            case SETTIME -> new SerialCommand(type, null, null, null, null, m.group(1).trim(), line, recovered);
            case SCHED_CLEAR, SCHED_LIST, STOP, LOCATE -> new SerialCommand(type, null, null, null, null, null, line, recovered);
        };
    }

    private static boolean validTime(String hour, String minute) {
        return Integer.parseInt(hour) <= 23 && Integer.parseInt(minute) <= 59;
    }
}
