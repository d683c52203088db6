package com.abba.pillnow.device.protocol;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public enum SerialCommandType {

    ALARM_TRIGGERED(
            "ALARM_TRIGGERED C(\\d)(?: (\\d{4}-\\d{2}-\\d{2}))? (\\d{1,2}):(\\d{2})",
            "TRIG\\w*\\s*C(\\d)\\s*(?:(\\d{4}-\\d{2}-\\d{2})\\s*)?(\\d{1,2}):(\\d{2})"),
    PILLALERT(
            "PILLALERT C?(\\d)",
            "ALERT ?C?(\\d)"),
    SETTIME(
            "SETTIME (.+)",
            "TIME ?(\\d{4}-\\d{2}-\\d{2}[ T]\\d{1,2}:\\d{2}(?::\\d{2})?)"),
    SCHED_ADD(
            "SCHED ADD (\\d{1,2}):(\\d{2}) C?(\\d)",
            "ADD ?(\\d{1,2}):(\\d{2}) ?C?(\\d)"),
    SCHED_CLEAR(
            "SCHED CLEAR",
            "CLEAR"),
    SCHED_LIST(
            "SCHED LIST",
            "LIST"),
    STOP(
            "STOP|STOP_LOCATE|STOPLOCATE|ALARMSTOP|ALARM_STOP",
            "ST[O0]P"),
    LOCATE(
            "LOCATE",
            "L?OCAT|LOCA?TE");

    private final Pattern strict;
    private final Pattern fallback;

    SerialCommandType(String strict, String fallback) {
        this.strict = Pattern.compile(strict);
        this.fallback = Pattern.compile(fallback);
    }

    public Matcher matchStrict(String line) {
        Matcher matcher = strict.matcher(line);
        return matcher.matches() ? matcher : null;
    }

    public Matcher matchFallback(String line) {
        Matcher matcher = fallback.matcher(line);
        return matcher.find() ? matcher : null;
    }
}
