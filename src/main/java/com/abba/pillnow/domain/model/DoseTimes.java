package com.abba.pillnow.domain.model;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class DoseTimes {

    private static final Pattern TIME_PATTERN = Pattern.compile("^\\s*(\\d{1,2}):(\\d{2})(?::\\d{2})?");
    private static final Pattern DATE_PATTERN = Pattern.compile("^\\s*(\\d{4}-\\d{2}-\\d{2})");

    private DoseTimes() {
    }

    public static String normalizeTime(String raw) {
        if (raw == null) {
            return null;
        }
        Matcher matcher = TIME_PATTERN.matcher(raw);
        if (!matcher.find()) {
            return null;
        }
        int hour = Integer.parseInt(matcher.group(1));
        int minute = Integer.parseInt(matcher.group(2));
        if (hour > 23 || minute > 59) {
            return null;
        }
        return String.format("%02d:%02d", hour, minute);
    }

    public static String normalizeDate(String raw) {
        if (raw == null) {
            return null;
        }
        Matcher matcher = DATE_PATTERN.matcher(raw);
        return matcher.find() ? matcher.group(1) : null;
    }
}
