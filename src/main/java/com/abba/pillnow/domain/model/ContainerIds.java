package com.abba.pillnow.domain.model;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class ContainerIds {

    public static final int MIN_CONTAINER = 1;
    public static final int MAX_CONTAINER = 3;
    public static final int DEFAULT_CONTAINER = 1;

    private static final Pattern NUMERIC = Pattern.compile("^\\d+$");
    private static final Pattern PREFIXED = Pattern.compile("^(?:container|c)\\s*[-_]?\\s*(\\d+)$");
    private static final Map<String, Integer> LEGACY_NAMES = Map.of(
            "morning", 1,
            "noon", 2,
            "afternoon", 2,
            "evening", 3,
            "night", 3
    );

    private ContainerIds() {
    }

    public static int normalize(Object raw) {
        if (raw == null) {
            return DEFAULT_CONTAINER;
        }
        if (raw instanceof Number number) {
            return inRange(number.longValue());
        }
        String value = raw.toString().trim().toLowerCase(Locale.ROOT);
        if (value.isEmpty()) {
            return DEFAULT_CONTAINER;
        }
        if (NUMERIC.matcher(value).matches()) {
            return inRange(parse(value));
        }
        Matcher prefixed = PREFIXED.matcher(value);
        if (prefixed.matches()) {
            return inRange(parse(prefixed.group(1)));
        }
        return LEGACY_NAMES.getOrDefault(value, DEFAULT_CONTAINER);
    }

    public static boolean isValid(int containerId) {
        return containerId >= MIN_CONTAINER && containerId <= MAX_CONTAINER;
    }

    public static String name(int containerId) {
        return "container" + containerId;
    }

    private static long parse(String digits) {
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            return DEFAULT_CONTAINER;
        }
    }

    private static int inRange(long value) {
        return value >= MIN_CONTAINER && value <= MAX_CONTAINER ? (int) value : DEFAULT_CONTAINER;
    }
}
