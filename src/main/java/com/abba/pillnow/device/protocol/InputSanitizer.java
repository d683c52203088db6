package com.abba.pillnow.device.protocol;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Cleans one raw line received over the noisy serial link.
 * <p>
 * Non-printable bytes are dropped, the text is upper-cased, the known corruptions of this
 * transport are substituted (in order) and runs of spaces are collapsed. A line is accepted
 * when at least {@value #MIN_VALID_RATIO} of its raw characters were printable and the
 * corrected text is shorter than {@value #MAX_LENGTH} characters.
 */
public final class InputSanitizer {

    public static final double MIN_VALID_RATIO = 0.7;
    public static final int MAX_LENGTH = 100;

    private static final List<Map.Entry<String, String>> CORRECTIONS = List.of(
            Map.entry("SCE@", "SCHED "),
            Map.entry("SCHE@", "SCHED "),
            Map.entry("SCHED@", "SCHED "),
            Map.entry("SHED ", "SCHED "),
            Map.entry(";", ":"),
            Map.entry("L0CATE", "LOCATE"),
            Map.entry("ST0P", "STOP"),
            Map.entry("ALARM TRIGGERED", "ALARM_TRIGGERED"),
            Map.entry("PILL ALERT", "PILLALERT"),
            Map.entry("@", " ")
    );

    public SanitizedLine sanitize(String raw) {
        return sanitize(raw == null ? new byte[0] : raw.getBytes(StandardCharsets.ISO_8859_1));
    }

    public SanitizedLine sanitize(byte[] raw) {
        StringBuilder printable = new StringBuilder(raw.length);
        int counted = 0;
        for (byte b : raw) {
            int c = b & 0xFF;
            if (c == '\r' || c == '\n') {
                continue;
            }
            counted++;
            if (c >= 0x20 && c <= 0x7E) {
                printable.append((char) c);
            }
        }
        if (counted == 0) {
            return SanitizedLine.rejected("empty", 0.0);
        }

        double ratio = (double) printable.length() / counted;
        if (ratio < MIN_VALID_RATIO) {
            return SanitizedLine.rejected("too much noise", ratio);
        }

        String text = printable.toString().toUpperCase(Locale.ROOT);
        for (Map.Entry<String, String> correction : CORRECTIONS) {
            text = text.replace(correction.getKey(), correction.getValue());
        }
        text = text.replaceAll(" {2,}", " ").trim();

        if (text.isEmpty()) {
            return SanitizedLine.rejected("empty", ratio);
        }
        if (text.length() >= MAX_LENGTH) {
            return SanitizedLine.rejected("too long", ratio);
        }
        return SanitizedLine.accepted(text, ratio);
    }
}
