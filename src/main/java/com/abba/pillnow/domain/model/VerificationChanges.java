package com.abba.pillnow.domain.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

public record VerificationChanges(
        boolean countChanged,
        int countDiff,
        int beforeCount,
        int afterCount,
        boolean typesChanged,
        List<PillChange> pillsChanged
) {

    public static VerificationChanges between(VerificationResult before, VerificationResult after) {
        int beforeCount = before.getDetectedCount();
        int afterCount = after.getDetectedCount();

        Map<String, Integer> beforeByType = countByType(before.getDetectedClasses());
        Map<String, Integer> afterByType = countByType(after.getDetectedClasses());

        List<PillChange> pillsChanged = new ArrayList<>();
        TreeSet<String> allTypes = new TreeSet<>(beforeByType.keySet());
        allTypes.addAll(afterByType.keySet());
        for (String type : allTypes) {
            int b = beforeByType.getOrDefault(type, 0);
            int a = afterByType.getOrDefault(type, 0);
            if (a != b) {
                pillsChanged.add(new PillChange(type, b, a, a - b));
            }
        }

        return new VerificationChanges(
                beforeCount != afterCount,
                afterCount - beforeCount,
                beforeCount,
                afterCount,
                !beforeByType.keySet().equals(afterByType.keySet()),
                pillsChanged
        );
    }

    public boolean hasChanges() {
        return countChanged || typesChanged || !pillsChanged.isEmpty();
    }

    public String describe(int containerId) {
        List<String> parts = new ArrayList<>();
        if (countChanged) {
            parts.add(countDiff > 0
                    ? countDiff + " pill(s) added"
                    : Math.abs(countDiff) + " pill(s) removed");
        }
        if (!pillsChanged.isEmpty()) {
            List<String> deltas = new ArrayList<>();
            for (PillChange change : pillsChanged) {
                deltas.add(change.type() + ": " + (change.change() > 0 ? "+" : "") + change.change());
            }
            parts.add("Type changes: " + String.join(", ", deltas));
        }
        if (typesChanged) {
            parts.add("Pill types changed");
        }
        if (parts.isEmpty()) {
            return "No significant changes detected";
        }
        return "Container " + containerId + ": " + String.join("; ", parts);
    }

    private static Map<String, Integer> countByType(List<DetectedClass> classes) {
        Map<String, Integer> counts = new TreeMap<>();
        if (classes == null) {
            return counts;
        }
        for (DetectedClass detected : classes) {
            if (detected.label() != null) {
                counts.merge(detected.label(), detected.n(), Integer::sum);
            }
        }
        return counts;
    }
}
