package com.abba.pillnow.domain.model;

import java.util.List;

public record VerificationResponse(
        Boolean pass,
        int count,
        List<DetectedClass> classesDetected,
        double confidence,
        String annotatedImagePath
) {

    public List<DetectedClass> classesOrEmpty() {
        return classesDetected == null ? List.of() : classesDetected;
    }
}
