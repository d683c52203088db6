package com.abba.pillnow.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VerificationResult {

    private int containerId;
    private String deviceId;
    private boolean pass;
    private int detectedCount;
    private List<DetectedClass> detectedClasses;
    private double confidence;
    private String annotatedImageRef;
    private String savedImagePath;
    private PillConfig expected;
    private OffsetDateTime timestamp;
    private VerificationChanges changes;
}
