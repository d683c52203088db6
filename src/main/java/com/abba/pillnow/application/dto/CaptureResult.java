package com.abba.pillnow.application.dto;

import com.abba.pillnow.domain.model.PillConfig;

public record CaptureResult(boolean published, int containerId, String deviceId, PillConfig expected) {
}
