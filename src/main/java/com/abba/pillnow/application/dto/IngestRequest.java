package com.abba.pillnow.application.dto;

import com.abba.pillnow.domain.model.PillConfig;

public record IngestRequest(
        String deviceId,
        String container,
        byte[] image,
        String contentType,
        PillConfig expected
) {
}
