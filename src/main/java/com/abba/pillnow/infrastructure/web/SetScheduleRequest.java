package com.abba.pillnow.infrastructure.web;

import com.abba.pillnow.domain.model.DoseSlot;
import com.abba.pillnow.domain.model.PillConfig;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record SetScheduleRequest(
        @JsonProperty("container_id") Object containerId,
        @JsonProperty("pill_config") PillConfig pillConfig,
        List<String> times,
        List<DoseSlot> schedules,
        @JsonProperty("notify_target") String notifyTarget,
        Boolean replace
) {
}
