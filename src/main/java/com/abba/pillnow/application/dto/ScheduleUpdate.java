package com.abba.pillnow.application.dto;

import com.abba.pillnow.domain.model.DoseSlot;
import com.abba.pillnow.domain.model.PillConfig;

import java.util.List;

public record ScheduleUpdate(
        int containerId,
        PillConfig pillConfig,
        List<DoseSlot> schedules,
        List<String> times,
        String notifyTarget,
        boolean replace
) {
}
