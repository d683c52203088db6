package com.abba.pillnow.domain.model;

import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Document(collection = "container_schedules")
@Data
public class ContainerSchedule {

    @Id
    private Integer containerId;

    private PillConfig pillConfig = PillConfig.empty();
    private List<DoseSlot> schedules = new ArrayList<>();
    private List<String> times = new ArrayList<>();
    private String notifyTarget;
    private int registrationOrder;
    private OffsetDateTime updatedAt;

    public Set<String> timesFor(LocalDate date) {
        Set<String> result = new LinkedHashSet<>();
        if (schedules != null && !schedules.isEmpty()) {
            String day = date.toString();
            for (DoseSlot slot : schedules) {
                String time = DoseTimes.normalizeTime(slot.getTime());
                if (time != null && (slot.getDate() == null || day.equals(slot.getDate()))) {
                    result.add(time);
                }
            }
            return result;
        }
        if (times != null) {
            for (String raw : times) {
                String time = DoseTimes.normalizeTime(raw);
                if (time != null) {
                    result.add(time);
                }
            }
        }
        return result;
    }
}
