package com.abba.pillnow.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Notification {

    private String id;
    private NotificationType type;
    private int container;
    private String title;
    private String message;
    private OffsetDateTime timestamp;
    private ScheduleEventType scheduleType;
    private String scheduleId;
    private Map<String, Object> detail;
}
