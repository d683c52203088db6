package com.abba.pillnow.infrastructure.web;

import com.abba.pillnow.application.dto.CaptureResult;
import com.abba.pillnow.domain.model.ContainerIds;
import com.abba.pillnow.domain.model.PillConfig;
import com.abba.pillnow.domain.service.AlarmScheduler;
import com.abba.pillnow.domain.service.CaptureService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class CaptureController {

    private static final Logger log = LoggerFactory.getLogger(CaptureController.class);

    private final CaptureService captureService;
    private final AlarmScheduler alarmScheduler;
    private final ObjectMapper objectMapper;

    public CaptureController(CaptureService captureService, AlarmScheduler alarmScheduler, ObjectMapper objectMapper) {
        this.captureService = captureService;
        this.alarmScheduler = alarmScheduler;
        this.objectMapper = objectMapper;
    }

    @PostMapping("/trigger-capture/{containerId}")
    public ResponseEntity<Map<String, Object>> triggerCapture(@PathVariable String containerId,
                                                              @RequestBody(required = false) JsonNode body) {
        int id = ContainerIds.normalize(containerId);
        PillConfig expected = body == null ? null : readExpected(body.get("expected"));
        CaptureResult result = captureService.triggerCapture(id, expected);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("ok", result.published());
        response.put("message", result.published() ? "Capture triggered" : "Device channel not connected");
        response.put("container", ContainerIds.name(id));
        response.put("pill_config", result.expected());
        return result.published()
                ? ResponseEntity.ok(response)
                : ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(response);
    }

    @PostMapping("/alarm/stopped/{containerId}")
    public ResponseEntity<Map<String, Object>> alarmStopped(@PathVariable String containerId) {
        int id = ContainerIds.normalize(containerId);
        captureService.onAlarmStopped(id);
        return ResponseEntity.ok(Map.of("ok", true, "message", "Alarm stop recorded, capture scheduled", "container", id));
    }

    @PostMapping("/debug/fire-schedule/{containerId}")
    public ResponseEntity<Map<String, Object>> fireSchedule(@PathVariable String containerId) {
        int id = ContainerIds.normalize(containerId);
        boolean fired = alarmScheduler.fireNow(id);
        return ResponseEntity.ok(Map.of(
                "ok", fired,
                "message", fired ? "Fire started" : "Not fired (unknown container or already fired)",
                "container", id));
    }

    private PillConfig readExpected(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        try {
            if (node.isObject()) {
                return objectMapper.treeToValue(node, PillConfig.class);
            }
            if (node.isNumber()) {
                return new PillConfig(node.asInt(), null);
            }
            String text = node.asText().trim();
            if (text.startsWith("{")) {
                return objectMapper.readValue(text, PillConfig.class);
            }
            return new PillConfig(Integer.parseInt(text), null);
        } catch (IOException | NumberFormatException e) {
            log.warn("Unreadable expected value '{}', using count 0", node);
            return PillConfig.empty();
        }
    }
}
