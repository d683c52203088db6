package com.abba.pillnow.infrastructure.web;

import com.abba.pillnow.application.service.RelayMetrics;
import com.abba.pillnow.domain.service.AlarmScheduler;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class HealthController {

    private final RelayMetrics metrics;
    private final AlarmScheduler alarmScheduler;
    private final Clock clock;

    @GetMapping({"/health", "/api/health"})
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "message", "PillNow relay is running",
                "timestamp", OffsetDateTime.now(clock).toString()));
    }

    @GetMapping("/test")
    public ResponseEntity<Map<String, Object>> test() {
        return ResponseEntity.ok(Map.of(
                "success", true,
                "message", "Connection successful",
                "serverTime", OffsetDateTime.now(clock).toString()));
    }

    @GetMapping("/metrics")
    public ResponseEntity<Map<String, Object>> metrics() {
        Map<String, Object> body = new LinkedHashMap<>(metrics.snapshot());
        body.put("fireRecords", alarmScheduler.fireRecordCount());
        return ResponseEntity.ok(body);
    }
}
