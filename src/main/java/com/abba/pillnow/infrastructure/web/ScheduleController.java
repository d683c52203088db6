package com.abba.pillnow.infrastructure.web;

import com.abba.pillnow.application.dto.CaptureResult;
import com.abba.pillnow.application.dto.ScheduleUpdate;
import com.abba.pillnow.application.dto.SyncResult;
import com.abba.pillnow.domain.model.ContainerIds;
import com.abba.pillnow.domain.model.ContainerSchedule;
import com.abba.pillnow.domain.service.CaptureService;
import com.abba.pillnow.domain.service.ScheduleStore;
import com.abba.pillnow.infrastructure.config.CloudProperties;
import com.abba.pillnow.infrastructure.config.DeviceProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class ScheduleController {

    private final ScheduleStore scheduleStore;
    private final CaptureService captureService;
    private final DeviceProperties deviceProperties;
    private final CloudProperties cloudProperties;

    @PostMapping("/set-schedule")
    public ResponseEntity<Map<String, Object>> setSchedule(@RequestBody SetScheduleRequest request) {
        if (request.containerId() == null) {
            throw new IllegalArgumentException("container_id is required");
        }
        int containerId = ContainerIds.normalize(request.containerId());
        ContainerSchedule schedule = scheduleStore.setSchedule(new ScheduleUpdate(
                containerId,
                request.pillConfig(),
                request.schedules(),
                request.times(),
                request.notifyTarget(),
                Boolean.TRUE.equals(request.replace())));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", true);
        body.put("container", containerId);
        body.put("schedule", schedule);
        if (deviceProperties.isCaptureOnScheduleSet()) {
            CaptureResult capture = captureService.triggerCapture(containerId, schedule.getPillConfig());
            body.put("message", capture.published() ? "Schedule set and capture triggered" : "Schedule set, device offline");
            body.put("captureTriggered", capture.published());
        } else {
            body.put("message", "Schedule set");
        }
        return ResponseEntity.ok(body);
    }

    @GetMapping("/schedules/{containerId}")
    public ResponseEntity<Map<String, Object>> getSchedule(@PathVariable String containerId) {
        int id = ContainerIds.normalize(containerId);
        return scheduleStore.getSchedule(id)
                .map(schedule -> ResponseEntity.ok(Map.<String, Object>of("ok", true, "schedule", schedule)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(Map.of("ok", false, "message", "No schedule for container " + id)));
    }

    @GetMapping("/get-pill-config/{containerId}")
    public ResponseEntity<Map<String, Object>> getPillConfig(@PathVariable String containerId) {
        int id = ContainerIds.normalize(containerId);
        boolean known = scheduleStore.getSchedule(id).isPresent();
        return ResponseEntity.ok(Map.of("ok", known, "pill_config", scheduleStore.getPillConfig(id)));
    }

    @PostMapping("/sync-from-cloud")
    public ResponseEntity<Map<String, Object>> syncFromCloud(@RequestParam(required = false) String elderId,
                                                             @RequestBody(required = false) Map<String, Object> body) {
        String filter = elderId;
        if (filter == null && body != null && body.get("elderId") != null) {
            filter = body.get("elderId").toString();
        }
        if (filter == null) {
            filter = cloudProperties.getElderId();
        }
        SyncResult result = scheduleStore.syncFromCloud(filter);
        log.info("Cloud sync requested elderId={} doses={}", filter, result.dosesPerContainer());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("ok", true);
        response.put("rowsRead", result.rowsRead());
        response.put("rowsSkipped", result.rowsSkipped());
        response.put("dosesPerContainer", result.dosesPerContainer());
        return ResponseEntity.ok(response);
    }
}
