package com.abba.pillnow.infrastructure.web;

import com.abba.pillnow.domain.model.ContainerIds;
import com.abba.pillnow.domain.model.Notification;
import com.abba.pillnow.domain.model.ScheduleEventType;
import com.abba.pillnow.domain.service.NotificationService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/notifications")
@RequiredArgsConstructor
public class NotificationController {

    private final NotificationService notificationService;

    @GetMapping
    public ResponseEntity<Map<String, Object>> all() {
        return ResponseEntity.ok(Map.of("success", true, "notifications", notificationService.findAll()));
    }

    @GetMapping("/{containerId}")
    public ResponseEntity<Map<String, Object>> byContainer(@PathVariable String containerId) {
        int id = ContainerIds.normalize(containerId);
        return ResponseEntity.ok(Map.of("success", true, "notifications", notificationService.findByContainer(id)));
    }

    @DeleteMapping("/{notificationId}")
    public ResponseEntity<Map<String, Object>> delete(@PathVariable String notificationId) {
        if (notificationService.delete(notificationId)) {
            return ResponseEntity.ok(Map.of("success", true, "message", "Notification deleted"));
        }
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(Map.of("success", false, "message", "Notification not found"));
    }

    @PostMapping("/schedule")
    public ResponseEntity<Map<String, Object>> scheduleEvent(@RequestBody ScheduleNotificationRequest request) {
        if (request.type() == null) {
            throw new IllegalArgumentException("type is required");
        }
        Notification notification = notificationService.recordScheduleEvent(
                ScheduleEventType.fromCode(request.type()),
                ContainerIds.normalize(request.container()),
                request.message(),
                request.scheduleId());
        return ResponseEntity.ok(Map.of("success", true, "notification", notification));
    }

    public record ScheduleNotificationRequest(String type, Object container, String message, String scheduleId) {
    }
}
