package com.abba.pillnow.application.service;

import com.abba.pillnow.domain.model.FireStage;
import com.abba.pillnow.domain.model.Notification;
import com.abba.pillnow.domain.model.NotificationType;
import com.abba.pillnow.domain.model.PillConfig;
import com.abba.pillnow.domain.model.ScheduleEventType;
import com.abba.pillnow.domain.model.VerificationResult;
import com.abba.pillnow.domain.service.MailGateway;
import com.abba.pillnow.domain.service.NotificationService;
import com.abba.pillnow.infrastructure.config.NotifyProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

@Service
@Slf4j
public class NotificationServiceImpl implements NotificationService {

    private final MailGateway mailGateway;
    private final NotifyProperties notifyProperties;
    private final Clock clock;

    private final Map<Integer, Deque<Notification>> notifications = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public NotificationServiceImpl(MailGateway mailGateway, NotifyProperties notifyProperties, Clock clock) {
        this.mailGateway = mailGateway;
        this.notifyProperties = notifyProperties;
        this.clock = clock;
    }

    @Override
    public Notification record(Notification notification) {
        if (notification.getTimestamp() == null) {
            notification.setTimestamp(OffsetDateTime.now(clock));
        }
        if (notification.getId() == null) {
            notification.setId(nextId(notification.getType(), notification.getContainer()));
        }
        Deque<Notification> entries = notifications.computeIfAbsent(notification.getContainer(), ignored -> new LinkedList<>());
        synchronized (entries) {
            entries.addFirst(notification);
            while (entries.size() > Math.max(1, notifyProperties.getMaxPerContainer())) {
                entries.removeLast();
            }
        }
        log.debug("Recorded notification id={} type={} container={}",
                notification.getId(), notification.getType(), notification.getContainer());
        return notification;
    }

    @Override
    public Notification recordScheduleEvent(ScheduleEventType type, int containerId, String message, String scheduleId) {
        return record(Notification.builder()
                .type(NotificationType.SCHEDULE)
                .scheduleType(type)
                .container(containerId)
                .title(type.getTitle())
                .message(message == null || message.isBlank() ? type.defaultMessage(containerId) : message)
                .scheduleId(scheduleId)
                .build());
    }

    @Override
    public Notification recordMismatch(VerificationResult result) {
        PillConfig expected = result.getExpected() == null ? PillConfig.empty() : result.getExpected();
        String expectedLabel = expected.getLabel() == null ? "" : " (" + expected.getLabel() + ")";
        String message = "Container %d: expected %d pill(s)%s, detected %d".formatted(
                result.getContainerId(), expected.getCount(), expectedLabel, result.getDetectedCount());
        return record(Notification.builder()
                .type(NotificationType.MISMATCH)
                .container(result.getContainerId())
                .title("Pill Mismatch")
                .message(message)
                .detail(Map.of(
                        "expectedCount", expected.getCount(),
                        "detectedCount", result.getDetectedCount(),
                        "confidence", result.getConfidence()))
                .build());
    }

    @Override
    public Notification recordPublishFailure(int containerId, FireStage stage, String detail) {
        return record(Notification.builder()
                .type(NotificationType.PUBLISH_FAILURE)
                .container(containerId)
                .title("Device command not delivered")
                .message("Container %d %s command not delivered: %s".formatted(
                        containerId, stage.name().toLowerCase(Locale.ROOT), detail))
                .build());
    }

    @Override
    public List<Notification> findByContainer(int containerId) {
        Deque<Notification> entries = notifications.get(containerId);
        if (entries == null) {
            return List.of();
        }
        synchronized (entries) {
            return new ArrayList<>(entries);
        }
    }

    @Override
    public List<Notification> findAll() {
        List<Notification> all = new ArrayList<>();
        for (Integer containerId : notifications.keySet()) {
            all.addAll(findByContainer(containerId));
        }
        all.sort(Comparator.comparing(Notification::getTimestamp).reversed());
        return all;
    }

    @Override
    public boolean delete(String notificationId) {
        boolean deleted = false;
        for (Deque<Notification> entries : notifications.values()) {
            synchronized (entries) {
                deleted |= entries.removeIf(n -> n.getId().equals(notificationId));
            }
        }
        return deleted;
    }

    @Override
    public boolean sendMail(String to, String subject, String text) {
        if (!notifyProperties.isMailEnabled()) {
            log.debug("Mail disabled, skipping '{}' to {}", subject, to);
            return false;
        }
        if (to == null || to.isBlank()) {
            log.debug("No mail target for '{}'", subject);
            return false;
        }
        try {
            mailGateway.send(to, subject, text);
            log.info("Mail sent subject='{}' to={}", subject, to);
            return true;
        } catch (Exception e) {
            log.warn("Mail delivery failed subject='{}' to={} reason={}", subject, to, e.getMessage());
            return false;
        }
    }

    private String nextId(NotificationType type, int containerId) {
        String prefix = type == null ? "notif" : type.name().toLowerCase(Locale.ROOT);
        return "%s_%d_%d_%d".formatted(prefix, containerId, clock.millis(), sequence.incrementAndGet());
    }
}
