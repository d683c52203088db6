package com.abba.pillnow.application.service;

import com.abba.pillnow.application.dto.IngestOutcome;
import com.abba.pillnow.application.dto.IngestRequest;
import com.abba.pillnow.domain.model.CommandAction;
import com.abba.pillnow.domain.model.ContainerIds;
import com.abba.pillnow.domain.model.ContainerSchedule;
import com.abba.pillnow.domain.model.DetectedClass;
import com.abba.pillnow.domain.model.DeviceCommand;
import com.abba.pillnow.domain.model.Notification;
import com.abba.pillnow.domain.model.NotificationType;
import com.abba.pillnow.domain.model.PillConfig;
import com.abba.pillnow.domain.model.VerificationChanges;
import com.abba.pillnow.domain.model.VerificationResponse;
import com.abba.pillnow.domain.model.VerificationResult;
import com.abba.pillnow.domain.service.CommandBus;
import com.abba.pillnow.domain.service.IngestService;
import com.abba.pillnow.domain.service.NotificationService;
import com.abba.pillnow.domain.service.PillVerifier;
import com.abba.pillnow.domain.service.ScheduleStore;
import com.abba.pillnow.domain.service.VerifierUnavailableException;
import com.abba.pillnow.infrastructure.config.DeviceProperties;
import com.abba.pillnow.infrastructure.config.NotifyProperties;
import com.abba.pillnow.infrastructure.storage.CaptureStorage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Service
@Slf4j
public class IngestServiceImpl implements IngestService {

    private final PillVerifier pillVerifier;
    private final CommandBus commandBus;
    private final NotificationService notificationService;
    private final ScheduleStore scheduleStore;
    private final CaptureStorage captureStorage;
    private final DeviceProperties deviceProperties;
    private final NotifyProperties notifyProperties;
    private final RelayMetrics metrics;
    private final Clock clock;

    private final Map<Integer, VerificationResult> results = new ConcurrentHashMap<>();
    private final Map<String, Instant> lastAlertByDevice = new ConcurrentHashMap<>();

    public IngestServiceImpl(PillVerifier pillVerifier,
                             CommandBus commandBus,
                             NotificationService notificationService,
                             ScheduleStore scheduleStore,
                             CaptureStorage captureStorage,
                             DeviceProperties deviceProperties,
                             NotifyProperties notifyProperties,
                             RelayMetrics metrics,
                             Clock clock) {
        this.pillVerifier = pillVerifier;
        this.commandBus = commandBus;
        this.notificationService = notificationService;
        this.scheduleStore = scheduleStore;
        this.captureStorage = captureStorage;
        this.deviceProperties = deviceProperties;
        this.notifyProperties = notifyProperties;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public IngestOutcome ingest(IngestRequest request) {
        if (request.image() == null || request.image().length == 0) {
            throw new IllegalArgumentException("image is required");
        }
        int containerId = ContainerIds.normalize(request.container());
        PillConfig expected = request.expected() != null ? request.expected() : scheduleStore.getPillConfig(containerId);
        metrics.ingested();

        String savedPath = captureStorage.save(request.deviceId(), containerId, request.image())
                .map(Path::toString)
                .orElse(null);

        VerificationResponse response;
        try {
            response = pillVerifier.verify(request.image(), request.contentType(), expected);
        } catch (VerifierUnavailableException e) {
            metrics.verifierUnreachable();
            log.warn("Verifier unreachable device={} container={} reason={}",
                    request.deviceId(), containerId, e.getMessage());
            return IngestOutcome.verifierUnreachable(e.getMessage());
        }

        boolean pass = response.pass() != null ? response.pass() : matches(expected, response);
        VerificationResult result = VerificationResult.builder()
                .containerId(containerId)
                .deviceId(request.deviceId())
                .pass(pass)
                .detectedCount(response.count())
                .detectedClasses(response.classesOrEmpty())
                .confidence(response.confidence())
                .annotatedImageRef(response.annotatedImagePath())
                .savedImagePath(savedPath)
                .expected(expected.copy())
                .timestamp(OffsetDateTime.now(clock))
                .build();

        VerificationResult previous = results.put(containerId, result);
        if (previous != null) {
            recordChanges(previous, result);
        }
        log.info("Verification container={} device={} pass={} expected={} detected={} confidence={}",
                containerId, request.deviceId(), pass, expected.getCount(), response.count(), response.confidence());

        boolean alertPublished = false;
        if (!pass) {
            metrics.mismatch();
            alertPublished = raiseMismatch(result);
        }
        return IngestOutcome.verified(result, alertPublished);
    }

    @Override
    public Optional<VerificationResult> getVerification(int containerId) {
        return Optional.ofNullable(results.get(containerId));
    }

    private boolean raiseMismatch(VerificationResult result) {
        try {
            notificationService.recordMismatch(result);
        } catch (Exception e) {
            log.error("Mismatch notification failed container={}", result.getContainerId(), e);
        }

        boolean alertPublished = false;
        try {
            alertPublished = publishAlert(result);
        } catch (Exception e) {
            log.error("Mismatch alert failed container={}", result.getContainerId(), e);
        }

        try {
            mailMismatch(result);
        } catch (Exception e) {
            log.error("Mismatch mail failed container={}", result.getContainerId(), e);
        }
        return alertPublished;
    }

    private boolean publishAlert(VerificationResult result) {
        String deviceId = commandBus.resolveDeviceId(result.getContainerId());
        Instant now = clock.instant();
        Instant last = lastAlertByDevice.get(deviceId);
        if (last != null && Duration.between(last, now).compareTo(deviceProperties.getAlertCooldown()) < 0) {
            metrics.alertSuppressed();
            log.debug("Alert cooldown active device={} container={}", deviceId, result.getContainerId());
            return false;
        }
        DeviceCommand alert = DeviceCommand.builder()
                .action(CommandAction.ALERT)
                .container(ContainerIds.name(result.getContainerId()))
                .reason("pill_mismatch")
                .expected(result.getExpected())
                .detected(result.getDetectedClasses())
                .build();
        boolean sent = commandBus.publish(deviceId, alert);
        if (sent) {
            lastAlertByDevice.put(deviceId, now);
        }
        return sent;
    }

    private void mailMismatch(VerificationResult result) {
        String target = scheduleStore.getSchedule(result.getContainerId())
                .map(ContainerSchedule::getNotifyTarget)
                .filter(value -> !value.isBlank())
                .orElse(notifyProperties.getDefaultTarget());
        if (target == null || target.isBlank()) {
            return;
        }
        PillConfig expected = result.getExpected();
        String text = "Container %d: expected %d pill(s)%s but %d were detected (confidence %.2f).".formatted(
                result.getContainerId(),
                expected.getCount(),
                expected.getLabel() == null ? "" : " of " + expected.getLabel(),
                result.getDetectedCount(),
                result.getConfidence());
        notificationService.sendMail(target, "Pill mismatch in container " + result.getContainerId(), text);
    }

    private void recordChanges(VerificationResult previous, VerificationResult current) {
        VerificationChanges changes = VerificationChanges.between(previous, current);
        if (!changes.hasChanges()) {
            return;
        }
        current.setChanges(changes);
        try {
            notificationService.record(Notification.builder()
                    .type(NotificationType.VERIFICATION)
                    .container(current.getContainerId())
                    .title("Verification changed")
                    .message(changes.describe(current.getContainerId()))
                    .detail(Map.of(
                            "beforeCount", changes.beforeCount(),
                            "afterCount", changes.afterCount(),
                            "countDiff", changes.countDiff()))
                    .build());
        } catch (Exception e) {
            log.warn("Change notification failed container={} reason={}", current.getContainerId(), e.getMessage());
        }
    }

    private static boolean matches(PillConfig expected, VerificationResponse response) {
        if (response.count() != expected.getCount()) {
            return false;
        }
        String label = expected.getLabel();
        List<DetectedClass> classes = response.classesOrEmpty();
        if (label == null || label.isBlank() || classes.isEmpty()) {
            return true;
        }
        return classes.stream().anyMatch(c -> label.equalsIgnoreCase(c.label()));
    }
}
