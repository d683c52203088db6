package com.abba.pillnow.application.service;

import com.abba.pillnow.domain.model.ContainerSchedule;
import com.abba.pillnow.domain.model.DeviceCommand;
import com.abba.pillnow.domain.model.FireStage;
import com.abba.pillnow.domain.model.Notification;
import com.abba.pillnow.domain.model.NotificationType;
import com.abba.pillnow.domain.model.PillConfig;
import com.abba.pillnow.domain.model.ScheduleEventType;
import com.abba.pillnow.domain.service.AlarmScheduler;
import com.abba.pillnow.domain.service.CommandBus;
import com.abba.pillnow.domain.service.NotificationService;
import com.abba.pillnow.domain.service.ScheduleStore;
import com.abba.pillnow.infrastructure.config.NotifyProperties;
import com.abba.pillnow.infrastructure.config.SchedulerProperties;
import com.abba.pillnow.infrastructure.config.SchedulingConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Service
@Slf4j
public class AlarmSchedulerImpl implements AlarmScheduler {

    private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");

    private final ScheduleStore scheduleStore;
    private final CommandBus commandBus;
    private final NotificationService notificationService;
    private final SchedulerProperties schedulerProperties;
    private final NotifyProperties notifyProperties;
    private final TaskScheduler taskScheduler;
    private final TaskExecutor mailExecutor;
    private final RelayMetrics metrics;
    private final Clock clock;

    private final Map<String, Instant> fireRecords = new ConcurrentHashMap<>();

    public AlarmSchedulerImpl(ScheduleStore scheduleStore,
                              CommandBus commandBus,
                              NotificationService notificationService,
                              SchedulerProperties schedulerProperties,
                              NotifyProperties notifyProperties,
                              @Qualifier(SchedulingConfig.ALARM_TASK_SCHEDULER) TaskScheduler taskScheduler,
                              @Qualifier(SchedulingConfig.MAIL_TASK_EXECUTOR) TaskExecutor mailExecutor,
                              RelayMetrics metrics,
                              Clock clock) {
        this.scheduleStore = scheduleStore;
        this.commandBus = commandBus;
        this.notificationService = notificationService;
        this.schedulerProperties = schedulerProperties;
        this.notifyProperties = notifyProperties;
        this.taskScheduler = taskScheduler;
        this.mailExecutor = mailExecutor;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public void tick() {
        try {
            ZonedDateTime now = ZonedDateTime.now(clock);
            LocalDate today = now.toLocalDate();
            String time = now.format(HH_MM);

            List<FireContext> due = new ArrayList<>();
            for (ContainerSchedule schedule : scheduleStore.registeredContainers()) {
                if (!schedule.timesFor(today).contains(time)) {
                    continue;
                }
                if (!claimFire(schedule.getContainerId(), today, time, now.toInstant())) {
                    continue;
                }
                due.add(contextFor(schedule, today, time));
            }
            for (int index = 0; index < due.size(); index++) {
                startFire(due.get(index), index);
            }
        } catch (Exception e) {
            log.error("Alarm tick failed", e);
        }
    }

    @Override
    public boolean fireNow(int containerId) {
        ContainerSchedule schedule = scheduleStore.getSchedule(containerId).orElse(null);
        if (schedule == null) {
            log.warn("Manual fire requested for unknown container={}", containerId);
            return false;
        }
        ZonedDateTime now = ZonedDateTime.now(clock);
        LocalDate today = now.toLocalDate();
        String time = now.format(HH_MM);
        if (!claimFire(containerId, today, time, now.toInstant())) {
            return false;
        }
        startFire(contextFor(schedule, today, time), 0);
        return true;
    }

    @Override
    public int pruneFireRecords() {
        Instant cutoff = clock.instant().minus(schedulerProperties.getPruneMaxAge());
        int before = fireRecords.size();
        fireRecords.values().removeIf(firedAt -> firedAt.isBefore(cutoff));
        enforceCap();
        int removed = before - fireRecords.size();
        if (removed > 0) {
            log.info("Pruned {} fire record(s), {} remaining", removed, fireRecords.size());
        }
        return removed;
    }

    @Override
    public int fireRecordCount() {
        return fireRecords.size();
    }

    private boolean claimFire(int containerId, LocalDate date, String time, Instant now) {
        String key = containerId + "|" + date + "|" + time;
        Duration window = schedulerProperties.getDedupWindow();
        boolean[] claimed = {false};
        fireRecords.compute(key, (ignored, last) -> {
            if (last != null && Duration.between(last, now).compareTo(window) < 0) {
                return last;
            }
            claimed[0] = true;
            return now;
        });
        if (!claimed[0]) {
            metrics.fireSuppressed();
            return false;
        }
        enforceCap();
        return true;
    }

    private void enforceCap() {
        int overflow = fireRecords.size() - schedulerProperties.getMaxFireRecords();
        if (overflow <= 0) {
            return;
        }
        List<Map.Entry<String, Instant>> oldest = new ArrayList<>(fireRecords.entrySet());
        oldest.sort(Map.Entry.comparingByValue(Comparator.naturalOrder()));
        Iterator<Map.Entry<String, Instant>> iterator = oldest.iterator();
        while (overflow > 0 && iterator.hasNext()) {
            fireRecords.remove(iterator.next().getKey());
            overflow--;
        }
    }

    private void startFire(FireContext context, int index) {
        metrics.fire();
        FireStage first = schedulerProperties.isPreAlarmCapture() ? FireStage.PRE_CAPTURE : FireStage.ALARM;
        Instant startAt = clock.instant().plusMillis(index * schedulerProperties.getStaggerMillis());
        log.info("Dose due container={} date={} time={} stage={} startAt={}",
                context.containerId(), context.date(), context.time(), first, startAt);
        taskScheduler.schedule(() -> runStage(first, context), startAt);
    }

    private void runStage(FireStage stage, FireContext context) {
        try {
            switch (stage) {
                case PRE_CAPTURE -> {
                    publish(stage, context, DeviceCommand.capture(context.containerId(), context.expected()));
                    taskScheduler.schedule(() -> runStage(FireStage.ALARM, context),
                            clock.instant().plus(schedulerProperties.getPreCaptureDelay()));
                }
                case ALARM -> {
                    publish(stage, context, DeviceCommand.alarm(context.containerId(), context.date().toString(), context.time()));
                    notificationService.recordScheduleEvent(ScheduleEventType.ALARM_TRIGGERED, context.containerId(), null, null);
                    if (schedulerProperties.isReminderEnabled()) {
                        mailExecutor.execute(() -> runStage(FireStage.REMINDER, context));
                    }
                }
                case REMINDER -> sendReminder(context);
            }
        } catch (Exception e) {
            log.error("Fire stage {} failed container={} time={}", stage, context.containerId(), context.time(), e);
            notificationService.recordPublishFailure(context.containerId(), stage, e.getMessage());
        }
    }

    private void publish(FireStage stage, FireContext context, DeviceCommand command) {
        boolean sent = commandBus.publishToContainer(context.containerId(), command);
        if (!sent) {
            log.warn("Fire stage {} not delivered container={} time={}", stage, context.containerId(), context.time());
            notificationService.recordPublishFailure(context.containerId(), stage, "device channel unavailable");
        }
    }

    private void sendReminder(FireContext context) {
        String target = context.notifyTarget() != null ? context.notifyTarget() : notifyProperties.getDefaultTarget();
        if (target == null || target.isBlank()) {
            return;
        }
        String label = context.expected() != null && context.expected().getLabel() != null
                ? context.expected().getLabel()
                : "your medication";
        String text = "It is %s. Time to take %s from container %d.".formatted(context.time(), label, context.containerId());
        boolean sent = notificationService.sendMail(target, "Medication reminder", text);
        notificationService.record(Notification.builder()
                .type(NotificationType.REMINDER)
                .container(context.containerId())
                .title("Medication reminder")
                .message(sent ? text : text + " (reminder not delivered)")
                .build());
    }

    private FireContext contextFor(ContainerSchedule schedule, LocalDate date, String time) {
        PillConfig expected = schedule.getPillConfig() == null ? PillConfig.empty() : schedule.getPillConfig().copy();
        return new FireContext(schedule.getContainerId(), date, time, expected, schedule.getNotifyTarget());
    }

    private record FireContext(int containerId, LocalDate date, String time, PillConfig expected, String notifyTarget) {
    }
}
