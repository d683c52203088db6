package com.abba.pillnow.application.service;

import com.abba.pillnow.application.dto.CaptureResult;
import com.abba.pillnow.domain.model.ContainerIds;
import com.abba.pillnow.domain.model.DeviceCommand;
import com.abba.pillnow.domain.model.PillConfig;
import com.abba.pillnow.domain.model.ScheduleEventType;
import com.abba.pillnow.domain.service.CaptureService;
import com.abba.pillnow.domain.service.CommandBus;
import com.abba.pillnow.domain.service.NotificationService;
import com.abba.pillnow.domain.service.ScheduleStore;
import com.abba.pillnow.infrastructure.config.DeviceProperties;
import com.abba.pillnow.infrastructure.config.SchedulingConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;

@Service
@Slf4j
public class CaptureServiceImpl implements CaptureService {

    private final CommandBus commandBus;
    private final ScheduleStore scheduleStore;
    private final NotificationService notificationService;
    private final DeviceProperties deviceProperties;
    private final TaskScheduler taskScheduler;
    private final Clock clock;

    public CaptureServiceImpl(CommandBus commandBus,
                              ScheduleStore scheduleStore,
                              NotificationService notificationService,
                              DeviceProperties deviceProperties,
                              @Qualifier(SchedulingConfig.ALARM_TASK_SCHEDULER) TaskScheduler taskScheduler,
                              Clock clock) {
        this.commandBus = commandBus;
        this.scheduleStore = scheduleStore;
        this.notificationService = notificationService;
        this.deviceProperties = deviceProperties;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
    }

    @Override
    public CaptureResult triggerCapture(int containerId, PillConfig expected) {
        if (!ContainerIds.isValid(containerId)) {
            throw new IllegalArgumentException("Unknown container: " + containerId);
        }
        PillConfig config = expected != null ? expected : scheduleStore.getPillConfig(containerId);
        String deviceId = commandBus.resolveDeviceId(containerId);
        boolean published = commandBus.publish(deviceId, DeviceCommand.capture(containerId, config));
        log.info("Capture requested container={} device={} expected={} published={}",
                containerId, deviceId, config, published);
        return new CaptureResult(published, containerId, deviceId, config);
    }

    @Override
    public void onAlarmStopped(int containerId) {
        if (!ContainerIds.isValid(containerId)) {
            throw new IllegalArgumentException("Unknown container: " + containerId);
        }
        notificationService.recordScheduleEvent(ScheduleEventType.ALARM_STOPPED, containerId, null, null);
        taskScheduler.schedule(() -> postStopCapture(containerId),
                clock.instant().plus(deviceProperties.getPostStopCaptureDelay()));
        log.info("Alarm stopped container={}, capture in {}", containerId, deviceProperties.getPostStopCaptureDelay());
    }

    private void postStopCapture(int containerId) {
        try {
            triggerCapture(containerId, null);
        } catch (Exception e) {
            log.error("Post-stop capture failed container={}", containerId, e);
        }
    }
}
