package com.abba.pillnow.application.service;

import com.abba.pillnow.domain.model.CommandAction;
import com.abba.pillnow.domain.model.ContainerSchedule;
import com.abba.pillnow.domain.model.DeviceCommand;
import com.abba.pillnow.domain.model.FireStage;
import com.abba.pillnow.domain.model.Notification;
import com.abba.pillnow.domain.model.NotificationType;
import com.abba.pillnow.domain.model.PillConfig;
import com.abba.pillnow.domain.model.ScheduleEventType;
import com.abba.pillnow.domain.service.CommandBus;
import com.abba.pillnow.domain.service.NotificationService;
import com.abba.pillnow.domain.service.ScheduleStore;
import com.abba.pillnow.infrastructure.config.NotifyProperties;
import com.abba.pillnow.infrastructure.config.SchedulerProperties;
import com.abba.pillnow.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AlarmSchedulerImplTest {

    @Mock
    private ScheduleStore scheduleStore;

    @Mock
    private CommandBus commandBus;

    @Mock
    private NotificationService notificationService;

    @Mock
    private TaskScheduler taskScheduler;

    private final SchedulerProperties schedulerProperties = new SchedulerProperties();
    private final NotifyProperties notifyProperties = new NotifyProperties();
    private final RelayMetrics metrics = new RelayMetrics();
    private MutableClock clock;
    private AlarmSchedulerImpl scheduler;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-10-18T08:30:00", "Asia/Manila");
        scheduler = new AlarmSchedulerImpl(scheduleStore, commandBus, notificationService,
                schedulerProperties, notifyProperties, taskScheduler, Runnable::run, metrics, clock);
    }

    @Test
    void firesOncePerDoseInsideTheDedupWindow() {
        when(scheduleStore.registeredContainers()).thenReturn(List.of(container(1, "08:30")));

        for (int second = 0; second < 180; second++) {
            scheduler.tick();
            clock.advance(Duration.ofSeconds(1));
        }

        verify(taskScheduler, times(1)).schedule(any(Runnable.class), any(Instant.class));
        assertThat(metrics.snapshot()).containsEntry("fires", 1L).containsEntry("firesSuppressed", 59L);
    }

    @Test
    void firesAgainOnTheNextDay() {
        when(scheduleStore.registeredContainers()).thenReturn(List.of(container(1, "08:30")));

        scheduler.tick();
        clock.advance(Duration.ofDays(1));
        scheduler.tick();

        verify(taskScheduler, times(2)).schedule(any(Runnable.class), any(Instant.class));
    }

    @Test
    void staggersSimultaneousFiresInRegistrationOrder() {
        when(scheduleStore.registeredContainers()).thenReturn(List.of(
                container(2, "08:30"), container(1, "08:30"), container(3, "08:30")));
        when(commandBus.publishToContainer(anyInt(), any(DeviceCommand.class))).thenReturn(true);
        Instant now = clock.instant();

        scheduler.tick();

        ArgumentCaptor<Runnable> stages = ArgumentCaptor.forClass(Runnable.class);
        ArgumentCaptor<Instant> startTimes = ArgumentCaptor.forClass(Instant.class);
        verify(taskScheduler, times(3)).schedule(stages.capture(), startTimes.capture());
        assertThat(startTimes.getAllValues())
                .containsExactly(now, now.plusMillis(500), now.plusMillis(1000));

        stages.getAllValues().forEach(Runnable::run);

        ArgumentCaptor<Integer> containers = ArgumentCaptor.forClass(Integer.class);
        verify(commandBus, times(3)).publishToContainer(containers.capture(), any(DeviceCommand.class));
        assertThat(containers.getAllValues()).containsExactly(2, 1, 3);
    }

    @Test
    void preCaptureThenAlarmAfterDelay() {
        schedulerProperties.setReminderEnabled(false);
        when(scheduleStore.registeredContainers()).thenReturn(List.of(container(1, "08:30")));
        when(commandBus.publishToContainer(anyInt(), any(DeviceCommand.class))).thenReturn(true);

        scheduler.tick();
        ArgumentCaptor<Runnable> first = ArgumentCaptor.forClass(Runnable.class);
        verify(taskScheduler).schedule(first.capture(), eq(clock.instant()));
        first.getValue().run();

        ArgumentCaptor<DeviceCommand> commands = ArgumentCaptor.forClass(DeviceCommand.class);
        verify(commandBus).publishToContainer(eq(1), commands.capture());
        assertThat(commands.getValue().getAction()).isEqualTo(CommandAction.CAPTURE);
        assertThat(commands.getValue().getExpected()).isEqualTo(new PillConfig(2, "Aspirin"));

        ArgumentCaptor<Runnable> alarm = ArgumentCaptor.forClass(Runnable.class);
        verify(taskScheduler).schedule(alarm.capture(), eq(clock.instant().plusSeconds(1)));
        alarm.getValue().run();

        verify(commandBus, times(2)).publishToContainer(eq(1), commands.capture());
        DeviceCommand alarmCommand = commands.getAllValues().get(commands.getAllValues().size() - 1);
        assertThat(alarmCommand.getAction()).isEqualTo(CommandAction.ALARM_TRIGGERED);
        assertThat(alarmCommand.getDate()).isEqualTo("2026-10-18");
        assertThat(alarmCommand.getTime()).isEqualTo("08:30");
        verify(notificationService).recordScheduleEvent(ScheduleEventType.ALARM_TRIGGERED, 1, null, null);
    }

    @Test
    void undeliveredAlarmIsRecordedAsPublishFailure() {
        schedulerProperties.setPreAlarmCapture(false);
        schedulerProperties.setReminderEnabled(false);
        when(scheduleStore.registeredContainers()).thenReturn(List.of(container(1, "08:30")));
        when(commandBus.publishToContainer(anyInt(), any(DeviceCommand.class))).thenReturn(false);

        scheduler.tick();
        ArgumentCaptor<Runnable> stage = ArgumentCaptor.forClass(Runnable.class);
        verify(taskScheduler).schedule(stage.capture(), any(Instant.class));
        stage.getValue().run();

        verify(notificationService).recordPublishFailure(1, FireStage.ALARM, "device channel unavailable");
    }

    @Test
    void reminderMailsTheContainerTarget() {
        schedulerProperties.setPreAlarmCapture(false);
        ContainerSchedule schedule = container(1, "08:30");
        schedule.setNotifyTarget("care@example.com");
        when(scheduleStore.registeredContainers()).thenReturn(List.of(schedule));
        when(commandBus.publishToContainer(anyInt(), any(DeviceCommand.class))).thenReturn(true);
        when(notificationService.sendMail(eq("care@example.com"), eq("Medication reminder"), any())).thenReturn(true);

        scheduler.tick();
        ArgumentCaptor<Runnable> stage = ArgumentCaptor.forClass(Runnable.class);
        verify(taskScheduler).schedule(stage.capture(), any(Instant.class));
        stage.getValue().run();

        verify(notificationService).sendMail(eq("care@example.com"), eq("Medication reminder"),
                startsWith("It is 08:30. Time to take Aspirin"));
        ArgumentCaptor<Notification> recorded = ArgumentCaptor.forClass(Notification.class);
        verify(notificationService).record(recorded.capture());
        assertThat(recorded.getValue().getType()).isEqualTo(NotificationType.REMINDER);
    }

    @Test
    void fireNowBypassesTimeMatchingButNotDedup() {
        when(scheduleStore.getSchedule(1)).thenReturn(Optional.of(container(1, "21:00")));
        when(scheduleStore.getSchedule(3)).thenReturn(Optional.empty());

        assertThat(scheduler.fireNow(1)).isTrue();
        assertThat(scheduler.fireNow(1)).isFalse();
        assertThat(scheduler.fireNow(3)).isFalse();
        verify(taskScheduler, times(1)).schedule(any(Runnable.class), any(Instant.class));
    }

    @Test
    void slowReminderMailDoesNotHoldTheAlarmLoop() throws Exception {
        schedulerProperties.setPreAlarmCapture(false);
        ContainerSchedule schedule = container(1, "08:30");
        schedule.setNotifyTarget("care@example.com");
        when(scheduleStore.registeredContainers()).thenReturn(List.of(schedule));
        when(commandBus.publishToContainer(anyInt(), any(DeviceCommand.class))).thenReturn(true);
        CountDownLatch mailStarted = new CountDownLatch(1);
        CountDownLatch releaseMail = new CountDownLatch(1);
        when(notificationService.sendMail(anyString(), anyString(), anyString())).thenAnswer(invocation -> {
            mailStarted.countDown();
            releaseMail.await(10, TimeUnit.SECONDS);
            return true;
        });

        ThreadPoolTaskScheduler alarmLoop = new ThreadPoolTaskScheduler();
        alarmLoop.setPoolSize(1);
        alarmLoop.setClock(clock);
        alarmLoop.initialize();
        ThreadPoolTaskExecutor mail = new ThreadPoolTaskExecutor();
        mail.setCorePoolSize(1);
        mail.setWaitForTasksToCompleteOnShutdown(true);
        mail.setAwaitTerminationSeconds(5);
        mail.initialize();
        try {
            AlarmSchedulerImpl looped = new AlarmSchedulerImpl(scheduleStore, commandBus, notificationService,
                    schedulerProperties, notifyProperties, alarmLoop, mail, metrics, clock);

            alarmLoop.submit(looped::tick).get(2, TimeUnit.SECONDS);
            assertThat(mailStarted.await(2, TimeUnit.SECONDS)).isTrue();

            CountDownLatch nextTick = new CountDownLatch(1);
            alarmLoop.execute(nextTick::countDown);
            assertThat(nextTick.await(500, TimeUnit.MILLISECONDS)).isTrue();
        } finally {
            releaseMail.countDown();
            alarmLoop.shutdown();
            mail.shutdown();
        }
        verify(notificationService).record(any(Notification.class));
    }

    @Test
    void concurrentManualFiresClaimTheDoseOnce() throws Exception {
        when(scheduleStore.getSchedule(1)).thenReturn(Optional.of(container(1, "21:00")));
        int callers = 8;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return scheduler.fireNow(1);
                }));
            }
            start.countDown();

            int claimed = 0;
            for (Future<Boolean> result : results) {
                if (result.get(5, TimeUnit.SECONDS)) {
                    claimed++;
                }
            }
            assertThat(claimed).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
        verify(taskScheduler, times(1)).schedule(any(Runnable.class), any(Instant.class));
        assertThat(metrics.snapshot()).containsEntry("firesSuppressed", 7L);
    }

    @Test
    void prunesOldRecordsAndCapsTheTable() {
        schedulerProperties.setMaxFireRecords(2);
        when(scheduleStore.registeredContainers()).thenReturn(List.of(
                container(1, "08:30"), container(2, "08:30"), container(3, "08:30")));

        scheduler.tick();
        assertThat(scheduler.fireRecordCount()).isEqualTo(2);

        clock.advance(Duration.ofHours(7));
        assertThat(scheduler.pruneFireRecords()).isEqualTo(2);
        assertThat(scheduler.fireRecordCount()).isZero();
        verify(commandBus, never()).publishToContainer(anyInt(), any(DeviceCommand.class));
    }

    private static ContainerSchedule container(int id, String time) {
        ContainerSchedule schedule = new ContainerSchedule();
        schedule.setContainerId(id);
        schedule.setTimes(List.of(time));
        schedule.setPillConfig(new PillConfig(2, "Aspirin"));
        return schedule;
    }
}
