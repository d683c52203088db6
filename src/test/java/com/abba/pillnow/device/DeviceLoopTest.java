package com.abba.pillnow.device;

import com.abba.pillnow.device.alarm.Actuator;
import com.abba.pillnow.device.alarm.AlarmMode;
import com.abba.pillnow.device.alarm.AlarmStateMachine;
import com.abba.pillnow.device.alarm.MismatchAlertLimiter;
import com.abba.pillnow.device.protocol.CommandDispatcher;
import com.abba.pillnow.device.protocol.CommandParser;
import com.abba.pillnow.device.protocol.InputSanitizer;
import com.abba.pillnow.device.schedule.DeviceClock;
import com.abba.pillnow.device.schedule.LocalScheduleTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(MockitoExtension.class)
class DeviceLoopTest {

    @Mock
    private Actuator actuator;

    private final AtomicLong millis = new AtomicLong();
    private final RecordingSerialLink host = new RecordingSerialLink("host");
    private final RecordingSerialLink phone = new RecordingSerialLink("phone");
    private AlarmStateMachine alarm;
    private DeviceLoop loop;

    @BeforeEach
    void setUp() {
        alarm = new AlarmStateMachine(actuator, millis::get);
        LocalScheduleTable table = new LocalScheduleTable();
        DeviceClock clock = new DeviceClock(millis::get);
        CommandDispatcher dispatcher = new CommandDispatcher(new InputSanitizer(), new CommandParser(), alarm,
                table, clock, new MismatchAlertLimiter(), host, phone, millis::get);
        loop = new DeviceLoop(List.of(host, phone), dispatcher, alarm, table, clock, millis::get);
    }

    @Test
    void localScheduleFiresOnceAndAlarmTimesOut() {
        host.receive("SETTIME 2026-10-18 08:29:59").receive("SCHED ADD 08:30 1");
        loop.runOnce();
        loop.runOnce();
        assertThat(host.written()).containsExactly("TIME SET 2026-10-18T08:29:59", "SCHED ADDED 08:30 C1");

        millis.addAndGet(1_000);
        loop.runOnce();
        assertThat(phone.written()).containsExactly("ALARM_TRIGGERED C1 08:30");
        assertThat(alarm.alarmingContainer()).contains(1);

        millis.addAndGet(1_000);
        loop.runOnce();
        assertThat(phone.written()).hasSize(1);

        millis.addAndGet(60_000);
        loop.runOnce();
        assertThat(alarm.isIdle()).isTrue();
        assertThat(phone.written()).containsExactly("ALARM_TRIGGERED C1 08:30", "ALARM_STOPPED C1");
        assertThat(host.written()).endsWith("ALARM_STOPPED C1");
    }

    @Test
    void readsOneLinePerLinkPerPass() {
        host.receive("LOCATE").receive("STOP");
        phone.receive("SCHED LIST");

        loop.runOnce();

        assertThat(alarm.mode()).isEqualTo(AlarmMode.LOCATING);
        assertThat(phone.written()).containsExactly("SCHED COUNT 0/8");

        loop.runOnce();
        assertThat(alarm.isIdle()).isTrue();
    }

    @Test
    void runStopsWhenAskedTo() throws InterruptedException {
        AtomicInteger passes = new AtomicInteger();

        loop.run(() -> passes.incrementAndGet() <= 3, 0);

        assertThat(passes.get()).isEqualTo(4);
    }
}
