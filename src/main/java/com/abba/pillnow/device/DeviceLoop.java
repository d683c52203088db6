package com.abba.pillnow.device;

import com.abba.pillnow.device.alarm.AlarmStateMachine;
import com.abba.pillnow.device.protocol.CommandDispatcher;
import com.abba.pillnow.device.schedule.DeviceClock;
import com.abba.pillnow.device.schedule.EmbeddedScheduleEntry;
import com.abba.pillnow.device.schedule.LocalScheduleTable;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.List;
import java.util.function.BooleanSupplier;
import java.util.function.LongSupplier;

@Slf4j
public class DeviceLoop {

    public static final long SCHEDULE_CHECK_MS = 1_000;

    private final List<SerialLink> links;
    private final CommandDispatcher dispatcher;
    private final AlarmStateMachine alarm;
    private final LocalScheduleTable schedule;
    private final DeviceClock clock;
    private final LongSupplier millis;

    private long lastScheduleCheck = Long.MIN_VALUE;

    public DeviceLoop(List<SerialLink> links,
                      CommandDispatcher dispatcher,
                      AlarmStateMachine alarm,
                      LocalScheduleTable schedule,
                      DeviceClock clock,
                      LongSupplier millis) {
        this.links = List.copyOf(links);
        this.dispatcher = dispatcher;
        this.alarm = alarm;
        this.schedule = schedule;
        this.clock = clock;
        this.millis = millis;
    }

    public void runOnce() {
        for (SerialLink link : links) {
            byte[] line = link.pollLine();
            if (line != null) {
                dispatcher.dispatch(line, link);
            }
        }

        alarm.tick().ifPresent(dispatcher::announceStop);

        long now = millis.getAsLong();
        if (lastScheduleCheck == Long.MIN_VALUE || now - lastScheduleCheck >= SCHEDULE_CHECK_MS) {
            lastScheduleCheck = now;
            checkSchedule();
        }
    }

    public void run(BooleanSupplier keepRunning, long passDelayMillis) throws InterruptedException {
        log.info("Device loop started with {} link(s)", links.size());
        while (keepRunning.getAsBoolean()) {
            runOnce();
            Thread.sleep(passDelayMillis);
        }
        log.info("Device loop stopped");
    }

    private void checkSchedule() {
        LocalDateTime now = clock.now();
        if (now == null) {
            return;
        }
        for (EmbeddedScheduleEntry entry : schedule.takeDue(now)) {
            log.info("Local schedule due {} C{}", entry.time(), entry.getContainer());
            dispatcher.fireLocal(entry);
        }
    }
}
