package com.abba.pillnow.device.protocol;

import com.abba.pillnow.device.SerialLink;
import com.abba.pillnow.device.alarm.AlarmStateMachine;
import com.abba.pillnow.device.alarm.MismatchAlertLimiter;
import com.abba.pillnow.device.alarm.StopEvent;
import com.abba.pillnow.device.schedule.AddResult;
import com.abba.pillnow.device.schedule.DeviceClock;
import com.abba.pillnow.device.schedule.EmbeddedScheduleEntry;
import com.abba.pillnow.device.schedule.LocalScheduleTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.LongSupplier;

public class CommandDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);
    private static final int MAX_REMEMBERED_UNKNOWN = 32;

    private final InputSanitizer sanitizer;
    private final CommandParser parser;
    private final AlarmStateMachine alarm;
    private final LocalScheduleTable schedule;
    private final DeviceClock clock;
    private final MismatchAlertLimiter alertLimiter;
    private final SerialLink hostLink;
    private final SerialLink phoneLink;
    private final LongSupplier millis;

    private final Set<String> echoedUnknown = new LinkedHashSet<>();

    public CommandDispatcher(InputSanitizer sanitizer,
                             CommandParser parser,
                             AlarmStateMachine alarm,
                             LocalScheduleTable schedule,
                             DeviceClock clock,
                             MismatchAlertLimiter alertLimiter,
                             SerialLink hostLink,
                             SerialLink phoneLink,
                             LongSupplier millis) {
        this.sanitizer = sanitizer;
        this.parser = parser;
        this.alarm = alarm;
        this.schedule = schedule;
        this.clock = clock;
        this.alertLimiter = alertLimiter;
        this.hostLink = hostLink;
        this.phoneLink = phoneLink;
        this.millis = millis;
    }

    public Optional<SerialCommand> dispatch(byte[] raw, SerialLink source) {
        SanitizedLine line = sanitizer.sanitize(raw);
        if (!line.isAccepted()) {
            log.debug("Discarded input from {}: {} (valid ratio {})", source.name(), line.rejectReason(),
                    String.format("%.2f", line.validRatio()));
            return Optional.empty();
        }

        Optional<SerialCommand> parsed = parser.parse(line.text());
        if (parsed.isEmpty()) {
            log.info("Unknown command from {}: {}", source.name(), line.text());
            if (rememberUnknown(line.text())) {
                source.writeLine("UNKNOWN " + line.text());
            }
            return Optional.empty();
        }

        SerialCommand command = parsed.get();
        if (command.recovered()) {
            log.info("Recovered {} from corrupted line '{}'", command.type(), command.line());
        }
        try {
            execute(command, source);
        } catch (RuntimeException e) {
            log.error("Command {} failed", command.type(), e);
        }
        return parsed;
    }

    public void fireLocal(EmbeddedScheduleEntry entry) {
        alarm.startAlarm(entry.getContainer());
        broadcast("ALARM_TRIGGERED C" + entry.getContainer() + " " + entry.time());
    }

    public void announceStop(StopEvent event) {
        if (event.endedAlarm()) {
            broadcast("ALARM_STOPPED C" + event.container());
        }
    }

    private void execute(SerialCommand command, SerialLink source) {
        switch (command.type()) {
            case LOCATE -> alarm.startLocate();
            case STOP -> alarm.stop().ifPresent(this::announceStop);
            case SETTIME -> setTime(command, source);
            case SCHED_ADD -> addSchedule(command, source);
            case SCHED_CLEAR -> {
                schedule.clear();
                source.writeLine("SCHED CLEARED");
            }
            case SCHED_LIST -> listSchedule(source);
            case ALARM_TRIGGERED -> alarmTriggered(command, source);
            case PILLALERT -> pillAlert(command);
        }
    }

    private void setTime(SerialCommand command, SerialLink source) {
        try {
            source.writeLine("TIME SET " + clock.set(command.argument()));
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring SETTIME with bad timestamp '{}'", command.argument());
        }
    }

    private void addSchedule(SerialCommand command, SerialLink source) {
        AddResult result = schedule.add(command.hour(), command.minute(), command.container(), clock.now());
        source.writeLine("SCHED " + result.name() + " " + command.time() + " C" + command.container());
        if (result == AddResult.FIRE_NOW) {
            EmbeddedScheduleEntry entry = new EmbeddedScheduleEntry();
            entry.setHour(command.hour());
            entry.setMinute(command.minute());
            entry.setContainer(command.container());
            fireLocal(entry);
        }
    }

    private void listSchedule(SerialLink source) {
        List<EmbeddedScheduleEntry> entries = schedule.entries();
        for (EmbeddedScheduleEntry entry : entries) {
            source.writeLine("SCHED " + entry.time() + " C" + entry.getContainer());
        }
        source.writeLine("SCHED COUNT " + entries.size() + "/" + schedule.capacity());
    }

    private void alarmTriggered(SerialCommand command, SerialLink source) {
        if (command.container() < 1) {
            log.warn("Ignoring ALARM_TRIGGERED without container: {}", command.line());
            return;
        }
        alarm.startAlarm(command.container());
        if (source != phoneLink) {
            String date = command.date() == null ? "" : command.date() + " ";
            phoneLink.writeLine("ALARM_TRIGGERED C" + command.container() + " " + date + command.time());
        }
    }

    private void pillAlert(SerialCommand command) {
        if (!alertLimiter.tryAcquire(millis.getAsLong())) {
            log.debug("Mismatch alert rate-limited container={}", command.container());
            return;
        }
        phoneLink.writeLine("PILLALERT C" + command.container());
        if (alarm.isIdle() && command.container() >= 1) {
            alarm.startAlarm(command.container());
        }
    }

    private void broadcast(String line) {
        hostLink.writeLine(line);
        phoneLink.writeLine(line);
    }

    private boolean rememberUnknown(String text) {
        if (echoedUnknown.contains(text)) {
            return false;
        }
        if (echoedUnknown.size() >= MAX_REMEMBERED_UNKNOWN) {
            echoedUnknown.remove(echoedUnknown.iterator().next());
        }
        echoedUnknown.add(text);
        return true;
    }
}
