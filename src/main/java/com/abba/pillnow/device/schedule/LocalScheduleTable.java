package com.abba.pillnow.device.schedule;

import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Slf4j
public class LocalScheduleTable {

    public static final int DEFAULT_CAPACITY = 8;

    private final EmbeddedScheduleEntry[] entries;

    public LocalScheduleTable() {
        this(DEFAULT_CAPACITY);
    }

    public LocalScheduleTable(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        entries = new EmbeddedScheduleEntry[capacity];
        for (int i = 0; i < capacity; i++) {
            entries[i] = new EmbeddedScheduleEntry();
        }
    }

    public AddResult add(int hour, int minute, int container, LocalDateTime now) {
        if (hour < 0 || hour > 23 || minute < 0 || minute > 59 || container < 1 || container > 9) {
            return AddResult.INVALID;
        }
        EmbeddedScheduleEntry slot = find(hour, minute, container);
        if (slot == null) {
            slot = freeSlot();
        }
        if (slot == null) {
            log.warn("Schedule table full, dropping {}:{} C{}", hour, minute, container);
            return AddResult.FULL;
        }
        slot.setHour(hour);
        slot.setMinute(minute);
        slot.setContainer(container);
        slot.setInUse(true);
        slot.setLastTriggeredYmd(0);

        if (now == null) {
            return AddResult.ADDED;
        }
        int minutesNow = now.getHour() * 60 + now.getMinute();
        int minutesEntry = hour * 60 + minute;
        if (minutesEntry == minutesNow) {
            slot.setLastTriggeredYmd(ymd(now));
            return AddResult.FIRE_NOW;
        }
        if (minutesEntry < minutesNow) {
            slot.setLastTriggeredYmd(ymd(now));
            return AddResult.ADDED_PREFIRED;
        }
        return AddResult.ADDED;
    }

    public List<EmbeddedScheduleEntry> takeDue(LocalDateTime now) {
        List<EmbeddedScheduleEntry> due = new ArrayList<>();
        int today = ymd(now);
        for (EmbeddedScheduleEntry entry : entries) {
            if (entry.isInUse()
                    && entry.getHour() == now.getHour()
                    && entry.getMinute() == now.getMinute()
                    && entry.getLastTriggeredYmd() != today) {
                entry.setLastTriggeredYmd(today);
                due.add(copy(entry));
            }
        }
        return due;
    }

    public void clear() {
        for (EmbeddedScheduleEntry entry : entries) {
            entry.setInUse(false);
            entry.setLastTriggeredYmd(0);
        }
    }

    public List<EmbeddedScheduleEntry> entries() {
        List<EmbeddedScheduleEntry> inUse = new ArrayList<>();
        for (EmbeddedScheduleEntry entry : entries) {
            if (entry.isInUse()) {
                inUse.add(copy(entry));
            }
        }
        return inUse;
    }

    public int capacity() {
        return entries.length;
    }

    private EmbeddedScheduleEntry find(int hour, int minute, int container) {
        for (EmbeddedScheduleEntry entry : entries) {
            if (entry.isInUse() && entry.getHour() == hour && entry.getMinute() == minute
                    && entry.getContainer() == container) {
                return entry;
            }
        }
        return null;
    }

    private EmbeddedScheduleEntry freeSlot() {
        for (EmbeddedScheduleEntry entry : entries) {
            if (!entry.isInUse()) {
                return entry;
            }
        }
        return null;
    }

    private static int ymd(LocalDateTime time) {
        return time.getYear() * 10_000 + time.getMonthValue() * 100 + time.getDayOfMonth();
    }

    private static EmbeddedScheduleEntry copy(EmbeddedScheduleEntry entry) {
        EmbeddedScheduleEntry copy = new EmbeddedScheduleEntry();
        copy.setHour(entry.getHour());
        copy.setMinute(entry.getMinute());
        copy.setContainer(entry.getContainer());
        copy.setInUse(entry.isInUse());
        copy.setLastTriggeredYmd(entry.getLastTriggeredYmd());
        return copy;
    }
}
