package com.abba.pillnow.device.schedule;

import lombok.Data;

@Data
public class EmbeddedScheduleEntry {

    private int hour;
    private int minute;
    private int container;
    private boolean inUse;
    private int lastTriggeredYmd;

    public String time() {
        return String.format("%02d:%02d", hour, minute);
    }
}
