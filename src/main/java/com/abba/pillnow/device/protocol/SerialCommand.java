package com.abba.pillnow.device.protocol;

public record SerialCommand(
        SerialCommandType type,
        Integer container,
        Integer hour,
        Integer minute,
        String date,
        String argument,
        String line,
        boolean recovered
) {

    public String time() {
        return hour == null || minute == null ? null : String.format("%02d:%02d", hour, minute);
    }
}
