package com.abba.pillnow.domain.model;

public record CloudScheduleRow(
        String id,
        Object container,
        String date,
        String time,
        String medicationId,
        Integer pillCount,
        String status
) {
}
