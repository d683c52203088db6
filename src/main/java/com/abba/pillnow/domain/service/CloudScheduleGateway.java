package com.abba.pillnow.domain.service;

import com.abba.pillnow.domain.model.CloudScheduleRow;

import java.util.List;
import java.util.Optional;

public interface CloudScheduleGateway {

    List<CloudScheduleRow> fetchSchedules(String elderId);

    Optional<String> findMedicationLabel(String medicationId);
}
