package com.abba.pillnow.domain.service;

import com.abba.pillnow.domain.model.FireStage;
import com.abba.pillnow.domain.model.Notification;
import com.abba.pillnow.domain.model.ScheduleEventType;
import com.abba.pillnow.domain.model.VerificationResult;

import java.util.List;

public interface NotificationService {

    Notification record(Notification notification);

    Notification recordScheduleEvent(ScheduleEventType type, int containerId, String message, String scheduleId);

    Notification recordMismatch(VerificationResult result);

    Notification recordPublishFailure(int containerId, FireStage stage, String detail);

    List<Notification> findByContainer(int containerId);

    List<Notification> findAll();

    boolean delete(String notificationId);

    boolean sendMail(String to, String subject, String text);
}
