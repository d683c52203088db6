package com.abba.pillnow.domain.service;

import com.abba.pillnow.application.dto.CaptureResult;
import com.abba.pillnow.domain.model.PillConfig;

public interface CaptureService {

    CaptureResult triggerCapture(int containerId, PillConfig expected);

    void onAlarmStopped(int containerId);
}
