package com.abba.pillnow.domain.service;

import com.abba.pillnow.application.dto.ScheduleUpdate;
import com.abba.pillnow.application.dto.SyncResult;
import com.abba.pillnow.domain.model.ContainerSchedule;
import com.abba.pillnow.domain.model.PillConfig;

import java.util.List;
import java.util.Optional;

public interface ScheduleStore {

    ContainerSchedule setSchedule(ScheduleUpdate update);

    Optional<ContainerSchedule> getSchedule(int containerId);

    PillConfig getPillConfig(int containerId);

    List<ContainerSchedule> registeredContainers();

    SyncResult syncFromCloud(String elderId);

    int loadPersisted();
}
