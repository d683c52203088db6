package com.abba.pillnow.infrastructure.scheduler;

import com.abba.pillnow.application.dto.SyncResult;
import com.abba.pillnow.domain.service.ScheduleStore;
import com.abba.pillnow.infrastructure.config.CloudProperties;
import com.abba.pillnow.infrastructure.config.SchedulerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
public class ScheduleStoreBootstrap {

    private static final Logger log = LoggerFactory.getLogger(ScheduleStoreBootstrap.class);

    private final ScheduleStore scheduleStore;
    private final SchedulerProperties schedulerProperties;
    private final CloudProperties cloudProperties;

    public ScheduleStoreBootstrap(ScheduleStore scheduleStore,
                                  SchedulerProperties schedulerProperties,
                                  CloudProperties cloudProperties) {
        this.scheduleStore = scheduleStore;
        this.schedulerProperties = schedulerProperties;
        this.cloudProperties = cloudProperties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        try {
            scheduleStore.loadPersisted();
        } catch (Exception e) {
            log.warn("Could not load persisted schedules: {}", e.getMessage());
        }
        if (!schedulerProperties.isSyncOnStartup()) {
            return;
        }
        try {
            SyncResult result = scheduleStore.syncFromCloud(cloudProperties.getElderId());
            log.info("Startup cloud sync rows={} doses={}", result.rowsRead(), result.dosesPerContainer());
        } catch (Exception e) {
            log.warn("Startup cloud sync failed: {}", e.getMessage());
        }
    }
}
