package com.abba.pillnow.infrastructure.scheduler;

import com.abba.pillnow.domain.service.AlarmScheduler;
import com.abba.pillnow.infrastructure.config.SchedulingConfig;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "pillnow.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class AlarmTickJob {

    private final AlarmScheduler alarmScheduler;

    public AlarmTickJob(AlarmScheduler alarmScheduler) {
        this.alarmScheduler = alarmScheduler;
    }

    @Scheduled(fixedRateString = "${pillnow.scheduler.tick-millis:1000}", scheduler = SchedulingConfig.ALARM_TASK_SCHEDULER)
    public void tick() {
        alarmScheduler.tick();
    }
}
