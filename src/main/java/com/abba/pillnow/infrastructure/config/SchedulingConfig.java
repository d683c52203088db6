package com.abba.pillnow.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
@EnableScheduling
public class SchedulingConfig {

    public static final String ALARM_TASK_SCHEDULER = "alarmTaskScheduler";
    public static final String MAIL_TASK_EXECUTOR = "mailTaskExecutor";

    private static final Logger log = LoggerFactory.getLogger(SchedulingConfig.class);

    @Bean
    public Clock clock(SchedulerProperties schedulerProperties) {
        return Clock.system(ZoneId.of(schedulerProperties.getZone()));
    }

    @Bean(name = ALARM_TASK_SCHEDULER)
    public ThreadPoolTaskScheduler alarmTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("alarm-loop-");
        scheduler.setErrorHandler(t -> log.error("Unhandled error on alarm loop", t));
        return scheduler;
    }

    @Bean(name = MAIL_TASK_EXECUTOR)
    public ThreadPoolTaskExecutor mailTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("mail-");
        return executor;
    }
}
