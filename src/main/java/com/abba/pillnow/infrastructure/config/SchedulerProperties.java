package com.abba.pillnow.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "pillnow.scheduler")
@Data
public class SchedulerProperties {

    private boolean enabled = true;
    private long tickMillis = 1000;
    private long staggerMillis = 500;
    private Duration dedupWindow = Duration.ofMinutes(2);
    private long pruneIntervalMillis = 3_600_000;
    private Duration pruneMaxAge = Duration.ofHours(6);
    private int maxFireRecords = 500;
    private boolean preAlarmCapture = true;
    private Duration preCaptureDelay = Duration.ofSeconds(1);
    private boolean reminderEnabled = true;
    private String zone = "Asia/Manila";
    private boolean syncOnStartup = false;
}
