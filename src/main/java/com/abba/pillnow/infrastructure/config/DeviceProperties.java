package com.abba.pillnow.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "pillnow.device")
@Data
public class DeviceProperties {

    private String topicPrefix = "pillnow";
    private String singleDeviceId;
    private Duration captureDebounce = Duration.ofSeconds(3);
    private Duration alertCooldown = Duration.ofSeconds(15);
    private Duration postStopCaptureDelay = Duration.ofSeconds(3);
    private boolean captureOnScheduleSet = true;
}
