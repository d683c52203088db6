package com.abba.pillnow.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "pillnow.notify")
@Data
public class NotifyProperties {

    private boolean mailEnabled = false;
    private String from = "no-reply@pillnow.app";
    private String defaultTarget;
    private int maxPerContainer = 50;
}
