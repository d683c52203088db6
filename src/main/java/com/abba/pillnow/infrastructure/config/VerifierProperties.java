package com.abba.pillnow.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "pillnow.verifier")
@Data
public class VerifierProperties {

    private String url = "http://127.0.0.1:8000/verify";
    private int timeoutSeconds = 30;
    private boolean saveCaptures = true;
    private String captureDir = "captures";
}
