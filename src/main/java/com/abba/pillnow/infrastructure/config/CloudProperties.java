package com.abba.pillnow.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "pillnow.cloud")
@Data
public class CloudProperties {

    private String baseUrl = "https://pillnow-database.onrender.com";
    private String token;
    private String elderId;
    private int timeoutSeconds = 15;
}
