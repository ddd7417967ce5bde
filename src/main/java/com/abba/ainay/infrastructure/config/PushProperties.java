package com.abba.ainay.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "ainay.push")
@Data
public class PushProperties {

    private boolean enabled = true;
    private String credentialsPath;
    private String appName = "ainay-push";
    private String clickUrl = "/companion";
    private Duration connectTimeout = Duration.ofSeconds(5);
    private Duration readTimeout = Duration.ofSeconds(10);
}
