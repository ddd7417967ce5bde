package com.abba.ainay.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "ainay.telegram")
@Data
public class TelegramProperties {

    private String apiBaseUrl = "https://api.telegram.org";
    private String botToken;

    public boolean isConfigured() {
        return botToken != null && !botToken.isBlank();
    }
}
