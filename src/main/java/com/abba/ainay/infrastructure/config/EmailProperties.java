package com.abba.ainay.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "ainay.email")
@Data
public class EmailProperties {

    private boolean enabled = true;
    private String fromAddress = "noreply@ainay.care";
    private String fromName = "AInay Companion Care";
}
