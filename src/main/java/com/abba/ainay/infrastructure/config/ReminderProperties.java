package com.abba.ainay.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "ainay.reminders")
@Data
public class ReminderProperties {

    private boolean enabled = true;
    private int defaultMinutesBefore = 5;
    private int windowMinutes = 2;
    private Duration interval = Duration.ofMinutes(2);
}
