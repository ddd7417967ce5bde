package com.abba.ainay.infrastructure.config;

import com.abba.ainay.application.notification.DispatchSettings;
import com.abba.ainay.application.notification.TierTable;
import com.abba.ainay.domain.model.NotificationTier;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "ainay.notifications")
@Data
public class NotificationProperties {

    private boolean enabled = true;
    private double pushFirstMinutes = 0.5;
    private double pushSecondMinutes = 1;
    private double telegramMinutes = 1.5;
    private double emailMinutes = 3;
    private double maxMinutesPast = 120;
    private int maxConcurrentSends = 10;
    private Duration sendTimeout = Duration.ofSeconds(10);
    private Duration interval = Duration.ofSeconds(30);
    private String zone;

    public DispatchSettings toSettings() {
        Map<NotificationTier, Double> thresholds = new EnumMap<>(NotificationTier.class);
        thresholds.put(NotificationTier.PUSH_FIRST, pushFirstMinutes);
        thresholds.put(NotificationTier.PUSH_SECOND, pushSecondMinutes);
        thresholds.put(NotificationTier.TELEGRAM, telegramMinutes);
        thresholds.put(NotificationTier.EMAIL, emailMinutes);
        return new DispatchSettings(enabled, TierTable.of(thresholds), maxMinutesPast, maxConcurrentSends, sendTimeout);
    }
}
