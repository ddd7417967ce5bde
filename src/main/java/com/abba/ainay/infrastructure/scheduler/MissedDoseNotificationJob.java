package com.abba.ainay.infrastructure.scheduler;

import com.abba.ainay.application.dto.NotificationRunResult;
import com.abba.ainay.domain.service.MissedDoseNotificationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@ConditionalOnProperty(prefix = "ainay.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class MissedDoseNotificationJob {

    private final MissedDoseNotificationService missedDoseNotificationService;

    public MissedDoseNotificationJob(MissedDoseNotificationService missedDoseNotificationService) {
        this.missedDoseNotificationService = missedDoseNotificationService;
    }

    @Scheduled(fixedDelayString = "${ainay.notifications.interval:PT30S}", initialDelayString = "${ainay.notifications.initial-delay:PT10S}")
    public void checkMissedDoses() {
        try {
            missedDoseNotificationService.checkAndNotifyMissedDoses().ifPresent(this::report);
        } catch (Exception e) {
            log.error("Missed-dose check failed: {}", e.getMessage(), e);
        }
    }

    private void report(NotificationRunResult result) {
        if (result.notified() > 0) {
            log.info("Sent {} push + {} telegram + {} email = {} total",
                    result.pushSent(), result.telegramSent(), result.emailSent(), result.notified());
        }
        if (!result.errors().isEmpty()) {
            log.error("Missed-dose check errors: {}", result.errors());
        }
    }
}
