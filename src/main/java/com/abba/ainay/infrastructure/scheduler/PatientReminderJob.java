package com.abba.ainay.infrastructure.scheduler;

import com.abba.ainay.domain.service.PatientReminderService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@ConditionalOnProperty(prefix = "ainay.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PatientReminderJob {

    private final PatientReminderService patientReminderService;

    public PatientReminderJob(PatientReminderService patientReminderService) {
        this.patientReminderService = patientReminderService;
    }

    @Scheduled(fixedDelayString = "${ainay.reminders.interval:PT2M}", initialDelayString = "${ainay.reminders.initial-delay:PT20S}")
    public void sendUpcomingReminders() {
        try {
            patientReminderService.checkAndSendReminders().ifPresent(result -> {
                if (result.sent() > 0) {
                    log.info("Sent {} patient reminder(s)", result.sent());
                }
                if (!result.errors().isEmpty()) {
                    log.error("Patient reminder errors: {}", result.errors());
                }
            });
        } catch (Exception e) {
            log.error("Patient reminder check failed: {}", e.getMessage(), e);
        }
    }
}
