package com.abba.ainay.infrastructure.web;

import com.abba.ainay.application.dto.ReminderRunResult;
import com.abba.ainay.domain.service.PatientReminderService;
import com.abba.ainay.infrastructure.config.ReminderProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/reminders")
public class ReminderController {

    private static final Logger log = LoggerFactory.getLogger(ReminderController.class);

    private final PatientReminderService patientReminderService;
    private final ReminderProperties properties;

    public ReminderController(PatientReminderService patientReminderService, ReminderProperties properties) {
        this.patientReminderService = patientReminderService;
        this.properties = properties;
    }

    @GetMapping("/status")
    public Map<String, Object> status() {
        return Map.of(
                "enabled", properties.isEnabled(),
                "defaultMinutesBefore", properties.getDefaultMinutesBefore(),
                "windowMinutes", properties.getWindowMinutes());
    }

    @PostMapping("/check")
    public ResponseEntity<ReminderRunResult> check() {
        log.info("Manual patient reminder check triggered");
        return patientReminderService.checkAndSendReminders()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.CONFLICT).build());
    }
}
