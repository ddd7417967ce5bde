package com.abba.ainay.infrastructure.web;

import com.abba.ainay.application.dto.ConnectionCheck;
import com.abba.ainay.application.dto.NotificationRunResult;
import com.abba.ainay.application.dto.NotificationStats;
import com.abba.ainay.application.dto.NotificationStatusView;
import com.abba.ainay.application.dto.TestSendResult;
import com.abba.ainay.application.notification.DispatchSettings;
import com.abba.ainay.application.notification.TierTable;
import com.abba.ainay.domain.service.ChannelGateway;
import com.abba.ainay.domain.service.MissedDoseNotificationService;
import com.abba.ainay.domain.service.NotificationHistoryService;
import com.abba.ainay.domain.service.TestNotificationService;
import com.abba.ainay.infrastructure.email.SmtpEmailGateway;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/notifications")
public class NotificationController {

    private static final Logger log = LoggerFactory.getLogger(NotificationController.class);

    private final MissedDoseNotificationService missedDoseNotificationService;
    private final NotificationHistoryService notificationHistoryService;
    private final List<ChannelGateway> gateways;
    private final DispatchSettings settings;
    private final TestNotificationService testNotificationService;
    private final SmtpEmailGateway emailGateway;
    private final Clock clock;

    public NotificationController(MissedDoseNotificationService missedDoseNotificationService,
                                  NotificationHistoryService notificationHistoryService,
                                  TestNotificationService testNotificationService,
                                  SmtpEmailGateway emailGateway,
                                  List<ChannelGateway> gateways,
                                  DispatchSettings settings,
                                  Clock clock) {
        this.missedDoseNotificationService = missedDoseNotificationService;
        this.notificationHistoryService = notificationHistoryService;
        this.testNotificationService = testNotificationService;
        this.emailGateway = emailGateway;
        this.gateways = gateways;
        this.settings = settings;
        this.clock = clock;
    }

    @GetMapping("/status")
    public NotificationStatusView status() {
        Map<String, Double> thresholds = new LinkedHashMap<>();
        for (TierTable.TierThreshold entry : settings.tiers().entries()) {
            thresholds.put(entry.tier().key(), entry.minutes());
        }
        Map<String, Boolean> channels = new LinkedHashMap<>();
        gateways.forEach(gateway -> channels.put(gateway.channel().name().toLowerCase(), gateway.isConfigured()));
        return new NotificationStatusView(
                settings.enabled(),
                thresholds,
                settings.maxMinutesPast(),
                settings.maxConcurrentSends(),
                channels,
                missedDoseNotificationService.isRunning(),
                notificationHistoryService.getStats(ZonedDateTime.now(clock)));
    }

    @PostMapping("/check")
    public ResponseEntity<NotificationRunResult> check() {
        log.info("Manual missed-dose check triggered");
        return missedDoseNotificationService.checkAndNotifyMissedDoses()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.CONFLICT).build());
    }

    @PostMapping("/test")
    public TestSendResult sendTest(@Valid @RequestBody TestEmailRequest request) {
        log.info("Test notification requested for {}", request.email());
        return TestSendResult.from(testNotificationService.sendTestEmail(request.email(), request.name()));
    }

    @GetMapping("/verify-email")
    public ConnectionCheck verifyEmail() {
        return emailGateway.verifyConnection();
    }

    @GetMapping("/stats")
    public NotificationStats stats() {
        return notificationHistoryService.getStats(ZonedDateTime.now(clock));
    }

    public record TestEmailRequest(@NotBlank @Email String email, String name) {
    }
}
