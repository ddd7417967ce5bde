package com.abba.ainay.application.service;

import com.abba.ainay.application.dto.DoseAlert;
import com.abba.ainay.application.dto.DoseCandidate;
import com.abba.ainay.application.dto.Recipient;
import com.abba.ainay.application.notification.ChannelDispatcher;
import com.abba.ainay.application.notification.DispatchAttempt;
import com.abba.ainay.application.notification.DispatchOutcome;
import com.abba.ainay.application.notification.DispatchSettings;
import com.abba.ainay.domain.model.NotificationChannel;
import com.abba.ainay.domain.model.PushSubscription;
import com.abba.ainay.domain.repository.PushSubscriptionRepository;
import com.abba.ainay.domain.service.ChannelGateway;
import com.abba.ainay.domain.service.ChannelGateway.DeliveryResult;
import com.abba.ainay.domain.service.PushSubscriptionService;
import com.abba.ainay.domain.service.TestNotificationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.LocalTime;
import java.util.List;
import java.util.Map;

@Service
@Slf4j
public class TestNotificationServiceImpl implements TestNotificationService {

    static final String DEFAULT_NAME = "Test User";
    static final DoseCandidate SAMPLE_DOSE = new DoseCandidate(
            "test-medication", "test-patient", "Test Patient", "Test Medicine", "500mg", "8:00 AM", LocalTime.of(8, 0));
    private static final double SAMPLE_MINUTES_MISSED = 15;

    private final Map<NotificationChannel, ChannelGateway> gatewaysByChannel;
    private final PushSubscriptionRepository pushSubscriptionRepository;
    private final PushSubscriptionService pushSubscriptionService;
    private final ChannelDispatcher channelDispatcher;
    private final DispatchSettings settings;

    public TestNotificationServiceImpl(List<ChannelGateway> gateways,
                                       PushSubscriptionRepository pushSubscriptionRepository,
                                       PushSubscriptionService pushSubscriptionService,
                                       ChannelDispatcher channelDispatcher,
                                       DispatchSettings settings) {
        this.gatewaysByChannel = ChannelGateway.byChannel(gateways);
        this.pushSubscriptionRepository = pushSubscriptionRepository;
        this.pushSubscriptionService = pushSubscriptionService;
        this.channelDispatcher = channelDispatcher;
        this.settings = settings;
    }

    @Override
    public DeliveryResult sendTestEmail(String email, String name) {
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("email is required");
        }
        String recipientName = name == null || name.isBlank() ? DEFAULT_NAME : name;
        log.info("Sending test email to {}", email);
        return send(NotificationChannel.EMAIL, new Recipient("test-recipient", recipientName, email, null, List.of()));
    }

    @Override
    public DeliveryResult sendTestPush(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        List<String> tokens = pushSubscriptionRepository.findByUserIdIn(List.of(userId)).stream()
                .map(PushSubscription::getToken)
                .toList();
        if (tokens.isEmpty()) {
            return DeliveryResult.failed("No subscriptions found for user");
        }
        log.info("Sending test push to user {} ({} device(s))", userId, tokens.size());
        Recipient recipient = new Recipient(userId, DEFAULT_NAME, null, null, tokens);
        DeliveryResult result = send(NotificationChannel.PUSH, recipient);
        if (result.permanentFailure()) {
            try {
                pushSubscriptionService.deregister(userId, result.staleAddresses());
            } catch (DataAccessException e) {
                log.warn("Could not remove expired push subscriptions for {}: {}", userId, e.getMessage());
            }
        }
        return result;
    }

    private DeliveryResult send(NotificationChannel channel, Recipient recipient) {
        ChannelGateway gateway = gatewaysByChannel.get(channel);
        if (gateway == null || !gateway.isConfigured()) {
            return DeliveryResult.failed(channel == NotificationChannel.EMAIL
                    ? "Email not configured" : "Push notifications not configured");
        }
        DoseAlert alert = DoseAlert.builder()
                .kind(DoseAlert.Kind.MISSED_DOSE)
                .medicationId(SAMPLE_DOSE.medicationId())
                .patientName(SAMPLE_DOSE.patientName())
                .recipientName(recipient.name())
                .medicationName(SAMPLE_DOSE.medicationName())
                .dosage(SAMPLE_DOSE.dosage())
                .scheduledTime(SAMPLE_DOSE.scheduleText())
                .minutesOffset(SAMPLE_MINUTES_MISSED)
                .build();
        List<DispatchOutcome> outcomes = channelDispatcher.dispatch(
                List.of(new DispatchAttempt(SAMPLE_DOSE, recipient, gateway, alert)), 1, settings.sendTimeout());
        return outcomes.get(0).result();
    }
}
