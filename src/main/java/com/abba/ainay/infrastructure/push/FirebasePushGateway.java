package com.abba.ainay.infrastructure.push;

import com.abba.ainay.application.dto.DoseAlert;
import com.abba.ainay.application.dto.Recipient;
import com.abba.ainay.domain.model.NotificationChannel;
import com.abba.ainay.domain.service.ChannelGateway;
import com.abba.ainay.infrastructure.config.NotificationEngineConfig;
import com.abba.ainay.infrastructure.config.PushProperties;
import com.google.firebase.messaging.FirebaseMessaging;
import com.google.firebase.messaging.FirebaseMessagingException;
import com.google.firebase.messaging.Message;
import com.google.firebase.messaging.MessagingErrorCode;
import com.google.firebase.messaging.Notification;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Delivers to every registration token a recipient holds. The send succeeds when at least one
 * token accepts the message; tokens Firebase reports as unregistered or invalid come back as stale.
 */
@Component
@Slf4j
public class FirebasePushGateway implements ChannelGateway {

    private final ObjectProvider<FirebaseMessaging> messagingProvider;
    private final PushProperties properties;
    private final Executor executor;

    public FirebasePushGateway(ObjectProvider<FirebaseMessaging> messagingProvider,
                               PushProperties properties,
                               @Qualifier(NotificationEngineConfig.PUSH_EXECUTOR) Executor executor) {
        this.messagingProvider = messagingProvider;
        this.properties = properties;
        this.executor = executor;
    }

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.PUSH;
    }

    @Override
    public boolean isConfigured() {
        return properties.isEnabled() && messagingProvider.getIfAvailable() != null;
    }

    @Override
    public boolean canReach(Recipient recipient) {
        return recipient.hasPush();
    }

    @Override
    public CompletableFuture<DeliveryResult> send(Recipient recipient, DoseAlert alert) {
        if (!recipient.hasPush()) {
            return CompletableFuture.completedFuture(DeliveryResult.failed("No subscriptions found for user"));
        }
        FirebaseMessaging messaging = messagingProvider.getIfAvailable();
        if (messaging == null) {
            return CompletableFuture.completedFuture(DeliveryResult.failed("Push notifications not configured"));
        }
        return CompletableFuture.supplyAsync(() -> deliver(messaging, recipient, alert), executor);
    }

    private DeliveryResult deliver(FirebaseMessaging messaging, Recipient recipient, DoseAlert alert) {
        List<String> stale = new ArrayList<>();
        String firstMessageId = null;
        String lastError = null;
        int sent = 0;

        for (String token : recipient.pushTokens()) {
            try {
                String messageId = messaging.send(buildMessage(token, alert));
                sent++;
                if (firstMessageId == null) {
                    firstMessageId = messageId;
                }
            } catch (FirebaseMessagingException e) {
                log.warn("Push to user {} failed: code={} message={}", recipient.id(), e.getMessagingErrorCode(), e.getMessage());
                lastError = e.getMessage();
                if (isStale(e.getMessagingErrorCode(), e.getMessage())) {
                    stale.add(token);
                }
            }
        }

        if (sent > 0) {
            log.debug("Push sent to {}/{} device(s) of user {}", sent, recipient.pushTokens().size(), recipient.id());
            return new DeliveryResult(true, firstMessageId, stale, null);
        }
        return new DeliveryResult(false, null, stale, lastError == null ? "Push delivery failed" : lastError);
    }

    /**
     * A token is gone for good when FCM reports it unregistered, or rejects the token itself as
     * malformed. Other {@code INVALID_ARGUMENT} errors are about the payload and say nothing about
     * the device.
     */
    static boolean isStale(MessagingErrorCode code, String message) {
        if (code == MessagingErrorCode.UNREGISTERED) {
            return true;
        }
        return code == MessagingErrorCode.INVALID_ARGUMENT
                && message != null
                && message.toLowerCase(Locale.ROOT).contains("registration token");
    }

    Message buildMessage(String token, DoseAlert alert) {
        boolean upcoming = alert.kind() == DoseAlert.Kind.UPCOMING_DOSE;
        String title = upcoming ? "Medication Reminder" : "Missed Medication Alert";
        String tier = alert.tier() == null ? "reminder" : alert.tier().key();
        return Message.builder()
                .setToken(token)
                .setNotification(Notification.builder()
                        .setTitle(title)
                        .setBody(alert.summary())
                        .build())
                .putData("type", upcoming ? "medication_reminder" : "missed_medication")
                .putData("tier", tier)
                .putData("medicationId", alert.medicationId() == null ? "" : alert.medicationId())
                .putData("medicationName", alert.medicationName() == null ? "" : alert.medicationName())
                .putData("scheduledTime", alert.scheduledTime() == null ? "" : alert.scheduledTime())
                .putData("minutesMissed", String.valueOf(Math.round(alert.minutesOffset())))
                .putData("url", properties.getClickUrl())
                .build();
    }
}
