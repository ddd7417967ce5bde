package com.abba.ainay.infrastructure.telegram;

import com.abba.ainay.application.dto.DoseAlert;
import com.abba.ainay.application.dto.Recipient;
import com.abba.ainay.domain.model.NotificationChannel;
import com.abba.ainay.domain.service.ChannelGateway;
import com.abba.ainay.infrastructure.config.NotificationEngineConfig;
import com.abba.ainay.infrastructure.config.TelegramProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Sends chat messages through the Telegram Bot API to recipients who linked a chat.
 */
@Component
public class TelegramBotGateway implements ChannelGateway {

    private static final Logger log = LoggerFactory.getLogger(TelegramBotGateway.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final TelegramProperties properties;
    private final ObjectMapper objectMapper;
    private final Executor executor;
    private final OkHttpClient client = new OkHttpClient.Builder()
            .connectTimeout(5, TimeUnit.SECONDS)
            .readTimeout(10, TimeUnit.SECONDS)
            .writeTimeout(10, TimeUnit.SECONDS)
            .callTimeout(15, TimeUnit.SECONDS)
            .build();

    public TelegramBotGateway(TelegramProperties properties,
                              ObjectMapper objectMapper,
                              @Qualifier(NotificationEngineConfig.TELEGRAM_EXECUTOR) Executor executor) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.executor = executor;
    }

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.TELEGRAM;
    }

    @Override
    public boolean isConfigured() {
        return properties.isConfigured();
    }

    @Override
    public boolean canReach(Recipient recipient) {
        return recipient.hasTelegram();
    }

    @Override
    public CompletableFuture<DeliveryResult> send(Recipient recipient, DoseAlert alert) {
        if (!recipient.hasTelegram()) {
            return CompletableFuture.completedFuture(DeliveryResult.failed("Recipient not linked to Telegram"));
        }
        if (!properties.isConfigured()) {
            return CompletableFuture.completedFuture(DeliveryResult.failed("Telegram not configured"));
        }
        return CompletableFuture.supplyAsync(() -> sendMessage(recipient, text(alert)), executor);
    }

    private DeliveryResult sendMessage(Recipient recipient, String text) {
        Request request;
        try {
            ObjectNode payload = objectMapper.createObjectNode();
            payload.put("chat_id", recipient.telegramChatId());
            payload.put("text", text);
            payload.put("parse_mode", "Markdown");
            request = new Request.Builder()
                    .url(properties.getApiBaseUrl() + "/bot" + properties.getBotToken() + "/sendMessage")
                    .post(RequestBody.create(objectMapper.writeValueAsString(payload), JSON))
                    .build();
        } catch (IOException e) {
            return DeliveryResult.failed("Could not build Telegram request: " + e.getMessage());
        }

        try (Response response = client.newCall(request).execute()) {
            String body = response.body() != null ? response.body().string() : "";
            JsonNode root = body.isBlank() ? objectMapper.createObjectNode() : objectMapper.readTree(body);
            if (!response.isSuccessful() || !root.path("ok").asBoolean(false)) {
                String description = root.path("description").asText("status=" + response.code());
                log.warn("Telegram rejected message to chat {}: {}", recipient.telegramChatId(), description);
                return DeliveryResult.failed(description);
            }
            String messageId = root.path("result").path("message_id").asText(null);
            log.info("Telegram message sent to {} ({})", recipient.name(), recipient.telegramChatId());
            return DeliveryResult.delivered(messageId);
        } catch (IOException e) {
            log.error("Error sending Telegram message to chat {}", recipient.telegramChatId(), e);
            return DeliveryResult.failed(e.getMessage());
        }
    }

    String text(DoseAlert alert) {
        if (alert.kind() == DoseAlert.Kind.UPCOMING_DOSE) {
            return "💊 *Medication Reminder*\n\n"
                    + "Hi " + alert.recipientName() + "! Time to take your medication " + alert.relativeTimeText() + ".\n\n"
                    + "Medicine: *" + alert.medicationName() + "*\n"
                    + "Dosage: " + alert.dosage() + "\n"
                    + "Scheduled: " + alert.scheduledTime();
        }
        return "🚨 *Missed Medication Alert*\n\n"
                + "Patient: *" + alert.patientName() + "*\n"
                + "Medicine: *" + alert.medicationName() + "*\n"
                + "Dosage: " + alert.dosage() + "\n"
                + "Scheduled: " + alert.scheduledTime() + "\n"
                + "Missed: " + alert.relativeTimeText() + "\n\n"
                + "Please check on " + alert.patientName() + " and remind them to take their medication.";
    }
}
