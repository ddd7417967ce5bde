package com.abba.ainay.infrastructure.telegram;

import com.abba.ainay.application.dto.DoseAlert;
import com.abba.ainay.application.dto.Recipient;
import com.abba.ainay.domain.model.NotificationTier;
import com.abba.ainay.domain.service.ChannelGateway.DeliveryResult;
import com.abba.ainay.infrastructure.config.TelegramProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TelegramBotGateway")
class TelegramBotGatewayTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Recipient recipient = new Recipient("c-1", "Ana", null, "4242", List.of());
    private final DoseAlert alert = DoseAlert.builder()
            .kind(DoseAlert.Kind.MISSED_DOSE)
            .tier(NotificationTier.TELEGRAM)
            .medicationId("med-1")
            .patientName("Lola")
            .recipientName("Ana")
            .medicationName("Metformin")
            .dosage("500mg")
            .scheduledTime("8:00 AM")
            .minutesOffset(1.5)
            .build();

    private MockWebServer server;
    private TelegramProperties properties;
    private TelegramBotGateway gateway;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        properties = new TelegramProperties();
        properties.setApiBaseUrl(server.url("/").toString().replaceAll("/$", ""));
        properties.setBotToken("TEST-TOKEN");
        gateway = new TelegramBotGateway(properties, objectMapper, Runnable::run);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    @DisplayName("posts a markdown message to the bot's chat endpoint")
    void postsMessage() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"ok\":true,\"result\":{\"message_id\":99}}"));

        DeliveryResult result = gateway.send(recipient, alert).join();

        assertThat(result.success()).isTrue();
        assertThat(result.messageId()).isEqualTo("99");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/botTEST-TOKEN/sendMessage");
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertThat(body.path("chat_id").asText()).isEqualTo("4242");
        assertThat(body.path("parse_mode").asText()).isEqualTo("Markdown");
        assertThat(body.path("text").asText()).contains("Missed Medication Alert", "Lola", "Metformin", "2 min ago");
    }

    @Test
    @DisplayName("reports the API's description when Telegram refuses")
    void reportsRefusal() {
        server.enqueue(new MockResponse().setResponseCode(403)
                .setBody("{\"ok\":false,\"description\":\"Forbidden: bot was blocked by the user\"}"));

        DeliveryResult result = gateway.send(recipient, alert).join();

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("blocked by the user");
        assertThat(result.permanentFailure()).isFalse();
    }

    @Test
    @DisplayName("fails without a network call when the recipient has no chat")
    void unlinkedRecipient() {
        Recipient unlinked = new Recipient("c-2", "Beto", "b@example.com", null, List.of());

        DeliveryResult result = gateway.send(unlinked, alert).join();

        assertThat(result.success()).isFalse();
        assertThat(gateway.canReach(unlinked)).isFalse();
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    @DisplayName("is not configured without a bot token")
    void requiresToken() {
        properties.setBotToken(" ");

        assertThat(gateway.isConfigured()).isFalse();
        assertThat(gateway.send(recipient, alert).join().error()).isEqualTo("Telegram not configured");
    }

    @Test
    @DisplayName("reminder text addresses the patient")
    void reminderText() {
        DoseAlert reminder = DoseAlert.builder()
                .kind(DoseAlert.Kind.UPCOMING_DOSE)
                .recipientName("Lola")
                .medicationName("Metformin")
                .dosage("500mg")
                .scheduledTime("8:00 AM")
                .minutesOffset(5)
                .build();

        assertThat(gateway.text(reminder)).contains("Medication Reminder", "Hi Lola", "in 5 minutes");
    }
}
