package com.abba.ainay.infrastructure.web;

import com.abba.ainay.application.dto.ConnectionCheck;
import com.abba.ainay.application.dto.NotificationRunResult;
import com.abba.ainay.application.dto.NotificationStats;
import com.abba.ainay.application.notification.DispatchSettings;
import com.abba.ainay.application.notification.TierTable;
import com.abba.ainay.domain.model.NotificationTier;
import com.abba.ainay.domain.service.MissedDoseNotificationService;
import com.abba.ainay.domain.service.ChannelGateway.DeliveryResult;
import com.abba.ainay.domain.service.NotificationHistoryService;
import com.abba.ainay.domain.service.TestNotificationService;
import com.abba.ainay.infrastructure.email.SmtpEmailGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@DisplayName("NotificationController")
class NotificationControllerTest {

    @Mock
    private MissedDoseNotificationService missedDoseNotificationService;
    @Mock
    private NotificationHistoryService notificationHistoryService;
    @Mock
    private TestNotificationService testNotificationService;
    @Mock
    private SmtpEmailGateway emailGateway;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        DispatchSettings settings = new DispatchSettings(true,
                TierTable.of(Map.of(NotificationTier.PUSH_FIRST, 0.5, NotificationTier.EMAIL, 3.0)),
                120, 10, Duration.ofSeconds(10));
        NotificationController controller = new NotificationController(missedDoseNotificationService,
                notificationHistoryService, testNotificationService, emailGateway, List.of(), settings,
                Clock.fixed(Instant.parse("2026-03-10T08:00:00Z"), ZoneOffset.UTC));
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("manual check returns the run summary")
    void manualCheck() throws Exception {
        when(missedDoseNotificationService.checkAndNotifyMissedDoses()).thenReturn(Optional.of(
                new NotificationRunResult(4, 2, 1, 1, 0, 2, List.of(), List.of())));

        mockMvc.perform(post("/api/notifications/check"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.checked").value(4))
                .andExpect(jsonPath("$.pushSent").value(1))
                .andExpect(jsonPath("$.errors").isEmpty());
    }

    @Test
    @DisplayName("manual check while a run is in flight answers 409")
    void busy() throws Exception {
        when(missedDoseNotificationService.checkAndNotifyMissedDoses()).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/notifications/check")).andExpect(status().isConflict());
    }

    @Test
    @DisplayName("status lists tier thresholds in order")
    void statusView() throws Exception {
        when(notificationHistoryService.getStats(any())).thenReturn(new NotificationStats(3, 40));

        mockMvc.perform(get("/api/notifications/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tierThresholdMinutes.push_first").value(0.5))
                .andExpect(jsonPath("$.tierThresholdMinutes.email").value(3.0));
    }

    @Test
    @DisplayName("store failures answer 503")
    void storeDown() throws Exception {
        when(notificationHistoryService.getStats(any()))
                .thenThrow(new DataAccessResourceFailureException("down"));

        mockMvc.perform(get("/api/notifications/stats")).andExpect(status().isServiceUnavailable());
    }

    @Test
    @DisplayName("test send mails the sample alert and returns the delivery result")
    void testSend() throws Exception {
        when(testNotificationService.sendTestEmail("ops@example.com", "Ops"))
                .thenReturn(DeliveryResult.delivered("<abc@ainay>"));

        mockMvc.perform(post("/api/notifications/test")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"ops@example.com\",\"name\":\"Ops\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.messageId").value("<abc@ainay>"));
    }

    @Test
    @DisplayName("test send without a valid address answers 400")
    void testSendValidation() throws Exception {
        mockMvc.perform(post("/api/notifications/test")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"not-an-address\"}"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(testNotificationService);
    }

    @Test
    @DisplayName("verify-email reports the SMTP check")
    void verifyEmail() throws Exception {
        when(emailGateway.verifyConnection()).thenReturn(ConnectionCheck.failed("Email not configured"));

        mockMvc.perform(get("/api/notifications/verify-email"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("Email not configured"));
    }
}
