package com.abba.ainay.application.notification;

import com.abba.ainay.application.dto.DoseAlert;
import com.abba.ainay.application.dto.DoseCandidate;
import com.abba.ainay.application.dto.Recipient;
import com.abba.ainay.domain.model.NotificationChannel;
import com.abba.ainay.domain.model.NotificationTier;
import com.abba.ainay.domain.service.ChannelGateway.DeliveryResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ChannelDispatcher")
class ChannelDispatcherTest {

    private final ChannelDispatcher dispatcher = new ChannelDispatcher();
    private final ExecutorService executor = Executors.newFixedThreadPool(8);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void neverExceedsBatchSizeInFlight() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        FakeChannelGateway gateway = new FakeChannelGateway(NotificationChannel.EMAIL)
                .respondingWith((recipient, alert) -> CompletableFuture.supplyAsync(() -> {
                    int current = inFlight.incrementAndGet();
                    peak.accumulateAndGet(current, Math::max);
                    sleep(20);
                    inFlight.decrementAndGet();
                    return DeliveryResult.delivered(recipient.id());
                }, executor));

        List<DispatchOutcome> outcomes = dispatcher.dispatch(attempts(gateway, 7), 3, Duration.ofSeconds(5));

        assertThat(outcomes).hasSize(7).allMatch(DispatchOutcome::success);
        assertThat(peak.get()).isLessThanOrEqualTo(3);
        assertThat(outcomes).extracting(outcome -> outcome.attempt().recipient().id())
                .containsExactly("r0", "r1", "r2", "r3", "r4", "r5", "r6");
    }

    @Test
    void timedOutAttemptIsAFailureAndDoesNotStallOthers() {
        FakeChannelGateway slow = new FakeChannelGateway(NotificationChannel.PUSH)
                .respondingWith((recipient, alert) -> new CompletableFuture<>());
        FakeChannelGateway fast = new FakeChannelGateway(NotificationChannel.EMAIL);
        List<DispatchAttempt> attempts = new ArrayList<>(attempts(slow, 1));
        attempts.addAll(attempts(fast, 1));

        List<DispatchOutcome> outcomes = dispatcher.dispatch(attempts, 5, Duration.ofMillis(100));

        assertThat(outcomes.get(0).success()).isFalse();
        assertThat(outcomes.get(0).result().error()).contains("timed out");
        assertThat(outcomes.get(1).success()).isTrue();
    }

    @Test
    void exceptionsFromChannelsBecomeFailedResults() {
        FakeChannelGateway throwing = new FakeChannelGateway(NotificationChannel.TELEGRAM)
                .respondingWith((recipient, alert) -> {
                    throw new IllegalStateException("bot offline");
                });
        FakeChannelGateway failingAsync = new FakeChannelGateway(NotificationChannel.EMAIL)
                .respondingWith((recipient, alert) -> CompletableFuture.failedFuture(new RuntimeException("smtp down")));
        List<DispatchAttempt> attempts = new ArrayList<>(attempts(throwing, 1));
        attempts.addAll(attempts(failingAsync, 1));

        List<DispatchOutcome> outcomes = dispatcher.dispatch(attempts, 2, Duration.ofSeconds(1));

        assertThat(outcomes).extracting(outcome -> outcome.result().error())
                .containsExactly("bot offline", "smtp down");
    }

    @Test
    void emptyInputDoesNothing() {
        assertThat(dispatcher.dispatch(List.of(), 3, Duration.ofSeconds(1))).isEmpty();
    }

    private List<DispatchAttempt> attempts(FakeChannelGateway gateway, int count) {
        List<DispatchAttempt> attempts = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            Recipient recipient = new Recipient("r" + i, "Companion " + i, "c" + i + "@example.com", "chat-" + i, List.of("token-" + i));
            DoseCandidate dose = new DoseCandidate("med-" + i, "patient-1", "Lola", "Metformin", "500mg", "8:00 AM", LocalTime.of(8, 0));
            DoseAlert alert = DoseAlert.builder()
                    .kind(DoseAlert.Kind.MISSED_DOSE)
                    .tier(NotificationTier.EMAIL)
                    .medicationId(dose.medicationId())
                    .medicationName(dose.medicationName())
                    .build();
            attempts.add(new DispatchAttempt(dose, recipient, gateway, alert));
        }
        return attempts;
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
