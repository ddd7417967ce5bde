package com.abba.ainay.application.notification;

import com.abba.ainay.domain.service.ChannelGateway.DeliveryResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs channel sends in fixed-size batches. Every attempt in a batch completes, successfully or
 * not, before the next batch starts, so at most {@code batchSize} sends are in flight.
 */
@Component
@Slf4j
public class ChannelDispatcher {

    public List<DispatchOutcome> dispatch(List<DispatchAttempt> attempts, int batchSize, Duration timeout) {
        if (attempts.isEmpty()) {
            return List.of();
        }
        int size = Math.max(1, batchSize);
        List<DispatchOutcome> outcomes = new ArrayList<>(attempts.size());
        for (int from = 0; from < attempts.size(); from += size) {
            List<DispatchAttempt> batch = attempts.subList(from, Math.min(from + size, attempts.size()));
            log.debug("Dispatching batch of {} send(s) starting at {}", batch.size(), from);
            List<CompletableFuture<DispatchOutcome>> futures = batch.stream()
                    .map(attempt -> start(attempt, timeout))
                    .toList();
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
            futures.forEach(future -> outcomes.add(future.join()));
        }
        return outcomes;
    }

    private CompletableFuture<DispatchOutcome> start(DispatchAttempt attempt, Duration timeout) {
        CompletableFuture<DeliveryResult> send;
        try {
            send = attempt.gateway().send(attempt.recipient(), attempt.alert());
        } catch (RuntimeException e) {
            send = CompletableFuture.failedFuture(e);
        }
        if (send == null) {
            send = CompletableFuture.completedFuture(DeliveryResult.failed("channel returned no result"));
        }
        return send
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .exceptionally(error -> DeliveryResult.failed(describe(error, timeout)))
                .thenApply(result -> new DispatchOutcome(attempt, result));
    }

    private String describe(Throwable error, Duration timeout) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof TimeoutException) {
            return "timed out after " + timeout.toMillis() + "ms";
        }
        return cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
    }
}
