package com.abba.ainay.application.service;

import com.abba.ainay.application.dto.PushSubscriptionResult;
import com.abba.ainay.domain.model.PushSubscription;
import com.abba.ainay.domain.repository.PushSubscriptionRepository;
import com.abba.ainay.domain.service.PushSubscriptionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;

@Service
@Slf4j
@RequiredArgsConstructor
public class PushSubscriptionServiceImpl implements PushSubscriptionService {

    private final PushSubscriptionRepository pushSubscriptionRepository;
    private final Clock clock;

    @Override
    public PushSubscriptionResult subscribe(String userId, String token) {
        if (userId == null || userId.isBlank() || token == null || token.isBlank()) {
            throw new IllegalArgumentException("userId and token are required");
        }
        Instant now = Instant.now(clock);
        return pushSubscriptionRepository.findByUserIdAndToken(userId, token)
                .map(existing -> {
                    existing.setUpdatedAt(now);
                    pushSubscriptionRepository.save(existing);
                    log.debug("Refreshed push subscription for user {}", userId);
                    return new PushSubscriptionResult(false, true);
                })
                .orElseGet(() -> {
                    PushSubscription subscription = new PushSubscription();
                    subscription.setUserId(userId);
                    subscription.setToken(token);
                    subscription.setCreatedAt(now);
                    subscription.setUpdatedAt(now);
                    pushSubscriptionRepository.save(subscription);
                    log.info("Created push subscription for user {}", userId);
                    return new PushSubscriptionResult(true, false);
                });
    }

    @Override
    public boolean unsubscribe(String userId, String token) {
        long removed = pushSubscriptionRepository.deleteByUserIdAndToken(userId, token);
        log.info("Push subscription removed for user {}: {}", userId, removed > 0);
        return removed > 0;
    }

    @Override
    public int deregister(String userId, Collection<String> tokens) {
        int removed = 0;
        for (String token : tokens) {
            removed += (int) pushSubscriptionRepository.deleteByUserIdAndToken(userId, token);
        }
        return removed;
    }

    @Override
    public boolean hasSubscriptions(String userId) {
        return pushSubscriptionRepository.countByUserId(userId) > 0;
    }
}
