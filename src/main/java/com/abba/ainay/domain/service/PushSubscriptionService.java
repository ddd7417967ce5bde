package com.abba.ainay.domain.service;

import com.abba.ainay.application.dto.PushSubscriptionResult;

import java.util.Collection;

public interface PushSubscriptionService {

    PushSubscriptionResult subscribe(String userId, String token);

    boolean unsubscribe(String userId, String token);

    int deregister(String userId, Collection<String> tokens);

    boolean hasSubscriptions(String userId);
}
