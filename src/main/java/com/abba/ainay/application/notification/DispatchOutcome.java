package com.abba.ainay.application.notification;

import com.abba.ainay.domain.service.ChannelGateway.DeliveryResult;

public record DispatchOutcome(DispatchAttempt attempt, DeliveryResult result) {

    public boolean success() {
        return result.success();
    }
}
