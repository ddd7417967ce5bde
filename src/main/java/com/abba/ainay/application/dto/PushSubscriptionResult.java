package com.abba.ainay.application.dto;

public record PushSubscriptionResult(
        boolean created,
        boolean updated
) {
}
