package com.abba.ainay.application.dto;

import com.abba.ainay.domain.model.NotificationChannel;
import com.abba.ainay.domain.model.NotificationTier;

public record NotificationDetail(
        String medication,
        String patient,
        String companion,
        NotificationTier tier,
        NotificationChannel channel,
        double minutesMissed,
        String messageId
) {
}
