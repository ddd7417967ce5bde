package com.abba.ainay.application.dto;

import java.util.Map;

public record NotificationStatusView(
        boolean enabled,
        Map<String, Double> tierThresholdMinutes,
        double maxMinutesPast,
        int maxConcurrentSends,
        Map<String, Boolean> channelsConfigured,
        boolean running,
        NotificationStats stats
) {
}
