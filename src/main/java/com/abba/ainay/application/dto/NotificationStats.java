package com.abba.ainay.application.dto;

public record NotificationStats(
        long today,
        long total
) {
}
