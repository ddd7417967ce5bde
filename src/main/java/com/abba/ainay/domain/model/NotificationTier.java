package com.abba.ainay.domain.model;

import java.util.List;

/**
 * Escalation levels for an overdue dose. Thresholds live in configuration; the enum fixes the
 * channels each level goes out on and the history type it is recorded under.
 */
public enum NotificationTier {

    PUSH_FIRST("push_first", List.of(NotificationChannel.PUSH)),
    PUSH_SECOND("push_second", List.of(NotificationChannel.PUSH)),
    TELEGRAM("telegram", List.of(NotificationChannel.TELEGRAM)),
    EMAIL("email", List.of(NotificationChannel.EMAIL));

    private final String key;
    private final List<NotificationChannel> channels;

    NotificationTier(String key, List<NotificationChannel> channels) {
        this.key = key;
        this.channels = channels;
    }

    public String key() {
        return key;
    }

    public List<NotificationChannel> channels() {
        return channels;
    }

    public NotificationType historyType() {
        return switch (this) {
            case PUSH_FIRST -> NotificationType.MISSED_MEDICATION_PUSH_FIRST;
            case PUSH_SECOND -> NotificationType.MISSED_MEDICATION_PUSH_SECOND;
            case TELEGRAM -> NotificationType.MISSED_MEDICATION_TELEGRAM;
            case EMAIL -> NotificationType.MISSED_MEDICATION_EMAIL;
        };
    }
}
