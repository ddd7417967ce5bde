package com.abba.ainay.domain.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

public enum NotificationType {

    /**
     * Single-tier email alert written before tiers existed. Counts as the email tier.
     */
    MISSED_MEDICATION,
    MISSED_MEDICATION_PUSH_FIRST,
    MISSED_MEDICATION_PUSH_SECOND,
    MISSED_MEDICATION_TELEGRAM,
    MISSED_MEDICATION_EMAIL,
    MEDICATION_REMINDER;

    public Optional<NotificationTier> tier() {
        return switch (this) {
            case MISSED_MEDICATION, MISSED_MEDICATION_EMAIL -> Optional.of(NotificationTier.EMAIL);
            case MISSED_MEDICATION_PUSH_FIRST -> Optional.of(NotificationTier.PUSH_FIRST);
            case MISSED_MEDICATION_PUSH_SECOND -> Optional.of(NotificationTier.PUSH_SECOND);
            case MISSED_MEDICATION_TELEGRAM -> Optional.of(NotificationTier.TELEGRAM);
            case MEDICATION_REMINDER -> Optional.empty();
        };
    }

    public static List<NotificationType> tierTypes() {
        return Arrays.stream(values())
                .filter(type -> type.tier().isPresent())
                .toList();
    }
}
