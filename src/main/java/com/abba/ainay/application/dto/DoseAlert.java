package com.abba.ainay.application.dto;

import com.abba.ainay.domain.model.NotificationTier;
import lombok.Builder;

/**
 * What a channel needs to tell a recipient about one dose. {@code minutesOffset} is minutes
 * overdue for a missed dose and minutes remaining for an upcoming one.
 */
@Builder
public record DoseAlert(
        Kind kind,
        NotificationTier tier,
        String medicationId,
        String patientName,
        String recipientName,
        String medicationName,
        String dosage,
        String scheduledTime,
        double minutesOffset
) {

    public enum Kind {
        MISSED_DOSE,
        UPCOMING_DOSE
    }

    public String summary() {
        if (kind == Kind.UPCOMING_DOSE) {
            return "Reminder for %s (%s) at %s".formatted(medicationName, dosage, scheduledTime);
        }
        return "%s missed %s (%s) scheduled at %s".formatted(patientName, medicationName, dosage, scheduledTime);
    }

    public String relativeTimeText() {
        if (kind == Kind.UPCOMING_DOSE) {
            long minutes = Math.round(minutesOffset);
            return minutes <= 1 ? "now" : "in " + minutes + " minutes";
        }
        if (minutesOffset < 1) {
            return "just now";
        }
        if (minutesOffset < 60) {
            return Math.round(minutesOffset) + " min ago";
        }
        return Math.round(minutesOffset / 60) + " hour(s) ago";
    }
}
