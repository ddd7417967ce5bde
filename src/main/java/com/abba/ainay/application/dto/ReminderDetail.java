package com.abba.ainay.application.dto;

public record ReminderDetail(
        String patient,
        String medication,
        String scheduledTime,
        long minutesUntil,
        boolean email,
        boolean telegram
) {
}
