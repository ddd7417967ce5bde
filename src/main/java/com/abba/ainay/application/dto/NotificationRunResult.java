package com.abba.ainay.application.dto;

import java.util.List;

public record NotificationRunResult(
        int checked,
        int notified,
        int pushSent,
        int telegramSent,
        int emailSent,
        int recorded,
        List<String> errors,
        List<NotificationDetail> details
) {

    public NotificationRunResult {
        errors = List.copyOf(errors);
        details = List.copyOf(details);
    }

    public static NotificationRunResult empty() {
        return new NotificationRunResult(0, 0, 0, 0, 0, 0, List.of(), List.of());
    }

    public static NotificationRunResult aborted(int checked, String error) {
        return new NotificationRunResult(checked, 0, 0, 0, 0, 0, List.of(error), List.of());
    }
}
