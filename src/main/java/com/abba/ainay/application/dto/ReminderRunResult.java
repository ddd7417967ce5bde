package com.abba.ainay.application.dto;

import java.util.List;

public record ReminderRunResult(
        int checked,
        int sent,
        List<String> errors,
        List<ReminderDetail> details
) {

    public ReminderRunResult {
        errors = List.copyOf(errors);
        details = List.copyOf(details);
    }

    public static ReminderRunResult empty() {
        return new ReminderRunResult(0, 0, List.of(), List.of());
    }

    public static ReminderRunResult aborted(String error) {
        return new ReminderRunResult(0, 0, List.of(error), List.of());
    }
}
