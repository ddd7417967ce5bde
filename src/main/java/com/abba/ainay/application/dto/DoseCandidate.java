package com.abba.ainay.application.dto;

import java.time.LocalTime;

public record DoseCandidate(
        String medicationId,
        String patientId,
        String patientName,
        String medicationName,
        String dosage,
        String scheduleText,
        LocalTime scheduleTime
) {
}
