package com.abba.ainay.domain.service;

import com.abba.ainay.application.dto.ReminderRunResult;

import java.util.Optional;

public interface PatientReminderService {

    Optional<ReminderRunResult> checkAndSendReminders();
}
