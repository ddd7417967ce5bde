package com.abba.ainay.domain.service;

import com.abba.ainay.application.dto.NotificationRunResult;

import java.util.Optional;

public interface MissedDoseNotificationService {

    /**
     * Runs one detection and dispatch pass. Empty when another pass is still in flight.
     */
    Optional<NotificationRunResult> checkAndNotifyMissedDoses();

    boolean isRunning();
}
