package com.abba.ainay.application.notification;

import java.time.Duration;

/**
 * Run-time view of the engine configuration, fixed when the context starts.
 */
public record DispatchSettings(
        boolean enabled,
        TierTable tiers,
        double maxMinutesPast,
        int maxConcurrentSends,
        Duration sendTimeout
) {

    public DispatchSettings {
        if (tiers == null) {
            throw new IllegalArgumentException("tiers must be provided");
        }
        if (maxMinutesPast < tiers.largestThreshold()) {
            throw new IllegalArgumentException("maxMinutesPast (" + maxMinutesPast
                    + ") must not be below the largest tier threshold (" + tiers.largestThreshold() + ")");
        }
        if (maxConcurrentSends < 1) {
            throw new IllegalArgumentException("maxConcurrentSends must be at least 1");
        }
        if (sendTimeout == null || sendTimeout.isNegative() || sendTimeout.isZero()) {
            throw new IllegalArgumentException("sendTimeout must be positive");
        }
    }
}
