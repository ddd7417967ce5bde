package com.abba.ainay.application.notification;

import com.abba.ainay.domain.model.NotificationTier;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Immutable tier thresholds, ascending. Construction rejects thresholds that are negative or
 * not strictly increasing in tier order.
 */
public final class TierTable {

    private final List<TierThreshold> entries;

    private TierTable(List<TierThreshold> entries) {
        this.entries = List.copyOf(entries);
    }

    public static TierTable of(Map<NotificationTier, Double> thresholds) {
        if (thresholds == null || thresholds.isEmpty()) {
            throw new IllegalArgumentException("At least one notification tier must be configured");
        }
        List<TierThreshold> entries = new ArrayList<>();
        for (NotificationTier tier : NotificationTier.values()) {
            Double minutes = thresholds.get(tier);
            if (minutes == null) {
                continue;
            }
            if (minutes < 0) {
                throw new IllegalArgumentException("Threshold for tier " + tier + " must not be negative: " + minutes);
            }
            if (!entries.isEmpty() && entries.get(entries.size() - 1).minutes() >= minutes) {
                TierThreshold previous = entries.get(entries.size() - 1);
                throw new IllegalArgumentException("Tier thresholds must be strictly increasing: "
                        + previous.tier() + "=" + previous.minutes() + " is not below " + tier + "=" + minutes);
            }
            entries.add(new TierThreshold(tier, minutes));
        }
        return new TierTable(entries);
    }

    public List<TierThreshold> entries() {
        return entries;
    }

    public List<NotificationTier> tiers() {
        return entries.stream().map(TierThreshold::tier).toList();
    }

    public double smallestThreshold() {
        return entries.get(0).minutes();
    }

    public double largestThreshold() {
        return entries.get(entries.size() - 1).minutes();
    }

    public record TierThreshold(NotificationTier tier, double minutes) {
    }

    @Override
    public String toString() {
        return "TierTable" + entries;
    }
}
