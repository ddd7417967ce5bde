package com.abba.ainay.application.notification;

import com.abba.ainay.domain.model.NotificationTier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a medication's schedule string into a time of day and buckets it into tiers.
 */
@Component
public class ScheduleTimeClassifier {

    private static final Pattern TIME_PATTERN = Pattern.compile("^(\\d{1,2}):(\\d{2})\\s*(AM|PM)?$", Pattern.CASE_INSENSITIVE);
    private static final double MILLIS_PER_MINUTE = 60_000d;

    /**
     * Accepts {@code H:MM}, {@code HH:MM} and {@code H:MM AM/PM}. Anything else, including out of
     * range hours or minutes, yields empty.
     */
    public Optional<LocalTime> parseScheduleTime(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = TIME_PATTERN.matcher(text.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        int hours = Integer.parseInt(matcher.group(1));
        int minutes = Integer.parseInt(matcher.group(2));
        String period = matcher.group(3);
        if (minutes > 59) {
            return Optional.empty();
        }
        if (period != null) {
            if (hours < 1 || hours > 12) {
                return Optional.empty();
            }
            boolean pm = period.toUpperCase(Locale.ROOT).equals("PM");
            if (pm && hours != 12) {
                hours += 12;
            } else if (!pm && hours == 12) {
                hours = 0;
            }
        } else if (hours > 23) {
            return Optional.empty();
        }
        return Optional.of(LocalTime.of(hours, minutes));
    }

    /**
     * Signed minutes between today's occurrence of {@code scheduleTime} and {@code now}; negative
     * while the dose is still upcoming.
     */
    public double minutesSince(LocalTime scheduleTime, ZonedDateTime now) {
        ZonedDateTime scheduled = now.toLocalDate().atTime(scheduleTime).atZone(now.getZone());
        return Duration.between(scheduled, now).toMillis() / MILLIS_PER_MINUTE;
    }

    /**
     * Every tier whose threshold has been reached, in ascending threshold order. Empty once the
     * dose is past {@code ceilingMinutes}.
     */
    public Set<NotificationTier> classify(double minutesSince, TierTable tiers, double ceilingMinutes) {
        if (minutesSince > ceilingMinutes || minutesSince < tiers.smallestThreshold()) {
            return Collections.emptySet();
        }
        Set<NotificationTier> matched = new LinkedHashSet<>();
        for (TierTable.TierThreshold entry : tiers.entries()) {
            if (entry.minutes() <= minutesSince) {
                matched.add(entry.tier());
            }
        }
        return matched;
    }
}
