package com.abba.ainay.application.notification;

import com.abba.ainay.domain.model.NotificationTier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("ScheduleTimeClassifier")
class ScheduleTimeClassifierTest {

    private static final ZoneId ZONE = ZoneId.of("Asia/Manila");

    private final ScheduleTimeClassifier classifier = new ScheduleTimeClassifier();

    private final TierTable tiers = TierTable.of(Map.of(
            NotificationTier.PUSH_FIRST, 0.5,
            NotificationTier.PUSH_SECOND, 1.0,
            NotificationTier.TELEGRAM, 1.5,
            NotificationTier.EMAIL, 3.0));

    @Nested
    @DisplayName("parseScheduleTime")
    class Parsing {

        @Test
        void twelveAndTwentyFourHourFormsAgree() {
            assertThat(classifier.parseScheduleTime("8:00 AM")).contains(LocalTime.of(8, 0));
            assertThat(classifier.parseScheduleTime("08:00")).contains(LocalTime.of(8, 0));
        }

        @Test
        void normalizesMidnightAndNoon() {
            assertThat(classifier.parseScheduleTime("12:00 AM")).contains(LocalTime.MIDNIGHT);
            assertThat(classifier.parseScheduleTime("12:15 PM")).contains(LocalTime.of(12, 15));
            assertThat(classifier.parseScheduleTime("2:30 pm")).contains(LocalTime.of(14, 30));
            assertThat(classifier.parseScheduleTime("9:05AM")).contains(LocalTime.of(9, 5));
        }

        @Test
        void acceptsTwentyFourHourEvening() {
            assertThat(classifier.parseScheduleTime("14:30")).contains(LocalTime.of(14, 30));
            assertThat(classifier.parseScheduleTime(" 7:45 ")).contains(LocalTime.of(7, 45));
        }

        @ParameterizedTest
        @ValueSource(strings = {"13:65", "garbage", "24:00", "13:00 PM", "0:30 AM", "8", "8:0", "", "8:00 XM"})
        void rejectsMalformedOrOutOfRange(String text) {
            assertThat(classifier.parseScheduleTime(text)).isEmpty();
        }

        @Test
        void rejectsNull() {
            assertThat(classifier.parseScheduleTime(null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("minutesSince")
    class MinutesSince {

        @Test
        void keepsSubMinutePrecision() {
            ZonedDateTime now = ZonedDateTime.of(2026, 3, 10, 8, 0, 30, 0, ZONE);
            assertThat(classifier.minutesSince(LocalTime.of(8, 0), now)).isCloseTo(0.5, within(1e-9));
        }

        @Test
        void isNegativeWhileUpcoming() {
            ZonedDateTime now = ZonedDateTime.of(2026, 3, 10, 7, 55, 0, 0, ZONE);
            assertThat(classifier.minutesSince(LocalTime.of(8, 0), now)).isCloseTo(-5.0, within(1e-9));
        }
    }

    @Nested
    @DisplayName("classify")
    class Classify {

        @Test
        void ninetySecondsLateMatchesFirstThreeTiers() {
            ZonedDateTime now = ZonedDateTime.of(2026, 3, 10, 8, 1, 30, 0, ZONE);
            double minutes = classifier.minutesSince(LocalTime.of(8, 0), now);

            assertThat(classifier.classify(minutes, tiers, 120))
                    .containsExactly(NotificationTier.PUSH_FIRST, NotificationTier.PUSH_SECOND, NotificationTier.TELEGRAM);
        }

        @Test
        void laterTierImpliesEveryEarlierTier() {
            assertThat(classifier.classify(3.0, tiers, 120))
                    .containsExactly(NotificationTier.PUSH_FIRST, NotificationTier.PUSH_SECOND,
                            NotificationTier.TELEGRAM, NotificationTier.EMAIL);
        }

        @Test
        void nothingBeforeSmallestThreshold() {
            assertThat(classifier.classify(0.4, tiers, 120)).isEmpty();
            assertThat(classifier.classify(-10, tiers, 120)).isEmpty();
        }

        @Test
        void nothingPastTheCeiling() {
            assertThat(classifier.classify(120, tiers, 120)).hasSize(4);
            assertThat(classifier.classify(120.01, tiers, 120)).isEmpty();
        }
    }
}
