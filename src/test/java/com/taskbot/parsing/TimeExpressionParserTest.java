package com.taskbot.parsing;

import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class TimeExpressionParserTest {

    private static final ZoneId ZONE = ZoneId.of("Asia/Karachi");
    // Tuesday, 10:00
    private static final ZonedDateTime NOW = ZonedDateTime.of(2026, 3, 10, 10, 0, 0, 0, ZONE);

    private final TimeExpressionParser parser = new TimeExpressionParser();

    @Test
    void relativeMinutesAreAddedToNow() {
        Optional<OffsetDateTime> time = parser.resolve("in 30 minutes", NOW);

        assertThat(time).contains(at(2026, 3, 10, 10, 30));
    }

    @Test
    void dayWordWithTwelveHourClock() {
        assertThat(parser.resolve("at 3pm tomorrow", NOW)).contains(at(2026, 3, 11, 15, 0));
    }

    @Test
    void bareTimeAlreadyPassedRollsToTomorrow() {
        assertThat(parser.resolve("8am", NOW)).contains(at(2026, 3, 11, 8, 0));
        assertThat(parser.resolve("at 14:45", NOW)).contains(at(2026, 3, 10, 14, 45));
    }

    @Test
    void tonightDefaultsToEvening() {
        assertThat(parser.resolve("tonight", NOW)).contains(at(2026, 3, 10, 20, 0));
    }

    @Test
    void weekdayWithoutTimeDefaultsToMorning() {
        assertThat(parser.resolve("friday 10:30", NOW)).contains(at(2026, 3, 13, 10, 30));
        assertThat(parser.resolve("next monday", NOW)).contains(at(2026, 3, 16, 9, 0));
    }

    @Test
    void pastMonthDayWithoutYearMovesToNextYear() {
        assertThat(parser.resolve("15 jan at 2pm", NOW)).contains(at(2027, 1, 15, 14, 0));
    }

    @Test
    void numericDateIsDayFirst() {
        assertThat(parser.resolve("5/4/2026 at 9:15", NOW)).contains(at(2026, 4, 5, 9, 15));
    }

    @Test
    void yearlessNumericPairNeedsDatePrefix() {
        Optional<TimeExpressionParser.Extraction> counted = parser.extract("call 2-3 clients at 5pm", NOW);

        assertThat(counted).isPresent();
        assertThat(counted.get().time()).isEqualTo(at(2026, 3, 10, 17, 0));
        assertThat(counted.get().remainder()).contains("2-3 clients");
        assertThat(parser.resolve("on 20/3 at 9am", NOW)).contains(at(2026, 3, 20, 9, 0));
    }

    @Test
    void isoLocalDateTimeUsesOperatingZone() {
        assertThat(parser.resolve("2026-03-12T14:00", NOW)).contains(at(2026, 3, 12, 14, 0));
    }

    @Test
    void extractReturnsRemainingText() {
        Optional<TimeExpressionParser.Extraction> extraction = parser.extract("call the bank at 3pm tomorrow", NOW);

        assertThat(extraction).isPresent();
        assertThat(extraction.get().remainder()).isEqualTo("call the bank");
        assertThat(extraction.get().time()).isEqualTo(at(2026, 3, 11, 15, 0));
    }

    @Test
    void textWithoutTimeIsNotRecognized() {
        assertThat(parser.resolve("call mom", NOW)).isEmpty();
        assertThat(parser.looksLikeTime("Budget review", NOW)).isFalse();
        assertThat(parser.looksLikeTime("noon", NOW)).isTrue();
    }

    private static OffsetDateTime at(int year, int month, int day, int hour, int minute) {
        return ZonedDateTime.of(year, month, day, hour, minute, 0, 0, ZONE).toOffsetDateTime();
    }
}
