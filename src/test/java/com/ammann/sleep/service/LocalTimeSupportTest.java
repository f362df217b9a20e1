/* (C)2026 */
package com.ammann.sleep.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class LocalTimeSupportTest {

    @ParameterizedTest
    @CsvSource({
        "2024-01-05T12:00:00Z,0",
        "2024-01-05T23:00:00Z,660",
        "2024-01-06T00:00:00Z,720",
        "2024-01-06T07:00:00Z,1140",
        "2024-01-06T11:59:00Z,1439"
    })
    void mapsLocalClockToMinutesFromNoon(String instant, double expected) {
        assertThat(LocalTimeSupport.minutesFromNoon(Instant.parse(instant), ZoneOffset.UTC))
                .isEqualTo(expected);
    }

    @Test
    void usesTheNightsZone() {
        Instant instant = Instant.parse("2024-01-05T22:00:00Z");

        assertThat(LocalTimeSupport.minutesFromNoon(instant, ZoneId.of("Europe/Paris")))
                .isEqualTo(660.0);
        assertThat(LocalTimeSupport.minutesFromNoon(instant, ZoneId.of("America/New_York")))
                .isEqualTo(300.0);
    }

    @Test
    void minutesFromNoonStaysWithinOneDay() {
        Instant base = Instant.parse("2024-03-30T00:00:00Z");
        IntStream.range(0, 48 * 60)
                .mapToObj(m -> base.plusSeconds(m * 60L + 59))
                .forEach(t -> assertThat(LocalTimeSupport.minutesFromNoon(t, ZoneId.of("Europe/Berlin")))
                        .isGreaterThanOrEqualTo(0.0)
                        .isLessThan(1440.0));
    }

    @Test
    void secondsAreDropped() {
        assertThat(LocalTimeSupport.minutesFromNoon(Instant.parse("2024-01-05T12:00:30Z"), ZoneOffset.UTC))
                .isEqualTo(0.0);
        assertThat(LocalTimeSupport.minutesFromNoon(Instant.parse("2024-01-05T23:00:59.900Z"), ZoneOffset.UTC))
                .isEqualTo(660.0);
    }

    @Test
    void invalidOrDisabledZonesFallBackToUtc() {
        assertThat(LocalTimeSupport.resolveZone("Mars/Olympus", true)).isEqualTo(ZoneOffset.UTC);
        assertThat(LocalTimeSupport.resolveZone(null, true)).isEqualTo(ZoneOffset.UTC);
        assertThat(LocalTimeSupport.resolveZone("Europe/Paris", false)).isEqualTo(ZoneOffset.UTC);
        assertThat(LocalTimeSupport.resolveZone("Europe/Paris", true)).isEqualTo(ZoneId.of("Europe/Paris"));
    }

    @ParameterizedTest
    @CsvSource({"0,12PM", "60,1PM", "660,11PM", "720,12AM", "780,1AM", "1380,11AM", "1440,12PM", "2160,12AM"})
    void labelsTicksOnTwelveHourClock(int tick, String label) {
        assertThat(LocalTimeSupport.tickLabel(tick)).isEqualTo(label);
    }

    @Test
    void convertsAxisPositionBackToClockMinutes() {
        assertThat(LocalTimeSupport.toMinuteOfDay(660)).isEqualTo(23 * 60);
        assertThat(LocalTimeSupport.toMinuteOfDay(1140)).isEqualTo(7 * 60);
        assertThat(LocalTimeSupport.toMinuteOfDay(0)).isEqualTo(12 * 60);
    }

    @Test
    void alignsOffsetsBeforeTheBaseOntoTheNextDay() {
        assertThat(LocalTimeSupport.alignAfter(100, 660)).isEqualTo(1540.0);
        assertThat(LocalTimeSupport.alignAfter(700, 660)).isEqualTo(700.0);
    }
}
