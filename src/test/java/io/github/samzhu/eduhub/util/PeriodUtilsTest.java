package io.github.samzhu.eduhub.util;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import org.junit.jupiter.api.Test;

class PeriodUtilsTest {

    private final Clock clock = Clock.fixed(Instant.parse("2025-06-30T12:00:00Z"), ZoneOffset.UTC);

    @Test
    void monthsAgoShouldCountThirtyDaysPerMonth() {
        // When
        Instant from = PeriodUtils.monthsAgo(clock, 6);

        // Then
        assertThat(from).isEqualTo(Instant.parse("2025-01-01T12:00:00Z"));
    }

    @Test
    void nextDaysShouldStartNow() {
        // When
        PeriodUtils.Window window = PeriodUtils.nextDays(clock, 7);

        // Then
        assertThat(window.from()).isEqualTo(clock.instant());
        assertThat(window.to()).isEqualTo(Instant.parse("2025-07-07T12:00:00Z"));
    }
}
