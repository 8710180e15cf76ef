package io.nooa.core.cron;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class ScheduleCalculatorTest {
    private static final Instant FROM = Instant.parse("2026-03-01T10:00:00Z");

    @Test
    void shouldAddIntervalToReferenceInstant() {
        assertThat(ScheduleCalculator.computeNextRun("30s", FROM)).isEqualTo(FROM.plusSeconds(30));
        assertThat(ScheduleCalculator.computeNextRun("5m", FROM)).isEqualTo(FROM.plus(Duration.ofMinutes(5)));
        assertThat(ScheduleCalculator.computeNextRun("6H", FROM)).isEqualTo(FROM.plus(Duration.ofHours(6)));
        assertThat(ScheduleCalculator.computeNextRun("2d", FROM)).isEqualTo(FROM.plus(Duration.ofDays(2)));
    }

    @Test
    void shouldSupportHourlyAndDailyMacros() {
        assertThat(ScheduleCalculator.computeNextRun("@hourly", FROM)).isEqualTo(FROM.plus(Duration.ofHours(1)));
        assertThat(ScheduleCalculator.computeNextRun("@daily", FROM)).isEqualTo(FROM.plus(Duration.ofDays(1)));
    }

    @Test
    void shouldFallBackToOneMinuteForUnknownSchedules() {
        assertThat(ScheduleCalculator.computeNextRun("every tuesday", FROM)).isEqualTo(FROM.plusSeconds(60));
        assertThat(ScheduleCalculator.computeNextRun("*/5 * * * *", FROM)).isEqualTo(FROM.plusSeconds(60));
        assertThat(ScheduleCalculator.isValid("every tuesday")).isFalse();
    }

    @Test
    void shouldTreatInstantsAsOneShot() {
        Instant at = Instant.parse("2026-03-02T08:30:00Z");

        assertThat(ScheduleCalculator.computeNextRun("2026-03-02T08:30:00Z", FROM)).isEqualTo(at);
        assertThat(ScheduleCalculator.computeNextRun("at 2026-03-02T08:30:00Z", FROM)).isEqualTo(at);
        assertThat(ScheduleCalculator.isOneShot("at 2026-03-02T08:30:00Z")).isTrue();
        assertThat(ScheduleCalculator.isOneShot("5m")).isFalse();
    }

    @Test
    void shouldRejectZeroIntervals() {
        assertThat(ScheduleCalculator.isValid("0m")).isFalse();
        assertThat(ScheduleCalculator.isValid("1m")).isTrue();
        assertThat(ScheduleCalculator.isValid("@daily")).isTrue();
    }

    @Test
    void shouldOnlyReportParseableNextRunsAsDue() {
        assertThat(ScheduleCalculator.isDue(FROM, "2026-03-01T09:59:59Z")).isTrue();
        assertThat(ScheduleCalculator.isDue(FROM, FROM.toString())).isTrue();
        assertThat(ScheduleCalculator.isDue(FROM, "2026-03-01T10:00:01Z")).isFalse();
        assertThat(ScheduleCalculator.isDue(FROM, "not a date")).isFalse();
        assertThat(ScheduleCalculator.isDue(FROM, null)).isFalse();
    }

    @Test
    void shouldRejectIntervalsThatOverflowOrExceedTheLimit() {
        assertThat(ScheduleCalculator.isValid("99999999999999d")).isFalse();
        assertThat(ScheduleCalculator.isValid("200000000000000d")).isFalse();
        assertThat(ScheduleCalculator.isValid("99999999999999999999999s")).isFalse();
        assertThat(ScheduleCalculator.isValid("36500d")).isTrue();
        assertThat(ScheduleCalculator.isValid("36501d")).isFalse();
        assertThat(ScheduleCalculator.interval("200000000000000d")).isEmpty();
    }

    @Test
    void shouldFallBackInsteadOfThrowingNearTheEndOfTime() {
        Instant nearMax = Instant.MAX.minusSeconds(3_600);

        assertThat(ScheduleCalculator.computeNextRun("99999999999999d", FROM)).isEqualTo(FROM.plusSeconds(60));
        assertThat(ScheduleCalculator.computeNextRun("36500d", nearMax)).isEqualTo(nearMax.plusSeconds(60));
    }
}
