package io.taskrunner4j.utils;

import io.taskrunner4j.core.ScheduleSpec;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TriggerCalculatorTest {

    private static final Instant JAN_1_10AM = Instant.parse("2024-01-01T10:00:00Z");

    @Test
    void dailyMidnightCronShouldFireAtNextMidnight() {
        Optional<Instant> next = TriggerCalculator.nextFireTime(ScheduleSpec.cron("0 0 * * *", "UTC"), JAN_1_10AM, null);

        assertThat(next).contains(Instant.parse("2024-01-02T00:00:00Z"));
    }

    @Test
    void cronShouldBeStrictlyAfterNow() {
        Instant midnight = Instant.parse("2024-01-02T00:00:00Z");

        Optional<Instant> next = TriggerCalculator.nextFireTime(ScheduleSpec.cron("0 0 * * *", "UTC"), midnight, null);

        assertThat(next).contains(Instant.parse("2024-01-03T00:00:00Z"));
    }

    @Test
    void restrictedDayAndWeekdayShouldMatchEither() {
        // the 13th, or any Friday; 2024-01-01 is a Monday
        ScheduleSpec spec = ScheduleSpec.cron("0 0 13 * 5", "UTC");

        assertThat(TriggerCalculator.nextFireTime(spec, JAN_1_10AM, null))
                .contains(Instant.parse("2024-01-05T00:00:00Z"));
        assertThat(TriggerCalculator.nextFireTime(spec, Instant.parse("2024-01-12T10:00:00Z"), null))
                .contains(Instant.parse("2024-01-13T00:00:00Z"));
    }

    @Test
    void weekdayRangeWithUnrestrictedDayShouldSkipWeekend() {
        Instant saturdayNoon = Instant.parse("2024-01-06T12:00:00Z");

        Optional<Instant> next = TriggerCalculator.nextFireTime(
                ScheduleSpec.cron("30 9 * * mon-fri", "UTC"), saturdayNoon, null);

        assertThat(next).contains(Instant.parse("2024-01-08T09:30:00Z"));
    }

    @Test
    void steppedDayWithWeekdayShouldRequireBoth() {
        // odd days that are also Mondays: Jan 1, 15, 29
        Optional<Instant> next = TriggerCalculator.nextFireTime(
                ScheduleSpec.cron("0 0 */2 * 1", "UTC"), Instant.parse("2024-01-02T00:00:00Z"), null);

        assertThat(next).contains(Instant.parse("2024-01-15T00:00:00Z"));
    }

    @Test
    void weekdaySevenShouldMeanSunday() {
        Optional<Instant> next = TriggerCalculator.nextFireTime(
                ScheduleSpec.cron("0 12 * * 7", "UTC"), Instant.parse("2024-01-01T00:00:00Z"), null);

        assertThat(next).contains(Instant.parse("2024-01-07T12:00:00Z"));
    }

    @Test
    void monthNamesShouldBeAccepted() {
        Optional<Instant> next = TriggerCalculator.nextFireTime(
                ScheduleSpec.cron("0 0 1 jan,jul *", "UTC"), Instant.parse("2024-02-01T00:00:00Z"), null);

        assertThat(next).contains(Instant.parse("2024-07-01T00:00:00Z"));
    }

    @Test
    void cronShouldBeEvaluatedInItsZone() {
        // 00:00Z is 08:00 in Taipei
        Optional<Instant> next = TriggerCalculator.nextFireTime(
                ScheduleSpec.cron("0 9 * * *", "Asia/Taipei"), Instant.parse("2024-01-01T00:00:00Z"), null);

        assertThat(next).contains(Instant.parse("2024-01-01T01:00:00Z"));
    }

    @Test
    void outOfRangeMinuteShouldBeRejectedWhenParsed() {
        assertThatThrownBy(() -> ScheduleSpec.cron("61 * * * *"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("minute")
                .hasMessageContaining("61");
    }

    @Test
    void cronWithWrongFieldCountShouldBeRejected() {
        assertThatThrownBy(() -> ScheduleSpec.cron("0 0 * *"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("5 fields");
    }

    @Test
    void intervalShouldFireNowThenEveryPeriod() {
        ScheduleSpec spec = ScheduleSpec.every(Duration.ofSeconds(5));

        assertThat(TriggerCalculator.nextFireTime(spec, JAN_1_10AM, null)).contains(JAN_1_10AM);
        assertThat(TriggerCalculator.nextFireTime(spec, JAN_1_10AM.plusSeconds(1), JAN_1_10AM))
                .contains(JAN_1_10AM.plusSeconds(5));
    }

    @Test
    void intervalAfterLongPauseShouldSkipMissedPeriods() {
        ScheduleSpec spec = ScheduleSpec.every(Duration.ofSeconds(10));

        Optional<Instant> next = TriggerCalculator.nextFireTimeAfterFire(spec, JAN_1_10AM.plusSeconds(35), JAN_1_10AM);

        assertThat(next).contains(JAN_1_10AM.plusSeconds(40));
    }

    @Test
    void immediateShouldFireOnlyOnce() {
        ScheduleSpec spec = ScheduleSpec.immediate();

        assertThat(TriggerCalculator.nextFireTime(spec, JAN_1_10AM, null)).contains(JAN_1_10AM);
        assertThat(TriggerCalculator.nextFireTime(spec, JAN_1_10AM, JAN_1_10AM)).isEmpty();
    }

    @Test
    void oneTimeShouldReturnItsInstantUntilFired() {
        Instant past = JAN_1_10AM.minusSeconds(3600);
        ScheduleSpec spec = ScheduleSpec.at(past);

        // a past instant is still due: the scheduler fires it once, immediately
        assertThat(TriggerCalculator.nextFireTime(spec, JAN_1_10AM, null)).contains(past);
        assertThat(TriggerCalculator.nextFireTime(spec, JAN_1_10AM, past)).isEmpty();
    }
}
