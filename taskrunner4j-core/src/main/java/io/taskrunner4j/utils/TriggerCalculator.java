package io.taskrunner4j.utils;

import io.taskrunner4j.core.ScheduleSpec;
import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Date;
import java.util.Objects;
import java.util.Optional;
import java.util.TimeZone;

/**
 * Computes when a schedule fires next. Stateless and deterministic for given inputs.
 *
 * <p>Cron evaluation follows standard cron semantics: when both day-of-month and day-of-week are restricted
 * a day matches if either field matches; otherwise both must match.
 */
public final class TriggerCalculator {

    // bound for AND-combined day fields that never line up (e.g. "31 * 2 *" style dead schedules)
    private static final int MAX_CRON_CANDIDATES = 10_000;

    private TriggerCalculator() {
    }

    /**
     * @param spec          schedule to evaluate
     * @param now           reference time
     * @param lastFireTime  previous fire of the same task, or null if it never fired
     * @return next fire time, or empty when the schedule will never fire again
     */
    public static Optional<Instant> nextFireTime(ScheduleSpec spec, Instant now, Instant lastFireTime) {
        Objects.requireNonNull(spec, "spec must not be null");
        Objects.requireNonNull(now, "now must not be null");

        return switch (spec.type()) {
            case IMMEDIATE -> lastFireTime == null ? Optional.of(now) : Optional.empty();
            case INTERVAL -> {
                Duration period = ((ScheduleSpec.Interval) spec).period();
                yield Optional.of(lastFireTime == null ? now : lastFireTime.plus(period));
            }
            case ONE_TIME -> lastFireTime == null
                    ? Optional.of(((ScheduleSpec.OneTime) spec).at())
                    : Optional.empty();
            case CRON -> nextCronTime((ScheduleSpec.Cron) spec, now);
        };
    }

    /**
     * Like {@link #nextFireTime} but never returns a time at or before {@code now} for a schedule that already
     * fired: elapsed interval periods are skipped rather than replayed.
     */
    public static Optional<Instant> nextFireTimeAfterFire(ScheduleSpec spec, Instant now, Instant firedAt) {
        Objects.requireNonNull(firedAt, "firedAt must not be null");
        Optional<Instant> next = nextFireTime(spec, now, firedAt);
        if (next.isEmpty() || next.get().isAfter(now) || !(spec instanceof ScheduleSpec.Interval interval)) {
            return next;
        }
        long periodNanos = interval.period().toNanos();
        long behind = Duration.between(next.get(), now).toNanos();
        long skip = behind / periodNanos + 1;
        return Optional.of(next.get().plus(interval.period().multipliedBy(skip)));
    }

    /**
     * Smallest instant strictly after {@code now} that satisfies all five fields.
     */
    public static Optional<Instant> nextCronTime(ScheduleSpec.Cron cron, Instant now) {
        CronFields fields = CronFields.parse(cron.minute(), cron.hour(), cron.day(), cron.month(), cron.weekday());
        ZoneId zone = cron.zoneId();

        if (fields.daysOred()) {
            Optional<Instant> byDay = next(compile(fields.quartzByDayOfMonth(), zone), now);
            Optional<Instant> byWeekday = next(compile(fields.quartzByDayOfWeek(), zone), now);
            if (byDay.isEmpty()) {
                return byWeekday;
            }
            if (byWeekday.isEmpty()) {
                return byDay;
            }
            return Optional.of(byDay.get().isBefore(byWeekday.get()) ? byDay.get() : byWeekday.get());
        }

        if (fields.allWeekdays()) {
            return next(compile(fields.quartzByDayOfMonth(), zone), now);
        }
        if (fields.allDays()) {
            return next(compile(fields.quartzByDayOfWeek(), zone), now);
        }

        // both fields narrowed with a '*' step: walk day-of-month candidates and keep those on a listed weekday
        CronExpression byDay = compile(fields.quartzByDayOfMonth(), zone);
        Instant cursor = now;
        for (int i = 0; i < MAX_CRON_CANDIDATES; i++) {
            Optional<Instant> candidate = next(byDay, cursor);
            if (candidate.isEmpty()) {
                return Optional.empty();
            }
            DayOfWeek dow = ZonedDateTime.ofInstant(candidate.get(), zone).getDayOfWeek();
            if (fields.matchesDayOfWeek(dow)) {
                return candidate;
            }
            cursor = candidate.get();
        }
        return Optional.empty();
    }

    private static Optional<Instant> next(CronExpression expression, Instant after) {
        Date next = expression.getNextValidTimeAfter(Date.from(after));
        return next == null ? Optional.empty() : Optional.of(next.toInstant());
    }

    private static CronExpression compile(String quartz, ZoneId zone) {
        try {
            CronExpression exp = new CronExpression(quartz);
            exp.setTimeZone(TimeZone.getTimeZone(zone));
            return exp;
        } catch (ParseException ex) {
            throw new IllegalArgumentException("Invalid cron expression: " + quartz, ex);
        }
    }
}
