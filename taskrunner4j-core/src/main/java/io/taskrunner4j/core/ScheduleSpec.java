package io.taskrunner4j.core;

import io.taskrunner4j.utils.CronFields;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;

/**
 * When a task fires. Exactly one variant describes a schedule; every variant validates itself on
 * construction so an invalid schedule can never reach the scheduler.
 */
public sealed interface ScheduleSpec
        permits ScheduleSpec.Immediate, ScheduleSpec.Interval, ScheduleSpec.OneTime, ScheduleSpec.Cron {

    ScheduleType type();

    static ScheduleSpec immediate() {
        return new Immediate();
    }

    static ScheduleSpec every(Duration period) {
        return new Interval(period);
    }

    static ScheduleSpec at(Instant at) {
        return new OneTime(at);
    }

    static ScheduleSpec cron(String expression) {
        return Cron.parse(expression, null);
    }

    static ScheduleSpec cron(String expression, String zone) {
        return Cron.parse(expression, zone);
    }

    /**
     * Fires once, synchronously with registration.
     */
    record Immediate() implements ScheduleSpec {
        @Override
        public ScheduleType type() {
            return ScheduleType.IMMEDIATE;
        }
    }

    /**
     * Fires every {@code period}, first at registration time.
     */
    record Interval(Duration period) implements ScheduleSpec {
        public Interval {
            Objects.requireNonNull(period, "period must not be null");
            if (period.isZero() || period.isNegative()) {
                throw new IllegalArgumentException("interval period must be a positive duration: " + period);
            }
        }

        @Override
        public ScheduleType type() {
            return ScheduleType.INTERVAL;
        }
    }

    /**
     * Fires once at {@code at}; a time already past fires as soon as the task is registered.
     */
    record OneTime(Instant at) implements ScheduleSpec {
        public OneTime {
            Objects.requireNonNull(at, "at must not be null");
        }

        @Override
        public ScheduleType type() {
            return ScheduleType.ONE_TIME;
        }
    }

    /**
     * Standard five-field cron. {@code zone} is an IANA id; null means the system default.
     */
    record Cron(String minute, String hour, String day, String month, String weekday, String zone)
            implements ScheduleSpec {

        public Cron {
            minute = normalize(minute, "minute");
            hour = normalize(hour, "hour");
            day = normalize(day, "day");
            month = normalize(month, "month");
            weekday = normalize(weekday, "weekday");
            if (zone != null && zone.isBlank()) {
                zone = null;
            }
            if (zone != null) {
                try {
                    ZoneId.of(zone);
                } catch (Exception ex) {
                    throw new IllegalArgumentException("Invalid cron zone: " + zone);
                }
            }
            CronFields.parse(minute, hour, day, month, weekday);
        }

        public Cron(String minute, String hour, String day, String month, String weekday) {
            this(minute, hour, day, month, weekday, null);
        }

        public static Cron parse(String expression, String zone) {
            Objects.requireNonNull(expression, "cron expression must not be null");
            String[] parts = expression.trim().split("\\s+");
            if (parts.length != 5) {
                throw new IllegalArgumentException(
                        "cron expression must have 5 fields (minute hour day month weekday): " + expression);
            }
            return new Cron(parts[0], parts[1], parts[2], parts[3], parts[4], zone);
        }

        public String expression() {
            return String.join(" ", minute, hour, day, month, weekday);
        }

        public ZoneId zoneId() {
            return zone == null ? ZoneId.systemDefault() : ZoneId.of(zone);
        }

        @Override
        public ScheduleType type() {
            return ScheduleType.CRON;
        }

        private static String normalize(String field, String name) {
            if (field == null || field.isBlank()) {
                return "*";
            }
            String f = field.trim();
            if (f.chars().anyMatch(Character::isWhitespace)) {
                throw new IllegalArgumentException("cron " + name + " field must not contain whitespace: " + field);
            }
            return f;
        }
    }
}
