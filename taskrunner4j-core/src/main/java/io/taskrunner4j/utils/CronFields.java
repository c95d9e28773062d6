package io.taskrunner4j.utils;

import java.time.DayOfWeek;
import java.util.BitSet;
import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Parsed and range-checked five-field cron expression.
 *
 * <p>Supported per field: {@code *}, {@code a}, {@code a-b}, {@code *}{@code /n}, {@code a-b/n}, {@code a/n} and comma
 * lists of those. Month accepts {@code jan..dec}, weekday accepts {@code sun..sat}; weekday numbers are
 * {@code 0..7} with 0 and 7 both meaning Sunday.
 *
 * <p>Fields are expanded into explicit value sets and re-rendered as Quartz expressions, so Quartz only ever
 * sees plain value lists.
 */
public final class CronFields {

    private static final Map<String, Integer> MONTHS = Map.ofEntries(
            Map.entry("jan", 1), Map.entry("feb", 2), Map.entry("mar", 3), Map.entry("apr", 4),
            Map.entry("may", 5), Map.entry("jun", 6), Map.entry("jul", 7), Map.entry("aug", 8),
            Map.entry("sep", 9), Map.entry("oct", 10), Map.entry("nov", 11), Map.entry("dec", 12)
    );

    private static final Map<String, Integer> WEEKDAYS = Map.of(
            "sun", 0, "mon", 1, "tue", 2, "wed", 3, "thu", 4, "fri", 5, "sat", 6
    );

    private final BitSet minutes;
    private final BitSet hours;
    private final BitSet days;
    private final BitSet months;
    private final BitSet weekdays;
    private final boolean dayStar;
    private final boolean weekdayStar;

    private CronFields(BitSet minutes, BitSet hours, BitSet days, BitSet months, BitSet weekdays,
                       boolean dayStar, boolean weekdayStar) {
        this.minutes = minutes;
        this.hours = hours;
        this.days = days;
        this.months = months;
        this.weekdays = weekdays;
        this.dayStar = dayStar;
        this.weekdayStar = weekdayStar;
    }

    /**
     * @throws IllegalArgumentException naming the offending field when any value is malformed or out of range
     */
    public static CronFields parse(String minute, String hour, String day, String month, String weekday) {
        BitSet minutes = parseField("minute", minute, 0, 59, Map.of());
        BitSet hours = parseField("hour", hour, 0, 23, Map.of());
        BitSet days = parseField("day", day, 1, 31, Map.of());
        BitSet months = parseField("month", month, 1, 12, MONTHS);
        BitSet weekdays = parseField("weekday", weekday, 0, 7, WEEKDAYS);
        if (weekdays.get(7)) {
            weekdays.clear(7);
            weekdays.set(0);
        }
        return new CronFields(minutes, hours, days, months, weekdays,
                day.startsWith("*"), weekday.startsWith("*"));
    }

    /**
     * True when day-of-month and day-of-week are both restricted; cron then fires when either matches.
     */
    public boolean daysOred() {
        return !dayStar && !weekdayStar;
    }

    public boolean allDays() {
        return days.cardinality() == 31;
    }

    public boolean allWeekdays() {
        return weekdays.cardinality() == 7;
    }

    public boolean matchesDayOfMonth(int dayOfMonth) {
        return days.get(dayOfMonth);
    }

    public boolean matchesDayOfWeek(DayOfWeek dayOfWeek) {
        return weekdays.get(dayOfWeek.getValue() % 7);
    }

    /**
     * Quartz expression constrained by day-of-month only (day-of-week is {@code ?}).
     */
    public String quartzByDayOfMonth() {
        return quartz(render(days, 1, 31), "?");
    }

    /**
     * Quartz expression constrained by day-of-week only (day-of-month is {@code ?}).
     */
    public String quartzByDayOfWeek() {
        StringJoiner dow = new StringJoiner(",");
        for (int d = weekdays.nextSetBit(0); d >= 0; d = weekdays.nextSetBit(d + 1)) {
            // Quartz counts SUN=1..SAT=7
            dow.add(Integer.toString(d + 1));
        }
        return quartz("?", allWeekdays() ? "*" : dow.toString());
    }

    private String quartz(String dom, String dow) {
        return String.join(" ", "0", render(minutes, 0, 59), render(hours, 0, 23), dom,
                render(months, 1, 12), dow);
    }

    private static String render(BitSet values, int min, int max) {
        if (values.cardinality() == max - min + 1) {
            return "*";
        }
        StringJoiner joiner = new StringJoiner(",");
        for (int v = values.nextSetBit(min); v >= 0 && v <= max; v = values.nextSetBit(v + 1)) {
            joiner.add(Integer.toString(v));
        }
        return joiner.toString();
    }

    private static BitSet parseField(String name, String field, int min, int max, Map<String, Integer> names) {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("cron " + name + " field must not be empty");
        }
        BitSet values = new BitSet(max + 1);
        for (String part : field.split(",", -1)) {
            if (part.isEmpty()) {
                throw new IllegalArgumentException("cron " + name + " field has an empty list element: " + field);
            }
            addPart(name, part, min, max, names, values);
        }
        return values;
    }

    private static void addPart(String name, String part, int min, int max, Map<String, Integer> names,
                                BitSet values) {
        String base = part;
        int step = 1;
        int slash = part.indexOf('/');
        if (slash >= 0) {
            base = part.substring(0, slash);
            String stepText = part.substring(slash + 1);
            step = parseNumber(name, stepText, part);
            if (step <= 0) {
                throw new IllegalArgumentException("cron " + name + " step must be positive: " + part);
            }
        }

        int from;
        int to;
        if ("*".equals(base)) {
            from = min;
            to = max;
        } else {
            int dash = base.indexOf('-');
            if (dash > 0) {
                from = parseValue(name, base.substring(0, dash), min, max, names);
                to = parseValue(name, base.substring(dash + 1), min, max, names);
                if (from > to) {
                    throw new IllegalArgumentException("cron " + name + " range is reversed: " + part);
                }
            } else {
                from = parseValue(name, base, min, max, names);
                to = slash >= 0 ? max : from;
            }
        }

        for (int v = from; v <= to; v += step) {
            values.set(v);
        }
    }

    private static int parseValue(String name, String text, int min, int max, Map<String, Integer> names) {
        Integer named = names.get(text.toLowerCase(Locale.ROOT));
        int value = named != null ? named : parseNumber(name, text, text);
        if (value < min || value > max) {
            throw new IllegalArgumentException(
                    "cron " + name + " value out of range (" + min + "-" + max + "): " + text);
        }
        return value;
    }

    private static int parseNumber(String name, String text, String part) {
        if (text.isEmpty() || !text.chars().allMatch(Character::isDigit)) {
            throw new IllegalArgumentException("cron " + name + " field is not a number: " + part);
        }
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("cron " + name + " value out of range: " + part);
        }
    }
}
