package io.taskrunner4j.utils;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses interval text into a {@link Duration}.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>Plain seconds: "90"</li>
 *   <li>Compact units: "30s", "5m", "2h", "1d", "1w", also chained: "1h30m"</li>
 *   <li>Spelled-out pairs: "5 minutes", "1 day 3 hours", "2 weeks"</li>
 * </ul>
 * Each unit may appear at most once. Months are not accepted: they have no fixed length.
 */
public final class HumanDuration {

    private static final Pattern TOKEN = Pattern.compile("(\\d+)\\s*([a-z]+)");

    private enum Unit {
        WEEK(Duration.ofDays(7)),
        DAY(Duration.ofDays(1)),
        HOUR(Duration.ofHours(1)),
        MINUTE(Duration.ofMinutes(1)),
        SECOND(Duration.ofSeconds(1));

        private final Duration length;

        Unit(Duration length) {
            this.length = length;
        }

        static Unit of(String word) {
            return switch (word) {
                case "w", "week", "weeks" -> WEEK;
                case "d", "day", "days" -> DAY;
                case "h", "hr", "hrs", "hour", "hours" -> HOUR;
                case "m", "min", "mins", "minute", "minutes" -> MINUTE;
                case "s", "sec", "secs", "second", "seconds" -> SECOND;
                default -> null;
            };
        }
    }

    private HumanDuration() {
    }

    /**
     * @throws IllegalArgumentException when the text is empty, malformed, repeats a unit, or is not positive
     */
    public static Duration parse(String input) {
        Objects.requireNonNull(input, "interval must not be null");
        String s = input.trim().toLowerCase(Locale.ROOT);
        if (s.isEmpty()) {
            throw new IllegalArgumentException("Interval string must not be empty");
        }

        if (s.chars().allMatch(Character::isDigit)) {
            return positive(Duration.ofSeconds(parseAmount(s, input)), input);
        }

        Matcher m = TOKEN.matcher(s);
        Set<Unit> seen = EnumSet.noneOf(Unit.class);
        Duration total = Duration.ZERO;
        int consumed = 0;
        while (m.find()) {
            if (!s.substring(consumed, m.start()).isBlank()) {
                throw new IllegalArgumentException("Invalid interval format: " + input);
            }
            Unit unit = Unit.of(m.group(2));
            if (unit == null) {
                throw new IllegalArgumentException("Unsupported interval unit: " + m.group(2));
            }
            if (!seen.add(unit)) {
                throw new IllegalArgumentException("Duplicate interval unit: " + unit.name().toLowerCase(Locale.ROOT));
            }
            try {
                total = total.plus(unit.length.multipliedBy(parseAmount(m.group(1), input)));
            } catch (ArithmeticException ex) {
                throw new IllegalArgumentException("Interval value out of range: " + input, ex);
            }
            consumed = m.end();
        }
        if (consumed == 0 || !s.substring(consumed).isBlank()) {
            throw new IllegalArgumentException("Invalid interval format: " + input);
        }
        return positive(total, input);
    }

    private static long parseAmount(String digits, String input) {
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Interval value out of range: " + input);
        }
    }

    private static Duration positive(Duration d, String input) {
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException("Interval must be positive: " + input);
        }
        return d;
    }
}
