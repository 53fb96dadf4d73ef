package deferq.queue.model;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Relative offset of a recurring job, e.g. {@code "+1 hour"} or {@code "+2 days"}.
 *
 * Seconds, minutes and hours move along the instant timeline. Days, weeks,
 * months and years move the local wall-clock time of a zone, so "+1 day"
 * across a DST change lands on the same local time the next day.
 */
public record Frequency(int sign, long amount, ChronoUnit unit) {

    private static final Pattern PATTERN = Pattern.compile(
            "^([+-])?\\s*(\\d+)\\s*(second|minute|hour|day|week|month|year)s?$",
            Pattern.CASE_INSENSITIVE);

    /** Longest accepted step: a thousand years. */
    private static final long MAX_SPAN_SECONDS = ChronoUnit.YEARS.getDuration().getSeconds() * 1000;

    /**
     * Parse a frequency expression.
     *
     * @throws IllegalArgumentException if the expression is not understood or
     *                                  spans more than a thousand years
     */
    public static Frequency parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("frequency is empty");
        }

        Matcher m = PATTERN.matcher(expression.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("invalid frequency: " + expression);
        }

        int sign = "-".equals(m.group(1)) ? -1 : 1;
        long amount;
        try {
            amount = Long.parseLong(m.group(2));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid frequency: " + expression, e);
        }
        ChronoUnit unit = switch (m.group(3).toLowerCase(Locale.ROOT)) {
            case "second" -> ChronoUnit.SECONDS;
            case "minute" -> ChronoUnit.MINUTES;
            case "hour" -> ChronoUnit.HOURS;
            case "day" -> ChronoUnit.DAYS;
            case "week" -> ChronoUnit.WEEKS;
            case "month" -> ChronoUnit.MONTHS;
            default -> ChronoUnit.YEARS;
        };
        if (amount > MAX_SPAN_SECONDS / unit.getDuration().getSeconds()) {
            throw new IllegalArgumentException("frequency is too large: " + expression);
        }

        return new Frequency(sign, amount, unit);
    }

    /** True when applying the frequency moves a date into the future. */
    public boolean isForward() {
        return sign > 0 && amount > 0;
    }

    /** Whether the step has a fixed length in seconds. */
    public boolean isTimeBased() {
        return unit.isTimeBased();
    }

    /** Length of one step in seconds, for time-based units only. */
    public long stepSeconds() {
        if (!isTimeBased()) {
            throw new IllegalStateException(unit + " has no fixed length");
        }
        return Math.multiplyExact(amount, unit.getDuration().getSeconds());
    }

    /** Apply {@code steps} frequency steps to the given instant. */
    public Instant addTo(Instant instant, ZoneId zone, long steps) {
        long total = Math.multiplyExact(Math.multiplyExact(sign, amount), steps);
        if (isTimeBased()) {
            return instant.plus(total, unit);
        }
        ZonedDateTime local = instant.atZone(zone);
        return local.plus(total, unit).toInstant();
    }

    @Override
    public String toString() {
        return (sign < 0 ? "-" : "+") + amount + " " + unit.name().toLowerCase(Locale.ROOT);
    }
}
