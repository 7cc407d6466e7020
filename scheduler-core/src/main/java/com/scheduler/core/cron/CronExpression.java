package com.scheduler.core.cron;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.Month;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.BitSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * A parsed five-field cron expression: minute, hour, day-of-month, month, day-of-week.
 *
 * Supported syntax per field: {@code *}, values, lists, ranges {@code a-b}, steps
 * {@code a-b/c}, {@code *&#47;c} and {@code a/c}, month and weekday names. Day-of-month
 * accepts {@code L} (last day of the month). Weekday 0 and 7 both mean Sunday and
 * descending weekday ranges wrap. The aliases {@code @yearly}, {@code @annually},
 * {@code @monthly}, {@code @weekly}, {@code @daily}, {@code @midnight} and
 * {@code @hourly} are expanded at parse time.
 *
 * When both day-of-month and day-of-week are restricted a day matches if either
 * matches. A field counts as restricted unless it is exactly {@code *}.
 *
 * Instances are immutable and thread-safe.
 */
public final class CronExpression {

    private static final Map<String, String> ALIASES = Map.of(
        "@yearly", "0 0 1 1 *",
        "@annually", "0 0 1 1 *",
        "@monthly", "0 0 1 * *",
        "@weekly", "0 0 * * 0",
        "@daily", "0 0 * * *",
        "@midnight", "0 0 * * *",
        "@hourly", "0 * * * *"
    );

    // Any valid expression fires within 8 years (Feb 29 across a skipped leap year)
    private static final int MAX_YEARS_AHEAD = 10;

    private final String expression;
    private final CronField minutes;
    private final CronField hours;
    private final CronField daysOfMonth;
    private final CronField months;
    private final CronField daysOfWeek;

    private CronExpression(String expression, CronField minutes, CronField hours,
                           CronField daysOfMonth, CronField months, CronField daysOfWeek) {
        this.expression = expression;
        this.minutes = minutes;
        this.hours = hours;
        this.daysOfMonth = daysOfMonth;
        this.months = months;
        this.daysOfWeek = daysOfWeek;
    }

    /**
     * Parse a cron expression or alias.
     *
     * @throws CronParseException if the expression is malformed
     */
    public static CronExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new CronParseException(String.valueOf(expression), "expression is empty");
        }
        String trimmed = expression.trim();
        String source = trimmed;
        if (trimmed.startsWith("@")) {
            source = ALIASES.get(trimmed.toLowerCase(Locale.ROOT));
            if (source == null) {
                throw new CronParseException(expression, "unknown alias '" + trimmed + "'");
            }
        }

        String[] tokens = source.split("\\s+");
        if (tokens.length != 5) {
            throw new CronParseException(expression,
                "expected 5 fields but found " + tokens.length);
        }

        CronExpression parsed = new CronExpression(
            trimmed,
            CronField.parse(expression, tokens[0], CronField.Type.MINUTE),
            CronField.parse(expression, tokens[1], CronField.Type.HOUR),
            CronField.parse(expression, tokens[2], CronField.Type.DAY_OF_MONTH),
            CronField.parse(expression, tokens[3], CronField.Type.MONTH),
            CronField.parse(expression, tokens[4], CronField.Type.DAY_OF_WEEK)
        );
        parsed.validateDaysOfMonth();
        return parsed;
    }

    /**
     * Check if the expression parses.
     */
    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (CronParseException e) {
            return false;
        }
    }

    /**
     * Compute the first fire time strictly after the given local time.
     * Seconds and below are ignored.
     */
    public LocalDateTime next(LocalDateTime after) {
        LocalDateTime candidate = after.truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);
        int yearLimit = candidate.getYear() + MAX_YEARS_AHEAD;

        while (candidate.getYear() <= yearLimit) {
            if (!months.matches(candidate.getMonthValue())) {
                candidate = candidate.toLocalDate().withDayOfMonth(1).plusMonths(1).atStartOfDay();
                continue;
            }
            if (!dayMatches(candidate.toLocalDate())) {
                candidate = candidate.toLocalDate().plusDays(1).atStartOfDay();
                continue;
            }
            int hour = hours.nextValue(candidate.getHour());
            if (hour < 0) {
                candidate = candidate.toLocalDate().plusDays(1).atStartOfDay();
                continue;
            }
            if (hour != candidate.getHour()) {
                candidate = candidate.toLocalDate().atTime(hour, 0);
            }
            int minute = minutes.nextValue(candidate.getMinute());
            if (minute < 0) {
                candidate = candidate.truncatedTo(ChronoUnit.HOURS).plusHours(1);
                continue;
            }
            return candidate.withMinute(minute);
        }
        throw new IllegalStateException("No fire time within " + MAX_YEARS_AHEAD
            + " years after " + after + " for '" + expression + "'");
    }

    /**
     * Compute the first fire time strictly after the given instant, evaluating
     * calendar fields in the given zone.
     */
    public Instant next(Instant after, ZoneId zone) {
        LocalDateTime local = LocalDateTime.ofInstant(after, zone);
        while (true) {
            local = next(local);
            Instant fire = local.atZone(zone).toInstant();
            // Overlapping local times can map to an instant at or before the reference
            if (fire.isAfter(after)) {
                return fire;
            }
        }
    }

    /**
     * Check if a local time (to the minute) is a fire time.
     */
    public boolean matches(LocalDateTime time) {
        return minutes.matches(time.getMinute())
            && hours.matches(time.getHour())
            && months.matches(time.getMonthValue())
            && dayMatches(time.toLocalDate());
    }

    public String getExpression() {
        return expression;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CronExpression that)) return false;
        return expression.equals(that.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression);
    }

    @Override
    public String toString() {
        return expression;
    }

    // ========== Helper Methods ==========

    private boolean dayMatches(LocalDate date) {
        boolean domRestricted = daysOfMonth.isRestricted();
        boolean dowRestricted = daysOfWeek.isRestricted();
        if (!domRestricted && !dowRestricted) {
            return true;
        }

        boolean domMatch = daysOfMonth.matches(date.getDayOfMonth())
            || (daysOfMonth.hasLastDayOfMonth() && date.getDayOfMonth() == date.lengthOfMonth());
        boolean dowMatch = daysOfWeek.matches(weekdayNumber(date.getDayOfWeek()));

        if (domRestricted && dowRestricted) {
            return domMatch || dowMatch;
        }
        return domRestricted ? domMatch : dowMatch;
    }

    private static int weekdayNumber(DayOfWeek dayOfWeek) {
        return dayOfWeek.getValue() % 7;
    }

    /**
     * Reject day-of-month values no selected month can ever reach, e.g. 31 in February.
     */
    private void validateDaysOfMonth() {
        if (!daysOfMonth.isRestricted() || daysOfMonth.hasLastDayOfMonth()) {
            return;
        }
        BitSet days = daysOfMonth.values();
        int smallestDay = days.nextSetBit(1);
        for (int month = months.nextValue(1); month >= 0; month = months.nextValue(month + 1)) {
            if (smallestDay <= Month.of(month).maxLength()) {
                return;
            }
        }
        throw new CronParseException(expression,
            "day-of-month field: day " + smallestDay + " never occurs in the selected months");
    }
}
