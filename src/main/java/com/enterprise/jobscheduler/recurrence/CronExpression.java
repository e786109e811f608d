package com.enterprise.jobscheduler.recurrence;

import it.sauronsoftware.cron4j.InvalidPatternException;
import it.sauronsoftware.cron4j.SchedulingPattern;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.Set;
import java.util.TimeZone;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Standard five-field cron expression: minute, hour, day-of-month, month, day-of-week.
 * <p>
 * Field matching is delegated to cron4j. When both day-of-month and day-of-week are
 * restricted the expression matches if either of them does, as in POSIX cron; cron4j
 * alone would require both, so such expressions are compiled into two alternatives.
 */
public final class CronExpression {
    
    /**
     * Upper bound of the forward search; covers every leap-day schedule
     */
    static final long MAX_SCAN_DAYS = 5L * 366;
    static final long MAX_SCAN_MINUTES = Duration.ofDays(MAX_SCAN_DAYS).toMinutes();
    
    // a leap year, so Feb 29 falls inside the date check
    private static final Instant DATE_SCAN_START = Instant.parse("2000-01-01T00:00:00Z");
    
    private static final Set<String> SATISFIABLE = ConcurrentHashMap.newKeySet();
    
    private final String expression;
    private final SchedulingPattern pattern;
    
    private CronExpression(String expression, SchedulingPattern pattern) {
        this.expression = expression;
        this.pattern = pattern;
    }
    
    /**
     * Parse and validate an expression
     *
     * @throws IllegalArgumentException if the expression is not a valid five-field cron expression
     */
    public static CronExpression parse(String expression) {
        if (expression == null || expression.trim().isEmpty()) {
            throw new IllegalArgumentException("Cron expression is required");
        }
        String normalized = expression.trim();
        if (normalized.indexOf('|') >= 0) {
            throw new IllegalArgumentException("Invalid cron expression: " + expression
                + " (multiple patterns are not supported)");
        }
        
        String[] fields = normalized.split("\\s+");
        if (fields.length != 5) {
            throw new IllegalArgumentException("Invalid cron expression: " + expression
                + " (expected 5 fields, got " + fields.length + ")");
        }
        
        String normalizedExpression = String.join(" ", fields);
        SchedulingPattern pattern;
        try {
            pattern = new SchedulingPattern(compile(fields[0], fields[1], fields));
            if (!SATISFIABLE.contains(normalizedExpression)) {
                if (!matchesSomeDay(new SchedulingPattern(compile("*", "*", fields)))) {
                    throw new IllegalArgumentException("Invalid cron expression: " + expression
                        + " (no date ever matches)");
                }
                SATISFIABLE.add(normalizedExpression);
            }
        } catch (InvalidPatternException e) {
            throw new IllegalArgumentException("Invalid cron expression: " + expression, e);
        }
        return new CronExpression(normalizedExpression, pattern);
    }
    
    private static String compile(String minute, String hour, String[] fields) {
        if (!"*".equals(fields[2]) && !"*".equals(fields[4])) {
            return minute + " " + hour + " " + fields[2] + " " + fields[3] + " *"
                + "|" + minute + " " + hour + " * " + fields[3] + " " + fields[4];
        }
        return minute + " " + hour + " " + fields[2] + " " + fields[3] + " " + fields[4];
    }
    
    // Minute and hour fields always admit a value, so only the date fields can make an
    // expression unsatisfiable. One check per day over the scan window finds such dates.
    private static boolean matchesSomeDay(SchedulingPattern datePattern) {
        TimeZone utc = TimeZone.getTimeZone("UTC");
        long dayMillis = Duration.ofDays(1).toMillis();
        long start = DATE_SCAN_START.toEpochMilli();
        for (long day = 0; day < MAX_SCAN_DAYS; day++) {
            if (datePattern.match(utc, start + day * dayMillis)) {
                return true;
            }
        }
        return false;
    }
    
    /**
     * Check whether an expression can be parsed
     */
    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
    
    /**
     * Whether the minute containing {@code instant} matches, evaluated in {@code zone}
     */
    public boolean matches(Instant instant, ZoneId zone) {
        return pattern.match(TimeZone.getTimeZone(zone), instant.toEpochMilli());
    }
    
    /**
     * First matching minute strictly after the minute containing {@code after}
     */
    public Optional<Instant> nextAfter(Instant after, ZoneId zone) {
        TimeZone timeZone = TimeZone.getTimeZone(zone);
        Instant candidate = after.truncatedTo(ChronoUnit.MINUTES).plus(1, ChronoUnit.MINUTES);
        
        for (long i = 0; i < MAX_SCAN_MINUTES; i++) {
            if (pattern.match(timeZone, candidate.toEpochMilli())) {
                return Optional.of(candidate);
            }
            candidate = candidate.plus(1, ChronoUnit.MINUTES);
        }
        return Optional.empty();
    }
    
    public String getExpression() {
        return expression;
    }
    
    @Override
    public String toString() {
        return expression;
    }
}
