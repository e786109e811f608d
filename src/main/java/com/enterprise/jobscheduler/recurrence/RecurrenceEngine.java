package com.enterprise.jobscheduler.recurrence;

import com.enterprise.jobscheduler.core.Clock;
import com.enterprise.jobscheduler.core.ScheduleRecurrence;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Computes when a recurring schedule runs next.
 * <p>
 * Calendar-based rules (DAILY, WEEKLY, MONTHLY, CRON) are evaluated in a single
 * configured zone so that the local time of day survives daylight-saving changes.
 * MONTHLY keeps the day of month and clamps it to the last day of shorter months,
 * so Jan 31 is followed by Feb 28 (Feb 29 in leap years).
 */
public class RecurrenceEngine {
    
    private final Clock clock;
    private final ZoneId zone;
    private final Map<String, CronExpression> cronCache = new ConcurrentHashMap<>();
    
    public RecurrenceEngine(Clock clock) {
        this(clock, ZoneOffset.UTC);
    }
    
    public RecurrenceEngine(Clock clock, ZoneId zone) {
        this.clock = clock;
        this.zone = zone;
    }
    
    /**
     * Next run after {@code currentRunAt}, or empty when the schedule has ended.
     *
     * @param occurrenceCount occurrences already completed before the one at {@code currentRunAt}
     */
    public Optional<Instant> calculateNextRunTime(Instant currentRunAt, ScheduleRecurrence recurrence,
                                                  int occurrenceCount) {
        if (recurrence == null || !recurrence.isRepeating()) {
            return Optional.empty();
        }
        
        Integer maxOccurrences = recurrence.getMaxOccurrences();
        if (maxOccurrences != null && occurrenceCount + 1 >= maxOccurrences) {
            return Optional.empty();
        }
        
        Optional<Instant> candidate = rawNext(currentRunAt, recurrence);
        if (candidate.isEmpty()) {
            return Optional.empty();
        }
        
        Instant endsAt = recurrence.getEndsAt();
        if (endsAt != null && candidate.get().isAfter(endsAt)) {
            return Optional.empty();
        }
        return candidate;
    }
    
    /**
     * The next {@code limit} run times after {@code from}, honoring the termination rules
     */
    public List<Instant> previewRunTimes(Instant from, ScheduleRecurrence recurrence,
                                         int occurrenceCount, int limit) {
        List<Instant> runs = new ArrayList<>();
        Instant current = from;
        int count = occurrenceCount;
        while (runs.size() < limit) {
            Optional<Instant> next = calculateNextRunTime(current, recurrence, count);
            if (next.isEmpty()) {
                break;
            }
            runs.add(next.get());
            current = next.get();
            count++;
        }
        return runs;
    }
    
    /**
     * Human readable distance from now to the next run, for display only
     */
    public String describeNextRun(Instant currentRunAt, ScheduleRecurrence recurrence) {
        Optional<Instant> next = calculateNextRunTime(currentRunAt, recurrence, 0);
        if (next.isEmpty()) {
            return "No further runs";
        }
        return describeRelative(next.get());
    }
    
    /**
     * Human readable distance from now to {@code instant}
     */
    public String describeRelative(Instant instant) {
        Duration until = Duration.between(clock.now(), instant);
        if (until.isNegative() || until.isZero()) {
            return "Now";
        }
        if (until.toDays() > 0) {
            return plural(until.toDays(), "day");
        }
        if (until.toHours() > 0) {
            return plural(until.toHours(), "hour");
        }
        if (until.toMinutes() > 0) {
            return plural(until.toMinutes(), "minute");
        }
        return "In less than a minute";
    }
    
    public ZoneId getZone() {
        return zone;
    }
    
    private Optional<Instant> rawNext(Instant currentRunAt, ScheduleRecurrence recurrence) {
        ZonedDateTime local = currentRunAt.atZone(zone);
        switch (recurrence.getType()) {
            case INTERVAL:
                return Optional.of(currentRunAt.plus(recurrence.getInterval()));
            case DAILY:
                return Optional.of(local.plusDays(1).toInstant());
            case WEEKLY:
                return Optional.of(local.plusWeeks(1).toInstant());
            case MONTHLY:
                // plusMonths clamps to the last valid day of the target month
                return Optional.of(local.plusMonths(1).toInstant());
            case CRON:
                return cron(recurrence.getCronExpression()).nextAfter(currentRunAt, zone);
            default:
                return Optional.empty();
        }
    }
    
    private CronExpression cron(String expression) {
        return cronCache.computeIfAbsent(expression, CronExpression::parse);
    }
    
    private static String plural(long amount, String unit) {
        return "In " + amount + " " + unit + (amount == 1 ? "" : "s");
    }
}
