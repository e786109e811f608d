package com.enterprise.jobscheduler.core;

import com.enterprise.jobscheduler.recurrence.CronExpression;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable recurrence rule of a schedule.
 * A rule may carry an absolute cutoff ({@code endsAt}), an occurrence cap
 * ({@code maxOccurrences}), both or neither; the first one to trigger ends the schedule.
 */
public final class ScheduleRecurrence {
    
    private final RecurrenceType type;
    private final Duration interval;
    private final String cronExpression;
    private final Instant endsAt;
    private final Integer maxOccurrences;
    
    @JsonCreator
    public ScheduleRecurrence(@JsonProperty("type") RecurrenceType type,
                              @JsonProperty("interval") Duration interval,
                              @JsonProperty("cronExpression") String cronExpression,
                              @JsonProperty("endsAt") Instant endsAt,
                              @JsonProperty("maxOccurrences") Integer maxOccurrences) {
        if (type == null) {
            throw new IllegalArgumentException("Recurrence type is required");
        }
        if (type == RecurrenceType.INTERVAL && (interval == null || interval.isZero() || interval.isNegative())) {
            throw new IllegalArgumentException("Interval recurrence requires a positive duration");
        }
        if (type == RecurrenceType.CRON) {
            // throws IllegalArgumentException on a malformed expression
            CronExpression.parse(cronExpression);
        }
        if (maxOccurrences != null && maxOccurrences < 1) {
            throw new IllegalArgumentException("maxOccurrences must be at least 1, got " + maxOccurrences);
        }
        this.type = type;
        this.interval = type == RecurrenceType.INTERVAL ? interval : null;
        this.cronExpression = type == RecurrenceType.CRON ? cronExpression.trim() : null;
        this.endsAt = endsAt;
        this.maxOccurrences = maxOccurrences;
    }
    
    public static ScheduleRecurrence once() {
        return new ScheduleRecurrence(RecurrenceType.ONCE, null, null, null, null);
    }
    
    public static ScheduleRecurrence interval(Duration interval) {
        return new ScheduleRecurrence(RecurrenceType.INTERVAL, interval, null, null, null);
    }
    
    public static ScheduleRecurrence daily() {
        return new ScheduleRecurrence(RecurrenceType.DAILY, null, null, null, null);
    }
    
    public static ScheduleRecurrence weekly() {
        return new ScheduleRecurrence(RecurrenceType.WEEKLY, null, null, null, null);
    }
    
    public static ScheduleRecurrence monthly() {
        return new ScheduleRecurrence(RecurrenceType.MONTHLY, null, null, null, null);
    }
    
    public static ScheduleRecurrence cron(String expression) {
        return new ScheduleRecurrence(RecurrenceType.CRON, null, expression, null, null);
    }
    
    /**
     * Copy of this rule that stops producing runs after {@code endsAt}
     */
    public ScheduleRecurrence endingAt(Instant endsAt) {
        return new ScheduleRecurrence(type, interval, cronExpression, endsAt, maxOccurrences);
    }
    
    /**
     * Copy of this rule capped at {@code maxOccurrences} executed occurrences
     */
    public ScheduleRecurrence limitedTo(int maxOccurrences) {
        return new ScheduleRecurrence(type, interval, cronExpression, endsAt, maxOccurrences);
    }
    
    public RecurrenceType getType() { return type; }
    
    public Duration getInterval() { return interval; }
    
    public String getCronExpression() { return cronExpression; }
    
    public Instant getEndsAt() { return endsAt; }
    
    public Integer getMaxOccurrences() { return maxOccurrences; }
    
    /**
     * Whether this rule can ever produce a second run
     */
    @JsonIgnore
    public boolean isRepeating() {
        return type != RecurrenceType.ONCE;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScheduleRecurrence)) return false;
        ScheduleRecurrence that = (ScheduleRecurrence) o;
        return type == that.type
            && Objects.equals(interval, that.interval)
            && Objects.equals(cronExpression, that.cronExpression)
            && Objects.equals(endsAt, that.endsAt)
            && Objects.equals(maxOccurrences, that.maxOccurrences);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(type, interval, cronExpression, endsAt, maxOccurrences);
    }
    
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(type.name());
        if (interval != null) {
            sb.append('(').append(interval).append(')');
        }
        if (cronExpression != null) {
            sb.append("('").append(cronExpression).append("')");
        }
        if (endsAt != null) {
            sb.append(" until ").append(endsAt);
        }
        if (maxOccurrences != null) {
            sb.append(" max ").append(maxOccurrences);
        }
        return sb.toString();
    }
}
