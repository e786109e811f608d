package com.enterprise.jobscheduler.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A scheduled unit of work and its lifecycle state.
 * <p>
 * The job is the aggregate root of the scheduler: all state changes go through the
 * lifecycle methods below, which enforce the {@link JobStatus} transition rules and
 * keep {@code runAt} non-decreasing. Instances are not thread-safe; repositories hand
 * out copies and serialize writes themselves.
 */
public class ScheduledJob {
    
    public static final Duration DEFAULT_OVERDUE_THRESHOLD = Duration.ofMinutes(5);
    
    private final UUID id;
    private final String jobType;
    private final String targetId;
    private final Map<String, Object> payload;
    private final ScheduleRecurrence recurrence;
    private final int maxRetries;
    private final int priority;
    private final Map<String, Object> metadata;
    private final Instant createdAt;
    
    private Instant runAt;
    private Instant occurrenceRunAt;
    private JobStatus status;
    private int attemptCount;
    private int occurrenceCount;
    private Instant lockedUntil;
    private String lockedBy;
    private JobResult lastResult;
    private Instant updatedAt;
    private long version;
    
    @JsonCreator
    public ScheduledJob(@JsonProperty("id") UUID id,
                        @JsonProperty("jobType") String jobType,
                        @JsonProperty("targetId") String targetId,
                        @JsonProperty("payload") Map<String, Object> payload,
                        @JsonProperty("runAt") Instant runAt,
                        @JsonProperty("occurrenceRunAt") Instant occurrenceRunAt,
                        @JsonProperty("status") JobStatus status,
                        @JsonProperty("recurrence") ScheduleRecurrence recurrence,
                        @JsonProperty("attemptCount") int attemptCount,
                        @JsonProperty("occurrenceCount") int occurrenceCount,
                        @JsonProperty("maxRetries") int maxRetries,
                        @JsonProperty("priority") int priority,
                        @JsonProperty("metadata") Map<String, Object> metadata,
                        @JsonProperty("lockedUntil") Instant lockedUntil,
                        @JsonProperty("lockedBy") String lockedBy,
                        @JsonProperty("lastResult") JobResult lastResult,
                        @JsonProperty("createdAt") Instant createdAt,
                        @JsonProperty("updatedAt") Instant updatedAt,
                        @JsonProperty("version") long version) {
        if (id == null) {
            throw new IllegalArgumentException("Job id is required");
        }
        if (runAt == null) {
            throw new IllegalArgumentException("Job runAt is required");
        }
        this.id = id;
        this.jobType = jobType;
        this.targetId = targetId;
        this.payload = payload == null ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        this.runAt = runAt;
        this.occurrenceRunAt = occurrenceRunAt != null ? occurrenceRunAt : runAt;
        this.status = status != null ? status : JobStatus.PENDING;
        this.recurrence = recurrence;
        this.attemptCount = attemptCount;
        this.occurrenceCount = occurrenceCount;
        this.maxRetries = maxRetries;
        this.priority = priority;
        this.metadata = metadata == null ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.lockedUntil = lockedUntil;
        this.lockedBy = lockedBy;
        this.lastResult = lastResult;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        this.version = version;
    }
    
    /**
     * Create a fresh PENDING job from a definition
     */
    public static ScheduledJob fromDefinition(UUID id, ScheduleDefinition definition,
                                              int defaultMaxRetries, Instant now) {
        int maxRetries = definition.getMaxRetries() != null ? definition.getMaxRetries() : defaultMaxRetries;
        return new ScheduledJob(id, definition.getJobType(), definition.getTargetId(),
            definition.getPayload(), definition.getRunAt(), definition.getRunAt(), JobStatus.PENDING,
            definition.getRecurrence(), 0, 0, maxRetries, definition.getPriority(),
            definition.getMetadata(), null, null, null, now, now, 0L);
    }
    
    /**
     * Detached copy carrying the same state
     */
    public ScheduledJob copy() {
        return new ScheduledJob(id, jobType, targetId, payload, runAt, occurrenceRunAt, status,
            recurrence, attemptCount, occurrenceCount, maxRetries, priority, metadata,
            lockedUntil, lockedBy, lastResult, createdAt, updatedAt, version);
    }
    
    // Lifecycle
    
    /**
     * Take the lease for {@code workerId}. Allowed from PENDING without a live lease,
     * or from RUNNING once the previous holder's lease has expired.
     */
    public void claim(String workerId, Instant now, Instant lockedUntil) {
        if (!isClaimable(now)) {
            throw new IllegalStateException("Job " + id + " cannot be claimed in status " + status
                + (this.lockedUntil != null ? " (locked until " + this.lockedUntil + ")" : ""));
        }
        this.status = JobStatus.RUNNING;
        this.lockedBy = workerId;
        this.lockedUntil = lockedUntil;
        touch(now);
    }
    
    /**
     * Push the lease of a running job further out
     */
    public void extendLease(Instant lockedUntil, Instant now) {
        requireStatus(JobStatus.RUNNING);
        this.lockedUntil = lockedUntil;
        touch(now);
    }
    
    /**
     * Put the current occurrence back to PENDING for another attempt
     */
    public void scheduleRetry(Instant retryAt, JobResult result, Instant now) {
        transitionTo(JobStatus.PENDING);
        this.attemptCount++;
        this.runAt = retryAt.isBefore(runAt) ? runAt : retryAt;
        this.lastResult = result;
        releaseLease();
        touch(now);
    }
    
    /**
     * Close the current occurrence and make the job PENDING for the next one
     */
    public void advanceTo(Instant nextRunAt, JobResult result, Instant now) {
        if (nextRunAt.isBefore(runAt)) {
            throw new IllegalArgumentException("Next run " + nextRunAt + " is before current run " + runAt);
        }
        transitionTo(JobStatus.PENDING);
        this.occurrenceCount++;
        this.attemptCount = 0;
        this.runAt = nextRunAt;
        this.occurrenceRunAt = nextRunAt;
        this.lastResult = result;
        releaseLease();
        touch(now);
    }
    
    /**
     * Close the current occurrence and end the job, SUCCEEDED or FAILED per the result
     */
    public void complete(JobResult result, Instant now) {
        transitionTo(result.isSuccess() ? JobStatus.SUCCEEDED : JobStatus.FAILED);
        this.occurrenceCount++;
        this.lastResult = result;
        releaseLease();
        touch(now);
    }
    
    /**
     * Cancel a job that has not been claimed
     */
    public void cancel(Instant now) {
        transitionTo(JobStatus.CANCELLED);
        releaseLease();
        touch(now);
    }
    
    // Queries
    
    public boolean isClaimable(Instant now) {
        if (status == JobStatus.PENDING) {
            return lockedUntil == null || isLeaseExpired(now);
        }
        return status == JobStatus.RUNNING && isLeaseExpired(now);
    }
    
    public boolean isLeaseExpired(Instant now) {
        return lockedUntil != null && !lockedUntil.isAfter(now);
    }
    
    public boolean isDue(Clock clock) {
        return isDueAt(clock.now());
    }
    
    /**
     * Whether the job should be picked up by a poll at {@code asOf}
     */
    public boolean isDueAt(Instant asOf) {
        return !runAt.isAfter(asOf) && isClaimable(asOf);
    }
    
    public boolean isOverdue(Clock clock, Duration threshold) {
        if (!status.canExecute()) {
            return false;
        }
        return !clock.now().isBefore(runAt.plus(threshold));
    }
    
    public boolean isOverdue(Clock clock) {
        return isOverdue(clock, DEFAULT_OVERDUE_THRESHOLD);
    }
    
    @JsonIgnore
    public boolean isRecurring() {
        return recurrence != null && recurrence.isRepeating();
    }
    
    public boolean canRetry() {
        return attemptCount < maxRetries;
    }
    
    public boolean hasExceededMaxRetries() {
        return attemptCount >= maxRetries;
    }
    
    private void transitionTo(JobStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException(
                "Cannot transition job " + id + " from " + status + " to " + target);
        }
        this.status = target;
    }
    
    private void requireStatus(JobStatus expected) {
        if (status != expected) {
            throw new IllegalStateException("Job " + id + " is " + status + ", expected " + expected);
        }
    }
    
    private void releaseLease() {
        this.lockedUntil = null;
        this.lockedBy = null;
    }
    
    private void touch(Instant now) {
        this.updatedAt = now;
        this.version++;
    }
    
    // Accessors
    
    public UUID getId() { return id; }
    
    public String getJobType() { return jobType; }
    
    public String getTargetId() { return targetId; }
    
    public Map<String, Object> getPayload() { return payload; }
    
    public Instant getRunAt() { return runAt; }
    
    /**
     * Nominal time of the current occurrence. Differs from {@link #getRunAt()} only while
     * a retry is pending; recurrence is always computed from this value.
     */
    public Instant getOccurrenceRunAt() { return occurrenceRunAt; }
    
    public JobStatus getStatus() { return status; }
    
    public ScheduleRecurrence getRecurrence() { return recurrence; }
    
    public int getAttemptCount() { return attemptCount; }
    
    public int getOccurrenceCount() { return occurrenceCount; }
    
    public int getMaxRetries() { return maxRetries; }
    
    public int getPriority() { return priority; }
    
    public Map<String, Object> getMetadata() { return metadata; }
    
    public Instant getLockedUntil() { return lockedUntil; }
    
    public String getLockedBy() { return lockedBy; }
    
    public JobResult getLastResult() { return lastResult; }
    
    public Instant getCreatedAt() { return createdAt; }
    
    public Instant getUpdatedAt() { return updatedAt; }
    
    public long getVersion() { return version; }
    
    @Override
    public String toString() {
        return "ScheduledJob{id=" + id + ", jobType='" + jobType + "', targetId='" + targetId
            + "', status=" + status + ", runAt=" + runAt + ", attempt=" + attemptCount
            + ", occurrence=" + occurrenceCount + "}";
    }
}
