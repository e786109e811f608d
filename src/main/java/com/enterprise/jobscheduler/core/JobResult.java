package com.enterprise.jobscheduler.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one execution attempt, produced by a {@link JobHandler}.
 * Handlers signal transient failures by returning a result with {@code shouldRetry}
 * set, never by throwing.
 */
public final class JobResult {
    
    private final boolean success;
    private final boolean shouldRetry;
    private final Duration retryDelay;
    private final String message;
    private final Map<String, Object> output;
    private final Instant completedAt;
    private final long executionDurationMs;
    
    @JsonCreator
    public JobResult(@JsonProperty("success") boolean success,
                     @JsonProperty("shouldRetry") boolean shouldRetry,
                     @JsonProperty("retryDelay") Duration retryDelay,
                     @JsonProperty("message") String message,
                     @JsonProperty("output") Map<String, Object> output,
                     @JsonProperty("completedAt") Instant completedAt,
                     @JsonProperty("executionDurationMs") long executionDurationMs) {
        if (success && shouldRetry) {
            throw new IllegalArgumentException("A successful result cannot request a retry");
        }
        if (retryDelay != null && retryDelay.isNegative()) {
            throw new IllegalArgumentException("Retry delay cannot be negative");
        }
        this.success = success;
        this.shouldRetry = shouldRetry;
        this.retryDelay = retryDelay;
        this.message = message;
        this.output = output == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(output));
        this.completedAt = completedAt;
        this.executionDurationMs = executionDurationMs;
    }
    
    public static JobResult success() {
        return new JobResult(true, false, null, null, null, null, 0L);
    }
    
    public static JobResult success(Map<String, Object> output) {
        return new JobResult(true, false, null, null, output, null, 0L);
    }
    
    public static JobResult success(String message, Map<String, Object> output) {
        return new JobResult(true, false, null, message, output, null, 0L);
    }
    
    /**
     * Permanent failure, never retried
     */
    public static JobResult failure(String message) {
        return new JobResult(false, false, null, message, null, null, 0L);
    }
    
    /**
     * Transient failure; a null delay falls back to the retry policy's backoff
     */
    public static JobResult retry(String message, Duration retryDelay) {
        return new JobResult(false, true, retryDelay, message, null, null, 0L);
    }
    
    public static JobResult failure(String message, boolean shouldRetry, Duration retryDelay) {
        return new JobResult(false, shouldRetry, retryDelay, message, null, null, 0L);
    }
    
    /**
     * Copy of this result stamped with its completion time and duration
     */
    public JobResult withTiming(Instant completedAt, long executionDurationMs) {
        return new JobResult(success, shouldRetry, retryDelay, message, output, completedAt, executionDurationMs);
    }
    
    public boolean isSuccess() { return success; }
    
    @JsonProperty("shouldRetry")
    public boolean shouldRetry() { return shouldRetry; }
    
    public Duration getRetryDelay() { return retryDelay; }
    
    public String getMessage() { return message; }
    
    public Map<String, Object> getOutput() { return output; }
    
    public Instant getCompletedAt() { return completedAt; }
    
    public long getExecutionDurationMs() { return executionDurationMs; }
    
    @Override
    public String toString() {
        return "JobResult{success=" + success + ", shouldRetry=" + shouldRetry
            + ", retryDelay=" + retryDelay + ", message='" + message + "'}";
    }
}
