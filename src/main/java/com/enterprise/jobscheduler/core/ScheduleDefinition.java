package com.enterprise.jobscheduler.core;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable request to schedule a job.
 * A definition carries no identity: scheduling the same definition twice
 * produces two independent jobs.
 */
public final class ScheduleDefinition {
    
    private final String jobType;
    private final String targetId;
    private final Instant runAt;
    private final Map<String, Object> payload;
    private final ScheduleRecurrence recurrence;
    private final Integer maxRetries;
    private final int priority;
    private final Map<String, Object> metadata;
    
    private ScheduleDefinition(Builder builder) {
        this.jobType = builder.jobType;
        this.targetId = builder.targetId;
        this.runAt = builder.runAt;
        this.payload = Collections.unmodifiableMap(new LinkedHashMap<>(builder.payload));
        this.recurrence = builder.recurrence;
        this.maxRetries = builder.maxRetries;
        this.priority = builder.priority;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
    }
    
    /**
     * Discriminant used to route the job to a handler
     */
    public String getJobType() { return jobType; }
    
    /**
     * Opaque reference to the entity the job acts on
     */
    public String getTargetId() { return targetId; }
    
    /**
     * First run time
     */
    public Instant getRunAt() { return runAt; }
    
    public Map<String, Object> getPayload() { return payload; }
    
    /**
     * Recurrence rule, null for a one-off job
     */
    public ScheduleRecurrence getRecurrence() { return recurrence; }
    
    /**
     * Per-job retry limit, null to use the configured policy default
     */
    public Integer getMaxRetries() { return maxRetries; }
    
    public int getPriority() { return priority; }
    
    public Map<String, Object> getMetadata() { return metadata; }
    
    public static Builder builder() {
        return new Builder();
    }
    
    /**
     * Builder for schedule definitions. Validation happens when the definition
     * is submitted to the {@link ScheduleManager}.
     */
    public static class Builder {
        private String jobType;
        private String targetId;
        private Instant runAt;
        private Map<String, Object> payload = new LinkedHashMap<>();
        private ScheduleRecurrence recurrence;
        private Integer maxRetries;
        private int priority = 0;
        private Map<String, Object> metadata = new LinkedHashMap<>();
        
        public Builder jobType(String jobType) {
            this.jobType = jobType;
            return this;
        }
        
        public Builder targetId(String targetId) {
            this.targetId = targetId;
            return this;
        }
        
        public Builder runAt(Instant runAt) {
            this.runAt = runAt;
            return this;
        }
        
        public Builder payload(Map<String, Object> payload) {
            this.payload = payload == null ? new LinkedHashMap<>() : new LinkedHashMap<>(payload);
            return this;
        }
        
        public Builder payloadEntry(String key, Object value) {
            this.payload.put(key, value);
            return this;
        }
        
        public Builder recurrence(ScheduleRecurrence recurrence) {
            this.recurrence = recurrence;
            return this;
        }
        
        public Builder maxRetries(Integer maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }
        
        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }
        
        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata);
            return this;
        }
        
        public ScheduleDefinition build() {
            return new ScheduleDefinition(this);
        }
    }
}
