package com.enterprise.jobscheduler.exception;

import java.util.UUID;

/**
 * Exception thrown when a requested job is not found
 */
public class JobNotFoundException extends SchedulingException {
    
    private final UUID jobId;
    
    public JobNotFoundException(UUID jobId) {
        super("Job not found: " + jobId);
        this.jobId = jobId;
    }
    
    public UUID getJobId() {
        return jobId;
    }
}
