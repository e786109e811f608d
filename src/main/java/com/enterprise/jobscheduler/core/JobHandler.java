package com.enterprise.jobscheduler.core;

/**
 * Executes the business action for one or more job types.
 * <p>
 * Implementations must be thread-safe and idempotent: a job whose lease expires while
 * its handler is still running can be claimed again by another worker, so the same
 * attempt may be handled more than once. Transient failures are reported through
 * {@link JobResult#retry(String, java.time.Duration)}; an exception thrown from
 * {@link #handle(ScheduledJob)} is always treated as a permanent failure.
 */
public interface JobHandler {
    
    /**
     * Check if this handler can execute jobs of the given type
     */
    boolean supports(String jobType);
    
    /**
     * Execute the job and report the outcome
     */
    JobResult handle(ScheduledJob job);
}
