package com.enterprise.jobscheduler.core;

/**
 * Lifecycle status of a scheduled job.
 *
 * <pre>
 * PENDING -> RUNNING            (claim)
 * PENDING -> CANCELLED          (cancel)
 * RUNNING -> PENDING            (retry or next occurrence)
 * RUNNING -> SUCCEEDED | FAILED (terminal result)
 * </pre>
 */
public enum JobStatus {
    PENDING,        // Waiting for its run time
    RUNNING,        // Claimed by a worker under a lease
    SUCCEEDED,      // Finished successfully, no further runs
    FAILED,         // Finished with a failure, no further runs
    CANCELLED;      // Cancelled before it was claimed
    
    /**
     * Whether a job in this status may be claimed for execution
     */
    public boolean canExecute() {
        return this == PENDING;
    }
    
    /**
     * Whether the job has reached the end of its lifecycle
     */
    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }
    
    /**
     * Whether a transition from this status to {@code target} is allowed
     */
    public boolean canTransitionTo(JobStatus target) {
        switch (this) {
            case PENDING:
                return target == RUNNING || target == CANCELLED;
            case RUNNING:
                return target == PENDING || target == SUCCEEDED || target == FAILED;
            default:
                return false;
        }
    }
}
