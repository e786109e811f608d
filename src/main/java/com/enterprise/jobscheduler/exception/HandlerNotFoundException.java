package com.enterprise.jobscheduler.exception;

/**
 * Exception thrown when no registered handler supports a job type
 */
public class HandlerNotFoundException extends SchedulingException {
    
    private final String jobType;
    
    public HandlerNotFoundException(String jobType) {
        super("No handler found for job type: " + jobType);
        this.jobType = jobType;
    }
    
    public String getJobType() {
        return jobType;
    }
}
