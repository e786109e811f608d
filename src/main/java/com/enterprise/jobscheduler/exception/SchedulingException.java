package com.enterprise.jobscheduler.exception;

/**
 * Base exception for scheduling related errors
 */
public class SchedulingException extends Exception {
    
    public SchedulingException(String message) {
        super(message);
    }
    
    public SchedulingException(String message, Throwable cause) {
        super(message, cause);
    }
}
