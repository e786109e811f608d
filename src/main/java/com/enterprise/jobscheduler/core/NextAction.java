package com.enterprise.jobscheduler.core;

/**
 * What happens to a job after an execution attempt
 */
public enum NextAction {
    RETRY,          // Same occurrence runs again after a delay
    RESCHEDULE,     // Occurrence is closed, recurrence decides the next one
    TERMINAL        // Job ends as SUCCEEDED or FAILED
}
