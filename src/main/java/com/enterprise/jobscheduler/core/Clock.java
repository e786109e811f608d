package com.enterprise.jobscheduler.core;

import java.time.Instant;

/**
 * Time source for the scheduler.
 * Every component reads "now" through an injected clock so that due-ness,
 * leases and recurrence can be driven deterministically in tests.
 */
public interface Clock {
    
    /**
     * Current instant
     */
    Instant now();
    
    /**
     * Clock backed by the system wall clock
     */
    static Clock system() {
        return SystemClock.INSTANCE;
    }
}
