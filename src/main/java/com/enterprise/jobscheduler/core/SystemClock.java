package com.enterprise.jobscheduler.core;

import java.time.Instant;

/**
 * Wall-clock implementation of {@link Clock}
 */
public final class SystemClock implements Clock {
    
    static final SystemClock INSTANCE = new SystemClock();
    
    private SystemClock() {
    }
    
    @Override
    public Instant now() {
        return Instant.now();
    }
}
