package com.enterprise.jobscheduler.queue;

import com.enterprise.jobscheduler.core.ScheduledJob;

/**
 * Hands due jobs to whatever executes them.
 */
public interface JobQueue {
    
    /**
     * Queue the job for execution after {@code delaySeconds}
     */
    void dispatch(ScheduledJob job, long delaySeconds);
    
    /**
     * Number of dispatched jobs not yet started
     */
    int size();
}
