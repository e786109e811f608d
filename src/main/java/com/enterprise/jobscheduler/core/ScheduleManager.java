package com.enterprise.jobscheduler.core;

import com.enterprise.jobscheduler.exception.JobNotFoundException;
import com.enterprise.jobscheduler.exception.ScheduleValidationException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Main interface of the scheduler.
 * Provides methods for scheduling, executing and managing jobs.
 */
public interface ScheduleManager {
    
    /**
     * Validate and persist a new PENDING job
     */
    ScheduledJob schedule(ScheduleDefinition definition) throws ScheduleValidationException;
    
    /**
     * Jobs due now, highest priority first
     */
    List<ScheduledJob> getDueJobs();
    
    List<ScheduledJob> getDueJobs(Instant asOf);
    
    /**
     * Claim and run one attempt of the job, then persist what happens next.
     *
     * @return the handler result, or empty if another worker holds the job or the
     *         lease was lost before the result could be written
     */
    Optional<JobResult> executeJob(UUID id) throws JobNotFoundException;
    
    /**
     * Cancel a PENDING job. Running jobs are never pre-empted.
     *
     * @return false if the job is not PENDING
     */
    boolean cancel(UUID id) throws JobNotFoundException;
    
    Optional<ScheduledJob> find(UUID id);
    
    List<ScheduledJob> findByType(String jobType);
    
    List<ScheduledJob> findByTarget(String targetId);
    
    List<ScheduledJob> findByStatus(JobStatus status, int limit);
    
    boolean delete(UUID id);
    
    long count(JobStatus status);
    
    /**
     * Heartbeat for a job this manager is currently executing
     *
     * @return false if this manager does not hold the job's lease
     */
    boolean extendLease(UUID id);
    
    /**
     * Human readable description of when the job runs next
     */
    String describeNextRun(UUID id) throws JobNotFoundException;
}
