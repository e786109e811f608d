package com.enterprise.jobscheduler.repository;

import com.enterprise.jobscheduler.core.JobStatus;
import com.enterprise.jobscheduler.core.ScheduledJob;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence boundary for scheduled jobs.
 * <p>
 * Implementations hand out detached copies and must make {@link #claim},
 * {@link #complete} and {@link #extendLease} atomic with respect to each other:
 * they are the only writes that race between workers.
 */
public interface ScheduleRepository {
    
    /**
     * Get a job by id
     */
    Optional<ScheduledJob> find(UUID id);
    
    /**
     * Jobs due at {@code asOf}: PENDING jobs whose run time has passed and whose lease,
     * if any, has expired, plus RUNNING jobs whose lease has expired. Ordered by
     * priority (highest first), then run time.
     */
    List<ScheduledJob> findDue(Instant asOf);
    
    List<ScheduledJob> findByType(String jobType);
    
    List<ScheduledJob> findByTarget(String targetId);
    
    /**
     * Up to {@code limit} jobs in the given status, earliest run time first
     */
    List<ScheduledJob> findByStatus(JobStatus status, int limit);
    
    /**
     * Insert or overwrite a job unconditionally
     */
    void save(ScheduledJob job);
    
    /**
     * Atomically move a claimable job to RUNNING under a lease held by {@code workerId}.
     * A job is claimable when it is PENDING without a live lease, or RUNNING with an
     * expired one. Of several concurrent claims on the same job exactly one succeeds.
     *
     * @return the claimed job, or empty if the job is missing or was not claimable
     */
    Optional<ScheduledJob> claim(UUID id, String workerId, Instant now, Instant lockedUntil);
    
    /**
     * Write the outcome of an execution, but only while the stored job is still RUNNING
     * under a lease held by {@code workerId}.
     *
     * @return false if the lease has been taken over in the meantime
     */
    boolean complete(ScheduledJob job, String workerId);
    
    /**
     * Extend the lease of a RUNNING job held by {@code workerId}
     */
    boolean extendLease(UUID id, String workerId, Instant now, Instant lockedUntil);
    
    /**
     * Atomically move a PENDING job to CANCELLED
     *
     * @return the cancelled job, or empty if the job is missing or no longer PENDING
     */
    Optional<ScheduledJob> cancel(UUID id, Instant now);
    
    boolean delete(UUID id);
    
    long count();
    
    long count(JobStatus status);
}
