package com.enterprise.jobscheduler.monitoring;

import com.enterprise.jobscheduler.core.JobResult;
import com.enterprise.jobscheduler.core.JobStatus;
import com.enterprise.jobscheduler.core.ScheduledJob;
import com.enterprise.jobscheduler.repository.ScheduleRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Collects and exposes metrics for the scheduler
 */
public class SchedulerMetrics {
    
    private static final Logger logger = LoggerFactory.getLogger(SchedulerMetrics.class);
    
    private final MeterRegistry meterRegistry;
    private final ConcurrentHashMap<String, Counter> jobTypeCounters = new ConcurrentHashMap<>();
    
    private final Counter jobsScheduled;
    private final Counter jobsExecuted;
    private final Counter jobsSucceeded;
    private final Counter jobsFailed;
    private final Counter jobsRetried;
    private final Counter jobsRescheduled;
    private final Counter jobsCancelled;
    private final Counter claimConflicts;
    private final Counter missingHandlers;
    private final Counter leasesLost;
    
    private final Timer executionTime;
    
    public SchedulerMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        
        this.jobsScheduled = Counter.builder("scheduler.jobs.scheduled")
            .description("Total number of jobs scheduled")
            .register(meterRegistry);
        
        this.jobsExecuted = Counter.builder("scheduler.jobs.executed")
            .description("Total number of execution attempts")
            .register(meterRegistry);
        
        this.jobsSucceeded = Counter.builder("scheduler.jobs.succeeded")
            .description("Total number of jobs that ended successfully")
            .register(meterRegistry);
        
        this.jobsFailed = Counter.builder("scheduler.jobs.failed")
            .description("Total number of jobs that ended in failure")
            .register(meterRegistry);
        
        this.jobsRetried = Counter.builder("scheduler.jobs.retried")
            .description("Total number of attempts scheduled for retry")
            .register(meterRegistry);
        
        this.jobsRescheduled = Counter.builder("scheduler.jobs.rescheduled")
            .description("Total number of recurring jobs moved to their next occurrence")
            .register(meterRegistry);
        
        this.jobsCancelled = Counter.builder("scheduler.jobs.cancelled")
            .description("Total number of jobs cancelled")
            .register(meterRegistry);
        
        this.claimConflicts = Counter.builder("scheduler.claims.conflicts")
            .description("Claims lost to another worker")
            .register(meterRegistry);
        
        this.missingHandlers = Counter.builder("scheduler.handlers.missing")
            .description("Executions that found no handler for their job type")
            .register(meterRegistry);
        
        this.leasesLost = Counter.builder("scheduler.leases.lost")
            .description("Completions discarded because the lease had been taken over")
            .register(meterRegistry);
        
        this.executionTime = Timer.builder("scheduler.job.execution.time")
            .description("Handler execution time")
            .register(meterRegistry);
        
        logger.info("SchedulerMetrics initialized");
    }
    
    /**
     * Expose the number of PENDING jobs held by the repository as a gauge
     */
    public void bindPendingGauge(ScheduleRepository repository) {
        Gauge.builder("scheduler.jobs.pending", repository, r -> r.count(JobStatus.PENDING))
            .description("Number of pending jobs")
            .register(meterRegistry);
    }
    
    public void recordScheduled(ScheduledJob job) {
        jobsScheduled.increment();
        getJobTypeCounter(job.getJobType(), "scheduled").increment();
    }
    
    public void recordExecuted(ScheduledJob job, JobResult result, long executionTimeMs) {
        jobsExecuted.increment();
        executionTime.record(executionTimeMs, TimeUnit.MILLISECONDS);
        getJobTypeCounter(job.getJobType(), result.isSuccess() ? "success" : "failure").increment();
        
        logger.debug("Recorded execution of job {} in {}ms", job.getId(), executionTimeMs);
    }
    
    public void recordRetried(ScheduledJob job) {
        jobsRetried.increment();
        getJobTypeCounter(job.getJobType(), "retried").increment();
    }
    
    public void recordRescheduled(ScheduledJob job) {
        jobsRescheduled.increment();
        getJobTypeCounter(job.getJobType(), "rescheduled").increment();
    }
    
    public void recordSucceeded(ScheduledJob job) {
        jobsSucceeded.increment();
        getJobTypeCounter(job.getJobType(), "succeeded").increment();
    }
    
    public void recordFailed(ScheduledJob job) {
        jobsFailed.increment();
        getJobTypeCounter(job.getJobType(), "failed").increment();
    }
    
    public void recordCancelled(ScheduledJob job) {
        jobsCancelled.increment();
        getJobTypeCounter(job.getJobType(), "cancelled").increment();
    }
    
    public void recordClaimConflict(UUID jobId) {
        claimConflicts.increment();
        logger.debug("Recorded claim conflict for job {}", jobId);
    }
    
    public void recordMissingHandler(String jobType) {
        missingHandlers.increment();
    }
    
    public void recordLeaseLost(ScheduledJob job) {
        leasesLost.increment();
    }
    
    private Counter getJobTypeCounter(String jobType, String outcome) {
        String key = jobType + "." + outcome;
        return jobTypeCounters.computeIfAbsent(key, k ->
            Counter.builder("scheduler.job.type")
                .tag("type", jobType)
                .tag("outcome", outcome)
                .description("Job count by type and outcome")
                .register(meterRegistry)
        );
    }
    
    /**
     * Snapshot of the scheduler counters
     */
    public Map<String, Object> getMetrics() {
        Map<String, Object> metrics = new ConcurrentHashMap<>();
        
        metrics.put("jobs.scheduled", jobsScheduled.count());
        metrics.put("jobs.executed", jobsExecuted.count());
        metrics.put("jobs.succeeded", jobsSucceeded.count());
        metrics.put("jobs.failed", jobsFailed.count());
        metrics.put("jobs.retried", jobsRetried.count());
        metrics.put("jobs.rescheduled", jobsRescheduled.count());
        metrics.put("jobs.cancelled", jobsCancelled.count());
        metrics.put("claims.conflicts", claimConflicts.count());
        metrics.put("handlers.missing", missingHandlers.count());
        metrics.put("leases.lost", leasesLost.count());
        
        metrics.put("job.execution.time.mean", executionTime.mean(TimeUnit.MILLISECONDS));
        metrics.put("job.execution.time.max", executionTime.max(TimeUnit.MILLISECONDS));
        
        return metrics;
    }
}
