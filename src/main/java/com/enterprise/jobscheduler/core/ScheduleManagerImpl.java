package com.enterprise.jobscheduler.core;

import com.enterprise.jobscheduler.exception.JobNotFoundException;
import com.enterprise.jobscheduler.exception.ScheduleValidationException;
import com.enterprise.jobscheduler.monitoring.SchedulerMetrics;
import com.enterprise.jobscheduler.recurrence.RecurrenceEngine;
import com.enterprise.jobscheduler.repository.ScheduleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Default {@link ScheduleManager}.
 * <p>
 * Each execution claims the job under a lease owned by a per-execution token
 * ({@code workerId/sequence}), so two threads of the same worker never mistake each
 * other's lease for their own.
 */
public class ScheduleManagerImpl implements ScheduleManager {
    
    private static final Logger logger = LoggerFactory.getLogger(ScheduleManagerImpl.class);
    
    private static final String NO_FURTHER_RUNS = "No further runs";
    
    private final ScheduleRepository repository;
    private final ExecutionEngine executionEngine;
    private final RecurrenceEngine recurrenceEngine;
    private final Clock clock;
    private final Duration leaseDuration;
    private final String workerId;
    private final int defaultMaxRetries;
    private final SchedulerMetrics metrics;
    private final ScheduleDefinitionValidator validator = new ScheduleDefinitionValidator();
    
    private final Map<UUID, String> activeLeases = new ConcurrentHashMap<>();
    private final AtomicLong executionSequence = new AtomicLong();
    
    public ScheduleManagerImpl(ScheduleRepository repository, ExecutionEngine executionEngine,
                               RecurrenceEngine recurrenceEngine, Clock clock,
                               Duration leaseDuration, String workerId, int defaultMaxRetries) {
        this(repository, executionEngine, recurrenceEngine, clock, leaseDuration, workerId,
            defaultMaxRetries, null);
    }
    
    public ScheduleManagerImpl(ScheduleRepository repository, ExecutionEngine executionEngine,
                               RecurrenceEngine recurrenceEngine, Clock clock,
                               Duration leaseDuration, String workerId, int defaultMaxRetries,
                               SchedulerMetrics metrics) {
        if (leaseDuration == null || leaseDuration.isZero() || leaseDuration.isNegative()) {
            throw new IllegalArgumentException("Lease duration must be positive");
        }
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("Worker id is required");
        }
        this.repository = repository;
        this.executionEngine = executionEngine;
        this.recurrenceEngine = recurrenceEngine;
        this.clock = clock;
        this.leaseDuration = leaseDuration;
        this.workerId = workerId;
        this.defaultMaxRetries = defaultMaxRetries;
        this.metrics = metrics;
    }
    
    @Override
    public ScheduledJob schedule(ScheduleDefinition definition) throws ScheduleValidationException {
        Instant now = clock.now();
        List<ScheduleDefinitionValidator.ValidationError> errors = validator.validate(definition, now);
        if (!errors.isEmpty()) {
            logger.warn("Rejected schedule definition: {}", errors);
            throw new ScheduleValidationException(errors);
        }
        
        ScheduledJob job = ScheduledJob.fromDefinition(UUID.randomUUID(), definition, defaultMaxRetries, now);
        repository.save(job);
        
        if (metrics != null) {
            metrics.recordScheduled(job);
        }
        logger.info("Scheduled job {} of type {} for target {} at {} ({})", job.getId(), job.getJobType(),
            job.getTargetId(), job.getRunAt(),
            job.getRecurrence() != null ? job.getRecurrence().getType() : RecurrenceType.ONCE);
        return job;
    }
    
    @Override
    public List<ScheduledJob> getDueJobs() {
        return getDueJobs(clock.now());
    }
    
    @Override
    public List<ScheduledJob> getDueJobs(Instant asOf) {
        return repository.findDue(asOf);
    }
    
    @Override
    public Optional<JobResult> executeJob(UUID id) throws JobNotFoundException {
        if (repository.find(id).isEmpty()) {
            throw new JobNotFoundException(id);
        }
        
        String leaseOwner = workerId + "/" + executionSequence.incrementAndGet();
        Instant claimedAt = clock.now();
        Optional<ScheduledJob> claimed = repository.claim(id, leaseOwner, claimedAt, claimedAt.plus(leaseDuration));
        if (claimed.isEmpty()) {
            logger.debug("Job {} could not be claimed by {}, skipping", id, leaseOwner);
            if (metrics != null) {
                metrics.recordClaimConflict(id);
            }
            return Optional.empty();
        }
        
        ScheduledJob job = claimed.get();
        logger.debug("Job {} claimed by {} until {}", id, leaseOwner, job.getLockedUntil());
        activeLeases.put(id, leaseOwner);
        try {
            ExecutionOutcome outcome = executionEngine.execute(job);
            JobResult result = outcome.getResult();
            Instant now = clock.now();
            NextAction applied;
            try {
                applied = apply(job, outcome, now);
            } catch (RuntimeException e) {
                // the job is still RUNNING; ending it here keeps a reclaim from failing the same way
                logger.error("Could not apply {} to job {}, failing it permanently", outcome.getAction(), id, e);
                result = JobResult.failure("could not apply " + outcome.getAction() + ": "
                        + e.getClass().getName() + ": " + e.getMessage())
                    .withTiming(now, result.getExecutionDurationMs());
                job.complete(result, now);
                applied = NextAction.TERMINAL;
            }
            
            if (!repository.complete(job, leaseOwner)) {
                logger.warn("Lease on job {} was lost during execution, discarding result: {}", id, result);
                if (metrics != null) {
                    metrics.recordLeaseLost(job);
                }
                return Optional.empty();
            }
            
            recordOutcome(job, applied);
            return Optional.of(result);
        } finally {
            activeLeases.remove(id, leaseOwner);
        }
    }
    
    /**
     * Move the claimed job to its next state. Returns the action actually taken, which is
     * TERMINAL for a recurring job whose schedule has ended.
     */
    private NextAction apply(ScheduledJob job, ExecutionOutcome outcome, Instant now) {
        JobResult result = outcome.getResult();
        switch (outcome.getAction()) {
            case RETRY:
                Instant retryAt = now.plus(outcome.getRetryDelay());
                job.scheduleRetry(retryAt, result, now);
                logger.warn("Job {} will be retried at {} (attempt {} of {})",
                    job.getId(), job.getRunAt(), job.getAttemptCount(), job.getMaxRetries());
                return NextAction.RETRY;
                
            case RESCHEDULE:
                Optional<Instant> next = nextOccurrence(job);
                if (next.isPresent()) {
                    job.advanceTo(next.get(), result, now);
                    logger.info("Job {} rescheduled to {} (occurrence {})",
                        job.getId(), job.getRunAt(), job.getOccurrenceCount() + 1);
                    return NextAction.RESCHEDULE;
                }
                job.complete(result, now);
                logger.info("Job {} schedule ended after {} occurrences, final status {}",
                    job.getId(), job.getOccurrenceCount(), job.getStatus());
                return NextAction.TERMINAL;
                
            case TERMINAL:
            default:
                job.complete(result, now);
                logger.info("Job {} finished with status {}", job.getId(), job.getStatus());
                return NextAction.TERMINAL;
        }
    }
    
    // The cadence is anchored on the occurrence slot, not on a retry-shifted runAt.
    // Slots before runAt were overtaken by retries and are skipped without counting.
    private Optional<Instant> nextOccurrence(ScheduledJob job) {
        ScheduleRecurrence recurrence = job.getRecurrence();
        int occurrenceCount = job.getOccurrenceCount();
        Optional<Instant> next = recurrenceEngine.calculateNextRunTime(
            job.getOccurrenceRunAt(), recurrence, occurrenceCount);
        while (next.isPresent() && next.get().isBefore(job.getRunAt())) {
            logger.debug("Skipping slot {} of job {}, already past {}", next.get(), job.getId(), job.getRunAt());
            next = recurrenceEngine.calculateNextRunTime(next.get(), recurrence, occurrenceCount);
        }
        return next;
    }
    
    private void recordOutcome(ScheduledJob job, NextAction applied) {
        if (metrics == null) {
            return;
        }
        switch (applied) {
            case RETRY:
                metrics.recordRetried(job);
                break;
            case RESCHEDULE:
                metrics.recordRescheduled(job);
                break;
            default:
                if (job.getStatus() == JobStatus.SUCCEEDED) {
                    metrics.recordSucceeded(job);
                } else {
                    metrics.recordFailed(job);
                }
        }
    }
    
    @Override
    public boolean cancel(UUID id) throws JobNotFoundException {
        ScheduledJob job = repository.find(id).orElseThrow(() -> new JobNotFoundException(id));
        
        Optional<ScheduledJob> cancelled = repository.cancel(id, clock.now());
        if (cancelled.isEmpty()) {
            logger.warn("Refused to cancel job {} in status {}", id, job.getStatus());
            return false;
        }
        
        if (metrics != null) {
            metrics.recordCancelled(cancelled.get());
        }
        logger.info("Job {} cancelled", id);
        return true;
    }
    
    @Override
    public Optional<ScheduledJob> find(UUID id) {
        return repository.find(id);
    }
    
    @Override
    public List<ScheduledJob> findByType(String jobType) {
        return repository.findByType(jobType);
    }
    
    @Override
    public List<ScheduledJob> findByTarget(String targetId) {
        return repository.findByTarget(targetId);
    }
    
    @Override
    public List<ScheduledJob> findByStatus(JobStatus status, int limit) {
        return repository.findByStatus(status, limit);
    }
    
    @Override
    public boolean delete(UUID id) {
        boolean deleted = repository.delete(id);
        if (deleted) {
            logger.info("Job {} deleted", id);
        }
        return deleted;
    }
    
    @Override
    public long count(JobStatus status) {
        return repository.count(status);
    }
    
    @Override
    public boolean extendLease(UUID id) {
        String leaseOwner = activeLeases.get(id);
        if (leaseOwner == null) {
            return false;
        }
        Instant now = clock.now();
        boolean extended = repository.extendLease(id, leaseOwner, now, now.plus(leaseDuration));
        if (!extended) {
            logger.warn("Could not extend lease on job {}, held by another worker", id);
        }
        return extended;
    }
    
    @Override
    public String describeNextRun(UUID id) throws JobNotFoundException {
        ScheduledJob job = repository.find(id).orElseThrow(() -> new JobNotFoundException(id));
        switch (job.getStatus()) {
            case PENDING:
                return recurrenceEngine.describeRelative(job.getRunAt());
            case RUNNING:
                return recurrenceEngine.calculateNextRunTime(job.getOccurrenceRunAt(), job.getRecurrence(),
                        job.getOccurrenceCount())
                    .map(recurrenceEngine::describeRelative)
                    .orElse(NO_FURTHER_RUNS);
            default:
                return NO_FURTHER_RUNS;
        }
    }
    
    public String getWorkerId() {
        return workerId;
    }
}
