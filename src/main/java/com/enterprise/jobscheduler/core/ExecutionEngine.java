package com.enterprise.jobscheduler.core;

import com.enterprise.jobscheduler.exception.HandlerNotFoundException;
import com.enterprise.jobscheduler.monitoring.SchedulerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Runs one attempt of a claimed job and decides what happens next.
 * <p>
 * The engine resolves the handler, invokes it inside a failure boundary and
 * interprets the {@link JobResult} against the {@link RetryPolicy}. It keeps no
 * per-invocation state, so a single instance can serve any number of workers.
 */
public class ExecutionEngine {
    
    private static final Logger logger = LoggerFactory.getLogger(ExecutionEngine.class);
    
    private final HandlerRegistry handlers;
    private final RetryPolicy retryPolicy;
    private final Clock clock;
    private final SchedulerMetrics metrics;
    
    public ExecutionEngine(HandlerRegistry handlers, RetryPolicy retryPolicy, Clock clock) {
        this(handlers, retryPolicy, clock, null);
    }
    
    public ExecutionEngine(HandlerRegistry handlers, RetryPolicy retryPolicy, Clock clock,
                           SchedulerMetrics metrics) {
        this.handlers = handlers;
        this.retryPolicy = retryPolicy;
        this.clock = clock;
        this.metrics = metrics;
    }
    
    /**
     * Execute one attempt of the job. Never throws for handler failures.
     */
    public ExecutionOutcome execute(ScheduledJob job) {
        JobHandler handler;
        try {
            handler = handlers.resolve(job.getJobType());
        } catch (HandlerNotFoundException e) {
            logger.error("No handler for job {} of type {}, failing permanently", job.getId(), job.getJobType());
            if (metrics != null) {
                metrics.recordMissingHandler(job.getJobType());
            }
            JobResult result = JobResult.failure("no handler for job type: " + job.getJobType())
                .withTiming(clock.now(), 0L);
            return ExecutionOutcome.terminal(result);
        } catch (RuntimeException e) {
            // supports() is handler code too; a throwing one fails the job like a throwing handle()
            logger.error("Resolving a handler for job {} of type {} failed", job.getId(), job.getJobType(), e);
            JobResult result = JobResult.failure("handler resolution failed: "
                    + e.getClass().getName() + ": " + e.getMessage())
                .withTiming(clock.now(), 0L);
            return ExecutionOutcome.terminal(result);
        }
        
        logger.debug("Executing job {} of type {} (attempt {}, occurrence {})",
            job.getId(), job.getJobType(), job.getAttemptCount() + 1, job.getOccurrenceCount() + 1);
        
        // wall-clock time comes from the injected Clock; durations use the monotonic timer
        long startTime = System.nanoTime();
        JobResult result = invoke(handler, job);
        long executionTime = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startTime);
        result = result.withTiming(clock.now(), executionTime);
        
        if (metrics != null) {
            metrics.recordExecuted(job, result, executionTime);
        }
        
        if (result.isSuccess()) {
            logger.debug("Job {} succeeded in {}ms", job.getId(), executionTime);
        } else {
            logger.warn("Job {} failed in {}ms: {}", job.getId(), executionTime, result.getMessage());
        }
        
        return decide(job, result);
    }
    
    private JobResult invoke(JobHandler handler, ScheduledJob job) {
        try {
            JobResult result = handler.handle(job);
            if (result == null) {
                logger.error("Handler {} returned no result for job {}", handler.getClass().getName(), job.getId());
                return JobResult.failure("handler returned no result");
            }
            return result;
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable t) {
            // exceptions carry no retry contract; only a returned result can ask for a retry
            logger.error("Handler {} threw while executing job {}", handler.getClass().getName(), job.getId(), t);
            return JobResult.failure("handler threw " + t.getClass().getName() + ": " + t.getMessage());
        }
    }
    
    private ExecutionOutcome decide(ScheduledJob job, JobResult result) {
        if (retryPolicy.shouldRetry(job, result)) {
            Duration delay = retryPolicy.getRetryDelay(job, result);
            return ExecutionOutcome.retry(result, delay);
        }
        
        if (!result.isSuccess() && result.shouldRetry()) {
            logger.warn("Job {} exhausted its {} retries", job.getId(), job.getMaxRetries());
        }
        
        if (job.isRecurring()) {
            return ExecutionOutcome.reschedule(result);
        }
        return ExecutionOutcome.terminal(result);
    }
    
    public HandlerRegistry getHandlers() {
        return handlers;
    }
    
    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }
}
