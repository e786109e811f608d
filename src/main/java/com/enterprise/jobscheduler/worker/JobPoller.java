package com.enterprise.jobscheduler.worker;

import com.enterprise.jobscheduler.core.Clock;
import com.enterprise.jobscheduler.core.ScheduleManager;
import com.enterprise.jobscheduler.core.ScheduledJob;
import com.enterprise.jobscheduler.queue.JobQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodically moves due jobs from the manager to the queue.
 */
public class JobPoller {
    
    private static final Logger logger = LoggerFactory.getLogger(JobPoller.class);
    
    private final ScheduleManager manager;
    private final JobQueue queue;
    private final Clock clock;
    private final Duration pollInterval;
    private final int batchSize;
    private final Duration shutdownTimeout;
    private final AtomicBoolean running = new AtomicBoolean(false);
    
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> pollTask;
    
    public JobPoller(ScheduleManager manager, JobQueue queue, Clock clock,
                     Duration pollInterval, int batchSize, Duration shutdownTimeout) {
        if (pollInterval == null || pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("Poll interval must be positive");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive");
        }
        this.manager = manager;
        this.queue = queue;
        this.clock = clock;
        this.pollInterval = pollInterval;
        this.batchSize = batchSize;
        this.shutdownTimeout = shutdownTimeout;
    }
    
    public void start() {
        if (running.compareAndSet(false, true)) {
            logger.info("Starting JobPoller (interval {}ms, batch size {})", pollInterval.toMillis(), batchSize);
            
            scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "job-poller");
                t.setDaemon(false);
                return t;
            });
            pollTask = scheduler.scheduleWithFixedDelay(
                this::pollSafely, 0, pollInterval.toMillis(), TimeUnit.MILLISECONDS);
            
            logger.info("JobPoller started successfully");
        }
    }
    
    public void stop() {
        if (running.compareAndSet(true, false)) {
            logger.info("Stopping JobPoller...");
            
            if (pollTask != null) {
                pollTask.cancel(false);
            }
            if (scheduler != null) {
                scheduler.shutdown();
                try {
                    if (!scheduler.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                        scheduler.shutdownNow();
                    }
                } catch (InterruptedException e) {
                    scheduler.shutdownNow();
                    Thread.currentThread().interrupt();
                }
            }
            
            logger.info("JobPoller stopped successfully");
        }
    }
    
    public boolean isRunning() {
        return running.get();
    }
    
    /**
     * Run a single poll cycle
     *
     * @return the number of jobs dispatched
     */
    public int pollOnce() {
        List<ScheduledJob> due = manager.getDueJobs(clock.now());
        int dispatched = 0;
        for (ScheduledJob job : due) {
            if (dispatched >= batchSize) {
                logger.debug("Batch limit {} reached, {} due jobs left for the next cycle",
                    batchSize, due.size() - dispatched);
                break;
            }
            if (job.isOverdue(clock)) {
                logger.warn("Job {} of type {} is overdue, was due at {}", job.getId(), job.getJobType(), job.getRunAt());
            }
            queue.dispatch(job, 0L);
            dispatched++;
        }
        if (dispatched > 0) {
            logger.debug("Dispatched {} due jobs", dispatched);
        }
        return dispatched;
    }
    
    private void pollSafely() {
        try {
            pollOnce();
        } catch (Exception e) {
            logger.error("Poll cycle failed", e);
        }
    }
}
