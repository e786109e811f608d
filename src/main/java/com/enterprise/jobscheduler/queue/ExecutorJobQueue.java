package com.enterprise.jobscheduler.queue;

import com.enterprise.jobscheduler.core.ScheduleManager;
import com.enterprise.jobscheduler.core.ScheduledJob;
import com.enterprise.jobscheduler.exception.JobNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process {@link JobQueue} running {@link ScheduleManager#executeJob} on a pool of
 * worker threads. A job that is already queued and not yet started is not queued twice.
 */
public class ExecutorJobQueue implements JobQueue {
    
    private static final Logger logger = LoggerFactory.getLogger(ExecutorJobQueue.class);
    
    private final ScheduleManager manager;
    private final ScheduledThreadPoolExecutor executor;
    private final Duration shutdownTimeout;
    private final Set<UUID> queued = ConcurrentHashMap.newKeySet();
    
    public ExecutorJobQueue(ScheduleManager manager, int workerThreads, Duration shutdownTimeout) {
        this.manager = manager;
        this.shutdownTimeout = shutdownTimeout;
        this.executor = new ScheduledThreadPoolExecutor(workerThreads, new JobWorkerThreadFactory());
        this.executor.setRemoveOnCancelPolicy(true);
        // undispatched jobs stay PENDING in the repository and are picked up by the next poll
        this.executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        
        logger.info("ExecutorJobQueue initialized with {} worker threads", workerThreads);
    }
    
    @Override
    public void dispatch(ScheduledJob job, long delaySeconds) {
        UUID jobId = job.getId();
        if (!queued.add(jobId)) {
            logger.debug("Job {} is already queued, skipping dispatch", jobId);
            return;
        }
        
        try {
            executor.schedule(() -> run(jobId), Math.max(0L, delaySeconds), TimeUnit.SECONDS);
            logger.debug("Job {} dispatched with delay {}s", jobId, delaySeconds);
        } catch (RejectedExecutionException e) {
            queued.remove(jobId);
            logger.error("Dispatch of job {} rejected, queue is shut down", jobId);
            throw e;
        }
    }
    
    private void run(UUID jobId) {
        queued.remove(jobId);
        try {
            manager.executeJob(jobId);
        } catch (JobNotFoundException e) {
            logger.warn("Job {} disappeared before it could run", jobId);
        } catch (RuntimeException e) {
            logger.error("Execution of job {} failed", jobId, e);
        }
    }
    
    @Override
    public int size() {
        return queued.size();
    }
    
    /**
     * Stop accepting jobs and wait for running executions to finish
     */
    public void shutdown() {
        logger.info("Shutting down ExecutorJobQueue...");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn("Job workers did not terminate gracefully, forcing shutdown");
                executor.shutdownNow();
            }
            logger.info("ExecutorJobQueue shutdown completed");
        } catch (InterruptedException e) {
            logger.error("Interrupted during shutdown", e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        queued.clear();
    }
    
    public boolean isShutdown() {
        return executor.isShutdown();
    }
    
    private static class JobWorkerThreadFactory implements ThreadFactory {
        private final AtomicLong threadNumber = new AtomicLong(1);
        private final String namePrefix = "job-worker-";
        
        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + threadNumber.getAndIncrement());
            t.setDaemon(false);
            t.setPriority(Thread.NORM_PRIORITY);
            return t;
        }
    }
}
