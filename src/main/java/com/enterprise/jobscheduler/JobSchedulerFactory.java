package com.enterprise.jobscheduler;

import com.enterprise.jobscheduler.config.ConfigValidator;
import com.enterprise.jobscheduler.config.SchedulerConfig;
import com.enterprise.jobscheduler.core.*;
import com.enterprise.jobscheduler.monitoring.SchedulerMetrics;
import com.enterprise.jobscheduler.queue.ExecutorJobQueue;
import com.enterprise.jobscheduler.recurrence.RecurrenceEngine;
import com.enterprise.jobscheduler.repository.InMemoryScheduleRepository;
import com.enterprise.jobscheduler.repository.MapDBScheduleRepository;
import com.enterprise.jobscheduler.repository.ScheduleRepository;
import com.enterprise.jobscheduler.worker.JobPoller;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Factory for creating and wiring a job scheduler
 */
public class JobSchedulerFactory {
    
    private static final Logger logger = LoggerFactory.getLogger(JobSchedulerFactory.class);
    
    /**
     * Create a scheduler with default configuration
     */
    public static JobScheduler createDefault(JobHandler... handlers) {
        return create(SchedulerConfig.builder().build(), handlers);
    }
    
    /**
     * Create a scheduler with custom configuration, using the system clock and the
     * repository selected by the storage configuration
     */
    public static JobScheduler create(SchedulerConfig config, JobHandler... handlers) {
        validate(config);
        ScheduleRepository repository = createRepository(config.getStorageConfig());
        return assemble(config, Clock.system(), repository, repository instanceof AutoCloseable, handlers);
    }
    
    /**
     * Create a scheduler on a clock and repository supplied by the host. The repository
     * is not closed when the scheduler stops.
     */
    public static JobScheduler create(SchedulerConfig config, Clock clock, ScheduleRepository repository,
                                      JobHandler... handlers) {
        validate(config);
        if (clock == null || repository == null) {
            throw new IllegalArgumentException("Clock and repository are required");
        }
        return assemble(config, clock, repository, false, handlers);
    }
    
    private static void validate(SchedulerConfig config) {
        ConfigValidator validator = new ConfigValidator();
        List<ConfigValidator.ValidationError> errors = validator.validate(config);
        
        if (!errors.isEmpty()) {
            StringBuilder errorMsg = new StringBuilder("Configuration validation failed:\n");
            errors.forEach(error -> errorMsg.append("  - ").append(error).append("\n"));
            throw new IllegalArgumentException(errorMsg.toString());
        }
    }
    
    private static JobScheduler assemble(SchedulerConfig config, Clock clock, ScheduleRepository repository,
                                         boolean ownsRepository, JobHandler... handlers) {
        logger.info("Creating JobScheduler for worker {} in zone {}",
            config.getLeaseConfig().getWorkerId(), config.getZoneId());
        
        SchedulerMetrics metrics = null;
        if (config.getMonitoringConfig().isEnableMetrics()) {
            metrics = new SchedulerMetrics(new SimpleMeterRegistry());
            metrics.bindPendingGauge(repository);
        }
        
        HandlerRegistry registry = new HandlerRegistry(Arrays.asList(handlers));
        RetryPolicy retryPolicy = createRetryPolicy(config.getRetryConfig());
        ExecutionEngine executionEngine = new ExecutionEngine(registry, retryPolicy, clock, metrics);
        RecurrenceEngine recurrenceEngine = new RecurrenceEngine(clock, config.getZoneId());
        
        ScheduleManager manager = new ScheduleManagerImpl(repository, executionEngine, recurrenceEngine, clock,
            config.getLeaseConfig().getLeaseDuration(), config.getLeaseConfig().getWorkerId(),
            config.getRetryConfig().getMaxRetries(), metrics);
        
        SchedulerConfig.PollerConfig pollerConfig = config.getPollerConfig();
        ExecutorJobQueue queue = new ExecutorJobQueue(manager, pollerConfig.getWorkerThreads(),
            pollerConfig.getShutdownTimeout());
        JobPoller poller = new JobPoller(manager, queue, clock, pollerConfig.getPollInterval(),
            pollerConfig.getBatchSize(), pollerConfig.getShutdownTimeout());
        
        logger.info("JobScheduler created successfully with {} handlers", registry.size());
        return new JobScheduler(manager, registry, recurrenceEngine, queue, poller, metrics,
            ownsRepository ? (AutoCloseable) repository : null);
    }
    
    private static ScheduleRepository createRepository(SchedulerConfig.StorageConfig config) {
        if (config.isPersistent()) {
            return new MapDBScheduleRepository(config.getDbPath());
        }
        return new InMemoryScheduleRepository();
    }
    
    private static RetryPolicy createRetryPolicy(SchedulerConfig.RetryConfig config) {
        return RetryPolicy.builder()
            .maxRetries(config.getMaxRetries())
            .baseDelay(config.getBaseDelay())
            .backoffMultiplier(config.getBackoffMultiplier())
            .maxDelay(config.getMaxDelay())
            .enableJitter(config.isEnableJitter())
            .build();
    }
    
    /**
     * A wired scheduler: the manager plus the poller and worker pool that drive it.
     * Stopping is final; create a new scheduler to run again.
     */
    public static class JobScheduler {
        private final ScheduleManager manager;
        private final HandlerRegistry handlers;
        private final RecurrenceEngine recurrenceEngine;
        private final ExecutorJobQueue queue;
        private final JobPoller poller;
        private final SchedulerMetrics metrics;
        private final AutoCloseable ownedRepository;
        private final AtomicBoolean stopped = new AtomicBoolean(false);
        
        JobScheduler(ScheduleManager manager, HandlerRegistry handlers, RecurrenceEngine recurrenceEngine,
                     ExecutorJobQueue queue, JobPoller poller, SchedulerMetrics metrics,
                     AutoCloseable ownedRepository) {
            this.manager = manager;
            this.handlers = handlers;
            this.recurrenceEngine = recurrenceEngine;
            this.queue = queue;
            this.poller = poller;
            this.metrics = metrics;
            this.ownedRepository = ownedRepository;
        }
        
        public ScheduleManager getManager() { return manager; }
        public HandlerRegistry getHandlers() { return handlers; }
        public RecurrenceEngine getRecurrenceEngine() { return recurrenceEngine; }
        public JobPoller getPoller() { return poller; }
        
        /**
         * Metrics, or null when metrics are disabled
         */
        public SchedulerMetrics getMetrics() { return metrics; }
        
        public void start() {
            if (stopped.get()) {
                throw new IllegalStateException("JobScheduler has been stopped");
            }
            poller.start();
        }
        
        public void stop() {
            if (stopped.compareAndSet(false, true)) {
                poller.stop();
                queue.shutdown();
                if (ownedRepository != null) {
                    try {
                        ownedRepository.close();
                    } catch (Exception e) {
                        logger.error("Failed to close repository", e);
                    }
                }
                logger.info("JobScheduler stopped");
            }
        }
        
        public boolean isRunning() {
            return poller.isRunning();
        }
    }
}
