package com.enterprise.jobscheduler;

import com.enterprise.jobscheduler.JobSchedulerFactory.JobScheduler;
import com.enterprise.jobscheduler.config.SchedulerConfig;
import com.enterprise.jobscheduler.core.JobHandler;
import com.enterprise.jobscheduler.core.JobResult;
import com.enterprise.jobscheduler.core.JobStatus;
import com.enterprise.jobscheduler.core.MutableClock;
import com.enterprise.jobscheduler.core.ScheduleDefinition;
import com.enterprise.jobscheduler.core.ScheduledJob;
import com.enterprise.jobscheduler.repository.InMemoryScheduleRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Function;

class JobSchedulerFactoryTest {
    
    @TempDir
    File tempDir;
    
    @Test
    void testCreateDefault() {
        JobScheduler scheduler = JobSchedulerFactory.createDefault(handler("report", job -> JobResult.success()));
        try {
            assertNotNull(scheduler.getManager());
            assertNotNull(scheduler.getMetrics());
            assertEquals(1, scheduler.getHandlers().size());
            assertFalse(scheduler.isRunning());
        } finally {
            scheduler.stop();
        }
    }
    
    @Test
    void testInvalidConfigRejected() {
        SchedulerConfig config = SchedulerConfig.builder()
            .pollerConfig(new SchedulerConfig.PollerConfig(Duration.ofSeconds(1), 0, 4, Duration.ofSeconds(5)))
            .build();
        
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> JobSchedulerFactory.create(config));
        assertTrue(e.getMessage().contains("poller.batchSize"));
    }
    
    @Test
    void testMetricsDisabled() {
        SchedulerConfig config = SchedulerConfig.builder()
            .monitoringConfig(new SchedulerConfig.MonitoringConfig(false))
            .build();
        
        JobScheduler scheduler = JobSchedulerFactory.create(config);
        try {
            assertNull(scheduler.getMetrics());
        } finally {
            scheduler.stop();
        }
    }
    
    @Test
    void testStartStopLifecycle() {
        JobScheduler scheduler = JobSchedulerFactory.createDefault();
        
        scheduler.start();
        assertTrue(scheduler.isRunning());
        
        scheduler.stop();
        assertFalse(scheduler.isRunning());
        assertThrows(IllegalStateException.class, scheduler::start);
        
        // stopping twice is harmless
        scheduler.stop();
    }
    
    @Test
    void testHostSuppliedClockAndRepository() throws Exception {
        MutableClock clock = MutableClock.at("2024-01-15T09:00:00Z");
        InMemoryScheduleRepository repository = new InMemoryScheduleRepository();
        JobScheduler scheduler = JobSchedulerFactory.create(SchedulerConfig.builder().build(), clock, repository,
            handler("report", job -> JobResult.success()));
        try {
            ScheduledJob job = scheduler.getManager().schedule(ScheduleDefinition.builder()
                .jobType("report")
                .targetId("account-1")
                .runAt(clock.now())
                .build());
            
            assertTrue(repository.find(job.getId()).isPresent());
            Optional<JobResult> result = scheduler.getManager().executeJob(job.getId());
            assertTrue(result.isPresent());
            assertTrue(result.get().isSuccess());
            assertEquals(JobStatus.SUCCEEDED, repository.find(job.getId()).orElseThrow().getStatus());
        } finally {
            scheduler.stop();
        }
        
        // host-owned repository stays usable
        assertEquals(1, repository.count());
    }
    
    @Test
    void testPersistentStorageSurvivesRestart() throws Exception {
        String dbPath = new File(tempDir, "jobs.db").getAbsolutePath();
        SchedulerConfig config = SchedulerConfig.builder()
            .storageConfig(new SchedulerConfig.StorageConfig(dbPath))
            .build();
        Instant runAt = Instant.now().plus(Duration.ofHours(1));
        
        JobScheduler first = JobSchedulerFactory.create(config);
        ScheduledJob job = first.getManager().schedule(ScheduleDefinition.builder()
            .jobType("report")
            .targetId("account-1")
            .runAt(runAt)
            .build());
        first.stop();
        
        JobScheduler second = JobSchedulerFactory.create(config);
        try {
            ScheduledJob reloaded = second.getManager().find(job.getId()).orElseThrow();
            assertEquals(JobStatus.PENDING, reloaded.getStatus());
            assertEquals(runAt, reloaded.getRunAt());
        } finally {
            second.stop();
        }
    }
    
    private static JobHandler handler(String jobType, Function<ScheduledJob, JobResult> body) {
        return new JobHandler() {
            @Override
            public boolean supports(String type) {
                return jobType.equals(type);
            }
            
            @Override
            public JobResult handle(ScheduledJob job) {
                return body.apply(job);
            }
        };
    }
}
