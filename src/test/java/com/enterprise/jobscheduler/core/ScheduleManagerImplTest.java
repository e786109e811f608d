package com.enterprise.jobscheduler.core;

import com.enterprise.jobscheduler.exception.JobNotFoundException;
import com.enterprise.jobscheduler.exception.ScheduleValidationException;
import com.enterprise.jobscheduler.monitoring.SchedulerMetrics;
import com.enterprise.jobscheduler.recurrence.RecurrenceEngine;
import com.enterprise.jobscheduler.repository.InMemoryScheduleRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

class ScheduleManagerImplTest {
    
    private static final Instant T = Instant.parse("2024-01-15T09:00:00Z");
    private static final Duration LEASE = Duration.ofMinutes(5);
    
    private MutableClock clock;
    private InMemoryScheduleRepository repository;
    private HandlerRegistry registry;
    private SchedulerMetrics metrics;
    private ScheduleManagerImpl manager;
    
    @BeforeEach
    void setUp() {
        clock = new MutableClock(T);
        repository = new InMemoryScheduleRepository();
        registry = new HandlerRegistry();
        metrics = new SchedulerMetrics(new SimpleMeterRegistry());
        ExecutionEngine engine = new ExecutionEngine(registry, RetryPolicy.Predefined.standard(), clock, metrics);
        RecurrenceEngine recurrenceEngine = new RecurrenceEngine(clock, ZoneOffset.UTC);
        manager = new ScheduleManagerImpl(repository, engine, recurrenceEngine, clock, LEASE, "worker-a", 3, metrics);
    }
    
    @Test
    void testOneOffJobLifecycle() throws Exception {
        registry.register(ExecutionEngineTest.handler("send-reminder", job -> JobResult.success()));
        ScheduledJob job = manager.schedule(definition("send-reminder", T.plus(Duration.ofMinutes(5)), null));
        
        assertTrue(manager.getDueJobs().isEmpty());
        
        clock.advance(Duration.ofMinutes(5));
        assertEquals(List.of(job.getId()), ids(manager.getDueJobs()));
        
        Optional<JobResult> result = manager.executeJob(job.getId());
        assertTrue(result.isPresent());
        assertTrue(result.get().isSuccess());
        
        ScheduledJob stored = manager.find(job.getId()).orElseThrow();
        assertEquals(JobStatus.SUCCEEDED, stored.getStatus());
        assertEquals(1, stored.getOccurrenceCount());
        assertNull(stored.getLockedUntil());
        assertTrue(manager.getDueJobs().isEmpty());
        
        clock.advance(Duration.ofDays(30));
        assertTrue(manager.getDueJobs().isEmpty());
    }
    
    @Test
    void testWeeklyCadenceAnchoredOnRunAt() throws Exception {
        registry.register(ExecutionEngineTest.handler("digest", job -> {
            clock.advance(Duration.ofMinutes(3));
            return JobResult.success();
        }));
        ScheduledJob job = manager.schedule(definition("digest", T, ScheduleRecurrence.weekly()));
        
        manager.executeJob(job.getId());
        
        ScheduledJob stored = manager.find(job.getId()).orElseThrow();
        assertEquals(JobStatus.PENDING, stored.getStatus());
        assertEquals(T.plus(Duration.ofDays(7)), stored.getRunAt());
        assertEquals(1, stored.getOccurrenceCount());
        assertEquals(0, stored.getAttemptCount());
    }
    
    @Test
    void testTransientFailureRetriedAfterDelay() throws Exception {
        registry.register(ExecutionEngineTest.handler("sync",
            job -> JobResult.failure("upstream busy", true, Duration.ofSeconds(60))));
        ScheduledJob job = manager.schedule(definition("sync", T, null));
        
        manager.executeJob(job.getId());
        ScheduledJob afterFirst = manager.find(job.getId()).orElseThrow();
        assertEquals(1, afterFirst.getAttemptCount());
        assertEquals(T.plusSeconds(60), afterFirst.getRunAt());
        
        clock.advance(Duration.ofSeconds(60));
        manager.executeJob(job.getId());
        
        ScheduledJob stored = manager.find(job.getId()).orElseThrow();
        assertEquals(JobStatus.PENDING, stored.getStatus());
        assertEquals(2, stored.getAttemptCount());
        assertEquals(clock.now().plusSeconds(60), stored.getRunAt());
        assertEquals(0, stored.getOccurrenceCount());
        assertNull(stored.getLockedBy());
        assertEquals("upstream busy", stored.getLastResult().getMessage());
        assertEquals(2.0, metrics.getMetrics().get("jobs.retried"));
    }
    
    @Test
    void testRetriesExhaustedEndsOneOffJob() throws Exception {
        registry.register(ExecutionEngineTest.handler("sync", job -> JobResult.retry("busy", Duration.ofSeconds(1))));
        ScheduledJob job = manager.schedule(ScheduleDefinition.builder()
            .jobType("sync").targetId("account-7").runAt(T).maxRetries(1).build());
        
        manager.executeJob(job.getId());
        clock.advance(Duration.ofSeconds(1));
        manager.executeJob(job.getId());
        
        ScheduledJob stored = manager.find(job.getId()).orElseThrow();
        assertEquals(JobStatus.FAILED, stored.getStatus());
        assertEquals(1.0, metrics.getMetrics().get("jobs.failed"));
    }
    
    @Test
    void testRecurringRetryKeepsCadence() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        registry.register(ExecutionEngineTest.handler("report", job -> calls.incrementAndGet() == 1
            ? JobResult.retry("not ready", Duration.ofSeconds(60))
            : JobResult.success()));
        ScheduledJob job = manager.schedule(definition("report", T, ScheduleRecurrence.daily()));
        
        manager.executeJob(job.getId());
        clock.advance(Duration.ofSeconds(60));
        manager.executeJob(job.getId());
        
        ScheduledJob stored = manager.find(job.getId()).orElseThrow();
        assertEquals(T.plus(Duration.ofDays(1)), stored.getRunAt());
        assertEquals(T.plus(Duration.ofDays(1)), stored.getOccurrenceRunAt());
        assertEquals(0, stored.getAttemptCount());
        assertEquals(1, stored.getOccurrenceCount());
    }
    
    @Test
    void testSlotsOvertakenByRetryAreSkipped() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        registry.register(ExecutionEngineTest.handler("ping", job -> calls.incrementAndGet() == 1
            ? JobResult.retry("timeout", Duration.ofMinutes(5))
            : JobResult.success()));
        ScheduledJob job = manager.schedule(definition("ping", T, ScheduleRecurrence.interval(Duration.ofMinutes(2))));
        
        manager.executeJob(job.getId());
        clock.advance(Duration.ofMinutes(5));
        manager.executeJob(job.getId());
        
        ScheduledJob stored = manager.find(job.getId()).orElseThrow();
        assertEquals(T.plus(Duration.ofMinutes(6)), stored.getRunAt());
        assertEquals(1, stored.getOccurrenceCount());
    }
    
    @Test
    void testMaxOccurrencesRunsExactlyThreeTimes() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        registry.register(ExecutionEngineTest.handler("heartbeat", job -> {
            calls.incrementAndGet();
            return JobResult.success();
        }));
        ScheduledJob job = manager.schedule(definition("heartbeat", T,
            ScheduleRecurrence.interval(Duration.ofHours(1)).limitedTo(3)));
        
        for (int i = 0; i < 5; i++) {
            ScheduledJob current = manager.find(job.getId()).orElseThrow();
            if (current.getStatus().isTerminal()) {
                break;
            }
            clock.set(current.getRunAt());
            manager.executeJob(job.getId());
        }
        
        ScheduledJob stored = manager.find(job.getId()).orElseThrow();
        assertEquals(3, calls.get());
        assertEquals(JobStatus.SUCCEEDED, stored.getStatus());
        assertEquals(3, stored.getOccurrenceCount());
        assertEquals(T.plus(Duration.ofHours(2)), stored.getRunAt());
    }
    
    @Test
    void testDuplicateDefinitionsYieldDistinctJobs() throws Exception {
        ScheduleDefinition definition = definition("send-reminder", T, null);
        
        ScheduledJob first = manager.schedule(definition);
        ScheduledJob second = manager.schedule(definition);
        
        assertNotEquals(first.getId(), second.getId());
        assertTrue(manager.find(first.getId()).isPresent());
        assertTrue(manager.find(second.getId()).isPresent());
        assertEquals(2, manager.findByTarget("user-42").size());
        assertEquals(2, manager.findByType("send-reminder").size());
    }
    
    @Test
    void testInvalidDefinitionNotPersisted() {
        ScheduleDefinition definition = ScheduleDefinition.builder().jobType("").runAt(T).build();
        
        ScheduleValidationException e = assertThrows(ScheduleValidationException.class,
            () -> manager.schedule(definition));
        
        assertEquals(2, e.getErrors().size());
        assertEquals(0, repository.count());
    }
    
    @Test
    void testCancelPendingJob() throws Exception {
        ScheduledJob job = manager.schedule(definition("send-reminder", T, ScheduleRecurrence.daily()));
        
        assertTrue(manager.cancel(job.getId()));
        assertEquals(JobStatus.CANCELLED, manager.find(job.getId()).orElseThrow().getStatus());
        assertFalse(manager.cancel(job.getId()));
        assertTrue(manager.getDueJobs().isEmpty());
        assertEquals(1.0, metrics.getMetrics().get("jobs.cancelled"));
    }
    
    @Test
    void testRunningJobIsNotCancelled() throws Exception {
        ScheduledJob job = manager.schedule(definition("send-reminder", T, null));
        repository.claim(job.getId(), "worker-b", T, T.plus(LEASE));
        
        assertFalse(manager.cancel(job.getId()));
        assertEquals(JobStatus.RUNNING, manager.find(job.getId()).orElseThrow().getStatus());
    }
    
    @Test
    void testUnknownJob() {
        UUID id = UUID.randomUUID();
        
        JobNotFoundException e = assertThrows(JobNotFoundException.class, () -> manager.executeJob(id));
        assertEquals(id, e.getJobId());
        assertThrows(JobNotFoundException.class, () -> manager.cancel(id));
        assertThrows(JobNotFoundException.class, () -> manager.describeNextRun(id));
    }
    
    @Test
    void testClaimConflictSkipsJob() throws Exception {
        AtomicBoolean invoked = new AtomicBoolean(false);
        registry.register(ExecutionEngineTest.handler("send-reminder", job -> {
            invoked.set(true);
            return JobResult.success();
        }));
        ScheduledJob job = manager.schedule(definition("send-reminder", T, null));
        repository.claim(job.getId(), "worker-b", T, T.plus(LEASE));
        
        assertTrue(manager.executeJob(job.getId()).isEmpty());
        assertFalse(invoked.get());
        assertEquals(1.0, metrics.getMetrics().get("claims.conflicts"));
    }
    
    @Test
    void testLostLeaseDiscardsResult() throws Exception {
        registry.register(ExecutionEngineTest.handler("slow-export", job -> {
            clock.advance(LEASE.plusMinutes(1));
            assertTrue(repository.claim(job.getId(), "worker-b", clock.now(), clock.now().plus(LEASE)).isPresent());
            return JobResult.success();
        }));
        ScheduledJob job = manager.schedule(definition("slow-export", T, null));
        
        assertTrue(manager.executeJob(job.getId()).isEmpty());
        
        ScheduledJob stored = manager.find(job.getId()).orElseThrow();
        assertEquals(JobStatus.RUNNING, stored.getStatus());
        assertEquals("worker-b", stored.getLockedBy());
        assertEquals(1.0, metrics.getMetrics().get("leases.lost"));
    }
    
    @Test
    void testExpiredRunningLeaseIsReclaimed() throws Exception {
        registry.register(ExecutionEngineTest.handler("send-reminder", job -> JobResult.success()));
        ScheduledJob job = manager.schedule(definition("send-reminder", T, null));
        repository.claim(job.getId(), "crashed-worker", T, T.plus(LEASE));
        
        assertTrue(manager.getDueJobs().isEmpty());
        
        clock.advance(LEASE);
        assertEquals(List.of(job.getId()), ids(manager.getDueJobs()));
        assertTrue(manager.executeJob(job.getId()).isPresent());
        assertEquals(JobStatus.SUCCEEDED, manager.find(job.getId()).orElseThrow().getStatus());
    }
    
    @Test
    void testThrowingHandlerFailsJob() throws Exception {
        registry.register(ExecutionEngineTest.handler("report", job -> {
            throw new IllegalStateException("template missing");
        }));
        ScheduledJob job = manager.schedule(definition("report", T, null));
        
        Optional<JobResult> result = manager.executeJob(job.getId());
        
        assertTrue(result.isPresent());
        assertFalse(result.get().isSuccess());
        ScheduledJob stored = manager.find(job.getId()).orElseThrow();
        assertEquals(JobStatus.FAILED, stored.getStatus());
        assertEquals(0, stored.getAttemptCount());
    }
    
    @Test
    void testThrowingSupportsFailsJob() throws Exception {
        registry.register(new JobHandler() {
            @Override
            public boolean supports(String jobType) {
                throw new IllegalStateException("type table unavailable");
            }
            
            @Override
            public JobResult handle(ScheduledJob job) {
                return JobResult.success();
            }
        });
        ScheduledJob job = manager.schedule(definition("report", T, null));
        
        Optional<JobResult> result = manager.executeJob(job.getId());
        
        assertTrue(result.isPresent());
        assertFalse(result.get().isSuccess());
        ScheduledJob stored = manager.find(job.getId()).orElseThrow();
        assertEquals(JobStatus.FAILED, stored.getStatus());
        assertNull(stored.getLockedBy());
        assertTrue(stored.getLastResult().getMessage().contains("type table unavailable"));
        assertTrue(manager.getDueJobs(T.plus(Duration.ofHours(1))).isEmpty());
    }
    
    @Test
    void testUnrepresentableRetryDelayFailsJob() throws Exception {
        registry.register(ExecutionEngineTest.handler("report",
            job -> JobResult.retry("busy", Duration.ofSeconds(Long.MAX_VALUE))));
        ScheduledJob job = manager.schedule(definition("report", T, null));
        
        Optional<JobResult> result = manager.executeJob(job.getId());
        
        assertTrue(result.isPresent());
        assertFalse(result.get().isSuccess());
        assertTrue(result.get().getMessage().startsWith("could not apply RETRY"));
        ScheduledJob stored = manager.find(job.getId()).orElseThrow();
        assertEquals(JobStatus.FAILED, stored.getStatus());
        assertEquals(0, stored.getAttemptCount());
        assertNull(stored.getLockedBy());
        assertEquals(1.0, metrics.getMetrics().get("jobs.failed"));
    }
    
    @Test
    void testMissingHandlerFailsWithoutRetry() throws Exception {
        ScheduledJob job = manager.schedule(definition("unregistered", T, ScheduleRecurrence.daily()));
        
        manager.executeJob(job.getId());
        
        ScheduledJob stored = manager.find(job.getId()).orElseThrow();
        assertEquals(JobStatus.FAILED, stored.getStatus());
        assertTrue(stored.getLastResult().getMessage().startsWith("no handler"));
    }
    
    @Test
    void testDueJobsOrderedByPriorityThenRunAt() throws Exception {
        ScheduledJob low = manager.schedule(ScheduleDefinition.builder()
            .jobType("t").targetId("a").runAt(T.minusSeconds(120)).priority(1).build());
        ScheduledJob highLate = manager.schedule(ScheduleDefinition.builder()
            .jobType("t").targetId("b").runAt(T.minusSeconds(10)).priority(5).build());
        ScheduledJob highEarly = manager.schedule(ScheduleDefinition.builder()
            .jobType("t").targetId("c").runAt(T.minusSeconds(60)).priority(5).build());
        manager.schedule(ScheduleDefinition.builder()
            .jobType("t").targetId("d").runAt(T.plusSeconds(60)).priority(9).build());
        
        assertEquals(List.of(highEarly.getId(), highLate.getId(), low.getId()), ids(manager.getDueJobs()));
    }
    
    @Test
    void testExtendLeaseWhileExecuting() throws Exception {
        AtomicReference<Boolean> extended = new AtomicReference<>();
        AtomicReference<Instant> lockedUntil = new AtomicReference<>();
        registry.register(ExecutionEngineTest.handler("slow-export", job -> {
            clock.advance(Duration.ofMinutes(4));
            extended.set(manager.extendLease(job.getId()));
            lockedUntil.set(repository.find(job.getId()).orElseThrow().getLockedUntil());
            clock.advance(Duration.ofMinutes(4));
            return JobResult.success();
        }));
        ScheduledJob job = manager.schedule(definition("slow-export", T, null));
        
        assertTrue(manager.executeJob(job.getId()).isPresent());
        
        assertTrue(extended.get());
        assertEquals(T.plus(Duration.ofMinutes(4)).plus(LEASE), lockedUntil.get());
        assertEquals(JobStatus.SUCCEEDED, manager.find(job.getId()).orElseThrow().getStatus());
        assertFalse(manager.extendLease(job.getId()));
    }
    
    @Test
    void testDescribeNextRun() throws Exception {
        registry.register(ExecutionEngineTest.handler("send-reminder", job -> JobResult.success()));
        ScheduledJob job = manager.schedule(definition("send-reminder", T.plus(Duration.ofHours(2)), null));
        
        assertEquals("In 2 hours", manager.describeNextRun(job.getId()));
        
        clock.advance(Duration.ofHours(2));
        assertEquals("Now", manager.describeNextRun(job.getId()));
        
        manager.executeJob(job.getId());
        assertEquals("No further runs", manager.describeNextRun(job.getId()));
    }
    
    @Test
    void testDeleteAndCount() throws Exception {
        ScheduledJob job = manager.schedule(definition("send-reminder", T, null));
        manager.schedule(definition("send-reminder", T, null));
        
        assertEquals(2, manager.count(JobStatus.PENDING));
        assertTrue(manager.delete(job.getId()));
        assertFalse(manager.delete(job.getId()));
        assertEquals(1, manager.count(JobStatus.PENDING));
        assertEquals(1, manager.findByStatus(JobStatus.PENDING, 10).size());
    }
    
    private static ScheduleDefinition definition(String jobType, Instant runAt, ScheduleRecurrence recurrence) {
        return ScheduleDefinition.builder()
            .jobType(jobType)
            .targetId("user-42")
            .runAt(runAt)
            .recurrence(recurrence)
            .payloadEntry("channel", "email")
            .build();
    }
    
    private static List<UUID> ids(List<ScheduledJob> jobs) {
        return jobs.stream().map(ScheduledJob::getId).collect(Collectors.toList());
    }
}
