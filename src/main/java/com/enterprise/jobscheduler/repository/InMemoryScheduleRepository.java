package com.enterprise.jobscheduler.repository;

import com.enterprise.jobscheduler.core.JobStatus;
import com.enterprise.jobscheduler.core.ScheduledJob;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Heap-backed repository. Conditional writes run inside {@link ConcurrentHashMap#compute},
 * which serializes them per job id.
 */
public class InMemoryScheduleRepository implements ScheduleRepository {
    
    static final Comparator<ScheduledJob> DUE_ORDER = Comparator
        .comparingInt(ScheduledJob::getPriority).reversed()
        .thenComparing(ScheduledJob::getRunAt);
    
    private final ConcurrentHashMap<UUID, ScheduledJob> jobs = new ConcurrentHashMap<>();
    
    @Override
    public Optional<ScheduledJob> find(UUID id) {
        ScheduledJob job = jobs.get(id);
        return job == null ? Optional.empty() : Optional.of(job.copy());
    }
    
    @Override
    public List<ScheduledJob> findDue(Instant asOf) {
        return select(job -> job.isDueAt(asOf), DUE_ORDER, Integer.MAX_VALUE);
    }
    
    @Override
    public List<ScheduledJob> findByType(String jobType) {
        return select(job -> Objects.equals(jobType, job.getJobType()),
            Comparator.comparing(ScheduledJob::getRunAt), Integer.MAX_VALUE);
    }
    
    @Override
    public List<ScheduledJob> findByTarget(String targetId) {
        return select(job -> Objects.equals(targetId, job.getTargetId()),
            Comparator.comparing(ScheduledJob::getRunAt), Integer.MAX_VALUE);
    }
    
    @Override
    public List<ScheduledJob> findByStatus(JobStatus status, int limit) {
        return select(job -> job.getStatus() == status,
            Comparator.comparing(ScheduledJob::getRunAt), limit);
    }
    
    @Override
    public void save(ScheduledJob job) {
        jobs.put(job.getId(), job.copy());
    }
    
    @Override
    public Optional<ScheduledJob> claim(UUID id, String workerId, Instant now, Instant lockedUntil) {
        AtomicReference<ScheduledJob> claimed = new AtomicReference<>();
        jobs.computeIfPresent(id, (key, current) -> {
            if (!current.isClaimable(now)) {
                return current;
            }
            ScheduledJob updated = current.copy();
            updated.claim(workerId, now, lockedUntil);
            claimed.set(updated.copy());
            return updated;
        });
        return Optional.ofNullable(claimed.get());
    }
    
    @Override
    public boolean complete(ScheduledJob job, String workerId) {
        AtomicBoolean written = new AtomicBoolean(false);
        jobs.computeIfPresent(job.getId(), (key, current) -> {
            if (!isHeldBy(current, workerId)) {
                return current;
            }
            written.set(true);
            return job.copy();
        });
        return written.get();
    }
    
    @Override
    public boolean extendLease(UUID id, String workerId, Instant now, Instant lockedUntil) {
        AtomicBoolean extended = new AtomicBoolean(false);
        jobs.computeIfPresent(id, (key, current) -> {
            if (!isHeldBy(current, workerId)) {
                return current;
            }
            ScheduledJob updated = current.copy();
            updated.extendLease(lockedUntil, now);
            extended.set(true);
            return updated;
        });
        return extended.get();
    }
    
    @Override
    public Optional<ScheduledJob> cancel(UUID id, Instant now) {
        AtomicReference<ScheduledJob> cancelled = new AtomicReference<>();
        jobs.computeIfPresent(id, (key, current) -> {
            if (current.getStatus() != JobStatus.PENDING) {
                return current;
            }
            ScheduledJob updated = current.copy();
            updated.cancel(now);
            cancelled.set(updated.copy());
            return updated;
        });
        return Optional.ofNullable(cancelled.get());
    }
    
    @Override
    public boolean delete(UUID id) {
        return jobs.remove(id) != null;
    }
    
    @Override
    public long count() {
        return jobs.size();
    }
    
    @Override
    public long count(JobStatus status) {
        return jobs.values().stream().filter(job -> job.getStatus() == status).count();
    }
    
    static boolean isHeldBy(ScheduledJob job, String workerId) {
        return job.getStatus() == JobStatus.RUNNING && Objects.equals(workerId, job.getLockedBy());
    }
    
    private List<ScheduledJob> select(Predicate<ScheduledJob> filter, Comparator<ScheduledJob> order, int limit) {
        return jobs.values().stream()
            .filter(filter)
            .sorted(order)
            .limit(limit)
            .map(ScheduledJob::copy)
            .collect(Collectors.toList());
    }
}
