package com.enterprise.jobscheduler.repository;

import com.enterprise.jobscheduler.core.JobStatus;
import com.enterprise.jobscheduler.core.ScheduledJob;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.mapdb.DB;
import org.mapdb.DBMaker;
import org.mapdb.Serializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * MapDB-backed repository. Jobs are stored as JSON documents keyed by id, with an
 * in-memory status index rebuilt on open. Every write is a MapDB transaction guarded
 * by a write lock, which also makes claim and complete atomic.
 */
public class MapDBScheduleRepository implements ScheduleRepository, AutoCloseable {
    
    private static final Logger logger = LoggerFactory.getLogger(MapDBScheduleRepository.class);
    
    private final DB db;
    private final ObjectMapper objectMapper;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    
    private final Map<UUID, String> jobStorage;
    private final Map<JobStatus, Set<UUID>> statusIndex = new ConcurrentHashMap<>();
    
    public MapDBScheduleRepository(String dbPath) {
        this.objectMapper = createObjectMapper();
        
        this.db = DBMaker.fileDB(new File(dbPath))
            .fileMmapEnable()
            .fileMmapPreclearDisable()
            .allocateStartSize(16 * 1024 * 1024) // 16MB
            .allocateIncrement(4 * 1024 * 1024) // 4MB
            .transactionEnable()
            .checksumHeaderBypass()
            .closeOnJvmShutdown()
            .make();
        
        this.jobStorage = db.hashMap("jobs", Serializer.UUID, Serializer.STRING).createOrOpen();
        
        initializeIndexes();
        
        logger.info("MapDBScheduleRepository initialized with database at: {} ({} jobs)", dbPath, jobStorage.size());
    }
    
    static ObjectMapper createObjectMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
    
    private void initializeIndexes() {
        lock.writeLock().lock();
        try {
            for (JobStatus status : JobStatus.values()) {
                statusIndex.put(status, ConcurrentHashMap.newKeySet());
            }
            for (Map.Entry<UUID, String> entry : jobStorage.entrySet()) {
                ScheduledJob job = deserialize(entry.getValue());
                statusIndex.get(job.getStatus()).add(entry.getKey());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }
    
    @Override
    public Optional<ScheduledJob> find(UUID id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(load(id));
        } finally {
            lock.readLock().unlock();
        }
    }
    
    @Override
    public List<ScheduledJob> findDue(Instant asOf) {
        lock.readLock().lock();
        try {
            List<ScheduledJob> due = new ArrayList<>();
            for (JobStatus status : List.of(JobStatus.PENDING, JobStatus.RUNNING)) {
                for (UUID id : statusIndex.get(status)) {
                    ScheduledJob job = load(id);
                    if (job != null && job.isDueAt(asOf)) {
                        due.add(job);
                    }
                }
            }
            due.sort(InMemoryScheduleRepository.DUE_ORDER);
            return due;
        } finally {
            lock.readLock().unlock();
        }
    }
    
    @Override
    public List<ScheduledJob> findByType(String jobType) {
        return scan(job -> Objects.equals(jobType, job.getJobType()), Integer.MAX_VALUE);
    }
    
    @Override
    public List<ScheduledJob> findByTarget(String targetId) {
        return scan(job -> Objects.equals(targetId, job.getTargetId()), Integer.MAX_VALUE);
    }
    
    @Override
    public List<ScheduledJob> findByStatus(JobStatus status, int limit) {
        lock.readLock().lock();
        try {
            return statusIndex.get(status).stream()
                .map(this::load)
                .filter(Objects::nonNull)
                .sorted(Comparator.comparing(ScheduledJob::getRunAt))
                .limit(limit)
                .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }
    
    @Override
    public void save(ScheduledJob job) {
        lock.writeLock().lock();
        try {
            store(job);
            db.commit();
            logger.debug("Job {} saved with status {}", job.getId(), job.getStatus());
        } catch (Exception e) {
            db.rollback();
            rebuildIndexEntry(job.getId());
            logger.error("Failed to save job {}", job.getId(), e);
            throw new RuntimeException("Failed to save job", e);
        } finally {
            lock.writeLock().unlock();
        }
    }
    
    @Override
    public Optional<ScheduledJob> claim(UUID id, String workerId, Instant now, Instant lockedUntil) {
        lock.writeLock().lock();
        try {
            ScheduledJob job = load(id);
            if (job == null || !job.isClaimable(now)) {
                return Optional.empty();
            }
            job.claim(workerId, now, lockedUntil);
            store(job);
            db.commit();
            logger.debug("Job {} claimed by {} until {}", id, workerId, lockedUntil);
            return Optional.of(job);
        } catch (Exception e) {
            db.rollback();
            rebuildIndexEntry(id);
            logger.error("Failed to claim job {}", id, e);
            throw new RuntimeException("Failed to claim job", e);
        } finally {
            lock.writeLock().unlock();
        }
    }
    
    @Override
    public boolean complete(ScheduledJob job, String workerId) {
        lock.writeLock().lock();
        try {
            ScheduledJob current = load(job.getId());
            if (current == null || !InMemoryScheduleRepository.isHeldBy(current, workerId)) {
                return false;
            }
            store(job);
            db.commit();
            logger.debug("Job {} completed by {} with status {}", job.getId(), workerId, job.getStatus());
            return true;
        } catch (Exception e) {
            db.rollback();
            rebuildIndexEntry(job.getId());
            logger.error("Failed to complete job {}", job.getId(), e);
            throw new RuntimeException("Failed to complete job", e);
        } finally {
            lock.writeLock().unlock();
        }
    }
    
    @Override
    public boolean extendLease(UUID id, String workerId, Instant now, Instant lockedUntil) {
        lock.writeLock().lock();
        try {
            ScheduledJob current = load(id);
            if (current == null || !InMemoryScheduleRepository.isHeldBy(current, workerId)) {
                return false;
            }
            current.extendLease(lockedUntil, now);
            store(current);
            db.commit();
            return true;
        } catch (Exception e) {
            db.rollback();
            logger.error("Failed to extend lease of job {}", id, e);
            throw new RuntimeException("Failed to extend lease", e);
        } finally {
            lock.writeLock().unlock();
        }
    }
    
    @Override
    public Optional<ScheduledJob> cancel(UUID id, Instant now) {
        lock.writeLock().lock();
        try {
            ScheduledJob job = load(id);
            if (job == null || job.getStatus() != JobStatus.PENDING) {
                return Optional.empty();
            }
            job.cancel(now);
            store(job);
            db.commit();
            logger.debug("Job {} cancelled", id);
            return Optional.of(job);
        } catch (Exception e) {
            db.rollback();
            rebuildIndexEntry(id);
            logger.error("Failed to cancel job {}", id, e);
            throw new RuntimeException("Failed to cancel job", e);
        } finally {
            lock.writeLock().unlock();
        }
    }
    
    @Override
    public boolean delete(UUID id) {
        lock.writeLock().lock();
        try {
            String removed = jobStorage.remove(id);
            if (removed == null) {
                return false;
            }
            statusIndex.values().forEach(ids -> ids.remove(id));
            db.commit();
            logger.debug("Job {} deleted", id);
            return true;
        } catch (Exception e) {
            db.rollback();
            rebuildIndexEntry(id);
            logger.error("Failed to delete job {}", id, e);
            throw new RuntimeException("Failed to delete job", e);
        } finally {
            lock.writeLock().unlock();
        }
    }
    
    @Override
    public long count() {
        lock.readLock().lock();
        try {
            return jobStorage.size();
        } finally {
            lock.readLock().unlock();
        }
    }
    
    @Override
    public long count(JobStatus status) {
        return statusIndex.get(status).size();
    }
    
    /**
     * Close the database
     */
    @Override
    public void close() {
        lock.writeLock().lock();
        try {
            if (!db.isClosed()) {
                db.close();
                logger.info("MapDBScheduleRepository closed");
            }
        } finally {
            lock.writeLock().unlock();
        }
    }
    
    private List<ScheduledJob> scan(Predicate<ScheduledJob> filter, int limit) {
        lock.readLock().lock();
        try {
            return jobStorage.values().stream()
                .map(this::deserialize)
                .filter(filter)
                .sorted(Comparator.comparing(ScheduledJob::getRunAt))
                .limit(limit)
                .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }
    
    private ScheduledJob load(UUID id) {
        String json = jobStorage.get(id);
        return json == null ? null : deserialize(json);
    }
    
    private void store(ScheduledJob job) throws IOException {
        jobStorage.put(job.getId(), objectMapper.writeValueAsString(job));
        for (Map.Entry<JobStatus, Set<UUID>> entry : statusIndex.entrySet()) {
            if (entry.getKey() == job.getStatus()) {
                entry.getValue().add(job.getId());
            } else {
                entry.getValue().remove(job.getId());
            }
        }
    }
    
    // After a rollback the index may hold a status that never got committed
    private void rebuildIndexEntry(UUID id) {
        statusIndex.values().forEach(ids -> ids.remove(id));
        try {
            ScheduledJob committed = load(id);
            if (committed != null) {
                statusIndex.get(committed.getStatus()).add(id);
            }
        } catch (RuntimeException e) {
            logger.warn("Could not restore index entry for job {}", id, e);
        }
    }
    
    private ScheduledJob deserialize(String json) {
        try {
            return objectMapper.readValue(json, ScheduledJob.class);
        } catch (IOException e) {
            throw new RuntimeException("Failed to deserialize job", e);
        }
    }
}
