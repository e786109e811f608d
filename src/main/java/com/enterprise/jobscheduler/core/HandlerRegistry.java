package com.enterprise.jobscheduler.core;

import com.enterprise.jobscheduler.exception.HandlerNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ordered registry of job handlers.
 * A job type resolves to the first handler, in registration order, whose
 * {@link JobHandler#supports(String)} returns true. Resolutions are cached per job
 * type; the cache is dropped whenever the set of handlers changes.
 */
public class HandlerRegistry {
    
    private static final Logger logger = LoggerFactory.getLogger(HandlerRegistry.class);
    
    private final List<JobHandler> handlers = new CopyOnWriteArrayList<>();
    private final Map<String, JobHandler> resolved = new ConcurrentHashMap<>();
    
    public HandlerRegistry() {
    }
    
    public HandlerRegistry(List<JobHandler> handlers) {
        handlers.forEach(this::register);
    }
    
    /**
     * Register a handler after all previously registered ones
     */
    public void register(JobHandler handler) {
        if (handler == null) {
            throw new IllegalArgumentException("Handler cannot be null");
        }
        handlers.add(handler);
        resolved.clear();
        logger.info("Registered job handler: {}", handler.getClass().getName());
    }
    
    /**
     * Unregister a handler
     */
    public boolean unregister(JobHandler handler) {
        boolean removed = handlers.remove(handler);
        if (removed) {
            resolved.clear();
            logger.info("Unregistered job handler: {}", handler.getClass().getName());
        }
        return removed;
    }
    
    /**
     * Find the handler responsible for a job type
     */
    public JobHandler resolve(String jobType) throws HandlerNotFoundException {
        if (jobType == null) {
            throw new HandlerNotFoundException(null);
        }
        JobHandler cached = resolved.get(jobType);
        if (cached != null) {
            return cached;
        }
        for (JobHandler handler : handlers) {
            if (handler.supports(jobType)) {
                resolved.put(jobType, handler);
                if (!handlers.contains(handler)) {
                    // unregistered while we were resolving; its cache clear may have run before our put
                    resolved.remove(jobType, handler);
                }
                return handler;
            }
        }
        throw new HandlerNotFoundException(jobType);
    }
    
    public List<JobHandler> getHandlers() {
        return List.copyOf(handlers);
    }
    
    public int size() {
        return handlers.size();
    }
}
