package com.enterprise.jobscheduler.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates scheduler configuration
 */
public class ConfigValidator {
    
    /**
     * Validate the configuration and return any validation errors
     */
    public List<ValidationError> validate(SchedulerConfig config) {
        List<ValidationError> errors = new ArrayList<>();
        
        validateRetryConfig(config.getRetryConfig(), errors);
        validateLeaseConfig(config.getLeaseConfig(), errors);
        validatePollerConfig(config.getPollerConfig(), errors);
        
        if (config.getStorageConfig() == null) {
            errors.add(new ValidationError("storage", "Storage configuration is required"));
        } else if (config.getStorageConfig().getDbPath() != null
                   && config.getStorageConfig().getDbPath().trim().isEmpty()) {
            errors.add(new ValidationError("storage.dbPath",
                "Database path cannot be blank, use null for in-memory storage"));
        }
        
        if (config.getMonitoringConfig() == null) {
            errors.add(new ValidationError("monitoring", "Monitoring configuration is required"));
        }
        
        if (config.getZoneId() == null) {
            errors.add(new ValidationError("zoneId", "Time zone is required"));
        }
        
        return errors;
    }
    
    private void validateRetryConfig(SchedulerConfig.RetryConfig config, List<ValidationError> errors) {
        if (config == null) {
            errors.add(new ValidationError("retry", "Retry configuration is required"));
            return;
        }
        
        if (config.getMaxRetries() < 0) {
            errors.add(new ValidationError("retry.maxRetries",
                "Maximum retries cannot be negative"));
        }
        
        if (config.getBaseDelay() == null || config.getBaseDelay().isNegative()) {
            errors.add(new ValidationError("retry.baseDelay",
                "Base delay cannot be negative"));
        }
        
        if (config.getBackoffMultiplier() < 1.0) {
            errors.add(new ValidationError("retry.backoffMultiplier",
                "Backoff multiplier must be at least 1"));
        }
        
        if (config.getMaxDelay() == null || config.getMaxDelay().isNegative()) {
            errors.add(new ValidationError("retry.maxDelay",
                "Maximum delay cannot be negative"));
        }
        
        if (config.getBaseDelay() != null && config.getMaxDelay() != null
            && config.getBaseDelay().compareTo(config.getMaxDelay()) > 0) {
            errors.add(new ValidationError("retry.delayRange",
                "Base delay cannot be greater than maximum delay"));
        }
    }
    
    private void validateLeaseConfig(SchedulerConfig.LeaseConfig config, List<ValidationError> errors) {
        if (config == null) {
            errors.add(new ValidationError("lease", "Lease configuration is required"));
            return;
        }
        
        if (config.getLeaseDuration() == null || config.getLeaseDuration().isZero()
            || config.getLeaseDuration().isNegative()) {
            errors.add(new ValidationError("lease.leaseDuration",
                "Lease duration must be greater than 0"));
        }
        
        if (config.getWorkerId() == null || config.getWorkerId().trim().isEmpty()) {
            errors.add(new ValidationError("lease.workerId",
                "Worker id is required"));
        }
    }
    
    private void validatePollerConfig(SchedulerConfig.PollerConfig config, List<ValidationError> errors) {
        if (config == null) {
            errors.add(new ValidationError("poller", "Poller configuration is required"));
            return;
        }
        
        if (config.getPollInterval() == null || config.getPollInterval().isZero()
            || config.getPollInterval().isNegative()) {
            errors.add(new ValidationError("poller.pollInterval",
                "Poll interval must be greater than 0"));
        }
        
        if (config.getBatchSize() <= 0) {
            errors.add(new ValidationError("poller.batchSize",
                "Batch size must be greater than 0"));
        }
        
        if (config.getWorkerThreads() <= 0) {
            errors.add(new ValidationError("poller.workerThreads",
                "Worker thread count must be greater than 0"));
        }
        
        if (config.getShutdownTimeout() == null || config.getShutdownTimeout().isNegative()) {
            errors.add(new ValidationError("poller.shutdownTimeout",
                "Shutdown timeout cannot be negative"));
        }
    }
    
    /**
     * Validation error
     */
    public static class ValidationError {
        private final String field;
        private final String message;
        
        public ValidationError(String field, String message) {
            this.field = field;
            this.message = message;
        }
        
        public String getField() { return field; }
        public String getMessage() { return message; }
        
        @Override
        public String toString() {
            return String.format("%s: %s", field, message);
        }
    }
}
