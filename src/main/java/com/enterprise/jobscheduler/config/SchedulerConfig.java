package com.enterprise.jobscheduler.config;

import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Configuration for the job scheduler
 */
public class SchedulerConfig {
    
    private final RetryConfig retryConfig;
    private final LeaseConfig leaseConfig;
    private final PollerConfig pollerConfig;
    private final StorageConfig storageConfig;
    private final MonitoringConfig monitoringConfig;
    private final ZoneId zoneId;
    
    public SchedulerConfig(RetryConfig retryConfig, LeaseConfig leaseConfig, PollerConfig pollerConfig,
                           StorageConfig storageConfig, MonitoringConfig monitoringConfig, ZoneId zoneId) {
        this.retryConfig = retryConfig;
        this.leaseConfig = leaseConfig;
        this.pollerConfig = pollerConfig;
        this.storageConfig = storageConfig;
        this.monitoringConfig = monitoringConfig;
        this.zoneId = zoneId;
    }
    
    public RetryConfig getRetryConfig() { return retryConfig; }
    public LeaseConfig getLeaseConfig() { return leaseConfig; }
    public PollerConfig getPollerConfig() { return pollerConfig; }
    public StorageConfig getStorageConfig() { return storageConfig; }
    public MonitoringConfig getMonitoringConfig() { return monitoringConfig; }
    
    /**
     * Zone used for DAILY, WEEKLY, MONTHLY and cron arithmetic
     */
    public ZoneId getZoneId() { return zoneId; }
    
    /**
     * Retry configuration
     */
    public static class RetryConfig {
        private final int maxRetries;
        private final Duration baseDelay;
        private final double backoffMultiplier;
        private final Duration maxDelay;
        private final boolean enableJitter;
        
        public RetryConfig(int maxRetries, Duration baseDelay, double backoffMultiplier,
                           Duration maxDelay, boolean enableJitter) {
            this.maxRetries = maxRetries;
            this.baseDelay = baseDelay;
            this.backoffMultiplier = backoffMultiplier;
            this.maxDelay = maxDelay;
            this.enableJitter = enableJitter;
        }
        
        /**
         * Retries allowed per occurrence when a definition does not set its own
         */
        public int getMaxRetries() { return maxRetries; }
        public Duration getBaseDelay() { return baseDelay; }
        public double getBackoffMultiplier() { return backoffMultiplier; }
        public Duration getMaxDelay() { return maxDelay; }
        public boolean isEnableJitter() { return enableJitter; }
    }
    
    /**
     * Lease configuration
     */
    public static class LeaseConfig {
        private final Duration leaseDuration;
        private final String workerId;
        
        public LeaseConfig(Duration leaseDuration, String workerId) {
            this.leaseDuration = leaseDuration;
            this.workerId = workerId;
        }
        
        public Duration getLeaseDuration() { return leaseDuration; }
        public String getWorkerId() { return workerId; }
    }
    
    /**
     * Poller and worker pool configuration
     */
    public static class PollerConfig {
        private final Duration pollInterval;
        private final int batchSize;
        private final int workerThreads;
        private final Duration shutdownTimeout;
        
        public PollerConfig(Duration pollInterval, int batchSize, int workerThreads, Duration shutdownTimeout) {
            this.pollInterval = pollInterval;
            this.batchSize = batchSize;
            this.workerThreads = workerThreads;
            this.shutdownTimeout = shutdownTimeout;
        }
        
        public Duration getPollInterval() { return pollInterval; }
        public int getBatchSize() { return batchSize; }
        public int getWorkerThreads() { return workerThreads; }
        public Duration getShutdownTimeout() { return shutdownTimeout; }
    }
    
    /**
     * Storage configuration. A null path selects the in-memory repository.
     */
    public static class StorageConfig {
        private final String dbPath;
        
        public StorageConfig(String dbPath) {
            this.dbPath = dbPath;
        }
        
        public String getDbPath() { return dbPath; }
        
        public boolean isPersistent() { return dbPath != null; }
    }
    
    /**
     * Monitoring configuration
     */
    public static class MonitoringConfig {
        private final boolean enableMetrics;
        
        public MonitoringConfig(boolean enableMetrics) {
            this.enableMetrics = enableMetrics;
        }
        
        public boolean isEnableMetrics() { return enableMetrics; }
    }
    
    /**
     * Builder for creating configurations
     */
    public static class Builder {
        private RetryConfig retryConfig = Defaults.defaultRetryConfig();
        private LeaseConfig leaseConfig = Defaults.defaultLeaseConfig();
        private PollerConfig pollerConfig = Defaults.defaultPollerConfig();
        private StorageConfig storageConfig = Defaults.defaultStorageConfig();
        private MonitoringConfig monitoringConfig = Defaults.defaultMonitoringConfig();
        private ZoneId zoneId = ZoneOffset.UTC;
        
        public Builder retryConfig(RetryConfig retryConfig) {
            this.retryConfig = retryConfig;
            return this;
        }
        
        public Builder leaseConfig(LeaseConfig leaseConfig) {
            this.leaseConfig = leaseConfig;
            return this;
        }
        
        public Builder pollerConfig(PollerConfig pollerConfig) {
            this.pollerConfig = pollerConfig;
            return this;
        }
        
        public Builder storageConfig(StorageConfig storageConfig) {
            this.storageConfig = storageConfig;
            return this;
        }
        
        public Builder monitoringConfig(MonitoringConfig monitoringConfig) {
            this.monitoringConfig = monitoringConfig;
            return this;
        }
        
        public Builder zoneId(ZoneId zoneId) {
            this.zoneId = zoneId;
            return this;
        }
        
        public SchedulerConfig build() {
            return new SchedulerConfig(retryConfig, leaseConfig, pollerConfig,
                                       storageConfig, monitoringConfig, zoneId);
        }
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    /**
     * Default configurations
     */
    public static class Defaults {
        public static RetryConfig defaultRetryConfig() {
            return new RetryConfig(
                3, Duration.ofSeconds(5), 2.0, Duration.ofMinutes(5), false
            );
        }
        
        public static LeaseConfig defaultLeaseConfig() {
            return new LeaseConfig(Duration.ofMinutes(5), defaultWorkerId());
        }
        
        public static PollerConfig defaultPollerConfig() {
            return new PollerConfig(
                Duration.ofSeconds(1), 100, 4, Duration.ofSeconds(30)
            );
        }
        
        public static StorageConfig defaultStorageConfig() {
            return new StorageConfig(null);
        }
        
        public static MonitoringConfig defaultMonitoringConfig() {
            return new MonitoringConfig(true);
        }
        
        /**
         * {@code scheduler-<pid>@<host>}
         */
        public static String defaultWorkerId() {
            return "scheduler-" + ManagementFactory.getRuntimeMXBean().getName();
        }
    }
}
