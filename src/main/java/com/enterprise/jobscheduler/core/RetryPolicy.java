package com.enterprise.jobscheduler.core;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Decides whether a failed attempt is retried and how long to wait before the next one
 */
public interface RetryPolicy {
    
    /**
     * Determine if the job should be retried based on the result
     */
    boolean shouldRetry(ScheduledJob job, JobResult result);
    
    /**
     * Calculate the delay before the next attempt. A delay supplied by the handler
     * in the result takes precedence over the policy's backoff.
     */
    Duration getRetryDelay(ScheduledJob job, JobResult result);
    
    /**
     * Default maximum number of retries for jobs that do not set their own
     */
    int getMaxRetries();
    
    /**
     * Exponential backoff policy
     */
    class DefaultRetryPolicy implements RetryPolicy {
        private final int maxRetries;
        private final Duration baseDelay;
        private final double backoffMultiplier;
        private final Duration maxDelay;
        private final boolean enableJitter;
        
        public DefaultRetryPolicy(int maxRetries, Duration baseDelay,
                                  double backoffMultiplier, Duration maxDelay,
                                  boolean enableJitter) {
            this.maxRetries = maxRetries;
            this.baseDelay = baseDelay;
            this.backoffMultiplier = backoffMultiplier;
            this.maxDelay = maxDelay;
            this.enableJitter = enableJitter;
        }
        
        @Override
        public boolean shouldRetry(ScheduledJob job, JobResult result) {
            if (result.isSuccess() || !result.shouldRetry()) {
                return false;
            }
            return job.getAttemptCount() < job.getMaxRetries();
        }
        
        @Override
        public Duration getRetryDelay(ScheduledJob job, JobResult result) {
            if (result.getRetryDelay() != null) {
                return result.getRetryDelay();
            }
            
            long delayMs = (long) (baseDelay.toMillis() * Math.pow(backoffMultiplier, job.getAttemptCount()));
            long actualDelay = Math.min(delayMs, maxDelay.toMillis());
            
            if (enableJitter) {
                // up to 10% extra to spread retries of jobs that failed together
                actualDelay += (long) (actualDelay * 0.1 * ThreadLocalRandom.current().nextDouble());
            }
            
            return Duration.ofMillis(actualDelay);
        }
        
        @Override
        public int getMaxRetries() {
            return maxRetries;
        }
    }
    
    /**
     * Builder for creating retry policies
     */
    class Builder {
        private int maxRetries = 3;
        private Duration baseDelay = Duration.ofSeconds(5);
        private double backoffMultiplier = 2.0;
        private Duration maxDelay = Duration.ofMinutes(5);
        private boolean enableJitter = false;
        
        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }
        
        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
            return this;
        }
        
        public Builder backoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }
        
        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }
        
        public Builder enableJitter(boolean enableJitter) {
            this.enableJitter = enableJitter;
            return this;
        }
        
        public RetryPolicy build() {
            return new DefaultRetryPolicy(maxRetries, baseDelay, backoffMultiplier, maxDelay, enableJitter);
        }
    }
    
    static Builder builder() {
        return new Builder();
    }
    
    /**
     * Predefined retry policies
     */
    class Predefined {
        
        /**
         * No retry policy
         */
        public static RetryPolicy noRetry() {
            return builder().maxRetries(0).build();
        }
        
        /**
         * Standard retry policy
         */
        public static RetryPolicy standard() {
            return builder()
                .maxRetries(3)
                .baseDelay(Duration.ofSeconds(5))
                .backoffMultiplier(2.0)
                .maxDelay(Duration.ofMinutes(5))
                .build();
        }
        
        /**
         * Aggressive retry policy for critical jobs
         */
        public static RetryPolicy aggressive() {
            return builder()
                .maxRetries(10)
                .baseDelay(Duration.ofSeconds(2))
                .backoffMultiplier(1.5)
                .maxDelay(Duration.ofMinutes(10))
                .build();
        }
    }
}
