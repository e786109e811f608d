package com.enterprise.jobscheduler.core;

import java.time.Duration;

/**
 * Result of an execution attempt paired with the decision about the job's next state
 */
public final class ExecutionOutcome {
    
    private final JobResult result;
    private final NextAction action;
    private final Duration retryDelay;
    
    private ExecutionOutcome(JobResult result, NextAction action, Duration retryDelay) {
        this.result = result;
        this.action = action;
        this.retryDelay = retryDelay;
    }
    
    public static ExecutionOutcome retry(JobResult result, Duration retryDelay) {
        return new ExecutionOutcome(result, NextAction.RETRY, retryDelay);
    }
    
    public static ExecutionOutcome reschedule(JobResult result) {
        return new ExecutionOutcome(result, NextAction.RESCHEDULE, null);
    }
    
    public static ExecutionOutcome terminal(JobResult result) {
        return new ExecutionOutcome(result, NextAction.TERMINAL, null);
    }
    
    public JobResult getResult() { return result; }
    
    public NextAction getAction() { return action; }
    
    /**
     * Delay before the next attempt, set only for {@link NextAction#RETRY}
     */
    public Duration getRetryDelay() { return retryDelay; }
    
    @Override
    public String toString() {
        return "ExecutionOutcome{action=" + action + ", retryDelay=" + retryDelay + ", result=" + result + "}";
    }
}
