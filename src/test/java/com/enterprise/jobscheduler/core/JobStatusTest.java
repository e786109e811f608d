package com.enterprise.jobscheduler.core;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class JobStatusTest {
    
    @Test
    void testOnlyPendingCanExecute() {
        assertTrue(JobStatus.PENDING.canExecute());
        assertFalse(JobStatus.RUNNING.canExecute());
        assertFalse(JobStatus.SUCCEEDED.canExecute());
        assertFalse(JobStatus.FAILED.canExecute());
        assertFalse(JobStatus.CANCELLED.canExecute());
    }
    
    @Test
    void testTerminalStatuses() {
        assertFalse(JobStatus.PENDING.isTerminal());
        assertFalse(JobStatus.RUNNING.isTerminal());
        assertTrue(JobStatus.SUCCEEDED.isTerminal());
        assertTrue(JobStatus.FAILED.isTerminal());
        assertTrue(JobStatus.CANCELLED.isTerminal());
    }
    
    @Test
    void testAllowedTransitions() {
        assertTrue(JobStatus.PENDING.canTransitionTo(JobStatus.RUNNING));
        assertTrue(JobStatus.PENDING.canTransitionTo(JobStatus.CANCELLED));
        assertTrue(JobStatus.RUNNING.canTransitionTo(JobStatus.PENDING));
        assertTrue(JobStatus.RUNNING.canTransitionTo(JobStatus.SUCCEEDED));
        assertTrue(JobStatus.RUNNING.canTransitionTo(JobStatus.FAILED));
    }
    
    @Test
    void testForbiddenTransitions() {
        assertFalse(JobStatus.PENDING.canTransitionTo(JobStatus.SUCCEEDED));
        assertFalse(JobStatus.RUNNING.canTransitionTo(JobStatus.CANCELLED));
        for (JobStatus target : JobStatus.values()) {
            assertFalse(JobStatus.SUCCEEDED.canTransitionTo(target));
            assertFalse(JobStatus.FAILED.canTransitionTo(target));
            assertFalse(JobStatus.CANCELLED.canTransitionTo(target));
        }
    }
}
