package com.example.votequorum.task;

import java.time.Instant;

/**
 * A task that failed permanently, kept for inspection.
 */
public final class DeadLetter {
    
    private final ConsensusTask task;
    private final Throwable error;
    private final int attempts;
    private final Instant failedAt;
    
    public DeadLetter(ConsensusTask task, Throwable error, int attempts, Instant failedAt) {
        this.task = task;
        this.error = error;
        this.attempts = attempts;
        this.failedAt = failedAt;
    }
    
    public ConsensusTask getTask() {
        return task;
    }
    
    public Throwable getError() {
        return error;
    }
    
    public int getAttempts() {
        return attempts;
    }
    
    public Instant getFailedAt() {
        return failedAt;
    }
}
