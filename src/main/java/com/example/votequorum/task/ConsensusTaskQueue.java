package com.example.votequorum.task;

import java.time.Duration;
import java.util.List;

/**
 * Runs consensus work off the caller's thread. A failed task is either retried or dead-lettered
 * with a structured error log; it is never dropped silently.
 */
public interface ConsensusTaskQueue {
    
    void submit(ConsensusTask task);
    
    /**
     * Waits until no submitted task is running or waiting for a retry.
     * 
     * @return true if the queue became idle within the timeout
     */
    boolean awaitIdle(Duration timeout) throws InterruptedException;
    
    List<DeadLetter> getDeadLetters();
    
    void shutdown();
}
