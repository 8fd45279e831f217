package com.example.votequorum.state;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per vote. Round opening, confirmation recording and evaluation of the same vote
 * serialize on it; different votes never contend.
 */
public class VoteLocks {
    
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    
    public <T> T withLock(String voteId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(voteId, id -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
    
    public void withLock(String voteId, Runnable action) {
        withLock(voteId, () -> {
            action.run();
            return null;
        });
    }
    
    /**
     * Whether the current thread holds the vote's lock.
     */
    public boolean isHeldByCurrentThread(String voteId) {
        ReentrantLock lock = locks.get(voteId);
        return lock != null && lock.isHeldByCurrentThread();
    }
    
    public int size() {
        return locks.size();
    }
}
