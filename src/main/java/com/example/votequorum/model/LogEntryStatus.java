package com.example.votequorum.model;

/**
 * Status of one node's confirmation within a round.
 */
public enum LogEntryStatus {
    PENDING,
    CONFIRMED,
    REJECTED,
    TIMED_OUT;
    
    public boolean isSettled() {
        return this != PENDING;
    }
}
