package com.example.votequorum.model;

/**
 * State of a single confirmation round.
 */
public enum RoundState {
    OPEN,
    COMPLETED,
    FAILED,
    SUPERSEDED,
    ABANDONED;
    
    public boolean isOpen() {
        return this == OPEN;
    }
}
