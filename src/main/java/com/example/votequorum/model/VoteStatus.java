package com.example.votequorum.model;

/**
 * Lifecycle status of a cast vote.
 */
public enum VoteStatus {
    /**
     * Vote is waiting for a quorum of node confirmations.
     */
    PENDING,
    
    /**
     * Quorum reached. Terminal.
     */
    FINALIZED,
    
    /**
     * All confirmation rounds were spent without reaching quorum. Terminal.
     */
    FAILED,
    
    /**
     * The owning election ended before the vote was finalized. Terminal.
     */
    EXPIRED;
    
    public boolean isTerminal() {
        return this != PENDING;
    }
}
