package com.example.votequorum.model;

/**
 * Operations accepted by the Lambda entry point.
 */
public enum RequestType {
    /**
     * Registers an election and its confirming nodes.
     */
    SETUP_ELECTION,
    
    /**
     * Opens an election for voting.
     */
    START_ELECTION,
    
    /**
     * Closes an election, abandoning in-flight rounds.
     */
    END_ELECTION,
    
    /**
     * Casts a vote. Answered immediately with a pending acknowledgment.
     */
    CAST_VOTE,
    
    /**
     * Node confirmation callback for the vote's current round.
     */
    CONFIRM,
    
    /**
     * Node heartbeat carrying the measured response time.
     */
    HEARTBEAT,
    
    VOTE_STATUS,
    
    NODE_STATUSES,
    
    ELECTION_STATS,
    
    OVERALL_STATS
}
