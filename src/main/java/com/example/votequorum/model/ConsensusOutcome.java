package com.example.votequorum.model;

/**
 * Result of evaluating a vote against its quorum threshold.
 */
public enum ConsensusOutcome {
    STILL_PENDING,
    FINALIZED,
    FAILED
}
