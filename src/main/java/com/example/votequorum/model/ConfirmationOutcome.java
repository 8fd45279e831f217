package com.example.votequorum.model;

/**
 * Answer a node gives for a vote in its current round.
 */
public enum ConfirmationOutcome {
    CONFIRMED,
    REJECTED;
    
    public LogEntryStatus toEntryStatus() {
        return this == CONFIRMED ? LogEntryStatus.CONFIRMED : LogEntryStatus.REJECTED;
    }
}
