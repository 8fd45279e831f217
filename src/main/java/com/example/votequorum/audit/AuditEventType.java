package com.example.votequorum.audit;

/**
 * Kinds of consensus events recorded in the audit trail.
 */
public enum AuditEventType {
    VOTE_CAST,
    VOTE_FINALIZED,
    VOTE_FAILED,
    VOTE_EXPIRED,
    ELECTION_STARTED,
    ELECTION_ENDED
}
