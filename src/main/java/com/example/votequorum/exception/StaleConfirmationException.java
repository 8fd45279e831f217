package com.example.votequorum.exception;

/**
 * Thrown when a confirmation arrives for a vote whose election has ended or whose round was abandoned.
 */
public class StaleConfirmationException extends ConsensusException {
    
    private final String voteId;
    
    public StaleConfirmationException(String voteId, String reason) {
        super("Stale confirmation for vote " + voteId + ": " + reason);
        this.voteId = voteId;
    }
    
    public String getVoteId() {
        return voteId;
    }
}
