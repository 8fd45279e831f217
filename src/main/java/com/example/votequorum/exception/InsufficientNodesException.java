package com.example.votequorum.exception;

/**
 * Thrown when a round cannot be opened because no node of the election is active.
 * The vote stays pending and the round may be retried later.
 */
public class InsufficientNodesException extends ConsensusException {
    
    private final String voteId;
    private final String electionId;
    
    public InsufficientNodesException(String voteId, String electionId) {
        super("No active nodes available in election " + electionId + " for vote " + voteId);
        this.voteId = voteId;
        this.electionId = electionId;
    }
    
    public String getVoteId() {
        return voteId;
    }
    
    public String getElectionId() {
        return electionId;
    }
    
    @Override
    public boolean isRetryable() {
        return true;
    }
}
