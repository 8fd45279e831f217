package com.example.votequorum.exception;

import com.example.votequorum.model.VoteStatus;

/**
 * Thrown when round work is requested for a vote that already reached a terminal status.
 */
public class VoteNotPendingException extends ConsensusException {
    
    private final String voteId;
    private final VoteStatus status;
    
    public VoteNotPendingException(String voteId, VoteStatus status) {
        super("Vote " + voteId + " is " + status + ", no further rounds");
        this.voteId = voteId;
        this.status = status;
    }
    
    public String getVoteId() {
        return voteId;
    }
    
    public VoteStatus getStatus() {
        return status;
    }
}
