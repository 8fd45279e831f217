package com.example.votequorum.exception;

/**
 * Thrown when a vote has used every confirmation round it is allowed.
 */
public class RoundExhaustedException extends ConsensusException {
    
    private final String voteId;
    private final int maxRounds;
    
    public RoundExhaustedException(String voteId, int maxRounds) {
        super("Vote " + voteId + " exhausted all " + maxRounds + " consensus rounds");
        this.voteId = voteId;
        this.maxRounds = maxRounds;
    }
    
    public String getVoteId() {
        return voteId;
    }
    
    public int getMaxRounds() {
        return maxRounds;
    }
}
