package com.example.votequorum.exception;

/**
 * Thrown when a confirmation does not match a pending entry of the vote's current round.
 * Covers duplicate, conflicting and stale-round confirmations.
 */
public class UnknownRoundEntryException extends ConsensusException {
    
    private final String voteId;
    private final String nodeId;
    private final int round;
    
    public UnknownRoundEntryException(String voteId, String nodeId, int round) {
        super("No pending consensus entry for vote " + voteId + ", node " + nodeId + ", round " + round);
        this.voteId = voteId;
        this.nodeId = nodeId;
        this.round = round;
    }
    
    public String getVoteId() {
        return voteId;
    }
    
    public String getNodeId() {
        return nodeId;
    }
    
    public int getRound() {
        return round;
    }
}
