package com.example.votequorum.exception;

/**
 * Thrown when a voter already has a vote in the election. Nothing is mutated.
 */
public class DuplicateVoteException extends ConsensusException {
    
    private final String voterId;
    private final String electionId;
    
    public DuplicateVoteException(String voterId, String electionId) {
        super("Voter " + voterId + " has already voted in election " + electionId);
        this.voterId = voterId;
        this.electionId = electionId;
    }
    
    public String getVoterId() {
        return voterId;
    }
    
    public String getElectionId() {
        return electionId;
    }
}
