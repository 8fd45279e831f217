package com.example.votequorum.exception;

/**
 * Thrown when an operation needs an election in a state it is not in (unknown, not started, or ended).
 */
public class ElectionNotActiveException extends ConsensusException {
    
    private final String electionId;
    
    public ElectionNotActiveException(String electionId, String detail) {
        super("Election " + electionId + " " + detail);
        this.electionId = electionId;
    }
    
    public String getElectionId() {
        return electionId;
    }
}
