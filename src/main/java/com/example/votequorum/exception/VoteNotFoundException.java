package com.example.votequorum.exception;

public class VoteNotFoundException extends ConsensusException {
    
    public VoteNotFoundException(String voteId) {
        super("Vote not found: " + voteId);
    }
}
