package com.example.votequorum.manager;

import com.example.votequorum.model.ConsensusOutcome;

/**
 * Decides whether a vote's current round has reached quorum.
 */
public interface ConsensusEvaluator {
    
    /**
     * Counts the confirmations of the vote's current round and applies the result:
     * finalizes the vote when the threshold is met, fails the round when every entry settled
     * short of it, and fails the vote when that was its last allowed round.
     * Calling it again for a finalized vote changes nothing and returns FINALIZED.
     * 
     * @param voteId The vote to evaluate
     * @return FINALIZED, FAILED (round or vote failed) or STILL_PENDING
     */
    ConsensusOutcome evaluate(String voteId);
}
