package com.example.votequorum.manager;

import com.example.votequorum.exception.InsufficientNodesException;
import com.example.votequorum.exception.RoundExhaustedException;
import com.example.votequorum.exception.StaleConfirmationException;
import com.example.votequorum.exception.UnknownRoundEntryException;
import com.example.votequorum.exception.VoteNotPendingException;
import com.example.votequorum.model.ConfirmationOutcome;
import com.example.votequorum.model.ConsensusLogEntry;
import com.example.votequorum.model.ConsensusRound;
import com.example.votequorum.model.RoundState;

import java.util.List;
import java.util.Optional;

/**
 * Opens confirmation rounds for votes and records node confirmations against them.
 * At most one round per vote is open at any time and round numbers strictly increase.
 */
public interface ConsensusRoundManager {
    
    /**
     * Selects active nodes for the vote's election and opens the next round with one pending
     * log entry per node. A round still open for the vote is superseded first.
     * 
     * @param voteId The vote to verify
     * @return The newly opened round
     * @throws InsufficientNodesException if no node is active; nothing is changed
     * @throws RoundExhaustedException if the vote already used all of its rounds
     * @throws VoteNotPendingException if the vote is no longer pending
     */
    ConsensusRound openRound(String voteId);
    
    /**
     * Settles the calling node's pending entry of the vote's current round.
     * Repeating an identical outcome for an already settled entry returns it unchanged.
     * 
     * @return The entry after the change
     * @throws UnknownRoundEntryException if there is no pending entry for the node in the current round
     * @throws StaleConfirmationException if the vote expired or its round was abandoned
     */
    ConsensusLogEntry recordConfirmation(String voteId, String nodeId, ConfirmationOutcome outcome);
    
    /**
     * Marks every still pending entry of the given round as timed out. Does nothing when that
     * round is no longer the vote's open round.
     * 
     * @return The entries that timed out
     */
    List<ConsensusLogEntry> timeoutRound(String voteId, int roundNumber);
    
    /**
     * Closes the vote's open round as abandoned, e.g. because its election ended.
     * 
     * @return The abandoned round, or empty if no round was open
     */
    Optional<ConsensusRound> abandonRound(String voteId);
    
    /**
     * Closes an open round with its final state.
     * 
     * @return true if the round was open and is now closed
     */
    boolean closeRound(String voteId, int roundNumber, RoundState finalState);
    
    Optional<ConsensusRound> getCurrentRound(String voteId);
    
    List<ConsensusLogEntry> getCurrentRoundEntries(String voteId);
    
    /**
     * All log entries of the vote across rounds, ordered by round then node selection order.
     */
    List<ConsensusLogEntry> getLogEntries(String voteId);
    
    List<ConsensusRound> getRounds(String voteId);
}
