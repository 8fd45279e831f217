package com.example.votequorum.simulation;

import com.example.votequorum.model.ConfirmationOutcome;

/**
 * Receives a node's answer for a vote, as a real node's confirmation callback would.
 */
@FunctionalInterface
public interface ConfirmationListener {
    
    void onConfirmation(String voteId, String nodeId, ConfirmationOutcome outcome);
}
