package com.example.votequorum.state;

import com.example.votequorum.exception.DuplicateVoteException;
import com.example.votequorum.exception.VoteNotFoundException;
import com.example.votequorum.model.Vote;
import com.example.votequorum.model.VoteStatus;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Holds votes and their confirmation state. Votes are created once per (voter, election)
 * and afterwards only move forward through their status machine.
 */
public interface VoteRecordStore {
    
    /**
     * Creates a pending vote.
     * 
     * @param voterId The voter casting the vote
     * @param candidateId The chosen candidate
     * @param electionId The election the vote belongs to
     * @param requiredConfirmations Quorum threshold, fixed for the vote's lifetime
     * @return The created vote with round 0 and no confirmations
     * @throws DuplicateVoteException if the voter already has a vote in this election
     */
    Vote create(String voterId, String candidateId, String electionId, int requiredConfirmations);
    
    Optional<Vote> get(String voteId);
    
    /**
     * Gets a vote that must exist.
     * 
     * @throws VoteNotFoundException if no vote has this id
     */
    Vote require(String voteId);
    
    Optional<Vote> findByVoterAndElection(String voterId, String electionId);
    
    /**
     * Looks a vote up by content fingerprint, for replay detection and audits.
     */
    Optional<Vote> findByFingerprint(String fingerprint);
    
    List<Vote> findByElection(String electionId);
    
    /**
     * Moves a pending vote to its next round and resets its confirmation count.
     * 
     * @return The vote after the change
     * @throws IllegalStateException if the vote is no longer pending
     */
    Vote advanceRound(String voteId);
    
    /**
     * Persists the number of confirmed entries of the vote's current round.
     * 
     * @return The vote after the change
     */
    Vote updateConfirmationCount(String voteId, int confirmationCount);
    
    /**
     * Transitions a vote to a new status.
     * 
     * @return true if the transition was valid and applied, false otherwise
     */
    boolean transitionToStatus(String voteId, VoteStatus targetStatus);
    
    /**
     * Only pending votes may move, and only to a terminal status.
     */
    default boolean isValidTransition(VoteStatus from, VoteStatus to) {
        return from == VoteStatus.PENDING && to != null && to.isTerminal();
    }
    
    /**
     * Vote counts per status for an election. Statuses without votes are absent.
     */
    Map<VoteStatus, Long> countByStatus(String electionId);
    
    /**
     * Computes the content fingerprint of a vote: SHA-256 over voter, candidate, election and nonce.
     * Deterministic for identical inputs; the nonce makes two casts of the same content differ.
     */
    static String computeFingerprint(String voterId, String candidateId, String electionId, String nonce) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            String material = voterId + "|" + candidateId + "|" + electionId + "|" + nonce;
            return HexFormat.of().formatHex(digest.digest(material.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
