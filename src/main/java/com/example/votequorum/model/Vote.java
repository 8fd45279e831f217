package com.example.votequorum.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Objects;

/**
 * A cast vote and its confirmation progress.
 * Instances are immutable snapshots; the store replaces them on every state change.
 */
public class Vote {
    
    private final String voteId;
    private final String voterId;
    private final String candidateId;
    private final String electionId;
    private final VoteStatus status;
    private final int requiredConfirmations;
    private final int confirmationCount;
    private final String fingerprint;
    private final int currentRound;
    private final Instant castAt;
    
    @JsonCreator
    public Vote(
            @JsonProperty("voteId") String voteId,
            @JsonProperty("voterId") String voterId,
            @JsonProperty("candidateId") String candidateId,
            @JsonProperty("electionId") String electionId,
            @JsonProperty("status") VoteStatus status,
            @JsonProperty("requiredConfirmations") int requiredConfirmations,
            @JsonProperty("confirmationCount") int confirmationCount,
            @JsonProperty("fingerprint") String fingerprint,
            @JsonProperty("currentRound") int currentRound,
            @JsonProperty("castAt") Instant castAt) {
        this.voteId = voteId;
        this.voterId = voterId;
        this.candidateId = candidateId;
        this.electionId = electionId;
        this.status = status;
        this.requiredConfirmations = requiredConfirmations;
        this.confirmationCount = confirmationCount;
        this.fingerprint = fingerprint;
        this.currentRound = currentRound;
        this.castAt = castAt;
    }
    
    public String getVoteId() {
        return voteId;
    }
    
    public String getVoterId() {
        return voterId;
    }
    
    public String getCandidateId() {
        return candidateId;
    }
    
    public String getElectionId() {
        return electionId;
    }
    
    public VoteStatus getStatus() {
        return status;
    }
    
    public int getRequiredConfirmations() {
        return requiredConfirmations;
    }
    
    public int getConfirmationCount() {
        return confirmationCount;
    }
    
    public String getFingerprint() {
        return fingerprint;
    }
    
    /**
     * Number of the latest round opened for this vote, 0 before the first round.
     */
    public int getCurrentRound() {
        return currentRound;
    }
    
    public Instant getCastAt() {
        return castAt;
    }
    
    @JsonIgnore
    public boolean hasQuorum() {
        return confirmationCount >= requiredConfirmations;
    }
    
    public Vote withStatus(VoteStatus newStatus) {
        return new Vote(voteId, voterId, candidateId, electionId, newStatus,
            requiredConfirmations, confirmationCount, fingerprint, currentRound, castAt);
    }
    
    public Vote withConfirmationCount(int newCount) {
        return new Vote(voteId, voterId, candidateId, electionId, status,
            requiredConfirmations, newCount, fingerprint, currentRound, castAt);
    }
    
    /**
     * Moves to the given round. Confirmations belong to a round, so the count restarts at zero.
     */
    public Vote withRound(int roundNumber) {
        return new Vote(voteId, voterId, candidateId, electionId, status,
            requiredConfirmations, 0, fingerprint, roundNumber, castAt);
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Vote vote = (Vote) o;
        return requiredConfirmations == vote.requiredConfirmations &&
               confirmationCount == vote.confirmationCount &&
               currentRound == vote.currentRound &&
               Objects.equals(voteId, vote.voteId) &&
               Objects.equals(voterId, vote.voterId) &&
               Objects.equals(candidateId, vote.candidateId) &&
               Objects.equals(electionId, vote.electionId) &&
               status == vote.status &&
               Objects.equals(fingerprint, vote.fingerprint) &&
               Objects.equals(castAt, vote.castAt);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(voteId, voterId, candidateId, electionId, status,
                          requiredConfirmations, confirmationCount, fingerprint, currentRound, castAt);
    }
    
    @Override
    public String toString() {
        return "Vote{" +
               "voteId='" + voteId + '\'' +
               ", voterId='" + voterId + '\'' +
               ", electionId='" + electionId + '\'' +
               ", status=" + status +
               ", confirmations=" + confirmationCount + "/" + requiredConfirmations +
               ", currentRound=" + currentRound +
               '}';
    }
}
