package com.example.votequorum.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Objects;

/**
 * Read-only view of a vote's verification progress, as served to dashboards.
 */
public class VoteStatusView {
    
    private final String voteId;
    private final VoteStatus status;
    private final int confirmationCount;
    private final int requiredConfirmations;
    private final int currentRound;
    private final String fingerprint;
    private final List<ConsensusLogEntry> logEntries;
    
    @JsonCreator
    public VoteStatusView(
            @JsonProperty("voteId") String voteId,
            @JsonProperty("status") VoteStatus status,
            @JsonProperty("confirmationCount") int confirmationCount,
            @JsonProperty("requiredConfirmations") int requiredConfirmations,
            @JsonProperty("currentRound") int currentRound,
            @JsonProperty("fingerprint") String fingerprint,
            @JsonProperty("logEntries") List<ConsensusLogEntry> logEntries) {
        this.voteId = voteId;
        this.status = status;
        this.confirmationCount = confirmationCount;
        this.requiredConfirmations = requiredConfirmations;
        this.currentRound = currentRound;
        this.fingerprint = fingerprint;
        this.logEntries = logEntries != null ? List.copyOf(logEntries) : List.of();
    }
    
    public static VoteStatusView of(Vote vote, List<ConsensusLogEntry> logEntries) {
        return new VoteStatusView(vote.getVoteId(), vote.getStatus(), vote.getConfirmationCount(),
            vote.getRequiredConfirmations(), vote.getCurrentRound(), vote.getFingerprint(), logEntries);
    }
    
    public String getVoteId() {
        return voteId;
    }
    
    public VoteStatus getStatus() {
        return status;
    }
    
    public int getConfirmationCount() {
        return confirmationCount;
    }
    
    public int getRequiredConfirmations() {
        return requiredConfirmations;
    }
    
    public int getCurrentRound() {
        return currentRound;
    }
    
    public String getFingerprint() {
        return fingerprint;
    }
    
    /**
     * Entries of every round, oldest round first.
     */
    public List<ConsensusLogEntry> getLogEntries() {
        return logEntries;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        VoteStatusView that = (VoteStatusView) o;
        return confirmationCount == that.confirmationCount &&
               requiredConfirmations == that.requiredConfirmations &&
               currentRound == that.currentRound &&
               Objects.equals(voteId, that.voteId) &&
               status == that.status &&
               Objects.equals(fingerprint, that.fingerprint) &&
               Objects.equals(logEntries, that.logEntries);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(voteId, status, confirmationCount, requiredConfirmations, currentRound, fingerprint, logEntries);
    }
    
    @Override
    public String toString() {
        return "VoteStatusView{" +
               "voteId='" + voteId + '\'' +
               ", status=" + status +
               ", confirmations=" + confirmationCount + "/" + requiredConfirmations +
               ", currentRound=" + currentRound +
               ", logEntries=" + logEntries.size() +
               '}';
    }
}
