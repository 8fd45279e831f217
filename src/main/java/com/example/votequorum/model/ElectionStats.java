package com.example.votequorum.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * Vote counts per status for one election.
 */
public class ElectionStats {
    
    private final String electionId;
    private final long total;
    private final long finalized;
    private final long pending;
    private final long failed;
    private final long expired;
    
    @JsonCreator
    public ElectionStats(
            @JsonProperty("electionId") String electionId,
            @JsonProperty("total") long total,
            @JsonProperty("finalized") long finalized,
            @JsonProperty("pending") long pending,
            @JsonProperty("failed") long failed,
            @JsonProperty("expired") long expired) {
        this.electionId = electionId;
        this.total = total;
        this.finalized = finalized;
        this.pending = pending;
        this.failed = failed;
        this.expired = expired;
    }
    
    public static ElectionStats fromCounts(String electionId, Map<VoteStatus, Long> counts) {
        long finalized = counts.getOrDefault(VoteStatus.FINALIZED, 0L);
        long pending = counts.getOrDefault(VoteStatus.PENDING, 0L);
        long failed = counts.getOrDefault(VoteStatus.FAILED, 0L);
        long expired = counts.getOrDefault(VoteStatus.EXPIRED, 0L);
        return new ElectionStats(electionId, finalized + pending + failed + expired,
            finalized, pending, failed, expired);
    }
    
    public String getElectionId() {
        return electionId;
    }
    
    public long getTotal() {
        return total;
    }
    
    public long getFinalized() {
        return finalized;
    }
    
    public long getPending() {
        return pending;
    }
    
    public long getFailed() {
        return failed;
    }
    
    public long getExpired() {
        return expired;
    }
    
    @Override
    public String toString() {
        return "ElectionStats{" +
               "electionId='" + electionId + '\'' +
               ", total=" + total +
               ", finalized=" + finalized +
               ", pending=" + pending +
               ", failed=" + failed +
               ", expired=" + expired +
               '}';
    }
}
