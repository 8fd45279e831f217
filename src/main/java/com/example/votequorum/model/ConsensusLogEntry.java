package com.example.votequorum.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Objects;

/**
 * One node's confirmation slot for a vote in a given round.
 */
public class ConsensusLogEntry {
    
    private final String voteId;
    private final String nodeId;
    private final int round;
    private final LogEntryStatus status;
    private final String signature;
    private final Instant timestamp;
    
    @JsonCreator
    public ConsensusLogEntry(
            @JsonProperty("voteId") String voteId,
            @JsonProperty("nodeId") String nodeId,
            @JsonProperty("round") int round,
            @JsonProperty("status") LogEntryStatus status,
            @JsonProperty("signature") String signature,
            @JsonProperty("timestamp") Instant timestamp) {
        this.voteId = voteId;
        this.nodeId = nodeId;
        this.round = round;
        this.status = status;
        this.signature = signature;
        this.timestamp = timestamp;
    }
    
    public String getVoteId() {
        return voteId;
    }
    
    public String getNodeId() {
        return nodeId;
    }
    
    public int getRound() {
        return round;
    }
    
    public LogEntryStatus getStatus() {
        return status;
    }
    
    public String getSignature() {
        return signature;
    }
    
    public Instant getTimestamp() {
        return timestamp;
    }
    
    public ConsensusLogEntry withStatus(LogEntryStatus newStatus, Instant at) {
        return new ConsensusLogEntry(voteId, nodeId, round, newStatus, signature, at);
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConsensusLogEntry that = (ConsensusLogEntry) o;
        return round == that.round &&
               Objects.equals(voteId, that.voteId) &&
               Objects.equals(nodeId, that.nodeId) &&
               status == that.status &&
               Objects.equals(signature, that.signature) &&
               Objects.equals(timestamp, that.timestamp);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(voteId, nodeId, round, status, signature, timestamp);
    }
    
    @Override
    public String toString() {
        return "ConsensusLogEntry{" +
               "voteId='" + voteId + '\'' +
               ", nodeId='" + nodeId + '\'' +
               ", round=" + round +
               ", status=" + status +
               ", timestamp=" + timestamp +
               '}';
    }
}
