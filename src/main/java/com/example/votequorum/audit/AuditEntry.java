package com.example.votequorum.audit;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * One link of the audit hash chain. {@code hash} covers every other field, including the
 * previous entry's hash.
 */
public class AuditEntry {
    
    private final long sequence;
    private final AuditEventType type;
    private final String electionId;
    private final String voteId;
    private final Map<String, Object> details;
    private final Instant timestamp;
    private final String previousHash;
    private final String hash;
    
    @JsonCreator
    public AuditEntry(
            @JsonProperty("sequence") long sequence,
            @JsonProperty("type") AuditEventType type,
            @JsonProperty("electionId") String electionId,
            @JsonProperty("voteId") String voteId,
            @JsonProperty("details") Map<String, Object> details,
            @JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("previousHash") String previousHash,
            @JsonProperty("hash") String hash) {
        this.sequence = sequence;
        this.type = type;
        this.electionId = electionId;
        this.voteId = voteId;
        this.details = details != null ? new TreeMap<>(details) : new TreeMap<>();
        this.timestamp = timestamp;
        this.previousHash = previousHash;
        this.hash = hash;
    }
    
    public long getSequence() {
        return sequence;
    }
    
    public AuditEventType getType() {
        return type;
    }
    
    public String getElectionId() {
        return electionId;
    }
    
    public String getVoteId() {
        return voteId;
    }
    
    public Map<String, Object> getDetails() {
        return details;
    }
    
    public Instant getTimestamp() {
        return timestamp;
    }
    
    public String getPreviousHash() {
        return previousHash;
    }
    
    public String getHash() {
        return hash;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AuditEntry that = (AuditEntry) o;
        return sequence == that.sequence &&
               Objects.equals(hash, that.hash);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(sequence, hash);
    }
    
    @Override
    public String toString() {
        return "AuditEntry{" +
               "sequence=" + sequence +
               ", type=" + type +
               ", electionId='" + electionId + '\'' +
               ", voteId='" + voteId + '\'' +
               ", hash='" + hash + '\'' +
               '}';
    }
}
