package com.example.votequorum.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Immediate acknowledgment returned when a vote is cast. Finalization is observed later.
 */
public class CastVoteReceipt {
    
    public static final String PENDING_MESSAGE = "Vote cast successfully! Your vote is being verified.";
    
    private final String voteId;
    private final String fingerprint;
    private final VoteStatus status;
    private final String message;
    
    @JsonCreator
    public CastVoteReceipt(
            @JsonProperty("voteId") String voteId,
            @JsonProperty("fingerprint") String fingerprint,
            @JsonProperty("status") VoteStatus status,
            @JsonProperty("message") String message) {
        this.voteId = voteId;
        this.fingerprint = fingerprint;
        this.status = status;
        this.message = message;
    }
    
    public String getVoteId() {
        return voteId;
    }
    
    public String getFingerprint() {
        return fingerprint;
    }
    
    public VoteStatus getStatus() {
        return status;
    }
    
    public String getMessage() {
        return message;
    }
    
    @Override
    public String toString() {
        return "CastVoteReceipt{voteId='" + voteId + "', status=" + status + '}';
    }
}
