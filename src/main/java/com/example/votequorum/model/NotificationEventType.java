package com.example.votequorum.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Event types pushed to the notification sink.
 */
public enum NotificationEventType {
    FINALIZED("finalized"),
    ROUND_FAILED("round_failed"),
    VOTE_FAILED("vote_failed"),
    VOTE_EXPIRED("vote_expired"),
    NODE_UNREACHABLE("node_unreachable"),
    ELECTION_STATUS("election_status"),
    PROCESSING_ERROR("processing_error");
    
    private final String wireName;
    
    NotificationEventType(String wireName) {
        this.wireName = wireName;
    }
    
    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
