package com.example.votequorum.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Payload delivered to observers through the notification sink.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NotificationEvent {
    
    private final NotificationEventType eventType;
    private final String voteId;
    private final String electionId;
    private final Integer roundNumber;
    private final String message;
    private final Instant timestamp;
    private final Map<String, Object> details;
    
    @JsonCreator
    public NotificationEvent(
            @JsonProperty("eventType") NotificationEventType eventType,
            @JsonProperty("voteId") String voteId,
            @JsonProperty("electionId") String electionId,
            @JsonProperty("roundNumber") Integer roundNumber,
            @JsonProperty("message") String message,
            @JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("details") Map<String, Object> details) {
        this.eventType = eventType;
        this.voteId = voteId;
        this.electionId = electionId;
        this.roundNumber = roundNumber;
        this.message = message;
        this.timestamp = timestamp;
        this.details = details;
    }
    
    public static NotificationEvent forVote(NotificationEventType type, Vote vote, Integer roundNumber, String message) {
        return new NotificationEvent(type, vote.getVoteId(), vote.getElectionId(), roundNumber,
            message, Instant.now(), null);
    }
    
    public static NotificationEvent forElection(NotificationEventType type, String electionId,
                                                String message, Map<String, Object> details) {
        return new NotificationEvent(type, null, electionId, null, message, Instant.now(), details);
    }
    
    public NotificationEventType getEventType() {
        return eventType;
    }
    
    public String getVoteId() {
        return voteId;
    }
    
    public String getElectionId() {
        return electionId;
    }
    
    public Integer getRoundNumber() {
        return roundNumber;
    }
    
    public String getMessage() {
        return message;
    }
    
    public Instant getTimestamp() {
        return timestamp;
    }
    
    public Map<String, Object> getDetails() {
        return details;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NotificationEvent that = (NotificationEvent) o;
        return eventType == that.eventType &&
               Objects.equals(voteId, that.voteId) &&
               Objects.equals(electionId, that.electionId) &&
               Objects.equals(roundNumber, that.roundNumber) &&
               Objects.equals(message, that.message) &&
               Objects.equals(timestamp, that.timestamp) &&
               Objects.equals(details, that.details);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(eventType, voteId, electionId, roundNumber, message, timestamp, details);
    }
    
    @Override
    public String toString() {
        return "NotificationEvent{" +
               "eventType=" + eventType +
               ", voteId='" + voteId + '\'' +
               ", electionId='" + electionId + '\'' +
               ", roundNumber=" + roundNumber +
               ", message='" + message + '\'' +
               '}';
    }
}
