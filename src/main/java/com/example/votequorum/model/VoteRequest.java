package com.example.votequorum.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;
import java.util.Objects;

/**
 * Request accepted by the Lambda entry point. Which fields are used depends on the type.
 */
public class VoteRequest {
    
    private final RequestType type;
    private final String electionId;
    private final String electionName;
    private final Integer replicationFactor;
    private final String voterId;
    private final String candidateId;
    private final String voteId;
    private final String nodeId;
    private final ConfirmationOutcome outcome;
    private final Long responseTimeMs;
    private final Map<String, Object> metadata;
    
    @JsonCreator
    public VoteRequest(
            @JsonProperty("type") RequestType type,
            @JsonProperty("electionId") String electionId,
            @JsonProperty("electionName") String electionName,
            @JsonProperty("replicationFactor") Integer replicationFactor,
            @JsonProperty("voterId") String voterId,
            @JsonProperty("candidateId") String candidateId,
            @JsonProperty("voteId") String voteId,
            @JsonProperty("nodeId") String nodeId,
            @JsonProperty("outcome") ConfirmationOutcome outcome,
            @JsonProperty("responseTimeMs") Long responseTimeMs,
            @JsonProperty("metadata") Map<String, Object> metadata) {
        this.type = type;
        this.electionId = electionId;
        this.electionName = electionName;
        this.replicationFactor = replicationFactor;
        this.voterId = voterId;
        this.candidateId = candidateId;
        this.voteId = voteId;
        this.nodeId = nodeId;
        this.outcome = outcome;
        this.responseTimeMs = responseTimeMs;
        this.metadata = metadata;
    }
    
    public static VoteRequest castVote(String voterId, String candidateId, String electionId) {
        return new VoteRequest(RequestType.CAST_VOTE, electionId, null, null, voterId, candidateId,
            null, null, null, null, null);
    }
    
    public static VoteRequest confirm(String voteId, String nodeId, ConfirmationOutcome outcome) {
        return new VoteRequest(RequestType.CONFIRM, null, null, null, null, null,
            voteId, nodeId, outcome, null, null);
    }
    
    public static VoteRequest heartbeat(String nodeId, long responseTimeMs) {
        return new VoteRequest(RequestType.HEARTBEAT, null, null, null, null, null,
            null, nodeId, null, responseTimeMs, null);
    }
    
    public static VoteRequest forVote(RequestType type, String voteId) {
        return new VoteRequest(type, null, null, null, null, null, voteId, null, null, null, null);
    }
    
    public static VoteRequest forElection(RequestType type, String electionId) {
        return new VoteRequest(type, electionId, null, null, null, null, null, null, null, null, null);
    }
    
    public static VoteRequest setupElection(String electionId, String name, Integer replicationFactor) {
        return new VoteRequest(RequestType.SETUP_ELECTION, electionId, name, replicationFactor,
            null, null, null, null, null, null, null);
    }
    
    public RequestType getType() {
        return type;
    }
    
    public String getElectionId() {
        return electionId;
    }
    
    public String getElectionName() {
        return electionName;
    }
    
    public Integer getReplicationFactor() {
        return replicationFactor;
    }
    
    public String getVoterId() {
        return voterId;
    }
    
    public String getCandidateId() {
        return candidateId;
    }
    
    public String getVoteId() {
        return voteId;
    }
    
    public String getNodeId() {
        return nodeId;
    }
    
    public ConfirmationOutcome getOutcome() {
        return outcome;
    }
    
    public Long getResponseTimeMs() {
        return responseTimeMs;
    }
    
    public Map<String, Object> getMetadata() {
        return metadata;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        VoteRequest that = (VoteRequest) o;
        return type == that.type &&
               Objects.equals(electionId, that.electionId) &&
               Objects.equals(electionName, that.electionName) &&
               Objects.equals(replicationFactor, that.replicationFactor) &&
               Objects.equals(voterId, that.voterId) &&
               Objects.equals(candidateId, that.candidateId) &&
               Objects.equals(voteId, that.voteId) &&
               Objects.equals(nodeId, that.nodeId) &&
               outcome == that.outcome &&
               Objects.equals(responseTimeMs, that.responseTimeMs) &&
               Objects.equals(metadata, that.metadata);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(type, electionId, electionName, replicationFactor, voterId, candidateId,
                          voteId, nodeId, outcome, responseTimeMs, metadata);
    }
    
    @Override
    public String toString() {
        return "VoteRequest{" +
               "type=" + type +
               ", electionId='" + electionId + '\'' +
               ", voterId='" + voterId + '\'' +
               ", voteId='" + voteId + '\'' +
               ", nodeId='" + nodeId + '\'' +
               ", outcome=" + outcome +
               '}';
    }
}
