package com.example.votequorum.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Objects;

/**
 * The consensus-relevant part of an election record.
 */
public class Election {
    
    private final String electionId;
    private final String name;
    private final ElectionStatus status;
    private final int replicationFactor;
    private final Instant createdAt;
    
    @JsonCreator
    public Election(
            @JsonProperty("electionId") String electionId,
            @JsonProperty("name") String name,
            @JsonProperty("status") ElectionStatus status,
            @JsonProperty("replicationFactor") int replicationFactor,
            @JsonProperty("createdAt") Instant createdAt) {
        this.electionId = electionId;
        this.name = name;
        this.status = status;
        this.replicationFactor = replicationFactor;
        this.createdAt = createdAt;
    }
    
    public String getElectionId() {
        return electionId;
    }
    
    public String getName() {
        return name;
    }
    
    public ElectionStatus getStatus() {
        return status;
    }
    
    public int getReplicationFactor() {
        return replicationFactor;
    }
    
    public Instant getCreatedAt() {
        return createdAt;
    }
    
    public Election withStatus(ElectionStatus newStatus) {
        return new Election(electionId, name, newStatus, replicationFactor, createdAt);
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Election election = (Election) o;
        return replicationFactor == election.replicationFactor &&
               Objects.equals(electionId, election.electionId) &&
               Objects.equals(name, election.name) &&
               status == election.status &&
               Objects.equals(createdAt, election.createdAt);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(electionId, name, status, replicationFactor, createdAt);
    }
    
    @Override
    public String toString() {
        return "Election{" +
               "electionId='" + electionId + '\'' +
               ", name='" + name + '\'' +
               ", status=" + status +
               ", replicationFactor=" + replicationFactor +
               '}';
    }
}
