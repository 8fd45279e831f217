package com.example.votequorum.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Objects;

/**
 * Snapshot of a confirming node participating in one election.
 */
public class ElectionNode {
    
    private final String nodeId;
    private final String electionId;
    private final String address;
    private final NodeStatus status;
    private final Instant lastHeartbeat;
    private final double responseTimeMs;
    private final double uptimePercentage;
    
    @JsonCreator
    public ElectionNode(
            @JsonProperty("nodeId") String nodeId,
            @JsonProperty("electionId") String electionId,
            @JsonProperty("address") String address,
            @JsonProperty("status") NodeStatus status,
            @JsonProperty("lastHeartbeat") Instant lastHeartbeat,
            @JsonProperty("responseTimeMs") double responseTimeMs,
            @JsonProperty("uptimePercentage") double uptimePercentage) {
        this.nodeId = nodeId;
        this.electionId = electionId;
        this.address = address;
        this.status = status;
        this.lastHeartbeat = lastHeartbeat;
        this.responseTimeMs = responseTimeMs;
        this.uptimePercentage = uptimePercentage;
    }
    
    public String getNodeId() {
        return nodeId;
    }
    
    public String getElectionId() {
        return electionId;
    }
    
    public String getAddress() {
        return address;
    }
    
    public NodeStatus getStatus() {
        return status;
    }
    
    public Instant getLastHeartbeat() {
        return lastHeartbeat;
    }
    
    /**
     * Exponential moving average of reported response times.
     */
    public double getResponseTimeMs() {
        return responseTimeMs;
    }
    
    public double getUptimePercentage() {
        return uptimePercentage;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ElectionNode that = (ElectionNode) o;
        return Double.compare(that.responseTimeMs, responseTimeMs) == 0 &&
               Double.compare(that.uptimePercentage, uptimePercentage) == 0 &&
               Objects.equals(nodeId, that.nodeId) &&
               Objects.equals(electionId, that.electionId) &&
               Objects.equals(address, that.address) &&
               status == that.status &&
               Objects.equals(lastHeartbeat, that.lastHeartbeat);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(nodeId, electionId, address, status, lastHeartbeat, responseTimeMs, uptimePercentage);
    }
    
    @Override
    public String toString() {
        return "ElectionNode{" +
               "nodeId='" + nodeId + '\'' +
               ", address='" + address + '\'' +
               ", status=" + status +
               ", lastHeartbeat=" + lastHeartbeat +
               ", responseTimeMs=" + responseTimeMs +
               ", uptimePercentage=" + uptimePercentage +
               '}';
    }
}
