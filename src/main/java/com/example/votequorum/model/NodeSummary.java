package com.example.votequorum.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * Dashboard row for a node of an election.
 */
public class NodeSummary {
    
    private final String nodeId;
    private final NodeStatus status;
    private final Instant lastHeartbeat;
    private final double responseTimeMs;
    private final double uptimePercentage;
    
    @JsonCreator
    public NodeSummary(
            @JsonProperty("nodeId") String nodeId,
            @JsonProperty("status") NodeStatus status,
            @JsonProperty("lastHeartbeat") Instant lastHeartbeat,
            @JsonProperty("responseTimeMs") double responseTimeMs,
            @JsonProperty("uptimePercentage") double uptimePercentage) {
        this.nodeId = nodeId;
        this.status = status;
        this.lastHeartbeat = lastHeartbeat;
        this.responseTimeMs = responseTimeMs;
        this.uptimePercentage = uptimePercentage;
    }
    
    public static NodeSummary of(ElectionNode node) {
        return new NodeSummary(node.getNodeId(), node.getStatus(), node.getLastHeartbeat(),
            node.getResponseTimeMs(), node.getUptimePercentage());
    }
    
    public String getNodeId() {
        return nodeId;
    }
    
    public NodeStatus getStatus() {
        return status;
    }
    
    public Instant getLastHeartbeat() {
        return lastHeartbeat;
    }
    
    public double getResponseTimeMs() {
        return responseTimeMs;
    }
    
    public double getUptimePercentage() {
        return uptimePercentage;
    }
    
    @Override
    public String toString() {
        return "NodeSummary{" +
               "nodeId='" + nodeId + '\'' +
               ", status=" + status +
               ", responseTimeMs=" + responseTimeMs +
               ", uptimePercentage=" + uptimePercentage +
               '}';
    }
}
