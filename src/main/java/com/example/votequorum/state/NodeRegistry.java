package com.example.votequorum.state;

import com.example.votequorum.model.ElectionNode;
import java.util.List;
import java.util.Optional;

/**
 * Tracks the confirming nodes of each election together with their liveness and health metrics.
 */
public interface NodeRegistry {
    
    /**
     * Creates the nodes of an election at setup time.
     * 
     * @param electionId The election the nodes serve
     * @param replicationFactor Number of nodes to create
     * @return The created nodes, all active
     */
    List<ElectionNode> registerNodes(String electionId, int replicationFactor);
    
    /**
     * Registers a single node with a known identity and address.
     * 
     * @param electionId The election the node serves
     * @param nodeId Unique node identity
     * @param address Network address as host:port
     * @return The registered node
     * @throws IllegalArgumentException if the node id is already registered
     */
    ElectionNode registerNode(String electionId, String nodeId, String address);
    
    /**
     * Selects up to {@code count} active nodes, best response time first, then most recent
     * heartbeat, then lowest id. Returns fewer nodes when not enough are active; never fails for that.
     * 
     * @param electionId The election to select from
     * @param count Maximum number of nodes to return
     * @return Ordered selection, possibly empty
     */
    List<ElectionNode> selectActiveNodes(String electionId, int count);
    
    /**
     * Records a heartbeat: marks the node active, folds the response time into the moving
     * average and updates uptime.
     * 
     * @param nodeId The node that sent the heartbeat
     * @param responseTimeMs Measured response time in milliseconds
     * @return The node after the update
     * @throws IllegalArgumentException if the node is unknown or the response time is negative
     */
    ElectionNode recordHeartbeat(String nodeId, long responseTimeMs);
    
    /**
     * Moves every active node whose last heartbeat is older than the timeout to unreachable.
     * 
     * @return Nodes that changed status during this sweep
     */
    List<ElectionNode> sweepUnreachable();
    
    /**
     * Retires a node for the rest of the election.
     * 
     * @param nodeId The node to retire
     * @return true if the node changed status, false if unknown or already inactive
     */
    boolean markInactive(String nodeId);
    
    Optional<ElectionNode> getNode(String nodeId);
    
    /**
     * All nodes of an election in registration order.
     */
    List<ElectionNode> getNodes(String electionId);
}
