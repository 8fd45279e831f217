package com.example.votequorum.model;

/**
 * Operational status of an election node.
 */
public enum NodeStatus {
    /**
     * Node is heartbeating within the expected interval and may be selected for rounds.
     */
    ACTIVE,
    
    /**
     * Node has been retired for the rest of the election. Never selected again.
     */
    INACTIVE,
    
    /**
     * Node missed heartbeats beyond the timeout. A fresh heartbeat makes it active again.
     */
    UNREACHABLE
}
