package com.example.votequorum.state;

import com.example.votequorum.exception.ElectionNotActiveException;
import com.example.votequorum.model.Election;
import com.example.votequorum.model.ElectionStatus;

import java.util.List;
import java.util.Optional;

/**
 * Keeps the consensus-relevant lifecycle of elections: UPCOMING, then ACTIVE, then COMPLETED.
 */
public interface ElectionRegistry {
    
    /**
     * Registers a new election in UPCOMING state.
     * 
     * @throws IllegalArgumentException if the id is already registered or the replication factor is below 1
     */
    Election register(String electionId, String name, int replicationFactor);
    
    /**
     * Moves an UPCOMING election to ACTIVE.
     * 
     * @throws ElectionNotActiveException if the election is unknown or not upcoming
     */
    Election start(String electionId);
    
    /**
     * Moves an ACTIVE election to COMPLETED.
     * 
     * @throws ElectionNotActiveException if the election is unknown or not active
     */
    Election end(String electionId);
    
    Optional<Election> get(String electionId);
    
    /**
     * Gets an election that must currently accept votes.
     * 
     * @throws ElectionNotActiveException if the election is unknown or not active
     */
    Election requireActive(String electionId);
    
    boolean isActive(String electionId);
    
    List<Election> findByStatus(ElectionStatus status);
}
