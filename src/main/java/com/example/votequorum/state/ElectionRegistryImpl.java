package com.example.votequorum.state;

import com.example.votequorum.exception.ElectionNotActiveException;
import com.example.votequorum.logging.StructuredLogger;
import com.example.votequorum.model.Election;
import com.example.votequorum.model.ElectionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * In-memory election registry. Status changes are compare-and-set on the map entry.
 */
public class ElectionRegistryImpl implements ElectionRegistry {
    
    private static final Logger logger = LoggerFactory.getLogger(ElectionRegistryImpl.class);
    
    private final StructuredLogger structuredLogger;
    private final Clock clock;
    private final Map<String, Election> elections = new ConcurrentHashMap<>();
    
    public ElectionRegistryImpl(String coordinatorId) {
        this(coordinatorId, Clock.systemUTC());
    }
    
    public ElectionRegistryImpl(String coordinatorId, Clock clock) {
        this.structuredLogger = new StructuredLogger(ElectionRegistryImpl.class, coordinatorId);
        this.clock = clock;
    }
    
    @Override
    public Election register(String electionId, String name, int replicationFactor) {
        if (electionId == null || electionId.isBlank()) {
            throw new IllegalArgumentException("electionId is required");
        }
        if (replicationFactor < 1) {
            throw new IllegalArgumentException("replicationFactor must be at least 1");
        }
        Election election = new Election(electionId, name, ElectionStatus.UPCOMING, replicationFactor, clock.instant());
        if (elections.putIfAbsent(electionId, election) != null) {
            throw new IllegalArgumentException("Election already registered: " + electionId);
        }
        logger.info("Registered election {} ({}) with replication factor {}", electionId, name, replicationFactor);
        return election;
    }
    
    @Override
    public Election start(String electionId) {
        return transition(electionId, ElectionStatus.UPCOMING, ElectionStatus.ACTIVE, "is not upcoming");
    }
    
    @Override
    public Election end(String electionId) {
        return transition(electionId, ElectionStatus.ACTIVE, ElectionStatus.COMPLETED, "is not active");
    }
    
    @Override
    public Optional<Election> get(String electionId) {
        return electionId == null ? Optional.empty() : Optional.ofNullable(elections.get(electionId));
    }
    
    @Override
    public Election requireActive(String electionId) {
        Election election = get(electionId)
            .orElseThrow(() -> new ElectionNotActiveException(electionId, "does not exist"));
        if (election.getStatus() != ElectionStatus.ACTIVE) {
            throw new ElectionNotActiveException(electionId, "is " + election.getStatus());
        }
        return election;
    }
    
    @Override
    public boolean isActive(String electionId) {
        return get(electionId).map(e -> e.getStatus() == ElectionStatus.ACTIVE).orElse(false);
    }
    
    @Override
    public List<Election> findByStatus(ElectionStatus status) {
        return elections.values().stream()
            .filter(e -> e.getStatus() == status)
            .collect(Collectors.toList());
    }
    
    private Election transition(String electionId, ElectionStatus from, ElectionStatus to, String detail) {
        if (!elections.containsKey(electionId)) {
            throw new ElectionNotActiveException(electionId, "does not exist");
        }
        AtomicReference<ElectionStatus> observed = new AtomicReference<>();
        Election updated = elections.computeIfPresent(electionId, (id, election) -> {
            observed.set(election.getStatus());
            return election.getStatus() == from ? election.withStatus(to) : election;
        });
        
        if (observed.get() != from) {
            throw new ElectionNotActiveException(electionId, detail);
        }
        structuredLogger.logStateTransition(from.name(), to.name(), "Election status transition",
            Map.of("electionId", electionId));
        return updated;
    }
}
