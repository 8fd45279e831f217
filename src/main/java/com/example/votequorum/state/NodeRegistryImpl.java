package com.example.votequorum.state;

import com.example.votequorum.logging.StructuredLogger;
import com.example.votequorum.model.ElectionNode;
import com.example.votequorum.model.NodeStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * In-memory node registry. Each node's health record is guarded by its own monitor, so
 * heartbeats for different nodes proceed fully in parallel.
 */
public class NodeRegistryImpl implements NodeRegistry {

    private static final Logger logger = LoggerFactory.getLogger(NodeRegistryImpl.class);

    static final double RESPONSE_TIME_SMOOTHING = 0.2;

    private static final Comparator<ElectionNode> SELECTION_ORDER =
        Comparator.comparingDouble(ElectionNode::getResponseTimeMs)
            .thenComparing(ElectionNode::getLastHeartbeat, Comparator.reverseOrder())
            .thenComparing(ElectionNode::getNodeId);

    private final StructuredLogger structuredLogger;
    private final Duration heartbeatTimeout;
    private final int uptimeWindowSize;
    private final Clock clock;

    private final Map<String, NodeHealth> nodes = new ConcurrentHashMap<>();
    private final Map<String, List<String>> nodesByElection = new ConcurrentHashMap<>();

    public NodeRegistryImpl(String coordinatorId, Duration heartbeatTimeout, int uptimeWindowSize) {
        this(coordinatorId, heartbeatTimeout, uptimeWindowSize, Clock.systemUTC());
    }

    public NodeRegistryImpl(String coordinatorId, Duration heartbeatTimeout, int uptimeWindowSize, Clock clock) {
        if (uptimeWindowSize < 1) {
            throw new IllegalArgumentException("uptimeWindowSize must be at least 1");
        }
        this.structuredLogger = new StructuredLogger(NodeRegistryImpl.class, coordinatorId);
        this.heartbeatTimeout = heartbeatTimeout;
        this.uptimeWindowSize = uptimeWindowSize;
        this.clock = clock;
    }

    @Override
    public List<ElectionNode> registerNodes(String electionId, int replicationFactor) {
        List<ElectionNode> created = new ArrayList<>(replicationFactor);
        for (int i = 0; i < replicationFactor; i++) {
            String address = "192.168.1." + (100 + i) + ":" + (8000 + i);
            created.add(registerNode(electionId, UUID.randomUUID().toString(), address));
        }
        logger.info("Registered {} nodes for election {}", created.size(), electionId);
        return created;
    }

    @Override
    public ElectionNode registerNode(String electionId, String nodeId, String address) {
        NodeHealth health = new NodeHealth(nodeId, electionId, address, clock.instant(), uptimeWindowSize);
        if (nodes.putIfAbsent(nodeId, health) != null) {
            throw new IllegalArgumentException("Node already registered: " + nodeId);
        }
        nodesByElection.computeIfAbsent(electionId, id -> new CopyOnWriteArrayList<>()).add(nodeId);

        ElectionNode snapshot = health.snapshot();
        structuredLogger.logNodeHealth(nodeId, electionId, snapshot.getStatus().name(),
            Map.of("action", "registered", "address", address));
        return snapshot;
    }

    @Override
    public List<ElectionNode> selectActiveNodes(String electionId, int count) {
        if (count <= 0) {
            return List.of();
        }
        List<ElectionNode> selected = getNodes(electionId).stream()
            .filter(node -> node.getStatus() == NodeStatus.ACTIVE)
            .sorted(SELECTION_ORDER)
            .limit(count)
            .collect(Collectors.toList());

        logger.debug("Selected {} of {} requested active nodes for election {}",
                    selected.size(), count, electionId);
        return selected;
    }

    @Override
    public ElectionNode recordHeartbeat(String nodeId, long responseTimeMs) {
        if (responseTimeMs < 0) {
            throw new IllegalArgumentException("Response time cannot be negative: " + responseTimeMs);
        }
        NodeHealth health = requireNode(nodeId);

        NodeStatus previous;
        ElectionNode updated;
        synchronized (health) {
            previous = health.status;
            health.heartbeat(clock.instant(), responseTimeMs, heartbeatTimeout);
            updated = health.snapshot();
        }

        if (previous != updated.getStatus()) {
            structuredLogger.logNodeHealth(nodeId, updated.getElectionId(), updated.getStatus().name(),
                Map.of("previousStatus", previous.name(),
                       "responseTimeMs", updated.getResponseTimeMs(),
                       "uptimePercentage", updated.getUptimePercentage()));
        } else {
            logger.debug("Heartbeat from node {}: {} ms (avg {} ms, uptime {}%)",
                        nodeId, responseTimeMs, updated.getResponseTimeMs(), updated.getUptimePercentage());
        }
        return updated;
    }

    @Override
    public List<ElectionNode> sweepUnreachable() {
        Instant now = clock.instant();
        List<ElectionNode> changed = new ArrayList<>();

        for (NodeHealth health : nodes.values()) {
            ElectionNode snapshot = null;
            synchronized (health) {
                if (health.markMissedIfOverdue(now, heartbeatTimeout)) {
                    snapshot = health.snapshot();
                }
            }
            if (snapshot != null) {
                changed.add(snapshot);
                structuredLogger.logNodeHealth(snapshot.getNodeId(), snapshot.getElectionId(),
                    NodeStatus.UNREACHABLE.name(),
                    Map.of("lastHeartbeat", snapshot.getLastHeartbeat().toString(),
                           "timeoutSeconds", heartbeatTimeout.getSeconds()));
            }
        }

        if (!changed.isEmpty()) {
            logger.warn("{} node(s) became unreachable", changed.size());
        }
        return changed;
    }

    @Override
    public boolean markInactive(String nodeId) {
        NodeHealth health = nodes.get(nodeId);
        if (health == null) {
            return false;
        }
        NodeStatus previous;
        synchronized (health) {
            previous = health.status;
            if (previous == NodeStatus.INACTIVE) {
                return false;
            }
            health.status = NodeStatus.INACTIVE;
        }
        structuredLogger.logNodeHealth(nodeId, health.electionId, NodeStatus.INACTIVE.name(),
            Map.of("previousStatus", previous.name()));
        return true;
    }

    @Override
    public Optional<ElectionNode> getNode(String nodeId) {
        NodeHealth health = nodes.get(nodeId);
        if (health == null) {
            return Optional.empty();
        }
        synchronized (health) {
            return Optional.of(health.snapshot());
        }
    }

    @Override
    public List<ElectionNode> getNodes(String electionId) {
        List<String> ids = nodesByElection.getOrDefault(electionId, List.of());
        List<ElectionNode> result = new ArrayList<>(ids.size());
        for (String nodeId : ids) {
            getNode(nodeId).ifPresent(result::add);
        }
        return result;
    }

    private NodeHealth requireNode(String nodeId) {
        NodeHealth health = nodeId != null ? nodes.get(nodeId) : null;
        if (health == null) {
            throw new IllegalArgumentException("Unknown node: " + nodeId);
        }
        return health;
    }

    /**
     * Mutable health record of one node. All access is synchronized on the instance.
     */
    private static class NodeHealth {
        private final String nodeId;
        private final String electionId;
        private final String address;
        private final int windowSize;
        // true = heartbeat arrived within the timeout, false = interval missed
        private final Deque<Boolean> window = new ArrayDeque<>();

        private NodeStatus status = NodeStatus.ACTIVE;
        private Instant lastHeartbeat;
        private double responseTimeMs = 0.0;
        private boolean hasResponseSample = false;
        private boolean missRecorded = false;

        NodeHealth(String nodeId, String electionId, String address, Instant registeredAt, int windowSize) {
            this.nodeId = nodeId;
            this.electionId = electionId;
            this.address = address;
            this.lastHeartbeat = registeredAt;
            this.windowSize = windowSize;
        }

        void heartbeat(Instant now, long sampleMs, Duration timeout) {
            boolean onTime = Duration.between(lastHeartbeat, now).compareTo(timeout) <= 0;
            // a miss already counted by the sweep is not counted twice
            record(onTime || missRecorded);
            missRecorded = false;

            if (hasResponseSample) {
                responseTimeMs = RESPONSE_TIME_SMOOTHING * sampleMs + (1 - RESPONSE_TIME_SMOOTHING) * responseTimeMs;
            } else {
                responseTimeMs = sampleMs;
                hasResponseSample = true;
            }

            lastHeartbeat = now;
            if (status != NodeStatus.INACTIVE) {
                status = NodeStatus.ACTIVE;
            }
        }

        boolean markMissedIfOverdue(Instant now, Duration timeout) {
            if (status != NodeStatus.ACTIVE) {
                return false;
            }
            if (Duration.between(lastHeartbeat, now).compareTo(timeout) <= 0) {
                return false;
            }
            status = NodeStatus.UNREACHABLE;
            record(false);
            missRecorded = true;
            return true;
        }

        private void record(boolean onTime) {
            window.addLast(onTime);
            while (window.size() > windowSize) {
                window.removeFirst();
            }
        }

        private double uptimePercentage() {
            if (window.isEmpty()) {
                return 100.0;
            }
            long onTime = window.stream().filter(Boolean::booleanValue).count();
            return onTime * 100.0 / window.size();
        }

        ElectionNode snapshot() {
            return new ElectionNode(nodeId, electionId, address, status, lastHeartbeat,
                responseTimeMs, uptimePercentage());
        }
    }
}
