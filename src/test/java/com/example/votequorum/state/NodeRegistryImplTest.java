package com.example.votequorum.state;

import com.example.votequorum.model.ElectionNode;
import com.example.votequorum.model.NodeStatus;
import com.example.votequorum.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class NodeRegistryImplTest {

    private static final String ELECTION = "election-1";
    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    private MutableClock clock;
    private NodeRegistryImpl registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        registry = new NodeRegistryImpl("test-coordinator", TIMEOUT, 20, clock);
    }

    private static List<String> ids(List<ElectionNode> nodes) {
        return nodes.stream().map(ElectionNode::getNodeId).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("Registration")
    class Registration {

        @Test
        @DisplayName("Should create the replication factor's nodes, all active")
        void shouldCreateNodesForElection() {
            List<ElectionNode> nodes = registry.registerNodes(ELECTION, 5);

            assertEquals(5, nodes.size());
            assertEquals(5, registry.getNodes(ELECTION).size());
            assertTrue(nodes.stream().allMatch(n -> n.getStatus() == NodeStatus.ACTIVE));
            assertEquals("192.168.1.100:8000", nodes.get(0).getAddress());
            assertEquals("192.168.1.104:8004", nodes.get(4).getAddress());
            assertEquals(100.0, nodes.get(0).getUptimePercentage());
            assertEquals(clock.instant(), nodes.get(0).getLastHeartbeat());
        }

        @Test
        @DisplayName("Should reject a duplicate node id")
        void shouldRejectDuplicateNodeId() {
            registry.registerNode(ELECTION, "node-a", "10.0.0.1:8000");

            assertThrows(IllegalArgumentException.class,
                () -> registry.registerNode(ELECTION, "node-a", "10.0.0.2:8000"));
        }

        @Test
        @DisplayName("Should keep elections apart")
        void shouldKeepElectionsApart() {
            registry.registerNodes(ELECTION, 3);
            registry.registerNodes("election-2", 2);

            assertEquals(3, registry.getNodes(ELECTION).size());
            assertEquals(2, registry.getNodes("election-2").size());
            assertTrue(registry.getNodes("unknown").isEmpty());
        }
    }

    @Nested
    @DisplayName("Node Selection")
    class NodeSelection {

        @Test
        @DisplayName("Should return the two active nodes by response time when three are requested")
        void shouldReturnFewerNodesWhenNotEnoughActive() {
            registry.registerNode(ELECTION, "node-a", "10.0.0.1:8000");
            registry.registerNode(ELECTION, "node-b", "10.0.0.2:8000");
            registry.registerNode(ELECTION, "node-c", "10.0.0.3:8000");
            registry.registerNode(ELECTION, "node-d", "10.0.0.4:8000");
            registry.recordHeartbeat("node-a", 50);
            registry.recordHeartbeat("node-c", 20);
            registry.markInactive("node-b");
            registry.markInactive("node-d");

            List<ElectionNode> selected = registry.selectActiveNodes(ELECTION, 3);

            assertEquals(List.of("node-c", "node-a"), ids(selected));
        }

        @Test
        @DisplayName("Should order by response time, then latest heartbeat, then id")
        void shouldApplyTieBreakers() {
            registry.registerNode(ELECTION, "node-a", "10.0.0.1:8000");
            registry.registerNode(ELECTION, "node-b", "10.0.0.2:8000");
            registry.registerNode(ELECTION, "node-c", "10.0.0.3:8000");

            assertEquals(List.of("node-a", "node-b", "node-c"), ids(registry.selectActiveNodes(ELECTION, 3)));

            clock.advance(Duration.ofSeconds(1));
            registry.recordHeartbeat("node-c", 0);

            assertEquals(List.of("node-c", "node-a", "node-b"), ids(registry.selectActiveNodes(ELECTION, 3)));
        }

        @Test
        @DisplayName("Should never select unreachable or inactive nodes")
        void shouldSkipNodesThatAreNotActive() {
            registry.registerNode(ELECTION, "node-a", "10.0.0.1:8000");
            registry.registerNode(ELECTION, "node-b", "10.0.0.2:8000");
            clock.advance(Duration.ofSeconds(20));
            registry.recordHeartbeat("node-a", 10);
            clock.advance(Duration.ofSeconds(15));
            registry.sweepUnreachable();

            assertEquals(List.of("node-a"), ids(registry.selectActiveNodes(ELECTION, 5)));
            assertTrue(registry.selectActiveNodes(ELECTION, 0).isEmpty());
        }

        @Test
        @DisplayName("Should return an empty list when no node is active")
        void shouldReturnEmptyWhenNoneActive() {
            registry.registerNode(ELECTION, "node-a", "10.0.0.1:8000");
            registry.markInactive("node-a");

            assertTrue(registry.selectActiveNodes(ELECTION, 3).isEmpty());
        }
    }

    @Nested
    @DisplayName("Heartbeats")
    class Heartbeats {

        @Test
        @DisplayName("Should seed the average with the first sample and smooth later ones")
        void shouldSmoothResponseTime() {
            registry.registerNode(ELECTION, "node-a", "10.0.0.1:8000");

            assertEquals(100.0, registry.recordHeartbeat("node-a", 100).getResponseTimeMs(), 0.0001);
            assertEquals(90.0, registry.recordHeartbeat("node-a", 50).getResponseTimeMs(), 0.0001);
            assertEquals(92.0, registry.recordHeartbeat("node-a", 100).getResponseTimeMs(), 0.0001);
        }

        @Test
        @DisplayName("Should count a late heartbeat against uptime")
        void shouldCountLateHeartbeatAsMiss() {
            registry.registerNode(ELECTION, "node-a", "10.0.0.1:8000");
            clock.advance(Duration.ofSeconds(10));
            registry.recordHeartbeat("node-a", 10);
            clock.advance(Duration.ofSeconds(45));

            ElectionNode node = registry.recordHeartbeat("node-a", 10);

            assertEquals(NodeStatus.ACTIVE, node.getStatus());
            assertEquals(50.0, node.getUptimePercentage(), 0.0001);
        }

        @Test
        @DisplayName("Should only keep the configured window of intervals")
        void shouldSlideUptimeWindow() {
            NodeRegistryImpl small = new NodeRegistryImpl("test-coordinator", TIMEOUT, 2, clock);
            small.registerNode(ELECTION, "node-a", "10.0.0.1:8000");
            clock.advance(Duration.ofSeconds(60));
            assertEquals(0.0, small.recordHeartbeat("node-a", 10).getUptimePercentage(), 0.0001);

            clock.advance(Duration.ofSeconds(5));
            small.recordHeartbeat("node-a", 10);
            clock.advance(Duration.ofSeconds(5));

            assertEquals(100.0, small.recordHeartbeat("node-a", 10).getUptimePercentage(), 0.0001);
        }

        @Test
        @DisplayName("Should bring an unreachable node back without counting its miss twice")
        void shouldReviveUnreachableNode() {
            registry.registerNode(ELECTION, "node-a", "10.0.0.1:8000");
            clock.advance(Duration.ofSeconds(31));
            List<ElectionNode> swept = registry.sweepUnreachable();
            assertEquals(1, swept.size());
            assertEquals(NodeStatus.UNREACHABLE, swept.get(0).getStatus());
            assertEquals(0.0, swept.get(0).getUptimePercentage(), 0.0001);

            ElectionNode revived = registry.recordHeartbeat("node-a", 10);

            assertEquals(NodeStatus.ACTIVE, revived.getStatus());
            assertEquals(50.0, revived.getUptimePercentage(), 0.0001);
        }

        @Test
        @DisplayName("Should not revive a retired node")
        void shouldKeepInactiveNodeInactive() {
            registry.registerNode(ELECTION, "node-a", "10.0.0.1:8000");
            assertTrue(registry.markInactive("node-a"));
            assertFalse(registry.markInactive("node-a"));

            assertEquals(NodeStatus.INACTIVE, registry.recordHeartbeat("node-a", 5).getStatus());
        }

        @Test
        @DisplayName("Should reject unknown nodes and negative response times")
        void shouldRejectInvalidHeartbeats() {
            registry.registerNode(ELECTION, "node-a", "10.0.0.1:8000");

            assertThrows(IllegalArgumentException.class, () -> registry.recordHeartbeat("missing", 5));
            assertThrows(IllegalArgumentException.class, () -> registry.recordHeartbeat("node-a", -1));
            assertFalse(registry.markInactive("missing"));
        }
    }

    @Nested
    @DisplayName("Liveness Sweep")
    class LivenessSweep {

        @Test
        @DisplayName("Should report each node once while it stays unreachable")
        void shouldReportTransitionsOnce() {
            registry.registerNodes(ELECTION, 3);
            clock.advance(Duration.ofSeconds(29));
            assertTrue(registry.sweepUnreachable().isEmpty());

            clock.advance(Duration.ofSeconds(2));
            assertEquals(3, registry.sweepUnreachable().size());
            assertTrue(registry.sweepUnreachable().isEmpty());
        }
    }
}
