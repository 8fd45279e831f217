package com.example.votequorum.monitor;

import com.example.votequorum.logging.StructuredLogger;
import com.example.votequorum.messaging.GuardedNotificationSink;
import com.example.votequorum.messaging.NotificationSink;
import com.example.votequorum.messaging.NotificationTopics;
import com.example.votequorum.model.ElectionNode;
import com.example.votequorum.model.NotificationEvent;
import com.example.votequorum.model.NotificationEventType;
import com.example.votequorum.state.NodeRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodically sweeps the node registry for overdue heartbeats and broadcasts every node that
 * became unreachable to the admin channel.
 */
public class NodeLivenessMonitor {
    
    private static final Logger logger = LoggerFactory.getLogger(NodeLivenessMonitor.class);
    
    private final NodeRegistry nodeRegistry;
    private final NotificationSink notificationSink;
    private final Duration sweepInterval;
    private final StructuredLogger structuredLogger;
    private final ScheduledExecutorService scheduler;
    private ScheduledFuture<?> sweepTask;
    
    public NodeLivenessMonitor(NodeRegistry nodeRegistry, NotificationSink notificationSink,
                               Duration sweepInterval, String coordinatorId) {
        this.nodeRegistry = nodeRegistry;
        this.notificationSink = GuardedNotificationSink.guard(notificationSink, coordinatorId);
        this.sweepInterval = sweepInterval;
        this.structuredLogger = new StructuredLogger(NodeLivenessMonitor.class, coordinatorId);
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "liveness-monitor-" + coordinatorId);
            t.setDaemon(true);
            return t;
        });
    }
    
    public synchronized void start() {
        if (sweepTask != null) {
            return;
        }
        long periodMs = sweepInterval.toMillis();
        sweepTask = scheduler.scheduleAtFixedRate(this::sweepSafely, periodMs, periodMs, TimeUnit.MILLISECONDS);
        logger.info("Node liveness monitor started, sweeping every {} ms", periodMs);
    }
    
    /**
     * Runs one sweep now.
     * 
     * @return The nodes that became unreachable in this sweep
     */
    public List<ElectionNode> sweep() {
        List<ElectionNode> unreachable = nodeRegistry.sweepUnreachable();
        for (ElectionNode node : unreachable) {
            notificationSink.publish(NotificationTopics.ADMIN_DASHBOARD, NotificationEvent.forElection(
                NotificationEventType.NODE_UNREACHABLE, node.getElectionId(),
                "Node " + node.getNodeId() + " missed its heartbeat",
                Map.of("nodeId", node.getNodeId(),
                       "address", node.getAddress(),
                       "lastHeartbeat", node.getLastHeartbeat().toString(),
                       "uptimePercentage", node.getUptimePercentage())));
        }
        return unreachable;
    }
    
    private void sweepSafely() {
        try {
            sweep();
        } catch (RuntimeException e) {
            // the scheduled task must survive a failed sweep
            structuredLogger.logError("livenessSweep", "Node liveness sweep failed", e, 0, 0, Map.of());
        }
    }
    
    public synchronized void stop() {
        if (sweepTask != null) {
            sweepTask.cancel(false);
            sweepTask = null;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("Node liveness monitor stopped");
    }
}
