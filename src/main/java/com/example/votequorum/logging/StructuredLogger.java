package com.example.votequorum.logging;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.util.Map;

/**
 * Structured JSON logging for the vote consensus core.
 * Every event is a single JSON object carrying the coordinator id, an event type and
 * optional context, so votes can be traced across rounds and background retries.
 */
public class StructuredLogger {

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule());

    private final Logger logger;
    private final String coordinatorId;

    public StructuredLogger(Class<?> clazz, String coordinatorId) {
        this.logger = LoggerFactory.getLogger(clazz);
        this.coordinatorId = coordinatorId;
    }

    /**
     * Logs a step in a vote's lifecycle (cast, finalized, failed, expired).
     */
    public void logVoteLifecycle(VoteEvent event, String voteId, String electionId, Map<String, Object> context) {
        try {
            ObjectNode logEntry = newEntry("vote_lifecycle");
            logEntry.put("event", event.name());
            logEntry.put("voteId", voteId);
            logEntry.put("electionId", electionId);
            attachContext(logEntry, "context", context);
            logger.info(objectMapper.writeValueAsString(logEntry));
        } catch (Exception e) {
            logger.error("Failed to log vote lifecycle event", e);
        }
    }

    /**
     * Logs a consensus round phase with its participant count and quorum threshold.
     */
    public void logConsensusRound(RoundPhase phase, String voteId, int roundNumber,
                                  int participants, int requiredConfirmations, Map<String, Object> context) {
        try {
            ObjectNode logEntry = newEntry("consensus_round");
            logEntry.put("phase", phase.name());
            logEntry.put("voteId", voteId);
            logEntry.put("roundNumber", roundNumber);
            logEntry.put("participants", participants);
            logEntry.put("requiredConfirmations", requiredConfirmations);
            attachContext(logEntry, "context", context);
            logger.info(objectMapper.writeValueAsString(logEntry));
        } catch (Exception e) {
            logger.error("Failed to log consensus round", e);
        }
    }

    /**
     * Logs node health changes: heartbeats that change status, liveness sweeps, retirement.
     */
    public void logNodeHealth(String nodeId, String electionId, String status, Map<String, Object> context) {
        try {
            ObjectNode logEntry = newEntry("node_health");
            logEntry.put("nodeId", nodeId);
            logEntry.put("electionId", electionId);
            logEntry.put("status", status);
            attachContext(logEntry, "context", context);
            logger.info(objectMapper.writeValueAsString(logEntry));
        } catch (Exception e) {
            logger.error("Failed to log node health event", e);
        }
    }

    /**
     * Logs performance metrics for consensus operations.
     */
    public void logPerformanceMetrics(String operation, long durationMs,
                                      int nodeCount, Map<String, Object> metrics) {
        try {
            ObjectNode logEntry = newEntry("performance_metrics");
            logEntry.put("operation", operation);
            logEntry.put("durationMs", durationMs);
            logEntry.put("nodeCount", nodeCount);
            attachContext(logEntry, "metrics", metrics);
            logger.info(objectMapper.writeValueAsString(logEntry));
        } catch (Exception e) {
            logger.error("Failed to log performance metrics", e);
        }
    }

    /**
     * Logs error events with context and retry information.
     */
    public void logError(String operation, String errorMessage, Throwable throwable,
                         int attempt, int maxAttempts, Map<String, Object> context) {
        try {
            ObjectNode logEntry = newEntry("error");
            logEntry.put("operation", operation);
            logEntry.put("errorMessage", errorMessage);
            logEntry.put("attempt", attempt);
            logEntry.put("maxAttempts", maxAttempts);

            if (throwable != null) {
                logEntry.put("exceptionType", throwable.getClass().getSimpleName());
                logEntry.put("exceptionMessage", throwable.getMessage());
                logEntry.put("stackTrace", getStackTraceString(throwable));
            }

            attachContext(logEntry, "context", context);
            logger.error(objectMapper.writeValueAsString(logEntry));
        } catch (Exception e) {
            logger.error("Failed to log error event", e);
        }
    }

    /**
     * Logs state transition events of votes, rounds and elections.
     */
    public void logStateTransition(String fromState, String toState, String reason,
                                   Map<String, Object> context) {
        try {
            ObjectNode logEntry = newEntry("state_transition");
            logEntry.put("fromState", fromState);
            logEntry.put("toState", toState);
            logEntry.put("reason", reason);
            attachContext(logEntry, "context", context);
            logger.info(objectMapper.writeValueAsString(logEntry));
        } catch (Exception e) {
            logger.error("Failed to log state transition", e);
        }
    }

    /**
     * Logs the outcome of handing an event to the notification sink.
     */
    public void logNotification(DeliveryResult result, String topic, String eventType,
                                String voteId, Map<String, Object> context) {
        try {
            ObjectNode logEntry = newEntry("notification");
            logEntry.put("result", result.name());
            logEntry.put("topic", topic);
            logEntry.put("notificationType", eventType);
            logEntry.put("voteId", voteId);
            attachContext(logEntry, "context", context);

            String json = objectMapper.writeValueAsString(logEntry);
            if (result == DeliveryResult.FAILED) {
                logger.warn(json);
            } else {
                logger.info(json);
            }
        } catch (Exception e) {
            logger.error("Failed to log notification event", e);
        }
    }

    /**
     * Logs coordinator lifecycle events (startup, shutdown, etc.).
     */
    public void logServiceLifecycle(ServiceLifecycleEvent event, Map<String, Object> context) {
        try {
            ObjectNode logEntry = newEntry("service_lifecycle");
            logEntry.put("lifecycleEvent", event.name());
            attachContext(logEntry, "context", context);
            logger.info(objectMapper.writeValueAsString(logEntry));
        } catch (Exception e) {
            logger.error("Failed to log service lifecycle event", e);
        }
    }

    /**
     * Sets MDC context for thread-local logging context.
     */
    public void setMDCContext(String voteId, String operation) {
        if (voteId != null) {
            MDC.put("voteId", voteId);
        }
        MDC.put("operation", operation);
        MDC.put("coordinatorId", coordinatorId);
    }

    /**
     * Clears MDC context.
     */
    public void clearMDCContext() {
        MDC.remove("voteId");
        MDC.remove("operation");
        MDC.remove("coordinatorId");
    }

    public Logger getLogger() {
        return logger;
    }

    public String getCoordinatorId() {
        return coordinatorId;
    }

    private ObjectNode newEntry(String eventType) {
        ObjectNode logEntry = objectMapper.createObjectNode();
        logEntry.put("timestamp", Instant.now().toString());
        logEntry.put("coordinatorId", coordinatorId);
        logEntry.put("eventType", eventType);
        return logEntry;
    }

    private void attachContext(ObjectNode logEntry, String field, Map<String, Object> context) {
        if (context != null && !context.isEmpty()) {
            logEntry.set(field, objectMapper.valueToTree(context));
        }
    }

    private String getStackTraceString(Throwable throwable) {
        StringWriter sw = new StringWriter();
        throwable.printStackTrace(new PrintWriter(sw));
        return sw.toString();
    }

    /**
     * Vote lifecycle events.
     */
    public enum VoteEvent {
        CAST,
        DUPLICATE_REJECTED,
        FINALIZED,
        FAILED,
        EXPIRED
    }

    /**
     * Consensus round phases.
     */
    public enum RoundPhase {
        OPENED,
        CONFIRMATION_RECORDED,
        CONFIRMATION_DROPPED,
        COMPLETED,
        FAILED,
        TIMED_OUT,
        SUPERSEDED,
        ABANDONED
    }

    /**
     * Notification delivery results.
     */
    public enum DeliveryResult {
        DELIVERED,
        FAILED,
        SKIPPED
    }

    /**
     * Coordinator lifecycle events.
     */
    public enum ServiceLifecycleEvent {
        STARTING,
        STARTED,
        STOPPING,
        STOPPED
    }
}
