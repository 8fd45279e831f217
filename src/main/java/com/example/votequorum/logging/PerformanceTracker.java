package com.example.votequorum.logging;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Aggregates timing and success rates of consensus operations and reports each
 * completed operation through the structured logger.
 */
public class PerformanceTracker {

    public static final String CAST_VOTE = "CAST_VOTE";
    public static final String OPEN_ROUND = "OPEN_ROUND";
    public static final String RECORD_CONFIRMATION = "RECORD_CONFIRMATION";
    public static final String EVALUATE = "EVALUATE";

    private final StructuredLogger logger;
    private final Map<String, OperationMetrics> operationMetrics = new ConcurrentHashMap<>();

    public PerformanceTracker(StructuredLogger logger) {
        this.logger = logger;
    }

    public OperationTimer startOperation(String subjectId, String operationType) {
        return new OperationTimer(subjectId, operationType, Instant.now());
    }

    /**
     * Records the completion of an operation and logs the running aggregates for its type.
     */
    public void recordOperation(OperationTimer timer, boolean success, Map<String, Object> additionalMetrics) {
        long durationMs = timer.getDurationMs();
        String operationType = timer.getOperationType();

        OperationMetrics metrics = operationMetrics.computeIfAbsent(operationType,
            k -> new OperationMetrics());
        metrics.recordOperation(durationMs, success);

        Map<String, Object> logMetrics = new HashMap<>();
        logMetrics.put("subjectId", timer.getSubjectId());
        logMetrics.put("success", success);
        logMetrics.put("totalOperations", metrics.getTotalOperations());
        logMetrics.put("successRate", metrics.getSuccessRate());
        logMetrics.put("averageDurationMs", metrics.getAverageDurationMs());
        logMetrics.put("maxDurationMs", metrics.getMaxDurationMs());
        if (additionalMetrics != null) {
            logMetrics.putAll(additionalMetrics);
        }

        logger.logPerformanceMetrics(operationType, durationMs, timer.getNodeCount(), logMetrics);
    }

    public OperationMetrics getMetrics(String operationType) {
        return operationMetrics.get(operationType);
    }

    public Map<String, OperationMetrics> getAllMetrics() {
        return Map.copyOf(operationMetrics);
    }

    public void resetMetrics() {
        operationMetrics.clear();
    }

    /**
     * Timer for a single operation on one vote (or node).
     */
    public static class OperationTimer {
        private final String subjectId;
        private final String operationType;
        private final Instant startTime;
        private final AtomicInteger nodeCount = new AtomicInteger(0);

        public OperationTimer(String subjectId, String operationType, Instant startTime) {
            this.subjectId = subjectId;
            this.operationType = operationType;
            this.startTime = startTime;
        }

        public String getSubjectId() {
            return subjectId;
        }

        public String getOperationType() {
            return operationType;
        }

        public long getDurationMs() {
            return Instant.now().toEpochMilli() - startTime.toEpochMilli();
        }

        /**
         * Sets how many nodes took part in the operation.
         */
        public void setNodeCount(int count) {
            nodeCount.set(count);
        }

        public int getNodeCount() {
            return nodeCount.get();
        }
    }

    /**
     * Aggregate metrics for an operation type.
     */
    public static class OperationMetrics {
        private final AtomicLong totalOperations = new AtomicLong(0);
        private final AtomicLong successfulOperations = new AtomicLong(0);
        private final AtomicLong totalDurationMs = new AtomicLong(0);
        private final AtomicLong maxDurationMs = new AtomicLong(0);

        public void recordOperation(long durationMs, boolean success) {
            totalOperations.incrementAndGet();
            totalDurationMs.addAndGet(durationMs);
            if (success) {
                successfulOperations.incrementAndGet();
            }
            maxDurationMs.updateAndGet(current -> Math.max(current, durationMs));
        }

        public long getTotalOperations() {
            return totalOperations.get();
        }

        public long getSuccessfulOperations() {
            return successfulOperations.get();
        }

        public long getFailedOperations() {
            return totalOperations.get() - successfulOperations.get();
        }

        public double getSuccessRate() {
            long total = totalOperations.get();
            return total > 0 ? (double) successfulOperations.get() / total : 0.0;
        }

        public double getAverageDurationMs() {
            long total = totalOperations.get();
            return total > 0 ? (double) totalDurationMs.get() / total : 0.0;
        }

        public long getMaxDurationMs() {
            return maxDurationMs.get();
        }
    }
}
