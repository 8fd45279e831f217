package com.example.votequorum.logging;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for PerformanceTracker functionality.
 */
class PerformanceTrackerTest {
    
    @Mock
    private StructuredLogger mockLogger;
    
    private PerformanceTracker performanceTracker;
    
    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        performanceTracker = new PerformanceTracker(mockLogger);
    }
    
    @Test
    void testStartOperation() {
        PerformanceTracker.OperationTimer timer =
            performanceTracker.startOperation("vote-1", PerformanceTracker.OPEN_ROUND);
        
        assertEquals("vote-1", timer.getSubjectId());
        assertEquals(PerformanceTracker.OPEN_ROUND, timer.getOperationType());
        assertEquals(0, timer.getNodeCount());
        assertTrue(timer.getDurationMs() >= 0);
    }
    
    @Test
    @SuppressWarnings("unchecked")
    void testRecordSuccessfulOperation() {
        PerformanceTracker.OperationTimer timer =
            performanceTracker.startOperation("vote-1", PerformanceTracker.OPEN_ROUND);
        timer.setNodeCount(3);
        
        performanceTracker.recordOperation(timer, true, Map.of("electionId", "election-1"));
        
        verify(mockLogger).logPerformanceMetrics(
            eq(PerformanceTracker.OPEN_ROUND),
            anyLong(),
            eq(3),
            argThat(metrics -> {
                Map<String, Object> metricsMap = (Map<String, Object>) metrics;
                return Boolean.TRUE.equals(metricsMap.get("success"))
                    && "vote-1".equals(metricsMap.get("subjectId"))
                    && "election-1".equals(metricsMap.get("electionId"));
            })
        );
        
        PerformanceTracker.OperationMetrics metrics = performanceTracker.getMetrics(PerformanceTracker.OPEN_ROUND);
        assertEquals(1, metrics.getTotalOperations());
        assertEquals(1.0, metrics.getSuccessRate(), 0.001);
    }
    
    @Test
    void testRecordFailedOperationWithoutExtras() {
        PerformanceTracker.OperationTimer timer =
            performanceTracker.startOperation("vote-2", PerformanceTracker.EVALUATE);
        
        performanceTracker.recordOperation(timer, false, null);
        
        verify(mockLogger).logPerformanceMetrics(eq(PerformanceTracker.EVALUATE), anyLong(), eq(0), any());
        PerformanceTracker.OperationMetrics metrics = performanceTracker.getMetrics(PerformanceTracker.EVALUATE);
        assertEquals(1, metrics.getFailedOperations());
        assertEquals(0.0, metrics.getSuccessRate(), 0.001);
    }
    
    @Test
    void testMultipleOperations() {
        for (int i = 0; i < 5; i++) {
            PerformanceTracker.OperationTimer timer =
                performanceTracker.startOperation("vote-" + i, PerformanceTracker.RECORD_CONFIRMATION);
            performanceTracker.recordOperation(timer, i % 2 == 0, null);
        }
        
        PerformanceTracker.OperationMetrics metrics =
            performanceTracker.getMetrics(PerformanceTracker.RECORD_CONFIRMATION);
        assertEquals(5, metrics.getTotalOperations());
        assertEquals(3, metrics.getSuccessfulOperations());
        assertEquals(0.6, metrics.getSuccessRate(), 0.001);
    }
    
    @Test
    void testGetAllMetricsAndReset() {
        performanceTracker.recordOperation(
            performanceTracker.startOperation("vote-1", PerformanceTracker.CAST_VOTE), true, null);
        performanceTracker.recordOperation(
            performanceTracker.startOperation("vote-1", PerformanceTracker.EVALUATE), true, null);
        
        assertEquals(2, performanceTracker.getAllMetrics().size());
        
        performanceTracker.resetMetrics();
        
        assertNull(performanceTracker.getMetrics(PerformanceTracker.CAST_VOTE));
        assertTrue(performanceTracker.getAllMetrics().isEmpty());
    }
    
    @Test
    void testOperationMetricsAggregates() {
        PerformanceTracker.OperationMetrics metrics = new PerformanceTracker.OperationMetrics();
        
        assertEquals(0.0, metrics.getAverageDurationMs(), 0.001);
        
        metrics.recordOperation(100L, true);
        metrics.recordOperation(300L, false);
        metrics.recordOperation(200L, true);
        
        assertEquals(3, metrics.getTotalOperations());
        assertEquals(200.0, metrics.getAverageDurationMs(), 0.001);
        assertEquals(300L, metrics.getMaxDurationMs());
        assertEquals(2.0 / 3.0, metrics.getSuccessRate(), 0.001);
    }
}
