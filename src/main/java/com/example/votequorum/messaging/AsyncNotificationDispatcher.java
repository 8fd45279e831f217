package com.example.votequorum.messaging;

import com.example.votequorum.logging.StructuredLogger;
import com.example.votequorum.model.NotificationEvent;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Hands events to a delegate sink on a background thread. Delivery failures are logged and
 * counted; they never reach the caller, so a broken transport cannot fail a consensus step.
 */
public class AsyncNotificationDispatcher implements NotificationSink {
    
    private static final int QUEUE_CAPACITY = 1000;
    
    private final NotificationSink delegate;
    private final StructuredLogger logger;
    private final ExecutorService executorService;
    private final AtomicInteger delivered = new AtomicInteger(0);
    private final AtomicInteger failed = new AtomicInteger(0);
    
    public AsyncNotificationDispatcher(NotificationSink delegate, String coordinatorId) {
        this(delegate, coordinatorId, createExecutor(coordinatorId));
    }
    
    AsyncNotificationDispatcher(NotificationSink delegate, String coordinatorId, ExecutorService executorService) {
        this.delegate = delegate;
        this.logger = new StructuredLogger(AsyncNotificationDispatcher.class, coordinatorId);
        this.executorService = executorService;
    }
    
    @Override
    public void publish(String topic, NotificationEvent event) {
        if (topic == null || event == null) {
            logger.logNotification(StructuredLogger.DeliveryResult.SKIPPED, topic,
                event != null ? event.getEventType().getWireName() : null,
                event != null ? event.getVoteId() : null,
                Map.of("reason", "missing topic or event"));
            return;
        }
        try {
            executorService.execute(() -> deliver(topic, event));
        } catch (RejectedExecutionException e) {
            failed.incrementAndGet();
            logger.logNotification(StructuredLogger.DeliveryResult.FAILED, topic,
                event.getEventType().getWireName(), event.getVoteId(),
                Map.of("reason", "dispatcher rejected event", "error", String.valueOf(e.getMessage())));
        }
    }
    
    private void deliver(String topic, NotificationEvent event) {
        try {
            delegate.publish(topic, event);
            delivered.incrementAndGet();
            logger.logNotification(StructuredLogger.DeliveryResult.DELIVERED, topic,
                event.getEventType().getWireName(), event.getVoteId(), null);
        } catch (RuntimeException e) {
            failed.incrementAndGet();
            Map<String, Object> context = new HashMap<>();
            context.put("errorType", e.getClass().getSimpleName());
            context.put("error", String.valueOf(e.getMessage()));
            if (event.getElectionId() != null) {
                context.put("electionId", event.getElectionId());
            }
            logger.logNotification(StructuredLogger.DeliveryResult.FAILED, topic,
                event.getEventType().getWireName(), event.getVoteId(), context);
        }
    }
    
    public int getDeliveredCount() {
        return delivered.get();
    }
    
    public int getFailedCount() {
        return failed.get();
    }
    
    /**
     * Stops accepting events and waits for queued deliveries to finish.
     */
    public void shutdown() {
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(10, TimeUnit.SECONDS)) {
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
    
    private static ExecutorService createExecutor(String coordinatorId) {
        return new ThreadPoolExecutor(
            1, 2,
            60L, TimeUnit.SECONDS,
            new LinkedBlockingQueue<>(QUEUE_CAPACITY),
            new ThreadFactory() {
                private final AtomicInteger threadNumber = new AtomicInteger(1);
                @Override
                public Thread newThread(Runnable r) {
                    Thread t = new Thread(r, "notify-" + coordinatorId + "-" + threadNumber.getAndIncrement());
                    t.setDaemon(true);
                    return t;
                }
            }
        );
    }
}
