package com.example.votequorum.task;

import com.example.votequorum.exception.ConsensusException;
import com.example.votequorum.logging.StructuredLogger;
import com.example.votequorum.messaging.NotificationSink;
import com.example.votequorum.messaging.NotificationTopics;
import com.example.votequorum.model.NotificationEvent;
import com.example.votequorum.model.NotificationEventType;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker pool with exponential backoff. A task is retried while its failure is retryable and
 * attempts remain; otherwise it is dead-lettered, reported to the admin channel and handed to
 * its exhaustion handler.
 */
public class RetryingTaskQueue implements ConsensusTaskQueue {
    
    static final long MAX_BACKOFF_MS = 30_000;
    
    private final StructuredLogger logger;
    private final NotificationSink notificationSink;
    private final int maxAttempts;
    private final long baseDelayMs;
    
    private final ExecutorService workers;
    private final ScheduledExecutorService scheduler;
    private final List<DeadLetter> deadLetters = new CopyOnWriteArrayList<>();
    private final Object idleMonitor = new Object();
    private final AtomicInteger inFlight = new AtomicInteger(0);
    
    public RetryingTaskQueue(String coordinatorId, int workerThreads, int maxAttempts, long baseDelayMs,
                             NotificationSink notificationSink) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.logger = new StructuredLogger(RetryingTaskQueue.class, coordinatorId);
        this.notificationSink = notificationSink;
        this.maxAttempts = maxAttempts;
        this.baseDelayMs = baseDelayMs;
        
        this.workers = new ThreadPoolExecutor(
            workerThreads, workerThreads,
            60L, TimeUnit.SECONDS,
            new LinkedBlockingQueue<>(),
            namedThreads("consensus-worker-" + coordinatorId)
        );
        this.scheduler = new ScheduledThreadPoolExecutor(1, namedThreads("consensus-retry-" + coordinatorId));
    }
    
    @Override
    public void submit(ConsensusTask task) {
        inFlight.incrementAndGet();
        dispatch(task, 1);
    }
    
    private void dispatch(ConsensusTask task, int attempt) {
        try {
            workers.execute(() -> execute(task, attempt));
        } catch (RejectedExecutionException e) {
            deadLetter(task, e, attempt - 1);
        }
    }
    
    private void execute(ConsensusTask task, int attempt) {
        logger.setMDCContext(task.getVoteId(), task.getName());
        try {
            task.run();
            finished();
        } catch (RuntimeException e) {
            handleFailure(task, attempt, e);
        } finally {
            logger.clearMDCContext();
        }
    }
    
    private void handleFailure(ConsensusTask task, int attempt, RuntimeException error) {
        if (!isRetryable(error) || attempt >= maxAttempts) {
            deadLetter(task, error, attempt);
            return;
        }
        
        long delayMs = backoffDelayMs(attempt);
        logger.getLogger().warn("Task {} for vote {} failed (attempt {}/{}), retrying in {} ms: {}",
            task.getName(), task.getVoteId(), attempt, maxAttempts, delayMs, error.getMessage());
        try {
            scheduler.schedule(() -> dispatch(task, attempt + 1), delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            deadLetter(task, error, attempt);
        }
    }
    
    /**
     * Delay before the attempt following {@code attempt}: base * 2^(attempt-1), capped.
     */
    long backoffDelayMs(int attempt) {
        long delay = baseDelayMs * (1L << Math.min(attempt - 1, 20));
        return Math.min(delay, MAX_BACKOFF_MS);
    }
    
    static boolean isRetryable(Throwable error) {
        if (error instanceof ConsensusException) {
            return ((ConsensusException) error).isRetryable();
        }
        return true;
    }
    
    private void deadLetter(ConsensusTask task, Throwable error, int attempts) {
        try {
            deadLetters.add(new DeadLetter(task, error, attempts, Instant.now()));
            
            Map<String, Object> context = new HashMap<>();
            context.put("task", task.getName());
            if (task.getVoteId() != null) {
                context.put("voteId", task.getVoteId());
            }
            if (task.getRound() != null) {
                context.put("round", task.getRound());
            }
            logger.logError(task.getName(), "Task dead-lettered", error, attempts, maxAttempts, context);
            
            notifyAdmin(task, error, attempts);
            runExhaustedHandler(task, error);
        } finally {
            finished();
        }
    }
    
    private void notifyAdmin(ConsensusTask task, Throwable error, int attempts) {
        Map<String, Object> details = new HashMap<>();
        details.put("task", task.getName());
        details.put("attempts", attempts);
        details.put("errorType", error.getClass().getSimpleName());
        try {
            notificationSink.publish(NotificationTopics.ADMIN_DASHBOARD, new NotificationEvent(
                NotificationEventType.PROCESSING_ERROR, task.getVoteId(), null, task.getRound(),
                String.valueOf(error.getMessage()), Instant.now(), details));
        } catch (RuntimeException e) {
            logger.logError("notifyAdmin", "Failed to report dead-lettered task", e, 0, 0,
                Map.of("task", task.getName()));
        }
    }
    
    private void runExhaustedHandler(ConsensusTask task, Throwable error) {
        if (task.getExhaustedHandler() == null) {
            return;
        }
        try {
            task.getExhaustedHandler().accept(error);
        } catch (RuntimeException e) {
            logger.logError("onExhausted", "Exhaustion handler failed", e, 0, 0,
                Map.of("task", task.getName(), "voteId", String.valueOf(task.getVoteId())));
        }
    }
    
    private void finished() {
        if (inFlight.decrementAndGet() == 0) {
            synchronized (idleMonitor) {
                idleMonitor.notifyAll();
            }
        }
    }
    
    @Override
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (idleMonitor) {
            while (inFlight.get() > 0) {
                long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remainingMs <= 0) {
                    return false;
                }
                idleMonitor.wait(remainingMs);
            }
            return true;
        }
    }
    
    @Override
    public List<DeadLetter> getDeadLetters() {
        return List.copyOf(deadLetters);
    }
    
    public int getInFlightCount() {
        return inFlight.get();
    }
    
    @Override
    public void shutdown() {
        scheduler.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
    
    private static ThreadFactory namedThreads(String prefix) {
        return new ThreadFactory() {
            private final AtomicInteger threadNumber = new AtomicInteger(1);
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, prefix + "-" + threadNumber.getAndIncrement());
                t.setDaemon(true);
                return t;
            }
        };
    }
}
