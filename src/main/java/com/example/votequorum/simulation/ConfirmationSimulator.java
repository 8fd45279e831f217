package com.example.votequorum.simulation;

import com.example.votequorum.model.ConfirmationOutcome;
import com.example.votequorum.model.ConsensusRound;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Stands in for real confirming nodes in local and demo setups: answers every participant of an
 * opened round after a random delay, rejecting with a configurable probability.
 */
public class ConfirmationSimulator {
    
    private static final Logger logger = LoggerFactory.getLogger(ConfirmationSimulator.class);
    
    private final long minDelayMs;
    private final long maxDelayMs;
    private final double rejectProbability;
    private final Random random;
    private final ScheduledExecutorService scheduler;
    private volatile ConfirmationListener listener;
    
    public ConfirmationSimulator(long minDelayMs, long maxDelayMs, double rejectProbability) {
        this(minDelayMs, maxDelayMs, rejectProbability, new Random());
    }
    
    public ConfirmationSimulator(long minDelayMs, long maxDelayMs, double rejectProbability, Random random) {
        if (minDelayMs < 0 || maxDelayMs < minDelayMs) {
            throw new IllegalArgumentException("Invalid delay range: " + minDelayMs + "-" + maxDelayMs);
        }
        if (rejectProbability < 0.0 || rejectProbability > 1.0) {
            throw new IllegalArgumentException("rejectProbability must be within [0, 1]");
        }
        this.minDelayMs = minDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.rejectProbability = rejectProbability;
        this.random = random;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "confirmation-simulator");
            t.setDaemon(true);
            return t;
        });
        
        logger.info("ConfirmationSimulator initialized, delay {}-{} ms, reject probability {}",
                   minDelayMs, maxDelayMs, rejectProbability);
    }
    
    public void setListener(ConfirmationListener listener) {
        this.listener = listener;
    }
    
    /**
     * Schedules one simulated answer per participant of the round.
     */
    public void simulate(ConsensusRound round) {
        ConfirmationListener target = listener;
        if (target == null) {
            logger.warn("No confirmation listener set, round {} of vote {} not simulated",
                       round.getRoundNumber(), round.getVoteId());
            return;
        }
        for (String nodeId : round.getParticipantNodeIds()) {
            long delayMs = nextDelayMs();
            ConfirmationOutcome outcome = nextOutcome();
            try {
                scheduler.schedule(() -> answer(target, round, nodeId, outcome), delayMs, TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                logger.warn("Simulator stopped, no answer from node {} for vote {}", nodeId, round.getVoteId());
            }
        }
    }
    
    private void answer(ConfirmationListener target, ConsensusRound round, String nodeId, ConfirmationOutcome outcome) {
        try {
            logger.debug("Simulated node {} answers {} for vote {} round {}",
                        nodeId, outcome, round.getVoteId(), round.getRoundNumber());
            target.onConfirmation(round.getVoteId(), nodeId, outcome);
        } catch (RuntimeException e) {
            logger.error("Simulated confirmation from node {} for vote {} failed", nodeId, round.getVoteId(), e);
        }
    }
    
    long nextDelayMs() {
        synchronized (random) {
            if (maxDelayMs == minDelayMs) {
                return minDelayMs;
            }
            return minDelayMs + (long) (random.nextDouble() * (maxDelayMs - minDelayMs + 1));
        }
    }
    
    ConfirmationOutcome nextOutcome() {
        synchronized (random) {
            return random.nextDouble() < rejectProbability ? ConfirmationOutcome.REJECTED : ConfirmationOutcome.CONFIRMED;
        }
    }
    
    public void stop() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("ConfirmationSimulator stopped");
    }
}
