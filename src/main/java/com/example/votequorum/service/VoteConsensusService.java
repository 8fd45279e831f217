package com.example.votequorum.service;

import com.example.votequorum.audit.AuditEventType;
import com.example.votequorum.audit.AuditTrail;
import com.example.votequorum.cache.CacheKeys;
import com.example.votequorum.cache.VoteStatusCache;
import com.example.votequorum.config.ConsensusConfig;
import com.example.votequorum.exception.ElectionNotActiveException;
import com.example.votequorum.exception.StaleConfirmationException;
import com.example.votequorum.exception.UnknownRoundEntryException;
import com.example.votequorum.logging.PerformanceTracker;
import com.example.votequorum.logging.StructuredLogger;
import com.example.votequorum.manager.ConsensusEvaluator;
import com.example.votequorum.manager.ConsensusEvaluatorImpl;
import com.example.votequorum.manager.ConsensusRoundManager;
import com.example.votequorum.manager.ConsensusRoundManagerImpl;
import com.example.votequorum.messaging.GuardedNotificationSink;
import com.example.votequorum.messaging.NotificationSink;
import com.example.votequorum.messaging.NotificationTopics;
import com.example.votequorum.model.CastVoteReceipt;
import com.example.votequorum.model.ConfirmationOutcome;
import com.example.votequorum.model.ConsensusOutcome;
import com.example.votequorum.model.ConsensusRound;
import com.example.votequorum.model.Election;
import com.example.votequorum.model.ElectionStats;
import com.example.votequorum.model.ElectionStatus;
import com.example.votequorum.model.NodeSummary;
import com.example.votequorum.model.NotificationEvent;
import com.example.votequorum.model.NotificationEventType;
import com.example.votequorum.model.OverallStats;
import com.example.votequorum.model.Vote;
import com.example.votequorum.model.VoteStatus;
import com.example.votequorum.model.VoteStatusView;
import com.example.votequorum.monitor.NodeLivenessMonitor;
import com.example.votequorum.simulation.ConfirmationSimulator;
import com.example.votequorum.state.ElectionRegistry;
import com.example.votequorum.state.ElectionRegistryImpl;
import com.example.votequorum.state.NodeRegistry;
import com.example.votequorum.state.NodeRegistryImpl;
import com.example.votequorum.state.VoteLocks;
import com.example.votequorum.state.VoteRecordStore;
import com.example.votequorum.state.VoteRecordStoreImpl;
import com.example.votequorum.task.ConsensusTask;
import com.example.votequorum.task.ConsensusTaskQueue;
import com.example.votequorum.task.RetryingTaskQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Entry point of the vote consensus core. Casting returns at once; round opening and
 * evaluation run on the task queue, and every outcome is pushed to the notification sink.
 */
public class VoteConsensusService {

    private static final Logger logger = LoggerFactory.getLogger(VoteConsensusService.class);

    static final String OPEN_ROUND_TASK = "open-round";
    static final String EVALUATE_TASK = "evaluate";
    static final String ROUND_TIMEOUT_TASK = "round-timeout";

    private final ConsensusConfig config;
    private final ElectionRegistry electionRegistry;
    private final NodeRegistry nodeRegistry;
    private final VoteRecordStore voteStore;
    private final ConsensusRoundManager roundManager;
    private final ConsensusEvaluator evaluator;
    private final VoteLocks voteLocks;
    private final ConsensusTaskQueue taskQueue;
    private final VoteStatusCache statusCache;
    private final AuditTrail auditTrail;
    private final NotificationSink notificationSink;
    private final NodeLivenessMonitor livenessMonitor;
    private final ConfirmationSimulator simulator;
    private final StructuredLogger structuredLogger;
    private final PerformanceTracker performanceTracker;
    private final ScheduledExecutorService timeoutScheduler;

    public VoteConsensusService(ConsensusConfig config, ElectionRegistry electionRegistry, NodeRegistry nodeRegistry,
                                VoteRecordStore voteStore, ConsensusRoundManager roundManager,
                                ConsensusEvaluator evaluator, VoteLocks voteLocks, ConsensusTaskQueue taskQueue,
                                VoteStatusCache statusCache, AuditTrail auditTrail,
                                NotificationSink notificationSink, NodeLivenessMonitor livenessMonitor,
                                ConfirmationSimulator simulator) {
        this.config = config;
        this.electionRegistry = electionRegistry;
        this.nodeRegistry = nodeRegistry;
        this.voteStore = voteStore;
        this.roundManager = roundManager;
        this.evaluator = evaluator;
        this.voteLocks = voteLocks;
        this.taskQueue = taskQueue;
        this.statusCache = statusCache;
        this.auditTrail = auditTrail;
        this.notificationSink = GuardedNotificationSink.guard(notificationSink, config.getCoordinatorId());
        this.livenessMonitor = livenessMonitor;
        this.simulator = simulator;
        this.structuredLogger = new StructuredLogger(VoteConsensusService.class, config.getCoordinatorId());
        this.performanceTracker = new PerformanceTracker(structuredLogger);
        this.timeoutScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "round-timeouts-" + config.getCoordinatorId());
            t.setDaemon(true);
            return t;
        });

        if (simulator != null) {
            simulator.setListener(this::recordConfirmation);
        }
    }

    /**
     * Wires the in-memory consensus core for the given configuration.
     */
    public static VoteConsensusService create(ConsensusConfig config, NotificationSink notificationSink) {
        String coordinatorId = config.getCoordinatorId();
        VoteLocks voteLocks = new VoteLocks();
        VoteStatusCache statusCache = new VoteStatusCache(config.getStatusCacheTtl());
        AuditTrail auditTrail = new AuditTrail();

        ElectionRegistry electionRegistry = new ElectionRegistryImpl(coordinatorId);
        NodeRegistry nodeRegistry = new NodeRegistryImpl(coordinatorId, config.getHeartbeatTimeout(),
            config.getUptimeWindowSize());
        VoteRecordStore voteStore = new VoteRecordStoreImpl(coordinatorId);
        ConsensusRoundManager roundManager = new ConsensusRoundManagerImpl(voteStore, nodeRegistry, voteLocks,
            statusCache, config.getMaxRounds(), coordinatorId);
        ConsensusEvaluator evaluator = new ConsensusEvaluatorImpl(voteStore, roundManager, voteLocks,
            notificationSink, statusCache, auditTrail, config.getMaxRounds(), coordinatorId);
        ConsensusTaskQueue taskQueue = new RetryingTaskQueue(coordinatorId, config.getWorkerThreads(),
            config.getTaskMaxAttempts(), config.getTaskBaseDelayMs(), notificationSink);
        NodeLivenessMonitor livenessMonitor = new NodeLivenessMonitor(nodeRegistry, notificationSink,
            sweepInterval(config.getHeartbeatTimeout()), coordinatorId);
        ConfirmationSimulator simulator = config.isSimulateConfirmations()
            ? new ConfirmationSimulator(config.getSimulationMinDelayMs(), config.getSimulationMaxDelayMs(),
                config.getSimulationRejectProbability())
            : null;

        return new VoteConsensusService(config, electionRegistry, nodeRegistry, voteStore, roundManager, evaluator,
            voteLocks, taskQueue, statusCache, auditTrail, notificationSink, livenessMonitor, simulator);
    }

    private static Duration sweepInterval(Duration heartbeatTimeout) {
        Duration half = heartbeatTimeout.dividedBy(2);
        return half.isZero() ? Duration.ofSeconds(1) : half;
    }

    public void start() {
        structuredLogger.logServiceLifecycle(StructuredLogger.ServiceLifecycleEvent.STARTING,
            Map.of("config", config.toString()));
        livenessMonitor.start();
        structuredLogger.logServiceLifecycle(StructuredLogger.ServiceLifecycleEvent.STARTED,
            Map.of("simulateConfirmations", simulator != null));
    }

    public void shutdown() {
        structuredLogger.logServiceLifecycle(StructuredLogger.ServiceLifecycleEvent.STOPPING,
            Map.of("deadLetters", taskQueue.getDeadLetters().size()));
        livenessMonitor.stop();
        if (simulator != null) {
            simulator.stop();
        }
        timeoutScheduler.shutdownNow();
        taskQueue.shutdown();
        structuredLogger.logServiceLifecycle(StructuredLogger.ServiceLifecycleEvent.STOPPED, null);
    }

    // Election lifecycle

    /**
     * Registers an election and creates its confirming nodes.
     *
     * @param replicationFactor Number of nodes, or null for the configured default
     */
    public Election setupElection(String electionId, String name, Integer replicationFactor) {
        int factor = replicationFactor != null ? replicationFactor : config.getReplicationFactor();
        Election election = electionRegistry.register(electionId, name, factor);
        nodeRegistry.registerNodes(electionId, factor);
        statusCache.invalidate(CacheKeys.ALL_ELECTION_STATS);
        logger.info("Election {} set up with {} nodes", electionId, factor);
        return election;
    }

    public Election startElection(String electionId) {
        Election election = electionRegistry.start(electionId);
        auditTrail.append(AuditEventType.ELECTION_STARTED, electionId, null,
            Map.of("replicationFactor", election.getReplicationFactor()));
        statusCache.invalidate(CacheKeys.ALL_ELECTION_STATS);
        broadcastElectionStatus(election, "Election " + election.getName() + " is now open", Map.of());
        return election;
    }

    /**
     * Ends an election. Pending votes expire, their open rounds are abandoned, and confirmations
     * arriving afterwards are rejected as stale.
     *
     * @return Final vote counts of the election
     */
    public ElectionStats endElection(String electionId) {
        Election election = electionRegistry.end(electionId);

        int expired = 0;
        for (Vote vote : voteStore.findByElection(electionId)) {
            if (expireVote(vote.getVoteId())) {
                expired++;
            }
        }

        statusCache.invalidate(CacheKeys.electionStats(electionId));
        statusCache.invalidate(CacheKeys.ALL_ELECTION_STATS);
        ElectionStats stats = ElectionStats.fromCounts(electionId, voteStore.countByStatus(electionId));
        auditTrail.append(AuditEventType.ELECTION_ENDED, electionId, null,
            Map.of("finalized", stats.getFinalized(), "expired", expired, "failed", stats.getFailed()));
        broadcastElectionStatus(election, "Election " + election.getName() + " has ended",
            Map.of("finalized", stats.getFinalized(), "expired", stats.getExpired(), "total", stats.getTotal()));
        return stats;
    }

    private boolean expireVote(String voteId) {
        return voteLocks.withLock(voteId, () -> {
            Vote vote = voteStore.require(voteId);
            if (vote.getStatus() != VoteStatus.PENDING) {
                return false;
            }
            roundManager.abandonRound(voteId);
            if (!voteStore.transitionToStatus(voteId, VoteStatus.EXPIRED)) {
                return false;
            }
            statusCache.invalidate(CacheKeys.voteStatus(voteId));
            auditTrail.append(AuditEventType.VOTE_EXPIRED, vote.getElectionId(), voteId,
                Map.of("round", vote.getCurrentRound(), "confirmations", vote.getConfirmationCount()));
            structuredLogger.logVoteLifecycle(StructuredLogger.VoteEvent.EXPIRED, voteId, vote.getElectionId(),
                Map.of("round", vote.getCurrentRound()));
            notificationSink.publish(NotificationTopics.vote(voteId), NotificationEvent.forVote(
                NotificationEventType.VOTE_EXPIRED, vote, vote.getCurrentRound(),
                "The election ended before your vote was verified"));
            return true;
        });
    }

    private void broadcastElectionStatus(Election election, String message, Map<String, Object> extra) {
        Map<String, Object> details = new HashMap<>(extra);
        details.put("status", election.getStatus().name());
        details.put("name", election.getName());
        NotificationEvent event = NotificationEvent.forElection(NotificationEventType.ELECTION_STATUS,
            election.getElectionId(), message, details);
        notificationSink.publish(NotificationTopics.election(election.getElectionId()), event);
        notificationSink.publish(NotificationTopics.ADMIN_DASHBOARD, event);
    }

    // Votes

    /**
     * Casts a vote and queues its first confirmation round. Returns before any node has answered.
     *
     * @throws ElectionNotActiveException if the election does not accept votes
     * @throws com.example.votequorum.exception.DuplicateVoteException if the voter already voted
     */
    public CastVoteReceipt castVote(String voterId, String candidateId, String electionId) {
        PerformanceTracker.OperationTimer timer = performanceTracker.startOperation(voterId, PerformanceTracker.CAST_VOTE);
        boolean success = false;
        try {
            electionRegistry.requireActive(electionId);
            Vote vote = voteStore.create(voterId, candidateId, electionId, config.getRequiredConfirmations());

            auditTrail.append(AuditEventType.VOTE_CAST, electionId, vote.getVoteId(),
                Map.of("fingerprint", vote.getFingerprint(), "candidateId", candidateId));
            statusCache.invalidate(CacheKeys.electionStats(electionId));

            taskQueue.submit(openRoundTask(vote.getVoteId(), 0));
            success = true;
            return new CastVoteReceipt(vote.getVoteId(), vote.getFingerprint(), VoteStatus.PENDING,
                CastVoteReceipt.PENDING_MESSAGE);
        } finally {
            performanceTracker.recordOperation(timer, success, Map.of("electionId", String.valueOf(electionId)));
        }
    }

    /**
     * Records a node's answer for a vote and queues an evaluation. Answers for a vote whose
     * election is no longer active are dropped and the vote expires.
     *
     * @return true if the answer was recorded, false if it was dropped as unknown or stale
     */
    public boolean recordConfirmation(String voteId, String nodeId, ConfirmationOutcome outcome) {
        try {
            voteLocks.withLock(voteId, () -> {
                Vote vote = voteStore.require(voteId);
                if (vote.getStatus() == VoteStatus.PENDING && !electionRegistry.isActive(vote.getElectionId())) {
                    expireVote(voteId);
                    throw new StaleConfirmationException(voteId, "election has ended");
                }
                roundManager.recordConfirmation(voteId, nodeId, outcome);
            });
        } catch (UnknownRoundEntryException | StaleConfirmationException e) {
            structuredLogger.logConsensusRound(StructuredLogger.RoundPhase.CONFIRMATION_DROPPED, voteId,
                voteStore.get(voteId).map(Vote::getCurrentRound).orElse(0), 0, 0,
                Map.of("nodeId", String.valueOf(nodeId),
                       "outcome", outcome.name(),
                       "reason", e.getClass().getSimpleName()));
            return false;
        }
        taskQueue.submit(evaluateTask(voteId));
        return true;
    }

    public NodeSummary recordHeartbeat(String nodeId, long responseTimeMs) {
        return NodeSummary.of(nodeRegistry.recordHeartbeat(nodeId, responseTimeMs));
    }

    // Background units

    /**
     * Opens the round following {@code afterRound}. Several evaluations may see the same failed
     * round; only the first task for it opens a new one.
     */
    ConsensusTask openRoundTask(String voteId, int afterRound) {
        return ConsensusTask.of(OPEN_ROUND_TASK, voteId, afterRound + 1, () -> openRound(voteId, afterRound))
            .onExhausted(error -> failVote(voteId, "Could not open a confirmation round: " + error.getMessage()));
    }

    private void openRound(String voteId, int afterRound) {
        ConsensusRound round = voteLocks.withLock(voteId, () -> {
            Vote vote = voteStore.require(voteId);
            if (vote.getStatus() != VoteStatus.PENDING || vote.getCurrentRound() != afterRound) {
                logger.debug("Vote {} is {} in round {}, round after {} not opened",
                            voteId, vote.getStatus(), vote.getCurrentRound(), afterRound);
                return null;
            }
            if (!electionRegistry.isActive(vote.getElectionId())) {
                // cast raced with endElection and was missed by its sweep
                expireVote(voteId);
                return null;
            }
            return roundManager.openRound(voteId);
        });
        if (round == null) {
            return;
        }
        scheduleRoundTimeout(voteId, round.getRoundNumber());
        if (simulator != null) {
            simulator.simulate(round);
        }
    }

    ConsensusTask evaluateTask(String voteId) {
        return ConsensusTask.of(EVALUATE_TASK, voteId, null, () -> evaluateAndAdvance(voteId));
    }

    private void evaluateAndAdvance(String voteId) {
        ConsensusOutcome outcome = evaluator.evaluate(voteId);
        if (outcome != ConsensusOutcome.FAILED) {
            return;
        }
        Vote vote = voteStore.require(voteId);
        if (vote.getStatus() == VoteStatus.PENDING) {
            logger.info("Round {} failed for vote {}, opening the next round", vote.getCurrentRound(), voteId);
            taskQueue.submit(openRoundTask(voteId, vote.getCurrentRound()));
        }
    }

    private void scheduleRoundTimeout(String voteId, int roundNumber) {
        Duration timeout = config.getRoundTimeout();
        try {
            timeoutScheduler.schedule(() -> taskQueue.submit(ConsensusTask.of(ROUND_TIMEOUT_TASK, voteId, roundNumber,
                () -> {
                    if (!roundManager.timeoutRound(voteId, roundNumber).isEmpty()) {
                        evaluateAndAdvance(voteId);
                    }
                })), timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            logger.warn("Service stopping, no timeout scheduled for vote {} round {}", voteId, roundNumber);
        }
    }

    private void failVote(String voteId, String reason) {
        voteLocks.withLock(voteId, () -> {
            if (!voteStore.transitionToStatus(voteId, VoteStatus.FAILED)) {
                return;
            }
            Vote vote = voteStore.require(voteId);
            statusCache.invalidate(CacheKeys.voteStatus(voteId));
            statusCache.invalidate(CacheKeys.electionStats(vote.getElectionId()));
            auditTrail.append(AuditEventType.VOTE_FAILED, vote.getElectionId(), voteId, Map.of("reason", reason));
            structuredLogger.logVoteLifecycle(StructuredLogger.VoteEvent.FAILED, voteId, vote.getElectionId(),
                Map.of("reason", reason));
            NotificationEvent event = NotificationEvent.forVote(NotificationEventType.VOTE_FAILED, vote,
                vote.getCurrentRound(), reason);
            notificationSink.publish(NotificationTopics.vote(voteId), event);
            notificationSink.publish(NotificationTopics.election(vote.getElectionId()), event);
        });
    }

    // Queries

    /**
     * Current status of a vote. Served from the cache; a miss is rebuilt under the vote's lock so
     * the cached view cannot be older than the last invalidation.
     *
     * @throws com.example.votequorum.exception.VoteNotFoundException if the vote does not exist
     */
    public VoteStatusView getVoteStatus(String voteId) {
        return statusCache.getVoteStatus(voteId).orElseGet(() ->
            voteLocks.withLock(voteId, () -> {
                VoteStatusView view = VoteStatusView.of(voteStore.require(voteId), roundManager.getLogEntries(voteId));
                statusCache.putVoteStatus(voteId, view);
                return view;
            }));
    }

    public List<NodeSummary> getElectionNodeStatuses(String electionId) {
        if (electionRegistry.get(electionId).isEmpty()) {
            throw new ElectionNotActiveException(electionId, "does not exist");
        }
        return nodeRegistry.getNodes(electionId).stream()
            .map(NodeSummary::of)
            .collect(Collectors.toList());
    }

    public ElectionStats getElectionStats(String electionId) {
        if (electionRegistry.get(electionId).isEmpty()) {
            throw new ElectionNotActiveException(electionId, "does not exist");
        }
        return statusCache.getElectionStats(electionId,
            () -> ElectionStats.fromCounts(electionId, voteStore.countByStatus(electionId)));
    }

    public OverallStats getOverallStats() {
        return statusCache.getOverallStats(() -> {
            long total = 0;
            long active = 0;
            long finalized = 0;
            for (ElectionStatus status : ElectionStatus.values()) {
                for (Election election : electionRegistry.findByStatus(status)) {
                    total++;
                    if (status == ElectionStatus.ACTIVE) {
                        active++;
                    }
                    finalized += voteStore.countByStatus(election.getElectionId())
                        .getOrDefault(VoteStatus.FINALIZED, 0L);
                }
            }
            return new OverallStats(total, active, finalized);
        });
    }

    public ConsensusTaskQueue getTaskQueue() {
        return taskQueue;
    }

    public AuditTrail getAuditTrail() {
        return auditTrail;
    }

    public ConsensusConfig getConfig() {
        return config;
    }
}
