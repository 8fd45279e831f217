package com.example.votequorum.manager;

import com.example.votequorum.cache.CacheInvalidator;
import com.example.votequorum.cache.CacheKeys;
import com.example.votequorum.exception.InsufficientNodesException;
import com.example.votequorum.exception.RoundExhaustedException;
import com.example.votequorum.exception.StaleConfirmationException;
import com.example.votequorum.exception.UnknownRoundEntryException;
import com.example.votequorum.exception.VoteNotPendingException;
import com.example.votequorum.logging.PerformanceTracker;
import com.example.votequorum.logging.StructuredLogger;
import com.example.votequorum.model.ConfirmationOutcome;
import com.example.votequorum.model.ConsensusLogEntry;
import com.example.votequorum.model.ConsensusRound;
import com.example.votequorum.model.ElectionNode;
import com.example.votequorum.model.LogEntryStatus;
import com.example.votequorum.model.RoundState;
import com.example.votequorum.model.Vote;
import com.example.votequorum.model.VoteStatus;
import com.example.votequorum.state.NodeRegistry;
import com.example.votequorum.state.VoteLocks;
import com.example.votequorum.state.VoteRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Round manager keeping rounds and log entries in memory. Every mutation of a vote's rounds
 * runs under that vote's lock.
 */
public class ConsensusRoundManagerImpl implements ConsensusRoundManager {
    
    private static final Logger logger = LoggerFactory.getLogger(ConsensusRoundManagerImpl.class);
    
    private final VoteRecordStore voteStore;
    private final NodeRegistry nodeRegistry;
    private final VoteLocks voteLocks;
    private final CacheInvalidator cacheInvalidator;
    private final int maxRounds;
    private final Clock clock;
    private final StructuredLogger structuredLogger;
    private final PerformanceTracker performanceTracker;
    
    private final Map<String, VoteRounds> roundsByVote = new ConcurrentHashMap<>();
    
    public ConsensusRoundManagerImpl(VoteRecordStore voteStore, NodeRegistry nodeRegistry, VoteLocks voteLocks,
                                     CacheInvalidator cacheInvalidator, int maxRounds, String coordinatorId) {
        this(voteStore, nodeRegistry, voteLocks, cacheInvalidator, maxRounds, coordinatorId, Clock.systemUTC());
    }
    
    public ConsensusRoundManagerImpl(VoteRecordStore voteStore, NodeRegistry nodeRegistry, VoteLocks voteLocks,
                                     CacheInvalidator cacheInvalidator, int maxRounds, String coordinatorId,
                                     Clock clock) {
        this.voteStore = voteStore;
        this.nodeRegistry = nodeRegistry;
        this.voteLocks = voteLocks;
        this.cacheInvalidator = cacheInvalidator;
        this.maxRounds = maxRounds;
        this.clock = clock;
        this.structuredLogger = new StructuredLogger(ConsensusRoundManagerImpl.class, coordinatorId);
        this.performanceTracker = new PerformanceTracker(structuredLogger);
    }
    
    /**
     * Signature placeholder for a node's entry. Plain concatenation, not a cryptographic
     * signature; a deployment with untrusted nodes must have each node sign the fingerprint.
     */
    public static String signatureFor(String fingerprint, String nodeId) {
        return "sig_" + fingerprint + "_" + nodeId;
    }
    
    @Override
    public ConsensusRound openRound(String voteId) {
        return voteLocks.withLock(voteId, () -> {
            PerformanceTracker.OperationTimer timer = performanceTracker.startOperation(voteId, PerformanceTracker.OPEN_ROUND);
            boolean success = false;
            try {
                ConsensusRound round = doOpenRound(voteId);
                timer.setNodeCount(round.getParticipantNodeIds().size());
                success = true;
                return round;
            } finally {
                performanceTracker.recordOperation(timer, success, null);
            }
        });
    }
    
    private ConsensusRound doOpenRound(String voteId) {
        Vote vote = voteStore.require(voteId);
        if (vote.getStatus() != VoteStatus.PENDING) {
            throw new VoteNotPendingException(voteId, vote.getStatus());
        }
        if (vote.getCurrentRound() >= maxRounds) {
            throw new RoundExhaustedException(voteId, maxRounds);
        }
        
        List<ElectionNode> nodes = nodeRegistry.selectActiveNodes(vote.getElectionId(), vote.getRequiredConfirmations());
        if (nodes.isEmpty()) {
            logger.warn("No active nodes for vote {} in election {}", voteId, vote.getElectionId());
            throw new InsufficientNodesException(voteId, vote.getElectionId());
        }
        
        VoteRounds rounds = roundsByVote.computeIfAbsent(voteId, id -> new VoteRounds());
        Instant now = clock.instant();
        
        ConsensusRound previous = rounds.current();
        if (previous != null && previous.getState().isOpen()) {
            closeWithPendingTimedOut(rounds, previous, RoundState.SUPERSEDED, now);
            structuredLogger.logConsensusRound(StructuredLogger.RoundPhase.SUPERSEDED, voteId,
                previous.getRoundNumber(), previous.getParticipantNodeIds().size(),
                vote.getRequiredConfirmations(), null);
        }
        
        Vote advanced = voteStore.advanceRound(voteId);
        int roundNumber = advanced.getCurrentRound();
        
        Map<String, ConsensusLogEntry> entries = new LinkedHashMap<>();
        List<String> participants = new ArrayList<>(nodes.size());
        for (ElectionNode node : nodes) {
            participants.add(node.getNodeId());
            entries.put(node.getNodeId(), new ConsensusLogEntry(voteId, node.getNodeId(), roundNumber,
                LogEntryStatus.PENDING, signatureFor(advanced.getFingerprint(), node.getNodeId()), now));
        }
        ConsensusRound round = new ConsensusRound(voteId, roundNumber, participants, RoundState.OPEN, now, null);
        rounds.add(round, entries);
        
        if (participants.size() < advanced.getRequiredConfirmations()) {
            logger.warn("Round {} for vote {} has {} of {} required nodes; quorum cannot be reached",
                       roundNumber, voteId, participants.size(), advanced.getRequiredConfirmations());
        }
        structuredLogger.logConsensusRound(StructuredLogger.RoundPhase.OPENED, voteId, roundNumber,
            participants.size(), advanced.getRequiredConfirmations(),
            Map.of("electionId", advanced.getElectionId(), "nodes", participants));
        
        cacheInvalidator.invalidate(CacheKeys.voteStatus(voteId));
        return round;
    }
    
    @Override
    public ConsensusLogEntry recordConfirmation(String voteId, String nodeId, ConfirmationOutcome outcome) {
        if (outcome == null) {
            throw new IllegalArgumentException("outcome is required");
        }
        return voteLocks.withLock(voteId, () -> {
            PerformanceTracker.OperationTimer timer =
                performanceTracker.startOperation(voteId, PerformanceTracker.RECORD_CONFIRMATION);
            boolean success = false;
            try {
                ConsensusLogEntry entry = doRecordConfirmation(voteId, nodeId, outcome);
                timer.setNodeCount(1);
                success = true;
                return entry;
            } finally {
                performanceTracker.recordOperation(timer, success, Map.of("outcome", outcome.name()));
            }
        });
    }
    
    private ConsensusLogEntry doRecordConfirmation(String voteId, String nodeId, ConfirmationOutcome outcome) {
        Vote vote = voteStore.require(voteId);
        if (vote.getStatus() == VoteStatus.EXPIRED) {
            throw new StaleConfirmationException(voteId, "election has ended");
        }
        
        VoteRounds rounds = roundsByVote.get(voteId);
        ConsensusRound round = rounds != null ? rounds.current() : null;
        if (round == null) {
            throw new UnknownRoundEntryException(voteId, nodeId, vote.getCurrentRound());
        }
        if (round.getState() == RoundState.ABANDONED) {
            throw new StaleConfirmationException(voteId, "round " + round.getRoundNumber() + " was abandoned");
        }
        
        Map<String, ConsensusLogEntry> entries = rounds.entries(round.getRoundNumber());
        ConsensusLogEntry entry = entries.get(nodeId);
        if (entry == null) {
            throw new UnknownRoundEntryException(voteId, nodeId, round.getRoundNumber());
        }
        
        LogEntryStatus target = outcome.toEntryStatus();
        if (entry.getStatus() == target) {
            logger.debug("Repeated {} from node {} for vote {} round {} ignored",
                        outcome, nodeId, voteId, round.getRoundNumber());
            return entry;
        }
        if (entry.getStatus() != LogEntryStatus.PENDING || !round.getState().isOpen()) {
            throw new UnknownRoundEntryException(voteId, nodeId, round.getRoundNumber());
        }
        
        ConsensusLogEntry settled = entry.withStatus(target, clock.instant());
        entries.put(nodeId, settled);
        
        int confirmed = countConfirmed(entries);
        if (target == LogEntryStatus.CONFIRMED) {
            voteStore.updateConfirmationCount(voteId, confirmed);
        }
        
        structuredLogger.logConsensusRound(StructuredLogger.RoundPhase.CONFIRMATION_RECORDED, voteId,
            round.getRoundNumber(), entries.size(), vote.getRequiredConfirmations(),
            Map.of("nodeId", nodeId, "outcome", outcome.name(), "confirmed", confirmed));
        
        cacheInvalidator.invalidate(CacheKeys.voteStatus(voteId));
        return settled;
    }
    
    @Override
    public List<ConsensusLogEntry> timeoutRound(String voteId, int roundNumber) {
        return voteLocks.withLock(voteId, () -> {
            VoteRounds rounds = roundsByVote.get(voteId);
            ConsensusRound round = rounds != null ? rounds.current() : null;
            if (round == null || round.getRoundNumber() != roundNumber || !round.getState().isOpen()) {
                return List.<ConsensusLogEntry>of();
            }
            
            List<ConsensusLogEntry> timedOut = timeOutPending(rounds.entries(roundNumber), clock.instant());
            if (!timedOut.isEmpty()) {
                structuredLogger.logConsensusRound(StructuredLogger.RoundPhase.TIMED_OUT, voteId, roundNumber,
                    round.getParticipantNodeIds().size(), voteStore.require(voteId).getRequiredConfirmations(),
                    Map.of("timedOutNodes", timedOut.stream().map(ConsensusLogEntry::getNodeId)
                        .collect(Collectors.toList())));
                cacheInvalidator.invalidate(CacheKeys.voteStatus(voteId));
            }
            return timedOut;
        });
    }
    
    @Override
    public Optional<ConsensusRound> abandonRound(String voteId) {
        return voteLocks.withLock(voteId, () -> {
            VoteRounds rounds = roundsByVote.get(voteId);
            ConsensusRound round = rounds != null ? rounds.current() : null;
            if (round == null || !round.getState().isOpen()) {
                return Optional.<ConsensusRound>empty();
            }
            ConsensusRound abandoned = closeWithPendingTimedOut(rounds, round, RoundState.ABANDONED, clock.instant());
            structuredLogger.logConsensusRound(StructuredLogger.RoundPhase.ABANDONED, voteId,
                round.getRoundNumber(), round.getParticipantNodeIds().size(),
                voteStore.require(voteId).getRequiredConfirmations(), null);
            cacheInvalidator.invalidate(CacheKeys.voteStatus(voteId));
            return Optional.of(abandoned);
        });
    }
    
    @Override
    public boolean closeRound(String voteId, int roundNumber, RoundState finalState) {
        if (finalState == null || finalState.isOpen()) {
            throw new IllegalArgumentException("Final state must close the round: " + finalState);
        }
        return voteLocks.withLock(voteId, () -> {
            VoteRounds rounds = roundsByVote.get(voteId);
            ConsensusRound round = rounds != null ? rounds.current() : null;
            if (round == null || round.getRoundNumber() != roundNumber || !round.getState().isOpen()) {
                return false;
            }
            rounds.replaceCurrent(round.close(finalState, clock.instant()));
            structuredLogger.logStateTransition(RoundState.OPEN.name(), finalState.name(), "Round closed",
                Map.of("voteId", voteId, "round", roundNumber));
            return true;
        });
    }
    
    @Override
    public Optional<ConsensusRound> getCurrentRound(String voteId) {
        return voteLocks.withLock(voteId, () -> {
            VoteRounds rounds = roundsByVote.get(voteId);
            return Optional.ofNullable(rounds != null ? rounds.current() : null);
        });
    }
    
    @Override
    public List<ConsensusLogEntry> getCurrentRoundEntries(String voteId) {
        return voteLocks.withLock(voteId, () -> {
            VoteRounds rounds = roundsByVote.get(voteId);
            ConsensusRound round = rounds != null ? rounds.current() : null;
            if (round == null) {
                return List.<ConsensusLogEntry>of();
            }
            return List.copyOf(rounds.entries(round.getRoundNumber()).values());
        });
    }
    
    @Override
    public List<ConsensusLogEntry> getLogEntries(String voteId) {
        return voteLocks.withLock(voteId, () -> {
            VoteRounds rounds = roundsByVote.get(voteId);
            if (rounds == null) {
                return List.<ConsensusLogEntry>of();
            }
            List<ConsensusLogEntry> all = new ArrayList<>();
            for (ConsensusRound round : rounds.rounds) {
                all.addAll(rounds.entries(round.getRoundNumber()).values());
            }
            return all;
        });
    }
    
    @Override
    public List<ConsensusRound> getRounds(String voteId) {
        return voteLocks.withLock(voteId, () -> {
            VoteRounds rounds = roundsByVote.get(voteId);
            return rounds == null ? List.<ConsensusRound>of() : List.copyOf(rounds.rounds);
        });
    }
    
    private ConsensusRound closeWithPendingTimedOut(VoteRounds rounds, ConsensusRound round,
                                                    RoundState finalState, Instant at) {
        timeOutPending(rounds.entries(round.getRoundNumber()), at);
        ConsensusRound closed = round.close(finalState, at);
        rounds.replaceCurrent(closed);
        return closed;
    }
    
    private static List<ConsensusLogEntry> timeOutPending(Map<String, ConsensusLogEntry> entries, Instant at) {
        List<ConsensusLogEntry> timedOut = new ArrayList<>();
        for (Map.Entry<String, ConsensusLogEntry> e : entries.entrySet()) {
            if (e.getValue().getStatus() == LogEntryStatus.PENDING) {
                ConsensusLogEntry updated = e.getValue().withStatus(LogEntryStatus.TIMED_OUT, at);
                e.setValue(updated);
                timedOut.add(updated);
            }
        }
        return timedOut;
    }
    
    static int countConfirmed(Map<String, ConsensusLogEntry> entries) {
        return (int) entries.values().stream()
            .filter(e -> e.getStatus() == LogEntryStatus.CONFIRMED)
            .count();
    }
    
    /**
     * Rounds of one vote. Guarded by the vote's lock.
     */
    private static class VoteRounds {
        private final List<ConsensusRound> rounds = new ArrayList<>();
        private final Map<Integer, Map<String, ConsensusLogEntry>> entriesByRound = new LinkedHashMap<>();
        
        ConsensusRound current() {
            return rounds.isEmpty() ? null : rounds.get(rounds.size() - 1);
        }
        
        void add(ConsensusRound round, Map<String, ConsensusLogEntry> entries) {
            rounds.add(round);
            entriesByRound.put(round.getRoundNumber(), entries);
        }
        
        void replaceCurrent(ConsensusRound round) {
            rounds.set(rounds.size() - 1, round);
        }
        
        Map<String, ConsensusLogEntry> entries(int roundNumber) {
            return entriesByRound.getOrDefault(roundNumber, new LinkedHashMap<>());
        }
    }
}
