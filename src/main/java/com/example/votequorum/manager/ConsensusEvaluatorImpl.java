package com.example.votequorum.manager;

import com.example.votequorum.audit.AuditEventType;
import com.example.votequorum.audit.AuditTrail;
import com.example.votequorum.cache.CacheInvalidator;
import com.example.votequorum.cache.CacheKeys;
import com.example.votequorum.logging.PerformanceTracker;
import com.example.votequorum.logging.StructuredLogger;
import com.example.votequorum.messaging.GuardedNotificationSink;
import com.example.votequorum.messaging.NotificationSink;
import com.example.votequorum.messaging.NotificationTopics;
import com.example.votequorum.model.ConsensusLogEntry;
import com.example.votequorum.model.ConsensusOutcome;
import com.example.votequorum.model.ConsensusRound;
import com.example.votequorum.model.LogEntryStatus;
import com.example.votequorum.model.NotificationEvent;
import com.example.votequorum.model.NotificationEventType;
import com.example.votequorum.model.RoundState;
import com.example.votequorum.model.Vote;
import com.example.votequorum.model.VoteStatus;
import com.example.votequorum.state.VoteLocks;
import com.example.votequorum.state.VoteRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public class ConsensusEvaluatorImpl implements ConsensusEvaluator {
    
    private static final Logger logger = LoggerFactory.getLogger(ConsensusEvaluatorImpl.class);
    
    private final VoteRecordStore voteStore;
    private final ConsensusRoundManager roundManager;
    private final VoteLocks voteLocks;
    private final NotificationSink notificationSink;
    private final CacheInvalidator cacheInvalidator;
    private final AuditTrail auditTrail;
    private final int maxRounds;
    private final StructuredLogger structuredLogger;
    private final PerformanceTracker performanceTracker;
    
    public ConsensusEvaluatorImpl(VoteRecordStore voteStore, ConsensusRoundManager roundManager, VoteLocks voteLocks,
                                  NotificationSink notificationSink, CacheInvalidator cacheInvalidator,
                                  AuditTrail auditTrail, int maxRounds, String coordinatorId) {
        this.voteStore = voteStore;
        this.roundManager = roundManager;
        this.voteLocks = voteLocks;
        this.notificationSink = GuardedNotificationSink.guard(notificationSink, coordinatorId);
        this.cacheInvalidator = cacheInvalidator;
        this.auditTrail = auditTrail;
        this.maxRounds = maxRounds;
        this.structuredLogger = new StructuredLogger(ConsensusEvaluatorImpl.class, coordinatorId);
        this.performanceTracker = new PerformanceTracker(structuredLogger);
    }
    
    @Override
    public ConsensusOutcome evaluate(String voteId) {
        return voteLocks.withLock(voteId, () -> {
            PerformanceTracker.OperationTimer timer = performanceTracker.startOperation(voteId, PerformanceTracker.EVALUATE);
            ConsensusOutcome outcome = null;
            try {
                outcome = doEvaluate(voteId);
                return outcome;
            } finally {
                performanceTracker.recordOperation(timer, outcome != null,
                    outcome != null ? Map.of("outcome", outcome.name()) : null);
            }
        });
    }
    
    private ConsensusOutcome doEvaluate(String voteId) {
        Vote vote = voteStore.require(voteId);
        switch (vote.getStatus()) {
            case FINALIZED:
                return ConsensusOutcome.FINALIZED;
            case FAILED:
            case EXPIRED:
                return ConsensusOutcome.FAILED;
            default:
                break;
        }
        
        Optional<ConsensusRound> current = roundManager.getCurrentRound(voteId);
        if (current.isEmpty()) {
            return ConsensusOutcome.STILL_PENDING;
        }
        ConsensusRound round = current.get();
        if (round.getState() == RoundState.FAILED) {
            // already evaluated; the next round has not been opened yet
            return ConsensusOutcome.FAILED;
        }
        if (!round.getState().isOpen()) {
            return ConsensusOutcome.STILL_PENDING;
        }
        
        List<ConsensusLogEntry> entries = roundManager.getCurrentRoundEntries(voteId);
        int confirmed = (int) entries.stream().filter(e -> e.getStatus() == LogEntryStatus.CONFIRMED).count();
        boolean allSettled = entries.stream().allMatch(e -> e.getStatus().isSettled());
        
        if (confirmed >= vote.getRequiredConfirmations()) {
            finalizeVote(vote, round, confirmed);
            return ConsensusOutcome.FINALIZED;
        }
        if (allSettled) {
            failRound(vote, round, entries, confirmed);
            return ConsensusOutcome.FAILED;
        }
        
        logger.debug("Vote {} round {} pending: {}/{} confirmed", voteId, round.getRoundNumber(),
                    confirmed, vote.getRequiredConfirmations());
        return ConsensusOutcome.STILL_PENDING;
    }
    
    private void finalizeVote(Vote vote, ConsensusRound round, int confirmed) {
        String voteId = vote.getVoteId();
        voteStore.updateConfirmationCount(voteId, confirmed);
        if (!voteStore.transitionToStatus(voteId, VoteStatus.FINALIZED)) {
            throw new IllegalStateException("Vote " + voteId + " could not be finalized");
        }
        roundManager.closeRound(voteId, round.getRoundNumber(), RoundState.COMPLETED);
        invalidate(vote);
        
        auditTrail.append(AuditEventType.VOTE_FINALIZED, vote.getElectionId(), voteId,
            Map.of("round", round.getRoundNumber(), "confirmations", confirmed,
                   "fingerprint", vote.getFingerprint()));
        structuredLogger.logConsensusRound(StructuredLogger.RoundPhase.COMPLETED, voteId, round.getRoundNumber(),
            round.getParticipantNodeIds().size(), vote.getRequiredConfirmations(), Map.of("confirmed", confirmed));
        structuredLogger.logVoteLifecycle(StructuredLogger.VoteEvent.FINALIZED, voteId, vote.getElectionId(),
            Map.of("round", round.getRoundNumber(), "confirmations", confirmed));
        
        NotificationEvent event = NotificationEvent.forVote(NotificationEventType.FINALIZED, vote,
            round.getRoundNumber(), "Vote verified by " + confirmed + " of " + vote.getRequiredConfirmations()
                + " required nodes");
        notificationSink.publish(NotificationTopics.vote(voteId), event);
        notificationSink.publish(NotificationTopics.election(vote.getElectionId()), event);
    }
    
    private void failRound(Vote vote, ConsensusRound round, List<ConsensusLogEntry> entries, int confirmed) {
        String voteId = vote.getVoteId();
        roundManager.closeRound(voteId, round.getRoundNumber(), RoundState.FAILED);
        
        long rejected = entries.stream().filter(e -> e.getStatus() == LogEntryStatus.REJECTED).count();
        long timedOut = entries.stream().filter(e -> e.getStatus() == LogEntryStatus.TIMED_OUT).count();
        structuredLogger.logConsensusRound(StructuredLogger.RoundPhase.FAILED, voteId, round.getRoundNumber(),
            entries.size(), vote.getRequiredConfirmations(),
            Map.of("confirmed", confirmed, "rejected", rejected, "timedOut", timedOut));
        NotificationEvent roundFailed = NotificationEvent.forVote(NotificationEventType.ROUND_FAILED, vote,
            round.getRoundNumber(), "Round " + round.getRoundNumber() + " reached " + confirmed + " of "
                + vote.getRequiredConfirmations() + " confirmations");
        notificationSink.publish(NotificationTopics.vote(voteId), roundFailed);
        notificationSink.publish(NotificationTopics.election(vote.getElectionId()), roundFailed);
        
        if (round.getRoundNumber() >= maxRounds) {
            voteStore.transitionToStatus(voteId, VoteStatus.FAILED);
            auditTrail.append(AuditEventType.VOTE_FAILED, vote.getElectionId(), voteId,
                Map.of("rounds", round.getRoundNumber(), "lastConfirmations", confirmed));
            structuredLogger.logVoteLifecycle(StructuredLogger.VoteEvent.FAILED, voteId, vote.getElectionId(),
                Map.of("rounds", round.getRoundNumber()));
            
            NotificationEvent failed = NotificationEvent.forVote(NotificationEventType.VOTE_FAILED, vote,
                round.getRoundNumber(), "Vote could not be verified after " + round.getRoundNumber() + " rounds");
            notificationSink.publish(NotificationTopics.vote(voteId), failed);
            notificationSink.publish(NotificationTopics.election(vote.getElectionId()), failed);
        }
        invalidate(vote);
    }
    
    private void invalidate(Vote vote) {
        cacheInvalidator.invalidate(CacheKeys.voteStatus(vote.getVoteId()));
        cacheInvalidator.invalidate(CacheKeys.electionStats(vote.getElectionId()));
        cacheInvalidator.invalidate(CacheKeys.ALL_ELECTION_STATS);
    }
}
