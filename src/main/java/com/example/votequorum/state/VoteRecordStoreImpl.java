package com.example.votequorum.state;

import com.example.votequorum.exception.DuplicateVoteException;
import com.example.votequorum.exception.VoteNotFoundException;
import com.example.votequorum.logging.StructuredLogger;
import com.example.votequorum.model.Vote;
import com.example.votequorum.model.VoteStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory vote store. The (voter, election) uniqueness rule is enforced with an atomic
 * insert-or-fail on a key index, so concurrent casts for the same voter cannot both succeed.
 */
public class VoteRecordStoreImpl implements VoteRecordStore {
    
    private static final Logger logger = LoggerFactory.getLogger(VoteRecordStoreImpl.class);
    
    private final StructuredLogger structuredLogger;
    private final Clock clock;
    
    private final Map<String, Vote> votes = new ConcurrentHashMap<>();
    private final Map<String, String> voteIdByVoterElection = new ConcurrentHashMap<>();
    private final Map<String, String> voteIdByFingerprint = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> voteIdsByElection = new ConcurrentHashMap<>();
    
    public VoteRecordStoreImpl(String coordinatorId) {
        this(coordinatorId, Clock.systemUTC());
    }
    
    public VoteRecordStoreImpl(String coordinatorId, Clock clock) {
        this.structuredLogger = new StructuredLogger(VoteRecordStoreImpl.class, coordinatorId);
        this.clock = clock;
    }
    
    @Override
    public Vote create(String voterId, String candidateId, String electionId, int requiredConfirmations) {
        if (voterId == null || candidateId == null || electionId == null) {
            throw new IllegalArgumentException("voterId, candidateId and electionId are required");
        }
        if (requiredConfirmations < 1) {
            throw new IllegalArgumentException("requiredConfirmations must be at least 1");
        }
        
        String voteId = UUID.randomUUID().toString();
        String existing = voteIdByVoterElection.putIfAbsent(uniquenessKey(voterId, electionId), voteId);
        if (existing != null) {
            logger.warn("Duplicate vote rejected for voter {} in election {}", voterId, electionId);
            structuredLogger.logVoteLifecycle(StructuredLogger.VoteEvent.DUPLICATE_REJECTED, existing, electionId,
                Map.of("voterId", voterId));
            throw new DuplicateVoteException(voterId, electionId);
        }
        
        Instant castAt = clock.instant();
        String nonce = UUID.randomUUID() + ":" + castAt.toEpochMilli();
        String fingerprint = VoteRecordStore.computeFingerprint(voterId, candidateId, electionId, nonce);
        
        Vote vote = new Vote(voteId, voterId, candidateId, electionId, VoteStatus.PENDING,
            requiredConfirmations, 0, fingerprint, 0, castAt);
        votes.put(voteId, vote);
        voteIdByFingerprint.put(fingerprint, voteId);
        voteIdsByElection.computeIfAbsent(electionId, id -> ConcurrentHashMap.newKeySet()).add(voteId);
        
        structuredLogger.logVoteLifecycle(StructuredLogger.VoteEvent.CAST, voteId, electionId,
            Map.of("requiredConfirmations", requiredConfirmations, "fingerprint", fingerprint));
        return vote;
    }
    
    @Override
    public Optional<Vote> get(String voteId) {
        return voteId == null ? Optional.empty() : Optional.ofNullable(votes.get(voteId));
    }
    
    @Override
    public Vote require(String voteId) {
        return get(voteId).orElseThrow(() -> new VoteNotFoundException(voteId));
    }
    
    @Override
    public Optional<Vote> findByVoterAndElection(String voterId, String electionId) {
        String voteId = voteIdByVoterElection.get(uniquenessKey(voterId, electionId));
        return get(voteId);
    }
    
    @Override
    public Optional<Vote> findByFingerprint(String fingerprint) {
        return fingerprint == null ? Optional.empty() : get(voteIdByFingerprint.get(fingerprint));
    }
    
    @Override
    public List<Vote> findByElection(String electionId) {
        List<Vote> result = new ArrayList<>();
        for (String voteId : voteIdsByElection.getOrDefault(electionId, Set.of())) {
            get(voteId).ifPresent(result::add);
        }
        return result;
    }
    
    @Override
    public Vote advanceRound(String voteId) {
        return update(voteId, vote -> {
            if (vote.getStatus() != VoteStatus.PENDING) {
                throw new IllegalStateException("Cannot open a round for " + vote.getStatus() + " vote " + voteId);
            }
            return vote.withRound(vote.getCurrentRound() + 1);
        });
    }
    
    @Override
    public Vote updateConfirmationCount(String voteId, int confirmationCount) {
        if (confirmationCount < 0) {
            throw new IllegalArgumentException("confirmationCount cannot be negative");
        }
        return update(voteId, vote -> vote.withConfirmationCount(confirmationCount));
    }
    
    @Override
    public boolean transitionToStatus(String voteId, VoteStatus targetStatus) {
        AtomicBoolean applied = new AtomicBoolean(false);
        AtomicReference<VoteStatus> previous = new AtomicReference<>();
        
        Vote updated = update(voteId, vote -> {
            previous.set(vote.getStatus());
            if (!isValidTransition(vote.getStatus(), targetStatus)) {
                return vote;
            }
            applied.set(true);
            return vote.withStatus(targetStatus);
        });
        
        if (!applied.get()) {
            logger.warn("Invalid vote transition from {} to {} for vote {}", previous.get(), targetStatus, voteId);
            return false;
        }
        
        structuredLogger.logStateTransition(previous.get().name(), targetStatus.name(), "Vote status transition",
            Map.of("voteId", voteId,
                   "electionId", updated.getElectionId(),
                   "confirmationCount", updated.getConfirmationCount(),
                   "requiredConfirmations", updated.getRequiredConfirmations(),
                   "round", updated.getCurrentRound()));
        return true;
    }
    
    @Override
    public Map<VoteStatus, Long> countByStatus(String electionId) {
        Map<VoteStatus, Long> counts = new EnumMap<>(VoteStatus.class);
        for (Vote vote : findByElection(electionId)) {
            counts.merge(vote.getStatus(), 1L, Long::sum);
        }
        return counts;
    }
    
    private Vote update(String voteId, java.util.function.UnaryOperator<Vote> change) {
        Vote updated = votes.computeIfPresent(voteId, (id, vote) -> change.apply(vote));
        if (updated == null) {
            throw new VoteNotFoundException(voteId);
        }
        return updated;
    }
    
    private static String uniquenessKey(String voterId, String electionId) {
        return voterId + "|" + electionId;
    }
}
