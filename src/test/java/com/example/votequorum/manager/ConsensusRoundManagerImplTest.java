package com.example.votequorum.manager;

import com.example.votequorum.cache.CacheInvalidator;
import com.example.votequorum.cache.CacheKeys;
import com.example.votequorum.exception.InsufficientNodesException;
import com.example.votequorum.exception.RoundExhaustedException;
import com.example.votequorum.exception.StaleConfirmationException;
import com.example.votequorum.exception.UnknownRoundEntryException;
import com.example.votequorum.exception.VoteNotPendingException;
import com.example.votequorum.model.ConfirmationOutcome;
import com.example.votequorum.model.ConsensusLogEntry;
import com.example.votequorum.model.ConsensusRound;
import com.example.votequorum.model.LogEntryStatus;
import com.example.votequorum.model.RoundState;
import com.example.votequorum.model.Vote;
import com.example.votequorum.model.VoteStatus;
import com.example.votequorum.state.NodeRegistryImpl;
import com.example.votequorum.state.VoteLocks;
import com.example.votequorum.state.VoteRecordStoreImpl;
import com.example.votequorum.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ConsensusRoundManagerImplTest {

    private static final String ELECTION = "election-1";

    @Mock
    private CacheInvalidator cacheInvalidator;

    private MutableClock clock;
    private NodeRegistryImpl nodeRegistry;
    private VoteRecordStoreImpl voteStore;
    private ConsensusRoundManagerImpl roundManager;
    private Vote vote;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        nodeRegistry = new NodeRegistryImpl("test-coordinator", Duration.ofSeconds(30), 20, clock);
        voteStore = new VoteRecordStoreImpl("test-coordinator", clock);
        roundManager = new ConsensusRoundManagerImpl(voteStore, nodeRegistry, new VoteLocks(),
            cacheInvalidator, 3, "test-coordinator", clock);

        for (String id : List.of("node-a", "node-b", "node-c", "node-d", "node-e")) {
            nodeRegistry.registerNode(ELECTION, id, "10.0.0.1:8000");
        }
        vote = voteStore.create("voter-1", "candidate-1", ELECTION, 3);
    }

    private static List<String> nodeIds(List<ConsensusLogEntry> entries) {
        return entries.stream().map(ConsensusLogEntry::getNodeId).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("Opening rounds")
    class OpeningRounds {

        @Test
        @DisplayName("Should open round 1 with one pending entry per selected node")
        void shouldOpenFirstRound() {
            ConsensusRound round = roundManager.openRound(vote.getVoteId());

            assertEquals(1, round.getRoundNumber());
            assertEquals(RoundState.OPEN, round.getState());
            assertEquals(List.of("node-a", "node-b", "node-c"), round.getParticipantNodeIds());
            assertEquals(1, voteStore.require(vote.getVoteId()).getCurrentRound());

            List<ConsensusLogEntry> entries = roundManager.getCurrentRoundEntries(vote.getVoteId());
            assertEquals(List.of("node-a", "node-b", "node-c"), nodeIds(entries));
            assertTrue(entries.stream().allMatch(e -> e.getStatus() == LogEntryStatus.PENDING));
            assertEquals(ConsensusRoundManagerImpl.signatureFor(vote.getFingerprint(), "node-a"),
                entries.get(0).getSignature());
            verify(cacheInvalidator).invalidate(CacheKeys.voteStatus(vote.getVoteId()));
        }

        @Test
        @DisplayName("Should number rounds strictly increasing and supersede the open one")
        void shouldSupersedeOpenRound() {
            roundManager.openRound(vote.getVoteId());
            roundManager.recordConfirmation(vote.getVoteId(), "node-a", ConfirmationOutcome.CONFIRMED);

            ConsensusRound second = roundManager.openRound(vote.getVoteId());

            assertEquals(2, second.getRoundNumber());
            List<ConsensusRound> rounds = roundManager.getRounds(vote.getVoteId());
            assertEquals(RoundState.SUPERSEDED, rounds.get(0).getState());
            assertEquals(RoundState.OPEN, rounds.get(1).getState());

            List<ConsensusLogEntry> all = roundManager.getLogEntries(vote.getVoteId());
            assertEquals(6, all.size());
            assertEquals(LogEntryStatus.CONFIRMED, all.get(0).getStatus());
            assertEquals(LogEntryStatus.TIMED_OUT, all.get(1).getStatus());
            assertEquals(LogEntryStatus.TIMED_OUT, all.get(2).getStatus());
            assertEquals(0, voteStore.require(vote.getVoteId()).getConfirmationCount());
        }

        @Test
        @DisplayName("Should refuse to open beyond the round limit")
        void shouldRefuseBeyondMaxRounds() {
            roundManager.openRound(vote.getVoteId());
            roundManager.openRound(vote.getVoteId());
            roundManager.openRound(vote.getVoteId());

            assertThrows(RoundExhaustedException.class, () -> roundManager.openRound(vote.getVoteId()));
            assertEquals(3, voteStore.require(vote.getVoteId()).getCurrentRound());
        }

        @Test
        @DisplayName("Should fail without mutating anything when no node is active")
        void shouldFailWithoutActiveNodes() {
            Vote orphan = voteStore.create("voter-2", "candidate-1", "empty-election", 3);

            assertThrows(InsufficientNodesException.class, () -> roundManager.openRound(orphan.getVoteId()));
            assertEquals(0, voteStore.require(orphan.getVoteId()).getCurrentRound());
            assertTrue(roundManager.getRounds(orphan.getVoteId()).isEmpty());
        }

        @Test
        @DisplayName("Should open a short round when fewer nodes are active than required")
        void shouldOpenShortRound() {
            nodeRegistry.markInactive("node-a");
            nodeRegistry.markInactive("node-b");
            nodeRegistry.markInactive("node-c");

            ConsensusRound round = roundManager.openRound(vote.getVoteId());

            assertEquals(List.of("node-d", "node-e"), round.getParticipantNodeIds());
        }

        @Test
        @DisplayName("Should refuse a vote that is no longer pending")
        void shouldRefuseSettledVote() {
            voteStore.transitionToStatus(vote.getVoteId(), VoteStatus.FINALIZED);

            assertThrows(VoteNotPendingException.class, () -> roundManager.openRound(vote.getVoteId()));
        }
    }

    @Nested
    @DisplayName("Recording confirmations")
    class RecordingConfirmations {

        @BeforeEach
        void openRound() {
            roundManager.openRound(vote.getVoteId());
        }

        @Test
        @DisplayName("Should settle the entry and keep the vote count equal to confirmed entries")
        void shouldSettleEntry() {
            roundManager.recordConfirmation(vote.getVoteId(), "node-a", ConfirmationOutcome.CONFIRMED);
            roundManager.recordConfirmation(vote.getVoteId(), "node-b", ConfirmationOutcome.REJECTED);
            ConsensusLogEntry entry =
                roundManager.recordConfirmation(vote.getVoteId(), "node-c", ConfirmationOutcome.CONFIRMED);

            assertEquals(LogEntryStatus.CONFIRMED, entry.getStatus());
            assertEquals(2, voteStore.require(vote.getVoteId()).getConfirmationCount());
        }

        @Test
        @DisplayName("Should never count concurrent answers twice")
        void shouldNotDoubleCountConcurrentAnswers() throws InterruptedException {
            List<String> answering = List.of("node-a", "node-b", "node-c", "node-d", "node-e");
            int repeats = 8;
            int threadCount = answering.size() * repeats * 2;
            ExecutorService executor = Executors.newFixedThreadPool(16);
            CountDownLatch start = new CountDownLatch(1);
            CountDownLatch done = new CountDownLatch(threadCount);
            AtomicInteger recorded = new AtomicInteger(0);
            AtomicInteger refused = new AtomicInteger(0);

            for (int i = 0; i < repeats * 2; i++) {
                // node-a gets conflicting answers; only the first one to land may settle its entry
                final ConfirmationOutcome nodeAOutcome = i % 2 == 0
                    ? ConfirmationOutcome.CONFIRMED : ConfirmationOutcome.REJECTED;
                for (String nodeId : answering) {
                    final ConfirmationOutcome outcome = nodeId.equals("node-a")
                        ? nodeAOutcome : ConfirmationOutcome.CONFIRMED;
                    executor.submit(() -> {
                        try {
                            start.await();
                            roundManager.recordConfirmation(vote.getVoteId(), nodeId, outcome);
                            recorded.incrementAndGet();
                        } catch (UnknownRoundEntryException e) {
                            refused.incrementAndGet();
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        } finally {
                            done.countDown();
                        }
                    });
                }
            }
            start.countDown();

            assertTrue(done.await(10, TimeUnit.SECONDS));
            executor.shutdown();

            List<ConsensusLogEntry> entries = roundManager.getCurrentRoundEntries(vote.getVoteId());
            long confirmedEntries = entries.stream().filter(e -> e.getStatus() == LogEntryStatus.CONFIRMED).count();
            Vote current = voteStore.require(vote.getVoteId());
            assertEquals(threadCount, recorded.get() + refused.get());
            assertTrue(entries.stream().noneMatch(e -> e.getStatus() == LogEntryStatus.PENDING));
            assertEquals(confirmedEntries, current.getConfirmationCount());
            assertTrue(current.getConfirmationCount() <= current.getRequiredConfirmations());
            assertTrue(confirmedEntries >= 2);
        }

        @Test
        @DisplayName("Should treat an identical repeat as a no-op")
        void shouldIgnoreIdenticalRepeat() {
            roundManager.recordConfirmation(vote.getVoteId(), "node-a", ConfirmationOutcome.CONFIRMED);
            ConsensusLogEntry repeated =
                roundManager.recordConfirmation(vote.getVoteId(), "node-a", ConfirmationOutcome.CONFIRMED);

            assertEquals(LogEntryStatus.CONFIRMED, repeated.getStatus());
            assertEquals(1, voteStore.require(vote.getVoteId()).getConfirmationCount());
        }

        @Test
        @DisplayName("Should reject a conflicting answer for an already settled entry")
        void shouldRejectConflictingAnswer() {
            roundManager.recordConfirmation(vote.getVoteId(), "node-a", ConfirmationOutcome.CONFIRMED);

            assertThrows(UnknownRoundEntryException.class,
                () -> roundManager.recordConfirmation(vote.getVoteId(), "node-a", ConfirmationOutcome.REJECTED));
            assertEquals(1, voteStore.require(vote.getVoteId()).getConfirmationCount());
        }

        @Test
        @DisplayName("Should reject a node that is not part of the round")
        void shouldRejectNonParticipant() {
            UnknownRoundEntryException error = assertThrows(UnknownRoundEntryException.class,
                () -> roundManager.recordConfirmation(vote.getVoteId(), "node-e", ConfirmationOutcome.CONFIRMED));

            assertEquals("node-e", error.getNodeId());
            assertEquals(1, error.getRound());
        }

        @Test
        @DisplayName("Should reject confirmations for a superseded round")
        void shouldRejectSupersededRoundAnswer() {
            nodeRegistry.markInactive("node-a");
            ConsensusRound second = roundManager.openRound(vote.getVoteId());

            assertEquals(List.of("node-b", "node-c", "node-d"), second.getParticipantNodeIds());
            assertThrows(UnknownRoundEntryException.class,
                () -> roundManager.recordConfirmation(vote.getVoteId(), "node-a", ConfirmationOutcome.CONFIRMED));
        }

        @Test
        @DisplayName("Should reject a late answer once the round is abandoned")
        void shouldRejectAfterAbandon() {
            roundManager.abandonRound(vote.getVoteId());

            assertThrows(StaleConfirmationException.class,
                () -> roundManager.recordConfirmation(vote.getVoteId(), "node-a", ConfirmationOutcome.CONFIRMED));
        }

        @Test
        @DisplayName("Should reject answers for an expired vote")
        void shouldRejectExpiredVote() {
            voteStore.transitionToStatus(vote.getVoteId(), VoteStatus.EXPIRED);

            assertThrows(StaleConfirmationException.class,
                () -> roundManager.recordConfirmation(vote.getVoteId(), "node-a", ConfirmationOutcome.CONFIRMED));
        }

        @Test
        @DisplayName("Should reject answers when no round was ever opened")
        void shouldRejectWithoutRound() {
            Vote other = voteStore.create("voter-9", "candidate-1", ELECTION, 3);

            assertThrows(UnknownRoundEntryException.class,
                () -> roundManager.recordConfirmation(other.getVoteId(), "node-a", ConfirmationOutcome.CONFIRMED));
        }
    }

    @Nested
    @DisplayName("Timeouts and closing")
    class TimeoutsAndClosing {

        @Test
        @DisplayName("Should time out only pending entries of the matching open round")
        void shouldTimeOutPendingEntries() {
            roundManager.openRound(vote.getVoteId());
            roundManager.recordConfirmation(vote.getVoteId(), "node-a", ConfirmationOutcome.CONFIRMED);

            assertTrue(roundManager.timeoutRound(vote.getVoteId(), 2).isEmpty());
            List<ConsensusLogEntry> timedOut = roundManager.timeoutRound(vote.getVoteId(), 1);

            assertEquals(List.of("node-b", "node-c"), nodeIds(timedOut));
            assertTrue(roundManager.timeoutRound(vote.getVoteId(), 1).isEmpty());
            assertEquals(RoundState.OPEN, roundManager.getCurrentRound(vote.getVoteId()).orElseThrow().getState());
        }

        @Test
        @DisplayName("Should close a round once and refuse open states")
        void shouldCloseOnce() {
            roundManager.openRound(vote.getVoteId());

            assertThrows(IllegalArgumentException.class,
                () -> roundManager.closeRound(vote.getVoteId(), 1, RoundState.OPEN));
            assertTrue(roundManager.closeRound(vote.getVoteId(), 1, RoundState.FAILED));
            assertFalse(roundManager.closeRound(vote.getVoteId(), 1, RoundState.COMPLETED));
            assertEquals(RoundState.FAILED, roundManager.getCurrentRound(vote.getVoteId()).orElseThrow().getState());
        }

        @Test
        @DisplayName("Should abandon only an open round")
        void shouldAbandonOpenRound() {
            assertTrue(roundManager.abandonRound(vote.getVoteId()).isEmpty());

            roundManager.openRound(vote.getVoteId());
            ConsensusRound abandoned = roundManager.abandonRound(vote.getVoteId()).orElseThrow();

            assertEquals(RoundState.ABANDONED, abandoned.getState());
            assertTrue(roundManager.getCurrentRoundEntries(vote.getVoteId()).stream()
                .allMatch(e -> e.getStatus() == LogEntryStatus.TIMED_OUT));
        }
    }
}
