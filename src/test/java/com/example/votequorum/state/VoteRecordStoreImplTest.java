package com.example.votequorum.state;

import com.example.votequorum.exception.DuplicateVoteException;
import com.example.votequorum.exception.VoteNotFoundException;
import com.example.votequorum.model.Vote;
import com.example.votequorum.model.VoteStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class VoteRecordStoreImplTest {

    private static final String ELECTION = "election-1";

    private VoteRecordStoreImpl store;

    @BeforeEach
    void setUp() {
        store = new VoteRecordStoreImpl("test-coordinator");
    }

    @Nested
    @DisplayName("Vote Creation")
    class VoteCreation {

        @Test
        @DisplayName("Should create a pending vote with no rounds and no confirmations")
        void shouldCreatePendingVote() {
            Vote vote = store.create("voter-1", "candidate-a", ELECTION, 3);

            assertNotNull(vote.getVoteId());
            assertEquals(VoteStatus.PENDING, vote.getStatus());
            assertEquals(3, vote.getRequiredConfirmations());
            assertEquals(0, vote.getConfirmationCount());
            assertEquals(0, vote.getCurrentRound());
            assertEquals(64, vote.getFingerprint().length());
            assertEquals(vote, store.require(vote.getVoteId()));
        }

        @Test
        @DisplayName("Should reject a second vote by the same voter in the same election")
        void shouldRejectDuplicateVote() {
            store.create("voter-1", "candidate-a", ELECTION, 3);

            DuplicateVoteException e = assertThrows(DuplicateVoteException.class,
                () -> store.create("voter-1", "candidate-b", ELECTION, 3));
            assertFalse(e.isRetryable());
            assertEquals(1, store.findByElection(ELECTION).size());
        }

        @Test
        @DisplayName("Should allow the same voter in a different election")
        void shouldAllowVoterInOtherElection() {
            store.create("voter-1", "candidate-a", ELECTION, 3);

            assertDoesNotThrow(() -> store.create("voter-1", "candidate-a", "election-2", 3));
        }

        @Test
        @DisplayName("Should accept exactly one of many concurrent casts by one voter")
        void shouldAcceptOneOfConcurrentCasts() throws InterruptedException {
            int threadCount = 16;
            ExecutorService executor = Executors.newFixedThreadPool(threadCount);
            CountDownLatch start = new CountDownLatch(1);
            CountDownLatch done = new CountDownLatch(threadCount);
            AtomicInteger created = new AtomicInteger(0);
            AtomicInteger duplicates = new AtomicInteger(0);

            for (int i = 0; i < threadCount; i++) {
                final String candidate = "candidate-" + i;
                executor.submit(() -> {
                    try {
                        start.await();
                        store.create("voter-1", candidate, ELECTION, 3);
                        created.incrementAndGet();
                    } catch (DuplicateVoteException e) {
                        duplicates.incrementAndGet();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        done.countDown();
                    }
                });
            }
            start.countDown();

            assertTrue(done.await(10, TimeUnit.SECONDS));
            executor.shutdown();
            assertEquals(1, created.get());
            assertEquals(threadCount - 1, duplicates.get());
            assertEquals(1, store.findByElection(ELECTION).size());
        }

        @Test
        @DisplayName("Should reject missing fields and a threshold below one")
        void shouldValidateArguments() {
            assertThrows(IllegalArgumentException.class, () -> store.create(null, "c", ELECTION, 3));
            assertThrows(IllegalArgumentException.class, () -> store.create("v", "c", ELECTION, 0));
        }
    }

    @Nested
    @DisplayName("Fingerprints")
    class Fingerprints {

        @Test
        @DisplayName("Should be deterministic for identical inputs")
        void shouldBeDeterministic() {
            String first = VoteRecordStore.computeFingerprint("v", "c", "e", "nonce-1");
            String second = VoteRecordStore.computeFingerprint("v", "c", "e", "nonce-1");

            assertEquals(first, second);
            assertNotEquals(first, VoteRecordStore.computeFingerprint("v", "c", "e", "nonce-2"));
        }

        @Test
        @DisplayName("Should find a vote by its fingerprint")
        void shouldFindByFingerprint() {
            Vote vote = store.create("voter-1", "candidate-a", ELECTION, 3);

            assertEquals(vote.getVoteId(), store.findByFingerprint(vote.getFingerprint()).orElseThrow().getVoteId());
            assertTrue(store.findByFingerprint("unknown").isEmpty());
        }
    }

    @Nested
    @DisplayName("Status Transitions")
    class StatusTransitions {

        @ParameterizedTest
        @EnumSource(value = VoteStatus.class, names = {"FINALIZED", "FAILED", "EXPIRED"})
        @DisplayName("Should allow a pending vote to reach any terminal status")
        void shouldAllowTerminalTransitions(VoteStatus target) {
            Vote vote = store.create("voter-1", "candidate-a", ELECTION, 3);

            assertTrue(store.transitionToStatus(vote.getVoteId(), target));
            assertEquals(target, store.require(vote.getVoteId()).getStatus());
        }

        @Test
        @DisplayName("Should never leave a terminal status")
        void shouldKeepTerminalStatus() {
            Vote vote = store.create("voter-1", "candidate-a", ELECTION, 3);
            store.transitionToStatus(vote.getVoteId(), VoteStatus.FINALIZED);

            assertFalse(store.transitionToStatus(vote.getVoteId(), VoteStatus.FAILED));
            assertFalse(store.transitionToStatus(vote.getVoteId(), VoteStatus.PENDING));
            assertFalse(store.transitionToStatus(vote.getVoteId(), VoteStatus.FINALIZED));
            assertEquals(VoteStatus.FINALIZED, store.require(vote.getVoteId()).getStatus());
        }

        @Test
        @DisplayName("Should throw for an unknown vote")
        void shouldThrowForUnknownVote() {
            assertThrows(VoteNotFoundException.class, () -> store.transitionToStatus("missing", VoteStatus.FAILED));
            assertThrows(VoteNotFoundException.class, () -> store.require("missing"));
        }
    }

    @Nested
    @DisplayName("Rounds and Counts")
    class RoundsAndCounts {

        @Test
        @DisplayName("Should increase the round and reset the confirmation count")
        void shouldAdvanceRound() {
            Vote vote = store.create("voter-1", "candidate-a", ELECTION, 3);
            store.advanceRound(vote.getVoteId());
            store.updateConfirmationCount(vote.getVoteId(), 2);

            Vote advanced = store.advanceRound(vote.getVoteId());

            assertEquals(2, advanced.getCurrentRound());
            assertEquals(0, advanced.getConfirmationCount());
        }

        @Test
        @DisplayName("Should refuse new rounds for a settled vote")
        void shouldRefuseRoundForSettledVote() {
            Vote vote = store.create("voter-1", "candidate-a", ELECTION, 3);
            store.transitionToStatus(vote.getVoteId(), VoteStatus.FAILED);

            assertThrows(IllegalStateException.class, () -> store.advanceRound(vote.getVoteId()));
        }

        @Test
        @DisplayName("Should count votes per status within an election")
        void shouldCountByStatus() {
            Vote first = store.create("voter-1", "candidate-a", ELECTION, 3);
            store.create("voter-2", "candidate-a", ELECTION, 3);
            store.create("voter-3", "candidate-b", ELECTION, 3);
            store.create("voter-4", "candidate-b", "election-2", 3);
            store.transitionToStatus(first.getVoteId(), VoteStatus.FINALIZED);

            Map<VoteStatus, Long> counts = store.countByStatus(ELECTION);

            assertEquals(1L, counts.get(VoteStatus.FINALIZED));
            assertEquals(2L, counts.get(VoteStatus.PENDING));
            assertNull(counts.get(VoteStatus.FAILED));
        }
    }
}
