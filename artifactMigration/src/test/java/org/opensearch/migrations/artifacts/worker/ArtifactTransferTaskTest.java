package org.opensearch.migrations.artifacts.worker;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import org.opensearch.migrations.artifacts.checkpoint.CheckpointStore;
import org.opensearch.migrations.artifacts.checkpoint.CheckpointStoreException;
import org.opensearch.migrations.artifacts.checkpoint.InMemoryCheckpointStore;
import org.opensearch.migrations.artifacts.checkpoint.TransferRecord;
import org.opensearch.migrations.artifacts.checkpoint.TransferState;
import org.opensearch.migrations.artifacts.errors.AuthorizationException;
import org.opensearch.migrations.artifacts.errors.TransientRemoteException;
import org.opensearch.migrations.artifacts.ratelimit.EndpointRateLimiter;
import org.opensearch.migrations.artifacts.retry.BackoffPolicy;
import org.opensearch.migrations.artifacts.retry.RetryClassifier;
import org.opensearch.migrations.artifacts.store.ArtifactDescriptor;
import org.opensearch.migrations.artifacts.store.InMemoryArtifactSource;
import org.opensearch.migrations.artifacts.store.InMemoryArtifactTarget;
import org.opensearch.migrations.artifacts.validation.ContentDigest;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArtifactTransferTaskTest {
    private static final String RUN = "run-1";
    private static final byte[] CONTENT = "the payload".getBytes(StandardCharsets.UTF_8);

    private InMemoryArtifactSource source;
    private InMemoryArtifactTarget target;
    private CheckpointStore store;
    private PoolCancellation cancellation;
    private List<Duration> sleeps;

    @BeforeEach
    void setUp() {
        source = new InMemoryArtifactSource().put("a", CONTENT);
        target = new InMemoryArtifactTarget();
        store = new InMemoryCheckpointStore();
        cancellation = new PoolCancellation();
        sleeps = new CopyOnWriteArrayList<>();
    }

    private ArtifactTransferTask task(int maxRetries) {
        return ArtifactTransferTask.builder()
            .runId(RUN)
            .source(source)
            .target(target)
            .store(store)
            .rateLimiter(EndpointRateLimiter.unlimited())
            .classifier(new RetryClassifier(
                new BackoffPolicy(Duration.ofMillis(10), 2.0, Duration.ofSeconds(1), () -> 0.0)))
            .cancellation(cancellation)
            .sleeper(sleeps::add)
            .maxRetries(maxRetries)
            .spoolThresholdBytes(4)
            .build();
    }

    private ArtifactDescriptor listed(String identity) throws Exception {
        return source.list().stream().filter(a -> a.getIdentity().equals(identity)).findFirst().orElseThrow();
    }

    private TransferRecord record(String identity) throws Exception {
        return store.getRecord(RUN, identity).orElseThrow();
    }

    private TransferRecord storedRecord(String identity) {
        try {
            return record(identity);
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    @Nested
    class Success {

        @Test
        void commitsAndRecordsTheVerifiedChecksum() throws Exception {
            var outcome = task(3).transfer(listed("a"), 0);

            assertEquals(TransferOutcome.Status.COMMITTED, outcome.getStatus());
            assertEquals(1, outcome.getAttempts());
            assertEquals(CONTENT.length, outcome.getBytes());
            assertArrayEquals(CONTENT, target.get("a"));
            var record = record("a");
            assertEquals(TransferState.COMMITTED, record.getState());
            assertEquals(ContentDigest.of(CONTENT), record.getChecksum());
            assertEquals(CONTENT.length, record.getSizeBytes());
            assertEquals(1, record.getAttemptCount());
        }

        @Test
        void transientReadFailuresAreRetriedWithGrowingDelays() throws Exception {
            source.failReads("a", 2, () -> new TransientRemoteException("read failed", 503, null));

            var outcome = task(3).transfer(listed("a"), 0);

            assertEquals(TransferOutcome.Status.COMMITTED, outcome.getStatus());
            assertEquals(3, outcome.getAttempts());
            assertEquals(3, record("a").getAttemptCount());
            assertEquals(List.of(Duration.ofMillis(10), Duration.ofMillis(20)), sleeps);
            assertEquals(1, target.writeCount("a"));
        }

        @Test
        void previouslyExhaustedArtifactIsClaimedAgainAndKeepsCounting() throws Exception {
            store.putRecord(RUN, TransferRecord.builder().identity("a").state(TransferState.IN_PROGRESS)
                .attemptCount(4).build(), null);
            store.putRecord(RUN, TransferRecord.builder().identity("a").state(TransferState.FAILED_RETRYABLE)
                .attemptCount(4).lastErrorClass("TransientRemoteException").build(), TransferState.IN_PROGRESS);

            var outcome = task(3).transfer(listed("a"), 0);

            assertEquals(TransferOutcome.Status.COMMITTED, outcome.getStatus());
            assertEquals(5, record("a").getAttemptCount());
            assertNull(record("a").getLastErrorClass());
        }

        @Test
        void failedCommitWriteIsRetriedWithoutResendingContent() throws Exception {
            store = new FlakyCommitStore(new InMemoryCheckpointStore(), 2);

            var outcome = task(3).transfer(listed("a"), 0);

            assertEquals(TransferOutcome.Status.COMMITTED, outcome.getStatus());
            assertEquals(TransferState.COMMITTED, record("a").getState());
            assertEquals(1, target.writeCount("a"));
            assertEquals(1, source.readCount("a"));
            assertEquals(2, sleeps.size());
        }
    }

    @Nested
    class Failure {

        @Test
        void exhaustedRetriesLeaveTheRecordRetryable() throws Exception {
            source.failReads("a", 10, () -> new TransientRemoteException("still down"));

            var outcome = task(2).transfer(listed("a"), 0);

            assertEquals(TransferOutcome.Status.FAILED_RETRYABLE, outcome.getStatus());
            assertEquals(3, outcome.getAttempts());
            assertEquals(TransferOutcome.Stage.SOURCE_READ, outcome.getFailedStage());
            var record = record("a");
            assertEquals(TransferState.FAILED_RETRYABLE, record.getState());
            assertEquals("TransientRemoteException", record.getLastErrorClass());
            assertEquals(3, record.getAttemptCount());
            assertEquals(0, target.totalWrites());
        }

        @Test
        void declaredChecksumMismatchIsFatalAndNeverWritten() throws Exception {
            source.put("bad", CONTENT, "sha256:" + "f".repeat(64));

            var outcome = task(3).transfer(listed("bad"), 0);

            assertEquals(TransferOutcome.Status.FAILED_FATAL, outcome.getStatus());
            assertEquals(1, outcome.getAttempts());
            assertEquals("IntegrityException", outcome.getErrorClass());
            assertThat(outcome.getErrorDetail(), containsString("PRE_TRANSFER"));
            assertEquals(TransferState.FAILED_FATAL, record("bad").getState());
            assertEquals(0, target.writeCount("bad"));
            assertTrue(sleeps.isEmpty());
        }

        @Test
        void targetConfirmationMismatchIsFatal() throws Exception {
            target.corruptConfirmationOf("a");

            var outcome = task(3).transfer(listed("a"), 0);

            assertEquals(TransferOutcome.Status.FAILED_FATAL, outcome.getStatus());
            assertThat(outcome.getErrorDetail(), containsString("POST_TRANSFER"));
            assertEquals(TransferOutcome.Stage.TARGET_WRITE, outcome.getFailedStage());
            assertEquals(TransferState.FAILED_FATAL, record("a").getState());
        }

        @Test
        void authorizationFailureIsSystemic() throws Exception {
            target.failAllWrites(() -> new AuthorizationException("token expired"));

            var outcome = task(3).transfer(listed("a"), 0);

            assertEquals(TransferOutcome.Status.FAILED_FATAL, outcome.getStatus());
            assertTrue(outcome.isSystemic());
            assertEquals(1, target.writeCount("a"));
        }

        @Test
        void artifactThatVanishedAfterListingIsFatal() throws Exception {
            var descriptor = listed("a");
            source.delete("a");

            var outcome = task(3).transfer(descriptor, 0);

            assertEquals(TransferOutcome.Status.FAILED_FATAL, outcome.getStatus());
            assertEquals("ArtifactNotFoundException", outcome.getErrorClass());
        }
    }

    @Nested
    class Ownership {

        @Test
        void finishedArtifactIsSkippedWithoutReading() throws Exception {
            task(3).transfer(listed("a"), 0);

            var second = task(3).transfer(listed("a"), 0);

            assertEquals(TransferOutcome.Status.SKIPPED, second.getStatus());
            assertEquals(1, source.readCount("a"));
        }

        @Test
        void onlyOneOfTwoConcurrentWorkersTransfersTheArtifact() throws Exception {
            var firstReadStarted = new CountDownLatch(1);
            var releaseFirstRead = new CountDownLatch(1);
            var reads = new AtomicInteger();
            source.onRead(identity -> {
                if (reads.incrementAndGet() == 1) {
                    firstReadStarted.countDown();
                    try {
                        releaseFirstRead.await(10, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
            });
            var executor = Executors.newSingleThreadExecutor();
            try {
                var first = executor.submit(() -> task(3).transfer(listed("a"), 0));
                assertTrue(firstReadStarted.await(10, TimeUnit.SECONDS));

                var second = task(3).transfer(listed("a"), 1);
                releaseFirstRead.countDown();

                assertEquals(TransferOutcome.Status.SKIPPED, second.getStatus());
                assertEquals(TransferOutcome.Status.COMMITTED, first.get(10, TimeUnit.SECONDS).getStatus());
                assertEquals(1, target.writeCount("a"));
                assertEquals(1, reads.get());
            } finally {
                executor.shutdownNow();
            }
        }
    }

    @Nested
    class Lease {

        @Test
        void claimIsLeasedToTheTransferringWorker() throws Exception {
            var task = task(3);
            var seenOnRead = new CopyOnWriteArrayList<TransferRecord>();
            source.onRead(identity -> seenOnRead.add(storedRecord(identity)));

            task.transfer(listed("a"), 0);

            assertEquals(task.getLeaseOwner(), seenOnRead.get(0).getLeaseOwner());
            assertNotNull(seenOnRead.get(0).getLeaseExpiresAt());
            assertNull(record("a").getLeaseExpiresAt());
        }

        @Test
        void everyRetryPersistsTheAttemptCount() throws Exception {
            var task = task(3);
            var seenOnRead = new CopyOnWriteArrayList<TransferRecord>();
            source.onRead(identity -> seenOnRead.add(storedRecord(identity)));
            source.failReads("a", 2, () -> new TransientRemoteException("read failed", 503, null));

            var outcome = task.transfer(listed("a"), 0);

            assertEquals(TransferOutcome.Status.COMMITTED, outcome.getStatus());
            assertEquals(List.of(1, 2, 3),
                seenOnRead.stream().map(TransferRecord::getAttemptCount).collect(Collectors.toList()));
            assertTrue(seenOnRead.stream().allMatch(r -> r.getState() == TransferState.IN_PROGRESS
                && task.getLeaseOwner().equals(r.getLeaseOwner())));
        }

        @Test
        void workerThatLostItsLeaseStopsBeforeWriting() throws Exception {
            source.onRead(identity -> {
                var held = storedRecord(identity);
                try {
                    store.putRecord(RUN, held.withState(TransferState.PENDING), TransferState.IN_PROGRESS);
                    store.putRecord(RUN, held.withLeaseOwner("other-worker"), TransferState.PENDING);
                } catch (CheckpointStoreException e) {
                    throw new IllegalStateException(e);
                }
            });

            var outcome = task(3).transfer(listed("a"), 0);

            assertEquals(TransferOutcome.Status.SKIPPED, outcome.getStatus());
            assertEquals(0, target.totalWrites());
            assertEquals(TransferState.IN_PROGRESS, record("a").getState());
            assertEquals("other-worker", record("a").getLeaseOwner());
        }
    }

    @Nested
    class Cancellation {

        @Test
        void cancelledBeforeDispatchLeavesNoRecord() throws Exception {
            cancellation.cancel();

            var outcome = task(3).transfer(listed("a"), 0);

            assertEquals(TransferOutcome.Status.ABANDONED, outcome.getStatus());
            assertTrue(store.getRecord(RUN, "a").isEmpty());
            assertEquals(0, source.readCount("a"));
        }

        @Test
        void cancelledMidTransferRollsBackToPending() throws Exception {
            source.onRead(identity -> cancellation.cancel());

            var outcome = task(3).transfer(listed("a"), 0);

            assertEquals(TransferOutcome.Status.ABANDONED, outcome.getStatus());
            assertEquals(TransferState.PENDING, record("a").getState());
            assertEquals(0, target.totalWrites());
        }

        @Test
        void haltedDispatchStillLetsTheClaimedArtifactFinish() throws Exception {
            var task = task(3);
            source.onRead(identity -> cancellation.haltDispatch("target unreachable"));

            var outcome = task.transfer(listed("a"), 0);

            assertEquals(TransferOutcome.Status.COMMITTED, outcome.getStatus());
            assertFalse(cancellation.isCancelled());
        }
    }

    /**
     * Fails the first {@code failures} writes of a COMMITTED record with a store error.
     */
    private static class FlakyCommitStore implements CheckpointStore {
        private final CheckpointStore delegate;
        private final AtomicInteger failuresLeft;

        FlakyCommitStore(CheckpointStore delegate, int failures) {
            this.delegate = delegate;
            this.failuresLeft = new AtomicInteger(failures);
        }

        @Override
        public Optional<TransferRecord> getRecord(String runId, String identity) throws CheckpointStoreException {
            return delegate.getRecord(runId, identity);
        }

        @Override
        public void putRecord(String runId, TransferRecord record, TransferState expectedPriorState)
            throws CheckpointStoreException {
            if (record.getState() == TransferState.COMMITTED && failuresLeft.getAndDecrement() > 0) {
                throw new CheckpointStoreException("putRecord", record.getIdentity(), "connection lost");
            }
            delegate.putRecord(runId, record, expectedPriorState);
        }

        @Override
        public Set<String> listByState(String runId, TransferState state) throws CheckpointStoreException {
            return delegate.listByState(runId, state);
        }

        @Override
        public List<TransferRecord> listRecords(String runId) throws CheckpointStoreException {
            return delegate.listRecords(runId);
        }
    }
}
