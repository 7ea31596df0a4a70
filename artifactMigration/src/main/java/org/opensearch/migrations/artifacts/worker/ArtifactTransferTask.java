package org.opensearch.migrations.artifacts.worker;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import org.opensearch.migrations.artifacts.checkpoint.CheckpointConflictException;
import org.opensearch.migrations.artifacts.checkpoint.CheckpointStore;
import org.opensearch.migrations.artifacts.checkpoint.CheckpointStoreException;
import org.opensearch.migrations.artifacts.checkpoint.TransferRecord;
import org.opensearch.migrations.artifacts.checkpoint.TransferState;
import org.opensearch.migrations.artifacts.errors.IntegrityException;
import org.opensearch.migrations.artifacts.ratelimit.Bucket;
import org.opensearch.migrations.artifacts.ratelimit.EndpointRateLimiter;
import org.opensearch.migrations.artifacts.retry.Classification;
import org.opensearch.migrations.artifacts.retry.RetryClassifier;
import org.opensearch.migrations.artifacts.store.ArtifactDescriptor;
import org.opensearch.migrations.artifacts.store.ArtifactSource;
import org.opensearch.migrations.artifacts.store.ArtifactTarget;
import org.opensearch.migrations.artifacts.tracing.MigrationObservability;
import org.opensearch.migrations.artifacts.validation.ArtifactValidator;
import org.opensearch.migrations.artifacts.validation.ContentSpool;
import org.opensearch.migrations.artifacts.validation.ValidationResult;

import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Moves a single artifact from source to target and drives its transfer record:
 * claim, read and validate, write and verify, then commit.
 *
 * <p>The claim is a conditional write made before any remote call, so two workers can never transfer the
 * same artifact at once.  The claim is a lease: it names this task's owner id and expires after the lease
 * duration.  The lease is renewed before every retry and before every target write, and each renewal
 * persists the attempt count.  A renewal that finds another owner ends the transfer without writing.
 * Retryable failures re-read from the source after the classifier's delay; the attempt count carried in
 * the record covers every attempt.  Once content is verified on the target only the checkpoint writes are
 * repeated on failure.
 *
 * <p>A pause is noticed between steps.  The record then goes back to {@link TransferState#PENDING} and the
 * outcome is {@link TransferOutcome.Status#ABANDONED}.
 */
@Slf4j
public class ArtifactTransferTask {

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private static final class StepBoundaryCancellation extends RuntimeException {
        StepBoundaryCancellation() {
            super("cancelled at step boundary", null, false, false);
        }
    }

    private static final class LeaseLostException extends RuntimeException {
        LeaseLostException(CheckpointConflictException cause) {
            super(cause.getMessage(), cause, false, false);
        }
    }

    private static final class AttemptProgress {
        TransferOutcome.Stage stage = TransferOutcome.Stage.SOURCE_READ;
    }

    /** The record as last written by this task. */
    private static final class Claim {
        TransferRecord record;

        Claim(TransferRecord record) {
            this.record = record;
        }
    }

    public static final Duration DEFAULT_LEASE_DURATION = Duration.ofMinutes(5);

    private static final class Verified {
        final String checksum;
        final long size;

        Verified(String checksum, long size) {
            this.checksum = checksum;
            this.size = size;
        }
    }

    private final String runId;
    private final ArtifactSource source;
    private final ArtifactTarget target;
    private final CheckpointStore store;
    private final EndpointRateLimiter rateLimiter;
    private final RetryClassifier classifier;
    private final PoolCancellation cancellation;
    private final ArtifactValidator validator;
    private final MigrationObservability observability;
    private final Sleeper sleeper;
    private final Clock clock;
    private final int maxRetries;
    private final long spoolThresholdBytes;
    private final String leaseOwner;
    private final Duration leaseDuration;

    @Builder
    private ArtifactTransferTask(@NonNull String runId,
                                 @NonNull ArtifactSource source,
                                 @NonNull ArtifactTarget target,
                                 @NonNull CheckpointStore store,
                                 @NonNull EndpointRateLimiter rateLimiter,
                                 @NonNull RetryClassifier classifier,
                                 @NonNull PoolCancellation cancellation,
                                 ArtifactValidator validator,
                                 MigrationObservability observability,
                                 Sleeper sleeper,
                                 Clock clock,
                                 int maxRetries,
                                 long spoolThresholdBytes,
                                 String leaseOwner,
                                 Duration leaseDuration) {
        this.runId = runId;
        this.source = source;
        this.target = target;
        this.store = store;
        this.rateLimiter = rateLimiter;
        this.classifier = classifier;
        this.cancellation = cancellation;
        this.validator = validator != null ? validator : new ArtifactValidator();
        this.observability = observability != null ? observability : MigrationObservability.NOOP;
        this.sleeper = sleeper != null ? sleeper : d -> TimeUnit.NANOSECONDS.sleep(d.toNanos());
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.maxRetries = maxRetries;
        this.spoolThresholdBytes = spoolThresholdBytes;
        this.leaseOwner = leaseOwner != null ? leaseOwner : "worker-" + UUID.randomUUID();
        this.leaseDuration = leaseDuration != null ? leaseDuration : DEFAULT_LEASE_DURATION;
    }

    public String getRunId() {
        return runId;
    }

    public PoolCancellation getCancellation() {
        return cancellation;
    }

    public String getLeaseOwner() {
        return leaseOwner;
    }

    public TransferOutcome transfer(ArtifactDescriptor artifact, int unitSequence) {
        var identity = artifact.getIdentity();
        var outcome = TransferOutcome.builder().identity(identity).unitSequence(unitSequence);
        if (cancellation.isCancelled() || cancellation.isDispatchHalted()) {
            return outcome.status(TransferOutcome.Status.ABANDONED).build();
        }

        Claim claim;
        try {
            var claimed = claim(identity);
            if (claimed.isEmpty()) {
                return outcome.status(TransferOutcome.Status.SKIPPED).build();
            }
            claim = new Claim(claimed.get());
        } catch (CheckpointConflictException e) {
            return skipAfterConflict(identity, outcome, e);
        } catch (CheckpointStoreException e) {
            log.atError().setCause(e).setMessage("Could not claim {}, leaving it for a later run")
                .addArgument(identity).log();
            return outcome.status(TransferOutcome.Status.FAILED_RETRYABLE)
                .failedStage(TransferOutcome.Stage.CLAIM)
                .errorClass(RetryClassifier.errorClassOf(e))
                .errorDetail(e.getMessage())
                .build();
        }

        int priorAttempts = claim.record.getAttemptCount() - 1;
        int attempt = 1;
        while (true) {
            int totalAttempts = priorAttempts + attempt;
            observability.onAttempt(identity, totalAttempts);
            var progress = new AttemptProgress();
            try {
                if (attempt > 1) {
                    progress.stage = TransferOutcome.Stage.CHECKPOINT;
                    renewLease(claim, totalAttempts);
                    progress.stage = TransferOutcome.Stage.SOURCE_READ;
                }
                var verified = attemptOnce(artifact, claim, totalAttempts, progress);
                return commit(claim.record, verified, totalAttempts, outcome);
            } catch (StepBoundaryCancellation e) {
                return abandon(claim.record, totalAttempts, outcome);
            } catch (LeaseLostException e) {
                log.atWarn().setMessage("Lease on {} passed to another worker, leaving it: {}")
                    .addArgument(identity).addArgument(e::getMessage).log();
                return outcome.status(TransferOutcome.Status.SKIPPED).attempts(totalAttempts)
                    .errorDetail(e.getMessage()).build();
            } catch (Exception e) {
                var classification = classifier.classify(e, attempt);
                if (classification instanceof Classification.Fatal) {
                    boolean systemic = ((Classification.Fatal) classification).isSystemic();
                    return fail(claim.record, TransferState.FAILED_FATAL, totalAttempts, e, progress.stage, systemic,
                        outcome);
                }
                if (attempt > maxRetries) {
                    return fail(claim.record, TransferState.FAILED_RETRYABLE, totalAttempts, e, progress.stage, false,
                        outcome);
                }
                var delay = ((Classification.Retryable) classification).getDelay();
                observability.onRetryScheduled(identity, totalAttempts, delay, e);
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return abandon(claim.record, totalAttempts, outcome);
                }
                attempt++;
            }
        }
    }

    /**
     * @return the claimed record, or empty when the existing record is finished or held by another worker
     */
    private Optional<TransferRecord> claim(String identity) throws CheckpointStoreException {
        var existing = store.getRecord(runId, identity);
        var prior = existing.map(TransferRecord::getState).orElse(null);
        if (prior != null && !prior.isClaimable()) {
            log.atDebug().setMessage("Not claiming {}, record is {}").addArgument(identity).addArgument(prior).log();
            return Optional.empty();
        }
        var base = existing.orElseGet(() -> TransferRecord.pending(identity));
        var now = clock.instant();
        var claimed = base.toBuilder()
            .state(TransferState.IN_PROGRESS)
            .attemptCount(base.getAttemptCount() + 1)
            .lastAttemptAt(now)
            .lastErrorClass(null)
            .lastErrorDetail(null)
            .leaseOwner(leaseOwner)
            .leaseExpiresAt(now.plus(leaseDuration))
            .build();
        store.putRecord(runId, claimed, prior);
        log.atDebug().setMessage("Claimed {} (was {})").addArgument(identity).addArgument(prior).log();
        return Optional.of(claimed);
    }

    private TransferOutcome skipAfterConflict(String identity,
                                              TransferOutcome.TransferOutcomeBuilder outcome,
                                              CheckpointConflictException conflict) {
        String holder;
        try {
            holder = store.getRecord(runId, identity).map(r -> r.getState().name()).orElse("<absent>");
        } catch (CheckpointStoreException e) {
            holder = "<unreadable: " + e.getMessage() + ">";
        }
        log.atDebug().setMessage("Lost the claim on {} to another worker, record is now {}")
            .addArgument(identity).addArgument(holder).log();
        return outcome.status(TransferOutcome.Status.SKIPPED).errorDetail(conflict.getMessage()).build();
    }

    /**
     * Rewrites the in-progress record with a fresh expiry and the current attempt count.
     *
     * @throws LeaseLostException if the record is no longer held by this task
     */
    private void renewLease(Claim claim, int attempts) throws CheckpointStoreException {
        var now = clock.instant();
        var renewed = claim.record.toBuilder()
            .attemptCount(attempts)
            .lastAttemptAt(now)
            .leaseExpiresAt(now.plus(leaseDuration))
            .build();
        try {
            store.putRecord(runId, renewed, TransferState.IN_PROGRESS);
        } catch (CheckpointConflictException e) {
            throw new LeaseLostException(e);
        }
        claim.record = renewed;
    }

    private Verified attemptOnce(ArtifactDescriptor artifact, Claim claim, int attempts, AttemptProgress progress)
        throws IOException {
        var identity = artifact.getIdentity();
        checkCancelled();
        rateLimiter.acquire(Bucket.SOURCE, 1);
        checkCancelled();
        try (var read = source.read(identity);
             var spool = ContentSpool.fill(read.getContent(), spoolThresholdBytes)) {
            requireOk(identity, validator.verifySpooled(spool, artifact.getChecksum(), artifact.getSizeBytes()));
            requireOk(identity, validator.verifySpooled(spool, read.getDeclaredChecksum(), read.getDeclaredSize()));

            checkCancelled();
            progress.stage = TransferOutcome.Stage.TARGET_WRITE;
            rateLimiter.acquire(Bucket.TARGET, 1);
            checkCancelled();
            progress.stage = TransferOutcome.Stage.CHECKPOINT;
            renewLease(claim, attempts);
            progress.stage = TransferOutcome.Stage.TARGET_WRITE;
            var metadata = new HashMap<>(artifact.getMetadata());
            metadata.putAll(read.getMetadata());
            try (var content = spool.openStream()) {
                var confirmation = target.write(identity, content, spool.getSize(), metadata);
                requireOk(identity, validator.verify(ValidationResult.Phase.POST_TRANSFER,
                    spool.getChecksum(), spool.getSize(), confirmation.getChecksum(), confirmation.getSizeBytes()));
            }
            return new Verified(spool.getChecksum(), spool.getSize());
        }
    }

    private void checkCancelled() {
        if (cancellation.isCancelled()) {
            throw new StepBoundaryCancellation();
        }
    }

    private static void requireOk(String identity, ValidationResult result) {
        if (!result.isOk()) {
            throw new IntegrityException(identity, (ValidationResult.Mismatch) result);
        }
    }

    private TransferOutcome commit(TransferRecord claimed,
                                   Verified verified,
                                   int attempts,
                                   TransferOutcome.TransferOutcomeBuilder outcome) {
        var validated = claimed.toBuilder()
            .state(TransferState.VALIDATED)
            .attemptCount(attempts)
            .checksum(verified.checksum)
            .sizeBytes(verified.size)
            .build();
        try {
            writeRecord(validated, TransferState.IN_PROGRESS);
            writeRecord(validated.withState(TransferState.COMMITTED).withLeaseExpiresAt(null), TransferState.VALIDATED);
        } catch (CheckpointConflictException e) {
            log.atWarn().setMessage("Record for {} was taken over after the content was verified: {}")
                .addArgument(claimed::getIdentity).addArgument(e::getMessage).log();
            return outcome.status(TransferOutcome.Status.SKIPPED).attempts(attempts).errorDetail(e.getMessage()).build();
        } catch (CheckpointStoreException e) {
            log.atError().setCause(e)
                .setMessage("Content of {} is verified on the target but its checkpoint could not be written")
                .addArgument(claimed::getIdentity).log();
            return outcome.status(TransferOutcome.Status.FAILED_RETRYABLE)
                .attempts(attempts)
                .failedStage(TransferOutcome.Stage.CHECKPOINT)
                .errorClass(RetryClassifier.errorClassOf(e))
                .errorDetail(e.getMessage())
                .build();
        }
        observability.onCommitted(claimed.getIdentity(), verified.size);
        return outcome.status(TransferOutcome.Status.COMMITTED).attempts(attempts).bytes(verified.size).build();
    }

    /**
     * Conditional write that repeats on store errors.  A conflict whose stored state already equals the
     * intended one means an earlier try landed without being acknowledged.
     */
    private void writeRecord(TransferRecord record, TransferState expected) throws CheckpointStoreException {
        int attempt = 1;
        while (true) {
            try {
                store.putRecord(runId, record, expected);
                return;
            } catch (CheckpointConflictException e) {
                var current = store.getRecord(runId, record.getIdentity());
                if (attempt > 1 && current.isPresent() && current.get().getState() == record.getState()
                    && Objects.equals(current.get().getLeaseOwner(), record.getLeaseOwner())) {
                    return;
                }
                throw e;
            } catch (CheckpointStoreException e) {
                if (attempt > maxRetries) {
                    throw e;
                }
                var delay = classifier.getBackoffPolicy().delayFor(attempt);
                log.atWarn().setMessage("Checkpoint write of {} for {} failed, retrying in {}ms: {}")
                    .addArgument(record::getState)
                    .addArgument(record::getIdentity)
                    .addArgument(delay::toMillis)
                    .addArgument(e::getMessage)
                    .log();
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
                attempt++;
            }
        }
    }

    private TransferOutcome abandon(TransferRecord claimed, int attempts, TransferOutcome.TransferOutcomeBuilder outcome) {
        try {
            store.putRecord(runId, claimed.toBuilder()
                    .state(TransferState.PENDING)
                    .attemptCount(attempts)
                    .leaseExpiresAt(null)
                    .build(),
                TransferState.IN_PROGRESS);
            log.atDebug().setMessage("Rolled {} back to PENDING").addArgument(claimed::getIdentity).log();
        } catch (CheckpointStoreException e) {
            log.atWarn().setCause(e)
                .setMessage("Could not roll {} back to PENDING; it will be re-queued when the run restarts")
                .addArgument(claimed::getIdentity).log();
        }
        return outcome.status(TransferOutcome.Status.ABANDONED).attempts(attempts).build();
    }

    private TransferOutcome fail(TransferRecord claimed,
                                 TransferState state,
                                 int attempts,
                                 Exception error,
                                 TransferOutcome.Stage stage,
                                 boolean systemic,
                                 TransferOutcome.TransferOutcomeBuilder outcome) {
        var cause = RetryClassifier.unwrap(error);
        var errorClass = cause.getClass().getSimpleName();
        var detail = cause.getMessage();
        try {
            writeRecord(claimed.toBuilder()
                .state(state)
                .attemptCount(attempts)
                .lastAttemptAt(clock.instant())
                .lastErrorClass(errorClass)
                .lastErrorDetail(detail)
                .leaseExpiresAt(null)
                .build(), TransferState.IN_PROGRESS);
        } catch (CheckpointStoreException e) {
            log.atError().setCause(e).setMessage("Could not record {} for {}")
                .addArgument(state).addArgument(claimed::getIdentity).log();
        }
        observability.onFailed(claimed.getIdentity(), errorClass, state == TransferState.FAILED_FATAL, detail);
        return outcome
            .status(state == TransferState.FAILED_FATAL
                ? TransferOutcome.Status.FAILED_FATAL
                : TransferOutcome.Status.FAILED_RETRYABLE)
            .attempts(attempts)
            .failedStage(stage)
            .errorClass(errorClass)
            .errorDetail(detail)
            .systemic(systemic)
            .build();
    }
}
