package org.opensearch.migrations.artifacts.controller;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import org.opensearch.migrations.artifacts.config.MigrationConfig;
import org.opensearch.migrations.artifacts.store.ArtifactDescriptor;
import org.opensearch.migrations.artifacts.worker.PoolCancellation;
import org.opensearch.migrations.artifacts.worker.TransferOutcome;

import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

/**
 * Mutable bookkeeping of one run inside the controller.  State changes are synchronized on the context;
 * outcomes may be recorded from any worker thread.
 */
@Slf4j
class RunContext {
    @Getter
    private final String runId;
    @Getter
    private final MigrationConfig config;
    @Getter
    private final Instant startedAt;
    private final Map<String, TransferOutcome> latestOutcomes = new ConcurrentHashMap<>();
    private final AtomicLong dispatched = new AtomicLong();

    private RunState state = RunState.CREATED;
    @Getter
    @Setter
    private List<ArtifactDescriptor> snapshot = List.of();
    @Getter
    @Setter
    private StrategyParameters strategy;
    @Getter
    @Setter
    private PoolCancellation cancellation;
    @Getter
    @Setter
    private CompletableFuture<RunReport> completion;
    @Setter
    private String failureReason;

    RunContext(String runId, MigrationConfig config, Instant startedAt) {
        this.runId = runId;
        this.config = config;
        this.startedAt = startedAt;
    }

    synchronized RunState getState() {
        return state;
    }

    synchronized void transition(RunState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Run " + runId + " cannot move from " + state + " to " + next);
        }
        log.atInfo().setMessage("Run {} {} -> {}").addArgument(runId).addArgument(state).addArgument(next).log();
        state = next;
    }

    void addDispatched(long count) {
        dispatched.addAndGet(count);
    }

    /**
     * Keeps the latest outcome per artifact.  A commit is never replaced, since nothing can follow it.
     */
    void record(TransferOutcome outcome) {
        latestOutcomes.merge(outcome.getIdentity(), outcome,
            (previous, next) -> previous.getStatus() == TransferOutcome.Status.COMMITTED ? previous : next);
    }

    /** Records an outcome only for artifacts not seen before in this run. */
    void recordIfAbsent(TransferOutcome outcome) {
        latestOutcomes.putIfAbsent(outcome.getIdentity(), outcome);
    }

    /** Drops outcomes that are about to be superseded by a new attempt. */
    void forgetUnfinished(String identity) {
        latestOutcomes.computeIfPresent(identity, (id, outcome) ->
            outcome.getStatus() == TransferOutcome.Status.ABANDONED
                || outcome.getStatus() == TransferOutcome.Status.FAILED_RETRYABLE ? null : outcome);
    }

    boolean hasAbandoned() {
        return latestOutcomes.values().stream().anyMatch(o -> o.getStatus() == TransferOutcome.Status.ABANDONED);
    }

    synchronized RunStatus status() {
        long committed = 0;
        long failedRetryable = 0;
        long failedFatal = 0;
        long skipped = 0;
        long abandoned = 0;
        long bytes = 0;
        var failures = new ArrayList<FailureDetail>();
        for (var outcome : latestOutcomes.values()) {
            switch (outcome.getStatus()) {
                case COMMITTED:
                    committed++;
                    bytes += outcome.getBytes();
                    break;
                case FAILED_RETRYABLE:
                    failedRetryable++;
                    failures.add(toFailureDetail(outcome));
                    break;
                case FAILED_FATAL:
                    failedFatal++;
                    failures.add(toFailureDetail(outcome));
                    break;
                case SKIPPED:
                    skipped++;
                    break;
                case ABANDONED:
                    abandoned++;
                    break;
                default:
                    throw new IllegalStateException("Unknown outcome status " + outcome.getStatus());
            }
        }
        failures.sort(Comparator.comparing(FailureDetail::getIdentity));
        return RunStatus.builder()
            .runId(runId)
            .state(state)
            .strategy(strategy == null ? null : strategy.name())
            .startedAt(startedAt)
            .totalArtifacts(snapshot.size())
            .dispatched(dispatched.get())
            .committed(committed)
            .failedRetryable(failedRetryable)
            .failedFatal(failedFatal)
            .skippedAlreadyDone(skipped)
            .abandoned(abandoned)
            .bytesCommitted(bytes)
            .failures(List.copyOf(failures))
            .pauseRequested(state == RunState.RUNNING && cancellation != null && cancellation.isCancelled())
            .failureReason(failureReason)
            .build();
    }

    private static FailureDetail toFailureDetail(TransferOutcome outcome) {
        return new FailureDetail(outcome.getIdentity(), outcome.getStatus().name(), outcome.getErrorClass(),
            outcome.getErrorDetail(), outcome.getAttempts());
    }
}
