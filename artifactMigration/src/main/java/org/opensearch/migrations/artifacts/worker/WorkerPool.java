package org.opensearch.migrations.artifacts.worker;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.opensearch.migrations.artifacts.partition.WorkUnit;
import org.opensearch.migrations.artifacts.store.ArtifactDescriptor;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * Runs work units with a fixed number of slots.  Each slot takes one unit at a time and transfers its
 * artifacts in order, so artifacts of one unit never run concurrently with each other.  Outcomes are
 * emitted as they are produced.
 *
 * <p>The pool also watches for systemic failure: an outcome flagged systemic, or a streak of
 * {@code systemicFailureThreshold} consecutive target-side failures that exhausted their retries, halts
 * dispatch for every pool sharing the {@link PoolCancellation}.
 */
@Slf4j
public class WorkerPool {
    public static final String RUN_ID_MDC_KEY = "runId";
    public static final String WORKER_ID_MDC_KEY = "workerId";

    private final String poolId;
    private final ArtifactTransferTask task;
    private final Scheduler scheduler;
    private final int systemicFailureThreshold;
    private final AtomicInteger consecutiveTargetFailures = new AtomicInteger();

    public WorkerPool(String poolId, ArtifactTransferTask task, Scheduler scheduler, int systemicFailureThreshold) {
        this.poolId = poolId;
        this.task = task;
        this.scheduler = scheduler;
        this.systemicFailureThreshold = systemicFailureThreshold;
    }

    public Flux<TransferOutcome> run(List<WorkUnit> workUnits, int concurrencyLimit) {
        return run(Flux.fromIterable(workUnits), concurrencyLimit);
    }

    public Flux<TransferOutcome> run(Flux<WorkUnit> workUnits, int concurrencyLimit) {
        if (concurrencyLimit < 1) {
            throw new IllegalArgumentException("concurrencyLimit must be >= 1, got " + concurrencyLimit);
        }
        return workUnits
            .flatMap(unit -> processUnit(unit).subscribeOn(scheduler), concurrencyLimit)
            .doOnNext(this::watchForSystemicFailure)
            .doOnSubscribe(s -> log.atInfo().setMessage("Pool {} started with {} slots")
                .addArgument(poolId).addArgument(concurrencyLimit).log())
            .doOnComplete(() -> log.atInfo().setMessage("Pool {} drained").addArgument(poolId).log());
    }

    private Flux<TransferOutcome> processUnit(WorkUnit unit) {
        return Flux.fromIterable(unit.getArtifacts())
            .concatMap(artifact -> Mono.fromCallable(() -> dispatch(artifact, unit)));
    }

    private TransferOutcome dispatch(ArtifactDescriptor artifact, WorkUnit unit) {
        MDC.put(RUN_ID_MDC_KEY, task.getRunId());
        MDC.put(WORKER_ID_MDC_KEY, poolId + "/unit-" + unit.getSequence());
        try {
            return task.transfer(artifact, unit.getSequence());
        } finally {
            MDC.remove(WORKER_ID_MDC_KEY);
            MDC.remove(RUN_ID_MDC_KEY);
        }
    }

    private void watchForSystemicFailure(TransferOutcome outcome) {
        if (outcome.isSystemic()) {
            task.getCancellation().haltDispatch(outcome.getErrorClass() + " on " + outcome.getIdentity()
                + ": " + outcome.getErrorDetail());
            return;
        }
        if (outcome.getStatus() == TransferOutcome.Status.FAILED_RETRYABLE
            && outcome.getFailedStage() == TransferOutcome.Stage.TARGET_WRITE) {
            int streak = consecutiveTargetFailures.incrementAndGet();
            if (streak >= systemicFailureThreshold) {
                task.getCancellation().haltDispatch("Target unreachable: " + streak
                    + " consecutive writes exhausted their retries, last error " + outcome.getErrorClass()
                    + ": " + outcome.getErrorDetail());
            }
        } else if (outcome.getStatus() == TransferOutcome.Status.COMMITTED) {
            consecutiveTargetFailures.set(0);
        }
    }
}
