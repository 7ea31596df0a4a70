package org.opensearch.migrations.artifacts.controller;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

import org.opensearch.migrations.artifacts.checkpoint.CheckpointRecovery;
import org.opensearch.migrations.artifacts.checkpoint.CheckpointStore;
import org.opensearch.migrations.artifacts.checkpoint.CheckpointStoreException;
import org.opensearch.migrations.artifacts.checkpoint.TransferRecord;
import org.opensearch.migrations.artifacts.checkpoint.TransferState;
import org.opensearch.migrations.artifacts.config.MigrationConfig;
import org.opensearch.migrations.artifacts.errors.MigrationException;
import org.opensearch.migrations.artifacts.partition.Partitioner;
import org.opensearch.migrations.artifacts.partition.WorkUnit;
import org.opensearch.migrations.artifacts.ratelimit.EndpointRateLimiter;
import org.opensearch.migrations.artifacts.retry.RetryClassifier;
import org.opensearch.migrations.artifacts.store.ArtifactDescriptor;
import org.opensearch.migrations.artifacts.store.ArtifactSource;
import org.opensearch.migrations.artifacts.store.ArtifactTarget;
import org.opensearch.migrations.artifacts.tracing.MigrationObservability;
import org.opensearch.migrations.artifacts.worker.ArtifactTransferTask;
import org.opensearch.migrations.artifacts.worker.PoolCancellation;
import org.opensearch.migrations.artifacts.worker.TransferOutcome;
import org.opensearch.migrations.artifacts.worker.WorkerPool;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Owns the lifecycle of migration runs: listing, exclusion of finished work, partitioning, and handing
 * the residual work to one or more {@link WorkerPool}s.
 *
 * <p>Only a systemic failure (the source cannot be listed, the checkpoint store is unusable, credentials
 * are rejected or the target stays unreachable) fails a run.  Per-artifact failures are recorded and the
 * run still completes.
 */
@Slf4j
public class MigrationController implements AutoCloseable {
    private final ArtifactSource source;
    private final ArtifactTarget target;
    private final CheckpointStore store;
    private final MigrationObservability observability;
    private final StrategySelector strategySelector = new StrategySelector();
    private final Partitioner partitioner = new Partitioner();
    private final CheckpointRecovery recovery;
    private final Map<String, RunContext> runs = new ConcurrentHashMap<>();

    public MigrationController(ArtifactSource source,
                               ArtifactTarget target,
                               CheckpointStore store,
                               MigrationObservability observability) {
        this.source = source;
        this.target = target;
        this.store = store;
        this.observability = observability;
        this.recovery = new CheckpointRecovery(store);
    }

    /**
     * Lists the source and starts transferring whatever is not already done.  Starting a run id that
     * already has records in the store continues that run: in-flight records left by a crash are
     * re-queued and committed artifacts are skipped.
     *
     * @throws IllegalArgumentException if the config is invalid
     * @throws IllegalStateException if a run with the same id is active in this controller
     */
    public RunHandle start(MigrationConfig config) {
        config.validate();
        var runId = config.getRunId() != null ? config.getRunId() : UUID.randomUUID().toString();
        var ctx = new RunContext(runId, config, Instant.now());
        runs.compute(runId, (id, existing) -> {
            if (existing != null && !existing.getState().isFinished()) {
                throw new IllegalStateException("Run " + id + " is already " + existing.getState());
            }
            return ctx;
        });

        MDC.put(WorkerPool.RUN_ID_MDC_KEY, runId);
        try {
            log.atInfo().setMessage("Starting run {} (resuming from {})")
                .addArgument(runId).addArgument(config::getResumeFromRunId).log();
            ctx.transition(RunState.LISTING);
            List<ArtifactDescriptor> listing;
            try {
                listing = deduplicate(source.list());
            } catch (IOException | RuntimeException e) {
                return failBeforeDispatch(ctx, "Could not list the source: " + e.getMessage(), e);
            }
            ctx.setSnapshot(listing);
            long totalBytes = estimateTotalBytes().orElseGet(() ->
                ctx.getSnapshot().stream().mapToLong(ArtifactDescriptor::getSizeBytes).sum());
            ctx.setStrategy(strategySelector.select(config, totalBytes));
            ctx.transition(RunState.PARTITIONING);
            return launch(ctx);
        } finally {
            MDC.remove(WorkerPool.RUN_ID_MDC_KEY);
        }
    }

    /**
     * Stops dispatching, lets every worker reach a step boundary and rolls in-flight artifacts back to
     * {@link TransferState#PENDING}.  Returns once the pools are quiet.
     *
     * @return the report of the segment that was paused
     */
    public RunReport pause(String runId) throws InterruptedException {
        var ctx = requireRun(runId);
        synchronized (ctx) {
            var state = ctx.getState();
            if (state == RunState.PAUSED || state.isFinished()) {
                log.atInfo().setMessage("Run {} is already {}, nothing to pause").addArgument(runId).addArgument(state).log();
            } else if (state == RunState.RUNNING) {
                ctx.getCancellation().cancel();
            } else {
                throw new IllegalStateException("Run " + runId + " cannot be paused while " + state);
            }
        }
        return awaitSegment(ctx);
    }

    /**
     * Continues a paused run from the listing it was started with.
     */
    public RunHandle resume(String runId) {
        var ctx = requireRun(runId);
        MDC.put(WorkerPool.RUN_ID_MDC_KEY, runId);
        try {
            synchronized (ctx) {
                if (ctx.getState() != RunState.PAUSED) {
                    throw new IllegalStateException("Run " + runId + " cannot be resumed while " + ctx.getState());
                }
            }
            log.atInfo().setMessage("Resuming run {}").addArgument(runId).log();
            return launch(ctx);
        } finally {
            MDC.remove(WorkerPool.RUN_ID_MDC_KEY);
        }
    }

    public RunStatus status(String runId) {
        return requireRun(runId).status();
    }

    private RunContext requireRun(String runId) {
        var ctx = runs.get(runId);
        if (ctx == null) {
            throw new IllegalArgumentException("Unknown run " + runId);
        }
        return ctx;
    }

    private static RunReport awaitSegment(RunContext ctx) throws InterruptedException {
        try {
            return ctx.getCompletion().get();
        } catch (ExecutionException e) {
            throw new MigrationException("Run " + ctx.getRunId() + " ended with an unexpected error", e.getCause());
        }
    }

    /** Falls back to the listed sizes when the source cannot estimate. */
    private OptionalLong estimateTotalBytes() {
        try {
            return source.estimateTotalBytes();
        } catch (RuntimeException e) {
            log.atWarn().setCause(e).setMessage("Source could not estimate its size, using the listed sizes").log();
            return OptionalLong.empty();
        }
    }

    private List<ArtifactDescriptor> deduplicate(List<ArtifactDescriptor> listed) {
        var byIdentity = new LinkedHashMap<String, ArtifactDescriptor>();
        for (var artifact : listed) {
            if (byIdentity.putIfAbsent(artifact.getIdentity(), artifact) != null) {
                log.atWarn().setMessage("Source listed {} more than once, keeping the first entry")
                    .addArgument(artifact::getIdentity).log();
            }
        }
        return List.copyOf(byIdentity.values());
    }

    private RunHandle launch(RunContext ctx) {
        var strategy = ctx.getStrategy();
        List<WorkUnit> units;
        try {
            var residual = residualWork(ctx);
            units = partitioner.partition(residual, strategy.maxArtifactsPerUnit(), strategy.maxBytesPerUnit());
            ctx.addDispatched(residual.size());
        } catch (CheckpointStoreException e) {
            return failBeforeDispatch(ctx, "Checkpoint store is unavailable: " + e.getMessage(), e);
        }

        var cancellation = new PoolCancellation();
        var completion = new CompletableFuture<RunReport>();
        synchronized (ctx) {
            ctx.setCancellation(cancellation);
            ctx.setCompletion(completion);
            ctx.transition(RunState.RUNNING);
        }
        var handle = new RunHandle(ctx.getRunId(), Instant.now(), strategy, completion);
        if (units.isEmpty()) {
            log.atInfo().setMessage("Run {} has no work left").addArgument(ctx::getRunId).log();
            completion.complete(finishSegment(ctx, cancellation, null));
            return handle;
        }

        var config = ctx.getConfig();
        var scheduler = Schedulers.newBoundedElastic(strategy.totalSlots(), Integer.MAX_VALUE,
            "artifact-worker-" + ctx.getRunId());
        var task = ArtifactTransferTask.builder()
            .runId(ctx.getRunId())
            .source(source)
            .target(target)
            .store(store)
            .rateLimiter(new EndpointRateLimiter(config.getRateLimitSource(), config.getRateLimitTarget(),
                config.rateLimitTimeout(), observability))
            .classifier(new RetryClassifier(config.backoffPolicy()))
            .cancellation(cancellation)
            .observability(observability)
            .maxRetries(config.getMaxRetries())
            .spoolThresholdBytes(config.getSpoolThresholdBytes())
            .leaseDuration(config.leaseDuration())
            .build();

        log.atInfo().setMessage("Run {}: {} artifacts in {} units, strategy {} ({} pool(s) x {} slots)")
            .addArgument(ctx::getRunId)
            .addArgument(() -> units.stream().mapToInt(WorkUnit::size).sum())
            .addArgument(units::size)
            .addArgument(strategy::name)
            .addArgument(strategy::poolInstances)
            .addArgument(strategy::concurrencyLimit)
            .log();

        runPools(units, strategy, task, scheduler, config.getSystemicFailureThreshold())
            .doOnNext(ctx::record)
            .doFinally(signal -> scheduler.dispose())
            .subscribe(
                outcome -> {},
                error -> completion.complete(finishSegment(ctx, cancellation, error)),
                () -> completion.complete(finishSegment(ctx, cancellation, null))
            );
        return handle;
    }

    /**
     * Units go to pool instances round-robin.  With a single pool, or when the strategy keeps units in
     * order, dispatch follows the listing.
     */
    private static Flux<TransferOutcome> runPools(List<WorkUnit> units,
                                                  StrategyParameters strategy,
                                                  ArtifactTransferTask task,
                                                  Scheduler scheduler,
                                                  int systemicFailureThreshold) {
        int poolCount = strategy.orderedUnits() ? 1 : Math.max(1, Math.min(strategy.poolInstances(), units.size()));
        int slotsPerPool = strategy.orderedUnits() ? strategy.totalSlots() : strategy.concurrencyLimit();
        var pools = new ArrayList<Flux<TransferOutcome>>();
        for (int i = 0; i < poolCount; i++) {
            var share = new ArrayList<WorkUnit>();
            for (int u = i; u < units.size(); u += poolCount) {
                share.add(units.get(u));
            }
            var pool = new WorkerPool("pool-" + i, task, scheduler, systemicFailureThreshold);
            pools.add(pool.run(share, slotsPerPool));
        }
        return Flux.merge(pools);
    }

    /**
     * Re-queues crashed work, then drops everything committed (here or in the run being resumed from) and
     * everything that already failed fatally in this run.
     */
    private List<ArtifactDescriptor> residualWork(RunContext ctx) throws CheckpointStoreException {
        var runId = ctx.getRunId();
        recovery.requeueInFlight(runId);
        Set<String> committed = new HashSet<>(store.listCommitted(runId));
        var resumeFrom = ctx.getConfig().getResumeFromRunId();
        if (resumeFrom != null && !resumeFrom.equals(runId)) {
            committed.addAll(store.listCommitted(resumeFrom));
        }
        var fatal = store.listByState(runId, TransferState.FAILED_FATAL);

        var residual = new ArrayList<ArtifactDescriptor>();
        for (var artifact : ctx.getSnapshot()) {
            var identity = artifact.getIdentity();
            if (committed.contains(identity)) {
                ctx.recordIfAbsent(TransferOutcome.builder()
                    .identity(identity)
                    .status(TransferOutcome.Status.SKIPPED)
                    .build());
            } else if (fatal.contains(identity)) {
                ctx.recordIfAbsent(previousFatalOutcome(runId, identity));
            } else {
                ctx.forgetUnfinished(identity);
                residual.add(artifact);
            }
        }
        log.atInfo().setMessage("Run {}: {} listed, {} already committed, {} failed fatally before, {} to transfer")
            .addArgument(runId)
            .addArgument(ctx.getSnapshot()::size)
            .addArgument(committed::size)
            .addArgument(fatal::size)
            .addArgument(residual::size)
            .log();
        return residual;
    }

    private TransferOutcome previousFatalOutcome(String runId, String identity) throws CheckpointStoreException {
        var record = store.getRecord(runId, identity);
        return TransferOutcome.builder()
            .identity(identity)
            .status(TransferOutcome.Status.FAILED_FATAL)
            .attempts(record.map(TransferRecord::getAttemptCount).orElse(0))
            .errorClass(record.map(TransferRecord::getLastErrorClass).orElse(null))
            .errorDetail(record.map(TransferRecord::getLastErrorDetail).orElse(null))
            .build();
    }

    private RunReport finishSegment(RunContext ctx, PoolCancellation cancellation, Throwable error) {
        RunState finalState;
        if (error != null) {
            log.atError().setCause(error).setMessage("Run {} stopped on an unexpected error")
                .addArgument(ctx::getRunId).log();
            ctx.setFailureReason("Unexpected error: " + error.getMessage());
            finalState = RunState.FAILED;
        } else if (cancellation.isDispatchHalted()) {
            ctx.setFailureReason(cancellation.getSystemicCause());
            finalState = RunState.FAILED;
        } else if (cancellation.isCancelled() && ctx.hasAbandoned()) {
            finalState = RunState.PAUSED;
        } else {
            finalState = RunState.COMPLETED;
        }
        ctx.transition(finalState);
        var report = RunReport.from(ctx.status(), Instant.now());
        log.atInfo().setMessage("Run {} {}: {} committed, {} failed retryably, {} failed fatally, {} skipped, "
                + "{} abandoned")
            .addArgument(report::getRunId)
            .addArgument(report::getState)
            .addArgument(report::getCommitted)
            .addArgument(report::getFailedRetryable)
            .addArgument(report::getFailedFatal)
            .addArgument(report::getSkippedAlreadyDone)
            .addArgument(report::getAbandoned)
            .log();
        return report;
    }

    private RunHandle failBeforeDispatch(RunContext ctx, String reason, Exception cause) {
        log.atError().setCause(cause).setMessage("Run {} failed: {}").addArgument(ctx::getRunId).addArgument(reason).log();
        ctx.setFailureReason(reason);
        ctx.transition(RunState.FAILED);
        var completion = CompletableFuture.completedFuture(RunReport.from(ctx.status(), Instant.now()));
        ctx.setCompletion(completion);
        return new RunHandle(ctx.getRunId(), ctx.getStartedAt(), ctx.getStrategy(), completion);
    }

    /**
     * Pauses every active run and waits for it to quiesce.
     */
    @Override
    public void close() throws InterruptedException {
        for (var ctx : runs.values()) {
            if (ctx.getState() == RunState.RUNNING) {
                pause(ctx.getRunId());
            }
        }
    }
}
