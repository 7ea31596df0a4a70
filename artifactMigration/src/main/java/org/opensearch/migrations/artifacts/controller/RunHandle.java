package org.opensearch.migrations.artifacts.controller;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import lombok.Getter;

/**
 * A started (or resumed) run segment.  The completion finishes with the segment's report, whether the run
 * completed, failed or was paused.
 */
@Getter
public class RunHandle {
    private final String runId;
    private final Instant startedAt;
    private final StrategyParameters strategy;
    private final CompletableFuture<RunReport> completion;

    RunHandle(String runId, Instant startedAt, StrategyParameters strategy, CompletableFuture<RunReport> completion) {
        this.runId = runId;
        this.startedAt = startedAt;
        this.strategy = strategy;
        this.completion = completion;
    }

    public RunReport awaitCompletion() throws InterruptedException {
        try {
            return completion.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Run " + runId + " ended with an unexpected error", e.getCause());
        }
    }

    public RunReport awaitCompletion(Duration timeout) throws InterruptedException, TimeoutException {
        try {
            return completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Run " + runId + " ended with an unexpected error", e.getCause());
        }
    }

    public boolean isDone() {
        return completion.isDone();
    }
}
