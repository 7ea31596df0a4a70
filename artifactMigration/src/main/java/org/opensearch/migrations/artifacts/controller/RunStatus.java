package org.opensearch.migrations.artifacts.controller;

import java.time.Instant;
import java.util.List;

import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time view of a run.  Counts reflect the latest outcome of each artifact, so an artifact that
 * failed retryably before a pause and committed after the resume is counted once, as committed.
 */
@Value
@Builder(toBuilder = true)
public class RunStatus {
    String runId;
    RunState state;
    String strategy;
    Instant startedAt;
    int totalArtifacts;
    /** Artifacts handed to worker pools, summed over every segment of the run. */
    long dispatched;
    long committed;
    long failedRetryable;
    long failedFatal;
    long skippedAlreadyDone;
    long abandoned;
    long bytesCommitted;
    @Builder.Default
    List<FailureDetail> failures = List.of();
    /** A pause was requested and workers are winding down. */
    boolean pauseRequested;
    /** Why the run failed, when it did. */
    String failureReason;

    public long pending() {
        return Math.max(0, totalArtifacts - committed - failedRetryable - failedFatal - skippedAlreadyDone);
    }
}
