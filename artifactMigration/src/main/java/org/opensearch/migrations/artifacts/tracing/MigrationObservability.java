package org.opensearch.migrations.artifacts.tracing;

import java.time.Duration;

import org.opensearch.migrations.artifacts.ratelimit.Bucket;

/**
 * Sink for counters and structured events produced while a run executes.  Calls are made inline by the
 * workers, so implementations must return quickly and must never throw.
 */
public interface MigrationObservability {

    MigrationObservability NOOP = new MigrationObservability() {};

    default void onAttempt(String identity, int attempt) {}

    default void onRetryScheduled(String identity, int attempt, Duration delay, Throwable cause) {}

    default void onCommitted(String identity, long bytes) {}

    default void onFailed(String identity, String errorClass, boolean fatal, String detail) {}

    default void onRateLimiterWait(Bucket bucket, Duration waited) {}
}
