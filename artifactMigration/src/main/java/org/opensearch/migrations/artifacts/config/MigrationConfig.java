package org.opensearch.migrations.artifacts.config;

import java.time.Duration;

import org.opensearch.migrations.artifacts.retry.BackoffPolicy;

import lombok.Builder;
import lombok.Value;

/**
 * Options for one run.  The batching and concurrency overrides are null unless set; a null value means
 * the selected strategy's default applies.
 */
@Value
@Builder(toBuilder = true)
public class MigrationConfig {
    public static final long DEFAULT_SPOOL_THRESHOLD_BYTES = 16L * 1024 * 1024;

    /** Generated when absent. */
    String runId;
    /** Artifacts committed by this earlier run are not transferred again. */
    String resumeFromRunId;
    @Builder.Default
    StrategyHint strategyHint = StrategyHint.AUTO;

    Integer concurrencyLimit;
    Integer batchArtifactCount;
    Long batchByteSize;
    Integer poolInstances;

    @Builder.Default
    int maxRetries = 3;
    @Builder.Default
    long backoffBaseMs = 100;
    @Builder.Default
    double backoffFactor = 2.0;
    @Builder.Default
    long backoffMaxMs = 30_000;

    /** Source read permits per second; zero or less disables the limit. */
    @Builder.Default
    double rateLimitSource = 0;
    /** Target write permits per second; zero or less disables the limit. */
    @Builder.Default
    double rateLimitTarget = 0;
    @Builder.Default
    long rateLimitTimeoutMs = 30_000;

    @Builder.Default
    long spoolThresholdBytes = DEFAULT_SPOOL_THRESHOLD_BYTES;
    @Builder.Default
    int systemicFailureThreshold = 5;
    /** How long a claim holds without renewal before another worker may take the artifact over. */
    @Builder.Default
    long leaseDurationMs = 300_000;

    public static MigrationConfig defaults() {
        return builder().build();
    }

    /**
     * @return this config
     * @throws IllegalArgumentException naming the first invalid option
     */
    public MigrationConfig validate() {
        requirePositive("concurrencyLimit", concurrencyLimit);
        requirePositive("batchArtifactCount", batchArtifactCount);
        requirePositive("batchByteSize", batchByteSize);
        requirePositive("poolInstances", poolInstances);
        if (strategyHint == null) {
            throw new IllegalArgumentException("strategyHint must be set");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got " + maxRetries);
        }
        if (backoffBaseMs <= 0) {
            throw new IllegalArgumentException("backoffBaseMs must be > 0, got " + backoffBaseMs);
        }
        if (backoffFactor < 1.0) {
            throw new IllegalArgumentException("backoffFactor must be >= 1, got " + backoffFactor);
        }
        if (backoffMaxMs < backoffBaseMs) {
            throw new IllegalArgumentException("backoffMaxMs (" + backoffMaxMs
                + ") must not be smaller than backoffBaseMs (" + backoffBaseMs + ")");
        }
        if (rateLimitTimeoutMs <= 0) {
            throw new IllegalArgumentException("rateLimitTimeoutMs must be > 0, got " + rateLimitTimeoutMs);
        }
        if (spoolThresholdBytes < 0) {
            throw new IllegalArgumentException("spoolThresholdBytes must be >= 0, got " + spoolThresholdBytes);
        }
        if (systemicFailureThreshold < 1) {
            throw new IllegalArgumentException("systemicFailureThreshold must be >= 1, got "
                + systemicFailureThreshold);
        }
        if (leaseDurationMs <= 0) {
            throw new IllegalArgumentException("leaseDurationMs must be > 0, got " + leaseDurationMs);
        }
        return this;
    }

    private static void requirePositive(String name, Number value) {
        if (value != null && value.longValue() < 1) {
            throw new IllegalArgumentException(name + " must be >= 1, got " + value);
        }
    }

    public BackoffPolicy backoffPolicy() {
        return new BackoffPolicy(Duration.ofMillis(backoffBaseMs), backoffFactor, Duration.ofMillis(backoffMaxMs));
    }

    public Duration leaseDuration() {
        return Duration.ofMillis(leaseDurationMs);
    }

    public Duration rateLimitTimeout() {
        return Duration.ofMillis(rateLimitTimeoutMs);
    }
}
