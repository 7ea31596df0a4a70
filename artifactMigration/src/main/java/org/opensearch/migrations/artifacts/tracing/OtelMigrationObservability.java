package org.opensearch.migrations.artifacts.tracing;

import java.time.Duration;

import org.opensearch.migrations.artifacts.ratelimit.Bucket;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import lombok.extern.slf4j.Slf4j;

/**
 * Records run activity as OpenTelemetry metrics and logs the committed/failed events.  Whether the metrics
 * leave the process depends on the {@link OpenTelemetry} instance supplied; with the no-op instance only
 * the log events remain.
 */
@Slf4j
public class OtelMigrationObservability implements MigrationObservability {
    public static final String SCOPE_NAME = "artifactMigration";
    public static final AttributeKey<String> ERROR_CLASS = AttributeKey.stringKey("errorClass");
    public static final AttributeKey<String> BUCKET = AttributeKey.stringKey("bucket");
    public static final AttributeKey<Boolean> FATAL = AttributeKey.booleanKey("fatal");

    private final LongCounter attempts;
    private final LongCounter retries;
    private final LongCounter successes;
    private final LongCounter bytesCommitted;
    private final LongCounter failures;
    private final DoubleHistogram rateLimiterWait;

    public OtelMigrationObservability(OpenTelemetry openTelemetry) {
        this(openTelemetry.getMeter(SCOPE_NAME));
    }

    public OtelMigrationObservability(Meter meter) {
        attempts = meter.counterBuilder("artifactAttempts").setUnit("1").build();
        retries = meter.counterBuilder("artifactRetries").setUnit("1").build();
        successes = meter.counterBuilder("artifactSuccesses").setUnit("1").build();
        bytesCommitted = meter.counterBuilder("bytesCommitted").setUnit("By").build();
        failures = meter.counterBuilder("artifactFailures").setUnit("1").build();
        rateLimiterWait = meter.histogramBuilder("rateLimiterWaitMillis").setUnit("ms").build();
    }

    @Override
    public void onAttempt(String identity, int attempt) {
        record(() -> attempts.add(1));
    }

    @Override
    public void onRetryScheduled(String identity, int attempt, Duration delay, Throwable cause) {
        record(() -> retries.add(1, Attributes.of(ERROR_CLASS, cause.getClass().getSimpleName())));
        log.atDebug().setMessage("Retrying {} after attempt {} in {}ms: {}")
            .addArgument(identity)
            .addArgument(attempt)
            .addArgument(delay::toMillis)
            .addArgument(cause::getMessage)
            .log();
    }

    @Override
    public void onCommitted(String identity, long bytes) {
        record(() -> {
            successes.add(1);
            bytesCommitted.add(bytes);
        });
        log.atInfo().setMessage("Artifact committed: {} ({} bytes)").addArgument(identity).addArgument(bytes).log();
    }

    @Override
    public void onFailed(String identity, String errorClass, boolean fatal, String detail) {
        record(() -> failures.add(1, Attributes.of(ERROR_CLASS, errorClass, FATAL, fatal)));
        if (fatal) {
            log.atError().setMessage("Artifact failed fatally: {} [{}] {}")
                .addArgument(identity).addArgument(errorClass).addArgument(detail).log();
        } else {
            log.atWarn().setMessage("Artifact failed after exhausting retries: {} [{}] {}")
                .addArgument(identity).addArgument(errorClass).addArgument(detail).log();
        }
    }

    @Override
    public void onRateLimiterWait(Bucket bucket, Duration waited) {
        record(() -> rateLimiterWait.record(waited.toNanos() / 1_000_000.0, Attributes.of(BUCKET, bucket.name())));
    }

    private static void record(Runnable instrumentUpdate) {
        try {
            instrumentUpdate.run();
        } catch (RuntimeException e) {
            log.atWarn().setCause(e).setMessage("Dropping metric update").log();
        }
    }
}
