package org.opensearch.migrations.artifacts.config;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/**
 * YAML form of {@link MigrationConfig}.  Keys that are absent leave the builder's value alone.
 */
public class MigrationConfigFile {
    public String run_id;
    public String resume_from_run_id;
    public StrategyHint strategy_hint;
    public Integer concurrency_limit;
    public Integer batch_artifact_count;
    public Long batch_byte_size;
    public Integer pool_instances;
    public Integer max_retries;
    public Long backoff_base_ms;
    public Double backoff_factor;
    public Long backoff_max_ms;
    public Double rate_limit_source;
    public Double rate_limit_target;
    public Long rate_limit_timeout_ms;
    public Long spool_threshold_bytes;
    public Integer systemic_failure_threshold;
    public Long lease_duration_ms;

    public static MigrationConfigFile loadFrom(String path) throws IOException {
        try (var inputStream = new FileInputStream(path)) {
            return loadFrom(inputStream);
        }
    }

    public static MigrationConfigFile loadFrom(InputStream inputStream) {
        var yaml = new Yaml(new Constructor(MigrationConfigFile.class, new LoaderOptions()));
        MigrationConfigFile loaded = yaml.load(inputStream);
        return loaded == null ? new MigrationConfigFile() : loaded;
    }

    public MigrationConfig.MigrationConfigBuilder applyTo(MigrationConfig.MigrationConfigBuilder builder) {
        if (run_id != null) {
            builder.runId(run_id);
        }
        if (resume_from_run_id != null) {
            builder.resumeFromRunId(resume_from_run_id);
        }
        if (strategy_hint != null) {
            builder.strategyHint(strategy_hint);
        }
        if (concurrency_limit != null) {
            builder.concurrencyLimit(concurrency_limit);
        }
        if (batch_artifact_count != null) {
            builder.batchArtifactCount(batch_artifact_count);
        }
        if (batch_byte_size != null) {
            builder.batchByteSize(batch_byte_size);
        }
        if (pool_instances != null) {
            builder.poolInstances(pool_instances);
        }
        if (max_retries != null) {
            builder.maxRetries(max_retries);
        }
        if (backoff_base_ms != null) {
            builder.backoffBaseMs(backoff_base_ms);
        }
        if (backoff_factor != null) {
            builder.backoffFactor(backoff_factor);
        }
        if (backoff_max_ms != null) {
            builder.backoffMaxMs(backoff_max_ms);
        }
        if (rate_limit_source != null) {
            builder.rateLimitSource(rate_limit_source);
        }
        if (rate_limit_target != null) {
            builder.rateLimitTarget(rate_limit_target);
        }
        if (rate_limit_timeout_ms != null) {
            builder.rateLimitTimeoutMs(rate_limit_timeout_ms);
        }
        if (spool_threshold_bytes != null) {
            builder.spoolThresholdBytes(spool_threshold_bytes);
        }
        if (systemic_failure_threshold != null) {
            builder.systemicFailureThreshold(systemic_failure_threshold);
        }
        if (lease_duration_ms != null) {
            builder.leaseDurationMs(lease_duration_ms);
        }
        return builder;
    }
}
