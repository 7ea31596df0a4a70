package org.opensearch.migrations.artifacts.controller;

import org.opensearch.migrations.artifacts.config.MigrationConfig;

/**
 * Everything that differs between the small, medium and large regimes.  The transfer protocol itself is
 * the same for all of them.
 *
 * @param orderedUnits whether units are dispatched in listing order; when false they are spread across
 *     the pool instances and may finish in any order
 */
public record StrategyParameters(
    String name,
    int maxArtifactsPerUnit,
    long maxBytesPerUnit,
    int concurrencyLimit,
    int poolInstances,
    boolean orderedUnits
) {
    public static final long MIB = 1024L * 1024;

    public static final StrategyParameters SMALL = new StrategyParameters("SMALL", 1, Long.MAX_VALUE, 1, 1, true);
    public static final StrategyParameters MEDIUM = new StrategyParameters("MEDIUM", 100, 256 * MIB, 10, 1, true);
    public static final StrategyParameters LARGE = new StrategyParameters("LARGE", 500, 1024 * MIB, 32, 4, false);

    public int totalSlots() {
        return concurrencyLimit * poolInstances;
    }

    /** Applies the batching and concurrency options that were set explicitly. */
    public StrategyParameters withOverrides(MigrationConfig config) {
        return new StrategyParameters(
            name,
            config.getBatchArtifactCount() != null ? config.getBatchArtifactCount() : maxArtifactsPerUnit,
            config.getBatchByteSize() != null ? config.getBatchByteSize() : maxBytesPerUnit,
            config.getConcurrencyLimit() != null ? config.getConcurrencyLimit() : concurrencyLimit,
            config.getPoolInstances() != null ? config.getPoolInstances() : poolInstances,
            orderedUnits
        );
    }
}
