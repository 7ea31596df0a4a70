package org.opensearch.migrations.artifacts.controller;

import org.opensearch.migrations.artifacts.config.MigrationConfig;
import org.opensearch.migrations.artifacts.config.StrategyHint;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class StrategySelector {
    public static final long SMALL_LIMIT_BYTES = 100L * StrategyParameters.MIB;
    public static final long MEDIUM_LIMIT_BYTES = 100L * 1024 * StrategyParameters.MIB;

    public StrategyParameters select(StrategyHint hint, long estimatedTotalBytes) {
        switch (hint) {
            case SMALL:
                return StrategyParameters.SMALL;
            case MEDIUM:
                return StrategyParameters.MEDIUM;
            case LARGE:
                return StrategyParameters.LARGE;
            case AUTO:
            default:
                var selected = estimatedTotalBytes < SMALL_LIMIT_BYTES ? StrategyParameters.SMALL
                    : estimatedTotalBytes < MEDIUM_LIMIT_BYTES ? StrategyParameters.MEDIUM
                    : StrategyParameters.LARGE;
                log.atInfo().setMessage("Estimated {} bytes to migrate, using the {} strategy")
                    .addArgument(estimatedTotalBytes).addArgument(selected::name).log();
                return selected;
        }
    }

    public StrategyParameters select(MigrationConfig config, long estimatedTotalBytes) {
        return select(config.getStrategyHint(), estimatedTotalBytes).withOverrides(config);
    }
}
