package org.opensearch.migrations.artifacts.config;

public enum StrategyHint {
    SMALL,
    MEDIUM,
    LARGE,
    /** Pick one of the others from the source's size estimate. */
    AUTO
}
