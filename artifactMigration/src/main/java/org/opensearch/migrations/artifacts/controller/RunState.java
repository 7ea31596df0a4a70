package org.opensearch.migrations.artifacts.controller;

import java.util.EnumSet;
import java.util.Set;

public enum RunState {
    CREATED,
    LISTING,
    PARTITIONING,
    RUNNING,
    PAUSED,
    COMPLETED,
    FAILED;

    public boolean isFinished() {
        return this == COMPLETED || this == FAILED;
    }

    public Set<RunState> allowedSuccessors() {
        switch (this) {
            case CREATED:
                return EnumSet.of(LISTING, FAILED);
            case LISTING:
                return EnumSet.of(PARTITIONING, FAILED);
            case PARTITIONING:
                return EnumSet.of(RUNNING, FAILED);
            case RUNNING:
                return EnumSet.of(PAUSED, COMPLETED, FAILED);
            case PAUSED:
                return EnumSet.of(RUNNING, FAILED);
            default:
                return EnumSet.noneOf(RunState.class);
        }
    }

    public boolean canTransitionTo(RunState next) {
        return allowedSuccessors().contains(next);
    }
}
