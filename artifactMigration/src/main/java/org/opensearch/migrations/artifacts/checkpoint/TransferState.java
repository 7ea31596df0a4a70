package org.opensearch.migrations.artifacts.checkpoint;

import java.util.EnumSet;
import java.util.Set;

/**
 * Per-artifact transfer state.  Transitions only move forward, with three exceptions: an in-flight record
 * can go back to {@link #PENDING} (crash recovery or a pause), an exhausted {@link #FAILED_RETRYABLE}
 * record can be claimed again by a later attempt, and {@link #IN_PROGRESS} can be rewritten in place to
 * renew its lease.
 */
public enum TransferState {
    PENDING,
    IN_PROGRESS,
    VALIDATED,
    COMMITTED,
    FAILED_RETRYABLE,
    FAILED_FATAL;

    public boolean isTerminal() {
        return this == COMMITTED || this == FAILED_FATAL;
    }

    /**
     * States from which a worker may claim the artifact.  A {@code null} prior state (no record yet)
     * is claimable as well.
     */
    public boolean isClaimable() {
        return this == PENDING || this == FAILED_RETRYABLE;
    }

    /** States held under a lease. */
    public boolean isInFlight() {
        return this == IN_PROGRESS || this == VALIDATED;
    }

    public Set<TransferState> allowedSuccessors() {
        switch (this) {
            case PENDING:
            case FAILED_RETRYABLE:
                return EnumSet.of(IN_PROGRESS);
            case IN_PROGRESS:
                return EnumSet.of(IN_PROGRESS, VALIDATED, FAILED_RETRYABLE, FAILED_FATAL, PENDING);
            case VALIDATED:
                return EnumSet.of(COMMITTED, FAILED_RETRYABLE, PENDING);
            default:
                return EnumSet.noneOf(TransferState.class);
        }
    }

    /**
     * @param from the prior state, or null when no record exists yet
     */
    public static boolean isAllowedTransition(TransferState from, TransferState to) {
        if (from == null) {
            return to == IN_PROGRESS || to == PENDING;
        }
        return from.allowedSuccessors().contains(to);
    }
}
