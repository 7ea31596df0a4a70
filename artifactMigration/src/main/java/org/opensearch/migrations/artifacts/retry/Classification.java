package org.opensearch.migrations.artifacts.retry;

import java.time.Duration;

import lombok.Value;

/**
 * What to do about a failed attempt.
 */
public interface Classification {

    boolean isRetryable();

    /** Try again after {@link #getDelay()}. */
    @Value
    class Retryable implements Classification {
        Duration delay;

        @Override
        public boolean isRetryable() {
            return true;
        }
    }

    /**
     * Give up on the artifact.  A systemic failure also stops the rest of the run from being dispatched.
     */
    @Value
    class Fatal implements Classification {
        String reason;
        boolean systemic;

        @Override
        public boolean isRetryable() {
            return false;
        }
    }
}
