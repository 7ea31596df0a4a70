package org.opensearch.migrations.artifacts.worker;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Result of handing one artifact to a worker slot.
 */
@Value
@Builder(toBuilder = true)
public class TransferOutcome {
    public enum Status {
        COMMITTED,
        FAILED_RETRYABLE,
        FAILED_FATAL,
        /** Claimed, finished or excluded elsewhere; nothing was transferred. */
        SKIPPED,
        /** Stopped by a pause or a systemic halt; the record was left claimable. */
        ABANDONED
    }

    /** Where the last failing attempt stopped. */
    public enum Stage {
        CLAIM,
        SOURCE_READ,
        TARGET_WRITE,
        CHECKPOINT
    }

    @NonNull
    String identity;
    @NonNull
    Status status;
    int unitSequence;
    int attempts;
    long bytes;
    String errorClass;
    String errorDetail;
    Stage failedStage;
    /** Set for failures that stop the whole run, such as rejected credentials. */
    boolean systemic;

    public boolean isFailure() {
        return status == Status.FAILED_FATAL || status == Status.FAILED_RETRYABLE;
    }
}
