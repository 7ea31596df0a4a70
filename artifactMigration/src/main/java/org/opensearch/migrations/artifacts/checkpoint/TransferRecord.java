package org.opensearch.migrations.artifacts.checkpoint;

import java.time.Instant;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;

/**
 * Durable state of one artifact within one run.  Records are immutable; every transition writes a new
 * record guarded by the state the writer expects to replace.
 *
 * <p>An in-flight record carries a lease: the worker that claimed it and the instant until which the
 * claim holds.  Only the lease owner may move an in-flight record on, and recovery only re-queues records
 * whose lease has run out.
 */
@Value
@With
@Builder(toBuilder = true)
public class TransferRecord {
    @NonNull
    String identity;
    @NonNull
    TransferState state;
    int attemptCount;
    Instant lastAttemptAt;
    String lastErrorClass;
    String lastErrorDetail;
    String checksum;
    Long sizeBytes;
    String leaseOwner;
    Instant leaseExpiresAt;

    /** A record without a lease counts as expired. */
    public boolean isLeaseExpired(Instant now) {
        return leaseExpiresAt == null || !now.isBefore(leaseExpiresAt);
    }

    public static TransferRecord pending(String identity) {
        return TransferRecord.builder().identity(identity).state(TransferState.PENDING).build();
    }
}
