package org.opensearch.migrations.artifacts.checkpoint;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Durable record of transfer state keyed by (run id, artifact identity).  Implementations must be
 * thread-safe and, for stores shared across processes, must make {@link #putRecord} an atomic
 * compare-and-set on the prior state (and, for in-flight records, on the lease owner).  That conditional
 * write is what guarantees a single writer per artifact.
 */
public interface CheckpointStore extends AutoCloseable {

    /**
     * Create any tables or structures the store needs.  Safe to call more than once.
     */
    default void setup() throws CheckpointStoreException {
    }

    Optional<TransferRecord> getRecord(String runId, String identity) throws CheckpointStoreException;

    /**
     * Write {@code record} only if the currently stored state equals {@code expectedPriorState}.  When that
     * state is in flight the stored lease owner must also equal {@code record.getLeaseOwner()}.
     *
     * @param expectedPriorState the state being replaced, or null if no record may exist yet
     * @throws CheckpointConflictException if the stored state differs from the expected one
     * @throws IllegalArgumentException if the transition is not permitted by {@link TransferState}
     */
    void putRecord(String runId, TransferRecord record, TransferState expectedPriorState)
        throws CheckpointStoreException;

    Set<String> listByState(String runId, TransferState state) throws CheckpointStoreException;

    List<TransferRecord> listRecords(String runId) throws CheckpointStoreException;

    default Set<String> listCommitted(String runId) throws CheckpointStoreException {
        return listByState(runId, TransferState.COMMITTED);
    }

    /**
     * Whether {@code stored} may be replaced by a write that expects {@code expectedPriorState}.
     */
    static boolean matchesExpected(TransferRecord stored, TransferRecord replacement, TransferState expectedPriorState) {
        var storedState = stored == null ? null : stored.getState();
        if (storedState != expectedPriorState) {
            return false;
        }
        return storedState == null
            || !storedState.isInFlight()
            || Objects.equals(stored.getLeaseOwner(), replacement.getLeaseOwner());
    }

    @Override
    default void close() throws Exception {
    }
}
