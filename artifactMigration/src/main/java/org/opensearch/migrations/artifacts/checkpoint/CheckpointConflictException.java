package org.opensearch.migrations.artifacts.checkpoint;

/**
 * A conditional write lost a race: the stored state was not the state the writer expected to replace.
 * The writer should re-read the record and abandon its attempt rather than report a failure.
 */
public class CheckpointConflictException extends CheckpointStoreException {
    private final transient TransferState expectedState;

    public CheckpointConflictException(String identity, TransferState expectedState, TransferState actualState) {
        super("putRecord", identity, "expected prior state " + describe(expectedState)
            + " but found " + describe(actualState));
        this.expectedState = expectedState;
    }

    public TransferState getExpectedState() {
        return expectedState;
    }

    private static String describe(TransferState state) {
        return state == null ? "<absent>" : state.name();
    }
}
