package org.opensearch.migrations.artifacts.checkpoint;

import java.io.IOException;

/**
 * A checkpoint store operation could not be completed.
 */
public class CheckpointStoreException extends IOException {
    private final String identity;
    private final String operation;

    public CheckpointStoreException(String operation, String identity, String message) {
        super(String.format("Operation '%s' failed for artifact '%s': %s", operation, identity, message));
        this.operation = operation;
        this.identity = identity;
    }

    public CheckpointStoreException(String operation, String identity, String message, Throwable cause) {
        super(String.format("Operation '%s' failed for artifact '%s': %s", operation, identity, message), cause);
        this.operation = operation;
        this.identity = identity;
    }

    public String getIdentity() {
        return identity;
    }

    public String getOperation() {
        return operation;
    }
}
