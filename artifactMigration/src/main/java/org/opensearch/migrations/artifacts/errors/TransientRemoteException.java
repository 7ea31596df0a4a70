package org.opensearch.migrations.artifacts.errors;

import java.util.OptionalInt;

/**
 * A remote call failed in a way that is expected to clear up on its own: a dropped connection,
 * a throttling response or a 5xx from the remote store.
 */
public class TransientRemoteException extends MigrationException {
    private final Integer statusCode;

    public TransientRemoteException(String message) {
        this(message, null, null);
    }

    public TransientRemoteException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public TransientRemoteException(String message, Integer statusCode, Throwable cause) {
        super(statusCode == null ? message : message + " (status " + statusCode + ")", cause);
        this.statusCode = statusCode;
    }

    public static TransientRemoteException throttled(String message) {
        return new TransientRemoteException(message, 429, null);
    }

    public OptionalInt getStatusCode() {
        return statusCode == null ? OptionalInt.empty() : OptionalInt.of(statusCode);
    }
}
