package org.opensearch.migrations.artifacts.errors;

/**
 * Base exception for failures raised while moving artifacts.  Subclasses describe the failure class
 * that {@link org.opensearch.migrations.artifacts.retry.RetryClassifier} maps to retryable or fatal.
 */
public class MigrationException extends RuntimeException {

    public MigrationException(String message) {
        super(message);
    }

    public MigrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
