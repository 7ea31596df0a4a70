package org.opensearch.migrations.artifacts.errors;

/**
 * The supplied credentials were rejected.  Expected to recur on every artifact, so besides failing the
 * artifact it stops the dispatch of new work.
 */
public class AuthorizationException extends MigrationException {

    public AuthorizationException(String message) {
        super(message);
    }

    public AuthorizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
