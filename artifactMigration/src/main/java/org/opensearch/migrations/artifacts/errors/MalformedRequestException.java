package org.opensearch.migrations.artifacts.errors;

public class MalformedRequestException extends MigrationException {

    public MalformedRequestException(String message) {
        super(message);
    }

    public MalformedRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
