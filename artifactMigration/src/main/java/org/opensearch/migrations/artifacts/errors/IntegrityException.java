package org.opensearch.migrations.artifacts.errors;

import org.opensearch.migrations.artifacts.validation.ValidationResult;

import lombok.Getter;

/**
 * Content read from the source or confirmed by the target does not match what was declared.
 * Never retried.
 */
@Getter
public class IntegrityException extends MigrationException {
    private final String identity;
    private final transient ValidationResult.Mismatch mismatch;

    public IntegrityException(String identity, ValidationResult.Mismatch mismatch) {
        super("Integrity check failed for '" + identity + "': " + mismatch.describe());
        this.identity = identity;
        this.mismatch = mismatch;
    }
}
