package org.opensearch.migrations.artifacts.errors;

import lombok.Getter;

/**
 * The artifact was part of the listing snapshot but can no longer be read from the source.
 */
@Getter
public class ArtifactNotFoundException extends MigrationException {
    private final String identity;

    public ArtifactNotFoundException(String identity) {
        super("Artifact '" + identity + "' no longer exists in the source");
        this.identity = identity;
    }
}
