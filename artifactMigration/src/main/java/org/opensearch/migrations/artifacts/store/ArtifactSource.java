package org.opensearch.migrations.artifacts.store;

import java.io.IOException;
import java.util.List;
import java.util.OptionalLong;

/**
 * Read side of a migration.  Implementations signal remote failures with the exceptions in
 * {@code org.opensearch.migrations.artifacts.errors}; a plain {@link IOException} is treated as a transient
 * network problem.
 */
public interface ArtifactSource {

    /**
     * A snapshot of every artifact to migrate, in a stable order.
     */
    List<ArtifactDescriptor> list() throws IOException;

    /**
     * @throws org.opensearch.migrations.artifacts.errors.ArtifactNotFoundException if the artifact no longer
     *     exists
     */
    SourceArtifact read(String identity) throws IOException;

    /**
     * A cheap estimate of the aggregate payload, used to pick a strategy.  Empty means the
     * caller should add up the listed sizes instead.
     */
    default OptionalLong estimateTotalBytes() {
        return OptionalLong.empty();
    }
}
