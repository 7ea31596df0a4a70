package org.opensearch.migrations.artifacts.store;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Write side of a migration.  Writes must be idempotent for a given identity and content, since an
 * attempt interrupted after the write but before its commit is repeated.
 */
public interface ArtifactTarget {

    WriteConfirmation write(String identity, InputStream content, long sizeBytes, Map<String, String> metadata)
        throws IOException;
}
