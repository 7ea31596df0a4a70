package org.opensearch.migrations.artifacts.store;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * An open read of an artifact.  Closing it closes the content stream.
 */
@Value
@Builder
public class SourceArtifact implements AutoCloseable {
    @NonNull
    String identity;
    @NonNull
    InputStream content;
    String declaredChecksum;
    Long declaredSize;
    @Builder.Default
    Map<String, String> metadata = Map.of();

    @Override
    public void close() throws IOException {
        content.close();
    }
}
