package org.opensearch.migrations.artifacts.store;

import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * An artifact as the source listed it.  The identity is the primary key of all transfer state.
 */
@Value
@Builder(toBuilder = true)
public class ArtifactDescriptor {
    @NonNull
    String identity;
    long sizeBytes;
    /** Declared checksum, or null when the source does not publish one. */
    String checksum;
    String contentType;
    @Builder.Default
    Map<String, String> metadata = Map.of();

    public static ArtifactDescriptor of(String identity, long sizeBytes, String checksum) {
        return builder().identity(identity).sizeBytes(sizeBytes).checksum(checksum).build();
    }
}
