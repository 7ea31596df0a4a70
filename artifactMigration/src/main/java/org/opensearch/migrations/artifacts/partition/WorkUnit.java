package org.opensearch.migrations.artifacts.partition;

import java.util.List;

import org.opensearch.migrations.artifacts.store.ArtifactDescriptor;

import lombok.NonNull;
import lombok.Value;

/**
 * An ordered, immutable batch of artifacts processed by one worker slot.
 */
@Value
public class WorkUnit {
    int sequence;
    @NonNull
    List<ArtifactDescriptor> artifacts;

    public WorkUnit(int sequence, List<ArtifactDescriptor> artifacts) {
        this.sequence = sequence;
        this.artifacts = List.copyOf(artifacts);
    }

    public long getTotalBytes() {
        return artifacts.stream().mapToLong(ArtifactDescriptor::getSizeBytes).sum();
    }

    public int size() {
        return artifacts.size();
    }
}
