package org.opensearch.migrations.artifacts.partition;

import java.util.ArrayList;
import java.util.List;

import org.opensearch.migrations.artifacts.store.ArtifactDescriptor;

import lombok.extern.slf4j.Slf4j;

/**
 * Splits a listing into work units.  The result depends only on the input order and the two bounds.
 */
@Slf4j
public class Partitioner {

    /**
     * Closes the current unit before adding an artifact that would push it past either bound.  Artifacts
     * are never split, so one that alone exceeds {@code maxBytesPerUnit} becomes a unit of its own.
     */
    public List<WorkUnit> partition(List<ArtifactDescriptor> artifacts, int maxArtifactsPerUnit, long maxBytesPerUnit) {
        if (maxArtifactsPerUnit < 1) {
            throw new IllegalArgumentException("maxArtifactsPerUnit must be >= 1, got " + maxArtifactsPerUnit);
        }
        if (maxBytesPerUnit < 1) {
            throw new IllegalArgumentException("maxBytesPerUnit must be >= 1, got " + maxBytesPerUnit);
        }
        var units = new ArrayList<WorkUnit>();
        var current = new ArrayList<ArtifactDescriptor>();
        long currentBytes = 0;
        for (var artifact : artifacts) {
            boolean cutBefore = !current.isEmpty()
                && (current.size() >= maxArtifactsPerUnit || currentBytes + artifact.getSizeBytes() > maxBytesPerUnit);
            if (cutBefore) {
                units.add(new WorkUnit(units.size(), current));
                current = new ArrayList<>();
                currentBytes = 0;
            }
            current.add(artifact);
            currentBytes += artifact.getSizeBytes();
        }
        if (!current.isEmpty()) {
            units.add(new WorkUnit(units.size(), current));
        }
        log.atDebug().setMessage("Partitioned {} artifacts into {} units (max {} artifacts / {} bytes)")
            .addArgument(artifacts::size)
            .addArgument(units::size)
            .addArgument(maxArtifactsPerUnit)
            .addArgument(maxBytesPerUnit)
            .log();
        return units;
    }
}
