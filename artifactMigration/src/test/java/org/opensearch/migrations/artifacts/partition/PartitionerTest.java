package org.opensearch.migrations.artifacts.partition;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import org.opensearch.migrations.artifacts.store.ArtifactDescriptor;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PartitionerTest {
    private final Partitioner partitioner = new Partitioner();

    private static List<ArtifactDescriptor> artifacts(long... sizes) {
        return IntStream.range(0, sizes.length)
            .mapToObj(i -> ArtifactDescriptor.of("a" + i, sizes[i], null))
            .collect(Collectors.toList());
    }

    private static List<List<String>> identities(List<WorkUnit> units) {
        return units.stream()
            .map(u -> u.getArtifacts().stream().map(ArtifactDescriptor::getIdentity).collect(Collectors.toList()))
            .collect(Collectors.toList());
    }

    @Nested
    class Bounds {

        @Test
        void cutsOnArtifactCount() {
            var units = partitioner.partition(artifacts(1, 1, 1, 1, 1), 2, Long.MAX_VALUE);
            assertEquals(List.of(List.of("a0", "a1"), List.of("a2", "a3"), List.of("a4")), identities(units));
        }

        @Test
        void cutsBeforeExceedingTheByteBound() {
            var units = partitioner.partition(artifacts(40, 40, 30, 10), 100, 100);
            assertEquals(List.of(List.of("a0", "a1"), List.of("a2", "a3")), identities(units));
        }

        @Test
        void unitExactlyAtTheByteBoundIsKept() {
            var units = partitioner.partition(artifacts(50, 50, 1), 100, 100);
            assertEquals(List.of(List.of("a0", "a1"), List.of("a2")), identities(units));
        }

        @Test
        void oversizedArtifactFormsItsOwnUnit() {
            var units = partitioner.partition(artifacts(10, 500, 10), 100, 100);
            assertEquals(List.of(List.of("a0"), List.of("a1"), List.of("a2")), identities(units));
            assertEquals(500, units.get(1).getTotalBytes());
        }

        @Test
        void invalidBoundsAreRejected() {
            assertThrows(IllegalArgumentException.class, () -> partitioner.partition(artifacts(1), 0, 10));
            assertThrows(IllegalArgumentException.class, () -> partitioner.partition(artifacts(1), 1, 0));
        }
    }

    @Test
    void everyArtifactLandsInExactlyOneUnitInListingOrder() {
        var input = artifacts(5, 90, 3, 3, 3, 60, 60, 1, 1, 200, 7);
        var units = partitioner.partition(input, 3, 100);

        var flattened = new ArrayList<ArtifactDescriptor>();
        units.forEach(u -> flattened.addAll(u.getArtifacts()));
        assertEquals(input, flattened);
        for (var unit : units) {
            assertTrue(unit.size() <= 3);
            assertTrue(unit.size() == 1 || unit.getTotalBytes() <= 100);
        }
    }

    @Test
    void sequenceNumbersFollowUnitOrder() {
        var units = partitioner.partition(artifacts(1, 1, 1, 1), 1, 10);
        assertThat(units.stream().map(WorkUnit::getSequence).collect(Collectors.toList()), contains(0, 1, 2, 3));
    }

    @Test
    void partitioningIsDeterministic() {
        var input = artifacts(5, 90, 3, 3, 3, 60, 60);
        assertEquals(partitioner.partition(input, 2, 100), partitioner.partition(input, 2, 100));
    }

    @Test
    void emptyListingGivesNoUnits() {
        assertThat(partitioner.partition(List.of(), 10, 10), empty());
    }
}
