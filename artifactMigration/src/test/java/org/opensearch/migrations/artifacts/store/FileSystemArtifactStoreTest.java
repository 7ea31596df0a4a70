package org.opensearch.migrations.artifacts.store;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import org.opensearch.migrations.artifacts.errors.ArtifactNotFoundException;
import org.opensearch.migrations.artifacts.errors.MalformedRequestException;
import org.opensearch.migrations.artifacts.validation.ContentDigest;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FileSystemArtifactStoreTest {

    @TempDir
    Path sourceDir;
    @TempDir
    Path targetDir;

    private void writeSource(String relative, String content) throws Exception {
        var file = sourceDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    @Test
    void listingIsSortedAndUsesForwardSlashes() throws Exception {
        writeSource("pkg/b/2.0/b.jar", "bbbb");
        writeSource("pkg/a/1.0/a.jar", "aa");
        writeSource("index.json", "{}");

        var listing = new FileSystemArtifactSource(sourceDir).list();

        assertThat(listing.stream().map(ArtifactDescriptor::getIdentity).collect(Collectors.toList()),
            contains("index.json", "pkg/a/1.0/a.jar", "pkg/b/2.0/b.jar"));
        assertEquals(2, listing.get(1).getSizeBytes());
        assertNull(listing.get(1).getChecksum());
    }

    @Test
    void estimateAddsUpFileSizes() throws Exception {
        writeSource("a", "12345");
        writeSource("nested/b", "123");

        assertEquals(8, new FileSystemArtifactSource(sourceDir).estimateTotalBytes().getAsLong());
    }

    @Test
    void readingAMissingArtifactFails() {
        var source = new FileSystemArtifactSource(sourceDir);
        assertThrows(ArtifactNotFoundException.class, () -> source.read("gone.jar"));
    }

    @Test
    void identitiesMayNotEscapeTheRoot() {
        var source = new FileSystemArtifactSource(sourceDir);
        var target = new FileSystemArtifactTarget(targetDir);
        assertThrows(MalformedRequestException.class, () -> source.read("../outside"));
        assertThrows(MalformedRequestException.class,
            () -> target.write("../../etc/passwd", new ByteArrayInputStream(new byte[0]), 0, Map.of()));
    }

    @Test
    void writeConfirmsWhatWasStored() throws Exception {
        var content = "artifact bytes".getBytes(StandardCharsets.UTF_8);
        var target = new FileSystemArtifactTarget(targetDir);

        var confirmation = target.write("deep/path/x.bin", new ByteArrayInputStream(content), content.length, Map.of());

        assertEquals(ContentDigest.of(content), confirmation.getChecksum());
        assertEquals(content.length, confirmation.getSizeBytes());
        assertArrayEquals(content, Files.readAllBytes(targetDir.resolve("deep/path/x.bin")));
    }

    @Test
    void repeatedWriteReplacesWithoutLeavingTemporaryFiles() throws Exception {
        var target = new FileSystemArtifactTarget(targetDir);
        var content = "same".getBytes(StandardCharsets.UTF_8);
        target.write("x.bin", new ByteArrayInputStream(content), 4, Map.of());
        target.write("x.bin", new ByteArrayInputStream(content), 4, Map.of());

        try (var files = Files.list(targetDir)) {
            assertThat(files.map(p -> p.getFileName().toString()).collect(Collectors.toList()), contains("x.bin"));
        }
    }

    @Test
    void sourceContentRoundTripsThroughTheTarget() throws Exception {
        writeSource("lib/c.tgz", "compressed-ish");
        var source = new FileSystemArtifactSource(sourceDir);
        var target = new FileSystemArtifactTarget(targetDir);

        try (var read = source.read("lib/c.tgz")) {
            assertEquals(14L, read.getDeclaredSize());
            target.write(read.getIdentity(), read.getContent(), read.getDeclaredSize(), read.getMetadata());
        }

        assertEquals("compressed-ish", Files.readString(targetDir.resolve("lib/c.tgz")));
    }
}
