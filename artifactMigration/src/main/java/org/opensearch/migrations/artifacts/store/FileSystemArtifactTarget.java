package org.opensearch.migrations.artifacts.store;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.DigestInputStream;
import java.util.Map;

import org.opensearch.migrations.artifacts.validation.ContentDigest;

import lombok.extern.slf4j.Slf4j;

/**
 * Writes artifacts below a directory.  Content lands in a temporary sibling file first and is moved into
 * place, so a reader never sees a partial artifact and a repeated write simply replaces it.
 */
@Slf4j
public class FileSystemArtifactTarget implements ArtifactTarget {
    private final Path root;

    public FileSystemArtifactTarget(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public WriteConfirmation write(String identity, InputStream content, long sizeBytes, Map<String, String> metadata)
        throws IOException {
        var destination = FileSystemArtifactSource.resolve(root, identity);
        Files.createDirectories(destination.getParent());
        var temp = Files.createTempFile(destination.getParent(), ".incoming-", ".tmp");
        try {
            var digest = ContentDigest.newDigest();
            long written;
            try (var in = new DigestInputStream(content, digest)) {
                written = Files.copy(in, temp, StandardCopyOption.REPLACE_EXISTING);
            }
            Files.move(temp, destination, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.atDebug().setMessage("Wrote {} ({} bytes)").addArgument(destination).addArgument(written).log();
            return new WriteConfirmation(ContentDigest.toHex(digest.digest()), written);
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
