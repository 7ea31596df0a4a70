package org.opensearch.migrations.artifacts.store;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.OptionalLong;
import java.util.stream.Collectors;

import org.opensearch.migrations.artifacts.errors.ArtifactNotFoundException;
import org.opensearch.migrations.artifacts.errors.MalformedRequestException;

import lombok.extern.slf4j.Slf4j;

/**
 * Every regular file under a directory is an artifact; its identity is the path relative to that
 * directory with {@code /} separators.  No checksums are declared, so they are computed on read.
 */
@Slf4j
public class FileSystemArtifactSource implements ArtifactSource {
    private final Path root;

    public FileSystemArtifactSource(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public List<ArtifactDescriptor> list() throws IOException {
        try (var files = Files.walk(root)) {
            var listed = files.filter(Files::isRegularFile)
                .map(this::describe)
                .sorted(Comparator.comparing(ArtifactDescriptor::getIdentity))
                .collect(Collectors.toList());
            log.atInfo().setMessage("Listed {} artifacts under {}").addArgument(listed::size).addArgument(root).log();
            return listed;
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    private ArtifactDescriptor describe(Path file) {
        try {
            return ArtifactDescriptor.of(identityOf(file), Files.size(file), null);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private String identityOf(Path file) {
        return root.relativize(file).toString().replace(file.getFileSystem().getSeparator(), "/");
    }

    @Override
    public SourceArtifact read(String identity) throws IOException {
        var file = resolve(root, identity);
        try {
            var size = Files.size(file);
            return SourceArtifact.builder()
                .identity(identity)
                .content(Files.newInputStream(file))
                .declaredSize(size)
                .build();
        } catch (NoSuchFileException e) {
            throw new ArtifactNotFoundException(identity);
        }
    }

    @Override
    public OptionalLong estimateTotalBytes() {
        try (var files = Files.walk(root)) {
            return OptionalLong.of(files.filter(Files::isRegularFile).mapToLong(f -> f.toFile().length()).sum());
        } catch (IOException e) {
            log.atWarn().setCause(e).setMessage("Could not estimate the size of {}").addArgument(root).log();
            return OptionalLong.empty();
        }
    }

    static Path resolve(Path root, String identity) {
        var resolved = root.resolve(identity).normalize();
        if (!resolved.startsWith(root) || resolved.equals(root)) {
            throw new MalformedRequestException("Identity escapes the store root: " + identity);
        }
        return resolved;
    }
}
