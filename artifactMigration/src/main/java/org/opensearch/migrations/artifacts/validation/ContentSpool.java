package org.opensearch.migrations.artifacts.validation;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.DigestInputStream;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * A fully-read copy of an artifact's content together with its SHA-256 digest.  Content up to
 * {@code memoryThresholdBytes} stays on the heap; anything larger is moved to a temporary file, which is
 * deleted on {@link #close()}.  The content can be replayed any number of times, so a failed write can be
 * retried without reading the source again.
 */
@Slf4j
public class ContentSpool implements AutoCloseable {
    private static final int BUFFER_SIZE = 64 * 1024;

    private final byte[] inMemory;
    private final Path spillFile;
    @Getter
    private final String checksum;
    @Getter
    private final long size;

    private ContentSpool(byte[] inMemory, Path spillFile, String checksum, long size) {
        this.inMemory = inMemory;
        this.spillFile = spillFile;
        this.checksum = checksum;
        this.size = size;
    }

    /**
     * Drain {@code content} into a new spool.  The stream is closed by this method.
     */
    public static ContentSpool fill(InputStream content, long memoryThresholdBytes) throws IOException {
        var digest = ContentDigest.newDigest();
        var buffer = new ByteArrayOutputStream();
        Path spill = null;
        OutputStream sink = buffer;
        long total = 0;
        try (var in = new DigestInputStream(content, digest)) {
            var chunk = new byte[BUFFER_SIZE];
            int read;
            while ((read = in.read(chunk)) != -1) {
                total += read;
                if (spill == null && total > memoryThresholdBytes) {
                    spill = Files.createTempFile("artifact-spool-", ".bin");
                    sink = Files.newOutputStream(spill);
                    buffer.writeTo(sink);
                    buffer = null;
                    log.atDebug().setMessage("Spooling content larger than {} bytes to {}")
                        .addArgument(memoryThresholdBytes).addArgument(spill).log();
                }
                sink.write(chunk, 0, read);
            }
        } catch (IOException | RuntimeException e) {
            if (spill != null) {
                sink.close();
                Files.deleteIfExists(spill);
            }
            throw e;
        }
        if (spill != null) {
            sink.close();
        }
        var hex = ContentDigest.toHex(digest.digest());
        return new ContentSpool(spill == null ? buffer.toByteArray() : null, spill, hex, total);
    }

    public InputStream openStream() throws IOException {
        return spillFile == null ? new ByteArrayInputStream(inMemory) : Files.newInputStream(spillFile);
    }

    public boolean isSpilledToDisk() {
        return spillFile != null;
    }

    @Override
    public void close() throws IOException {
        if (spillFile != null) {
            Files.deleteIfExists(spillFile);
        }
    }
}
