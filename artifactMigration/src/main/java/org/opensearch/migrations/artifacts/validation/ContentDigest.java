package org.opensearch.migrations.artifacts.validation;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * SHA-256 helpers.  Checksums are compared as lowercase hex, with an optional {@code sha256:} prefix
 * stripped.
 */
public final class ContentDigest {
    public static final String ALGORITHM = "SHA-256";
    public static final String PREFIX = "sha256:";

    private ContentDigest() {}

    public static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " is required by every JRE", e);
        }
    }

    public static String toHex(byte[] digest) {
        return HexFormat.of().formatHex(digest);
    }

    public static String of(byte[] content) {
        return toHex(newDigest().digest(content));
    }

    /**
     * @return the bare lowercase hex digest, or null when no checksum was given
     */
    public static String normalize(String checksum) {
        if (checksum == null || checksum.isBlank()) {
            return null;
        }
        var trimmed = checksum.trim().toLowerCase(Locale.ROOT);
        return trimmed.startsWith(PREFIX) ? trimmed.substring(PREFIX.length()) : trimmed;
    }
}
