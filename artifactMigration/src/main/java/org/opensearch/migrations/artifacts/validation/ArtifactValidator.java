package org.opensearch.migrations.artifacts.validation;

/**
 * Compares digests and sizes.  Holds no state, so the same inputs always give the same result.
 *
 * <p>A missing expected checksum or size is not a mismatch: the source may not declare one, in which case
 * the digest computed on the first read becomes the reference for the post-transfer check.
 */
public class ArtifactValidator {

    public ValidationResult verify(ValidationResult.Phase phase,
                                   String expectedChecksum,
                                   Long expectedSize,
                                   String actualChecksum,
                                   long actualSize) {
        var expected = ContentDigest.normalize(expectedChecksum);
        var actual = ContentDigest.normalize(actualChecksum);
        boolean checksumMatches = expected == null || expected.equals(actual);
        boolean sizeMatches = expectedSize == null || expectedSize < 0 || expectedSize == actualSize;
        if (checksumMatches && sizeMatches) {
            return ValidationResult.ok();
        }
        return new ValidationResult.Mismatch(phase, expected, actual,
            sizeMatches ? null : expectedSize, actualSize);
    }

    /** Checks raw content, hashing it first. */
    public ValidationResult verifyContent(byte[] content, String expectedChecksum, Long expectedSize) {
        return verify(ValidationResult.Phase.PRE_TRANSFER, expectedChecksum, expectedSize,
            ContentDigest.of(content), content.length);
    }

    public ValidationResult verifySpooled(ContentSpool spool, String expectedChecksum, Long expectedSize) {
        return verify(ValidationResult.Phase.PRE_TRANSFER, expectedChecksum, expectedSize,
            spool.getChecksum(), spool.getSize());
    }
}
