package org.opensearch.migrations.artifacts.validation;

import java.util.ArrayList;

import lombok.Value;

/**
 * Outcome of comparing observed content against what was expected of it.
 */
public interface ValidationResult {

    boolean isOk();

    static ValidationResult ok() {
        return Ok.INSTANCE;
    }

    /** Which comparison produced the result. */
    enum Phase {
        /** Content read from the source against the source's declaration. */
        PRE_TRANSFER,
        /** The target's confirmation against the content that was sent. */
        POST_TRANSFER
    }

    final class Ok implements ValidationResult {
        static final Ok INSTANCE = new Ok();

        private Ok() {}

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public String toString() {
            return "Ok";
        }
    }

    @Value
    class Mismatch implements ValidationResult {
        Phase phase;
        String expectedChecksum;
        String actualChecksum;
        Long expectedSize;
        long actualSize;

        @Override
        public boolean isOk() {
            return false;
        }

        public boolean isChecksumMismatch() {
            return expectedChecksum != null && !expectedChecksum.equals(actualChecksum);
        }

        public boolean isSizeMismatch() {
            return expectedSize != null && expectedSize != actualSize;
        }

        public String describe() {
            var parts = new ArrayList<String>();
            if (isChecksumMismatch()) {
                parts.add("checksum expected " + expectedChecksum + " but was " + actualChecksum);
            }
            if (isSizeMismatch()) {
                parts.add("size expected " + expectedSize + " but was " + actualSize);
            }
            return phase + ": " + String.join(", ", parts);
        }
    }
}
