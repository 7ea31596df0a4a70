package org.opensearch.migrations.artifacts.store;

import lombok.Value;

/** What the target reports having stored. */
@Value
public class WriteConfirmation {
    String checksum;
    long sizeBytes;
}
