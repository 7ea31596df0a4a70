package org.opensearch.migrations.artifacts.ratelimit;

/** One token bucket per remote endpoint. */
public enum Bucket {
    SOURCE,
    TARGET
}
