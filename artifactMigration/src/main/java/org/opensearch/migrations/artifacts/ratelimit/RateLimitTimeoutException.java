package org.opensearch.migrations.artifacts.ratelimit;

import java.time.Duration;

import org.opensearch.migrations.artifacts.errors.MigrationException;

import lombok.Getter;

@Getter
public class RateLimitTimeoutException extends MigrationException {
    private final Bucket bucket;

    public RateLimitTimeoutException(Bucket bucket, int cost, Duration timeout) {
        super("Timed out after " + timeout + " waiting for " + cost + " permit(s) from the " + bucket + " bucket");
        this.bucket = bucket;
    }
}
