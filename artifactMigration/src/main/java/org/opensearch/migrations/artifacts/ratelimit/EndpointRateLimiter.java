package org.opensearch.migrations.artifacts.ratelimit;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

import org.opensearch.migrations.artifacts.tracing.MigrationObservability;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.extern.slf4j.Slf4j;

/**
 * Token buckets guarding the source and target APIs, shared by every worker of a run.  Blocking in
 * {@link #acquire} is the only pacing the workers have; nothing else throttles them.
 *
 * <p>A bucket configured with a non-positive rate is unlimited.
 */
@Slf4j
public class EndpointRateLimiter {
    private static final Duration ONE_SECOND = Duration.ofSeconds(1);

    private final Map<Bucket, RateLimiter> limiters = new EnumMap<>(Bucket.class);
    private final Duration timeout;
    private final MigrationObservability observability;

    public EndpointRateLimiter(double sourceTokensPerSecond,
                               double targetTokensPerSecond,
                               Duration timeout,
                               MigrationObservability observability) {
        this.timeout = timeout;
        this.observability = observability;
        addBucket(Bucket.SOURCE, sourceTokensPerSecond);
        addBucket(Bucket.TARGET, targetTokensPerSecond);
    }

    public static EndpointRateLimiter unlimited() {
        return new EndpointRateLimiter(0, 0, ONE_SECOND, MigrationObservability.NOOP);
    }

    private void addBucket(Bucket bucket, double tokensPerSecond) {
        if (tokensPerSecond <= 0) {
            log.atInfo().setMessage("{} bucket is unlimited").addArgument(bucket).log();
            return;
        }
        limiters.put(bucket, RateLimiter.of("artifact-migration-" + bucket.name().toLowerCase(),
            configFor(tokensPerSecond, timeout)));
    }

    /**
     * Hands out whole tokens per period and stretches the period so the effective rate never exceeds
     * {@code tokensPerSecond}: 2.5/s becomes 2 tokens every 800ms, 0.5/s one token every 2s.
     */
    static RateLimiterConfig configFor(double tokensPerSecond, Duration timeout) {
        int limitForPeriod = (int) Math.max(1, Math.floor(tokensPerSecond));
        var refreshPeriod =
            Duration.ofNanos((long) Math.ceil(limitForPeriod * ONE_SECOND.toNanos() / tokensPerSecond));
        return RateLimiterConfig.custom()
            .limitForPeriod(limitForPeriod)
            .limitRefreshPeriod(refreshPeriod)
            .timeoutDuration(timeout)
            .build();
    }

    /**
     * Block until {@code cost} tokens are available.  Costs larger than one period's worth of tokens are
     * taken in period-sized pieces, each bounded by the timeout.
     *
     * @throws RateLimitTimeoutException if the tokens were not granted within the timeout
     */
    public void acquire(Bucket bucket, int cost) {
        if (cost < 1) {
            throw new IllegalArgumentException("cost must be >= 1, got " + cost);
        }
        var limiter = limiters.get(bucket);
        if (limiter == null) {
            return;
        }
        int perPeriod = limiter.getRateLimiterConfig().getLimitForPeriod();
        long startNanos = System.nanoTime();
        try {
            int remaining = cost;
            while (remaining > 0) {
                int piece = Math.min(remaining, perPeriod);
                if (!limiter.acquirePermission(piece)) {
                    throw new RateLimitTimeoutException(bucket, cost, timeout);
                }
                remaining -= piece;
            }
        } finally {
            observability.onRateLimiterWait(bucket, Duration.ofNanos(System.nanoTime() - startNanos));
        }
    }

    public boolean isLimited(Bucket bucket) {
        return limiters.containsKey(bucket);
    }
}
