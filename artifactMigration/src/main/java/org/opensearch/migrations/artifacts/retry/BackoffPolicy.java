package org.opensearch.migrations.artifacts.retry;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

import lombok.Getter;

/**
 * Exponential backoff with bounded jitter.  For attempt {@code n} (1-based) the raw delay is
 * {@code base * factor^(n-1)}; jitter adds up to {@code raw * (factor - 1) / 2}, which is less than the gap
 * to the next raw delay, so delays strictly increase until they reach {@code cap}.
 */
@Getter
public class BackoffPolicy {
    private final Duration base;
    private final double factor;
    private final Duration cap;
    private final DoubleSupplier jitterSource;

    public BackoffPolicy(Duration base, double factor, Duration cap) {
        this(base, factor, cap, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param jitterSource yields values in {@code [0, 1)}
     */
    public BackoffPolicy(Duration base, double factor, Duration cap, DoubleSupplier jitterSource) {
        if (base.isNegative() || base.isZero()) {
            throw new IllegalArgumentException("base delay must be positive, got " + base);
        }
        if (factor < 1.0) {
            throw new IllegalArgumentException("backoff factor must be >= 1, got " + factor);
        }
        if (cap.compareTo(base) < 0) {
            throw new IllegalArgumentException("cap " + cap + " is smaller than the base delay " + base);
        }
        this.base = base;
        this.factor = factor;
        this.cap = cap;
        this.jitterSource = jitterSource;
    }

    public Duration delayFor(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1, got " + attempt);
        }
        double capNanos = cap.toNanos();
        double raw = base.toNanos() * Math.pow(factor, attempt - 1.0);
        if (raw >= capNanos) {
            return cap;
        }
        double jitter = jitterSource.getAsDouble() * raw * (factor - 1) / 2;
        return Duration.ofNanos(Math.round(Math.min(raw + jitter, capNanos)));
    }
}
