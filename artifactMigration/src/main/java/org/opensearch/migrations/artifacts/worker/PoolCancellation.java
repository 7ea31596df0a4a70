package org.opensearch.migrations.artifacts.worker;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import lombok.extern.slf4j.Slf4j;

/**
 * Cooperative stop signals shared by every pool of one run segment.  Workers poll them at step
 * boundaries; nothing is interrupted.
 *
 * <p>A pause ({@link #cancel()}) makes in-flight artifacts roll back and stops dispatch.  A systemic
 * failure ({@link #haltDispatch(String)}) only stops dispatch: artifacts already in flight finish.
 */
@Slf4j
public class PoolCancellation {
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final AtomicReference<String> systemicCause = new AtomicReference<>();

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.atInfo().setMessage("Cancellation requested, workers will stop at the next step boundary").log();
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void haltDispatch(String cause) {
        if (systemicCause.compareAndSet(null, cause)) {
            log.atError().setMessage("Halting dispatch of new artifacts: {}").addArgument(cause).log();
        }
    }

    public boolean isDispatchHalted() {
        return systemicCause.get() != null;
    }

    /** @return the first systemic failure reported, or null */
    public String getSystemicCause() {
        return systemicCause.get();
    }
}
