package org.opensearch.migrations.artifacts.checkpoint;

import java.time.Clock;
import java.util.List;

import lombok.extern.slf4j.Slf4j;

/**
 * Crash recovery for a run's records.  A worker that died mid-transfer leaves its record
 * {@link TransferState#IN_PROGRESS} (or {@link TransferState#VALIDATED} if it died just before the commit
 * write); once the lease on such a record has expired it is returned to {@link TransferState#PENDING} so
 * that the next attempt can claim it.  Records under a live lease belong to a worker that may still be
 * running, possibly in another process, and are left alone.
 */
@Slf4j
public class CheckpointRecovery {
    private static final List<TransferState> IN_FLIGHT_STATES =
        List.of(TransferState.IN_PROGRESS, TransferState.VALIDATED);

    private final CheckpointStore store;
    private final Clock clock;

    public CheckpointRecovery(CheckpointStore store) {
        this(store, Clock.systemUTC());
    }

    public CheckpointRecovery(CheckpointStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Records that change while being re-queued are left alone: some other writer owns them now.
     *
     * @return the number of records re-queued
     */
    public int requeueInFlight(String runId) throws CheckpointStoreException {
        int requeued = 0;
        int leased = 0;
        var now = clock.instant();
        for (var state : IN_FLIGHT_STATES) {
            for (var identity : store.listByState(runId, state)) {
                var current = store.getRecord(runId, identity);
                if (current.isEmpty() || current.get().getState() != state) {
                    continue;
                }
                if (!current.get().isLeaseExpired(now)) {
                    leased++;
                    log.atDebug().setMessage("Record for {} is leased by {} until {}, leaving it")
                        .addArgument(identity)
                        .addArgument(current.get()::getLeaseOwner)
                        .addArgument(current.get()::getLeaseExpiresAt)
                        .log();
                    continue;
                }
                try {
                    store.putRecord(runId, current.get().withState(TransferState.PENDING).withLeaseExpiresAt(null), state);
                    requeued++;
                } catch (CheckpointConflictException e) {
                    log.atDebug().setMessage("Record for {} changed while re-queueing, leaving it: {}")
                        .addArgument(identity)
                        .addArgument(e::getMessage)
                        .log();
                }
            }
        }
        if (requeued > 0 || leased > 0) {
            log.atInfo().setMessage("Re-queued {} in-flight records of run {}, {} still under a live lease")
                .addArgument(requeued).addArgument(runId).addArgument(leased).log();
        }
        return requeued;
    }
}
