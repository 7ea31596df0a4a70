package org.opensearch.migrations.artifacts.checkpoint;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Process-local checkpoint store.  The conditional write is an atomic {@link ConcurrentMap#compute}, which
 * is enough for every worker inside one JVM.  State does not survive a restart of the process.
 */
public class InMemoryCheckpointStore implements CheckpointStore {

    private record Key(String runId, String identity) {}

    private final ConcurrentMap<Key, TransferRecord> records = new ConcurrentHashMap<>();

    @Override
    public Optional<TransferRecord> getRecord(String runId, String identity) {
        return Optional.ofNullable(records.get(new Key(runId, identity)));
    }

    @Override
    public void putRecord(String runId, TransferRecord record, TransferState expectedPriorState)
        throws CheckpointConflictException {
        if (!TransferState.isAllowedTransition(expectedPriorState, record.getState())) {
            throw new IllegalArgumentException("Transition " + expectedPriorState + " -> " + record.getState()
                + " is not allowed for " + record.getIdentity());
        }
        var observed = new AtomicReference<TransferState>();
        var won = new AtomicBoolean();
        records.compute(new Key(runId, record.getIdentity()), (k, current) -> {
            observed.set(current == null ? null : current.getState());
            if (!CheckpointStore.matchesExpected(current, record, expectedPriorState)) {
                return current;
            }
            won.set(true);
            return record;
        });
        if (!won.get()) {
            throw new CheckpointConflictException(record.getIdentity(), expectedPriorState, observed.get());
        }
    }

    @Override
    public Set<String> listByState(String runId, TransferState state) {
        return records.entrySet().stream()
            .filter(e -> e.getKey().runId().equals(runId) && e.getValue().getState() == state)
            .map(e -> e.getKey().identity())
            .collect(Collectors.toSet());
    }

    @Override
    public List<TransferRecord> listRecords(String runId) {
        return records.entrySet().stream()
            .filter(e -> e.getKey().runId().equals(runId))
            .map(Map.Entry::getValue)
            .sorted(Comparator.comparing(TransferRecord::getIdentity))
            .collect(Collectors.toList());
    }

    /** Drop every record of a run. */
    public void purge(String runId) {
        records.keySet().removeIf(k -> k.runId().equals(runId));
    }
}
