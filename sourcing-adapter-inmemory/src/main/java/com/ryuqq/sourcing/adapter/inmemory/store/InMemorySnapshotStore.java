package com.ryuqq.sourcing.adapter.inmemory.store;

import com.ryuqq.sourcing.core.aggregate.Snapshot;
import com.ryuqq.sourcing.core.model.AggregateId;
import com.ryuqq.sourcing.core.spi.SnapshotStore;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link SnapshotStore} SPI keeping one (the latest) snapshot per aggregate.
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public class InMemorySnapshotStore implements SnapshotStore {

    private final ConcurrentHashMap<AggregateId, Snapshot> snapshots = new ConcurrentHashMap<>();

    @Override
    public Optional<Snapshot> getLatest(AggregateId aggregateId) {
        if (aggregateId == null) {
            throw new IllegalArgumentException("aggregateId cannot be null");
        }
        return Optional.ofNullable(snapshots.get(aggregateId));
    }

    @Override
    public void put(Snapshot snapshot) {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot cannot be null");
        }
        snapshots.merge(snapshot.aggregateId(), snapshot,
            (current, candidate) -> candidate.version() >= current.version() ? candidate : current);
    }

    /**
     * Clears all snapshots. Used for test cleanup.
     */
    public void clear() {
        snapshots.clear();
    }
}
