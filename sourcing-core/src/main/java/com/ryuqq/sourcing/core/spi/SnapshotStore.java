package com.ryuqq.sourcing.core.spi;

import com.ryuqq.sourcing.core.aggregate.Snapshot;
import com.ryuqq.sourcing.core.model.AggregateId;

import java.util.Optional;

/**
 * Snapshot storage SPI.
 *
 * <p>Keeps the latest known snapshot per aggregate. Implementations may store a single
 * row per aggregate or append every snapshot and answer "latest by version".</p>
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public interface SnapshotStore {

    /**
     * Latest snapshot of an aggregate.
     *
     * @param aggregateId aggregate identifier
     * @return the snapshot with the highest version, if any
     */
    Optional<Snapshot> getLatest(AggregateId aggregateId);

    /**
     * Stores a snapshot. A snapshot older than the stored one never replaces it.
     *
     * @param snapshot snapshot to store
     * @throws IllegalArgumentException if snapshot is null
     */
    void put(Snapshot snapshot);
}
