package com.ryuqq.sourcing.adapter.inmemory.store;

import com.ryuqq.sourcing.core.event.StoredEvent;
import com.ryuqq.sourcing.core.model.AggregateId;
import com.ryuqq.sourcing.core.spi.AppendResult;
import com.ryuqq.sourcing.core.spi.EventStore;
import com.ryuqq.sourcing.core.spi.EventStreamQuery;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory implementation of {@link EventStore} SPI for testing and reference purposes.
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>streams:</strong> ConcurrentHashMap&lt;AggregateId, ConcurrentSkipListMap&lt;Long, StoredEvent&gt;&gt;
 *       - one ordered map per stream, keyed by sequence number</li>
 * </ul>
 *
 * <p>Batches are written under a write lock after every position has been checked, so a batch
 * is either fully visible or not at all. Reads take the read lock.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public class InMemoryEventStore implements EventStore {

    private final ConcurrentHashMap<AggregateId, ConcurrentSkipListMap<Long, StoredEvent>> streams =
        new ConcurrentHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public AppendResult appendAll(List<StoredEvent> events) {
        if (events == null) {
            throw new IllegalArgumentException("events cannot be null");
        }
        lock.writeLock().lock();
        try {
            Map<AggregateId, Map<Long, StoredEvent>> batch = new HashMap<>();
            for (StoredEvent event : events) {
                StoredEvent existing = stream(event.aggregateId()).get(event.sequenceNumber());
                if (existing == null) {
                    existing = batch.getOrDefault(event.aggregateId(), Map.of()).get(event.sequenceNumber());
                }
                if (existing != null) {
                    return new AppendResult.SequenceConflict(existing, event);
                }
                batch.computeIfAbsent(event.aggregateId(), id -> new HashMap<>()).put(event.sequenceNumber(), event);
            }
            for (StoredEvent event : events) {
                streams.computeIfAbsent(event.aggregateId(), id -> new ConcurrentSkipListMap<>())
                    .put(event.sequenceNumber(), event);
            }
            return new AppendResult.Appended(events);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<StoredEvent> read(EventStreamQuery query) {
        if (query == null) {
            throw new IllegalArgumentException("query cannot be null");
        }
        lock.readLock().lock();
        try {
            List<StoredEvent> result = new ArrayList<>();
            for (StoredEvent event : stream(query.aggregateId()).tailMap(query.afterSequence(), false).values()) {
                if (query.maxSequence() != null && event.sequenceNumber() > query.maxSequence()) {
                    break;
                }
                if (query.includes(event.sequenceNumber(), event.timestamp())) {
                    result.add(event);
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<StoredEvent> find(AggregateId aggregateId, long sequenceNumber) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(stream(aggregateId).get(sequenceNumber));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long latestSequenceNumber(AggregateId aggregateId) {
        lock.readLock().lock();
        try {
            ConcurrentSkipListMap<Long, StoredEvent> stream = stream(aggregateId);
            return stream.isEmpty() ? 0 : stream.lastKey();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Total number of stored events across all streams. Used for test assertions.
     *
     * @return event count
     */
    public int size() {
        return streams.values().stream().mapToInt(Map::size).sum();
    }

    /**
     * Clears all streams. Used for test cleanup.
     */
    public void clear() {
        lock.writeLock().lock();
        try {
            streams.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private ConcurrentSkipListMap<Long, StoredEvent> stream(AggregateId aggregateId) {
        ConcurrentSkipListMap<Long, StoredEvent> stream = streams.get(aggregateId);
        return stream != null ? stream : new ConcurrentSkipListMap<>();
    }
}
