package com.ryuqq.sourcing.core.spi;

import com.ryuqq.sourcing.core.event.StoredEvent;
import com.ryuqq.sourcing.core.model.AggregateId;

import java.util.List;
import java.util.Optional;

/**
 * Append-only event storage SPI.
 *
 * <p>The event store is the single arbiter of "who committed first" for a stream. Appends
 * use atomic insert-if-absent semantics on (aggregateId, sequenceNumber), typically a
 * unique constraint, so that two writers racing on the same position never overwrite
 * each other.</p>
 *
 * <p><strong>Logical layout:</strong></p>
 * <pre>
 * events(aggregate_id, sequence_number, stream_name, type, body, timestamp, actor, etag)
 * PRIMARY KEY (aggregate_id, sequence_number)
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: all methods may be called concurrently from several workers</li>
 *   <li>Atomic batches: {@link #appendAll(List)} writes every event or none</li>
 *   <li>Ordered reads: events are returned in ascending sequence order</li>
 * </ul>
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public interface EventStore {

    /**
     * Appends a batch of events atomically.
     *
     * <p>Each event's sequence number is its expected position in the stream. If any position
     * is already taken, nothing from the batch is written and the first colliding pair is
     * returned as {@link AppendResult.SequenceConflict}.</p>
     *
     * @param events events to append, ascending by sequence number (may span several streams)
     * @return append result
     * @throws IllegalArgumentException if events is null
     */
    AppendResult appendAll(List<StoredEvent> events);

    /**
     * Reads events of one stream within the query bounds, ascending by sequence number.
     *
     * @param query stream and bounds
     * @return matching events (empty if the stream does not exist)
     * @throws IllegalArgumentException if query is null
     */
    List<StoredEvent> read(EventStreamQuery query);

    /**
     * Point lookup of a single event.
     *
     * @param aggregateId stream identifier
     * @param sequenceNumber position
     * @return the event if present
     */
    Optional<StoredEvent> find(AggregateId aggregateId, long sequenceNumber);

    /**
     * Highest committed sequence number of a stream.
     *
     * @param aggregateId stream identifier
     * @return highest sequence number, 0 if the stream does not exist
     */
    long latestSequenceNumber(AggregateId aggregateId);
}
