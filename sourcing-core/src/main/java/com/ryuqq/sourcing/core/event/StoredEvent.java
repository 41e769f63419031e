package com.ryuqq.sourcing.core.event;

import com.ryuqq.sourcing.core.model.AggregateId;
import com.ryuqq.sourcing.core.model.Payload;

import java.time.Instant;

/**
 * Persisted form of a {@link DomainEvent}.
 *
 * <p>Records are keyed by (aggregateId, sequenceNumber); an {@link com.ryuqq.sourcing.core.spi.EventStore}
 * must reject a second record with the same key.</p>
 *
 * <p><strong>Logical layout:</strong></p>
 * <pre>
 * events(stream_name, aggregate_id, sequence_number, type, body, timestamp, actor, etag)
 * UNIQUE (aggregate_id, sequence_number)
 * </pre>
 *
 * @param streamName aggregate type name that owns the stream
 * @param aggregateId stream identifier
 * @param sequenceNumber position within the stream (1-based)
 * @param eventType event type discriminator
 * @param body serialized event data
 * @param timestamp creation time of the event
 * @param actor originating actor (nullable)
 * @param etag originating command ETag (nullable)
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public record StoredEvent(
    String streamName,
    AggregateId aggregateId,
    long sequenceNumber,
    String eventType,
    Payload body,
    Instant timestamp,
    String actor,
    String etag
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException if a required field is null or sequenceNumber is not positive
     */
    public StoredEvent {
        if (streamName == null || streamName.isBlank()) {
            throw new IllegalArgumentException("streamName cannot be null or blank");
        }
        if (aggregateId == null) {
            throw new IllegalArgumentException("aggregateId cannot be null");
        }
        if (sequenceNumber < 1) {
            throw new IllegalArgumentException("sequenceNumber must be positive (current: " + sequenceNumber + ")");
        }
        if (eventType == null || eventType.isBlank()) {
            throw new IllegalArgumentException("eventType cannot be null or blank");
        }
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
    }
}
