package com.ryuqq.sourcing.core.spi;

import com.ryuqq.sourcing.core.model.AggregateId;

import java.time.Instant;

/**
 * Bounds of an event stream read.
 *
 * @param aggregateId stream identifier
 * @param afterSequence only events with a greater sequence number (0 reads from the start)
 * @param maxSequence only events up to and including this sequence number (nullable)
 * @param asOf only events with a timestamp at or before this instant (nullable)
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public record EventStreamQuery(AggregateId aggregateId, long afterSequence, Long maxSequence, Instant asOf) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException if aggregateId is null or afterSequence is negative
     */
    public EventStreamQuery {
        if (aggregateId == null) {
            throw new IllegalArgumentException("aggregateId cannot be null");
        }
        if (afterSequence < 0) {
            throw new IllegalArgumentException("afterSequence must be non-negative (current: " + afterSequence + ")");
        }
    }

    public static EventStreamQuery all(AggregateId aggregateId) {
        return new EventStreamQuery(aggregateId, 0, null, null);
    }

    public static EventStreamQuery after(AggregateId aggregateId, long sequenceNumber) {
        return new EventStreamQuery(aggregateId, sequenceNumber, null, null);
    }

    public EventStreamQuery upToSequence(long sequenceNumber) {
        return new EventStreamQuery(aggregateId, afterSequence, sequenceNumber, asOf);
    }

    public EventStreamQuery asOf(Instant instant) {
        return new EventStreamQuery(aggregateId, afterSequence, maxSequence, instant);
    }

    /**
     * Checks whether an event position and timestamp fall within the bounds.
     *
     * @param sequenceNumber event position
     * @param timestamp event timestamp
     * @return true if within bounds
     */
    public boolean includes(long sequenceNumber, Instant timestamp) {
        if (sequenceNumber <= afterSequence) {
            return false;
        }
        if (maxSequence != null && sequenceNumber > maxSequence) {
            return false;
        }
        return asOf == null || !timestamp.isAfter(asOf);
    }
}
