package com.ryuqq.sourcing.core.spi;

import com.ryuqq.sourcing.core.event.StoredEvent;

import java.util.List;

/**
 * Result of {@link EventStore#appendAll(List)}.
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public sealed interface AppendResult permits AppendResult.Appended, AppendResult.SequenceConflict {

    /**
     * Every event of the batch was written.
     *
     * @param events the written events
     */
    record Appended(List<StoredEvent> events) implements AppendResult {

        public Appended {
            events = events == null ? List.of() : List.copyOf(events);
        }
    }

    /**
     * A position of the batch was already taken; nothing was written.
     *
     * @param existing the event already stored at the position
     * @param attempted the event that tried to take the position
     */
    record SequenceConflict(StoredEvent existing, StoredEvent attempted) implements AppendResult {

        public SequenceConflict {
            if (existing == null || attempted == null) {
                throw new IllegalArgumentException("existing and attempted cannot be null");
            }
        }
    }
}
