package com.ryuqq.sourcing.core.spi;

import com.ryuqq.sourcing.core.aggregate.EventSourcedAggregate;
import com.ryuqq.sourcing.core.model.AggregateId;

import java.util.Optional;

/**
 * Access to aggregate instances for event subscribers.
 *
 * <p>While a save is publishing, the source returns the just-saved in-memory instance
 * instead of reloading it from storage.</p>
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface AggregateSource {

    /**
     * Looks up an aggregate.
     *
     * @param type aggregate class
     * @param id aggregate identifier
     * @param <A> aggregate type
     * @return the aggregate, empty if it does not exist
     */
    <A extends EventSourcedAggregate<A>> Optional<A> aggregate(Class<A> type, AggregateId id);
}
