package com.ryuqq.sourcing.core.spi;

import com.ryuqq.sourcing.core.event.DomainEvent;

/**
 * Event publication SPI.
 *
 * <p>The repository publishes each committed event exactly once, in ascending sequence
 * order, after the durable commit. Subscribers invoked synchronously may use the given
 * {@link AggregateSource} to reach the saved aggregate.</p>
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public interface EventBus {

    /**
     * Publishes a committed event.
     *
     * @param event committed event
     * @param source aggregate access scoped to the publishing save
     */
    void publish(DomainEvent<?> event, AggregateSource source);
}
