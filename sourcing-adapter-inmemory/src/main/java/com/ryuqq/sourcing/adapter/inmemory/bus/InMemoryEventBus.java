package com.ryuqq.sourcing.adapter.inmemory.bus;

import com.ryuqq.sourcing.core.event.Consequenter;
import com.ryuqq.sourcing.core.event.DomainEvent;
import com.ryuqq.sourcing.core.spi.AggregateSource;
import com.ryuqq.sourcing.core.spi.EventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link EventBus} SPI dispatching synchronously to {@link Consequenter}s.
 *
 * <p>Every published event is recorded for test assertions. A consequenter failure is logged and
 * recorded but does not stop delivery to the remaining consequenters: the event is already
 * committed when it is published.</p>
 *
 * <pre>
 * InMemoryEventBus bus = new InMemoryEventBus();
 * bus.subscribe(Consequenter.of(Order.Placed.class, (event, source) -&gt; ...));
 * </pre>
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public class InMemoryEventBus implements EventBus {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventBus.class);

    private final List<Consequenter<?>> consequenters = new CopyOnWriteArrayList<>();
    private final List<DomainEvent<?>> published = new CopyOnWriteArrayList<>();
    private final List<Throwable> failures = new CopyOnWriteArrayList<>();

    /**
     * Registers a consequenter.
     *
     * @param consequenter consequenter to register
     * @throws IllegalArgumentException if consequenter is null
     */
    public void subscribe(Consequenter<?> consequenter) {
        if (consequenter == null) {
            throw new IllegalArgumentException("consequenter cannot be null");
        }
        consequenters.add(consequenter);
    }

    @Override
    public void publish(DomainEvent<?> event, AggregateSource source) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        published.add(event);
        for (Consequenter<?> consequenter : consequenters) {
            if (consequenter.eventDataType().isInstance(event.data())) {
                deliver(consequenter, event, source);
            }
        }
    }

    /**
     * Events published so far, in publication order.
     *
     * @return published events
     */
    public List<DomainEvent<?>> publishedEvents() {
        return new ArrayList<>(published);
    }

    /**
     * Consequenter failures recorded so far.
     *
     * @return failures
     */
    public List<Throwable> failures() {
        return new ArrayList<>(failures);
    }

    /**
     * Clears recorded events and failures (subscriptions are kept).
     */
    public void clear() {
        published.clear();
        failures.clear();
    }

    private <T> void deliver(Consequenter<T> consequenter, DomainEvent<?> event, AggregateSource source) {
        try {
            consequenter.haveConsequences(event.withDataAs(consequenter.eventDataType()), source);
        } catch (RuntimeException e) {
            log.error("Consequenter for {} failed on {} #{}",
                consequenter.eventDataType().getSimpleName(), event.aggregateId(), event.sequenceNumber(), e);
            failures.add(e);
        }
    }
}
