package com.ryuqq.sourcing.core.event;

import com.ryuqq.sourcing.core.spi.AggregateSource;

/**
 * Handler with side effects that reacts to published events of one data type.
 *
 * <p>Consequenters run synchronously while the repository publishes a save. The supplied
 * {@link AggregateSource} returns the just-saved instance without reloading it.</p>
 *
 * <pre>
 * Consequenter&lt;Order.Placed&gt; shipping = Consequenter.of(Order.Placed.class, (event, source) -&gt; {
 *     Order order = source.aggregate(Order.class, event.aggregateId()).orElseThrow();
 *     ...
 * });
 * </pre>
 *
 * @param <T> event data type
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public interface Consequenter<T> {

    /**
     * Event data type this consequenter reacts to.
     *
     * @return data class
     */
    Class<T> eventDataType();

    /**
     * Reacts to a committed event.
     *
     * @param event the committed event
     * @param source access to aggregates, scoped to the publishing save where applicable
     */
    void haveConsequences(DomainEvent<T> event, AggregateSource source);

    /**
     * Creates a consequenter from a lambda.
     *
     * @param type event data type
     * @param handler handler body
     * @param <T> event data type
     * @return consequenter
     */
    static <T> Consequenter<T> of(Class<T> type, Handler<T> handler) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        return new Consequenter<>() {
            @Override
            public Class<T> eventDataType() {
                return type;
            }

            @Override
            public void haveConsequences(DomainEvent<T> event, AggregateSource source) {
                handler.handle(event, source);
            }
        };
    }

    /**
     * Lambda shape for {@link #of(Class, Handler)}.
     *
     * @param <T> event data type
     */
    @FunctionalInterface
    interface Handler<T> {
        void handle(DomainEvent<T> event, AggregateSource source);
    }
}
