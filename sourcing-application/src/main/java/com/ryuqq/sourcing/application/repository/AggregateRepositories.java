package com.ryuqq.sourcing.application.repository;

import com.ryuqq.sourcing.core.aggregate.AggregateType;
import com.ryuqq.sourcing.core.aggregate.EventSourcedAggregate;
import com.ryuqq.sourcing.core.model.AggregateId;
import com.ryuqq.sourcing.core.spi.AggregateSource;
import com.ryuqq.sourcing.core.spi.EventBus;
import com.ryuqq.sourcing.core.spi.EventStore;
import com.ryuqq.sourcing.core.spi.PayloadCodec;
import com.ryuqq.sourcing.core.spi.SnapshotStore;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 같은 저장소들을 공유하는 Aggregate 타입별 {@link EventSourcedRepository} 모음.
 *
 * <p>타입 이름(스트림 이름)으로 저장소를 찾습니다. 등록된 모든 저장소의
 * save 범위 밖 조회 경로이기도 하므로, 핸들러는 다른 타입의 Aggregate도 읽을 수 있습니다.</p>
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public class AggregateRepositories implements AggregateSource {

    private final EventStore eventStore;
    private final SnapshotStore snapshotStore;
    private final PayloadCodec codec;
    private final EventBus eventBus;
    private final Clock clock;

    private final Map<String, EventSourcedRepository<?>> byName = new ConcurrentHashMap<>();
    private final Map<Class<?>, AggregateSource> byClass = new ConcurrentHashMap<>();

    public AggregateRepositories(
        EventStore eventStore,
        SnapshotStore snapshotStore,
        PayloadCodec codec,
        EventBus eventBus,
        Clock clock
    ) {
        if (eventStore == null || snapshotStore == null || codec == null || eventBus == null || clock == null) {
            throw new IllegalArgumentException("eventStore, snapshotStore, codec, eventBus and clock cannot be null");
        }
        this.eventStore = eventStore;
        this.snapshotStore = snapshotStore;
        this.codec = codec;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    /**
     * Aggregate 타입 등록.
     *
     * @param aggregateType 등록할 타입
     * @return 해당 타입의 저장소
     * @throws IllegalArgumentException 같은 이름이 이미 등록된 경우
     */
    public synchronized <A extends EventSourcedAggregate<A>> EventSourcedRepository<A> register(
        AggregateType<A> aggregateType
    ) {
        if (aggregateType == null) {
            throw new IllegalArgumentException("aggregateType cannot be null");
        }
        if (byName.containsKey(aggregateType.name())) {
            throw new IllegalArgumentException("Aggregate type name already registered: " + aggregateType.name());
        }
        DefaultEventSourcedRepository<A> repository = new DefaultEventSourcedRepository<>(
            aggregateType, eventStore, snapshotStore, codec, eventBus, clock, this
        );
        byName.put(aggregateType.name(), repository);
        byClass.put(aggregateType.aggregateClass(), repository);
        return repository;
    }

    /**
     * 타입 이름으로 저장소 조회.
     *
     * @param aggregateTypeName 타입 이름
     * @return 저장소 (없으면 empty)
     */
    public Optional<EventSourcedRepository<?>> repository(String aggregateTypeName) {
        return Optional.ofNullable(byName.get(aggregateTypeName));
    }

    @Override
    public <A extends EventSourcedAggregate<A>> Optional<A> aggregate(Class<A> type, AggregateId id) {
        AggregateSource repository = byClass.get(type);
        if (repository == null) {
            return Optional.empty();
        }
        return repository.aggregate(type, id);
    }
}
