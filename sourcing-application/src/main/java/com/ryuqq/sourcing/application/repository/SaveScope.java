package com.ryuqq.sourcing.application.repository;

import com.ryuqq.sourcing.core.aggregate.EventSourcedAggregate;
import com.ryuqq.sourcing.core.model.AggregateId;
import com.ryuqq.sourcing.core.spi.AggregateSource;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 한 번의 save 호출 동안만 유효한 Aggregate 캐시.
 *
 * <p>save 중 동기적으로 호출되는 핸들러는 방금 저장된 인스턴스를 다시 읽지 않고 받습니다.
 * 캐시에 없거나 scope가 닫힌 뒤에는 fallback으로 조회합니다.</p>
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public final class SaveScope implements AggregateSource, AutoCloseable {

    private final Map<AggregateId, EventSourcedAggregate<?>> aggregates = new ConcurrentHashMap<>();
    private final AggregateSource fallback;
    private volatile boolean closed;

    /**
     * @param fallback 캐시에 없을 때 사용할 조회 경로
     * @throws IllegalArgumentException fallback이 null인 경우
     */
    public SaveScope(AggregateSource fallback) {
        if (fallback == null) {
            throw new IllegalArgumentException("fallback cannot be null");
        }
        this.fallback = fallback;
    }

    /**
     * 저장된 인스턴스 등록.
     *
     * @param aggregate 방금 저장된 Aggregate
     */
    public void put(EventSourcedAggregate<?> aggregate) {
        if (aggregate == null) {
            throw new IllegalArgumentException("aggregate cannot be null");
        }
        if (closed) {
            throw new IllegalStateException("SaveScope is already closed");
        }
        aggregates.put(aggregate.id(), aggregate);
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public <A extends EventSourcedAggregate<A>> Optional<A> aggregate(Class<A> type, AggregateId id) {
        if (!closed) {
            EventSourcedAggregate<?> cached = aggregates.get(id);
            if (type.isInstance(cached)) {
                return Optional.of(type.cast(cached));
            }
        }
        return fallback.aggregate(type, id);
    }

    @Override
    public void close() {
        closed = true;
        aggregates.clear();
    }
}
