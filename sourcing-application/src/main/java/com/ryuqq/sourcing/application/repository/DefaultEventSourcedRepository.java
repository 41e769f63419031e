package com.ryuqq.sourcing.application.repository;

import com.ryuqq.sourcing.core.aggregate.AggregateType;
import com.ryuqq.sourcing.core.aggregate.EventSourcedAggregate;
import com.ryuqq.sourcing.core.aggregate.Snapshot;
import com.ryuqq.sourcing.core.event.DomainEvent;
import com.ryuqq.sourcing.core.event.StoredEvent;
import com.ryuqq.sourcing.core.model.AggregateId;
import com.ryuqq.sourcing.core.outcome.ConcurrencyException;
import com.ryuqq.sourcing.core.outcome.SaveResult;
import com.ryuqq.sourcing.core.spi.AggregateSource;
import com.ryuqq.sourcing.core.spi.AppendResult;
import com.ryuqq.sourcing.core.spi.EventBus;
import com.ryuqq.sourcing.core.spi.EventStore;
import com.ryuqq.sourcing.core.spi.EventStreamQuery;
import com.ryuqq.sourcing.core.spi.PayloadCodec;
import com.ryuqq.sourcing.core.spi.PayloadDecodingException;
import com.ryuqq.sourcing.core.spi.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link EventSourcedRepository} 기본 구현.
 *
 * <p><strong>저장 흐름:</strong></p>
 * <pre>
 * save(aggregate)
 *   ↓
 * pendingEvents → StoredEvent (body = codec.encode(data))
 *   ↓
 * eventStore.appendAll (원자적, 위치 충돌 시 SequenceConflict)
 *   ├─ Conflict → SaveResult.Conflict (발행 없음)
 *   └─ Appended → markChangesAsCommitted
 *                   ↓
 *                 SaveScope 열기 → 이벤트 오름차순 발행 → SaveScope 닫기
 *                   ↓
 *                 SaveResult.Saved
 * </pre>
 *
 * <p>스레드 안전합니다. 다만 하나의 Aggregate 인스턴스를 여러 스레드가 공유해서는 안 됩니다.</p>
 *
 * @param <A> Aggregate 타입
 * @author Sourcing Team
 * @since 1.0.0
 */
public class DefaultEventSourcedRepository<A extends EventSourcedAggregate<A>>
    implements EventSourcedRepository<A>, AggregateSource {

    private static final Logger log = LoggerFactory.getLogger(DefaultEventSourcedRepository.class);

    private final AggregateType<A> aggregateType;
    private final EventStore eventStore;
    private final SnapshotStore snapshotStore;
    private final PayloadCodec codec;
    private final EventBus eventBus;
    private final Clock clock;
    private final AggregateSource consequenceSource;
    private final AggregateRehydrator<A> rehydrator;

    /**
     * 단일 타입 저장소 생성. 핸들러의 조회는 이 저장소가 처리합니다.
     */
    public DefaultEventSourcedRepository(
        AggregateType<A> aggregateType,
        EventStore eventStore,
        SnapshotStore snapshotStore,
        PayloadCodec codec,
        EventBus eventBus,
        Clock clock
    ) {
        this(aggregateType, eventStore, snapshotStore, codec, eventBus, clock, null);
    }

    /**
     * 생성자.
     *
     * @param aggregateType Aggregate 타입
     * @param eventStore 이벤트 저장소
     * @param snapshotStore 스냅샷 저장소
     * @param codec 본문 코덱
     * @param eventBus 커밋된 이벤트 발행 대상
     * @param clock 스냅샷 생성 시각용 시계
     * @param consequenceSource save 범위 밖 조회 경로 (null이면 이 저장소)
     * @throws IllegalArgumentException consequenceSource 이외의 인자가 null인 경우
     */
    public DefaultEventSourcedRepository(
        AggregateType<A> aggregateType,
        EventStore eventStore,
        SnapshotStore snapshotStore,
        PayloadCodec codec,
        EventBus eventBus,
        Clock clock,
        AggregateSource consequenceSource
    ) {
        if (aggregateType == null) {
            throw new IllegalArgumentException("aggregateType cannot be null");
        }
        if (eventStore == null) {
            throw new IllegalArgumentException("eventStore cannot be null");
        }
        if (snapshotStore == null) {
            throw new IllegalArgumentException("snapshotStore cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        if (eventBus == null) {
            throw new IllegalArgumentException("eventBus cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.aggregateType = aggregateType;
        this.eventStore = eventStore;
        this.snapshotStore = snapshotStore;
        this.codec = codec;
        this.eventBus = eventBus;
        this.clock = clock;
        this.consequenceSource = consequenceSource != null ? consequenceSource : this;
        this.rehydrator = new AggregateRehydrator<>(aggregateType, codec);
    }

    @Override
    public AggregateType<A> aggregateType() {
        return aggregateType;
    }

    @Override
    public Optional<A> getLatest(AggregateId id) {
        requireId(id);
        return load(id, snapshotStore.getLatest(id).filter(this::isOwnSnapshot).orElse(null), null);
    }

    @Override
    public Optional<A> getVersion(AggregateId id, long version) {
        requireId(id);
        if (version < 1) {
            throw new IllegalArgumentException("version must be positive (current: " + version + ")");
        }
        return load(id, null, version);
    }

    @Override
    public Optional<A> getAsOfDate(AggregateId id, Instant asOf) {
        requireId(id);
        if (asOf == null) {
            throw new IllegalArgumentException("asOf cannot be null");
        }
        List<StoredEvent> events = eventStore.read(EventStreamQuery.all(id).asOf(asOf));
        return rehydrator.rehydrate(id, events, null);
    }

    @Override
    public SaveResult save(A aggregate) {
        if (aggregate == null) {
            throw new IllegalArgumentException("aggregate cannot be null");
        }
        if (!aggregate.hasPendingEvents()) {
            return new SaveResult.Saved(List.of());
        }
        List<DomainEvent<?>> pending = aggregate.pendingEvents();
        List<StoredEvent> toAppend = new ArrayList<>(pending.size());
        for (DomainEvent<?> event : pending) {
            toAppend.add(toStoredEvent(event));
        }

        AppendResult result = eventStore.appendAll(toAppend);
        if (result instanceof AppendResult.SequenceConflict conflict) {
            ConcurrencyException exception = new ConcurrencyException(conflict.existing(), conflict.attempted());
            log.warn("Save rejected: {}", exception.getMessage());
            return new SaveResult.Conflict(exception);
        }

        aggregate.markChangesAsCommitted();
        log.debug("Saved {} events for {} {} (version={})",
            pending.size(), aggregateType.name(), aggregate.id(), aggregate.version());

        try (SaveScope scope = new SaveScope(consequenceSource)) {
            scope.put(aggregate);
            for (DomainEvent<?> event : pending) {
                eventBus.publish(event, scope);
            }
        }
        return new SaveResult.Saved(pending);
    }

    @Override
    public A refresh(A aggregate) {
        if (aggregate == null) {
            throw new IllegalArgumentException("aggregate cannot be null");
        }
        if (aggregate.hasPendingEvents()) {
            throw new IllegalStateException("Aggregates having pending events cannot be updated.");
        }
        List<StoredEvent> newer = eventStore.read(EventStreamQuery.after(aggregate.id(), aggregate.version()));
        for (StoredEvent event : newer) {
            aggregate.applyHistorical(rehydrator.toDomainEvent(event));
        }
        if (!newer.isEmpty()) {
            log.debug("Refreshed {} {} to version {}", aggregateType.name(), aggregate.id(), aggregate.version());
        }
        return aggregate;
    }

    @Override
    public Snapshot snapshot(A aggregate) {
        if (aggregate == null) {
            throw new IllegalArgumentException("aggregate cannot be null");
        }
        if (!aggregateType.supportsSnapshots()) {
            throw new IllegalStateException(aggregateType.name() + " does not support snapshots");
        }
        if (aggregate.hasPendingEvents()) {
            throw new IllegalStateException("Aggregates having pending events cannot be snapshotted.");
        }
        if (aggregate.version() < 1) {
            throw new IllegalStateException("Cannot snapshot an aggregate without events: " + aggregate.id());
        }
        Snapshot snapshot = new Snapshot(
            aggregate.id(),
            aggregate.version(),
            aggregateType.name(),
            codec.encode(aggregate.captureSnapshotState()),
            aggregate.etags(),
            clock.instant()
        );
        snapshotStore.put(snapshot);
        log.info("Snapshot of {} {} taken at version {}", aggregateType.name(), aggregate.id(), aggregate.version());
        return snapshot;
    }

    /**
     * 이 저장소의 타입에 대해서만 응답합니다.
     */
    @Override
    public <T extends EventSourcedAggregate<T>> Optional<T> aggregate(Class<T> type, AggregateId id) {
        if (type != aggregateType.aggregateClass()) {
            return Optional.empty();
        }
        return getLatest(id).map(type::cast);
    }

    private Optional<A> load(AggregateId id, Snapshot snapshot, Long maxSequence) {
        if (snapshot != null) {
            EventStreamQuery query = EventStreamQuery.after(id, snapshot.version());
            if (maxSequence != null) {
                query = query.upToSequence(maxSequence);
            }
            try {
                return rehydrator.rehydrate(id, eventStore.read(query), snapshot);
            } catch (PayloadDecodingException e) {
                log.warn("Ignoring unreadable snapshot of {} {} at version {}: {}",
                    aggregateType.name(), id, snapshot.version(), e.getMessage());
            }
        }
        EventStreamQuery query = EventStreamQuery.all(id);
        if (maxSequence != null) {
            query = query.upToSequence(maxSequence);
        }
        return rehydrator.rehydrate(id, eventStore.read(query), null);
    }

    private boolean isOwnSnapshot(Snapshot snapshot) {
        if (aggregateType.supportsSnapshots() && aggregateType.name().equals(snapshot.aggregateTypeName())) {
            return true;
        }
        log.warn("Ignoring snapshot of {} typed {} (expected {})",
            snapshot.aggregateId(), snapshot.aggregateTypeName(), aggregateType.name());
        return false;
    }

    private StoredEvent toStoredEvent(DomainEvent<?> event) {
        return new StoredEvent(
            aggregateType.name(),
            event.aggregateId(),
            event.sequenceNumber(),
            event.eventType(),
            codec.encode(event.data()),
            event.timestamp(),
            event.actor(),
            event.etag()
        );
    }

    private static void requireId(AggregateId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
    }
}
