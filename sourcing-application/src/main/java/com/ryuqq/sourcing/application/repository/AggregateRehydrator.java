package com.ryuqq.sourcing.application.repository;

import com.ryuqq.sourcing.core.aggregate.AggregateType;
import com.ryuqq.sourcing.core.aggregate.EventSourcedAggregate;
import com.ryuqq.sourcing.core.aggregate.Snapshot;
import com.ryuqq.sourcing.core.event.DomainEvent;
import com.ryuqq.sourcing.core.event.StoredEvent;
import com.ryuqq.sourcing.core.event.UnrecognizedEvent;
import com.ryuqq.sourcing.core.model.AggregateId;
import com.ryuqq.sourcing.core.spi.Decoded;
import com.ryuqq.sourcing.core.spi.PayloadCodec;
import com.ryuqq.sourcing.core.spi.PayloadDecodingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * 저장된 이벤트(와 선택적 스냅샷)로부터 Aggregate 복원.
 *
 * <ul>
 *   <li>알 수 없는 eventType: 적용하지 않고 {@link UnrecognizedEvent}로 이력에 남김 (version은 전진)</li>
 *   <li>알려진 타입의 알 수 없는 멤버: 파싱된 필드만으로 적용</li>
 *   <li>본문 역직렬화 실패: 알 수 없는 타입과 동일하게 처리</li>
 *   <li>이벤트와 스냅샷이 모두 없으면 empty</li>
 * </ul>
 *
 * @param <A> Aggregate 타입
 * @author Sourcing Team
 * @since 1.0.0
 */
public class AggregateRehydrator<A extends EventSourcedAggregate<A>> {

    private static final Logger log = LoggerFactory.getLogger(AggregateRehydrator.class);

    private final AggregateType<A> aggregateType;
    private final PayloadCodec codec;

    public AggregateRehydrator(AggregateType<A> aggregateType, PayloadCodec codec) {
        if (aggregateType == null) {
            throw new IllegalArgumentException("aggregateType cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        this.aggregateType = aggregateType;
        this.codec = codec;
    }

    /**
     * Aggregate 복원.
     *
     * <p>호출자는 이미 경계(버전/시각)로 걸러진 이벤트를 전달합니다. 스냅샷이 주어지면
     * 스냅샷 버전 이하의 이벤트는 무시됩니다.</p>
     *
     * @param id Aggregate ID
     * @param events 오름차순 저장 이벤트
     * @param snapshot 시드로 사용할 스냅샷 (nullable)
     * @return Aggregate (이벤트와 스냅샷이 모두 없으면 empty)
     */
    public Optional<A> rehydrate(AggregateId id, List<StoredEvent> events, Snapshot snapshot) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if ((events == null || events.isEmpty()) && snapshot == null) {
            return Optional.empty();
        }
        A aggregate = aggregateType.newInstance(id);
        long floor = 0;
        if (snapshot != null) {
            Object state = codec.decode(snapshot.state(), aggregateType.snapshotStateType()).value();
            aggregate.restoreFromSnapshot(snapshot.version(), snapshot.etags(), state);
            floor = snapshot.version();
        }
        if (events != null) {
            for (StoredEvent event : events) {
                if (event.sequenceNumber() > floor) {
                    aggregate.applyHistorical(toDomainEvent(event));
                }
            }
        }
        return Optional.of(aggregate);
    }

    /**
     * 저장 이벤트를 도메인 이벤트로 변환.
     *
     * @param event 저장 이벤트
     * @return 도메인 이벤트 (해석할 수 없으면 data가 {@link UnrecognizedEvent})
     */
    public DomainEvent<?> toDomainEvent(StoredEvent event) {
        Object data = decodeData(event);
        return new DomainEvent<>(
            event.aggregateId(),
            event.sequenceNumber(),
            event.eventType(),
            event.timestamp(),
            event.actor(),
            event.etag(),
            data
        );
    }

    private Object decodeData(StoredEvent event) {
        Optional<Class<?>> dataType = aggregateType.eventDataType(event.eventType());
        if (dataType.isEmpty()) {
            log.warn("Skipping unrecognized event type {} at {} #{}",
                event.eventType(), event.aggregateId(), event.sequenceNumber());
            return new UnrecognizedEvent(event.eventType(), event.body());
        }
        try {
            Decoded<?> decoded = codec.decode(event.body(), dataType.get());
            if (!decoded.isLossless()) {
                log.debug("Ignored members {} of {} at {} #{}",
                    decoded.ignoredFields(), event.eventType(), event.aggregateId(), event.sequenceNumber());
            }
            return decoded.value();
        } catch (PayloadDecodingException e) {
            log.warn("Skipping undecodable {} at {} #{}: {}",
                event.eventType(), event.aggregateId(), event.sequenceNumber(), e.getMessage());
            return new UnrecognizedEvent(event.eventType(), event.body());
        }
    }
}
