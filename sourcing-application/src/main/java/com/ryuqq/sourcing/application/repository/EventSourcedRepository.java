package com.ryuqq.sourcing.application.repository;

import com.ryuqq.sourcing.core.aggregate.AggregateType;
import com.ryuqq.sourcing.core.aggregate.EventSourcedAggregate;
import com.ryuqq.sourcing.core.aggregate.Snapshot;
import com.ryuqq.sourcing.core.model.AggregateId;
import com.ryuqq.sourcing.core.outcome.SaveResult;

import java.time.Instant;
import java.util.Optional;

/**
 * 이벤트 소싱 Aggregate 저장소.
 *
 * <p>Aggregate 상태는 이벤트 스트림으로부터만 복원되며, 저장은 pendingEvents를
 * 기대 sequenceNumber 위치에 원자적으로 추가하는 것입니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Order order = repository.getLatest(orderId).orElseThrow();
 * order.apply(new Order.AddItem("Widget", 2));
 *
 * SaveResult result = repository.save(order);
 * if (result instanceof SaveResult.Conflict conflict) {
 *     // 다른 작업자가 먼저 커밋함: 다시 읽고 재적용
 * }
 * </pre>
 *
 * @param <A> Aggregate 타입
 * @author Sourcing Team
 * @since 1.0.0
 */
public interface EventSourcedRepository<A extends EventSourcedAggregate<A>> {

    /**
     * 이 저장소가 다루는 Aggregate 타입.
     *
     * @return Aggregate 타입
     */
    AggregateType<A> aggregateType();

    /**
     * 최신 스냅샷(있다면)과 그 이후의 모든 이벤트로 복원.
     *
     * @param id Aggregate ID
     * @return Aggregate (스트림이 없으면 empty)
     */
    Optional<A> getLatest(AggregateId id);

    /**
     * 지정한 버전까지의 이벤트만으로 복원.
     *
     * <p>스냅샷을 사용하지 않고 첫 이벤트부터 재생하므로 이력 길이는 항상 버전과 같습니다.</p>
     *
     * @param id Aggregate ID
     * @param version 최대 sequenceNumber (1 이상)
     * @return Aggregate (스트림이 없으면 empty)
     * @throws IllegalArgumentException version이 1 미만인 경우
     */
    Optional<A> getVersion(AggregateId id, long version);

    /**
     * timestamp가 지정 시각 이하인 이벤트만으로 복원.
     *
     * @param id Aggregate ID
     * @param asOf 기준 시각 (포함)
     * @return Aggregate (해당 시각까지 이벤트가 없으면 empty)
     */
    Optional<A> getAsOfDate(AggregateId id, Instant asOf);

    /**
     * pendingEvents 저장.
     *
     * <p>성공 시 pendingEvents는 eventHistory로 이동하고, 각 이벤트는 커밋 이후
     * 오름차순으로 한 번씩 발행됩니다. 충돌 시 아무것도 저장/발행되지 않습니다.</p>
     *
     * @param aggregate 저장할 Aggregate
     * @return {@link SaveResult.Saved} 또는 {@link SaveResult.Conflict}
     */
    SaveResult save(A aggregate);

    /**
     * 현재 버전 이후에 커밋된 이벤트를 라이브 인스턴스에 반영.
     *
     * @param aggregate 갱신할 Aggregate
     * @return 같은 인스턴스
     * @throws IllegalStateException 저장되지 않은 pendingEvents가 있는 경우
     */
    A refresh(A aggregate);

    /**
     * 현재 커밋된 상태의 스냅샷을 생성하고 저장.
     *
     * @param aggregate 스냅샷 대상
     * @return 저장된 스냅샷
     * @throws IllegalStateException 스냅샷을 지원하지 않는 타입이거나 pendingEvents가 있는 경우
     */
    Snapshot snapshot(A aggregate);
}
