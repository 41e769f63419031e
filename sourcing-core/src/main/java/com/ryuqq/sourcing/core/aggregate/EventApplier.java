package com.ryuqq.sourcing.core.aggregate;

import com.ryuqq.sourcing.core.event.DomainEvent;

/**
 * 이벤트 하나를 Aggregate 상태에 반영하는 순수 변경 함수.
 *
 * @param <A> Aggregate 타입
 * @param <T> 이벤트 데이터 타입
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface EventApplier<A, T> {

    /**
     * 이벤트를 Aggregate에 반영.
     *
     * @param aggregate 대상 Aggregate
     * @param event 반영할 이벤트
     */
    void apply(A aggregate, DomainEvent<T> event);
}
