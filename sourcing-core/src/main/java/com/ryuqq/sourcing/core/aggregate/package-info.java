/**
 * Aggregate 모델.
 *
 * <p>{@link com.ryuqq.sourcing.core.aggregate.EventSourcedAggregate}는 이벤트로부터 상태를 재구성하고,
 * {@link com.ryuqq.sourcing.core.aggregate.AggregateType}은 이벤트 타입 판별자를 applier로 매핑합니다.</p>
 *
 * @since 1.0.0
 * @author Sourcing Team
 */
package com.ryuqq.sourcing.core.aggregate;
