package com.ryuqq.sourcing.core.scheduling;

import com.ryuqq.sourcing.core.model.AggregateId;

/**
 * 예약 커맨드 실행 전에 존재해야 하는 이벤트.
 *
 * <p>인과적으로 앞선 이벤트 (aggregateId 스트림의 sequenceNumber)가 기록되기 전까지
 * 커맨드 실행을 보류합니다.</p>
 *
 * @param aggregateId 확인할 스트림
 * @param sequenceNumber 존재해야 하는 순번
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public record DeliveryPrecondition(AggregateId aggregateId, long sequenceNumber) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException aggregateId가 null이거나 sequenceNumber가 1 미만인 경우
     */
    public DeliveryPrecondition {
        if (aggregateId == null) {
            throw new IllegalArgumentException("aggregateId cannot be null");
        }
        if (sequenceNumber < 1) {
            throw new IllegalArgumentException("sequenceNumber must be positive (current: " + sequenceNumber + ")");
        }
    }
}
