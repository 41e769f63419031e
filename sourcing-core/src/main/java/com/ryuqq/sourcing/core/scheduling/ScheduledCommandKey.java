package com.ryuqq.sourcing.core.scheduling;

import com.ryuqq.sourcing.core.model.AggregateId;

/**
 * 예약 커맨드의 고유 키 (aggregateId, sequenceNumber).
 *
 * @param aggregateId 대상 Aggregate 식별자
 * @param sequenceNumber 예약 시점에 확보한 순번 (1 이상)
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public record ScheduledCommandKey(AggregateId aggregateId, long sequenceNumber) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException aggregateId가 null이거나 sequenceNumber가 1 미만인 경우
     */
    public ScheduledCommandKey {
        if (aggregateId == null) {
            throw new IllegalArgumentException("aggregateId cannot be null");
        }
        if (sequenceNumber < 1) {
            throw new IllegalArgumentException("sequenceNumber must be positive (current: " + sequenceNumber + ")");
        }
    }

    /**
     * 이 키로 예약된 커맨드의 기본 ETag.
     *
     * <p>재전달된 커맨드가 이미 반영되었는지 Aggregate가 판별하는 데 사용됩니다.</p>
     *
     * @return {@code scheduled:{aggregateId}:{sequenceNumber}}
     */
    public String defaultETag() {
        return "scheduled:" + aggregateId.getValue() + ":" + sequenceNumber;
    }

    @Override
    public String toString() {
        return aggregateId.getValue() + "#" + sequenceNumber;
    }
}
