package com.ryuqq.sourcing.core.scheduling;

import com.ryuqq.sourcing.core.model.AggregateId;
import com.ryuqq.sourcing.core.statemachine.ScheduledCommandState;

import java.time.Instant;

/**
 * 트리거 대상 예약 커맨드 필터.
 *
 * <p>항상 SCHEDULED 상태이면서 {@code dueAtOrBefore} 시각까지 실행 가능한 기록만 선택합니다.
 * aggregateId와 sequenceNumber는 선택적으로 범위를 좁힙니다.</p>
 *
 * <pre>
 * ScheduledCommandSelector selector = ScheduledCommandSelector.due(now).forAggregate(orderId);
 * </pre>
 *
 * @param dueAtOrBefore 기준 시각
 * @param aggregateId 대상 Aggregate (null이면 전체)
 * @param sequenceNumber 대상 순번 (null이면 전체)
 * @param limit 최대 선택 개수 (1 이상)
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public record ScheduledCommandSelector(
    Instant dueAtOrBefore,
    AggregateId aggregateId,
    Long sequenceNumber,
    int limit
) {

    public static final int DEFAULT_LIMIT = 1000;

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException dueAtOrBefore가 null이거나 limit이 1 미만인 경우
     */
    public ScheduledCommandSelector {
        if (dueAtOrBefore == null) {
            throw new IllegalArgumentException("dueAtOrBefore cannot be null");
        }
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive (current: " + limit + ")");
        }
    }

    /**
     * 기준 시각까지 실행 가능한 모든 예약 커맨드.
     *
     * @param instant 기준 시각
     * @return selector
     */
    public static ScheduledCommandSelector due(Instant instant) {
        return new ScheduledCommandSelector(instant, null, null, DEFAULT_LIMIT);
    }

    public ScheduledCommandSelector forAggregate(AggregateId id) {
        return new ScheduledCommandSelector(dueAtOrBefore, id, sequenceNumber, limit);
    }

    public ScheduledCommandSelector withSequenceNumber(long number) {
        return new ScheduledCommandSelector(dueAtOrBefore, aggregateId, number, limit);
    }

    public ScheduledCommandSelector withLimit(int newLimit) {
        return new ScheduledCommandSelector(dueAtOrBefore, aggregateId, sequenceNumber, newLimit);
    }

    /**
     * 기록이 이 필터에 해당하는지 확인.
     *
     * @param command 예약 기록
     * @return 해당하면 true
     */
    public boolean matches(ScheduledCommand command) {
        if (command.state() != ScheduledCommandState.SCHEDULED) {
            return false;
        }
        if (!command.isDueAt(dueAtOrBefore)) {
            return false;
        }
        if (aggregateId != null && !aggregateId.equals(command.aggregateId())) {
            return false;
        }
        return sequenceNumber == null || sequenceNumber == command.sequenceNumber();
    }
}
