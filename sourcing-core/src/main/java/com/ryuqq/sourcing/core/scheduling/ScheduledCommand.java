package com.ryuqq.sourcing.core.scheduling;

import com.ryuqq.sourcing.core.model.AggregateId;
import com.ryuqq.sourcing.core.model.Payload;
import com.ryuqq.sourcing.core.statemachine.ScheduledCommandState;
import com.ryuqq.sourcing.core.statemachine.StateTransition;

import java.time.Instant;
import java.util.Comparator;

/**
 * 특정 시각 이후, 선행 조건 충족 시 Aggregate에 적용될 커맨드의 영속 기록.
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>appliedTime과 finalAttemptTime은 동시에 설정될 수 없음</li>
 *   <li>둘 중 하나가 설정되면 기록은 더 이상 변경되지 않음</li>
 * </ul>
 *
 * <p>상태 변경 메서드는 새 인스턴스를 반환하며, {@link StateTransition}으로 전이를 검증합니다.</p>
 *
 * @param aggregateId 대상 Aggregate 식별자
 * @param sequenceNumber 예약 순번
 * @param aggregateTypeName 대상 Aggregate 타입 이름
 * @param commandName 커맨드 이름
 * @param commandBody 직렬화된 커맨드
 * @param dueTime 실행 가능 시각 (null이면 즉시)
 * @param precondition 선행 조건 (null 가능)
 * @param createdTime 예약 시각
 * @param attempts 지금까지의 실패한 시도 횟수
 * @param lastFailure 마지막 실패 상세 (null 가능)
 * @param appliedTime 적용 완료 시각 (null 가능)
 * @param finalAttemptTime 최종 실패 시각 (null 가능)
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public record ScheduledCommand(
    AggregateId aggregateId,
    long sequenceNumber,
    String aggregateTypeName,
    String commandName,
    Payload commandBody,
    Instant dueTime,
    DeliveryPrecondition precondition,
    Instant createdTime,
    int attempts,
    CommandFailure lastFailure,
    Instant appliedTime,
    Instant finalAttemptTime
) {

    /**
     * 트리거 처리 순서: 실행 가능 시각, 그 다음 sequenceNumber.
     */
    public static final Comparator<ScheduledCommand> DELIVERY_ORDER = Comparator
        .comparing(ScheduledCommand::effectiveDueTime)
        .thenComparing(command -> command.aggregateId().getValue())
        .thenComparingLong(ScheduledCommand::sequenceNumber);

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 종료 마커가 동시에 설정된 경우
     */
    public ScheduledCommand {
        if (aggregateId == null) {
            throw new IllegalArgumentException("aggregateId cannot be null");
        }
        if (sequenceNumber < 1) {
            throw new IllegalArgumentException("sequenceNumber must be positive (current: " + sequenceNumber + ")");
        }
        if (aggregateTypeName == null || aggregateTypeName.isBlank()) {
            throw new IllegalArgumentException("aggregateTypeName cannot be null or blank");
        }
        if (commandName == null || commandName.isBlank()) {
            throw new IllegalArgumentException("commandName cannot be null or blank");
        }
        if (commandBody == null) {
            throw new IllegalArgumentException("commandBody cannot be null");
        }
        if (createdTime == null) {
            throw new IllegalArgumentException("createdTime cannot be null");
        }
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts must be non-negative (current: " + attempts + ")");
        }
        if (appliedTime != null && finalAttemptTime != null) {
            throw new IllegalArgumentException("appliedTime and finalAttemptTime are mutually exclusive");
        }
    }

    /**
     * 새 예약 기록 생성 (SCHEDULED 상태).
     *
     * @param key 예약 키
     * @param aggregateTypeName Aggregate 타입 이름
     * @param commandName 커맨드 이름
     * @param commandBody 직렬화된 커맨드
     * @param dueTime 실행 가능 시각 (null이면 즉시)
     * @param precondition 선행 조건 (null 가능)
     * @param createdTime 예약 시각
     * @return SCHEDULED 상태의 기록
     */
    public static ScheduledCommand schedule(
        ScheduledCommandKey key,
        String aggregateTypeName,
        String commandName,
        Payload commandBody,
        Instant dueTime,
        DeliveryPrecondition precondition,
        Instant createdTime
    ) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return new ScheduledCommand(
            key.aggregateId(), key.sequenceNumber(), aggregateTypeName, commandName, commandBody,
            dueTime, precondition, createdTime, 0, null, null, null
        );
    }

    public ScheduledCommandKey key() {
        return new ScheduledCommandKey(aggregateId, sequenceNumber);
    }

    /**
     * 현재 상태 (종료 마커로부터 유도).
     *
     * @return 상태
     */
    public ScheduledCommandState state() {
        if (appliedTime != null) {
            return ScheduledCommandState.APPLIED;
        }
        if (finalAttemptTime != null) {
            return ScheduledCommandState.PERMANENTLY_FAILED;
        }
        return ScheduledCommandState.SCHEDULED;
    }

    /**
     * 실행 가능 시각 (dueTime이 없으면 예약 시각).
     *
     * @return 실행 가능 시각
     */
    public Instant effectiveDueTime() {
        return dueTime != null ? dueTime : createdTime;
    }

    /**
     * 주어진 시각에 실행 가능한지 확인.
     *
     * @param instant 기준 시각
     * @return dueTime이 없거나 instant 이전/동일하면 true
     */
    public boolean isDueAt(Instant instant) {
        return dueTime == null || !dueTime.isAfter(instant);
    }

    /**
     * 적용 완료 처리.
     *
     * @param at 적용 시각
     * @return APPLIED 상태의 새 기록
     * @throws IllegalStateException 이미 종료 상태인 경우
     */
    public ScheduledCommand markApplied(Instant at) {
        if (at == null) {
            throw new IllegalArgumentException("at cannot be null");
        }
        StateTransition.validate(state(), ScheduledCommandState.APPLIED);
        return new ScheduledCommand(
            aggregateId, sequenceNumber, aggregateTypeName, commandName, commandBody,
            dueTime, precondition, createdTime, attempts, lastFailure, at, null
        );
    }

    /**
     * 재시도 가능한 실패 기록 (SCHEDULED 유지, dueTime 연기).
     *
     * @param failure 실패 상세
     * @param nextDueTime 다음 실행 가능 시각
     * @return 시도 횟수가 증가한 새 기록
     * @throws IllegalStateException 이미 종료 상태인 경우
     */
    public ScheduledCommand recordFailedAttempt(CommandFailure failure, Instant nextDueTime) {
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
        StateTransition.validate(state(), ScheduledCommandState.SCHEDULED);
        return new ScheduledCommand(
            aggregateId, sequenceNumber, aggregateTypeName, commandName, commandBody,
            nextDueTime, precondition, createdTime, attempts + 1, failure, null, null
        );
    }

    /**
     * 최종 실패 처리 (더 이상 재시도하지 않음).
     *
     * @param failure 실패 상세
     * @param at 최종 실패 시각
     * @return PERMANENTLY_FAILED 상태의 새 기록
     * @throws IllegalStateException 이미 종료 상태인 경우
     */
    public ScheduledCommand markFinalAttempt(CommandFailure failure, Instant at) {
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
        if (at == null) {
            throw new IllegalArgumentException("at cannot be null");
        }
        StateTransition.validate(state(), ScheduledCommandState.PERMANENTLY_FAILED);
        return new ScheduledCommand(
            aggregateId, sequenceNumber, aggregateTypeName, commandName, commandBody,
            dueTime, precondition, createdTime, Math.max(attempts, failure.attempt()), failure, null, at
        );
    }
}
