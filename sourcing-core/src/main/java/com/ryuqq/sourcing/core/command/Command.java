package com.ryuqq.sourcing.core.command;

import com.ryuqq.sourcing.core.aggregate.EventSourcedAggregate;

/**
 * Aggregate에 적용되는 커맨드.
 *
 * <p>커맨드는 직렬화 가능한 값이어야 합니다. 예약된 커맨드는 본문만 저장되고,
 * 트리거 시점에 {@link com.ryuqq.sourcing.core.aggregate.AggregateType#commandType(String)}으로
 * 클래스를 찾아 역직렬화됩니다.</p>
 *
 * <p><strong>처리 순서:</strong></p>
 * <ol>
 *   <li>ETag 중복 확인 (중복이면 건너뜀)</li>
 *   <li>{@link #validate(EventSourcedAggregate)}</li>
 *   <li>{@link #handle(EventSourcedAggregate, EventRecorder)}</li>
 * </ol>
 *
 * @param <A> 대상 Aggregate 타입
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public interface Command<A extends EventSourcedAggregate<A>> {

    /**
     * 커맨드 이름 (기본값: 단순 클래스명).
     *
     * @return 커맨드 이름
     */
    default String commandName() {
        return getClass().getSimpleName();
    }

    /**
     * 커맨드 ETag (멱등성 토큰).
     *
     * @return ETag, 지정하지 않으면 null
     */
    default String etag() {
        return null;
    }

    /**
     * 이벤트를 기록하기 전에 커맨드를 검증.
     *
     * @param aggregate 대상 Aggregate
     * @throws CommandValidationException 커맨드가 현재 상태에 적용될 수 없는 경우
     */
    default void validate(A aggregate) {
    }

    /**
     * 커맨드 처리 (이벤트 기록).
     *
     * @param aggregate 대상 Aggregate
     * @param recorder 이벤트 기록 통로
     */
    void handle(A aggregate, EventRecorder recorder);
}
