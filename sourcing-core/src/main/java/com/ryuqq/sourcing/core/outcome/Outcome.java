package com.ryuqq.sourcing.core.outcome;

import com.ryuqq.sourcing.core.scheduling.ScheduledCommandKey;

/**
 * 예약 커맨드 1회 적용 결과.
 *
 * <p>Outcome은 세 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 적용 완료 (APPLIED로 기록)</li>
 *   <li>{@link Retry}: 실패했지만 재시도 횟수가 남음 (SCHEDULED 유지)</li>
 *   <li>{@link Fail}: 최종 실패 (PERMANENTLY_FAILED로 기록)</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 결과 종류가 컴파일 타임에 고정됩니다.</p>
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public sealed interface Outcome permits Ok, Retry, Fail {

    /**
     * 결과가 가리키는 예약 커맨드 키.
     *
     * @return 예약 키
     */
    ScheduledCommandKey key();

    default boolean isOk() {
        return this instanceof Ok;
    }

    default boolean isRetry() {
        return this instanceof Retry;
    }

    default boolean isFail() {
        return this instanceof Fail;
    }
}
