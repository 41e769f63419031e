package com.ryuqq.sourcing.core.outcome;

import com.ryuqq.sourcing.core.scheduling.CommandFailure;
import com.ryuqq.sourcing.core.scheduling.ScheduledCommandKey;

/**
 * 재시도 가능한 적용 실패.
 *
 * <p>커맨드는 SCHEDULED로 남고, dueTime이 {@code nextRetryAfterMillis}만큼 연기됩니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>커맨드 검증 실패 (상태가 바뀌면 성공할 수 있음)</li>
 *   <li>동시성 충돌</li>
 *   <li>대상 Aggregate가 아직 없음</li>
 * </ul>
 *
 * @param key 예약 키
 * @param failure 실패 상세
 * @param nextRetryAfterMillis 다음 재시도까지 대기 시간 (밀리초, 0 이상)
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public record Retry(
    ScheduledCommandKey key,
    CommandFailure failure,
    long nextRetryAfterMillis
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public Retry {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
        if (nextRetryAfterMillis < 0) {
            throw new IllegalArgumentException("nextRetryAfterMillis must be non-negative (current: " + nextRetryAfterMillis + ")");
        }
    }
}
