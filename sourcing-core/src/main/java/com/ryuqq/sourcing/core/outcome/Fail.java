package com.ryuqq.sourcing.core.outcome;

import com.ryuqq.sourcing.core.scheduling.CommandFailure;
import com.ryuqq.sourcing.core.scheduling.ScheduledCommandKey;

/**
 * 최종 실패 (재시도 불가).
 *
 * <p>재시도 횟수를 모두 소진했거나, 재시도해도 성공할 수 없는 실패입니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>등록되지 않은 커맨드 이름</li>
 *   <li>역직렬화할 수 없는 커맨드 본문</li>
 *   <li>선행 조건 최대 대기 시간 초과</li>
 * </ul>
 *
 * @param key 예약 키
 * @param failure 실패 상세
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public record Fail(ScheduledCommandKey key, CommandFailure failure) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException key 또는 failure가 null인 경우
     */
    public Fail {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
    }
}
