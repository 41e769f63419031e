package com.ryuqq.sourcing.core.scheduling;

import java.time.Instant;

/**
 * 예약 커맨드 적용 실패 상세.
 *
 * @param code 실패 분류
 * @param message 실패 메시지
 * @param attempt 실패한 시도 번호 (선행 조건 만료는 시도 없이 0일 수 있음)
 * @param failedAt 실패 시각
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public record CommandFailure(FailureCode code, String message, int attempt, Instant failedAt) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 attempt가 음수인 경우
     */
    public CommandFailure {
        if (code == null) {
            throw new IllegalArgumentException("code cannot be null");
        }
        if (message == null || message.isBlank()) {
            message = code.name();
        }
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be non-negative (current: " + attempt + ")");
        }
        if (failedAt == null) {
            throw new IllegalArgumentException("failedAt cannot be null");
        }
    }
}
