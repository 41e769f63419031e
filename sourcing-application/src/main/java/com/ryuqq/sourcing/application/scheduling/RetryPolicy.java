package com.ryuqq.sourcing.application.scheduling;

import java.time.Duration;
import java.time.Instant;

/**
 * 예약 커맨드 재시도 정책 (불변 record).
 *
 * <ul>
 *   <li>maxAttempts: 최대 시도 횟수, 첫 시도 포함 (기본 5)</li>
 *   <li>baseDelayMs / maxDelayMs / jitterFactor: 재시도 간 backoff (기본 1000ms / 300000ms / 0.1)</li>
 *   <li>maxPreconditionWaitMs: 선행 조건 최대 대기 시간, dueTime 기준 (기본 3600000ms = 1시간)</li>
 * </ul>
 *
 * @param maxAttempts 최대 시도 횟수 (1 이상)
 * @param baseDelayMs 기본 지연 (밀리초, 양수)
 * @param maxDelayMs 최대 지연 (밀리초, baseDelayMs 이상)
 * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
 * @param maxPreconditionWaitMs 선행 조건 최대 대기 (밀리초, 0 이상)
 * @author Sourcing Team
 * @since 1.0.0
 */
public record RetryPolicy(
    int maxAttempts,
    long baseDelayMs,
    long maxDelayMs,
    double jitterFactor,
    long maxPreconditionWaitMs
) {

    /**
     * 기본 정책.
     */
    public RetryPolicy() {
        this(5, 1000, 300000, 0.1, 3600000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RetryPolicy {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive (current: " + maxAttempts + ")");
        }
        if (maxPreconditionWaitMs < 0) {
            throw new IllegalArgumentException(
                "maxPreconditionWaitMs must be non-negative (current: " + maxPreconditionWaitMs + ")"
            );
        }
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException("baseDelayMs must be positive (current: " + baseDelayMs + ")");
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")");
        }
    }

    /**
     * 실패한 시도 이후에도 재시도 여지가 있는지 확인.
     *
     * @param failedAttempt 방금 실패한 시도 번호 (1부터)
     * @return 재시도 가능하면 true
     */
    public boolean allowsRetryAfter(int failedAttempt) {
        return failedAttempt < maxAttempts;
    }

    /**
     * 선행 조건 대기 시간 초과 여부.
     *
     * @param effectiveDueTime 실행 가능 시각
     * @param now 현재 시각
     * @return 초과했으면 true
     */
    public boolean preconditionWaitExceeded(Instant effectiveDueTime, Instant now) {
        return Duration.between(effectiveDueTime, now).toMillis() > maxPreconditionWaitMs;
    }

    public BackoffCalculator backoff() {
        return new BackoffCalculator(baseDelayMs, maxDelayMs, jitterFactor);
    }

    public RetryPolicy withMaxAttempts(int maxAttempts) {
        return new RetryPolicy(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor, maxPreconditionWaitMs);
    }

    public RetryPolicy withBackoff(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        return new RetryPolicy(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor, maxPreconditionWaitMs);
    }

    public RetryPolicy withMaxPreconditionWaitMs(long maxPreconditionWaitMs) {
        return new RetryPolicy(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor, maxPreconditionWaitMs);
    }
}
