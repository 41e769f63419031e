package com.ryuqq.sourcing.application.scheduling;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * 재시도 지연 계산기 (Exponential Backoff with Jitter).
 *
 * <pre>
 * delay = min(baseDelay * 2^(attempt-1) + jitter, maxDelay)
 * jitter = random[0, 1) * exponential * jitterFactor
 * </pre>
 *
 * <p>예시 (baseDelay=1000ms, jitterFactor=0.1): 1회차 1000-1100ms, 2회차 2000-2200ms,
 * 3회차 4000-4400ms.</p>
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;
    private final DoubleSupplier random;

    /**
     * @param baseDelayMs 기본 지연 (밀리초, 양수)
     * @param maxDelayMs 최대 지연 (밀리초, baseDelayMs 이상)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        this(baseDelayMs, maxDelayMs, jitterFactor, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * 난수 공급자를 지정하는 생성자.
     *
     * @param random [0, 1) 범위의 난수 공급자
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor, DoubleSupplier random) {
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
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
        this.random = random;
    }

    /**
     * 실패한 시도 이후의 지연 계산.
     *
     * @param attempt 실패한 시도 번호 (1부터)
     * @return 다음 시도까지의 지연
     * @throws IllegalArgumentException attempt가 양수가 아닌 경우
     */
    public Duration delayAfter(int attempt) {
        if (attempt <= 0) {
            throw new IllegalArgumentException("attempt must be positive (current: " + attempt + ")");
        }
        // shift가 63을 넘으면 overflow
        int shift = Math.min(attempt - 1, 62);
        long exponential = baseDelayMs > (maxDelayMs >> shift) ? maxDelayMs : baseDelayMs << shift;
        long jitter = (long) (exponential * jitterFactor * random.getAsDouble());
        return Duration.ofMillis(Math.min(exponential + jitter, maxDelayMs));
    }

    public long baseDelayMs() {
        return baseDelayMs;
    }

    public long maxDelayMs() {
        return maxDelayMs;
    }

    public double jitterFactor() {
        return jitterFactor;
    }
}
