package com.ryuqq.sourcing.adapter.runner;

/**
 * QueueDeliveryAdapter 설정 (불변 record).
 *
 * <ul>
 *   <li>batchSize: pump 한 번에 receive할 메시지 수 (기본 10)</li>
 *   <li>concurrency: 동시 처리 스레드 수 (기본 5)</li>
 *   <li>maxProcessingTimeMs: 메시지 하나의 처리 허용 시간 (기본 30000ms).
 *       초과하면 결과와 무관하게 메시지를 완료하지 않음</li>
 * </ul>
 *
 * @author Sourcing Team
 * @since 1.0.0
 * @param batchSize 배치 크기 (1 이상)
 * @param concurrency 동시 처리 스레드 수 (1 이상)
 * @param maxProcessingTimeMs 처리 허용 시간 (밀리초, 양수)
 */
public record QueueDeliveryConfig(
    int batchSize,
    int concurrency,
    long maxProcessingTimeMs
) {

    /**
     * 기본 설정 생성자.
     */
    public QueueDeliveryConfig() {
        this(10, 5, 30000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public QueueDeliveryConfig {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive (current: " + batchSize + ")");
        }
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be positive (current: " + concurrency + ")");
        }
        if (maxProcessingTimeMs <= 0) {
            throw new IllegalArgumentException(
                "maxProcessingTimeMs must be positive (current: " + maxProcessingTimeMs + ")"
            );
        }
    }

    public QueueDeliveryConfig withBatchSize(int batchSize) {
        return new QueueDeliveryConfig(batchSize, concurrency, maxProcessingTimeMs);
    }

    public QueueDeliveryConfig withConcurrency(int concurrency) {
        return new QueueDeliveryConfig(batchSize, concurrency, maxProcessingTimeMs);
    }

    public QueueDeliveryConfig withMaxProcessingTimeMs(long maxProcessingTimeMs) {
        return new QueueDeliveryConfig(batchSize, concurrency, maxProcessingTimeMs);
    }
}
