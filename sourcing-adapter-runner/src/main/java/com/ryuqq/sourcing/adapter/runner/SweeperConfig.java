package com.ryuqq.sourcing.adapter.runner;

/**
 * ScheduledCommandSweeper 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>scanIntervalMs: 스캔 주기 (기본 60000ms = 1분)</li>
 *   <li>graceMs: 큐 전달에 양보하는 시간. dueTime이 이만큼 지난 커맨드만 스캔 (기본 30000ms)</li>
 *   <li>batchSize: 한 번에 처리할 최대 커맨드 수 (기본 100)</li>
 * </ul>
 *
 * @author Sourcing Team
 * @since 1.0.0
 * @param scanIntervalMs 스캔 주기 (밀리초, 양수)
 * @param graceMs 유예 시간 (밀리초, 0 이상)
 * @param batchSize 배치 크기 (1 이상)
 */
public record SweeperConfig(
    long scanIntervalMs,
    long graceMs,
    int batchSize
) {

    /**
     * 기본 설정 생성자.
     */
    public SweeperConfig() {
        this(60000, 30000, 100);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public SweeperConfig {
        if (scanIntervalMs <= 0) {
            throw new IllegalArgumentException("scanIntervalMs must be positive (current: " + scanIntervalMs + ")");
        }
        if (graceMs < 0) {
            throw new IllegalArgumentException("graceMs must be non-negative (current: " + graceMs + ")");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive (current: " + batchSize + ")");
        }
    }

    public SweeperConfig withScanIntervalMs(long scanIntervalMs) {
        return new SweeperConfig(scanIntervalMs, graceMs, batchSize);
    }

    public SweeperConfig withGraceMs(long graceMs) {
        return new SweeperConfig(scanIntervalMs, graceMs, batchSize);
    }

    public SweeperConfig withBatchSize(int batchSize) {
        return new SweeperConfig(scanIntervalMs, graceMs, batchSize);
    }
}
