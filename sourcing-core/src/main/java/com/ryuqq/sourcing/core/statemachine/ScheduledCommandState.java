package com.ryuqq.sourcing.core.statemachine;

/**
 * 예약 커맨드의 생명주기 상태.
 *
 * <p>상태는 저장되지 않고 {@code appliedTime}, {@code finalAttemptTime} 종료 마커로부터 유도됩니다.</p>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * SCHEDULED ─┬─► SCHEDULED (재시도 가능한 실패, dueTime 연기)
 *            │
 *            ├─► APPLIED (appliedTime 설정)
 *            │
 *            └─► PERMANENTLY_FAILED (finalAttemptTime 설정)
 *
 * 금지된 전이:
 * - APPLIED → 모든 상태 ❌
 * - PERMANENTLY_FAILED → 모든 상태 ❌
 * </pre>
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public enum ScheduledCommandState {

    /**
     * 실행 대기 중 (재시도 대기 포함).
     */
    SCHEDULED,

    /**
     * 적용 완료.
     */
    APPLIED,

    /**
     * 최종 실패 (더 이상 재시도 없음).
     */
    PERMANENTLY_FAILED;

    /**
     * 종료 상태인지 확인.
     *
     * @return APPLIED 또는 PERMANENTLY_FAILED인 경우 true
     */
    public boolean isTerminal() {
        return this == APPLIED || this == PERMANENTLY_FAILED;
    }
}
