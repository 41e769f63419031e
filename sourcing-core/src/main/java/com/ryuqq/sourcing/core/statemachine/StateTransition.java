package com.ryuqq.sourcing.core.statemachine;

/**
 * 예약 커맨드 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>SCHEDULED → SCHEDULED (재시도)</li>
 *   <li>SCHEDULED → APPLIED</li>
 *   <li>SCHEDULED → PERMANENTLY_FAILED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong> 종료 상태(APPLIED, PERMANENTLY_FAILED)는 고정되며 어떤 상태로도 전이할 수 없습니다.</p>
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public final class StateTransition {

    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 종료 상태에서 전이하려는 경우
     */
    public static void validate(ScheduledCommandState from, ScheduledCommandState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static ScheduledCommandState transition(ScheduledCommandState current, ScheduledCommandState next) {
        validate(current, next);
        return next;
    }
}
