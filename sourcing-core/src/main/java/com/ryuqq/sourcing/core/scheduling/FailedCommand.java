package com.ryuqq.sourcing.core.scheduling;

/**
 * 트리거 중 실패한 예약 커맨드.
 *
 * @param command 실패 기록 반영 후의 예약 커맨드
 * @param failure 실패 상세
 * @param permanent 최종 실패 (더 이상 재시도하지 않음) 여부
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public record FailedCommand(ScheduledCommand command, CommandFailure failure, boolean permanent) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException command 또는 failure가 null인 경우
     */
    public FailedCommand {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
    }
}
