package com.ryuqq.sourcing.core.scheduling;

import java.util.List;

/**
 * 한 번의 트리거 결과.
 *
 * @param successfulCommands 적용 완료된 커맨드 (APPLIED 상태)
 * @param failedCommands 적용에 실패한 커맨드 (재시도 대기 포함)
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public record TriggerResult(List<ScheduledCommand> successfulCommands, List<FailedCommand> failedCommands) {

    /**
     * Compact Constructor.
     */
    public TriggerResult {
        successfulCommands = successfulCommands == null ? List.of() : List.copyOf(successfulCommands);
        failedCommands = failedCommands == null ? List.of() : List.copyOf(failedCommands);
    }

    public static TriggerResult empty() {
        return new TriggerResult(List.of(), List.of());
    }

    public boolean hasSuccesses() {
        return !successfulCommands.isEmpty();
    }

    public boolean hasFailures() {
        return !failedCommands.isEmpty();
    }

    /**
     * 최종 실패로 기록된 커맨드만 반환.
     *
     * @return 최종 실패 목록
     */
    public List<FailedCommand> permanentFailures() {
        return failedCommands.stream().filter(FailedCommand::permanent).toList();
    }
}
