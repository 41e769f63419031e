package com.ryuqq.sourcing.core.scheduling;

/**
 * 예약 커맨드 적용 실패 분류.
 *
 * <p>{@link #isRetryable()}가 false인 코드는 남은 재시도 횟수와 무관하게 즉시 최종 실패로 기록됩니다.</p>
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public enum FailureCode {

    /** 커맨드 검증 실패. */
    VALIDATION_FAILED(true),

    /** 커맨드 처리 중 도메인 예외. */
    COMMAND_FAILED(true),

    /** 다른 작업자가 먼저 커밋함. */
    CONCURRENCY_CONFLICT(true),

    /** 대상 Aggregate가 아직 없음. */
    AGGREGATE_NOT_FOUND(true),

    /** 생성 커맨드인데 Aggregate가 이미 존재함. */
    AGGREGATE_ALREADY_EXISTS(false),

    /** 등록되지 않은 Aggregate 타입. */
    UNKNOWN_AGGREGATE_TYPE(false),

    /** 등록되지 않은 커맨드 이름. */
    UNKNOWN_COMMAND(false),

    /** 커맨드 본문 역직렬화 실패. */
    UNDECODABLE_COMMAND(false),

    /** 최대 대기 시간 안에 선행 조건이 충족되지 않음. */
    PRECONDITION_TIMEOUT(false);

    private final boolean retryable;

    FailureCode(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
