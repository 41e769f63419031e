package com.ryuqq.sourcing.core.command;

/**
 * 커맨드가 Aggregate의 현재 상태에 적용될 수 없음을 나타내는 예외.
 *
 * <p>예약 실행에서는 재시도 가능한 적용 실패로 기록됩니다.</p>
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public class CommandValidationException extends RuntimeException {

    public CommandValidationException(String message) {
        super(message);
    }
}
