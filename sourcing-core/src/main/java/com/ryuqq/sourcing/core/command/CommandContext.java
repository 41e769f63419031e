package com.ryuqq.sourcing.core.command;

import java.time.Clock;

/**
 * 커맨드 적용 시 명시적으로 전달되는 실행 컨텍스트.
 *
 * <p>전역 시계 대신 주입된 {@link Clock}을 사용해 이벤트 timestamp를 결정합니다.</p>
 *
 * @param clock 이벤트 timestamp에 사용할 시계
 * @param actor 행위자 (null 가능)
 * @param etag 커맨드가 ETag를 지정하지 않을 때 사용할 기본 ETag (null 가능)
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public record CommandContext(Clock clock, String actor, String etag) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException clock이 null인 경우
     */
    public CommandContext {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
    }

    /**
     * UTC 시스템 시계 기반 컨텍스트.
     *
     * @return 컨텍스트
     */
    public static CommandContext system() {
        return new CommandContext(Clock.systemUTC(), null, null);
    }

    public static CommandContext of(Clock clock) {
        return new CommandContext(clock, null, null);
    }

    public CommandContext withActor(String newActor) {
        return new CommandContext(clock, newActor, etag);
    }

    public CommandContext withETag(String newETag) {
        return new CommandContext(clock, actor, newETag);
    }
}
