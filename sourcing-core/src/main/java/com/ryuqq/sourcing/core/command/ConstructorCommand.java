package com.ryuqq.sourcing.core.command;

import com.ryuqq.sourcing.core.aggregate.EventSourcedAggregate;

/**
 * 아직 존재하지 않는 Aggregate를 생성하는 커맨드.
 *
 * <p>예약 실행 시 대상 스트림이 비어 있으면 빈 Aggregate를 만든 뒤 이 커맨드를 적용합니다.
 * 일반 {@link Command}는 대상 Aggregate가 없으면 적용되지 않습니다.</p>
 *
 * @param <A> 생성할 Aggregate 타입
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public interface ConstructorCommand<A extends EventSourcedAggregate<A>> extends Command<A> {
}
