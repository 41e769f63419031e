package com.ryuqq.sourcing.core.command;

import com.ryuqq.sourcing.core.event.DomainEvent;

/**
 * 커맨드 처리 중 새 이벤트를 기록하는 통로.
 *
 * <p>기록된 이벤트는 즉시 Aggregate 상태에 반영되고 다음 sequenceNumber를 부여받습니다.</p>
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public interface EventRecorder {

    /**
     * 이벤트 기록.
     *
     * @param data 이벤트 데이터 (Aggregate 타입에 등록된 클래스여야 함)
     * @param <T> 이벤트 데이터 타입
     * @return 기록된 이벤트
     * @throws IllegalArgumentException 등록되지 않은 데이터 타입인 경우
     */
    <T> DomainEvent<T> record(T data);
}
