package com.ryuqq.sourcing.core.outcome;

import com.ryuqq.sourcing.core.event.DomainEvent;

import java.util.List;

/**
 * Repository 저장 결과.
 *
 * <ul>
 *   <li>{@link Saved}: 모든 pending 이벤트가 커밋되고 발행됨</li>
 *   <li>{@link Conflict}: 다른 작업자가 먼저 커밋함, 아무것도 저장/발행되지 않음</li>
 * </ul>
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public sealed interface SaveResult permits SaveResult.Saved, SaveResult.Conflict {

    default boolean isSaved() {
        return this instanceof Saved;
    }

    /**
     * 충돌이면 {@link ConcurrencyException}을 던짐.
     *
     * @return 저장 결과 (Saved)
     * @throws ConcurrencyException 충돌인 경우
     */
    default Saved orElseThrow() {
        if (this instanceof Conflict conflict) {
            throw conflict.exception();
        }
        return (Saved) this;
    }

    /**
     * 저장 성공.
     *
     * @param committedEvents 커밋된 이벤트 (오름차순, 저장할 것이 없었으면 빈 목록)
     */
    record Saved(List<DomainEvent<?>> committedEvents) implements SaveResult {

        public Saved {
            committedEvents = committedEvents == null ? List.of() : List.copyOf(committedEvents);
        }
    }

    /**
     * 동시성 충돌.
     *
     * @param exception 충돌 상세
     */
    record Conflict(ConcurrencyException exception) implements SaveResult {

        public Conflict {
            if (exception == null) {
                throw new IllegalArgumentException("exception cannot be null");
            }
        }
    }
}
