package com.ryuqq.sourcing.core.outcome;

import com.ryuqq.sourcing.core.event.StoredEvent;

/**
 * 다른 작업자가 같은 (aggregateId, sequenceNumber)에 먼저 커밋했음을 나타내는 예외.
 *
 * <p>메시지에는 이미 커밋된 이벤트와 저장하려던 이벤트의 타입, 행위자, 본문이 모두 포함됩니다.
 * 저장소는 자동으로 재시도하지 않으며, 호출자가 다시 로드하고 커맨드를 재적용해야 합니다.</p>
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public class ConcurrencyException extends RuntimeException {

    private final transient StoredEvent committed;
    private final transient StoredEvent attempted;

    /**
     * 생성자.
     *
     * @param committed 이미 커밋된 이벤트
     * @param attempted 저장하려던 이벤트
     */
    public ConcurrencyException(StoredEvent committed, StoredEvent attempted) {
        super(describe(committed, attempted));
        this.committed = committed;
        this.attempted = attempted;
    }

    public StoredEvent committed() {
        return committed;
    }

    public StoredEvent attempted() {
        return attempted;
    }

    private static String describe(StoredEvent committed, StoredEvent attempted) {
        if (committed == null || attempted == null) {
            throw new IllegalArgumentException("committed and attempted events cannot be null");
        }
        return String.format(
            "Concurrency conflict on %s %s at sequence %d: committed %s %s%s; attempted %s %s%s",
            attempted.streamName(),
            attempted.aggregateId().getValue(),
            attempted.sequenceNumber(),
            committed.eventType(),
            committed.body().content(),
            actor(committed),
            attempted.eventType(),
            attempted.body().content(),
            actor(attempted)
        );
    }

    private static String actor(StoredEvent event) {
        return event.actor() == null ? "" : " by " + event.actor();
    }
}
