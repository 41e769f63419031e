package com.ryuqq.sourcing.core.outcome;

import com.ryuqq.sourcing.core.scheduling.ScheduledCommandKey;

/**
 * 적용 완료 결과.
 *
 * @param key 예약 키
 * @param recordedEvents 이번 적용으로 기록된 이벤트 수 (ETag 중복으로 건너뛴 경우 0)
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public record Ok(ScheduledCommandKey key, int recordedEvents) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException key가 null이거나 recordedEvents가 음수인 경우
     */
    public Ok {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (recordedEvents < 0) {
            throw new IllegalArgumentException("recordedEvents must be non-negative (current: " + recordedEvents + ")");
        }
    }

    /**
     * 이미 반영되어 있던 커맨드 (새 이벤트 없음).
     *
     * @return true면 재전달된 커맨드
     */
    public boolean alreadyApplied() {
        return recordedEvents == 0;
    }
}
