package com.ryuqq.sourcing.core.aggregate;

import com.ryuqq.sourcing.core.model.AggregateId;
import com.ryuqq.sourcing.core.model.Payload;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 특정 버전의 Aggregate 상태를 직렬화한 스냅샷.
 *
 * <p>요청 시에만 생성되며, 한 번 기록된 스냅샷은 변경되지 않고 더 높은 버전의 스냅샷으로 대체됩니다.</p>
 *
 * @param aggregateId Aggregate 식별자
 * @param version 스냅샷이 반영하는 이벤트 sequenceNumber (1 이상)
 * @param aggregateTypeName Aggregate 타입 이름
 * @param state 직렬화된 상태
 * @param etags 스냅샷 시점까지 반영된 커맨드 ETag
 * @param createdAt 생성 시각
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public record Snapshot(
    AggregateId aggregateId,
    long version,
    String aggregateTypeName,
    Payload state,
    Set<String> etags,
    Instant createdAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 version이 1 미만인 경우
     */
    public Snapshot {
        if (aggregateId == null) {
            throw new IllegalArgumentException("aggregateId cannot be null");
        }
        if (version < 1) {
            throw new IllegalArgumentException("version must be positive (current: " + version + ")");
        }
        if (aggregateTypeName == null || aggregateTypeName.isBlank()) {
            throw new IllegalArgumentException("aggregateTypeName cannot be null or blank");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
        etags = etags == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(etags));
    }
}
