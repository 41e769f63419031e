package com.ryuqq.sourcing.core.model;

import java.util.UUID;

/**
 * Aggregate(이벤트 스트림)의 전역 고유 식별자.
 *
 * <p>AggregateId는 이벤트 스트림, 스냅샷, 예약 커맨드를 묶는 키로 사용됩니다.
 * 동일한 AggregateId를 가진 이벤트들은 하나의 스트림을 구성하며,
 * 스트림 내에서 sequenceNumber가 1부터 연속적으로 증가합니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_), 콜론(:)만 허용</li>
 * </ul>
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public final class AggregateId {

    private final String value;

    private AggregateId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("AggregateId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("AggregateId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_:]+$")) {
            throw new IllegalArgumentException("AggregateId contains invalid characters. Only alphanumeric, hyphen, underscore and colon are allowed");
        }
        this.value = value;
    }

    /**
     * AggregateId 생성.
     *
     * @param value AggregateId 값
     * @return AggregateId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static AggregateId of(String value) {
        return new AggregateId(value);
    }

    /**
     * 무작위 UUID 기반 AggregateId 생성.
     *
     * @return 새 AggregateId
     */
    public static AggregateId random() {
        return new AggregateId(UUID.randomUUID().toString());
    }

    /**
     * AggregateId 값 조회.
     *
     * @return AggregateId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AggregateId that = (AggregateId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "AggregateId{" + value + '}';
    }
}
