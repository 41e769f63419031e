package com.ryuqq.sourcing.core.event;

import com.ryuqq.sourcing.core.model.AggregateId;

import java.time.Instant;

/**
 * 이벤트 스트림에 기록되는 불변 사실 (Event).
 *
 * <p>DomainEvent는 타입이 지정된 도메인 데이터({@code data})에 스트림 메타데이터를 덧붙인
 * 봉투(envelope)입니다. 도메인 데이터 자체는 순수한 값(record 등)이며,
 * Aggregate에 대한 변경은 {@link com.ryuqq.sourcing.core.aggregate.AggregateType}에
 * 등록된 applier가 수행합니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>sequenceNumber는 1 이상</li>
 *   <li>동일 스트림 내에서 sequenceNumber는 1부터 빈틈 없이 증가</li>
 * </ul>
 *
 * @param aggregateId 소유 스트림 식별자
 * @param sequenceNumber 스트림 내 순번 (1 이상)
 * @param eventType 이벤트 타입 판별자
 * @param timestamp 이벤트 생성 시각
 * @param actor 이벤트를 발생시킨 주체 (null 가능)
 * @param etag 이벤트를 발생시킨 커맨드의 ETag (null 가능)
 * @param data 도메인 데이터
 * @param <T> 도메인 데이터 타입
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public record DomainEvent<T>(
    AggregateId aggregateId,
    long sequenceNumber,
    String eventType,
    Instant timestamp,
    String actor,
    String etag,
    T data
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 sequenceNumber가 1 미만인 경우
     */
    public DomainEvent {
        if (aggregateId == null) {
            throw new IllegalArgumentException("aggregateId cannot be null");
        }
        if (sequenceNumber < 1) {
            throw new IllegalArgumentException("sequenceNumber must be positive (current: " + sequenceNumber + ")");
        }
        if (eventType == null || eventType.isBlank()) {
            throw new IllegalArgumentException("eventType cannot be null or blank");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        if (data == null) {
            throw new IllegalArgumentException("data cannot be null");
        }
    }

    /**
     * 역직렬화할 수 없었던 이벤트인지 확인.
     *
     * @return data가 {@link UnrecognizedEvent}이면 true
     */
    public boolean isRecognized() {
        return !(data instanceof UnrecognizedEvent);
    }

    /**
     * 데이터 타입을 확인한 뒤 같은 이벤트를 구체 타입으로 반환.
     *
     * @param dataType 기대하는 데이터 타입
     * @param <U> 데이터 타입
     * @return 같은 메타데이터를 가진 이벤트
     * @throws ClassCastException 데이터가 해당 타입이 아닌 경우
     */
    public <U> DomainEvent<U> withDataAs(Class<U> dataType) {
        return new DomainEvent<>(aggregateId, sequenceNumber, eventType, timestamp, actor, etag, dataType.cast(data));
    }
}
