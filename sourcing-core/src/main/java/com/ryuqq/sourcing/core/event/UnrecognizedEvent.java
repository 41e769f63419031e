package com.ryuqq.sourcing.core.event;

import com.ryuqq.sourcing.core.model.Payload;

/**
 * 알 수 없는 타입이라 적용되지 못한 이벤트의 자리 표시자.
 *
 * <p>Rehydration 중 등록되지 않은 eventType을 만나면 이벤트를 건너뛰되,
 * 스트림의 버전 계산이 어긋나지 않도록 이 자리 표시자를 이벤트 히스토리에 남깁니다.</p>
 *
 * @param eventType 저장소에 기록된 원래 eventType
 * @param body 원본 본문
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public record UnrecognizedEvent(String eventType, Payload body) {
}
