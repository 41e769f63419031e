package com.ryuqq.sourcing.adapter.runner;

/**
 * 큐 메시지 하나에 대한 확인(ack) 결정.
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public enum DeliveryDecision {

    /**
     * 이번 전달에서 적용됨: 메시지 완료.
     */
    COMPLETED,

    /**
     * 이전(또는 동시) 전달이 이미 종료 상태로 만듦: 재전달 방지를 위해 완료.
     */
    COMPLETED_PREVIOUSLY_RESOLVED,

    /**
     * 미확인 상태로 남김: 전송 계층이 재전달.
     */
    LEFT_FOR_REDELIVERY;

    public boolean isCompleted() {
        return this != LEFT_FOR_REDELIVERY;
    }
}
