/**
 * 이벤트 소싱 저장소.
 *
 * <p>{@link com.ryuqq.sourcing.application.repository.AggregateRehydrator}가 스냅샷과 이벤트로
 * 상태를 복원하고, {@link com.ryuqq.sourcing.application.repository.DefaultEventSourcedRepository}가
 * 저장과 커밋 후 발행을 담당합니다.</p>
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
package com.ryuqq.sourcing.application.repository;
