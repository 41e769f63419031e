/**
 * 커맨드 예약과 트리거.
 *
 * <ul>
 *   <li>{@link com.ryuqq.sourcing.application.scheduling.CommandScheduler}: 예약 저장 + 큐 메시지 전송</li>
 *   <li>{@link com.ryuqq.sourcing.application.scheduling.CommandTriggerEngine}: 실행 가능한 예약 커맨드 적용</li>
 *   <li>{@link com.ryuqq.sourcing.application.scheduling.RetryPolicy}: 재시도/선행 조건 대기 정책</li>
 * </ul>
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
package com.ryuqq.sourcing.application.scheduling;
