/**
 * 예약 커맨드 모델.
 *
 * <ul>
 *   <li>{@link com.ryuqq.sourcing.core.scheduling.ScheduledCommand} - 영속 예약 기록</li>
 *   <li>{@link com.ryuqq.sourcing.core.scheduling.ScheduledCommandSelector} - 트리거 필터</li>
 *   <li>{@link com.ryuqq.sourcing.core.scheduling.TriggerResult} - 트리거 결과</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Sourcing Team
 */
package com.ryuqq.sourcing.core.scheduling;
