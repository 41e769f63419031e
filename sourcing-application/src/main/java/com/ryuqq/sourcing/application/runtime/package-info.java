/**
 * 백그라운드 전달 Runtime 인터페이스.
 *
 * <p>구현체는 adapter-runner 모듈의 {@code QueueDeliveryAdapter}(큐 메시지)와
 * {@code ScheduledCommandSweeper}(저장소 주기 스캔)입니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.sourcing.application.runtime;
