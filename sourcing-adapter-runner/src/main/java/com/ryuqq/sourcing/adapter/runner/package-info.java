/**
 * Runner Adapter Layer - {@link com.ryuqq.sourcing.application.runtime.Runtime} 구현체.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.sourcing.adapter.runner.QueueDeliveryAdapter} - 큐 메시지 → 트리거 → ack 결정</li>
 *   <li>{@link com.ryuqq.sourcing.adapter.runner.ScheduledCommandSweeper} - 저장소 주기 스캔</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (QueueDeliveryAdapter, ScheduledCommandSweeper)
 *   ↓ implements
 * application (Runtime, CommandTriggerEngine)
 *   ↓ depends on
 * core (ScheduledCommand, TriggerResult, CommandQueue SPI)
 * </pre>
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
package com.ryuqq.sourcing.adapter.runner;
