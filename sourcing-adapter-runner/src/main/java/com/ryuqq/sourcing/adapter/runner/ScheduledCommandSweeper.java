package com.ryuqq.sourcing.adapter.runner;

import com.ryuqq.sourcing.application.runtime.Runtime;
import com.ryuqq.sourcing.application.scheduling.CommandTriggerEngine;
import com.ryuqq.sourcing.core.scheduling.ScheduledCommandSelector;
import com.ryuqq.sourcing.core.scheduling.TriggerResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 실행 가능한 예약 커맨드를 주기적으로 트리거하는 Sweeper.
 *
 * <p>큐 메시지가 유실되었거나 재전달 한도를 넘긴 커맨드, 큐 없이 예약된 커맨드,
 * 재시도 대기 후 다시 실행 가능해진 커맨드를 처리합니다.
 * 주기적으로 호출되어야 합니다 (예: ScheduledExecutorService).</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. selector = due(now - graceMs).withLimit(batchSize)
 * 2. triggerEngine.trigger(selector)
 * 3. 성공/실패 카운트 로깅
 * </pre>
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public final class ScheduledCommandSweeper implements Runtime {

    private static final Logger log = LoggerFactory.getLogger(ScheduledCommandSweeper.class);

    private final CommandTriggerEngine triggerEngine;
    private final SweeperConfig config;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @param triggerEngine 트리거 엔진
     * @param config 설정
     * @param clock 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ScheduledCommandSweeper(CommandTriggerEngine triggerEngine, SweeperConfig config, Clock clock) {
        if (triggerEngine == null) {
            throw new IllegalArgumentException("triggerEngine cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.triggerEngine = triggerEngine;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public void pump() {
        scan();
    }

    /**
     * 주어진 스케줄러에서 scanIntervalMs 간격으로 스캔을 반복.
     *
     * @param scheduler 스캔을 실행할 스케줄러
     * @return 반복 작업 (취소하면 스캔 중단)
     */
    public ScheduledFuture<?> start(ScheduledExecutorService scheduler) {
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        log.info("Sweeper started (interval={}ms, grace={}ms, batchSize={})",
            config.scanIntervalMs(), config.graceMs(), config.batchSize());
        return scheduler.scheduleWithFixedDelay(this::pump, 0, config.scanIntervalMs(), TimeUnit.MILLISECONDS);
    }

    /**
     * 한 번 스캔.
     *
     * <p>예외가 발생해도 전파하지 않고 로깅한 뒤 빈 결과를 반환합니다.
     * 다음 스캔에서 다시 시도됩니다.</p>
     *
     * @return 트리거 결과
     */
    public TriggerResult scan() {
        Instant threshold = clock.instant().minusMillis(config.graceMs());
        log.debug("Sweeper scan started (due <= {})", threshold);
        try {
            TriggerResult result = triggerEngine.trigger(
                ScheduledCommandSelector.due(threshold).withLimit(config.batchSize())
            );
            if (result.hasSuccesses() || result.hasFailures()) {
                log.info("Sweeper scan completed: {} applied, {} failed ({} permanently)",
                    result.successfulCommands().size(), result.failedCommands().size(), result.permanentFailures().size());
            }
            return result;
        } catch (RuntimeException e) {
            log.error("Sweeper scan failed", e);
            return TriggerResult.empty();
        }
    }
}
