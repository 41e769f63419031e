package com.ryuqq.sourcing.adapter.runner;

import com.ryuqq.sourcing.application.runtime.Runtime;
import com.ryuqq.sourcing.application.scheduling.CommandTriggerEngine;
import com.ryuqq.sourcing.core.model.AggregateId;
import com.ryuqq.sourcing.core.scheduling.ScheduledCommand;
import com.ryuqq.sourcing.core.scheduling.ScheduledCommandKey;
import com.ryuqq.sourcing.core.scheduling.ScheduledCommandMessage;
import com.ryuqq.sourcing.core.scheduling.ScheduledCommandSelector;
import com.ryuqq.sourcing.core.scheduling.TriggerResult;
import com.ryuqq.sourcing.core.spi.CommandQueue;
import com.ryuqq.sourcing.core.spi.PayloadCodec;
import com.ryuqq.sourcing.core.spi.QueueExceptionListener;
import com.ryuqq.sourcing.core.spi.QueueMessage;
import com.ryuqq.sourcing.core.spi.ScheduledCommandStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * 큐 메시지를 트리거 호출로 연결하는 전달 어댑터.
 *
 * <p>메시지는 예약 커맨드의 조회 키(aggregateId, sequenceNumber, dueTime)만 담고 있습니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * pump() 호출
 *   ↓
 * receive(batchSize) → [Message1, Message2, ...]
 *   ↓
 * For each Message (worker pool):
 *   1. 조회 키 디코딩
 *   2. trigger(due ≤ max(dueTime, now), aggregateId)
 *   3. 실패 없음 + 성공 1건 이상 → complete (COMPLETED)
 *   4. 저장소에 해당 키가 이미 종료 상태 → complete (COMPLETED_PREVIOUSLY_RESOLVED)
 *   5. 그 외 → 미확인 (LEFT_FOR_REDELIVERY)
 * </pre>
 *
 * <p>메시지를 거부(reject)하지 않습니다. 처리 허용 시간 초과나 예외는 모두
 * "미확인"으로 처리되어 전송 계층의 재전달에 맡깁니다. 중복 전달은 이미 APPLIED인
 * 기록을 만나 다시 적용되지 않고 완료됩니다.</p>
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public final class QueueDeliveryAdapter implements Runtime {

    private static final Logger log = LoggerFactory.getLogger(QueueDeliveryAdapter.class);

    private final CommandQueue queue;
    private final CommandTriggerEngine triggerEngine;
    private final ScheduledCommandStore commandStore;
    private final PayloadCodec codec;
    private final QueueDeliveryConfig config;
    private final Clock clock;
    private final ExecutorService workerExecutor;

    private final List<Consumer<QueueMessage>> messageListeners = new CopyOnWriteArrayList<>();
    private final List<QueueExceptionListener> exceptionListeners = new CopyOnWriteArrayList<>();

    /**
     * 생성자. 큐의 예외 채널에 이 어댑터를 등록합니다.
     *
     * @param queue 커맨드 큐
     * @param triggerEngine 트리거 엔진
     * @param commandStore 이전 처리 여부 확인용 저장소
     * @param codec 메시지 코덱
     * @param config 설정
     * @param clock 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public QueueDeliveryAdapter(
        CommandQueue queue,
        CommandTriggerEngine triggerEngine,
        ScheduledCommandStore commandStore,
        PayloadCodec codec,
        QueueDeliveryConfig config,
        Clock clock
    ) {
        if (queue == null) {
            throw new IllegalArgumentException("queue cannot be null");
        }
        if (triggerEngine == null) {
            throw new IllegalArgumentException("triggerEngine cannot be null");
        }
        if (commandStore == null) {
            throw new IllegalArgumentException("commandStore cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.queue = queue;
        this.triggerEngine = triggerEngine;
        this.commandStore = commandStore;
        this.codec = codec;
        this.config = config;
        this.clock = clock;
        this.workerExecutor = Executors.newFixedThreadPool(config.concurrency());
        queue.setExceptionListener(this::onTransportException);
    }

    /**
     * 메시지 수신 리스너 등록 (처리 전에 호출됨).
     *
     * @param listener 리스너
     */
    public void addMessageListener(Consumer<QueueMessage> listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        messageListeners.add(listener);
    }

    /**
     * 예외 리스너 등록 (세션 유실, 처리 중 예외).
     *
     * @param listener 리스너
     */
    public void addExceptionListener(QueueExceptionListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        exceptionListeners.add(listener);
    }

    @Override
    public void pump() {
        if (workerExecutor.isShutdown()) {
            throw new IllegalStateException("QueueDeliveryAdapter is shut down");
        }
        List<QueueMessage> messages = queue.receive(config.batchSize());
        for (QueueMessage message : messages) {
            workerExecutor.submit(() -> handle(message));
        }
    }

    /**
     * 메시지 하나를 처리하고 확인 여부를 결정.
     *
     * @param message 수신된 메시지
     * @return 결정
     */
    public DeliveryDecision handle(QueueMessage message) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        long startNanos = System.nanoTime();
        notifyMessageListeners(message);
        try {
            ScheduledCommandMessage lookup = codec.decode(message.body(), ScheduledCommandMessage.class).value();
            ScheduledCommandKey key = new ScheduledCommandKey(AggregateId.of(lookup.aggregateId()), lookup.sequenceNumber());

            Instant now = clock.instant();
            Instant dueAtOrBefore = lookup.dueTime() != null && lookup.dueTime().isAfter(now) ? lookup.dueTime() : now;
            TriggerResult result = triggerEngine.trigger(
                ScheduledCommandSelector.due(dueAtOrBefore).forAggregate(key.aggregateId())
            );

            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
            if (elapsedMs > config.maxProcessingTimeMs()) {
                log.warn("Handling window of {}ms exceeded for message {} ({}ms), leaving it for redelivery",
                    config.maxProcessingTimeMs(), message.messageId(), elapsedMs);
                return DeliveryDecision.LEFT_FOR_REDELIVERY;
            }

            if (!result.hasFailures() && result.hasSuccesses()) {
                queue.complete(message);
                log.debug("Message {} for {} completed", message.messageId(), key);
                return DeliveryDecision.COMPLETED;
            }

            Optional<ScheduledCommand> stored = commandStore.get(key);
            if (stored.isPresent() && stored.get().state().isTerminal()) {
                queue.complete(message);
                log.debug("Message {} for {} completed, already {}", message.messageId(), key, stored.get().state());
                return DeliveryDecision.COMPLETED_PREVIOUSLY_RESOLVED;
            }

            log.info("Message {} for {} left for redelivery (applied={}, failed={})",
                message.messageId(), key, result.successfulCommands().size(), result.failedCommands().size());
            return DeliveryDecision.LEFT_FOR_REDELIVERY;

        } catch (RuntimeException e) {
            log.error("Failed to handle message {}, leaving it for redelivery", message.messageId(), e);
            notifyExceptionListeners(message, e);
            return DeliveryDecision.LEFT_FOR_REDELIVERY;
        }
    }

    /**
     * 어댑터 종료 (진행 중인 처리 완료 대기).
     *
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        workerExecutor.shutdown();
        if (!workerExecutor.awaitTermination(60, TimeUnit.SECONDS)) {
            workerExecutor.shutdownNow();
        }
    }

    private void onTransportException(QueueMessage message, Throwable error) {
        log.error("Queue transport failure{}", message == null ? "" : " on message " + message.messageId(), error);
        notifyExceptionListeners(message, error);
    }

    private void notifyMessageListeners(QueueMessage message) {
        for (Consumer<QueueMessage> listener : messageListeners) {
            try {
                listener.accept(message);
            } catch (RuntimeException e) {
                log.warn("Message listener failed for {}", message.messageId(), e);
            }
        }
    }

    private void notifyExceptionListeners(QueueMessage message, Throwable error) {
        for (QueueExceptionListener listener : exceptionListeners) {
            try {
                listener.onException(message, error);
            } catch (RuntimeException e) {
                log.warn("Exception listener failed", e);
            }
        }
    }
}
