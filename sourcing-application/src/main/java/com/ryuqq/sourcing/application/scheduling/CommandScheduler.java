package com.ryuqq.sourcing.application.scheduling;

import com.ryuqq.sourcing.core.aggregate.AggregateType;
import com.ryuqq.sourcing.core.aggregate.EventSourcedAggregate;
import com.ryuqq.sourcing.core.command.Command;
import com.ryuqq.sourcing.core.model.AggregateId;
import com.ryuqq.sourcing.core.model.Payload;
import com.ryuqq.sourcing.core.scheduling.DeliveryPrecondition;
import com.ryuqq.sourcing.core.scheduling.ScheduledCommand;
import com.ryuqq.sourcing.core.scheduling.ScheduledCommandKey;
import com.ryuqq.sourcing.core.scheduling.ScheduledCommandMessage;
import com.ryuqq.sourcing.core.spi.CommandQueue;
import com.ryuqq.sourcing.core.spi.EventStore;
import com.ryuqq.sourcing.core.spi.PayloadCodec;
import com.ryuqq.sourcing.core.spi.ScheduledCommandStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * 커맨드 예약.
 *
 * <p>예약 시점에 sequenceNumber를 확보하고 기록을 저장한 뒤, 조회 키만 담은 메시지를
 * dueTime까지의 지연과 함께 큐로 보냅니다. 큐가 없으면 기록만 저장되며 sweeper가
 * 처리합니다.</p>
 *
 * <p>sequenceNumber는 이벤트 스트림의 최신 번호와 이미 예약된 최대 번호 중 큰 값 + 1 입니다.</p>
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public class CommandScheduler {

    private static final Logger log = LoggerFactory.getLogger(CommandScheduler.class);

    private static final int MAX_RESERVATION_ATTEMPTS = 10;

    private final ScheduledCommandStore commandStore;
    private final EventStore eventStore;
    private final PayloadCodec codec;
    private final CommandQueue queue;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @param commandStore 예약 커맨드 저장소
     * @param eventStore sequenceNumber 확보용 이벤트 저장소
     * @param codec 커맨드/메시지 코덱
     * @param queue 조회 메시지를 보낼 큐 (nullable)
     * @param clock 시계
     * @throws IllegalArgumentException queue 이외의 인자가 null인 경우
     */
    public CommandScheduler(
        ScheduledCommandStore commandStore,
        EventStore eventStore,
        PayloadCodec codec,
        CommandQueue queue,
        Clock clock
    ) {
        if (commandStore == null) {
            throw new IllegalArgumentException("commandStore cannot be null");
        }
        if (eventStore == null) {
            throw new IllegalArgumentException("eventStore cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.commandStore = commandStore;
        this.eventStore = eventStore;
        this.codec = codec;
        this.queue = queue;
        this.clock = clock;
    }

    /**
     * 선행 조건 없이 예약.
     *
     * @see #schedule(AggregateType, AggregateId, Command, Instant, DeliveryPrecondition)
     */
    public <A extends EventSourcedAggregate<A>> ScheduledCommand schedule(
        AggregateType<A> aggregateType,
        AggregateId aggregateId,
        Command<A> command,
        Instant dueTime
    ) {
        return schedule(aggregateType, aggregateId, command, dueTime, null);
    }

    /**
     * 커맨드 예약.
     *
     * @param aggregateType 대상 Aggregate 타입
     * @param aggregateId 대상 Aggregate ID
     * @param command 예약할 커맨드 (타입에 등록된 이름이어야 함)
     * @param dueTime 실행 가능 시각 (null이면 즉시)
     * @param precondition 선행 조건 (nullable)
     * @return 저장된 예약 기록
     * @throws IllegalArgumentException 등록되지 않은 커맨드이거나 필수 인자가 null인 경우
     * @throws IllegalStateException sequenceNumber 확보에 반복 실패한 경우
     */
    public <A extends EventSourcedAggregate<A>> ScheduledCommand schedule(
        AggregateType<A> aggregateType,
        AggregateId aggregateId,
        Command<A> command,
        Instant dueTime,
        DeliveryPrecondition precondition
    ) {
        if (aggregateType == null) {
            throw new IllegalArgumentException("aggregateType cannot be null");
        }
        if (aggregateId == null) {
            throw new IllegalArgumentException("aggregateId cannot be null");
        }
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        String commandName = command.commandName();
        if (aggregateType.commandType(commandName).isEmpty()) {
            throw new IllegalArgumentException(
                "Command " + commandName + " is not registered for " + aggregateType.name()
            );
        }
        Payload body = codec.encode(command);
        Instant now = clock.instant();

        ScheduledCommand scheduled = reserve(aggregateType.name(), aggregateId, commandName, body, dueTime, precondition, now);
        log.info("Scheduled {} for {} {} as #{} (due={})",
            commandName, aggregateType.name(), aggregateId, scheduled.sequenceNumber(), dueTime);

        if (queue != null) {
            Duration delay = dueTime == null || !dueTime.isAfter(now) ? Duration.ZERO : Duration.between(now, dueTime);
            queue.send(aggregateId.getValue(), codec.encode(ScheduledCommandMessage.of(scheduled)), delay);
        }
        return scheduled;
    }

    private ScheduledCommand reserve(
        String aggregateTypeName,
        AggregateId aggregateId,
        String commandName,
        Payload body,
        Instant dueTime,
        DeliveryPrecondition precondition,
        Instant now
    ) {
        for (int attempt = 0; attempt < MAX_RESERVATION_ATTEMPTS; attempt++) {
            long next = Math.max(
                eventStore.latestSequenceNumber(aggregateId),
                commandStore.highestSequenceNumber(aggregateId)
            ) + 1;
            ScheduledCommand candidate = ScheduledCommand.schedule(
                new ScheduledCommandKey(aggregateId, next), aggregateTypeName, commandName, body, dueTime, precondition, now
            );
            if (commandStore.insert(candidate)) {
                return candidate;
            }
            log.debug("Sequence #{} of {} taken concurrently, retrying", next, aggregateId);
        }
        throw new IllegalStateException(
            "Could not reserve a sequence number for " + aggregateId + " after " + MAX_RESERVATION_ATTEMPTS + " attempts"
        );
    }
}
