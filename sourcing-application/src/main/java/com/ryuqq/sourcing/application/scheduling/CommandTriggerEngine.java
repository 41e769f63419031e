package com.ryuqq.sourcing.application.scheduling;

import com.ryuqq.sourcing.application.repository.AggregateRepositories;
import com.ryuqq.sourcing.application.repository.EventSourcedRepository;
import com.ryuqq.sourcing.core.aggregate.EventSourcedAggregate;
import com.ryuqq.sourcing.core.command.Command;
import com.ryuqq.sourcing.core.command.CommandContext;
import com.ryuqq.sourcing.core.command.CommandValidationException;
import com.ryuqq.sourcing.core.command.ConstructorCommand;
import com.ryuqq.sourcing.core.outcome.Fail;
import com.ryuqq.sourcing.core.outcome.Ok;
import com.ryuqq.sourcing.core.outcome.Outcome;
import com.ryuqq.sourcing.core.outcome.Retry;
import com.ryuqq.sourcing.core.outcome.SaveResult;
import com.ryuqq.sourcing.core.scheduling.CommandFailure;
import com.ryuqq.sourcing.core.scheduling.DeliveryPrecondition;
import com.ryuqq.sourcing.core.scheduling.FailedCommand;
import com.ryuqq.sourcing.core.scheduling.FailureCode;
import com.ryuqq.sourcing.core.scheduling.ScheduledCommand;
import com.ryuqq.sourcing.core.scheduling.ScheduledCommandSelector;
import com.ryuqq.sourcing.core.scheduling.TriggerResult;
import com.ryuqq.sourcing.core.spi.EventStore;
import com.ryuqq.sourcing.core.spi.PayloadCodec;
import com.ryuqq.sourcing.core.spi.PayloadDecodingException;
import com.ryuqq.sourcing.core.spi.ScheduledCommandStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 예약 커맨드 트리거 엔진.
 *
 * <p>selector에 해당하는 SCHEDULED 기록을 실행 순서대로 하나씩 처리합니다:</p>
 * <pre>
 * 선행 조건 미충족 ─┬─ 대기 한도 이내 → 건너뜀 (SCHEDULED 유지, 결과에 포함 안 됨)
 *                  └─ 대기 한도 초과 → PERMANENTLY_FAILED
 * Aggregate 로드 → 커맨드 디코딩 → apply → save
 *   ├─ 성공 (또는 ETag로 이미 반영됨) → markApplied → Ok
 *   ├─ 재시도 가능한 실패 + 시도 횟수 남음 → markAttemptFailed (dueTime 연기) → Retry
 *   └─ 그 외 실패 → markFinalAttempt → Fail
 * </pre>
 *
 * <p>모든 기록 갱신은 "아직 SCHEDULED일 때만" 적용되는 조건부 갱신이므로 여러 작업자가
 * 동시에 트리거해도 같은 커맨드가 두 번 적용 완료로 기록되지 않습니다. 이벤트 중복은
 * 예약 커맨드의 ETag가 막습니다.</p>
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public class CommandTriggerEngine {

    private static final Logger log = LoggerFactory.getLogger(CommandTriggerEngine.class);

    static final String SCHEDULER_ACTOR = "scheduler";

    private final ScheduledCommandStore commandStore;
    private final EventStore eventStore;
    private final AggregateRepositories repositories;
    private final PayloadCodec codec;
    private final RetryPolicy retryPolicy;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @param commandStore 예약 커맨드 저장소
     * @param eventStore 선행 조건 확인용 이벤트 저장소
     * @param repositories 타입 이름별 Aggregate 저장소
     * @param codec 커맨드 본문 코덱
     * @param retryPolicy 재시도 정책
     * @param clock 시계
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public CommandTriggerEngine(
        ScheduledCommandStore commandStore,
        EventStore eventStore,
        AggregateRepositories repositories,
        PayloadCodec codec,
        RetryPolicy retryPolicy,
        Clock clock
    ) {
        if (commandStore == null) {
            throw new IllegalArgumentException("commandStore cannot be null");
        }
        if (eventStore == null) {
            throw new IllegalArgumentException("eventStore cannot be null");
        }
        if (repositories == null) {
            throw new IllegalArgumentException("repositories cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        if (retryPolicy == null) {
            throw new IllegalArgumentException("retryPolicy cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.commandStore = commandStore;
        this.eventStore = eventStore;
        this.repositories = repositories;
        this.codec = codec;
        this.retryPolicy = retryPolicy;
        this.clock = clock;
    }

    /**
     * 선택된 예약 커맨드 실행.
     *
     * @param selector 대상 필터
     * @return 성공/실패 요약 (재시도 가능한 실패는 permanent=false로 포함)
     */
    public TriggerResult trigger(ScheduledCommandSelector selector) {
        if (selector == null) {
            throw new IllegalArgumentException("selector cannot be null");
        }
        List<ScheduledCommand> candidates = commandStore.find(selector);
        if (candidates.isEmpty()) {
            return TriggerResult.empty();
        }

        List<ScheduledCommand> successes = new ArrayList<>();
        List<FailedCommand> failures = new ArrayList<>();
        for (ScheduledCommand command : candidates) {
            Optional<Outcome> outcome = deliver(command);
            if (outcome.isEmpty()) {
                continue;
            }
            Outcome result = outcome.get();
            if (result instanceof Ok) {
                successes.add(command);
            } else if (result instanceof Retry retry) {
                failures.add(new FailedCommand(command, retry.failure(), false));
            } else if (result instanceof Fail fail) {
                failures.add(new FailedCommand(command, fail.failure(), true));
            }
        }

        log.info("Trigger pass: selected={}, applied={}, failed={}", candidates.size(), successes.size(), failures.size());
        return new TriggerResult(successes, failures);
    }

    /**
     * 예약 커맨드 하나를 처리.
     *
     * @param command SCHEDULED 상태의 기록
     * @return 처리 결과 (선행 조건 대기로 건너뛰면 empty)
     */
    Optional<Outcome> deliver(ScheduledCommand command) {
        Instant now = clock.instant();
        DeliveryPrecondition precondition = command.precondition();
        if (precondition != null
            && eventStore.find(precondition.aggregateId(), precondition.sequenceNumber()).isEmpty()) {
            if (retryPolicy.preconditionWaitExceeded(command.effectiveDueTime(), now)) {
                return Optional.of(fail(command, FailureCode.PRECONDITION_TIMEOUT,
                    "Precondition " + precondition.aggregateId() + " #" + precondition.sequenceNumber()
                        + " not satisfied within " + retryPolicy.maxPreconditionWaitMs() + "ms", now));
            }
            log.debug("Deferring {}: waiting for {} #{}",
                command.key(), precondition.aggregateId(), precondition.sequenceNumber());
            return Optional.empty();
        }

        Optional<EventSourcedRepository<?>> repository = repositories.repository(command.aggregateTypeName());
        if (repository.isEmpty()) {
            return Optional.of(fail(command, FailureCode.UNKNOWN_AGGREGATE_TYPE,
                "Unknown aggregate type " + command.aggregateTypeName(), now));
        }
        try {
            return Optional.of(apply(repository.get(), command, now));
        } catch (RuntimeException e) {
            log.error("Unexpected failure delivering {}", command.key(), e);
            return Optional.of(failed(command, FailureCode.COMMAND_FAILED, describe(e), now));
        }
    }

    private <A extends EventSourcedAggregate<A>> Outcome apply(
        EventSourcedRepository<A> repository,
        ScheduledCommand scheduled,
        Instant now
    ) {
        Optional<Class<? extends Command<A>>> commandType = repository.aggregateType().commandType(scheduled.commandName());
        if (commandType.isEmpty()) {
            return fail(scheduled, FailureCode.UNKNOWN_COMMAND,
                "Unknown command " + scheduled.commandName() + " for " + scheduled.aggregateTypeName(), now);
        }
        Command<A> command;
        try {
            command = codec.decode(scheduled.commandBody(), commandType.get()).value();
        } catch (PayloadDecodingException e) {
            return fail(scheduled, FailureCode.UNDECODABLE_COMMAND, e.getMessage(), now);
        }

        String etag = command.etag() != null ? command.etag() : scheduled.key().defaultETag();
        Optional<A> existing = repository.getLatest(scheduled.aggregateId());
        A aggregate;
        if (command instanceof ConstructorCommand) {
            if (existing.isPresent()) {
                if (existing.get().hasETag(etag)) {
                    return applied(scheduled, 0, now);
                }
                return fail(scheduled, FailureCode.AGGREGATE_ALREADY_EXISTS,
                    scheduled.aggregateTypeName() + " " + scheduled.aggregateId() + " already exists", now);
            }
            aggregate = repository.aggregateType().newInstance(scheduled.aggregateId());
        } else if (existing.isPresent()) {
            aggregate = existing.get();
        } else {
            return failed(scheduled, FailureCode.AGGREGATE_NOT_FOUND,
                scheduled.aggregateTypeName() + " " + scheduled.aggregateId() + " not found", now);
        }

        CommandContext context = CommandContext.of(clock).withActor(SCHEDULER_ACTOR).withETag(etag);
        boolean changed;
        try {
            changed = aggregate.apply(command, context);
        } catch (CommandValidationException e) {
            return failed(scheduled, FailureCode.VALIDATION_FAILED, e.getMessage(), now);
        } catch (RuntimeException e) {
            log.warn("Command {} failed for {}", scheduled.commandName(), scheduled.key(), e);
            return failed(scheduled, FailureCode.COMMAND_FAILED, describe(e), now);
        }
        if (!changed) {
            return applied(scheduled, 0, now);
        }

        SaveResult result = repository.save(aggregate);
        if (result instanceof SaveResult.Conflict conflict) {
            return failed(scheduled, FailureCode.CONCURRENCY_CONFLICT, conflict.exception().getMessage(), now);
        }
        return applied(scheduled, ((SaveResult.Saved) result).committedEvents().size(), now);
    }

    private Outcome applied(ScheduledCommand command, int recordedEvents, Instant now) {
        if (commandStore.markApplied(command.key(), now).isEmpty()) {
            log.debug("{} was resolved by another worker", command.key());
        }
        if (recordedEvents == 0) {
            log.debug("{} already reflected on {}", command.key(), command.aggregateId());
        }
        return new Ok(command.key(), recordedEvents);
    }

    /**
     * 재시도 가능 여부와 남은 시도 횟수에 따라 Retry 또는 Fail.
     */
    private Outcome failed(ScheduledCommand command, FailureCode code, String message, Instant now) {
        int attempt = command.attempts() + 1;
        CommandFailure failure = new CommandFailure(code, message, attempt, now);
        if (!code.isRetryable() || !retryPolicy.allowsRetryAfter(attempt)) {
            return finalFailure(command, failure, now);
        }
        Duration delay = retryPolicy.backoff().delayAfter(attempt);
        if (commandStore.markAttemptFailed(command.key(), command.attempts(), failure, now.plus(delay)).isEmpty()) {
            log.debug("{} changed concurrently, retry bookkeeping skipped", command.key());
        }
        log.warn("{} failed ({} attempt {}/{}), retrying in {}ms: {}",
            command.key(), code, attempt, retryPolicy.maxAttempts(), delay.toMillis(), failure.message());
        return new Retry(command.key(), failure, delay.toMillis());
    }

    private Outcome fail(ScheduledCommand command, FailureCode code, String message, Instant now) {
        return finalFailure(command, new CommandFailure(code, message, command.attempts() + 1, now), now);
    }

    private Outcome finalFailure(ScheduledCommand command, CommandFailure failure, Instant now) {
        if (commandStore.markFinalAttempt(command.key(), failure, now).isEmpty()) {
            log.debug("{} was resolved by another worker", command.key());
        }
        log.error("{} permanently failed ({}): {}", command.key(), failure.code(), failure.message());
        return new Fail(command.key(), failure);
    }

    private static String describe(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
