package com.ryuqq.sourcing.application.scheduling;

import com.ryuqq.sourcing.adapter.inmemory.bus.InMemoryEventBus;
import com.ryuqq.sourcing.adapter.inmemory.store.InMemoryEventStore;
import com.ryuqq.sourcing.adapter.inmemory.store.InMemoryScheduledCommandStore;
import com.ryuqq.sourcing.adapter.inmemory.store.InMemorySnapshotStore;
import com.ryuqq.sourcing.adapter.jackson.JacksonPayloadCodec;
import com.ryuqq.sourcing.application.repository.AggregateRepositories;
import com.ryuqq.sourcing.application.repository.EventSourcedRepository;
import com.ryuqq.sourcing.core.command.CommandContext;
import com.ryuqq.sourcing.core.event.DomainEvent;
import com.ryuqq.sourcing.core.model.AggregateId;
import com.ryuqq.sourcing.core.model.Payload;
import com.ryuqq.sourcing.core.scheduling.DeliveryPrecondition;
import com.ryuqq.sourcing.core.scheduling.FailedCommand;
import com.ryuqq.sourcing.core.scheduling.FailureCode;
import com.ryuqq.sourcing.core.scheduling.ScheduledCommand;
import com.ryuqq.sourcing.core.scheduling.ScheduledCommandKey;
import com.ryuqq.sourcing.core.scheduling.ScheduledCommandSelector;
import com.ryuqq.sourcing.core.scheduling.TriggerResult;
import com.ryuqq.sourcing.core.statemachine.ScheduledCommandState;
import com.ryuqq.sourcing.testkit.fixture.CustomerAccount;
import com.ryuqq.sourcing.testkit.fixture.MutableClock;
import com.ryuqq.sourcing.testkit.fixture.Order;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * CommandTriggerEngine 테스트.
 *
 * <p>인메모리 저장소와 수동 시계로 예약 커맨드의 상태 전이를 검증합니다.</p>
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
class CommandTriggerEngineTest {

    private static final Instant T0 = Instant.parse("2024-03-01T09:00:00Z");
    private static final AggregateId ORDER_ID = AggregateId.of("order-1");

    private MutableClock clock;
    private InMemoryEventStore eventStore;
    private InMemoryScheduledCommandStore commandStore;
    private EventSourcedRepository<Order> orders;
    private EventSourcedRepository<CustomerAccount> customers;
    private CommandScheduler scheduler;
    private CommandTriggerEngine engine;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        eventStore = new InMemoryEventStore();
        commandStore = new InMemoryScheduledCommandStore();
        JacksonPayloadCodec codec = new JacksonPayloadCodec();
        AggregateRepositories repositories = new AggregateRepositories(
            eventStore, new InMemorySnapshotStore(), codec, new InMemoryEventBus(), clock
        );
        orders = repositories.register(Order.TYPE);
        customers = repositories.register(CustomerAccount.TYPE);

        RetryPolicy policy = new RetryPolicy()
            .withMaxAttempts(3)
            .withBackoff(1000, 60000, 0.0)
            .withMaxPreconditionWaitMs(600000);
        engine = new CommandTriggerEngine(commandStore, eventStore, repositories, codec, policy, clock);
        scheduler = new CommandScheduler(commandStore, eventStore, codec, null, clock);
    }

    private void createOrder(AggregateId id) {
        Order order = Order.TYPE.newInstance(id);
        order.apply(new Order.CreateOrder("Alice"), CommandContext.of(clock));
        orders.save(order).orElseThrow();
    }

    private TriggerResult triggerNow() {
        return engine.trigger(ScheduledCommandSelector.due(clock.instant()));
    }

    private ScheduledCommand stored(ScheduledCommand command) {
        return commandStore.get(command.key()).orElseThrow();
    }

    @Nested
    class 적용 {

        @Test
        void 실행_시각이_된_커맨드는_한_번만_적용된다() {
            createOrder(ORDER_ID);
            ScheduledCommand scheduled = scheduler.schedule(
                Order.TYPE, ORDER_ID, new Order.AddItem("Widget", 2), T0.plusSeconds(60)
            );

            assertThat(triggerNow().hasSuccesses()).isFalse();

            clock.advance(Duration.ofSeconds(60));
            TriggerResult first = engine.trigger(ScheduledCommandSelector.due(clock.instant()));
            TriggerResult second = engine.trigger(ScheduledCommandSelector.due(clock.instant()));

            assertThat(first.successfulCommands()).extracting(ScheduledCommand::key).containsExactly(scheduled.key());
            assertThat(first.failedCommands()).isEmpty();
            assertThat(second.successfulCommands()).isEmpty();
            assertThat(second.failedCommands()).isEmpty();

            ScheduledCommand applied = stored(scheduled);
            assertThat(applied.state()).isEqualTo(ScheduledCommandState.APPLIED);
            assertThat(applied.appliedTime()).isEqualTo(clock.instant());

            Order order = orders.getLatest(ORDER_ID).orElseThrow();
            assertThat(order.version()).isEqualTo(2);
            assertThat(order.totalQuantity()).isEqualTo(2);
            DomainEvent<?> event = order.eventHistory().get(1);
            assertThat(event.etag()).isEqualTo("scheduled:order-1:2");
            assertThat(event.actor()).isEqualTo("scheduler");
            assertThat(event.timestamp()).isEqualTo(clock.instant());
        }

        @Test
        void dueTime이_없으면_즉시_실행_가능하다() {
            createOrder(ORDER_ID);
            scheduler.schedule(Order.TYPE, ORDER_ID, new Order.AddItem("Widget", 1), null);

            assertThat(triggerNow().successfulCommands()).hasSize(1);
        }

        @Test
        void 실행_시각_순서대로_적용된다() {
            createOrder(ORDER_ID);
            ScheduledCommand place = scheduler.schedule(Order.TYPE, ORDER_ID, new Order.Place(), T0.plusSeconds(120));
            ScheduledCommand addItem = scheduler.schedule(
                Order.TYPE, ORDER_ID, new Order.AddItem("Widget", 1), T0.plusSeconds(60)
            );
            clock.advance(Duration.ofMinutes(3));

            TriggerResult result = triggerNow();

            assertThat(result.successfulCommands()).extracting(ScheduledCommand::key)
                .containsExactly(addItem.key(), place.key());
            assertThat(orders.getLatest(ORDER_ID).orElseThrow().isPlaced()).isTrue();
        }

        @Test
        void 생성자_커맨드는_새_Aggregate를_만든다() {
            AggregateId newId = AggregateId.of("order-new");
            ScheduledCommand create = scheduler.schedule(Order.TYPE, newId, new Order.CreateOrder("Carol"), null);

            TriggerResult result = triggerNow();

            assertThat(create.sequenceNumber()).isEqualTo(1);
            assertThat(result.successfulCommands()).hasSize(1);
            assertThat(orders.getLatest(newId).orElseThrow().customerName()).isEqualTo("Carol");
        }

        @Test
        void 이미_반영된_ETag의_커맨드는_이벤트_없이_적용_완료로_기록된다() {
            createOrder(ORDER_ID);
            ScheduledCommand scheduled = scheduler.schedule(Order.TYPE, ORDER_ID, new Order.AddItem("Widget", 1), null);

            // 이벤트는 저장되었지만 적용 표시 전에 작업자가 중단된 상황
            Order order = orders.getLatest(ORDER_ID).orElseThrow();
            order.apply(new Order.AddItem("Widget", 1), CommandContext.of(clock).withETag(scheduled.key().defaultETag()));
            orders.save(order).orElseThrow();

            TriggerResult result = triggerNow();

            assertThat(result.successfulCommands()).hasSize(1);
            assertThat(stored(scheduled).state()).isEqualTo(ScheduledCommandState.APPLIED);
            assertThat(orders.getLatest(ORDER_ID).orElseThrow().version()).isEqualTo(2);
        }

        @Test
        void 선택되지_않은_기록은_변경되지_않는다() {
            AggregateId other = AggregateId.of("order-2");
            createOrder(ORDER_ID);
            createOrder(other);
            scheduler.schedule(Order.TYPE, ORDER_ID, new Order.AddItem("Widget", 1), null);
            ScheduledCommand untouched = scheduler.schedule(Order.TYPE, other, new Order.AddItem("Gadget", 1), null);

            TriggerResult result = engine.trigger(ScheduledCommandSelector.due(clock.instant()).forAggregate(ORDER_ID));

            assertThat(result.successfulCommands()).hasSize(1);
            assertThat(stored(untouched)).isEqualTo(untouched);
            assertThat(orders.getLatest(other).orElseThrow().version()).isEqualTo(1);
        }
    }

    @Nested
    class 선행_조건 {

        private final AggregateId customerId = AggregateId.of("customer-1");

        @Test
        void 충족되지_않으면_건너뛰고_충족되면_적용한다() {
            createOrder(ORDER_ID);
            ScheduledCommand scheduled = scheduler.schedule(
                Order.TYPE, ORDER_ID, new Order.AddItem("Welcome gift", 1), null, new DeliveryPrecondition(customerId, 1)
            );

            TriggerResult waiting = triggerNow();

            assertThat(waiting.successfulCommands()).isEmpty();
            assertThat(waiting.failedCommands()).isEmpty();
            assertThat(stored(scheduled)).isEqualTo(scheduled);

            customers.save(CustomerAccount.open(customerId, "alice")).orElseThrow();
            TriggerResult ready = triggerNow();

            assertThat(ready.successfulCommands()).extracting(ScheduledCommand::key).containsExactly(scheduled.key());
        }

        @Test
        void 최대_대기_시간을_넘기면_영구_실패한다() {
            createOrder(ORDER_ID);
            ScheduledCommand scheduled = scheduler.schedule(
                Order.TYPE, ORDER_ID, new Order.AddItem("Welcome gift", 1), null, new DeliveryPrecondition(customerId, 1)
            );
            clock.advance(Duration.ofMillis(600001));

            TriggerResult result = triggerNow();

            assertThat(result.failedCommands()).hasSize(1);
            FailedCommand failed = result.failedCommands().get(0);
            assertThat(failed.permanent()).isTrue();
            assertThat(failed.failure().code()).isEqualTo(FailureCode.PRECONDITION_TIMEOUT);
            assertThat(stored(scheduled).state()).isEqualTo(ScheduledCommandState.PERMANENTLY_FAILED);
            assertThat(stored(scheduled).finalAttemptTime()).isEqualTo(clock.instant());
        }
    }

    @Nested
    class 실패 {

        @Test
        void 검증_실패는_backoff_후_재시도되고_한도를_넘기면_영구_실패한다() {
            createOrder(ORDER_ID);
            ScheduledCommand scheduled = scheduler.schedule(Order.TYPE, ORDER_ID, new Order.Place(), null);

            TriggerResult first = triggerNow();

            assertThat(first.successfulCommands()).isEmpty();
            assertThat(first.failedCommands()).hasSize(1);
            assertThat(first.failedCommands().get(0).permanent()).isFalse();
            assertThat(first.failedCommands().get(0).failure().code()).isEqualTo(FailureCode.VALIDATION_FAILED);
            assertThat(first.failedCommands().get(0).failure().message()).isEqualTo("The order has no items.");
            ScheduledCommand afterFirst = stored(scheduled);
            assertThat(afterFirst.state()).isEqualTo(ScheduledCommandState.SCHEDULED);
            assertThat(afterFirst.attempts()).isEqualTo(1);
            assertThat(afterFirst.dueTime()).isEqualTo(T0.plusMillis(1000));

            // backoff 동안은 선택되지 않음
            assertThat(triggerNow().failedCommands()).isEmpty();

            clock.advance(Duration.ofMillis(1000));
            TriggerResult second = triggerNow();
            assertThat(second.failedCommands().get(0).permanent()).isFalse();
            assertThat(stored(scheduled).dueTime()).isEqualTo(clock.instant().plusMillis(2000));

            clock.advance(Duration.ofMillis(2000));
            TriggerResult third = triggerNow();

            assertThat(third.permanentFailures()).hasSize(1);
            ScheduledCommand failed = stored(scheduled);
            assertThat(failed.state()).isEqualTo(ScheduledCommandState.PERMANENTLY_FAILED);
            assertThat(failed.lastFailure().attempt()).isEqualTo(3);
            assertThat(orders.getLatest(ORDER_ID).orElseThrow().version()).isEqualTo(1);
        }

        @Test
        void 실패_후_도메인_조건이_충족되면_재시도에서_적용된다() {
            createOrder(ORDER_ID);
            ScheduledCommand scheduled = scheduler.schedule(Order.TYPE, ORDER_ID, new Order.Place(), null);
            triggerNow();

            Order order = orders.getLatest(ORDER_ID).orElseThrow();
            order.apply(new Order.AddItem("Widget", 1), CommandContext.of(clock));
            orders.save(order).orElseThrow();
            clock.advance(Duration.ofSeconds(1));

            TriggerResult retry = triggerNow();

            assertThat(retry.successfulCommands()).extracting(ScheduledCommand::key).containsExactly(scheduled.key());
            assertThat(orders.getLatest(ORDER_ID).orElseThrow().isPlaced()).isTrue();
        }

        @Test
        void 대상_Aggregate가_없으면_재시도_가능한_실패다() {
            scheduler.schedule(Order.TYPE, AggregateId.of("order-missing"), new Order.AddItem("Widget", 1), null);

            TriggerResult result = triggerNow();

            assertThat(result.failedCommands()).singleElement().satisfies(failed -> {
                assertThat(failed.permanent()).isFalse();
                assertThat(failed.failure().code()).isEqualTo(FailureCode.AGGREGATE_NOT_FOUND);
            });
        }

        @Test
        void 이미_존재하는_Aggregate에_대한_생성자_커맨드는_영구_실패한다() {
            createOrder(ORDER_ID);
            scheduler.schedule(Order.TYPE, ORDER_ID, new Order.CreateOrder("Mallory"), null);

            TriggerResult result = triggerNow();

            assertThat(result.permanentFailures()).singleElement()
                .satisfies(failed -> assertThat(failed.failure().code()).isEqualTo(FailureCode.AGGREGATE_ALREADY_EXISTS));
            assertThat(orders.getLatest(ORDER_ID).orElseThrow().customerName()).isEqualTo("Alice");
        }

        @Test
        void 해석할_수_없는_기록은_즉시_영구_실패한다() {
            commandStore.insert(ScheduledCommand.schedule(new ScheduledCommandKey(ORDER_ID, 1),
                "Invoice", "Pay", Payload.of("{}"), null, null, T0));
            commandStore.insert(ScheduledCommand.schedule(new ScheduledCommandKey(ORDER_ID, 2),
                "Order", "Refund", Payload.of("{}"), null, null, T0));
            commandStore.insert(ScheduledCommand.schedule(new ScheduledCommandKey(ORDER_ID, 3),
                "Order", "AddItem", Payload.of("{\"productName\":"), null, null, T0));

            TriggerResult result = triggerNow();

            assertThat(result.permanentFailures()).extracting(failed -> failed.failure().code())
                .containsExactly(
                    FailureCode.UNKNOWN_AGGREGATE_TYPE,
                    FailureCode.UNKNOWN_COMMAND,
                    FailureCode.UNDECODABLE_COMMAND
                );
            assertThat(commandStore.find(ScheduledCommandSelector.due(clock.instant()))).isEmpty();
        }
    }
}
