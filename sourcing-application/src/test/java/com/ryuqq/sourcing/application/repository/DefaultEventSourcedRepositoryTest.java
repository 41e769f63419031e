package com.ryuqq.sourcing.application.repository;

import com.ryuqq.sourcing.adapter.inmemory.bus.InMemoryEventBus;
import com.ryuqq.sourcing.adapter.inmemory.store.InMemoryEventStore;
import com.ryuqq.sourcing.adapter.inmemory.store.InMemorySnapshotStore;
import com.ryuqq.sourcing.adapter.jackson.JacksonPayloadCodec;
import com.ryuqq.sourcing.core.aggregate.Snapshot;
import com.ryuqq.sourcing.core.command.CommandContext;
import com.ryuqq.sourcing.core.event.Consequenter;
import com.ryuqq.sourcing.core.event.DomainEvent;
import com.ryuqq.sourcing.core.event.StoredEvent;
import com.ryuqq.sourcing.core.model.AggregateId;
import com.ryuqq.sourcing.core.model.Payload;
import com.ryuqq.sourcing.core.outcome.ConcurrencyException;
import com.ryuqq.sourcing.core.outcome.SaveResult;
import com.ryuqq.sourcing.core.spi.EventStreamQuery;
import com.ryuqq.sourcing.testkit.fixture.CustomerAccount;
import com.ryuqq.sourcing.testkit.fixture.MutableClock;
import com.ryuqq.sourcing.testkit.fixture.Order;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * DefaultEventSourcedRepository 테스트.
 *
 * <p>인메모리 저장소와 Jackson 코덱으로 저장/복원/발행 동작을 검증합니다.</p>
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
class DefaultEventSourcedRepositoryTest {

    private static final Instant T0 = Instant.parse("2024-03-01T09:00:00Z");

    private InMemoryEventStore eventStore;
    private InMemorySnapshotStore snapshotStore;
    private InMemoryEventBus eventBus;
    private MutableClock clock;
    private DefaultEventSourcedRepository<Order> orders;
    private DefaultEventSourcedRepository<CustomerAccount> customers;

    @BeforeEach
    void setUp() {
        eventStore = new InMemoryEventStore();
        snapshotStore = new InMemorySnapshotStore();
        eventBus = new InMemoryEventBus();
        clock = new MutableClock(T0);
        JacksonPayloadCodec codec = new JacksonPayloadCodec();
        orders = new DefaultEventSourcedRepository<>(Order.TYPE, eventStore, snapshotStore, codec, eventBus, clock);
        customers = new DefaultEventSourcedRepository<>(CustomerAccount.TYPE, eventStore, snapshotStore, codec, eventBus, clock);
    }

    private static CommandContext at(int minute) {
        return CommandContext.of(Clock.fixed(T0.plusSeconds(60L * minute), ZoneOffset.UTC));
    }

    /**
     * Created (0분) + AddItem quantity 1..itemCount (i분).
     */
    private Order savedOrder(AggregateId id, int itemCount) {
        Order order = Order.TYPE.newInstance(id);
        order.apply(new Order.CreateOrder("Alice"), at(0));
        for (int i = 1; i <= itemCount; i++) {
            order.apply(new Order.AddItem("item-" + i, i), at(i));
        }
        orders.save(order).orElseThrow();
        return order;
    }

    private static StoredEvent stored(AggregateId id, long sequenceNumber, String eventType, String body) {
        return new StoredEvent("Order", id, sequenceNumber, eventType, Payload.of(body),
            T0.plusSeconds(60 * sequenceNumber), "seed", null);
    }

    @Nested
    class 복원 {

        @Test
        void 최신_버전은_저장된_이벤트_수와_같다() {
            AggregateId id = AggregateId.of("order-1");
            savedOrder(id, 3);

            Order loaded = orders.getLatest(id).orElseThrow();

            assertThat(loaded.version()).isEqualTo(eventStore.read(EventStreamQuery.all(id)).size()).isEqualTo(4);
            assertThat(loaded.customerName()).isEqualTo("Alice");
            assertThat(loaded.totalQuantity()).isEqualTo(6);
            assertThat(loaded.hasPendingEvents()).isFalse();
        }

        @Test
        void 저장_후_로드하면_같은_이벤트_순서가_재현된다() {
            AggregateId id = AggregateId.of("order-1");
            Order order = savedOrder(id, 3);

            Order loaded = orders.getLatest(id).orElseThrow();

            assertThat(loaded.eventHistory()).extracting(DomainEvent::sequenceNumber).containsExactly(1L, 2L, 3L, 4L);
            assertThat(loaded.eventHistory()).extracting(DomainEvent::eventType)
                .containsExactly("Created", "ItemAdded", "ItemAdded", "ItemAdded");
            assertThat(loaded.eventHistory()).<Object>extracting(DomainEvent::data)
                .containsExactlyElementsOf(order.eventHistory().stream().map(DomainEvent::data).toList());
        }

        @Test
        void 열개_중_버전_4를_요청하면_정확히_4개의_이벤트만_적용된다() {
            AggregateId id = AggregateId.of("order-10");
            savedOrder(id, 9);

            Order v4 = orders.getVersion(id, 4).orElseThrow();

            assertThat(v4.version()).isEqualTo(4);
            assertThat(v4.eventHistory()).hasSize(4);
            assertThat(v4.totalQuantity()).isEqualTo(6);
        }

        @Test
        void 모든_N에_대해_getVersion의_버전과_이력_길이는_N이다() {
            AggregateId id = AggregateId.of("order-10");
            savedOrder(id, 9);

            for (int n = 1; n <= 10; n++) {
                Order loaded = orders.getVersion(id, n).orElseThrow();
                assertThat(loaded.version()).isEqualTo(n);
                assertThat(loaded.eventHistory()).hasSize(n);
            }
        }

        @Test
        void 기준_시각_이하의_이벤트만_포함된다() {
            AggregateId id = AggregateId.of("order-1");
            savedOrder(id, 5);

            Order asOfThird = orders.getAsOfDate(id, T0.plusSeconds(180)).orElseThrow();
            Order justBefore = orders.getAsOfDate(id, T0.plusSeconds(179)).orElseThrow();

            assertThat(asOfThird.version()).isEqualTo(4);
            assertThat(asOfThird.totalQuantity()).isEqualTo(6);
            assertThat(asOfThird.eventHistory()).allMatch(e -> !e.timestamp().isAfter(T0.plusSeconds(180)));
            assertThat(justBefore.version()).isEqualTo(3);
            assertThat(orders.getAsOfDate(id, T0.minusSeconds(1))).isEmpty();
        }

        @Test
        void 같은_입력으로_두_번_복원하면_상태가_같다() {
            AggregateId id = AggregateId.of("order-1");
            savedOrder(id, 4);

            Order first = orders.getLatest(id).orElseThrow();
            Order second = orders.getLatest(id).orElseThrow();

            assertThat(first).isNotSameAs(second);
            assertThat(first.version()).isEqualTo(second.version());
            assertThat(first.items()).isEqualTo(second.items());
            assertThat(first.eventHistory()).isEqualTo(second.eventHistory());
        }

        @Test
        void 스트림이_없으면_empty를_반환한다() {
            assertThat(orders.getLatest(AggregateId.of("missing"))).isEmpty();
            assertThat(orders.getVersion(AggregateId.of("missing"), 3)).isEmpty();
        }

        @Test
        void 스트림_끝의_알_수_없는_이벤트는_버전을_바꾸지_않는다() {
            AggregateId id = AggregateId.of("order-unknown-tail");
            eventStore.appendAll(List.of(
                stored(id, 1, "Created", "{\"customerName\":\"Alice\"}"),
                stored(id, 2, "ItemAdded", "{\"productName\":\"Widget\",\"quantity\":2}"),
                stored(id, 3, "ItemAdded", "{\"productName\":\"Gadget\",\"quantity\":1}"),
                stored(id, 4, "FulfillmentMethodSelected", "{\"fulfillmentMethod\":\"Delivery\"}"),
                stored(id, 5, "LoyaltyPointsAwarded", "{\"points\":40}")
            ));

            Order loaded = orders.getLatest(id).orElseThrow();

            assertThat(loaded.version()).isEqualTo(5);
            assertThat(loaded.eventHistory()).hasSize(5);
            assertThat(loaded.eventHistory()).filteredOn(DomainEvent::isRecognized).hasSize(4);
            assertThat(loaded.totalQuantity()).isEqualTo(3);
            assertThat(loaded.fulfillmentMethod()).isEqualTo("Delivery");

            // 다음 이벤트는 6번 위치에 저장되어야 함
            loaded.apply(new Order.AddItem("Extra", 1), at(10));
            SaveResult.Saved saved = orders.save(loaded).orElseThrow();
            assertThat(saved.committedEvents()).extracting(DomainEvent::sequenceNumber).containsExactly(6L);
        }

        @Test
        void 알_수_없는_멤버가_있어도_파싱된_필드로_적용된다() {
            AggregateId id = AggregateId.of("order-extra-member");
            eventStore.appendAll(List.of(
                stored(id, 1, "Created", "{\"customerName\":\"Alice\",\"loyaltyTier\":\"gold\"}"),
                stored(id, 2, "ItemAdded", "{\"productName\":\"Widget\",\"quantity\":2,\"giftWrap\":true}")
            ));

            Order loaded = orders.getLatest(id).orElseThrow();

            assertThat(loaded.customerName()).isEqualTo("Alice");
            assertThat(loaded.items()).containsExactly(new Order.Item("Widget", 2));
            assertThat(loaded.eventHistory()).allMatch(DomainEvent::isRecognized);
        }

        @Test
        void 역직렬화할_수_없는_본문은_건너뛰지만_버전은_전진한다() {
            AggregateId id = AggregateId.of("order-broken");
            eventStore.appendAll(List.of(
                stored(id, 1, "Created", "{\"customerName\":\"Alice\"}"),
                stored(id, 2, "ItemAdded", "{\"productName\":"),
                stored(id, 3, "ItemAdded", "{\"productName\":\"Gadget\",\"quantity\":1}")
            ));

            Order loaded = orders.getLatest(id).orElseThrow();

            assertThat(loaded.version()).isEqualTo(3);
            assertThat(loaded.items()).containsExactly(new Order.Item("Gadget", 1));
            assertThat(loaded.eventHistory().get(1).isRecognized()).isFalse();
        }
    }

    @Nested
    class 저장 {

        @Test
        void 저장_후_pending_이벤트가_이력으로_이동하고_오름차순으로_발행된다() {
            AggregateId id = AggregateId.of("order-1");
            Order order = Order.TYPE.newInstance(id);
            order.apply(new Order.CreateOrder("Alice"), at(0));
            order.apply(new Order.AddItem("Widget", 1), at(1));
            order.apply(new Order.AddItem("Gadget", 2), at(2));

            SaveResult result = orders.save(order);

            assertThat(result.isSaved()).isTrue();
            assertThat(order.hasPendingEvents()).isFalse();
            assertThat(order.eventHistory()).hasSize(3);
            assertThat(order.version()).isEqualTo(3);
            assertThat(eventBus.publishedEvents()).extracting(DomainEvent::sequenceNumber).containsExactly(1L, 2L, 3L);
        }

        @Test
        void pending_이벤트가_없으면_아무것도_하지_않는다() {
            AggregateId id = AggregateId.of("order-1");
            Order order = savedOrder(id, 1);
            eventBus.clear();

            SaveResult.Saved saved = orders.save(order).orElseThrow();

            assertThat(saved.committedEvents()).isEmpty();
            assertThat(eventBus.publishedEvents()).isEmpty();
        }

        @Test
        void 먼저_커밋한_쪽이_이기고_나중_쪽은_양쪽_변경을_명시한_충돌을_받는다() {
            AggregateId id = AggregateId.of("order-race");
            savedOrder(id, 1);
            eventBus.clear();

            Order first = orders.getLatest(id).orElseThrow();
            Order second = orders.getLatest(id).orElseThrow();
            first.apply(new Order.AddItem("Widget", 1), at(5).withActor("Alice"));
            second.apply(new Order.ChangeCustomerInfo("Robert"), at(6).withActor("Bob"));

            SaveResult firstResult = orders.save(first);
            SaveResult secondResult = orders.save(second);

            assertThat(firstResult.isSaved()).isTrue();
            assertThat(secondResult).isInstanceOf(SaveResult.Conflict.class);
            ConcurrencyException exception = ((SaveResult.Conflict) secondResult).exception();
            assertThat(exception.getMessage())
                .contains("ItemAdded")
                .contains("CustomerInfoChanged")
                .contains("Alice")
                .contains("Bob");
            assertThat(exception.committed().sequenceNumber()).isEqualTo(3);
            assertThatThrownBy(secondResult::orElseThrow).isSameAs(exception);

            // 충돌한 쪽은 저장도 발행도 되지 않음
            assertThat(second.hasPendingEvents()).isTrue();
            assertThat(eventBus.publishedEvents()).extracting(DomainEvent::eventType).containsExactly("ItemAdded");
            assertThat(orders.getLatest(id).orElseThrow().customerName()).isEqualTo("Alice");
        }

        @Test
        void 저장_중_호출된_핸들러는_방금_저장된_인스턴스를_받는다() {
            AtomicReference<Order> seen = new AtomicReference<>();
            eventBus.subscribe(Consequenter.of(Order.ItemAdded.class, (event, source) ->
                seen.set(source.aggregate(Order.class, event.aggregateId()).orElseThrow())));

            AggregateId id = AggregateId.of("order-1");
            Order order = Order.TYPE.newInstance(id);
            order.apply(new Order.CreateOrder("Alice"), at(0));
            order.apply(new Order.AddItem("Widget", 1), at(1));
            orders.save(order).orElseThrow();

            assertThat(seen.get()).isSameAs(order);
            assertThat(eventBus.failures()).isEmpty();
        }

        @Test
        void 저장_범위_밖에서는_저장소를_통해_다시_로드한다() {
            AggregateId id = AggregateId.of("order-1");
            Order order = savedOrder(id, 2);

            Order reloaded = orders.aggregate(Order.class, id).orElseThrow();

            assertThat(reloaded).isNotSameAs(order);
            assertThat(reloaded.version()).isEqualTo(order.version());
            assertThat(orders.aggregate(CustomerAccount.class, id)).isEmpty();
        }
    }

    @Nested
    class 갱신 {

        @Test
        void pending_이벤트가_있으면_갱신할_수_없다() {
            AggregateId id = AggregateId.of("order-1");
            Order order = savedOrder(id, 1);
            order.apply(new Order.AddItem("Unsaved", 1), at(3));

            assertThatThrownBy(() -> orders.refresh(order))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Aggregates having pending events cannot be updated.");
            assertThat(order.pendingEvents()).hasSize(1);
        }

        @Test
        void 현재_버전_이후에_커밋된_이벤트만_반영한다() {
            AggregateId id = AggregateId.of("order-1");
            savedOrder(id, 1);
            Order stale = orders.getLatest(id).orElseThrow();
            Order writer = orders.getLatest(id).orElseThrow();
            writer.apply(new Order.AddItem("Gadget", 4), at(5));
            orders.save(writer).orElseThrow();

            Order refreshed = orders.refresh(stale);

            assertThat(refreshed).isSameAs(stale);
            assertThat(stale.version()).isEqualTo(3);
            assertThat(stale.totalQuantity()).isEqualTo(5);
        }
    }

    @Nested
    class 스냅샷 {

        private CustomerAccount accountWith123Events(AggregateId id) {
            CustomerAccount account = CustomerAccount.TYPE.newInstance(id);
            account.apply(new CustomerAccount.RequestUserName("alice"));
            for (int i = 0; i < 121; i++) {
                account.apply(i % 2 == 0 ? new CustomerAccount.RequestNoSpam() : new CustomerAccount.RequestSpam());
            }
            account.apply(new CustomerAccount.ChangeEmailAddress("alice@example.com", "email-etag-1"));
            customers.save(account).orElseThrow();
            return account;
        }

        @Test
        void 스냅샷에서_복원하면_이후_이벤트만_적용된다() {
            AggregateId id = AggregateId.of("customer-1");
            CustomerAccount account = accountWith123Events(id);

            Snapshot snapshot = customers.snapshot(account);

            assertThat(snapshot.version()).isEqualTo(123);
            assertThat(snapshot.aggregateTypeName()).isEqualTo("CustomerAccount");
            assertThat(snapshot.etags()).contains("email-etag-1");
            assertThat(snapshot.createdAt()).isEqualTo(T0);

            CustomerAccount fromSnapshot = customers.getLatest(id).orElseThrow();
            assertThat(fromSnapshot.version()).isEqualTo(123);
            assertThat(fromSnapshot.eventHistory()).isEmpty();
            assertThat(fromSnapshot.userName()).isEqualTo("alice");
            assertThat(fromSnapshot.emailAddress()).isEqualTo("alice@example.com");
            assertThat(fromSnapshot.noSpam()).isEqualTo(account.noSpam());

            fromSnapshot.apply(new CustomerAccount.RequestSpam());
            customers.save(fromSnapshot).orElseThrow();

            CustomerAccount latest = customers.getLatest(id).orElseThrow();
            assertThat(latest.version()).isEqualTo(124);
            assertThat(latest.eventHistory()).extracting(DomainEvent::sequenceNumber).containsExactly(124L);
            assertThat(latest.noSpam()).isFalse();
        }

        @Test
        void 버전_조회는_스냅샷과_무관하게_처음부터_재생한다() {
            AggregateId id = AggregateId.of("customer-1");
            customers.snapshot(accountWith123Events(id));

            CustomerAccount v50 = customers.getVersion(id, 50).orElseThrow();
            CustomerAccount v123 = customers.getVersion(id, 123).orElseThrow();

            assertThat(v50.version()).isEqualTo(50);
            assertThat(v50.eventHistory()).hasSize(50);
            assertThat(v50.emailAddress()).isNull();
            assertThat(v123.version()).isEqualTo(123);
            assertThat(v123.eventHistory()).hasSize(123);
            assertThat(v123.emailAddress()).isEqualTo("alice@example.com");
        }

        @Test
        void 스냅샷의_ETag는_복원_후에도_중복_커맨드를_막는다() {
            AggregateId id = AggregateId.of("customer-1");
            customers.snapshot(accountWith123Events(id));

            CustomerAccount loaded = customers.getLatest(id).orElseThrow();

            assertThat(loaded.apply(new CustomerAccount.ChangeEmailAddress("other@example.com", "email-etag-1"))).isFalse();
            assertThat(loaded.hasPendingEvents()).isFalse();
        }

        @Test
        void 타입_이름이_다른_스냅샷은_무시한다() {
            AggregateId id = AggregateId.of("customer-1");
            accountWith123Events(id);
            snapshotStore.put(new Snapshot(id, 123, "Order", Payload.of("{}"), Set.of(), T0));

            CustomerAccount loaded = customers.getLatest(id).orElseThrow();

            assertThat(loaded.eventHistory()).hasSize(123);
            assertThat(loaded.emailAddress()).isEqualTo("alice@example.com");
        }

        @Test
        void 읽을_수_없는_스냅샷은_무시하고_전체_재생한다() {
            AggregateId id = AggregateId.of("customer-1");
            accountWith123Events(id);
            snapshotStore.put(new Snapshot(id, 123, "CustomerAccount", Payload.of("{\"userName\":"), Set.of(), T0));

            CustomerAccount loaded = customers.getLatest(id).orElseThrow();

            assertThat(loaded.eventHistory()).hasSize(123);
        }

        @Test
        void 스냅샷을_지원하지_않는_타입은_예외가_발생한다() {
            Order order = savedOrder(AggregateId.of("order-1"), 1);

            assertThatThrownBy(() -> orders.snapshot(order))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("does not support snapshots");
        }

        @Test
        void pending_이벤트가_있으면_스냅샷을_만들_수_없다() {
            CustomerAccount account = CustomerAccount.open(AggregateId.of("customer-2"), "bob");

            assertThatThrownBy(() -> customers.snapshot(account)).isInstanceOf(IllegalStateException.class);
        }
    }

    @Test
    void 잘못된_인자는_거부한다() {
        assertThatThrownBy(() -> orders.getVersion(AggregateId.of("order-1"), 0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> orders.getLatest(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DefaultEventSourcedRepository<>(Order.TYPE, null, snapshotStore,
            new JacksonPayloadCodec(), eventBus, clock)).isInstanceOf(IllegalArgumentException.class);
    }
}
