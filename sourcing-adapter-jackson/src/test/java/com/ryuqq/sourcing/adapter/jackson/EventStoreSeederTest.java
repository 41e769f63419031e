package com.ryuqq.sourcing.adapter.jackson;

import com.ryuqq.sourcing.adapter.inmemory.store.InMemoryEventStore;
import com.ryuqq.sourcing.core.event.StoredEvent;
import com.ryuqq.sourcing.core.model.AggregateId;
import com.ryuqq.sourcing.core.spi.EventStreamQuery;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * EventStoreSeeder 테스트.
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
class EventStoreSeederTest {

    private InMemoryEventStore eventStore;
    private EventStoreSeeder seeder;

    @BeforeEach
    void setUp() {
        eventStore = new InMemoryEventStore();
        seeder = new EventStoreSeeder(eventStore);
    }

    @Test
    void 클래스패스_리소스에서_이벤트를_적재한다() {
        List<StoredEvent> seeded = seeder.seedFromResource("Events.json");

        assertThat(seeded).hasSize(8);
        assertThat(eventStore.latestSequenceNumber(AggregateId.of("order-seeded-1"))).isEqualTo(6);
        assertThat(eventStore.latestSequenceNumber(AggregateId.of("customer-seeded-1"))).isEqualTo(2);

        List<StoredEvent> order = eventStore.read(EventStreamQuery.all(AggregateId.of("order-seeded-1")));
        assertThat(order).extracting(StoredEvent::eventType)
            .containsExactly("Created", "ItemAdded", "ItemAdded", "LoyaltyPointsAwarded", "FulfillmentMethodSelected", "Placed");
        assertThat(order.get(5).etag()).isEqualTo("place-order-seeded-1");
        assertThat(order.get(0).actor()).isEqualTo("seed");
        assertThat(order.get(1).body().content()).isEqualTo("{\"productName\":\"Widget\",\"quantity\":2}");
    }

    @Test
    void 이미_존재하는_위치에_적재하면_예외가_발생한다() {
        seeder.seedFromResource("Events.json");

        assertThatThrownBy(() -> seeder.seedFromResource("Events.json"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("position already holds");
    }

    @Test
    void 필수_필드가_없으면_거부한다() {
        String json = "[{\"streamName\":\"Order\",\"aggregateId\":\"order-x\",\"eventType\":\"Created\","
            + "\"timestamp\":\"2024-03-01T09:00:00Z\",\"body\":{}}]";

        assertThatThrownBy(() -> seeder.seed(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("sequenceNumber");
    }

    @Test
    void 존재하지_않는_리소스는_거부한다() {
        assertThatThrownBy(() -> seeder.seedFromResource("Missing.json"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
