package com.ryuqq.sourcing.testkit.fixture;

import com.ryuqq.sourcing.core.command.CommandContext;
import com.ryuqq.sourcing.core.command.CommandValidationException;
import com.ryuqq.sourcing.core.model.AggregateId;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OrderTest {

    private final CommandContext context = CommandContext.of(new MutableClock(Instant.parse("2024-03-01T09:00:00Z")));

    @Test
    void 주문_생성과_상품_추가() {
        Order order = Order.create(AggregateId.of("order-1"), "Alice");

        order.apply(new Order.AddItem("Widget", 2), context);
        order.apply(new Order.AddItem("Gadget", 1), context);
        order.apply(new Order.ChangeFulfillmentMethod("Delivery"), context);

        assertThat(order.customerName()).isEqualTo("Alice");
        assertThat(order.items()).containsExactly(new Order.Item("Widget", 2), new Order.Item("Gadget", 1));
        assertThat(order.totalQuantity()).isEqualTo(3);
        assertThat(order.fulfillmentMethod()).isEqualTo("Delivery");
        assertThat(order.pendingEvents()).extracting(event -> event.eventType())
            .containsExactly("Created", "ItemAdded", "ItemAdded", "FulfillmentMethodSelected");
    }

    @Test
    void 상품이_없는_주문은_확정할_수_없다() {
        Order order = Order.create(AggregateId.of("order-1"), "Alice");

        assertThatThrownBy(() -> order.apply(new Order.Place(), context))
            .isInstanceOf(CommandValidationException.class)
            .hasMessage("The order has no items.");
    }

    @Test
    void 확정된_주문에는_상품을_추가할_수_없다() {
        Order order = Order.create(AggregateId.of("order-1"), "Alice");
        order.apply(new Order.AddItem("Widget", 1), context);
        order.apply(new Order.Place(), context);

        assertThat(order.isPlaced()).isTrue();
        assertThatThrownBy(() -> order.apply(new Order.AddItem("Widget", 1), context))
            .isInstanceOf(CommandValidationException.class)
            .hasMessage("The order has already been placed.");
    }

    @Test
    void 취소는_한_번만_가능하다() {
        Order order = Order.create(AggregateId.of("order-1"), "Alice");
        order.apply(new Order.Cancel("changed my mind"), context);

        assertThat(order.isCancelled()).isTrue();
        assertThatThrownBy(() -> order.apply(new Order.Cancel("again"), context))
            .isInstanceOf(CommandValidationException.class);
    }

    @Test
    void 고객명_없이는_생성할_수_없다() {
        assertThatThrownBy(() -> Order.create(AggregateId.of("order-1"), " "))
            .isInstanceOf(CommandValidationException.class);
    }
}
