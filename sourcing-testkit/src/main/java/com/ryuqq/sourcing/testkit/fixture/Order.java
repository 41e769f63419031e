package com.ryuqq.sourcing.testkit.fixture;

import com.ryuqq.sourcing.core.aggregate.AggregateType;
import com.ryuqq.sourcing.core.aggregate.EventSourcedAggregate;
import com.ryuqq.sourcing.core.command.Command;
import com.ryuqq.sourcing.core.command.CommandValidationException;
import com.ryuqq.sourcing.core.command.ConstructorCommand;
import com.ryuqq.sourcing.core.command.EventRecorder;
import com.ryuqq.sourcing.core.model.AggregateId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Sample order aggregate used by tests across modules.
 *
 * <p>Events and commands are nested records so that they serialize as plain JSON objects.</p>
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public final class Order extends EventSourcedAggregate<Order> {

    public static final AggregateType<Order> TYPE = AggregateType.builder("Order", Order.class, Order::new)
        .on("Created", Created.class, (order, event) -> order.customerName = event.data().customerName())
        .on("ItemAdded", ItemAdded.class, (order, event) ->
            order.items.add(new Item(event.data().productName(), event.data().quantity())))
        .on("CustomerInfoChanged", CustomerInfoChanged.class, (order, event) ->
            order.customerName = event.data().customerName())
        .on("FulfillmentMethodSelected", FulfillmentMethodSelected.class, (order, event) ->
            order.fulfillmentMethod = event.data().fulfillmentMethod())
        .on("Placed", Placed.class, (order, event) -> order.placed = true)
        .on("Cancelled", Cancelled.class, (order, event) -> order.cancelled = true)
        .command("CreateOrder", CreateOrder.class)
        .command("AddItem", AddItem.class)
        .command("ChangeCustomerInfo", ChangeCustomerInfo.class)
        .command("ChangeFulfillmentMethod", ChangeFulfillmentMethod.class)
        .command("Place", Place.class)
        .command("Cancel", Cancel.class)
        .build();

    private final List<Item> items = new ArrayList<>();
    private String customerName;
    private String fulfillmentMethod;
    private boolean placed;
    private boolean cancelled;

    private Order(AggregateId id) {
        super(TYPE, id);
    }

    /**
     * Creates a new order with a Created event pending.
     *
     * @param id order identifier
     * @param customerName customer name
     * @return new order
     */
    public static Order create(AggregateId id, String customerName) {
        Order order = TYPE.newInstance(id);
        order.apply(new CreateOrder(customerName));
        return order;
    }

    public String customerName() {
        return customerName;
    }

    public List<Item> items() {
        return Collections.unmodifiableList(items);
    }

    public int totalQuantity() {
        return items.stream().mapToInt(Item::quantity).sum();
    }

    public String fulfillmentMethod() {
        return fulfillmentMethod;
    }

    public boolean isPlaced() {
        return placed;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    private void requireOpen() {
        if (cancelled) {
            throw new CommandValidationException("The order has been cancelled.");
        }
        if (placed) {
            throw new CommandValidationException("The order has already been placed.");
        }
    }

    public record Item(String productName, int quantity) {
    }

    public record Created(String customerName) {
    }

    public record ItemAdded(String productName, int quantity) {
    }

    public record CustomerInfoChanged(String customerName) {
    }

    public record FulfillmentMethodSelected(String fulfillmentMethod) {
    }

    public record Placed() {
    }

    public record Cancelled(String reason) {
    }

    public record CreateOrder(String customerName) implements ConstructorCommand<Order> {

        @Override
        public void validate(Order order) {
            if (customerName == null || customerName.isBlank()) {
                throw new CommandValidationException("You must provide a customer name");
            }
        }

        @Override
        public void handle(Order order, EventRecorder recorder) {
            recorder.record(new Created(customerName));
        }
    }

    public record AddItem(String productName, int quantity) implements Command<Order> {

        @Override
        public void validate(Order order) {
            order.requireOpen();
            if (quantity < 1) {
                throw new CommandValidationException("Quantity must be at least 1.");
            }
        }

        @Override
        public void handle(Order order, EventRecorder recorder) {
            recorder.record(new ItemAdded(productName, quantity));
        }
    }

    public record ChangeCustomerInfo(String customerName) implements Command<Order> {

        @Override
        public void handle(Order order, EventRecorder recorder) {
            recorder.record(new CustomerInfoChanged(customerName));
        }
    }

    public record ChangeFulfillmentMethod(String fulfillmentMethod) implements Command<Order> {

        @Override
        public void validate(Order order) {
            order.requireOpen();
        }

        @Override
        public void handle(Order order, EventRecorder recorder) {
            recorder.record(new FulfillmentMethodSelected(fulfillmentMethod));
        }
    }

    public record Place() implements Command<Order> {

        @Override
        public void validate(Order order) {
            order.requireOpen();
            if (order.items.isEmpty()) {
                throw new CommandValidationException("The order has no items.");
            }
        }

        @Override
        public void handle(Order order, EventRecorder recorder) {
            recorder.record(new Placed());
        }
    }

    public record Cancel(String reason) implements Command<Order> {

        @Override
        public void validate(Order order) {
            if (order.cancelled) {
                throw new CommandValidationException("The order has already been cancelled.");
            }
        }

        @Override
        public void handle(Order order, EventRecorder recorder) {
            recorder.record(new Cancelled(reason));
        }
    }
}
