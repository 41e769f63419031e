package com.ryuqq.sourcing.testkit.contract;

import com.ryuqq.sourcing.core.model.Payload;
import com.ryuqq.sourcing.core.spi.CommandQueue;
import com.ryuqq.sourcing.core.spi.QueueMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for {@link CommandQueue} implementations.
 *
 * <p>Redelivery is driven through {@link #expireVisibilityTimeout(QueueMessage)}, which each
 * implementation maps to its own visibility mechanism.</p>
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public abstract class AbstractCommandQueueContractTest extends AbstractContractTest {

    protected CommandQueue queue;

    protected abstract CommandQueue createCommandQueue();

    /**
     * Makes a received, uncompleted message visible again as if its handling window expired.
     *
     * @param message received message
     */
    protected abstract void expireVisibilityTimeout(QueueMessage message);

    @BeforeEach
    void setUpCommandQueue() {
        queue = createCommandQueue();
    }

    @Test
    void receive_SentMessage_IsDeliveredOnce() {
        // Given
        queue.send("order-1", Payload.of("{\"a\":1}"), Duration.ZERO);

        // When
        List<QueueMessage> first = queue.receive(10);
        List<QueueMessage> second = queue.receive(10);

        // Then
        assertEquals(1, first.size());
        assertEquals("order-1", first.get(0).sessionId());
        assertEquals(1, first.get(0).deliveryCount());
        assertTrue(second.isEmpty(), "A received message stays invisible until its window expires");
    }

    @Test
    void receive_DelayedMessage_IsInvisibleUntilDelayElapses() {
        // Given
        queue.send("order-1", Payload.of("{}"), Duration.ofMillis(200));

        // When & Then
        assertTrue(queue.receive(10).isEmpty());
        sleep(300);
        assertEquals(1, queue.receive(10).size());
    }

    @Test
    void expireVisibilityTimeout_UncompletedMessage_IsRedelivered() {
        // Given
        queue.send("order-1", Payload.of("{}"), Duration.ZERO);
        QueueMessage received = queue.receive(1).get(0);

        // When
        expireVisibilityTimeout(received);
        List<QueueMessage> redelivered = queue.receive(1);

        // Then
        assertEquals(1, redelivered.size());
        assertEquals(received.messageId(), redelivered.get(0).messageId());
        assertEquals(2, redelivered.get(0).deliveryCount());
    }

    @Test
    void complete_ReceivedMessage_IsNeverRedelivered() {
        // Given
        queue.send("order-1", Payload.of("{}"), Duration.ZERO);
        QueueMessage received = queue.receive(1).get(0);

        // When
        queue.complete(received);
        queue.complete(received);
        expireVisibilityTimeout(received);

        // Then
        assertTrue(queue.receive(1).isEmpty());
    }
}
