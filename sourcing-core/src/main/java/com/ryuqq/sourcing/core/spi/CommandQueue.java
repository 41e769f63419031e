package com.ryuqq.sourcing.core.spi;

import com.ryuqq.sourcing.core.model.Payload;

import java.time.Duration;
import java.util.List;

/**
 * At-least-once queue transport SPI for scheduled command lookups.
 *
 * <p>Messages that are received but not completed become visible again after the
 * transport's visibility timeout; the transport owns redelivery and its backoff.
 * There is no reject operation: a consumer either completes a message or lets the
 * handling window expire.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: all methods may be called from multiple threads</li>
 *   <li>Idempotent completion: completing an already completed message is a no-op</li>
 *   <li>At-least-once delivery: a message may be delivered several times</li>
 * </ul>
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public interface CommandQueue {

    /**
     * Sends a message that becomes visible after the given delay.
     *
     * @param sessionId session identifier (nullable)
     * @param body message body
     * @param delay visibility delay, {@link Duration#ZERO} for immediate delivery
     * @throws IllegalArgumentException if body or delay is null, or delay is negative
     */
    void send(String sessionId, Payload body, Duration delay);

    /**
     * Receives up to {@code maxMessages} visible messages and hides them for the visibility timeout.
     *
     * @param maxMessages maximum number of messages
     * @return received messages (may be empty)
     * @throws IllegalArgumentException if maxMessages is not positive
     */
    List<QueueMessage> receive(int maxMessages);

    /**
     * Completes (acknowledges) a message so it is never delivered again.
     *
     * @param message received message
     * @throws IllegalArgumentException if message is null
     */
    void complete(QueueMessage message);

    /**
     * Registers the listener for transport-level failures.
     *
     * @param listener listener, null to unregister
     */
    void setExceptionListener(QueueExceptionListener listener);
}
