package com.ryuqq.sourcing.core.spi;

import com.ryuqq.sourcing.core.model.Payload;

/**
 * A message delivered by a {@link CommandQueue}.
 *
 * @param messageId transport message identifier
 * @param sessionId session (ordering group) identifier, the aggregate id for scheduled commands
 * @param body message body
 * @param deliveryCount number of times the transport delivered this message (1 on first delivery)
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public record QueueMessage(String messageId, String sessionId, Payload body, int deliveryCount) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException if messageId or body is null, or deliveryCount is not positive
     */
    public QueueMessage {
        if (messageId == null || messageId.isBlank()) {
            throw new IllegalArgumentException("messageId cannot be null or blank");
        }
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        if (deliveryCount < 1) {
            throw new IllegalArgumentException("deliveryCount must be positive (current: " + deliveryCount + ")");
        }
    }
}
