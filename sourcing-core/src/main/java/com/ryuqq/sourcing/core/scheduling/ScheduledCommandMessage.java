package com.ryuqq.sourcing.core.scheduling;

import java.time.Instant;

/**
 * Queue message body that points at a scheduled command.
 *
 * <p>The message carries the lookup key only, never the command itself.</p>
 *
 * @param aggregateId target aggregate identifier
 * @param sequenceNumber scheduled command sequence number
 * @param dueTime due time of the command (nullable)
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public record ScheduledCommandMessage(String aggregateId, long sequenceNumber, Instant dueTime) {

    /**
     * Builds the message for a scheduled command.
     *
     * @param command scheduled command
     * @return message
     */
    public static ScheduledCommandMessage of(ScheduledCommand command) {
        return new ScheduledCommandMessage(
            command.aggregateId().getValue(), command.sequenceNumber(), command.dueTime()
        );
    }
}
