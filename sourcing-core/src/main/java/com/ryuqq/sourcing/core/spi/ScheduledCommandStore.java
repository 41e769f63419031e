package com.ryuqq.sourcing.core.spi;

import com.ryuqq.sourcing.core.model.AggregateId;
import com.ryuqq.sourcing.core.scheduling.CommandFailure;
import com.ryuqq.sourcing.core.scheduling.ScheduledCommand;
import com.ryuqq.sourcing.core.scheduling.ScheduledCommandKey;
import com.ryuqq.sourcing.core.scheduling.ScheduledCommandSelector;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable scheduled-command storage SPI.
 *
 * <p>Records are keyed by (aggregateId, sequenceNumber). Every state change is a per-record
 * conditional update that only succeeds while the record is still {@code SCHEDULED}, so two
 * concurrent triggers can never both apply or both fail the same command.</p>
 *
 * <p><strong>Logical layout:</strong></p>
 * <pre>
 * scheduled_commands(aggregate_id, sequence_number, aggregate_type, command_name, command_body,
 *                    due_time NULL, precondition_aggregate_id NULL, precondition_sequence NULL,
 *                    created_time, attempts, last_failure NULL,
 *                    applied_time NULL, final_attempt_time NULL)
 * PRIMARY KEY (aggregate_id, sequence_number)
 * </pre>
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public interface ScheduledCommandStore {

    /**
     * Inserts a new record if its key is free.
     *
     * @param command record in {@code SCHEDULED} state
     * @return true if inserted, false if the key is already taken
     * @throws IllegalArgumentException if command is null or already terminal
     */
    boolean insert(ScheduledCommand command);

    /**
     * Selects {@code SCHEDULED} records matching the selector, ordered by
     * {@link ScheduledCommand#DELIVERY_ORDER}, at most {@code selector.limit()} of them.
     *
     * @param selector filter
     * @return matching records
     */
    List<ScheduledCommand> find(ScheduledCommandSelector selector);

    /**
     * Point lookup regardless of state.
     *
     * @param key record key
     * @return the record if present
     */
    Optional<ScheduledCommand> get(ScheduledCommandKey key);

    /**
     * Highest sequence number scheduled for an aggregate.
     *
     * @param aggregateId aggregate identifier
     * @return highest sequence number, 0 if none
     */
    long highestSequenceNumber(AggregateId aggregateId);

    /**
     * Sets appliedTime if the record is still {@code SCHEDULED}.
     *
     * @param key record key
     * @param appliedTime application time
     * @return the updated record, empty if missing or already terminal
     */
    Optional<ScheduledCommand> markApplied(ScheduledCommandKey key, Instant appliedTime);

    /**
     * Records a retryable failure if the record is still {@code SCHEDULED} with the expected
     * attempt count. The attempt count is incremented and the due time moved.
     *
     * @param key record key
     * @param expectedAttempts attempt count read before the failed attempt
     * @param failure failure detail
     * @param nextDueTime new due time
     * @return the updated record, empty if the condition did not hold
     */
    Optional<ScheduledCommand> markAttemptFailed(
        ScheduledCommandKey key,
        int expectedAttempts,
        CommandFailure failure,
        Instant nextDueTime
    );

    /**
     * Sets finalAttemptTime if the record is still {@code SCHEDULED}.
     *
     * @param key record key
     * @param failure final failure detail
     * @param finalAttemptTime time of the final attempt
     * @return the updated record, empty if missing or already terminal
     */
    Optional<ScheduledCommand> markFinalAttempt(ScheduledCommandKey key, CommandFailure failure, Instant finalAttemptTime);
}
