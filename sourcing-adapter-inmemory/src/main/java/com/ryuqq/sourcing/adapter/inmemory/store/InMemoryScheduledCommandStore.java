package com.ryuqq.sourcing.adapter.inmemory.store;

import com.ryuqq.sourcing.core.model.AggregateId;
import com.ryuqq.sourcing.core.scheduling.CommandFailure;
import com.ryuqq.sourcing.core.scheduling.ScheduledCommand;
import com.ryuqq.sourcing.core.scheduling.ScheduledCommandKey;
import com.ryuqq.sourcing.core.scheduling.ScheduledCommandSelector;
import com.ryuqq.sourcing.core.spi.ScheduledCommandStore;
import com.ryuqq.sourcing.core.statemachine.ScheduledCommandState;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * In-memory implementation of {@link ScheduledCommandStore} SPI for testing and reference purposes.
 *
 * <p>Conditional updates run inside {@link ConcurrentHashMap#computeIfPresent}, which is atomic
 * per key, so "set appliedTime only if currently unset" holds under concurrent triggers.</p>
 *
 * <p><strong>Performance Characteristics:</strong></p>
 * <ul>
 *   <li><strong>insert / get / mark*:</strong> O(1)</li>
 *   <li><strong>find:</strong> O(N log N) - full scan, filter and sort</li>
 * </ul>
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public class InMemoryScheduledCommandStore implements ScheduledCommandStore {

    private final ConcurrentHashMap<ScheduledCommandKey, ScheduledCommand> commands = new ConcurrentHashMap<>();

    @Override
    public boolean insert(ScheduledCommand command) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        if (command.state() != ScheduledCommandState.SCHEDULED) {
            throw new IllegalArgumentException("Only SCHEDULED commands can be inserted: " + command.key());
        }
        return commands.putIfAbsent(command.key(), command) == null;
    }

    @Override
    public List<ScheduledCommand> find(ScheduledCommandSelector selector) {
        if (selector == null) {
            throw new IllegalArgumentException("selector cannot be null");
        }
        return commands.values().stream()
            .filter(selector::matches)
            .sorted(ScheduledCommand.DELIVERY_ORDER)
            .limit(selector.limit())
            .toList();
    }

    @Override
    public Optional<ScheduledCommand> get(ScheduledCommandKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return Optional.ofNullable(commands.get(key));
    }

    @Override
    public long highestSequenceNumber(AggregateId aggregateId) {
        return commands.keySet().stream()
            .filter(key -> key.aggregateId().equals(aggregateId))
            .mapToLong(ScheduledCommandKey::sequenceNumber)
            .max()
            .orElse(0);
    }

    @Override
    public Optional<ScheduledCommand> markApplied(ScheduledCommandKey key, Instant appliedTime) {
        return updateIfScheduled(key, -1, current -> current.markApplied(appliedTime));
    }

    @Override
    public Optional<ScheduledCommand> markAttemptFailed(
        ScheduledCommandKey key,
        int expectedAttempts,
        CommandFailure failure,
        Instant nextDueTime
    ) {
        return updateIfScheduled(key, expectedAttempts, current -> current.recordFailedAttempt(failure, nextDueTime));
    }

    @Override
    public Optional<ScheduledCommand> markFinalAttempt(
        ScheduledCommandKey key,
        CommandFailure failure,
        Instant finalAttemptTime
    ) {
        return updateIfScheduled(key, -1, current -> current.markFinalAttempt(failure, finalAttemptTime));
    }

    /**
     * Number of stored records. Used for test assertions.
     *
     * @return record count
     */
    public int size() {
        return commands.size();
    }

    /**
     * Clears all records. Used for test cleanup.
     */
    public void clear() {
        commands.clear();
    }

    private Optional<ScheduledCommand> updateIfScheduled(
        ScheduledCommandKey key,
        int expectedAttempts,
        UnaryOperator<ScheduledCommand> update
    ) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        AtomicReference<ScheduledCommand> updated = new AtomicReference<>();
        commands.computeIfPresent(key, (k, current) -> {
            if (current.state() != ScheduledCommandState.SCHEDULED) {
                return current;
            }
            if (expectedAttempts >= 0 && current.attempts() != expectedAttempts) {
                return current;
            }
            ScheduledCommand next = update.apply(current);
            updated.set(next);
            return next;
        });
        return Optional.ofNullable(updated.get());
    }
}
