package com.ryuqq.sourcing.core.aggregate;

import com.ryuqq.sourcing.core.model.AggregateId;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * AggregateType 등록 정보 테스트.
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
class AggregateTypeTest {

    @Test
    void lookups_RegisteredNames_ResolveTypes() {
        assertEquals("Counter", Counter.TYPE.name());
        assertEquals(Counter.class, Counter.TYPE.aggregateClass());
        assertEquals(Optional.of(Counter.Incremented.class), Counter.TYPE.eventDataType("Incremented"));
        assertEquals("Reset", Counter.TYPE.eventTypeOf(Counter.Reset.class));
        assertEquals(Optional.of(Counter.Increment.class), Counter.TYPE.commandType("Increment"));
        assertTrue(Counter.TYPE.supportsSnapshots());
        assertEquals(Counter.State.class, Counter.TYPE.snapshotStateType());
    }

    @Test
    void lookups_UnknownNames_AreEmpty() {
        assertTrue(Counter.TYPE.eventDataType("Doubled").isEmpty());
        assertTrue(Counter.TYPE.commandType("Double").isEmpty());
        assertThrows(IllegalArgumentException.class, () -> Counter.TYPE.eventTypeOf(String.class));
    }

    @Test
    void newInstance_CreatesEmptyAggregate() {
        // When
        Counter counter = Counter.TYPE.newInstance(AggregateId.of("counter-9"));

        // Then
        assertEquals(AggregateId.of("counter-9"), counter.id());
        assertEquals(0, counter.version());
        assertSame(Counter.TYPE, counter.aggregateType());
    }

    @Test
    void newInstance_FactoryReturnsNull_ThrowsException() {
        AggregateType<Counter> broken = AggregateType.builder("Broken", Counter.class, id -> null).build();

        assertThrows(IllegalStateException.class, () -> broken.newInstance(AggregateId.of("x")));
    }

    @Test
    void snapshotStateType_WithoutSnapshotSupport_ThrowsException() {
        AggregateType<Counter> plain = AggregateType.builder("Plain", Counter.class, id -> null).build();

        assertFalse(plain.supportsSnapshots());
        IllegalStateException exception = assertThrows(IllegalStateException.class, plain::snapshotStateType);
        assertTrue(exception.getMessage().contains("does not support snapshots"));
    }

    @Test
    void builder_DuplicateRegistrations_ThrowException() {
        AggregateType.Builder<Counter> builder = AggregateType.builder("Dup", Counter.class, id -> null)
            .on("Incremented", Counter.Incremented.class, (counter, event) -> { })
            .command("Increment", Counter.Increment.class);

        assertThrows(IllegalArgumentException.class,
            () -> builder.on("Incremented", Counter.Reset.class, (counter, event) -> { }));
        assertThrows(IllegalArgumentException.class,
            () -> builder.on("Added", Counter.Incremented.class, (counter, event) -> { }));
        assertThrows(IllegalArgumentException.class,
            () -> builder.command("Increment", Counter.Increment.class));
    }

    @Test
    void builder_InvalidArguments_ThrowException() {
        assertThrows(IllegalArgumentException.class, () -> AggregateType.builder(" ", Counter.class, id -> null));
        assertThrows(IllegalArgumentException.class, () -> AggregateType.builder("Counter", null, id -> null));
        assertThrows(IllegalArgumentException.class, () -> AggregateType.builder("Counter", Counter.class, null));
    }
}
