package com.ryuqq.sourcing.core.aggregate;

import com.ryuqq.sourcing.core.command.Command;
import com.ryuqq.sourcing.core.event.DomainEvent;
import com.ryuqq.sourcing.core.event.UnrecognizedEvent;
import com.ryuqq.sourcing.core.model.AggregateId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Aggregate 타입별 이벤트/커맨드 레지스트리.
 *
 * <p>이벤트 타입 판별자(discriminator)를 이벤트 데이터 클래스와 applier 함수로 매핑합니다.
 * Aggregate 클래스마다 한 번 구성되며, 이후에는 읽기 전용입니다.
 * 리플렉션 기반 디스패치 대신 명시적으로 등록된 매핑만 사용합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * static final AggregateType&lt;Order&gt; TYPE = AggregateType.builder("Order", Order.class, Order::new)
 *     .on("ItemAdded", ItemAdded.class, (order, event) -&gt; order.items.add(event.data()))
 *     .command("AddItem", AddItem.class)
 *     .build();
 * </pre>
 *
 * @param <A> Aggregate 타입
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public final class AggregateType<A extends EventSourcedAggregate<A>> {

    private final String name;
    private final Class<A> aggregateClass;
    private final Function<AggregateId, A> factory;
    private final Map<String, EventRegistration<A, ?>> eventsByName;
    private final Map<Class<?>, EventRegistration<A, ?>> eventsByClass;
    private final Map<String, Class<? extends Command<A>>> commandsByName;
    private final SnapshotSupport<A, ?> snapshotSupport;

    private AggregateType(Builder<A> builder) {
        this.name = builder.name;
        this.aggregateClass = builder.aggregateClass;
        this.factory = builder.factory;
        this.eventsByName = Collections.unmodifiableMap(new LinkedHashMap<>(builder.eventsByName));
        Map<Class<?>, EventRegistration<A, ?>> byClass = new LinkedHashMap<>();
        for (EventRegistration<A, ?> registration : builder.eventsByName.values()) {
            byClass.put(registration.dataType(), registration);
        }
        this.eventsByClass = Collections.unmodifiableMap(byClass);
        this.commandsByName = Collections.unmodifiableMap(new LinkedHashMap<>(builder.commandsByName));
        this.snapshotSupport = builder.snapshotSupport;
    }

    /**
     * 빌더 생성.
     *
     * @param name Aggregate 타입 이름 (스트림 이름으로도 사용)
     * @param aggregateClass Aggregate 클래스
     * @param factory 식별자로 빈 Aggregate를 만드는 팩토리
     * @param <A> Aggregate 타입
     * @return 빌더
     * @throws IllegalArgumentException 인자가 null이거나 name이 비어 있는 경우
     */
    public static <A extends EventSourcedAggregate<A>> Builder<A> builder(
        String name,
        Class<A> aggregateClass,
        Function<AggregateId, A> factory
    ) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (aggregateClass == null) {
            throw new IllegalArgumentException("aggregateClass cannot be null");
        }
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }
        return new Builder<>(name, aggregateClass, factory);
    }

    public String name() {
        return name;
    }

    public Class<A> aggregateClass() {
        return aggregateClass;
    }

    /**
     * 빈 Aggregate 인스턴스 생성 (버전 0).
     *
     * @param id Aggregate 식별자
     * @return 새 인스턴스
     */
    public A newInstance(AggregateId id) {
        A aggregate = factory.apply(id);
        if (aggregate == null) {
            throw new IllegalStateException("factory returned null for " + name);
        }
        return aggregate;
    }

    /**
     * 이벤트 타입 판별자에 해당하는 데이터 클래스 조회.
     *
     * @param eventType 이벤트 타입 판별자
     * @return 등록된 데이터 클래스 (미등록이면 empty)
     */
    public Optional<Class<?>> eventDataType(String eventType) {
        EventRegistration<A, ?> registration = eventsByName.get(eventType);
        return registration == null ? Optional.empty() : Optional.of(registration.dataType());
    }

    /**
     * 데이터 클래스에 해당하는 이벤트 타입 판별자 조회.
     *
     * @param dataType 이벤트 데이터 클래스
     * @return 이벤트 타입 판별자
     * @throws IllegalArgumentException 등록되지 않은 클래스인 경우
     */
    public String eventTypeOf(Class<?> dataType) {
        EventRegistration<A, ?> registration = eventsByClass.get(dataType);
        if (registration == null) {
            throw new IllegalArgumentException(
                "Event data type not registered for " + name + ": " + dataType.getName()
            );
        }
        return registration.eventType();
    }

    /**
     * 커맨드 이름에 해당하는 커맨드 클래스 조회.
     *
     * @param commandName 커맨드 이름
     * @return 등록된 커맨드 클래스 (미등록이면 empty)
     */
    public Optional<Class<? extends Command<A>>> commandType(String commandName) {
        return Optional.ofNullable(commandsByName.get(commandName));
    }

    /**
     * 스냅샷 지원 여부.
     *
     * @return 스냅샷 상태 타입이 등록되어 있으면 true
     */
    public boolean supportsSnapshots() {
        return snapshotSupport != null;
    }

    /**
     * 스냅샷 상태 타입.
     *
     * @return 상태 클래스
     * @throws IllegalStateException 스냅샷을 지원하지 않는 타입인 경우
     */
    public Class<?> snapshotStateType() {
        return requireSnapshotSupport().stateType();
    }

    void dispatch(A aggregate, DomainEvent<?> event) {
        if (event.data() instanceof UnrecognizedEvent) {
            return;
        }
        EventRegistration<A, ?> registration = eventsByName.get(event.eventType());
        if (registration == null) {
            throw new IllegalArgumentException(
                "No applier registered for " + name + " event type: " + event.eventType()
            );
        }
        registration.dispatch(aggregate, event);
    }

    Object captureState(A aggregate) {
        return requireSnapshotSupport().capture().apply(aggregate);
    }

    void restoreState(A aggregate, Object state) {
        requireSnapshotSupport().restore(aggregate, state);
    }

    private SnapshotSupport<A, ?> requireSnapshotSupport() {
        if (snapshotSupport == null) {
            throw new IllegalStateException(name + " does not support snapshots");
        }
        return snapshotSupport;
    }

    @Override
    public String toString() {
        return "AggregateType{" + name + "}";
    }

    private record EventRegistration<A, T>(String eventType, Class<T> dataType, EventApplier<A, T> applier) {

        void dispatch(A aggregate, DomainEvent<?> event) {
            if (!dataType.isInstance(event.data())) {
                throw new IllegalArgumentException(
                    "Event " + eventType + " carries " + event.data().getClass().getName()
                        + ", expected " + dataType.getName()
                );
            }
            applier.apply(aggregate, event.withDataAs(dataType));
        }
    }

    private record SnapshotSupport<A, S>(Class<S> stateType, Function<A, S> capture, BiConsumer<A, S> restorer) {

        void restore(A aggregate, Object state) {
            restorer.accept(aggregate, stateType.cast(state));
        }
    }

    /**
     * {@link AggregateType} 빌더.
     *
     * @param <A> Aggregate 타입
     */
    public static final class Builder<A extends EventSourcedAggregate<A>> {

        private final String name;
        private final Class<A> aggregateClass;
        private final Function<AggregateId, A> factory;
        private final Map<String, EventRegistration<A, ?>> eventsByName = new LinkedHashMap<>();
        private final Map<String, Class<? extends Command<A>>> commandsByName = new LinkedHashMap<>();
        private SnapshotSupport<A, ?> snapshotSupport;

        private Builder(String name, Class<A> aggregateClass, Function<AggregateId, A> factory) {
            this.name = name;
            this.aggregateClass = aggregateClass;
            this.factory = factory;
        }

        /**
         * 이벤트 타입 등록.
         *
         * @param eventType 이벤트 타입 판별자
         * @param dataType 이벤트 데이터 클래스
         * @param applier 상태 변경 함수
         * @param <T> 이벤트 데이터 타입
         * @return this
         * @throws IllegalArgumentException 중복 등록이거나 인자가 null인 경우
         */
        public <T> Builder<A> on(String eventType, Class<T> dataType, EventApplier<A, T> applier) {
            if (eventType == null || eventType.isBlank()) {
                throw new IllegalArgumentException("eventType cannot be null or blank");
            }
            if (dataType == null) {
                throw new IllegalArgumentException("dataType cannot be null");
            }
            if (applier == null) {
                throw new IllegalArgumentException("applier cannot be null");
            }
            if (eventsByName.containsKey(eventType)) {
                throw new IllegalArgumentException("Duplicate event type for " + name + ": " + eventType);
            }
            for (EventRegistration<A, ?> existing : eventsByName.values()) {
                if (existing.dataType().equals(dataType)) {
                    throw new IllegalArgumentException("Duplicate event data type for " + name + ": " + dataType.getName());
                }
            }
            eventsByName.put(eventType, new EventRegistration<>(eventType, dataType, applier));
            return this;
        }

        /**
         * 예약 가능한 커맨드 등록.
         *
         * @param commandName 커맨드 이름
         * @param commandType 커맨드 클래스
         * @return this
         * @throws IllegalArgumentException 중복 등록이거나 인자가 null인 경우
         */
        public Builder<A> command(String commandName, Class<? extends Command<A>> commandType) {
            if (commandName == null || commandName.isBlank()) {
                throw new IllegalArgumentException("commandName cannot be null or blank");
            }
            if (commandType == null) {
                throw new IllegalArgumentException("commandType cannot be null");
            }
            if (commandsByName.putIfAbsent(commandName, commandType) != null) {
                throw new IllegalArgumentException("Duplicate command for " + name + ": " + commandName);
            }
            return this;
        }

        /**
         * 스냅샷 상태 캡처/복원 함수 등록.
         *
         * @param stateType 스냅샷 상태 클래스
         * @param capture Aggregate → 상태
         * @param restore 상태 → Aggregate
         * @param <S> 상태 타입
         * @return this
         */
        public <S> Builder<A> snapshots(Class<S> stateType, Function<A, S> capture, BiConsumer<A, S> restore) {
            if (stateType == null || capture == null || restore == null) {
                throw new IllegalArgumentException("snapshot stateType, capture and restore cannot be null");
            }
            this.snapshotSupport = new SnapshotSupport<>(stateType, capture, restore);
            return this;
        }

        public AggregateType<A> build() {
            return new AggregateType<>(this);
        }
    }
}
