package com.ryuqq.sourcing.core.aggregate;

import com.ryuqq.sourcing.core.command.Command;
import com.ryuqq.sourcing.core.command.CommandContext;
import com.ryuqq.sourcing.core.command.EventRecorder;
import com.ryuqq.sourcing.core.event.DomainEvent;
import com.ryuqq.sourcing.core.model.AggregateId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 이벤트 스트림으로부터 상태가 결정되는 Aggregate의 기반 클래스.
 *
 * <p>커맨드 적용으로 생성된 이벤트는 {@code pendingEvents}에 쌓이고, 저장이 확정되면
 * {@link #markChangesAsCommitted()}로 {@code eventHistory}로 옮겨집니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>version = 지금까지 본 가장 큰 sequenceNumber (커밋 + 미커밋)</li>
 *   <li>eventHistory는 append-only</li>
 *   <li>이미 보유한 ETag를 가진 커맨드는 다시 적용되지 않음</li>
 * </ul>
 *
 * <p>Aggregate 인스턴스는 스레드 안전하지 않습니다. 한 번에 하나의 작업자만 사용해야 합니다.</p>
 *
 * @param <A> 구체 Aggregate 타입 (self type)
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public abstract class EventSourcedAggregate<A extends EventSourcedAggregate<A>> {

    private final AggregateType<A> aggregateType;
    private final AggregateId id;
    private final List<DomainEvent<?>> eventHistory = new ArrayList<>();
    private final List<DomainEvent<?>> pendingEvents = new ArrayList<>();
    private final Set<String> etags = new LinkedHashSet<>();
    private long version;

    /**
     * 생성자.
     *
     * @param aggregateType 이 Aggregate의 타입 레지스트리
     * @param id Aggregate 식별자
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    protected EventSourcedAggregate(AggregateType<A> aggregateType, AggregateId id) {
        if (aggregateType == null) {
            throw new IllegalArgumentException("aggregateType cannot be null");
        }
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        this.aggregateType = aggregateType;
        this.id = id;
    }

    public AggregateId id() {
        return id;
    }

    public long version() {
        return version;
    }

    public AggregateType<A> aggregateType() {
        return aggregateType;
    }

    /**
     * 커밋된 이벤트 목록 (읽기 전용 사본).
     *
     * @return 이벤트 히스토리
     */
    public List<DomainEvent<?>> eventHistory() {
        return Collections.unmodifiableList(new ArrayList<>(eventHistory));
    }

    /**
     * 아직 저장되지 않은 이벤트 목록 (읽기 전용 사본).
     *
     * @return 미커밋 이벤트
     */
    public List<DomainEvent<?>> pendingEvents() {
        return Collections.unmodifiableList(new ArrayList<>(pendingEvents));
    }

    public boolean hasPendingEvents() {
        return !pendingEvents.isEmpty();
    }

    /**
     * 이 Aggregate가 반영한 커맨드 ETag 집합 (읽기 전용 사본).
     *
     * @return ETag 집합
     */
    public Set<String> etags() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(etags));
    }

    public boolean hasETag(String etag) {
        return etag != null && etags.contains(etag);
    }

    /**
     * 시스템 시계로 커맨드 적용.
     *
     * @param command 적용할 커맨드
     * @return 적용되었으면 true, 동일 ETag가 이미 반영되어 건너뛰었으면 false
     * @see #apply(Command, CommandContext)
     */
    public final boolean apply(Command<A> command) {
        return apply(command, CommandContext.system());
    }

    /**
     * 커맨드 적용.
     *
     * <p>커맨드의 ETag (없으면 context의 ETag)를 이미 보유하고 있으면 아무것도 하지 않습니다.
     * 그 외에는 {@link Command#validate}로 검증한 뒤 {@link Command#handle}을 호출하며,
     * 기록된 이벤트는 즉시 상태에 반영되고 pendingEvents에 추가됩니다.</p>
     *
     * @param command 적용할 커맨드
     * @param context 시계, 행위자, 기본 ETag
     * @return 적용되었으면 true, ETag 중복으로 건너뛰었으면 false
     * @throws IllegalArgumentException 인자가 null인 경우
     * @throws com.ryuqq.sourcing.core.command.CommandValidationException 검증 실패 시
     */
    public final boolean apply(Command<A> command, CommandContext context) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        String etag = command.etag() != null ? command.etag() : context.etag();
        if (hasETag(etag)) {
            return false;
        }
        command.validate(self());
        command.handle(self(), new Recorder(context, etag));
        if (etag != null) {
            etags.add(etag);
        }
        return true;
    }

    /**
     * 저장소에서 읽은 이벤트를 반영 (rehydration / refresh 전용).
     *
     * @param event 커밋된 이벤트
     * @throws IllegalArgumentException 다른 스트림의 이벤트인 경우
     * @throws IllegalStateException sequenceNumber가 현재 버전 이하인 경우
     */
    public final void applyHistorical(DomainEvent<?> event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        if (!id.equals(event.aggregateId())) {
            throw new IllegalArgumentException(
                "Event belongs to " + event.aggregateId() + ", not " + id
            );
        }
        if (event.sequenceNumber() <= version) {
            throw new IllegalStateException(
                "Event sequence " + event.sequenceNumber() + " is not after version " + version + " of " + id
            );
        }
        aggregateType.dispatch(self(), event);
        eventHistory.add(event);
        version = event.sequenceNumber();
        if (event.etag() != null) {
            etags.add(event.etag());
        }
    }

    /**
     * 저장이 확정된 pendingEvents를 eventHistory로 이동.
     */
    public final void markChangesAsCommitted() {
        eventHistory.addAll(pendingEvents);
        pendingEvents.clear();
    }

    /**
     * 스냅샷 상태로 빈 Aggregate를 초기화.
     *
     * @param snapshotVersion 스냅샷이 반영하는 버전
     * @param snapshotETags 스냅샷에 기록된 ETag 집합
     * @param state 역직렬화된 스냅샷 상태
     * @throws IllegalStateException 이미 이벤트가 반영된 Aggregate인 경우
     */
    public final void restoreFromSnapshot(long snapshotVersion, Set<String> snapshotETags, Object state) {
        if (version != 0 || !eventHistory.isEmpty() || !pendingEvents.isEmpty()) {
            throw new IllegalStateException("Snapshot can only seed an empty aggregate: " + id);
        }
        if (snapshotVersion < 1) {
            throw new IllegalArgumentException("snapshotVersion must be positive (current: " + snapshotVersion + ")");
        }
        aggregateType.restoreState(self(), state);
        version = snapshotVersion;
        if (snapshotETags != null) {
            etags.addAll(snapshotETags);
        }
    }

    /**
     * 현재 상태를 스냅샷 상태 객체로 캡처.
     *
     * @return 스냅샷 상태
     * @throws IllegalStateException 스냅샷을 지원하지 않는 타입인 경우
     */
    public final Object captureSnapshotState() {
        return aggregateType.captureState(self());
    }

    protected final A self() {
        return aggregateType.aggregateClass().cast(this);
    }

    @Override
    public String toString() {
        return aggregateType.name() + "{id=" + id + ", version=" + version + ", pending=" + pendingEvents.size() + "}";
    }

    private final class Recorder implements EventRecorder {

        private final CommandContext context;
        private final String etag;

        private Recorder(CommandContext context, String etag) {
            this.context = context;
            this.etag = etag;
        }

        @Override
        public <T> DomainEvent<T> record(T data) {
            if (data == null) {
                throw new IllegalArgumentException("data cannot be null");
            }
            DomainEvent<T> event = new DomainEvent<>(
                id,
                version + 1,
                aggregateType.eventTypeOf(data.getClass()),
                context.clock().instant(),
                context.actor(),
                etag,
                data
            );
            aggregateType.dispatch(self(), event);
            pendingEvents.add(event);
            version = event.sequenceNumber();
            return event;
        }
    }
}
