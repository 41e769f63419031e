package com.ryuqq.sourcing.adapter.inmemory.queue;

import com.ryuqq.sourcing.core.model.Payload;
import com.ryuqq.sourcing.core.spi.CommandQueue;
import com.ryuqq.sourcing.core.spi.QueueExceptionListener;
import com.ryuqq.sourcing.core.spi.QueueMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.Delayed;
import java.util.concurrent.TimeUnit;

/**
 * In-memory implementation of {@link CommandQueue} SPI for testing and reference purposes.
 *
 * <p>This implementation provides thread-safe at-least-once queue semantics
 * using {@link DelayQueue} for delayed delivery and an in-flight map for visibility timeouts.</p>
 *
 * <p><strong>Architecture:</strong></p>
 * <ul>
 *   <li><strong>Main Queue:</strong> DelayQueue&lt;DelayedMessage&gt; - delayed delivery ordered by availability time</li>
 *   <li><strong>In-Flight Tracking:</strong> ConcurrentHashMap&lt;String, InFlightMessage&gt; - received, uncompleted messages</li>
 * </ul>
 *
 * <p>Uncompleted messages return to the main queue once their visibility timeout expires;
 * expired entries are swept at the start of every {@link #receive(int)}. Each redelivery
 * increments {@link QueueMessage#deliveryCount()}.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryCommandQueue queue = new InMemoryCommandQueue();
 * queue.send("order-1", body, Duration.ofSeconds(5));
 *
 * for (QueueMessage message : queue.receive(10)) {
 *     if (handled(message)) {
 *         queue.complete(message);
 *     }
 *     // otherwise the message is redelivered after the visibility timeout
 * }
 * </pre>
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public class InMemoryCommandQueue implements CommandQueue {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCommandQueue.class);

    /**
     * Default visibility timeout: 30 seconds.
     */
    private static final long DEFAULT_VISIBILITY_TIMEOUT_MS = 30_000L;

    private final DelayQueue<DelayedMessage> queue;
    private final ConcurrentHashMap<String, InFlightMessage> inFlight;
    private final long visibilityTimeoutMs;
    private volatile QueueExceptionListener exceptionListener;

    /**
     * Creates a new queue with default visibility timeout (30 seconds).
     */
    public InMemoryCommandQueue() {
        this(DEFAULT_VISIBILITY_TIMEOUT_MS);
    }

    /**
     * Creates a new queue with custom visibility timeout.
     *
     * @param visibilityTimeoutMs visibility timeout in milliseconds
     * @throws IllegalArgumentException if visibilityTimeoutMs is not positive
     */
    public InMemoryCommandQueue(long visibilityTimeoutMs) {
        if (visibilityTimeoutMs <= 0) {
            throw new IllegalArgumentException("visibilityTimeoutMs must be positive, but was: " + visibilityTimeoutMs);
        }
        this.queue = new DelayQueue<>();
        this.inFlight = new ConcurrentHashMap<>();
        this.visibilityTimeoutMs = visibilityTimeoutMs;
    }

    @Override
    public void send(String sessionId, Payload body, Duration delay) {
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        if (delay == null || delay.isNegative()) {
            throw new IllegalArgumentException("delay cannot be null or negative, but was: " + delay);
        }
        QueueMessage message = new QueueMessage(UUID.randomUUID().toString(), sessionId, body, 1);
        queue.put(new DelayedMessage(message, delay.toMillis()));
    }

    @Override
    public List<QueueMessage> receive(int maxMessages) {
        if (maxMessages <= 0) {
            throw new IllegalArgumentException("maxMessages must be positive, but was: " + maxMessages);
        }
        processVisibilityTimeouts();

        List<QueueMessage> result = new ArrayList<>();
        long now = System.currentTimeMillis();
        for (int i = 0; i < maxMessages; i++) {
            DelayedMessage delayed = queue.poll();
            if (delayed == null) {
                break;
            }
            QueueMessage message = delayed.message;
            inFlight.put(message.messageId(), new InFlightMessage(message, now + visibilityTimeoutMs));
            result.add(message);
        }
        return result;
    }

    /**
     * {@inheritDoc}
     *
     * <p>Idempotent: completing a message that is no longer in flight does nothing.</p>
     */
    @Override
    public void complete(QueueMessage message) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        inFlight.remove(message.messageId());
    }

    @Override
    public void setExceptionListener(QueueExceptionListener listener) {
        this.exceptionListener = listener;
    }

    /**
     * Returns in-flight messages whose visibility timeout has expired to the queue.
     *
     * @return number of messages returned to queue
     */
    public int processVisibilityTimeouts() {
        long now = System.currentTimeMillis();
        int count = 0;
        for (var entry : inFlight.entrySet()) {
            if (entry.getValue().visibleAgainAt <= now && inFlight.remove(entry.getKey(), entry.getValue())) {
                redeliver(entry.getValue().message);
                count++;
            }
        }
        if (count > 0) {
            log.debug("Visibility timeout expired for {} message(s)", count);
        }
        return count;
    }

    /**
     * Manually expires the visibility timeout of a message. Used for testing.
     *
     * @param message received message
     * @return true if the message was in flight and returned to the queue
     * @throws IllegalArgumentException if message is null
     */
    public boolean expireVisibilityTimeout(QueueMessage message) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        InFlightMessage wrapper = inFlight.remove(message.messageId());
        if (wrapper != null) {
            redeliver(wrapper.message);
            return true;
        }
        return false;
    }

    /**
     * Simulates a lost transport session by notifying the exception listener. Used for testing.
     *
     * @param error the session failure
     */
    public void simulateSessionLost(Throwable error) {
        QueueExceptionListener listener = exceptionListener;
        if (listener != null) {
            listener.onException(null, error);
        }
    }

    /**
     * Clears all messages. Used for test cleanup.
     */
    public void clear() {
        queue.clear();
        inFlight.clear();
    }

    /**
     * Returns the number of queued (not in-flight) messages, including delayed ones.
     *
     * @return queue size
     */
    public int queueSize() {
        return queue.size();
    }

    /**
     * Returns the number of in-flight messages.
     *
     * @return in-flight count
     */
    public int inFlightSize() {
        return inFlight.size();
    }

    private void redeliver(QueueMessage message) {
        QueueMessage next = new QueueMessage(
            message.messageId(), message.sessionId(), message.body(), message.deliveryCount() + 1
        );
        queue.put(new DelayedMessage(next, 0));
    }

    private static class DelayedMessage implements Delayed {
        private final QueueMessage message;
        private final long availableAt;

        DelayedMessage(QueueMessage message, long delayMs) {
            this.message = message;
            this.availableAt = System.currentTimeMillis() + delayMs;
        }

        @Override
        public long getDelay(TimeUnit unit) {
            long diff = availableAt - System.currentTimeMillis();
            return unit.convert(diff, TimeUnit.MILLISECONDS);
        }

        @Override
        public int compareTo(Delayed other) {
            return Long.compare(this.getDelay(TimeUnit.MILLISECONDS), other.getDelay(TimeUnit.MILLISECONDS));
        }
    }

    private static class InFlightMessage {
        private final QueueMessage message;
        private final long visibleAgainAt;

        InFlightMessage(QueueMessage message, long visibleAgainAt) {
            this.message = message;
            this.visibleAgainAt = visibleAgainAt;
        }
    }
}
