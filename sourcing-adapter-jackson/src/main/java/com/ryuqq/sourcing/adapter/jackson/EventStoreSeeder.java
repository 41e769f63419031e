package com.ryuqq.sourcing.adapter.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.sourcing.core.event.StoredEvent;
import com.ryuqq.sourcing.core.model.AggregateId;
import com.ryuqq.sourcing.core.model.Payload;
import com.ryuqq.sourcing.core.spi.AppendResult;
import com.ryuqq.sourcing.core.spi.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads events from a JSON array into an {@link EventStore}.
 *
 * <p>Each element describes one stored event; {@code body} is any JSON value and is stored
 * verbatim:</p>
 * <pre>
 * [
 *   {"streamName": "Order", "aggregateId": "order-1", "sequenceNumber": 1,
 *    "eventType": "Created", "timestamp": "2024-03-01T09:00:00Z", "actor": "seed",
 *    "body": {"customerName": "Alice"}}
 * ]
 * </pre>
 *
 * <p>The whole array is appended as one atomic batch.</p>
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public class EventStoreSeeder {

    private static final Logger log = LoggerFactory.getLogger(EventStoreSeeder.class);

    private final EventStore eventStore;
    private final ObjectMapper objectMapper;

    public EventStoreSeeder(EventStore eventStore) {
        this(eventStore, JacksonPayloadCodec.defaultObjectMapper());
    }

    /**
     * Constructor.
     *
     * @param eventStore target store
     * @param objectMapper mapper used to parse the seed document
     * @throws IllegalArgumentException if any argument is null
     */
    public EventStoreSeeder(EventStore eventStore, ObjectMapper objectMapper) {
        if (eventStore == null) {
            throw new IllegalArgumentException("eventStore cannot be null");
        }
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.eventStore = eventStore;
        this.objectMapper = objectMapper;
    }

    /**
     * Seeds from a classpath resource.
     *
     * @param resourceName resource name, e.g. {@code "Events.json"}
     * @return seeded events
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException if a seeded position is already taken
     */
    public List<StoredEvent> seedFromResource(String resourceName) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        try (InputStream in = loader.getResourceAsStream(resourceName)) {
            if (in == null) {
                throw new IllegalArgumentException("Seed resource not found: " + resourceName);
            }
            return seed(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read seed resource " + resourceName, e);
        }
    }

    /**
     * Seeds from a JSON array.
     *
     * @param json JSON document
     * @return seeded events
     * @throws IOException if the document cannot be parsed
     * @throws IllegalStateException if a seeded position is already taken
     */
    public List<StoredEvent> seed(InputStream json) throws IOException {
        JsonNode root = objectMapper.readTree(json);
        if (root == null || !root.isArray()) {
            throw new IllegalArgumentException("Seed document must be a JSON array");
        }
        List<StoredEvent> events = new ArrayList<>();
        for (JsonNode node : root) {
            events.add(toStoredEvent(node));
        }
        return seed(events);
    }

    /**
     * Seeds already built events.
     *
     * @param events events to append
     * @return the appended events
     * @throws IllegalStateException if a seeded position is already taken
     */
    public List<StoredEvent> seed(List<StoredEvent> events) {
        AppendResult result = eventStore.appendAll(events);
        if (result instanceof AppendResult.SequenceConflict conflict) {
            throw new IllegalStateException(
                "Cannot seed " + conflict.attempted().eventType() + " at " + conflict.attempted().aggregateId()
                    + " #" + conflict.attempted().sequenceNumber() + ": position already holds "
                    + conflict.existing().eventType()
            );
        }
        long streams = events.stream().map(StoredEvent::aggregateId).distinct().count();
        log.info("Seeded {} events into {} streams", events.size(), streams);
        return events;
    }

    private StoredEvent toStoredEvent(JsonNode node) throws IOException {
        JsonNode body = node.path("body");
        return new StoredEvent(
            required(node, "streamName").asText(),
            AggregateId.of(required(node, "aggregateId").asText()),
            required(node, "sequenceNumber").asLong(),
            required(node, "eventType").asText(),
            Payload.of(body.isMissingNode() ? "{}" : objectMapper.writeValueAsString(body)),
            Instant.parse(required(node, "timestamp").asText()),
            node.hasNonNull("actor") ? node.get("actor").asText() : null,
            node.hasNonNull("etag") ? node.get("etag").asText() : null
        );
    }

    private static JsonNode required(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("Seed event is missing '" + field + "': " + node);
        }
        return value;
    }
}
