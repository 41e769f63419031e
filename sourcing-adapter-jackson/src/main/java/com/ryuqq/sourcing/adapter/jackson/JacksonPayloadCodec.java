package com.ryuqq.sourcing.adapter.jackson;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.deser.DeserializationProblemHandler;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ryuqq.sourcing.core.model.Payload;
import com.ryuqq.sourcing.core.spi.Decoded;
import com.ryuqq.sourcing.core.spi.PayloadCodec;
import com.ryuqq.sourcing.core.spi.PayloadDecodingException;

import java.io.IOException;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Jackson implementation of {@link PayloadCodec}.
 *
 * <p>Bodies are JSON documents. Decoding never fails on unknown members: every unknown
 * property is skipped by a {@link DeserializationProblemHandler} and reported in
 * {@link Decoded#ignoredFields()}, so that a known event type carrying newer members is
 * still applied with the fields that parsed.</p>
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public class JacksonPayloadCodec implements PayloadCodec {

    private final ObjectMapper objectMapper;

    /**
     * Creates a codec with {@link #defaultObjectMapper()}.
     */
    public JacksonPayloadCodec() {
        this(defaultObjectMapper());
    }

    /**
     * Creates a codec with a caller-configured mapper.
     *
     * @param objectMapper mapper to use
     * @throws IllegalArgumentException if objectMapper is null
     */
    public JacksonPayloadCodec(ObjectMapper objectMapper) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.objectMapper = objectMapper;
    }

    /**
     * Mapper used by default: JSR-310 types as ISO-8601 strings, empty records allowed,
     * unknown properties tolerated.
     *
     * @return new mapper
     */
    public static ObjectMapper defaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    @Override
    public Payload encode(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        try {
            return Payload.of(objectMapper.writeValueAsString(value));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode " + value.getClass().getName(), e);
        }
    }

    @Override
    public <T> Decoded<T> decode(Payload payload, Class<T> type) {
        if (payload == null || payload.isEmpty()) {
            throw new PayloadDecodingException("Cannot decode an empty payload into " + name(type), null);
        }
        if (!payload.hasContentType(Payload.JSON)) {
            throw new PayloadDecodingException(
                "Cannot decode " + payload.contentType() + " payload into " + name(type), null
            );
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        Set<String> ignoredFields = new LinkedHashSet<>();
        ObjectReader reader = objectMapper.readerFor(type).withHandler(new UnknownPropertyCollector(ignoredFields));
        T value;
        try {
            value = reader.readValue(payload.content());
        } catch (JsonProcessingException e) {
            throw new PayloadDecodingException("Cannot decode payload into " + name(type) + ": " + e.getOriginalMessage(), e);
        }
        if (value == null) {
            throw new PayloadDecodingException("Payload decoded to null for " + name(type), null);
        }
        return new Decoded<>(value, ignoredFields);
    }

    private static String name(Class<?> type) {
        return type == null ? "null" : type.getName();
    }

    private static final class UnknownPropertyCollector extends DeserializationProblemHandler {

        private final Set<String> ignoredFields;

        private UnknownPropertyCollector(Set<String> ignoredFields) {
            this.ignoredFields = ignoredFields;
        }

        @Override
        public boolean handleUnknownProperty(
            DeserializationContext ctxt,
            JsonParser p,
            JsonDeserializer<?> deserializer,
            Object beanOrClass,
            String propertyName
        ) throws IOException {
            ignoredFields.add(propertyName);
            p.skipChildren();
            return true;
        }
    }
}
