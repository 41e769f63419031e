package com.ryuqq.sourcing.core.spi;

import com.ryuqq.sourcing.core.model.Payload;

/**
 * Serialization SPI for event, command, snapshot and message bodies.
 *
 * <p>Decoding is lenient: members unknown to the target type are skipped and reported
 * through {@link Decoded#ignoredFields()} instead of failing the decode.</p>
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public interface PayloadCodec {

    /**
     * Encodes a value.
     *
     * @param value value to encode
     * @return encoded payload
     * @throws IllegalArgumentException if value is null or cannot be encoded
     */
    Payload encode(Object value);

    /**
     * Decodes a payload leniently.
     *
     * @param payload encoded payload
     * @param type target type
     * @param <T> target type
     * @return decoded value and ignored member names
     * @throws PayloadDecodingException if the payload is malformed or cannot build the type
     */
    <T> Decoded<T> decode(Payload payload, Class<T> type);
}
