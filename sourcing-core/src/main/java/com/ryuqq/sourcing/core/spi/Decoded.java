package com.ryuqq.sourcing.core.spi;

import java.util.Set;

/**
 * Result of a lenient decode.
 *
 * @param value decoded value built from the fields that parsed
 * @param ignoredFields names of members present in the payload but unknown to the target type
 * @param <T> target type
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public record Decoded<T>(T value, Set<String> ignoredFields) {

    public Decoded {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        ignoredFields = ignoredFields == null ? Set.of() : Set.copyOf(ignoredFields);
    }

    /**
     * @return true if every member of the payload was understood
     */
    public boolean isLossless() {
        return ignoredFields.isEmpty();
    }
}
