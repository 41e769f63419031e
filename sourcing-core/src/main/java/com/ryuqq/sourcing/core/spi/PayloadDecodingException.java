package com.ryuqq.sourcing.core.spi;

/**
 * Payload could not be decoded into the requested type.
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
public class PayloadDecodingException extends RuntimeException {

    public PayloadDecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
