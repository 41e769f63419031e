package com.ryuqq.sourcing.core.spi;

/**
 * Notification channel for transport-level failures (lost session, handler exception).
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface QueueExceptionListener {

    /**
     * Called when message handling or the transport session fails.
     *
     * @param message the message being handled, null for session-level failures
     * @param error the failure
     */
    void onException(QueueMessage message, Throwable error);
}
