/**
 * In-memory event bus with synchronous consequenter dispatch.
 *
 * @see com.ryuqq.sourcing.core.spi.EventBus
 * @author Sourcing Team
 * @since 1.0.0
 */
package com.ryuqq.sourcing.adapter.inmemory.bus;
