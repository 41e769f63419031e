/**
 * Event envelope types.
 *
 * <ul>
 *   <li>{@link com.ryuqq.sourcing.core.event.DomainEvent} - typed in-memory event</li>
 *   <li>{@link com.ryuqq.sourcing.core.event.StoredEvent} - persisted event record</li>
 *   <li>{@link com.ryuqq.sourcing.core.event.UnrecognizedEvent} - placeholder for unknown event types</li>
 *   <li>{@link com.ryuqq.sourcing.core.event.Consequenter} - synchronous event subscriber</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Sourcing Team
 */
package com.ryuqq.sourcing.core.event;
