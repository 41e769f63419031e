/**
 * In-memory queue transport adapter.
 *
 * <h2>Message Lifecycle</h2>
 *
 * <pre>
 * ┌─────────────┐
 * │    send     │ (with optional delay)
 * └──────┬──────┘
 *        │
 *        ▼
 * ┌─────────────┐
 * │ DelayQueue  │ (wait for delay expiration)
 * └──────┬──────┘
 *        │
 *        ▼
 * ┌─────────────┐
 * │   receive   │ → in flight (visibility timeout starts)
 * └──────┬──────┘
 *        │
 *        ├──► complete() ──────────────────► [Permanently Removed]
 *        │
 *        └──► Visibility Timeout Expired ──► [Re-queued, deliveryCount + 1]
 * </pre>
 *
 * <h2>Limitations</h2>
 * <ul>
 *   <li><strong>In-Memory Only:</strong> Data lost on process restart</li>
 *   <li><strong>Single JVM:</strong> No distributed delivery</li>
 * </ul>
 *
 * @see com.ryuqq.sourcing.core.spi.CommandQueue
 * @author Sourcing Team
 * @since 1.0.0
 */
package com.ryuqq.sourcing.adapter.inmemory.queue;
