/**
 * In-memory store adapters.
 *
 * <ul>
 *   <li>{@link com.ryuqq.sourcing.adapter.inmemory.store.InMemoryEventStore} - append-only streams</li>
 *   <li>{@link com.ryuqq.sourcing.adapter.inmemory.store.InMemorySnapshotStore} - latest snapshot per aggregate</li>
 *   <li>{@link com.ryuqq.sourcing.adapter.inmemory.store.InMemoryScheduledCommandStore} - scheduled commands</li>
 * </ul>
 *
 * <h2>Limitations</h2>
 * <ul>
 *   <li>No actual ACID transactions (in-memory simulation only)</li>
 *   <li>Data lost on process restart</li>
 * </ul>
 *
 * @author Sourcing Team
 * @since 1.0.0
 */
package com.ryuqq.sourcing.adapter.inmemory.store;
