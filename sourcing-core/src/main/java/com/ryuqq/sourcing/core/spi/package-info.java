/**
 * Service Provider Interface (SPI) package.
 *
 * <p>Interfaces implemented by infrastructure adapters. The core and application modules
 * depend only on these.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.sourcing.core.spi.EventStore} - append-only event storage</li>
 *   <li>{@link com.ryuqq.sourcing.core.spi.SnapshotStore} - latest snapshot per aggregate</li>
 *   <li>{@link com.ryuqq.sourcing.core.spi.ScheduledCommandStore} - scheduled commands with conditional updates</li>
 *   <li>{@link com.ryuqq.sourcing.core.spi.CommandQueue} - at-least-once queue transport</li>
 *   <li>{@link com.ryuqq.sourcing.core.spi.EventBus} - committed event publication</li>
 *   <li>{@link com.ryuqq.sourcing.core.spi.PayloadCodec} - lenient serialization</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on infrastructure</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Sourcing Team
 */
package com.ryuqq.sourcing.core.spi;
