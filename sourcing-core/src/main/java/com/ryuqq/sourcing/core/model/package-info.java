/**
 * Core value objects.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.sourcing.core.model.AggregateId} - Event stream identifier</li>
 *   <li>{@link com.ryuqq.sourcing.core.model.Payload} - Serialized event, command or snapshot body</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All value objects are immutable (final fields)</li>
 *   <li><strong>Validation:</strong> Constructor validation ensures data integrity</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Sourcing Team
 */
package com.ryuqq.sourcing.core.model;
