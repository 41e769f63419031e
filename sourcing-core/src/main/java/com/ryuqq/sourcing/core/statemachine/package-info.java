/**
 * Scheduled command state machine package.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.sourcing.core.statemachine.ScheduledCommandState} - derived lifecycle state (enum)</li>
 *   <li>{@link com.ryuqq.sourcing.core.statemachine.StateTransition} - transition validation</li>
 * </ul>
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * SCHEDULED → SCHEDULED (retryable failure)
 * SCHEDULED → APPLIED (appliedTime set)
 * SCHEDULED → PERMANENTLY_FAILED (finalAttemptTime set)
 *
 * Forbidden:
 * - APPLIED → * (terminal state)
 * - PERMANENTLY_FAILED → * (terminal state)
 * </pre>
 *
 * @since 1.0.0
 * @author Sourcing Team
 */
package com.ryuqq.sourcing.core.statemachine;
