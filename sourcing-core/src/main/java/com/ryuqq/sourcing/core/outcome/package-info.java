/**
 * Result types.
 *
 * <h2>Scheduled command outcome</h2>
 * <ul>
 *   <li>{@link com.ryuqq.sourcing.core.outcome.Outcome} - sealed interface (permits Ok, Retry, Fail)</li>
 *   <li>{@link com.ryuqq.sourcing.core.outcome.Ok} - command applied</li>
 *   <li>{@link com.ryuqq.sourcing.core.outcome.Retry} - application failed, retries remain</li>
 *   <li>{@link com.ryuqq.sourcing.core.outcome.Fail} - application failed for good</li>
 * </ul>
 *
 * <h2>Repository save</h2>
 * <ul>
 *   <li>{@link com.ryuqq.sourcing.core.outcome.SaveResult} - Saved or Conflict</li>
 *   <li>{@link com.ryuqq.sourcing.core.outcome.ConcurrencyException} - conflict detail</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Sourcing Team
 */
package com.ryuqq.sourcing.core.outcome;
