/**
 * Command contracts applied to aggregates.
 *
 * @since 1.0.0
 * @author Sourcing Team
 */
package com.ryuqq.sourcing.core.command;
