/**
 * Sample aggregates shared by the test suites of every module.
 *
 * @since 1.0.0
 * @author Sourcing Team
 */
package com.ryuqq.sourcing.testkit.fixture;
