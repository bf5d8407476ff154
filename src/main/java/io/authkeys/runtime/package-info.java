/**
 * Audit and reconciliation engine.
 *
 * <p>{@link io.authkeys.runtime.ConfigExpander} turns policy into expected bindings,
 * {@link io.authkeys.runtime.FetchCoordinator} reads every declared account concurrently,
 * {@link io.authkeys.runtime.ReconciliationEngine} classifies, and
 * {@link io.authkeys.runtime.RemediationPlanner} with
 * {@link io.authkeys.runtime.RemediationCoordinator} rewrites files to match the policy.
 */
package io.authkeys.runtime;
