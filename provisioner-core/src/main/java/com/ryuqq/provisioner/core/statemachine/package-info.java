/**
 * Provisioning request state machine package.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.provisioner.core.statemachine.ProvisioningStatus} - request lifecycle statuses (enum)</li>
 *   <li>{@link com.ryuqq.provisioner.core.statemachine.StatusTransition} - transition validation and execution</li>
 * </ul>
 *
 * <h2>Transition Rules</h2>
 * <pre>
 * PENDING → PROVISIONING (workflow submitted)
 * PENDING → FAILED (pre-submission failure)
 * PENDING → CANCELLED
 * PROVISIONING → COMPLETED (workflow succeeded)
 * PROVISIONING → FAILED (workflow failed or errored)
 * PROVISIONING → CANCELLED
 *
 * Forbidden:
 * - COMPLETED, FAILED, CANCELLED → * (terminal)
 * - PROVISIONING → PENDING
 * </pre>
 *
 * @since 1.0.0
 * @author Provisioner Team
 */
package com.ryuqq.provisioner.core.statemachine;
