/**
 * Namespace provisioning orchestration: request validation, admission (duplicate name and team quota),
 * workflow definition building, submission and request lifecycle.
 *
 * <p>Entry point is {@link com.ryuqq.provisioner.application.provisioning.ProvisioningService}.</p>
 */
package com.ryuqq.provisioner.application.provisioning;
