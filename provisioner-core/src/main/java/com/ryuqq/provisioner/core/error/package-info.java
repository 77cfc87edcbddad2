/**
 * Error taxonomy for provisioning.
 *
 * <p>All exceptions are unchecked and extend
 * {@link com.ryuqq.provisioner.core.error.ProvisioningException}. Expected negative outcomes of
 * external lookups (not found, unauthenticated) are not exceptions; adapters return them as
 * {@link com.ryuqq.provisioner.core.result.CallResult} values.</p>
 *
 * @since 1.0.0
 * @author Provisioner Team
 */
package com.ryuqq.provisioner.core.error;
