/**
 * In-memory {@link com.ryuqq.provisioner.core.spi.RequestStore} adapter.
 *
 * <p>Suitable for tests and single-instance deployments. Records are lost on restart.</p>
 *
 * @since 1.0.0
 * @author Provisioner Team
 */
package com.ryuqq.provisioner.adapter.inmemory.store;
