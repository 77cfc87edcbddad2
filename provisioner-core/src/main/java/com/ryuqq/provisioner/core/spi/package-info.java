/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines interfaces that must be implemented by infrastructure adapters.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.provisioner.core.spi.RequestStore} - provisioning request records</li>
 *   <li>{@link com.ryuqq.provisioner.core.spi.WorkflowEngine} - workflow engine transport</li>
 *   <li>{@link com.ryuqq.provisioner.core.spi.IdentityDirectory} - identity directory transport</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter modules (provisioner-adapter-inmemory, provisioner-adapter-http) provide concrete
 * implementations. The testkit provides fakes for tests.</p>
 *
 * @since 1.0.0
 * @author Provisioner Team
 */
package com.ryuqq.provisioner.core.spi;
