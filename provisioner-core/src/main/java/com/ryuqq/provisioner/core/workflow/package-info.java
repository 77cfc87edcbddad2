/**
 * Declarative workflow DAG submitted to the external workflow engine.
 *
 * @since 1.0.0
 * @author Provisioner Team
 */
package com.ryuqq.provisioner.core.workflow;
