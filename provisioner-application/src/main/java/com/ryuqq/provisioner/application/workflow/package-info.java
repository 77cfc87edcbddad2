/**
 * Workflow engine client: submission, status polling and termination.
 *
 * @since 1.0.0
 * @author Provisioner Team
 */
package com.ryuqq.provisioner.application.workflow;
