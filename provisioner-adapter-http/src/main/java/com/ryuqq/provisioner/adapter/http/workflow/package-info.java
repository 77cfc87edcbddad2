/**
 * {@link com.ryuqq.provisioner.core.spi.WorkflowEngine} over the engine's JSON REST API.
 */
package com.ryuqq.provisioner.adapter.http.workflow;
