/**
 * Mapping of the provisioning error taxonomy onto HTTP problem responses.
 */
package com.ryuqq.provisioner.adapter.web.error;
