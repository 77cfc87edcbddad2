/**
 * Tagged results of calls into external dependencies.
 *
 * @since 1.0.0
 * @author Provisioner Team
 */
package com.ryuqq.provisioner.core.result;
