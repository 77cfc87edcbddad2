/**
 * In-process fakes of the external dependencies.
 *
 * @since 1.0.0
 * @author Provisioner Team
 */
package com.ryuqq.provisioner.testkit.fake;
