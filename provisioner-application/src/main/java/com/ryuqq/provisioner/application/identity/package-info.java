/**
 * Identity principal validation against the external directory.
 *
 * @since 1.0.0
 * @author Provisioner Team
 */
package com.ryuqq.provisioner.application.identity;
