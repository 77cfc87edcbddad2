/**
 * Reusable contract tests for provisioner SPI implementations.
 *
 * @since 1.0.0
 * @author Provisioner Team
 */
package com.ryuqq.provisioner.testkit.contract;
