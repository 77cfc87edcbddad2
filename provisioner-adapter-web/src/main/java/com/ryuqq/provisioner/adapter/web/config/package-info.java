/**
 * Bean wiring and {@code provisioner.*} property binding.
 */
package com.ryuqq.provisioner.adapter.web.config;
