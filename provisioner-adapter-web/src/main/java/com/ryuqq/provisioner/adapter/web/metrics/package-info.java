/**
 * Micrometer bindings for circuit breaker events.
 */
package com.ryuqq.provisioner.adapter.web.metrics;
