/**
 * Spring Boot application exposing the inbound REST surface.
 *
 * <p>Wires the library modules (core, application, adapters) into beans, binds
 * {@code provisioner.*} properties, publishes circuit breaker metrics to Micrometer
 * and maps the domain error taxonomy to RFC 7807 problem responses.</p>
 */
package com.ryuqq.provisioner.adapter.web;
