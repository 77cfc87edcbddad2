package com.ryuqq.provisioner.adapter.web.dto;

import com.ryuqq.provisioner.core.protection.RegistryHealth;

import java.util.Comparator;
import java.util.List;

/**
 * {@code GET /circuit-breakers} 응답.
 */
public record RegistryHealthView(boolean overallHealthy, List<CircuitBreakerView> breakers) {

    public static RegistryHealthView from(RegistryHealth health) {
        return new RegistryHealthView(
            health.overallHealthy(),
            health.breakers().values().stream()
                .map(CircuitBreakerView::from)
                .sorted(Comparator.comparing(CircuitBreakerView::name))
                .toList()
        );
    }
}
