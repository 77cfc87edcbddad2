package com.ryuqq.provisioner.core.protection;

import java.util.Map;

/**
 * 레지스트리 전체 건강 상태.
 *
 * @param overallHealthy 모든 브레이커가 CLOSED 이면 true
 * @param breakers 이름 → 스냅샷
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record RegistryHealth(boolean overallHealthy, Map<String, CircuitBreakerMetrics> breakers) {

    public RegistryHealth {
        breakers = breakers == null ? Map.of() : Map.copyOf(breakers);
    }
}
