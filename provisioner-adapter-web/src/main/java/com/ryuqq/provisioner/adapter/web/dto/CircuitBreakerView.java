package com.ryuqq.provisioner.adapter.web.dto;

import com.ryuqq.provisioner.core.protection.CircuitBreakerMetrics;

import java.time.Instant;

/**
 * 브레이커 메트릭 스냅샷 응답.
 */
public record CircuitBreakerView(
    String name,
    String state,
    int consecutiveFailures,
    long requestCount,
    long failureCount,
    long rejectedCount,
    double successRate,
    boolean healthy,
    long nextAttemptInSeconds,
    Instant lastFailureTime
) {

    public static CircuitBreakerView from(CircuitBreakerMetrics metrics) {
        return new CircuitBreakerView(
            metrics.name(),
            metrics.state().name(),
            metrics.consecutiveFailures(),
            metrics.requestCount(),
            metrics.failureCount(),
            metrics.rejectedCount(),
            metrics.successRate(),
            metrics.healthy(),
            metrics.nextAttemptInSeconds(),
            metrics.lastFailureTime()
        );
    }
}
