package com.ryuqq.provisioner.core.protection;

import java.time.Duration;
import java.time.Instant;

/**
 * 서킷 브레이커 상태 스냅샷.
 *
 * @param name 의존성 이름
 * @param state 현재 상태
 * @param consecutiveFailures 연속 실패 수
 * @param requestCount 실행된 호출 수 (거부된 호출 제외)
 * @param failureCount 실패로 집계된 호출 수
 * @param rejectedCount 거부된 호출 수
 * @param successRate 성공률 (0~100, 호출이 없으면 100)
 * @param healthy CLOSED 상태이면 true
 * @param nextAttemptIn OPEN 상태에서 다음 탐색까지 남은 시간 (그 외 0)
 * @param lastFailureTime 마지막 실패 시각 (nullable)
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record CircuitBreakerMetrics(
    String name,
    CircuitBreakerState state,
    int consecutiveFailures,
    long requestCount,
    long failureCount,
    long rejectedCount,
    double successRate,
    boolean healthy,
    Duration nextAttemptIn,
    Instant lastFailureTime
) {

    /**
     * 다음 탐색까지 남은 초 (올림).
     */
    public long nextAttemptInSeconds() {
        long millis = nextAttemptIn.toMillis();
        return millis <= 0 ? 0 : (millis + 999) / 1000;
    }
}
