package com.ryuqq.provisioner.core.protection;

/**
 * Circuit Breaker 상태.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED (정상)
 *   │
 *   ▼ (연속 실패 수가 failureThreshold 도달)
 * OPEN (차단)
 *   │
 *   ▼ (resetTimeout 경과 후 첫 호출)
 * HALF_OPEN (반개방)
 *   │
 *   ├─► ceil(failureThreshold / 2) 회 연속 성공 → CLOSED
 *   └─► 실패 1회 → OPEN (새 resetTimeout)
 * </pre>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public enum CircuitBreakerState {

    /**
     * 정상 상태 (요청 통과).
     *
     * <p>연속 실패 수를 추적하며, 성공 시 0으로 초기화합니다.</p>
     */
    CLOSED,

    /**
     * 차단 상태 (요청 즉시 거부).
     *
     * <p>다음 시도 시각 이전의 모든 호출은 의존성을 호출하지 않고 거부됩니다.</p>
     */
    OPEN,

    /**
     * 반개방 상태 (한 번에 하나의 탐색 호출만 통과).
     */
    HALF_OPEN;

    /**
     * 메트릭 게이지 값 (CLOSED=0, HALF_OPEN=1, OPEN=2).
     */
    public int gaugeValue() {
        return switch (this) {
            case CLOSED -> 0;
            case HALF_OPEN -> 1;
            case OPEN -> 2;
        };
    }
}
