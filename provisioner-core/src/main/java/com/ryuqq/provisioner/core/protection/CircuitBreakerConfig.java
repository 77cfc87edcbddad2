package com.ryuqq.provisioner.core.protection;

import java.time.Duration;

/**
 * Circuit Breaker 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>name: 보호 대상 의존성 이름 (레지스트리 키, 메트릭 태그)</li>
 *   <li>failureThreshold: OPEN 전이까지의 연속 실패 수</li>
 *   <li>resetTimeout: OPEN 유지 시간 (이후 HALF_OPEN 탐색 허용)</li>
 *   <li>callTimeout: 호출당 제한 시간 (초과 시 실패로 집계)</li>
 * </ul>
 *
 * <p><strong>의존성별 기본값:</strong></p>
 * <ul>
 *   <li>identity-directory: 5회 / 30초 / 5초</li>
 *   <li>workflow-engine: 3회 / 60초 / 30초 (워크플로우 호출이 더 느림)</li>
 * </ul>
 *
 * @param name 의존성 이름 (빈 문자열 불가)
 * @param failureThreshold 연속 실패 임계값 (1 이상)
 * @param resetTimeout OPEN 유지 시간 (양수)
 * @param callTimeout 호출당 제한 시간 (양수, resetTimeout 보다 짧아야 함)
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record CircuitBreakerConfig(
    String name,
    int failureThreshold,
    Duration resetTimeout,
    Duration callTimeout
) {

    public static final String IDENTITY_DIRECTORY = "identity-directory";
    public static final String WORKFLOW_ENGINE = "workflow-engine";

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CircuitBreakerConfig {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (failureThreshold < 1) {
            throw new IllegalArgumentException(
                "failureThreshold must be positive (current: " + failureThreshold + ")"
            );
        }
        if (resetTimeout == null || resetTimeout.isZero() || resetTimeout.isNegative()) {
            throw new IllegalArgumentException("resetTimeout must be positive (current: " + resetTimeout + ")");
        }
        if (callTimeout == null || callTimeout.isZero() || callTimeout.isNegative()) {
            throw new IllegalArgumentException("callTimeout must be positive (current: " + callTimeout + ")");
        }
        if (callTimeout.compareTo(resetTimeout) >= 0) {
            throw new IllegalArgumentException(
                "callTimeout must be shorter than resetTimeout (call: " + callTimeout + ", reset: " + resetTimeout + ")"
            );
        }
    }

    /**
     * 기본값으로 설정 생성 (5회 / 60초 / 10초).
     */
    public static CircuitBreakerConfig of(String name) {
        return new CircuitBreakerConfig(name, 5, Duration.ofSeconds(60), Duration.ofSeconds(10));
    }

    /**
     * 디렉터리 의존성 기본 설정.
     */
    public static CircuitBreakerConfig forIdentityDirectory() {
        return new CircuitBreakerConfig(IDENTITY_DIRECTORY, 5, Duration.ofSeconds(30), Duration.ofSeconds(5));
    }

    /**
     * 워크플로우 엔진 의존성 기본 설정.
     */
    public static CircuitBreakerConfig forWorkflowEngine() {
        return new CircuitBreakerConfig(WORKFLOW_ENGINE, 3, Duration.ofSeconds(60), Duration.ofSeconds(30));
    }

    /**
     * HALF_OPEN 에서 CLOSED 로 닫히기 위한 연속 성공 수.
     *
     * @return ceil(failureThreshold / 2)
     */
    public int halfOpenSuccessThreshold() {
        return (failureThreshold + 1) / 2;
    }

    public CircuitBreakerConfig withFailureThreshold(int failureThreshold) {
        return new CircuitBreakerConfig(name, failureThreshold, resetTimeout, callTimeout);
    }

    public CircuitBreakerConfig withResetTimeout(Duration resetTimeout) {
        return new CircuitBreakerConfig(name, failureThreshold, resetTimeout, callTimeout);
    }

    public CircuitBreakerConfig withCallTimeout(Duration callTimeout) {
        return new CircuitBreakerConfig(name, failureThreshold, resetTimeout, callTimeout);
    }
}
