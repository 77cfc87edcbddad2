package com.ryuqq.provisioner.core.protection;

/**
 * 서킷 브레이커 이벤트 수신자 (메트릭 연동 확장점).
 *
 * <p>콜백은 호출 스레드에서 동기적으로 실행되므로 가볍게 유지해야 합니다.
 * 콜백에서 발생한 예외는 브레이커가 로그만 남기고 무시합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public interface CircuitBreakerListener {

    /**
     * 아무 것도 하지 않는 수신자.
     */
    CircuitBreakerListener NOOP = new CircuitBreakerListener() {
    };

    /**
     * 레지스트리가 새 브레이커를 만든 직후 호출.
     */
    default void onCreated(CircuitBreaker breaker) {
    }

    /**
     * 상태 전이 시 호출.
     */
    default void onStateTransition(String name, CircuitBreakerState from, CircuitBreakerState to) {
    }

    /**
     * 호출 하나가 끝나거나 거부될 때마다 호출.
     */
    default void onCall(String name, CallOutcome outcome) {
    }
}
