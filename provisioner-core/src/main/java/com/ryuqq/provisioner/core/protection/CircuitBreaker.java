package com.ryuqq.provisioner.core.protection;

import java.util.concurrent.Callable;
import java.util.function.Predicate;

/**
 * Circuit Breaker SPI.
 *
 * <p>외부 의존성 호출을 감싸 연속 실패를 추적하고, 임계값 도달 시 빠르게 실패(Fail-Fast)하여
 * 장애가 전체 시스템으로 전파되는 것을 방지합니다. 의존성 하나당 프로세스 전체에서
 * 인스턴스 하나를 공유하며, 모든 카운터 갱신과 상태 전이는 직렬화됩니다.</p>
 *
 * <p>브레이커는 내부적으로 재시도하지 않습니다. 재시도 여부는 호출자가 결정합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CircuitBreaker cb = registry.getOrCreate(CircuitBreakerConfig.forWorkflowEngine());
 *
 * CallResult<WorkflowRef> result = cb.execute(
 *     () -> engine.submit(definition),
 *     CallResult::countsAsFailure
 * );
 * }</pre>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public interface CircuitBreaker {

    /**
     * 보호 대상 의존성 이름.
     */
    String getName();

    /**
     * 작업 실행. 예외나 타임아웃만 실패로 집계합니다.
     *
     * @param operation 보호할 작업
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws com.ryuqq.provisioner.core.error.CircuitBreakerOpenException 브레이커가 호출을 거부한 경우 (작업 미실행)
     * @throws com.ryuqq.provisioner.core.error.CallTimeoutException callTimeout 초과
     * @throws com.ryuqq.provisioner.core.error.ExternalServiceException 작업이 checked 예외를 던진 경우
     * @throws java.util.concurrent.CancellationException 대기 중 호출 스레드가 인터럽트된 경우
     */
    <T> T execute(Callable<T> operation);

    /**
     * 작업 실행. 정상 반환된 결과도 {@code isFailure} 가 true 이면 실패로 집계합니다.
     *
     * <p>결과 기반 실패는 예외로 바뀌지 않고 그대로 반환됩니다.</p>
     *
     * @param operation 보호할 작업
     * @param isFailure 결과가 실패인지 판정
     * @param <T> 결과 타입
     * @return 작업 결과
     */
    <T> T execute(Callable<T> operation, Predicate<? super T> isFailure);

    /**
     * 현재 상태 조회.
     */
    CircuitBreakerState getState();

    /**
     * 현재 상태 스냅샷.
     */
    CircuitBreakerMetrics getMetrics();

    /**
     * CLOSED 상태로 강제 리셋 (운영자 조치).
     */
    void reset();

    /**
     * OPEN 상태로 강제 전환 (운영자 조치, 24시간 유지).
     */
    void forceOpen();
}
