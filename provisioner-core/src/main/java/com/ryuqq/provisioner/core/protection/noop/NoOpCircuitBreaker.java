package com.ryuqq.provisioner.core.protection.noop;

import com.ryuqq.provisioner.core.error.ExternalServiceException;
import com.ryuqq.provisioner.core.protection.CircuitBreaker;
import com.ryuqq.provisioner.core.protection.CircuitBreakerMetrics;
import com.ryuqq.provisioner.core.protection.CircuitBreakerState;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.function.Predicate;

/**
 * Circuit Breaker NoOp 구현.
 *
 * <p>모든 호출을 호출 스레드에서 그대로 실행하며, 상태 추적과 타임아웃을 하지 않습니다.
 * 보호 없이 클라이언트를 단위 테스트할 때 사용합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>execute(): 작업 실행, checked 예외는 {@link ExternalServiceException} 으로 감쌈</li>
 *   <li>getState(): 항상 CLOSED 반환</li>
 *   <li>reset(), forceOpen(): 아무 동작 안 함</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class NoOpCircuitBreaker implements CircuitBreaker {

    private final String name;

    public NoOpCircuitBreaker() {
        this("noop");
    }

    public NoOpCircuitBreaker(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public <T> T execute(Callable<T> operation) {
        try {
            return operation.call();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new ExternalServiceException(name, "Call to " + name + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public <T> T execute(Callable<T> operation, Predicate<? super T> isFailure) {
        return execute(operation);
    }

    @Override
    public CircuitBreakerState getState() {
        return CircuitBreakerState.CLOSED;
    }

    @Override
    public CircuitBreakerMetrics getMetrics() {
        return new CircuitBreakerMetrics(
            name, CircuitBreakerState.CLOSED, 0, 0, 0, 0, 100.0, true, Duration.ZERO, null
        );
    }

    @Override
    public void reset() {
        // NoOp
    }

    @Override
    public void forceOpen() {
        // NoOp
    }
}
