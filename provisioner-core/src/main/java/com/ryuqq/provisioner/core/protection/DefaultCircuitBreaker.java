package com.ryuqq.provisioner.core.protection;

import com.ryuqq.provisioner.core.error.CallTimeoutException;
import com.ryuqq.provisioner.core.error.CircuitBreakerOpenException;
import com.ryuqq.provisioner.core.error.ExternalServiceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * 연속 실패 기반 Circuit Breaker 구현.
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>CLOSED: 실패마다 연속 실패 수 증가, 임계값 도달 시 OPEN. 성공 시 연속 실패 수 0으로 초기화</li>
 *   <li>OPEN: nextAttemptAt 이전 호출은 작업을 실행하지 않고 {@link CircuitBreakerOpenException}.
 *       nextAttemptAt 이후 첫 호출은 HALF_OPEN 으로 전이하며 통과</li>
 *   <li>HALF_OPEN: 동시에 하나의 탐색 호출만 통과. 실패 시 즉시 OPEN,
 *       연속 성공이 ceil(failureThreshold / 2) 에 도달하면 CLOSED</li>
 * </ul>
 *
 * <p><strong>호출 허가:</strong> 각 호출은 허가 시점의 상태 세대(generation)를 기록한 {@link Permit} 을 받습니다.
 * 상태 전이마다 세대가 증가하므로, CLOSED 시점에 허가된 호출이 HALF_OPEN 중에 끝나더라도
 * 탐색 호출로 집계되지 않습니다.</p>
 *
 * <p><strong>호출 타임아웃:</strong> 작업은 호출 실행기에서 실행되며, callTimeout 안에 끝나지 않으면
 * 작업을 인터럽트하고 실패로 집계한 뒤 {@link CallTimeoutException} 을 던집니다.</p>
 *
 * <p><strong>스레드 안전성:</strong> 모든 상태와 카운터는 인스턴스 모니터로 보호됩니다.
 * 작업 실행 자체는 락 밖에서 이루어집니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class DefaultCircuitBreaker implements CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(DefaultCircuitBreaker.class);

    static final Duration FORCE_OPEN_DURATION = Duration.ofHours(24);
    static final int HEALTH_LOG_INTERVAL = 50;

    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final ExecutorService callExecutor;
    private final CircuitBreakerListener listener;

    // guarded by this
    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private int consecutiveFailures;
    private int halfOpenSuccesses;
    private boolean trialInFlight;
    private long generation;
    private long requestCount;
    private long failureCount;
    private long rejectedCount;
    private Instant lastFailureTime;
    private Instant nextAttemptAt;

    /**
     * 생성자.
     *
     * @param config 브레이커 설정
     * @param clock 시간 기준 (테스트에서 제어 가능)
     * @param callExecutor 작업 실행기 (호출 타임아웃 적용용)
     * @param listener 이벤트 수신자
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public DefaultCircuitBreaker(
        CircuitBreakerConfig config,
        Clock clock,
        ExecutorService callExecutor,
        CircuitBreakerListener listener
    ) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (callExecutor == null) {
            throw new IllegalArgumentException("callExecutor cannot be null");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        this.config = config;
        this.clock = clock;
        this.callExecutor = callExecutor;
        this.listener = listener;
    }

    @Override
    public String getName() {
        return config.name();
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }

    @Override
    public <T> T execute(Callable<T> operation) {
        return execute(operation, result -> false);
    }

    @Override
    public <T> T execute(Callable<T> operation, Predicate<? super T> isFailure) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (isFailure == null) {
            throw new IllegalArgumentException("isFailure cannot be null");
        }

        Permit permit = acquirePermission();

        Future<T> future;
        try {
            future = callExecutor.submit(operation);
        } catch (RejectedExecutionException e) {
            onFailure(permit, CallOutcome.FAILURE, e);
            throw new ExternalServiceException(getName(), "Call executor rejected call to " + getName(), e);
        }

        T result;
        try {
            result = future.get(config.callTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            onFailure(permit, CallOutcome.TIMEOUT, e);
            throw new CallTimeoutException(getName(), config.callTimeout());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            onFailure(permit, CallOutcome.FAILURE, cause);
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new ExternalServiceException(
                getName(), "Call to " + getName() + " failed: " + cause.getMessage(), cause
            );
        } catch (InterruptedException e) {
            future.cancel(true);
            releasePermission(permit);
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while calling " + getName());
        }

        if (isFailure.test(result)) {
            onFailure(permit, CallOutcome.FAILURE, null);
        } else {
            onSuccess(permit);
        }
        return result;
    }

    private Permit acquirePermission() {
        Transition transition = null;
        Duration remaining = null;
        Permit permit = null;
        synchronized (this) {
            switch (state) {
                case CLOSED -> {
                    return new Permit(false, generation);
                }
                case OPEN -> {
                    Instant now = clock.instant();
                    if (now.isBefore(nextAttemptAt)) {
                        rejectedCount++;
                        remaining = Duration.between(now, nextAttemptAt);
                    } else {
                        transition = moveTo(CircuitBreakerState.HALF_OPEN);
                        halfOpenSuccesses = 0;
                        trialInFlight = true;
                        permit = new Permit(true, generation);
                    }
                }
                case HALF_OPEN -> {
                    if (trialInFlight) {
                        rejectedCount++;
                        remaining = Duration.ZERO;
                    } else {
                        trialInFlight = true;
                        permit = new Permit(true, generation);
                    }
                }
            }
        }

        if (transition != null) {
            publish(transition);
        }
        if (remaining != null) {
            log.warn("Circuit breaker '{}' rejected call, retry in {}ms", getName(), remaining.toMillis());
            notifyCall(CallOutcome.REJECTED);
            throw new CircuitBreakerOpenException(getName(), remaining);
        }
        return permit;
    }

    private synchronized void releasePermission(Permit permit) {
        if (isCurrentTrial(permit)) {
            trialInFlight = false;
        }
    }

    // caller holds the monitor
    private boolean isCurrentTrial(Permit permit) {
        return permit.trial()
            && permit.generation() == generation
            && state == CircuitBreakerState.HALF_OPEN;
    }

    private void onSuccess(Permit permit) {
        Transition transition = null;
        boolean logHealth;
        synchronized (this) {
            requestCount++;
            if (isCurrentTrial(permit)) {
                trialInFlight = false;
                halfOpenSuccesses++;
                if (halfOpenSuccesses >= config.halfOpenSuccessThreshold()) {
                    transition = moveTo(CircuitBreakerState.CLOSED);
                    consecutiveFailures = 0;
                    halfOpenSuccesses = 0;
                    nextAttemptAt = null;
                }
            } else if (state == CircuitBreakerState.CLOSED) {
                consecutiveFailures = 0;
            }
            logHealth = requestCount % HEALTH_LOG_INTERVAL == 0;
        }

        notifyCall(CallOutcome.SUCCESS);
        if (transition != null) {
            publish(transition);
        }
        if (logHealth) {
            logHealthSnapshot();
        }
    }

    private void onFailure(Permit permit, CallOutcome outcome, Throwable cause) {
        Transition transition = null;
        boolean logHealth;
        int failures;
        synchronized (this) {
            Instant now = clock.instant();
            requestCount++;
            failureCount++;
            lastFailureTime = now;

            if (isCurrentTrial(permit)) {
                consecutiveFailures++;
                trialInFlight = false;
                transition = open(now, config.resetTimeout());
            } else if (state == CircuitBreakerState.CLOSED) {
                consecutiveFailures++;
                if (consecutiveFailures >= config.failureThreshold()) {
                    transition = open(now, config.resetTimeout());
                }
            }
            failures = consecutiveFailures;
            logHealth = requestCount % HEALTH_LOG_INTERVAL == 0;
        }

        log.warn("Circuit breaker '{}' recorded {} ({}/{}): {}",
            getName(), outcome.tag(), failures, config.failureThreshold(),
            cause != null ? cause.toString() : "failure result");
        notifyCall(outcome);
        if (transition != null) {
            publish(transition);
        }
        if (logHealth) {
            logHealthSnapshot();
        }
    }

    // caller holds the monitor
    private Transition open(Instant now, Duration duration) {
        Transition transition = moveTo(CircuitBreakerState.OPEN);
        nextAttemptAt = now.plus(duration);
        halfOpenSuccesses = 0;
        trialInFlight = false;
        return transition;
    }

    // caller holds the monitor
    private Transition moveTo(CircuitBreakerState next) {
        CircuitBreakerState previous = state;
        if (previous == next) {
            return null;
        }
        state = next;
        generation++;
        return new Transition(previous, next);
    }

    @Override
    public synchronized CircuitBreakerState getState() {
        return state;
    }

    @Override
    public synchronized CircuitBreakerMetrics getMetrics() {
        Duration nextAttemptIn = Duration.ZERO;
        if (state == CircuitBreakerState.OPEN && nextAttemptAt != null) {
            Duration remaining = Duration.between(clock.instant(), nextAttemptAt);
            nextAttemptIn = remaining.isNegative() ? Duration.ZERO : remaining;
        }
        double successRate = requestCount == 0
            ? 100.0
            : (requestCount - failureCount) * 100.0 / requestCount;
        return new CircuitBreakerMetrics(
            getName(),
            state,
            consecutiveFailures,
            requestCount,
            failureCount,
            rejectedCount,
            successRate,
            state == CircuitBreakerState.CLOSED,
            nextAttemptIn,
            lastFailureTime
        );
    }

    @Override
    public void reset() {
        Transition transition;
        synchronized (this) {
            transition = moveTo(CircuitBreakerState.CLOSED);
            consecutiveFailures = 0;
            halfOpenSuccesses = 0;
            trialInFlight = false;
            nextAttemptAt = null;
        }
        log.warn("Circuit breaker '{}' manually reset to CLOSED", getName());
        if (transition != null) {
            publish(transition);
        }
    }

    @Override
    public void forceOpen() {
        Transition transition;
        Instant until;
        synchronized (this) {
            transition = open(clock.instant(), FORCE_OPEN_DURATION);
            until = nextAttemptAt;
        }
        log.warn("Circuit breaker '{}' manually forced OPEN until {}", getName(), until);
        if (transition != null) {
            publish(transition);
        }
    }

    private void publish(Transition transition) {
        if (transition.to() == CircuitBreakerState.OPEN) {
            log.error("Circuit breaker '{}' {} → OPEN, next attempt at {}",
                getName(), transition.from(), nextAttemptAtSnapshot());
        } else {
            log.info("Circuit breaker '{}' {} → {}", getName(), transition.from(), transition.to());
        }
        try {
            listener.onStateTransition(getName(), transition.from(), transition.to());
        } catch (RuntimeException e) {
            log.warn("Circuit breaker listener failed on transition for '{}'", getName(), e);
        }
    }

    private void notifyCall(CallOutcome outcome) {
        try {
            listener.onCall(getName(), outcome);
        } catch (RuntimeException e) {
            log.warn("Circuit breaker listener failed on call outcome for '{}'", getName(), e);
        }
    }

    private void logHealthSnapshot() {
        if (!log.isDebugEnabled()) {
            return;
        }
        CircuitBreakerMetrics metrics = getMetrics();
        log.debug("Circuit breaker '{}' health: state={}, requests={}, consecutiveFailures={}, successRate={}%",
            metrics.name(), metrics.state(), metrics.requestCount(), metrics.consecutiveFailures(),
            String.format("%.1f", metrics.successRate()));
    }

    private synchronized Instant nextAttemptAtSnapshot() {
        return nextAttemptAt;
    }

    private record Transition(CircuitBreakerState from, CircuitBreakerState to) {
    }

    // trial: admitted while HALF_OPEN
    private record Permit(boolean trial, long generation) {
    }

    @Override
    public String toString() {
        return "DefaultCircuitBreaker{name='" + getName() + "', state=" + getState() + '}';
    }
}
