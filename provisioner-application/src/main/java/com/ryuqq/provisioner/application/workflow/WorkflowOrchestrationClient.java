package com.ryuqq.provisioner.application.workflow;

import com.ryuqq.provisioner.core.error.CircuitBreakerOpenException;
import com.ryuqq.provisioner.core.error.ExternalServiceException;
import com.ryuqq.provisioner.core.error.WorkflowNotFoundException;
import com.ryuqq.provisioner.core.model.WorkflowRef;
import com.ryuqq.provisioner.core.model.WorkflowStatus;
import com.ryuqq.provisioner.core.protection.CircuitBreaker;
import com.ryuqq.provisioner.core.result.CallResult;
import com.ryuqq.provisioner.core.result.NotFound;
import com.ryuqq.provisioner.core.result.Success;
import com.ryuqq.provisioner.core.spi.WorkflowEngine;
import com.ryuqq.provisioner.core.workflow.WorkflowDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CancellationException;

/**
 * 워크플로우 엔진 클라이언트.
 *
 * <p>모든 엔진 호출은 워크플로우 엔진 전용 서킷 브레이커를 거칩니다.
 * 클라이언트는 재시도하지 않습니다 (폴링 루프의 반복 조회 제외).</p>
 *
 * <p><strong>오류 매핑:</strong></p>
 * <ul>
 *   <li>브레이커 거부 → {@link CircuitBreakerOpenException} (그대로 전파)</li>
 *   <li>ServiceError, Unauthenticated, 타임아웃 → {@link ExternalServiceException}</li>
 *   <li>상태 조회 NotFound → {@link WorkflowNotFoundException}</li>
 *   <li>종료 요청 NotFound → 정상 (이미 없는 워크플로우)</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * WorkflowRef ref = client.submit(definition);
 * WorkflowStatus status = client.waitForCompletion(ref, new PollingPolicy());
 * if (status.waitTimedOut()) {
 *     // 아직 실행 중, 요청은 열어둠
 * }
 * </pre>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class WorkflowOrchestrationClient {

    private static final Logger log = LoggerFactory.getLogger(WorkflowOrchestrationClient.class);

    private final WorkflowEngine engine;
    private final CircuitBreaker breaker;
    private final Clock clock;
    private final Sleeper sleeper;

    public WorkflowOrchestrationClient(WorkflowEngine engine, CircuitBreaker breaker, Clock clock, Sleeper sleeper) {
        if (engine == null) {
            throw new IllegalArgumentException("engine cannot be null");
        }
        if (breaker == null) {
            throw new IllegalArgumentException("breaker cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.engine = engine;
        this.breaker = breaker;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * 워크플로우 제출.
     *
     * @param definition 제출할 DAG
     * @return 엔진이 부여한 워크플로우 식별자
     * @throws CircuitBreakerOpenException 브레이커가 호출을 거부한 경우 (엔진 미호출)
     * @throws ExternalServiceException 엔진 호출 실패
     */
    public WorkflowRef submit(WorkflowDefinition definition) {
        if (definition == null) {
            throw new IllegalArgumentException("definition cannot be null");
        }
        CallResult<WorkflowRef> result = breaker.execute(() -> engine.submit(definition), CallResult::countsAsFailure);
        if (result instanceof Success<WorkflowRef> success) {
            log.info("Submitted workflow {} ({} steps)", success.value(), definition.getSteps().size());
            return success.value();
        }
        throw failure("submit workflow " + definition.getName(), result);
    }

    /**
     * 워크플로우 상태 조회 (1회).
     *
     * @param ref 워크플로우 식별자
     * @return 상태 스냅샷
     * @throws WorkflowNotFoundException 엔진에 워크플로우가 없는 경우
     * @throws CircuitBreakerOpenException 브레이커가 호출을 거부한 경우
     * @throws ExternalServiceException 엔진 호출 실패
     */
    public WorkflowStatus getStatus(WorkflowRef ref) {
        if (ref == null) {
            throw new IllegalArgumentException("ref cannot be null");
        }
        CallResult<WorkflowStatus> result = breaker.execute(() -> engine.fetchStatus(ref), CallResult::countsAsFailure);
        if (result instanceof Success<WorkflowStatus> success) {
            return success.value();
        }
        if (result instanceof NotFound) {
            throw new WorkflowNotFoundException(ref);
        }
        throw failure("fetch status of " + ref, result);
    }

    /**
     * 고정 간격으로 종료 단계까지 대기.
     *
     * @see #waitForCompletion(WorkflowRef, PollingPolicy)
     */
    public WorkflowStatus waitForCompletion(WorkflowRef ref, Duration pollInterval, Duration timeout) {
        return waitForCompletion(ref, PollingPolicy.fixed(pollInterval, timeout));
    }

    /**
     * 종료 단계(Succeeded, Failed, Error) 또는 타임아웃까지 상태를 폴링.
     *
     * <p>일시적 조회 실패(브레이커 거부, 엔진 오류)는 로그만 남기고 계속 폴링합니다.
     * 타임아웃 시 예외 대신 {@code waitTimedOut=true} 인 마지막 관찰 상태를 반환합니다.</p>
     *
     * <p>호출 스레드가 인터럽트되면 인터럽트 플래그를 복원하고 {@link CancellationException} 을 던집니다.
     * 대기 취소는 워크플로우 자체를 종료하지 않습니다.</p>
     *
     * @param ref 워크플로우 식별자
     * @param policy 폴링 정책
     * @return 종료 상태 또는 "아직 실행 중" 상태
     * @throws WorkflowNotFoundException 엔진에 워크플로우가 없는 경우
     * @throws CancellationException 대기가 취소된 경우
     */
    public WorkflowStatus waitForCompletion(WorkflowRef ref, PollingPolicy policy) {
        if (ref == null) {
            throw new IllegalArgumentException("ref cannot be null");
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }

        Instant deadline = clock.instant().plus(policy.timeout());
        WorkflowStatus lastObserved = null;
        int attempt = 0;

        while (true) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Waiting for workflow " + ref + " was cancelled");
            }
            attempt++;
            try {
                WorkflowStatus status = getStatus(ref);
                lastObserved = status;
                if (status.isTerminal()) {
                    log.info("Workflow {} reached {} after {} polls", ref, status.phase().value(), attempt);
                    return status;
                }
            } catch (CircuitBreakerOpenException | ExternalServiceException e) {
                log.warn("Polling workflow {} failed (attempt {}), will retry: {}", ref, attempt, e.getMessage());
            }

            Duration remaining = Duration.between(clock.instant(), deadline);
            if (remaining.isZero() || remaining.isNegative()) {
                log.info("Stopped waiting for workflow {} after {}; it may still be running", ref, policy.timeout());
                return WorkflowStatus.stillRunning(ref, lastObserved);
            }

            Duration delay = policy.delayFor(attempt);
            try {
                sleeper.sleep(delay.compareTo(remaining) < 0 ? delay : remaining);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CancellationException("Waiting for workflow " + ref + " was cancelled");
            }
        }
    }

    /**
     * 워크플로우 종료 요청 (best-effort).
     *
     * <p>엔진에 워크플로우가 없거나 이미 끝난 경우도 정상으로 취급합니다.</p>
     *
     * @param ref 워크플로우 식별자
     * @throws CircuitBreakerOpenException 브레이커가 호출을 거부한 경우
     * @throws ExternalServiceException 엔진 호출 실패
     */
    public void terminate(WorkflowRef ref) {
        if (ref == null) {
            throw new IllegalArgumentException("ref cannot be null");
        }
        CallResult<Boolean> result = breaker.execute(() -> engine.delete(ref), CallResult::countsAsFailure);
        if (result instanceof Success) {
            log.info("Terminated workflow {}", ref);
            return;
        }
        if (result instanceof NotFound) {
            log.info("Workflow {} already gone, nothing to terminate", ref);
            return;
        }
        throw failure("terminate " + ref, result);
    }

    public String getDependencyName() {
        return breaker.getName();
    }

    private ExternalServiceException failure(String action, CallResult<?> result) {
        return new ExternalServiceException(
            breaker.getName(),
            "Workflow engine failed to " + action + ": " + result.describe()
        );
    }
}
