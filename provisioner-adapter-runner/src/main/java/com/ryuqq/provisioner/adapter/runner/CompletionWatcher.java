package com.ryuqq.provisioner.adapter.runner;

import com.ryuqq.provisioner.application.provisioning.ProvisioningService;
import com.ryuqq.provisioner.application.workflow.PollingPolicy;
import com.ryuqq.provisioner.application.workflow.WorkflowOrchestrationClient;
import com.ryuqq.provisioner.core.error.RequestNotFoundException;
import com.ryuqq.provisioner.core.error.WorkflowNotFoundException;
import com.ryuqq.provisioner.core.model.ProvisioningRequest;
import com.ryuqq.provisioner.core.model.RequestId;
import com.ryuqq.provisioner.core.model.WorkflowRef;
import com.ryuqq.provisioner.core.model.WorkflowStatus;
import com.ryuqq.provisioner.core.spi.RequestStore;
import com.ryuqq.provisioner.core.statemachine.ProvisioningStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;

/**
 * 요청 단위 완료 대기.
 *
 * <p>{@link #watch(RequestId)} 는 전용 executor 에서
 * {@link WorkflowOrchestrationClient#waitForCompletion(WorkflowRef, PollingPolicy)} 를 실행하고,
 * 결과를 {@link ProvisioningService#applyWorkflowStatus} 로 반영합니다.</p>
 *
 * <p><strong>취소:</strong></p>
 * <ul>
 *   <li>반환된 {@link Future} 를 {@code cancel(true)} 하면 대기 스레드가 인터럽트되어 폴링이 멈춥니다.</li>
 *   <li>대기 취소는 워크플로우를 종료하지 않습니다. 워크플로우 종료는 {@link ProvisioningService#cancel} 입니다.</li>
 * </ul>
 *
 * <p>같은 요청에 대한 대기는 동시에 하나만 실행되며, 중복 호출은 진행 중인 Future 를 반환합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class CompletionWatcher {

    private static final Logger log = LoggerFactory.getLogger(CompletionWatcher.class);

    private final RequestStore store;
    private final ProvisioningService service;
    private final WorkflowOrchestrationClient workflowClient;
    private final Executor executor;
    private final PollingPolicy policy;
    private final Map<RequestId, Future<ProvisioningRequest>> watches = new ConcurrentHashMap<>();

    /**
     * 생성자.
     *
     * @param executor 대기 작업을 실행할 비동기 executor (호출 스레드에서 실행하는 executor 는 사용할 수 없음)
     */
    public CompletionWatcher(
        RequestStore store,
        ProvisioningService service,
        WorkflowOrchestrationClient workflowClient,
        Executor executor,
        PollingPolicy policy
    ) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (service == null) {
            throw new IllegalArgumentException("service cannot be null");
        }
        if (workflowClient == null) {
            throw new IllegalArgumentException("workflowClient cannot be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        this.store = store;
        this.service = service;
        this.workflowClient = workflowClient;
        this.executor = executor;
        this.policy = policy;
    }

    /**
     * 요청의 워크플로우가 끝날 때까지 대기를 시작합니다.
     *
     * @param requestId 요청 ID
     * @return 대기 결과 반영 후의 레코드. PROVISIONING 이 아니면 즉시 완료된 Future
     * @throws RequestNotFoundException 요청이 없는 경우
     */
    public Future<ProvisioningRequest> watch(RequestId requestId) {
        if (requestId == null) {
            throw new IllegalArgumentException("requestId cannot be null");
        }
        ProvisioningRequest current = store.findById(requestId)
            .orElseThrow(() -> new RequestNotFoundException(requestId));
        Optional<WorkflowRef> ref = current.getWorkflowRef();
        if (current.getStatus() != ProvisioningStatus.PROVISIONING || ref.isEmpty()) {
            return CompletableFuture.completedFuture(current);
        }
        return watches.computeIfAbsent(requestId, id -> {
            WatchTask task = new WatchTask(id, ref.get());
            executor.execute(task);
            return task;
        });
    }

    /**
     * 진행 중인 대기를 멈춥니다. 워크플로우와 요청 상태는 그대로입니다.
     *
     * @return 멈춘 대기가 있었으면 true
     */
    public boolean stopWatching(RequestId requestId) {
        Future<ProvisioningRequest> watch = watches.get(requestId);
        if (watch == null || !watch.cancel(true)) {
            return false;
        }
        log.info("Stopped watching {}", requestId);
        return true;
    }

    public int activeWatches() {
        return watches.size();
    }

    private ProvisioningRequest awaitAndApply(RequestId requestId, WorkflowRef ref) {
        log.debug("Watching workflow {} for {}", ref, requestId);
        try {
            WorkflowStatus status = workflowClient.waitForCompletion(ref, policy);
            ProvisioningRequest applied = service.applyWorkflowStatus(requestId, status);
            if (status.waitTimedOut()) {
                log.info("Watch of {} timed out after {}; request stays {}", requestId, policy.timeout(), applied.getStatus());
            }
            return applied;
        } catch (WorkflowNotFoundException e) {
            return service.refresh(requestId);
        }
    }

    /**
     * 완료되거나 취소되면 스스로 등록을 해제하는 대기 작업.
     */
    private final class WatchTask extends FutureTask<ProvisioningRequest> {

        private final RequestId requestId;

        WatchTask(RequestId requestId, WorkflowRef ref) {
            super(() -> awaitAndApply(requestId, ref));
            this.requestId = requestId;
        }

        @Override
        protected void done() {
            watches.remove(requestId, this);
        }
    }
}
