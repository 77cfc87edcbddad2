package com.ryuqq.provisioner.application.provisioning;

import com.ryuqq.provisioner.application.identity.PrincipalValidator;
import com.ryuqq.provisioner.application.workflow.WorkflowOrchestrationClient;
import com.ryuqq.provisioner.core.error.CircuitBreakerOpenException;
import com.ryuqq.provisioner.core.error.ConflictException;
import com.ryuqq.provisioner.core.error.ExternalServiceException;
import com.ryuqq.provisioner.core.error.ProvisioningException;
import com.ryuqq.provisioner.core.error.RequestNotFoundException;
import com.ryuqq.provisioner.core.error.ValidationException;
import com.ryuqq.provisioner.core.error.WorkflowNotFoundException;
import com.ryuqq.provisioner.core.model.IdentityPrincipal;
import com.ryuqq.provisioner.core.model.NamespaceRequest;
import com.ryuqq.provisioner.core.model.ProvisioningRequest;
import com.ryuqq.provisioner.core.model.RequestId;
import com.ryuqq.provisioner.core.model.ResourceTierConfig;
import com.ryuqq.provisioner.core.model.WorkflowPhase;
import com.ryuqq.provisioner.core.model.WorkflowRef;
import com.ryuqq.provisioner.core.model.WorkflowStatus;
import com.ryuqq.provisioner.core.protection.CircuitBreakerConfig;
import com.ryuqq.provisioner.core.result.CallResult;
import com.ryuqq.provisioner.core.result.ServiceError;
import com.ryuqq.provisioner.core.result.Success;
import com.ryuqq.provisioner.core.spi.RequestStore;
import com.ryuqq.provisioner.core.statemachine.ProvisioningStatus;
import com.ryuqq.provisioner.core.workflow.WorkflowDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 기본 {@link ProvisioningService} 구현.
 *
 * <p><strong>생성 흐름:</strong></p>
 * <ol>
 *   <li>요청 ID 발급</li>
 *   <li>형식 검증 (외부 호출 없음). 실패 시 FAILED 저장 후 {@link ValidationException}</li>
 *   <li>이름 중복, 팀 쿼터 검사 후 PENDING 저장 (접수 구간만 직렬화)</li>
 *   <li>소유자 지정 시 디렉터리 검증</li>
 *   <li>등급 한도 조회, 워크플로우 정의 생성, 제출</li>
 *   <li>PENDING → PROVISIONING</li>
 * </ol>
 *
 * <p>제출 전 실패는 {@code phase=pre-submission}, 제출 후 실패는 {@code phase=post-submission} 으로 로그에 남습니다.</p>
 *
 * <p><strong>취소:</strong> 로컬 상태를 즉시 CANCELLED 로 바꾸고, 워크플로우 종료는 cleanup executor 에서
 * 수행합니다. 종료 요청이 실패해도 CANCELLED 는 되돌리지 않습니다.</p>
 *
 * <p>단일 요청에 대한 쓰기는 모두 {@link RequestStore#update} 를 거치므로 상태 전이는 단조적입니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class DefaultProvisioningService implements ProvisioningService {

    private static final Logger log = LoggerFactory.getLogger(DefaultProvisioningService.class);

    static final String PRE_SUBMISSION = "pre-submission";
    static final String POST_SUBMISSION = "post-submission";

    private final RequestStore store;
    private final WorkflowOrchestrationClient workflowClient;
    private final PrincipalValidator principalValidator;
    private final ProvisioningConfig config;
    private final Clock clock;
    private final Executor cleanupExecutor;
    private final NamespaceRequestValidator validator;
    private final ProvisioningWorkflowFactory workflowFactory;
    private final Object admissionLock = new Object();

    public DefaultProvisioningService(
        RequestStore store,
        WorkflowOrchestrationClient workflowClient,
        PrincipalValidator principalValidator,
        ProvisioningConfig config,
        Clock clock,
        Executor cleanupExecutor
    ) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (workflowClient == null) {
            throw new IllegalArgumentException("workflowClient cannot be null");
        }
        if (principalValidator == null) {
            throw new IllegalArgumentException("principalValidator cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (cleanupExecutor == null) {
            throw new IllegalArgumentException("cleanupExecutor cannot be null");
        }
        this.store = store;
        this.workflowClient = workflowClient;
        this.principalValidator = principalValidator;
        this.config = config;
        this.clock = clock;
        this.cleanupExecutor = cleanupExecutor;
        this.validator = new NamespaceRequestValidator(config);
        this.workflowFactory = new ProvisioningWorkflowFactory(config);
    }

    @Override
    public ProvisioningRequest createNamespace(NamespaceRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        RequestId requestId = RequestId.generate(clock);
        log.info("Namespace request received: requestId={}, namespace={}, team={}, environment={}, tier={}",
            requestId, request.namespaceName(), request.team(), request.environment().value(), request.resourceTier());

        ProvisioningRequest pending = ProvisioningRequest.pending(
            requestId, request, NamespaceRequestValidator.resolveTier(request), clock.instant()
        );

        List<String> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            String message = "Validation failed: " + String.join("; ", violations);
            saveFailed(pending, message);
            throw new ValidationException(violations, requestId);
        }

        admit(pending);

        WorkflowDefinition definition = prepare(pending, request);

        WorkflowRef ref = submit(requestId, definition);

        ProvisioningRequest updated = store.update(requestId, current ->
            current.getStatus() == ProvisioningStatus.PENDING
                ? current.markProvisioning(ref, WorkflowStatusMessages.SUBMITTED, clock.instant())
                : current
        );
        if (updated.getStatus() != ProvisioningStatus.PROVISIONING) {
            log.warn("Request {} became {} during submission; terminating workflow {}",
                requestId, updated.getStatus(), ref);
            scheduleTerminate(requestId, ref);
            return updated;
        }
        log.info("Workflow {} submitted for request {} (namespace={})", ref, requestId, request.namespaceName());
        return updated;
    }

    @Override
    public ProvisioningRequest getStatus(RequestId requestId) {
        ProvisioningRequest current = find(requestId);
        if (current.getStatus() == ProvisioningStatus.PROVISIONING) {
            return refresh(requestId);
        }
        return current;
    }

    @Override
    public ProvisioningRequest refresh(RequestId requestId) {
        ProvisioningRequest current = find(requestId);
        Optional<WorkflowRef> ref = current.getWorkflowRef();
        if (current.getStatus() != ProvisioningStatus.PROVISIONING || ref.isEmpty()) {
            return current;
        }
        try {
            return applyWorkflowStatus(requestId, workflowClient.getStatus(ref.get()));
        } catch (WorkflowNotFoundException e) {
            return failProvisioning(requestId, ref.get(), "Workflow " + ref.get() + " no longer exists");
        } catch (CircuitBreakerOpenException | ExternalServiceException e) {
            log.warn("Could not refresh request {} from workflow {}: {}", requestId, ref.get(), e.getMessage());
            return current;
        }
    }

    @Override
    public ProvisioningRequest applyWorkflowStatus(RequestId requestId, WorkflowStatus status) {
        if (requestId == null) {
            throw new IllegalArgumentException("requestId cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        String message = WorkflowStatusMessages.describe(status);
        AtomicReference<ProvisioningStatus> before = new AtomicReference<>();
        ProvisioningRequest updated = store.update(requestId, current -> {
            before.set(current.getStatus());
            if (current.getStatus() != ProvisioningStatus.PROVISIONING
                || !current.getWorkflowRef().map(status.ref()::equals).orElse(false)) {
                return current;
            }
            if (status.phase() == WorkflowPhase.SUCCEEDED) {
                return current.markCompleted(message, clock.instant());
            }
            if (status.phase().isFailure()) {
                return current.markFailed(message, clock.instant());
            }
            return current.withStatusMessage(message, clock.instant());
        });

        if (before.get() != updated.getStatus()) {
            if (updated.getStatus() == ProvisioningStatus.COMPLETED) {
                log.info("Request {} completed: namespace {} is ready", requestId, updated.getNamespaceName());
            } else if (updated.getStatus() == ProvisioningStatus.FAILED) {
                log.error("Request {} failed (phase={}): {}", requestId, POST_SUBMISSION, message);
            }
        }
        return updated;
    }

    @Override
    public ProvisioningRequest cancel(RequestId requestId) {
        if (requestId == null) {
            throw new IllegalArgumentException("requestId cannot be null");
        }
        AtomicReference<ProvisioningStatus> before = new AtomicReference<>();
        ProvisioningRequest updated = store.update(requestId, current -> {
            before.set(current.getStatus());
            if (current.getStatus().isTerminal()) {
                return current;
            }
            return current.markCancelled(clock.instant());
        });

        if (before.get().isTerminal()) {
            log.info("Cancel of request {} ignored: already {}", requestId, before.get());
            return updated;
        }
        log.info("Request {} cancelled (was {})", requestId, before.get());
        updated.getWorkflowRef().ifPresent(ref -> scheduleTerminate(requestId, ref));
        return updated;
    }

    @Override
    public List<ProvisioningRequest> listByTeam(String team) {
        if (team == null || team.isBlank()) {
            throw new IllegalArgumentException("team cannot be null or blank");
        }
        return store.listByTeam(team);
    }

    private void admit(ProvisioningRequest pending) {
        synchronized (admissionLock) {
            boolean duplicate = store.findByNamespaceName(pending.getNamespaceName()).stream()
                .anyMatch(existing -> existing.getStatus().isActive());
            if (duplicate) {
                String message = "Namespace '" + pending.getNamespaceName() + "' already exists or is being provisioned";
                saveFailed(pending, message);
                throw new ConflictException(ConflictException.Reason.DUPLICATE_NAME, message, pending.getRequestId());
            }

            long active = store.listByTeam(pending.getTeam()).stream()
                .filter(existing -> existing.getStatus().isActive())
                .count();
            if (active >= config.teamQuota()) {
                String message = "Team '" + pending.getTeam() + "' has reached its namespace quota ("
                    + active + "/" + config.teamQuota() + ")";
                saveFailed(pending, message);
                throw new ConflictException(ConflictException.Reason.QUOTA_EXCEEDED, message, pending.getRequestId());
            }

            store.save(pending);
        }
    }

    // admitted record must not stay PENDING if owner resolution or workflow building fails
    private WorkflowDefinition prepare(ProvisioningRequest pending, NamespaceRequest request) {
        RequestId requestId = pending.getRequestId();
        try {
            IdentityPrincipal owner = request.ownerPrincipalId() == null
                ? null
                : resolveOwner(requestId, request.ownerPrincipalId());
            ResourceTierConfig limits = config.tierTable().lookup(request.resourceTier());
            return workflowFactory.build(pending, limits, owner);
        } catch (ProvisioningException e) {
            throw e;
        } catch (RuntimeException e) {
            failPending(requestId, "Request preparation failed: " + e);
            throw e;
        }
    }

    private IdentityPrincipal resolveOwner(RequestId requestId, String ownerPrincipalId) {
        CallResult<IdentityPrincipal> result = principalValidator.validateById(ownerPrincipalId);
        if (result instanceof Success<IdentityPrincipal> success) {
            return success.value();
        }
        if (result.isNotFound()) {
            String message = "Owner principal '" + ownerPrincipalId + "' was not found in the directory";
            failPending(requestId, message);
            throw new ValidationException(List.of(message), requestId);
        }

        String message = "Owner principal could not be verified: " + result.describe();
        failPending(requestId, message);
        Throwable cause = result instanceof ServiceError<IdentityPrincipal> error ? error.cause() : null;
        if (cause instanceof CircuitBreakerOpenException open) {
            throw open.withRequestId(requestId, message);
        }
        throw new ExternalServiceException(CircuitBreakerConfig.IDENTITY_DIRECTORY, message, cause, requestId);
    }

    private WorkflowRef submit(RequestId requestId, WorkflowDefinition definition) {
        try {
            return workflowClient.submit(definition);
        } catch (CircuitBreakerOpenException e) {
            String message = "Workflow engine is degraded (circuit breaker open); resubmit after "
                + e.getRemainingWait().toSeconds() + "s";
            failPending(requestId, message);
            throw e.withRequestId(requestId, message);
        } catch (ExternalServiceException e) {
            failPending(requestId, "Workflow submission failed: " + e.getMessage());
            throw e.withRequestId(requestId);
        } catch (RuntimeException e) {
            failPending(requestId, "Workflow submission failed: " + e.getMessage());
            throw e;
        }
    }

    private void saveFailed(ProvisioningRequest pending, String message) {
        store.save(pending.markFailed(message, clock.instant()));
        log.warn("Request {} rejected (phase={}): {}", pending.getRequestId(), PRE_SUBMISSION, message);
    }

    private void failPending(RequestId requestId, String message) {
        store.update(requestId, current ->
            current.getStatus() == ProvisioningStatus.PENDING
                ? current.markFailed(message, clock.instant())
                : current
        );
        log.warn("Request {} failed (phase={}): {}", requestId, PRE_SUBMISSION, message);
    }

    private ProvisioningRequest failProvisioning(RequestId requestId, WorkflowRef ref, String message) {
        ProvisioningRequest updated = store.update(requestId, current ->
            current.getStatus() == ProvisioningStatus.PROVISIONING
                && current.getWorkflowRef().map(ref::equals).orElse(false)
                ? current.markFailed(message, clock.instant())
                : current
        );
        if (updated.getStatus() == ProvisioningStatus.FAILED) {
            log.error("Request {} failed (phase={}): {}", requestId, POST_SUBMISSION, message);
        }
        return updated;
    }

    private void scheduleTerminate(RequestId requestId, WorkflowRef ref) {
        try {
            cleanupExecutor.execute(() -> terminateQuietly(requestId, ref));
        } catch (RejectedExecutionException e) {
            log.warn("Could not schedule termination of workflow {} for request {}: {}",
                ref, requestId, e.getMessage());
        }
    }

    private void terminateQuietly(RequestId requestId, WorkflowRef ref) {
        try {
            workflowClient.terminate(ref);
            log.info("Workflow {} terminated for cancelled request {}", ref, requestId);
        } catch (RuntimeException e) {
            log.warn("Termination of workflow {} for request {} failed; request stays CANCELLED: {}",
                ref, requestId, e.getMessage());
        }
    }

    private ProvisioningRequest find(RequestId requestId) {
        if (requestId == null) {
            throw new IllegalArgumentException("requestId cannot be null");
        }
        return store.findById(requestId).orElseThrow(() -> new RequestNotFoundException(requestId));
    }
}
