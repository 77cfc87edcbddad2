package com.ryuqq.provisioner.core.model;

import com.ryuqq.provisioner.core.statemachine.ProvisioningStatus;
import com.ryuqq.provisioner.core.statemachine.StatusTransition;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 프로비저닝 요청 레코드.
 *
 * <p>불변 객체이며, 모든 상태 변경은 {@link StatusTransition} 검증을 거친 새 인스턴스를 반환합니다.
 * 레코드의 유일한 작성자는 프로비저닝 서비스입니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태에 도달한 후에는 상태가 변하지 않음</li>
 *   <li>workflowRef 는 최대 한 번만 설정됨</li>
 *   <li>COMPLETED 요청은 completedAt 이 있고 errorMessage 가 없음</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class ProvisioningRequest {

    private final RequestId requestId;
    private final String namespaceName;
    private final String team;
    private final Environment environment;
    private final ResourceTier resourceTier;
    private final NetworkPolicy networkPolicy;
    private final Set<String> features;
    private final String requestedBy;
    private final String description;
    private final String costCenter;
    private final String ownerPrincipalId;
    private final ProvisioningStatus status;
    private final String statusMessage;
    private final WorkflowRef workflowRef;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant completedAt;
    private final String errorMessage;

    private ProvisioningRequest(
        RequestId requestId,
        String namespaceName,
        String team,
        Environment environment,
        ResourceTier resourceTier,
        NetworkPolicy networkPolicy,
        Set<String> features,
        String requestedBy,
        String description,
        String costCenter,
        String ownerPrincipalId,
        ProvisioningStatus status,
        String statusMessage,
        WorkflowRef workflowRef,
        Instant createdAt,
        Instant updatedAt,
        Instant completedAt,
        String errorMessage
    ) {
        this.requestId = requestId;
        this.namespaceName = namespaceName;
        this.team = team;
        this.environment = environment;
        this.resourceTier = resourceTier;
        this.networkPolicy = networkPolicy;
        this.features = features;
        this.requestedBy = requestedBy;
        this.description = description;
        this.costCenter = costCenter;
        this.ownerPrincipalId = ownerPrincipalId;
        this.status = status;
        this.statusMessage = statusMessage;
        this.workflowRef = workflowRef;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        this.completedAt = completedAt;
        this.errorMessage = errorMessage;
    }

    /**
     * 접수된 요청으로부터 PENDING 레코드 생성.
     *
     * @param requestId 발급된 요청 ID
     * @param request 원본 요청
     * @param tier 해석된 리소스 등급
     * @param now 접수 시각
     * @return PENDING 상태의 레코드
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static ProvisioningRequest pending(
        RequestId requestId,
        NamespaceRequest request,
        ResourceTier tier,
        Instant now
    ) {
        if (requestId == null) {
            throw new IllegalArgumentException("requestId cannot be null");
        }
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        if (tier == null) {
            throw new IllegalArgumentException("tier cannot be null");
        }
        if (now == null) {
            throw new IllegalArgumentException("now cannot be null");
        }
        return new ProvisioningRequest(
            requestId,
            request.namespaceName(),
            request.team(),
            request.environment(),
            tier,
            request.networkPolicy(),
            request.features(),
            request.requestedBy(),
            request.description(),
            request.costCenter(),
            request.ownerPrincipalId(),
            ProvisioningStatus.PENDING,
            "Provisioning request accepted",
            null,
            now,
            now,
            null,
            null
        );
    }

    /**
     * 워크플로우 제출 성공: PENDING → PROVISIONING.
     *
     * @param ref 엔진이 부여한 워크플로우 식별자
     * @param message 상태 메시지
     * @param now 전이 시각
     * @return PROVISIONING 상태의 새 레코드
     * @throws IllegalStateException 허용되지 않은 전이이거나 workflowRef 가 이미 설정된 경우
     */
    public ProvisioningRequest markProvisioning(WorkflowRef ref, String message, Instant now) {
        if (ref == null) {
            throw new IllegalArgumentException("ref cannot be null");
        }
        if (workflowRef != null) {
            throw new IllegalStateException("workflowRef is already set for request " + requestId);
        }
        StatusTransition.validate(status, ProvisioningStatus.PROVISIONING);
        return copy(ProvisioningStatus.PROVISIONING, message, ref, now, null, null);
    }

    /**
     * 워크플로우 성공: PROVISIONING → COMPLETED.
     */
    public ProvisioningRequest markCompleted(String message, Instant now) {
        StatusTransition.validate(status, ProvisioningStatus.COMPLETED);
        return copy(ProvisioningStatus.COMPLETED, message, workflowRef, now, now, null);
    }

    /**
     * 실패: PENDING 또는 PROVISIONING → FAILED.
     *
     * @param error 사람이 읽을 수 있는 오류 메시지
     * @param now 전이 시각
     * @return FAILED 상태의 새 레코드
     */
    public ProvisioningRequest markFailed(String error, Instant now) {
        if (error == null || error.isBlank()) {
            throw new IllegalArgumentException("error cannot be null or blank");
        }
        StatusTransition.validate(status, ProvisioningStatus.FAILED);
        return copy(ProvisioningStatus.FAILED, error, workflowRef, now, now, error);
    }

    /**
     * 취소: PENDING 또는 PROVISIONING → CANCELLED.
     */
    public ProvisioningRequest markCancelled(Instant now) {
        StatusTransition.validate(status, ProvisioningStatus.CANCELLED);
        return copy(ProvisioningStatus.CANCELLED, "Provisioning cancelled", workflowRef, now, now, null);
    }

    /**
     * 비종료 상태에서 진행 메시지만 갱신.
     *
     * @throws IllegalStateException 종료 상태인 경우
     */
    public ProvisioningRequest withStatusMessage(String message, Instant now) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Cannot update message of terminal request " + requestId);
        }
        if (Objects.equals(message, statusMessage)) {
            return this;
        }
        return copy(status, message, workflowRef, now, completedAt, errorMessage);
    }

    private ProvisioningRequest copy(
        ProvisioningStatus newStatus,
        String newMessage,
        WorkflowRef newRef,
        Instant now,
        Instant newCompletedAt,
        String newError
    ) {
        if (now == null) {
            throw new IllegalArgumentException("now cannot be null");
        }
        return new ProvisioningRequest(
            requestId, namespaceName, team, environment, resourceTier, networkPolicy,
            features, requestedBy, description, costCenter, ownerPrincipalId,
            newStatus, newMessage, newRef, createdAt, now, newCompletedAt, newError
        );
    }

    public RequestId getRequestId() {
        return requestId;
    }

    public String getNamespaceName() {
        return namespaceName;
    }

    public String getTeam() {
        return team;
    }

    public Environment getEnvironment() {
        return environment;
    }

    public ResourceTier getResourceTier() {
        return resourceTier;
    }

    public NetworkPolicy getNetworkPolicy() {
        return networkPolicy;
    }

    public Set<String> getFeatures() {
        return features;
    }

    public String getRequestedBy() {
        return requestedBy;
    }

    public Optional<String> getDescription() {
        return Optional.ofNullable(description);
    }

    public String getCostCenter() {
        return costCenter;
    }

    public Optional<String> getOwnerPrincipalId() {
        return Optional.ofNullable(ownerPrincipalId);
    }

    public ProvisioningStatus getStatus() {
        return status;
    }

    public String getStatusMessage() {
        return statusMessage;
    }

    public Optional<WorkflowRef> getWorkflowRef() {
        return Optional.ofNullable(workflowRef);
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Optional<Instant> getCompletedAt() {
        return Optional.ofNullable(completedAt);
    }

    public Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProvisioningRequest that = (ProvisioningRequest) o;
        return requestId.equals(that.requestId)
            && status == that.status
            && Objects.equals(workflowRef, that.workflowRef)
            && Objects.equals(updatedAt, that.updatedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(requestId, status, workflowRef, updatedAt);
    }

    @Override
    public String toString() {
        return "ProvisioningRequest{" +
            "requestId=" + requestId +
            ", namespaceName='" + namespaceName + '\'' +
            ", team='" + team + '\'' +
            ", status=" + status +
            ", workflowRef=" + workflowRef +
            '}';
    }
}
