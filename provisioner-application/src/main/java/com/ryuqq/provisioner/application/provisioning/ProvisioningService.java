package com.ryuqq.provisioner.application.provisioning;

import com.ryuqq.provisioner.core.model.NamespaceRequest;
import com.ryuqq.provisioner.core.model.ProvisioningRequest;
import com.ryuqq.provisioner.core.model.RequestId;
import com.ryuqq.provisioner.core.model.WorkflowStatus;

import java.util.List;

/**
 * 네임스페이스 프로비저닝 진입점.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * PENDING → PROVISIONING → COMPLETED
 *    │            ├──────→ FAILED
 *    │            └──────→ CANCELLED
 *    ├──→ FAILED (검증 실패, 제출 실패)
 *    └──→ CANCELLED
 * </pre>
 *
 * <p>요청 ID 가 발급된 이후의 오류는 {@code ProvisioningException#getRequestId()} 로 ID 를 전달합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public interface ProvisioningService {

    /**
     * 네임스페이스 생성 요청 접수 및 워크플로우 제출.
     *
     * @param request 생성 요청
     * @return PROVISIONING 상태의 레코드 (제출 직후 취소된 경우 CANCELLED)
     * @throws com.ryuqq.provisioner.core.error.ValidationException 형식 검증 또는 소유자 검증 실패
     * @throws com.ryuqq.provisioner.core.error.ConflictException 이름 중복 또는 팀 쿼터 초과
     * @throws com.ryuqq.provisioner.core.error.CircuitBreakerOpenException 워크플로우 엔진 브레이커 OPEN
     * @throws com.ryuqq.provisioner.core.error.ExternalServiceException 외부 호출 실패
     */
    ProvisioningRequest createNamespace(NamespaceRequest request);

    /**
     * 요청 상태 조회. PROVISIONING 이면 엔진 상태를 반영한 뒤 반환합니다.
     *
     * @throws com.ryuqq.provisioner.core.error.RequestNotFoundException 요청이 없는 경우
     */
    ProvisioningRequest getStatus(RequestId requestId);

    /**
     * 엔진에서 워크플로우 상태를 한 번 조회해 반영합니다.
     * 엔진을 사용할 수 없으면 저장된 상태를 그대로 반환합니다.
     *
     * @throws com.ryuqq.provisioner.core.error.RequestNotFoundException 요청이 없는 경우
     */
    ProvisioningRequest refresh(RequestId requestId);

    /**
     * 관찰한 워크플로우 상태 반영. PROVISIONING 이 아니거나 워크플로우가 다르면 무시합니다.
     *
     * @throws com.ryuqq.provisioner.core.error.RequestNotFoundException 요청이 없는 경우
     */
    ProvisioningRequest applyWorkflowStatus(RequestId requestId, WorkflowStatus status);

    /**
     * 요청 취소. 종료 상태의 요청은 변경 없이 그대로 반환합니다.
     *
     * @return 취소 후 (또는 이미 종료된) 레코드
     * @throws com.ryuqq.provisioner.core.error.RequestNotFoundException 요청이 없는 경우
     */
    ProvisioningRequest cancel(RequestId requestId);

    /**
     * 팀의 요청 목록 (생성 순).
     */
    List<ProvisioningRequest> listByTeam(String team);
}
