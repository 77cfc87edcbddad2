package com.ryuqq.provisioner.core.statemachine;

/**
 * 프로비저닝 요청의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * PENDING
 *    │
 *    ├─► FAILED (사전 검증 실패, 제출 실패)
 *    ├─► CANCELLED (제출 전 취소)
 *    │
 *    ▼ (워크플로우 제출 성공)
 * PROVISIONING
 *    │
 *    ├─► COMPLETED (워크플로우 성공)
 *    ├─► FAILED (워크플로우 실패/에러)
 *    └─► CANCELLED (취소 요청)
 *
 * 금지된 전이:
 * - 종료 상태 (COMPLETED, FAILED, CANCELLED) → * ❌
 * - PROVISIONING → PENDING ❌
 * </pre>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public enum ProvisioningStatus {

    /**
     * 접수됨 (아직 워크플로우 미제출).
     */
    PENDING,

    /**
     * 워크플로우 제출 완료, 실행 중.
     */
    PROVISIONING,

    /**
     * 완료 (네임스페이스 사용 가능).
     */
    COMPLETED,

    /**
     * 실패 (제출 전 또는 제출 후).
     */
    FAILED,

    /**
     * 취소됨.
     */
    CANCELLED;

    /**
     * 종료 상태인지 확인.
     *
     * @return COMPLETED, FAILED, CANCELLED 인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * 네임스페이스 이름을 점유하고 팀 쿼터에 포함되는 상태인지 확인.
     *
     * <p>PENDING, PROVISIONING, COMPLETED 요청은 같은 이름의 신규 요청을 막고
     * 팀 쿼터를 소비합니다. FAILED, CANCELLED 요청은 이름을 반환합니다.</p>
     *
     * @return 점유 상태이면 true
     */
    public boolean isActive() {
        return this == PENDING || this == PROVISIONING || this == COMPLETED;
    }
}
