package com.ryuqq.provisioner.adapter.runner;

/**
 * StatusPoller 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>batchSize: 한 번의 스캔에서 조회할 PROVISIONING 요청 수 (기본 100)</li>
 * </ul>
 *
 * <p>스캔 주기는 스캔을 호출하는 쪽(스케줄러)이 정합니다.</p>
 *
 * <p>스캔 한 번은 요청마다 워크플로우 엔진을 한 번 호출합니다.
 * 워크플로우 엔진 브레이커의 임계값보다 배치가 크면 장애 시 브레이커가 스캔 도중 열릴 수 있으며,
 * 이후 항목은 엔진 호출 없이 건너뜁니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 * @param batchSize 배치 크기 (1 이상이어야 함)
 */
public record StatusPollerConfig(
    int batchSize
) {

    /**
     * 기본 설정 생성자.
     */
    public StatusPollerConfig() {
        this(100);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public StatusPollerConfig {
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
    }

    public StatusPollerConfig withBatchSize(int batchSize) {
        return new StatusPollerConfig(batchSize);
    }
}
