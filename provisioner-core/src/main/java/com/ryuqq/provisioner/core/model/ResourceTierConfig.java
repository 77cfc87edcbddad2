package com.ryuqq.provisioner.core.model;

/**
 * 리소스 등급별 한도 (불변 record).
 *
 * <p>워크플로우 제출 시점에 값이 그대로 워크플로우 파라미터로 복사되므로,
 * 이후 등급 테이블이 바뀌어도 이미 제출된 요청에는 영향이 없습니다.</p>
 *
 * @param cpuLimit CPU 한도 (예: "2")
 * @param memoryLimit 메모리 한도 (예: "4Gi")
 * @param storageQuota 스토리지 쿼터 (예: "20Gi")
 * @param maxPods 최대 Pod 수 (1 이상)
 * @param maxServices 최대 Service 수 (1 이상)
 * @param estimatedMonthlyCost 예상 월 비용 표기 (예: "$100")
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record ResourceTierConfig(
    String cpuLimit,
    String memoryLimit,
    String storageQuota,
    int maxPods,
    int maxServices,
    String estimatedMonthlyCost
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public ResourceTierConfig {
        if (cpuLimit == null || cpuLimit.isBlank()) {
            throw new IllegalArgumentException("cpuLimit cannot be null or blank");
        }
        if (memoryLimit == null || memoryLimit.isBlank()) {
            throw new IllegalArgumentException("memoryLimit cannot be null or blank");
        }
        if (storageQuota == null || storageQuota.isBlank()) {
            throw new IllegalArgumentException("storageQuota cannot be null or blank");
        }
        if (maxPods < 1) {
            throw new IllegalArgumentException("maxPods must be positive (current: " + maxPods + ")");
        }
        if (maxServices < 1) {
            throw new IllegalArgumentException("maxServices must be positive (current: " + maxServices + ")");
        }
        if (estimatedMonthlyCost == null) {
            estimatedMonthlyCost = "";
        }
    }
}
