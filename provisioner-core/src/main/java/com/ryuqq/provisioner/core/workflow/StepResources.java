package com.ryuqq.provisioner.core.workflow;

/**
 * 워크플로우 단계 하나가 사용하는 컨테이너 리소스.
 *
 * @param cpuRequest CPU 요청 (예: "100m")
 * @param memoryRequest 메모리 요청 (예: "128Mi")
 * @param cpuLimit CPU 한도
 * @param memoryLimit 메모리 한도
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record StepResources(String cpuRequest, String memoryRequest, String cpuLimit, String memoryLimit) {

    public StepResources {
        if (cpuRequest == null || memoryRequest == null || cpuLimit == null || memoryLimit == null) {
            throw new IllegalArgumentException("StepResources values cannot be null");
        }
    }

    /**
     * 가벼운 단계용 (검증, 완료 처리).
     */
    public static StepResources light() {
        return new StepResources("50m", "64Mi", "100m", "128Mi");
    }

    /**
     * 일반 단계용 (리소스 적용).
     */
    public static StepResources standard() {
        return new StepResources("100m", "128Mi", "250m", "256Mi");
    }
}
