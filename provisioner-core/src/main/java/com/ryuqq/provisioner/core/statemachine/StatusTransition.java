package com.ryuqq.provisioner.core.statemachine;

/**
 * 프로비저닝 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>PENDING → PROVISIONING</li>
 *   <li>PENDING → FAILED</li>
 *   <li>PENDING → CANCELLED</li>
 *   <li>PROVISIONING → COMPLETED</li>
 *   <li>PROVISIONING → FAILED</li>
 *   <li>PROVISIONING → CANCELLED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태에서는 어떤 상태로도 전이 불가</li>
 *   <li>역방향 전이 불가 (예: PROVISIONING → PENDING)</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class StatusTransition {

    // Utility class - prevent instantiation
    private StatusTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(ProvisioningStatus from, ProvisioningStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Statuses cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal status: %s → %s", from, to)
            );
        }

        if (!canTransition(from, to)) {
            throw new IllegalStateException(
                String.format("Invalid status transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 전이 가능 여부 (예외 없이).
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @return 허용된 전이이면 true
     */
    public static boolean canTransition(ProvisioningStatus from, ProvisioningStatus to) {
        if (from == null || to == null) {
            return false;
        }
        return switch (from) {
            case PENDING -> to == ProvisioningStatus.PROVISIONING
                || to == ProvisioningStatus.FAILED
                || to == ProvisioningStatus.CANCELLED;
            case PROVISIONING -> to == ProvisioningStatus.COMPLETED
                || to == ProvisioningStatus.FAILED
                || to == ProvisioningStatus.CANCELLED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static ProvisioningStatus transition(ProvisioningStatus current, ProvisioningStatus next) {
        validate(current, next);
        return next;
    }
}
