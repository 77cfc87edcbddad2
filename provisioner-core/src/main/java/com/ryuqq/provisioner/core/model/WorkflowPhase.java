package com.ryuqq.provisioner.core.model;

/**
 * 워크플로우 엔진이 보고하는 실행 단계.
 *
 * <p>엔진 응답의 phase 문자열은 대소문자를 구분하지 않고 매핑하며,
 * 알 수 없는 값이나 누락된 값은 {@link #UNKNOWN} 으로 취급합니다 (비종료).</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public enum WorkflowPhase {

    PENDING("Pending"),
    RUNNING("Running"),
    SUCCEEDED("Succeeded"),
    FAILED("Failed"),
    ERROR("Error"),
    UNKNOWN("Unknown");

    private final String value;

    WorkflowPhase(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * 종료 단계인지 확인.
     *
     * @return SUCCEEDED, FAILED, ERROR 이면 true
     */
    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == ERROR;
    }

    /**
     * 실패로 끝난 단계인지 확인.
     */
    public boolean isFailure() {
        return this == FAILED || this == ERROR;
    }

    public static WorkflowPhase fromValue(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        String trimmed = value.trim();
        for (WorkflowPhase phase : values()) {
            if (phase.value.equalsIgnoreCase(trimmed)) {
                return phase;
            }
        }
        return UNKNOWN;
    }
}
