package com.ryuqq.provisioner.core.model;

/**
 * 워크플로우 엔진에 제출된 워크플로우 인스턴스 식별자.
 *
 * <p>제출이 성공한 경우에만 엔진 응답으로부터 생성됩니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class WorkflowRef {

    private final String value;

    private WorkflowRef(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("WorkflowRef cannot be null or blank");
        }
        this.value = value;
    }

    /**
     * WorkflowRef 생성.
     *
     * @param value 엔진이 부여한 워크플로우 이름
     * @return WorkflowRef 인스턴스
     * @throws IllegalArgumentException value가 null이거나 빈 문자열인 경우
     */
    public static WorkflowRef of(String value) {
        return new WorkflowRef(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowRef that = (WorkflowRef) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
