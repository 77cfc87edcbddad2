package com.ryuqq.provisioner.core.error;

import com.ryuqq.provisioner.core.model.RequestId;

import java.util.List;

/**
 * 입력 검증 실패. 재시도해도 성공하지 않습니다.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class ValidationException extends ProvisioningException {

    private final List<String> violations;

    public ValidationException(List<String> violations) {
        this(violations, null);
    }

    public ValidationException(List<String> violations, RequestId requestId) {
        super(buildMessage(violations), null, requestId);
        this.violations = List.copyOf(violations);
    }

    public ValidationException(String violation) {
        this(List.of(violation));
    }

    /**
     * 같은 위반 목록에 요청 ID 를 붙인 예외.
     */
    public ValidationException withRequestId(RequestId requestId) {
        return new ValidationException(violations, requestId);
    }

    public List<String> getViolations() {
        return violations;
    }

    private static String buildMessage(List<String> violations) {
        if (violations == null || violations.isEmpty()) {
            throw new IllegalArgumentException("violations cannot be null or empty");
        }
        return "Validation failed: " + String.join("; ", violations);
    }
}
