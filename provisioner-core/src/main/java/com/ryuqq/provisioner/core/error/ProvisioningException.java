package com.ryuqq.provisioner.core.error;

import com.ryuqq.provisioner.core.model.RequestId;

import java.util.Optional;

/**
 * 프로비저닝 오류 계층의 최상위 예외 (unchecked).
 *
 * <p>요청 접수 이후에 발생한 오류는 호출자가 상태를 조회할 수 있도록 {@link RequestId} 를 함께 전달합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class ProvisioningException extends RuntimeException {

    private final RequestId requestId;

    public ProvisioningException(String message) {
        this(message, null, null);
    }

    public ProvisioningException(String message, Throwable cause) {
        this(message, cause, null);
    }

    public ProvisioningException(String message, Throwable cause, RequestId requestId) {
        super(message, cause);
        this.requestId = requestId;
    }

    /**
     * 관련 요청 ID (요청 접수 전 오류이면 empty).
     */
    public Optional<RequestId> getRequestId() {
        return Optional.ofNullable(requestId);
    }
}
