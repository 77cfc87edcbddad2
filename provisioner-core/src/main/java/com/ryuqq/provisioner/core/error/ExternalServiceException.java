package com.ryuqq.provisioner.core.error;

import com.ryuqq.provisioner.core.model.RequestId;

/**
 * 외부 의존성 호출 실패.
 *
 * <p>서킷 브레이커의 실패 집계 대상입니다. 어떤 의존성이 실패했는지 {@link #getDependency()} 로 전달합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class ExternalServiceException extends ProvisioningException {

    private final String dependency;

    public ExternalServiceException(String dependency, String message) {
        this(dependency, message, null, null);
    }

    public ExternalServiceException(String dependency, String message, Throwable cause) {
        this(dependency, message, cause, null);
    }

    public ExternalServiceException(String dependency, String message, Throwable cause, RequestId requestId) {
        super(message, cause, requestId);
        if (dependency == null || dependency.isBlank()) {
            throw new IllegalArgumentException("dependency cannot be null or blank");
        }
        this.dependency = dependency;
    }

    /**
     * 같은 오류에 요청 ID 를 붙인 예외.
     */
    public ExternalServiceException withRequestId(RequestId requestId) {
        return new ExternalServiceException(dependency, getMessage(), getCause(), requestId);
    }

    public String getDependency() {
        return dependency;
    }
}
