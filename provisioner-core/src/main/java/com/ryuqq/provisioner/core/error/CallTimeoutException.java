package com.ryuqq.provisioner.core.error;

import com.ryuqq.provisioner.core.model.RequestId;

import java.time.Duration;

/**
 * 서킷 브레이커의 호출 타임아웃 초과.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class CallTimeoutException extends ExternalServiceException {

    private final Duration timeout;

    public CallTimeoutException(String dependency, Duration timeout) {
        this(dependency, timeout, null);
    }

    private CallTimeoutException(String dependency, Duration timeout, RequestId requestId) {
        super(dependency, "Call to " + dependency + " timed out after " + timeout.toMillis() + "ms", null, requestId);
        this.timeout = timeout;
    }

    @Override
    public CallTimeoutException withRequestId(RequestId requestId) {
        return new CallTimeoutException(getDependency(), timeout, requestId);
    }

    public Duration getTimeout() {
        return timeout;
    }
}
