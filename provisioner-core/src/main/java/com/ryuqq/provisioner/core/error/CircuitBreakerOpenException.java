package com.ryuqq.provisioner.core.error;

import com.ryuqq.provisioner.core.model.RequestId;

import java.time.Duration;

/**
 * 서킷 브레이커가 열려 있어 호출이 거부됨.
 *
 * <p>의존성은 호출되지 않았습니다. 호출자는 {@link #getRemainingWait()} 이후에 재시도할 수 있습니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class CircuitBreakerOpenException extends ProvisioningException {

    private final String dependency;
    private final Duration remainingWait;

    public CircuitBreakerOpenException(String dependency, Duration remainingWait) {
        this(dependency, remainingWait, null, null);
    }

    public CircuitBreakerOpenException(String dependency, Duration remainingWait, String message, RequestId requestId) {
        super(message != null ? message : defaultMessage(dependency, remainingWait), null, requestId);
        this.dependency = dependency;
        this.remainingWait = remainingWait.isNegative() ? Duration.ZERO : remainingWait;
    }

    /**
     * 같은 거부 정보에 요청 ID 와 사용자 메시지를 붙인 예외.
     */
    public CircuitBreakerOpenException withRequestId(RequestId requestId, String message) {
        return new CircuitBreakerOpenException(dependency, remainingWait, message, requestId);
    }

    public String getDependency() {
        return dependency;
    }

    public Duration getRemainingWait() {
        return remainingWait;
    }

    private static String defaultMessage(String dependency, Duration remainingWait) {
        long seconds = (long) Math.ceil(Math.max(0, remainingWait.toMillis()) / 1000.0);
        return "Circuit breaker '" + dependency + "' is OPEN. Retry in " + seconds + "s";
    }
}
