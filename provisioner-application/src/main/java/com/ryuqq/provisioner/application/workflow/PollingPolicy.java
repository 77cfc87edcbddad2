package com.ryuqq.provisioner.application.workflow;

import java.time.Duration;

/**
 * 워크플로우 완료 대기 정책 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>pollInterval: 첫 폴링 간격 (기본 5초)</li>
 *   <li>timeout: 전체 대기 상한 (기본 10분)</li>
 *   <li>maxInterval: 폴링 간격 상한 (기본 5초, 즉 고정 간격)</li>
 *   <li>backoffMultiplier: 폴링마다 간격에 곱하는 값 (기본 1.0)</li>
 * </ul>
 *
 * <p><strong>간격 계산:</strong></p>
 * <pre>
 * delay(attempt) = min(pollInterval * backoffMultiplier^(attempt-1), maxInterval)
 * </pre>
 *
 * @param pollInterval 첫 폴링 간격 (양수)
 * @param timeout 전체 대기 상한 (양수)
 * @param maxInterval 간격 상한 (pollInterval 이상)
 * @param backoffMultiplier 간격 증가 배수 (1.0 이상)
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record PollingPolicy(
    Duration pollInterval,
    Duration timeout,
    Duration maxInterval,
    double backoffMultiplier
) {

    /**
     * 기본 설정 생성자 (5초 고정 간격, 10분 상한).
     */
    public PollingPolicy() {
        this(Duration.ofSeconds(5), Duration.ofMinutes(10), Duration.ofSeconds(5), 1.0);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public PollingPolicy {
        if (pollInterval == null || pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be positive (current: " + pollInterval + ")");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
        if (maxInterval == null || maxInterval.compareTo(pollInterval) < 0) {
            throw new IllegalArgumentException(
                "maxInterval must be >= pollInterval (poll: " + pollInterval + ", max: " + maxInterval + ")"
            );
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException(
                "backoffMultiplier must be >= 1.0 (current: " + backoffMultiplier + ")"
            );
        }
    }

    /**
     * 고정 간격 정책.
     */
    public static PollingPolicy fixed(Duration pollInterval, Duration timeout) {
        return new PollingPolicy(pollInterval, timeout, pollInterval, 1.0);
    }

    /**
     * attempt 번째 폴링 이후의 대기 시간.
     *
     * @param attempt 폴링 횟수 (1부터 시작)
     * @return 다음 폴링까지 대기 시간
     */
    public Duration delayFor(int attempt) {
        if (attempt <= 0) {
            throw new IllegalArgumentException("attempt must be positive (current: " + attempt + ")");
        }
        double factor = Math.pow(backoffMultiplier, attempt - 1);
        double millis = Math.min(pollInterval.toMillis() * factor, (double) maxInterval.toMillis());
        return Duration.ofMillis((long) millis);
    }

    public PollingPolicy withPollInterval(Duration pollInterval) {
        Duration max = maxInterval.compareTo(pollInterval) < 0 ? pollInterval : maxInterval;
        return new PollingPolicy(pollInterval, timeout, max, backoffMultiplier);
    }

    public PollingPolicy withTimeout(Duration timeout) {
        return new PollingPolicy(pollInterval, timeout, maxInterval, backoffMultiplier);
    }

    public PollingPolicy withBackoff(Duration maxInterval, double backoffMultiplier) {
        return new PollingPolicy(pollInterval, timeout, maxInterval, backoffMultiplier);
    }
}
