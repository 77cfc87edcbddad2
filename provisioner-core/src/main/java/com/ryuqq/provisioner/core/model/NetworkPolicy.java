package com.ryuqq.provisioner.core.model;

import java.util.Locale;

/**
 * 네임스페이스에 적용할 네트워크 격리 수준.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public enum NetworkPolicy {

    /** 동일 네임스페이스 내부 트래픽만 허용. */
    ISOLATED("isolated"),

    /** 같은 팀 네임스페이스 간 트래픽 허용. */
    TEAM_SHARED("team-shared"),

    /** 제한 없음 (production 에서는 사용 불가). */
    OPEN("open");

    private final String value;

    NetworkPolicy(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * 외부 표현 값으로부터 NetworkPolicy 조회.
     *
     * @param value 정책 이름 (대소문자 무시)
     * @return NetworkPolicy
     * @throws IllegalArgumentException 알 수 없는 값인 경우
     */
    public static NetworkPolicy fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (NetworkPolicy policy : values()) {
                if (policy.value.equals(normalized)) {
                    return policy;
                }
            }
        }
        throw new IllegalArgumentException("Unknown network policy: " + value);
    }
}
