package com.ryuqq.provisioner.core.model;

import java.util.Locale;

/**
 * 네임스페이스가 속하는 배포 환경.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public enum Environment {

    DEVELOPMENT("development"),
    STAGING("staging"),
    PRODUCTION("production");

    private final String value;

    Environment(String value) {
        this.value = value;
    }

    /**
     * 외부 표현 (라벨, JSON) 값.
     *
     * @return 소문자 환경 이름
     */
    public String value() {
        return value;
    }

    /**
     * 외부 표현 값으로부터 Environment 조회.
     *
     * @param value 환경 이름 (대소문자 무시)
     * @return Environment
     * @throws IllegalArgumentException 알 수 없는 값인 경우
     */
    public static Environment fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (Environment environment : values()) {
                if (environment.value.equals(normalized)) {
                    return environment;
                }
            }
        }
        throw new IllegalArgumentException("Unknown environment: " + value);
    }
}
