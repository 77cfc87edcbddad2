package com.ryuqq.provisioner.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * 네임스페이스 리소스 등급.
 *
 * <p>선언 순서가 곧 크기 순서입니다 (MICRO &lt; SMALL &lt; MEDIUM &lt; LARGE).</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public enum ResourceTier {

    MICRO("micro"),
    SMALL("small"),
    MEDIUM("medium"),
    LARGE("large");

    private final String value;

    ResourceTier(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * 이 등급이 other 이상인지 확인.
     *
     * @param other 비교 대상 등급
     * @return this &gt;= other 이면 true
     */
    public boolean isAtLeast(ResourceTier other) {
        return compareTo(other) >= 0;
    }

    /**
     * 외부 표현 값으로부터 ResourceTier 조회.
     *
     * <p>알 수 없는 값은 예외 대신 빈 Optional 을 반환합니다.
     * 폴백 정책은 {@link ResourceTierTable} 이 결정합니다.</p>
     *
     * @param value 등급 이름 (대소문자 무시)
     * @return ResourceTier 또는 empty
     */
    public static Optional<ResourceTier> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ResourceTier tier : values()) {
            if (tier.value.equals(normalized)) {
                return Optional.of(tier);
            }
        }
        return Optional.empty();
    }
}
