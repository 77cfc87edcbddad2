package com.ryuqq.provisioner.core.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 리소스 등급 → 한도 조회 테이블.
 *
 * <p>조회는 전역적이고 결정적입니다. 테이블에 없는 등급이나 알 수 없는 등급 이름은
 * {@link ResourceTier#SMALL} 값으로 폴백하며, 폴백은 WARN 로그로 남깁니다.</p>
 *
 * <p><strong>기본 테이블:</strong></p>
 * <pre>
 * tier    cpu  memory  storage  pods  services  cost
 * micro   1    2Gi     10Gi     5     3         $50
 * small   2    4Gi     20Gi     10    5         $100
 * medium  4    8Gi     50Gi     20    10        $200
 * large   8    16Gi    100Gi    50    20        $400
 * </pre>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class ResourceTierTable {

    private static final Logger log = LoggerFactory.getLogger(ResourceTierTable.class);

    /** 폴백 등급. */
    public static final ResourceTier FALLBACK_TIER = ResourceTier.SMALL;

    private static final ResourceTierConfig DEFAULT_SMALL =
        new ResourceTierConfig("2", "4Gi", "20Gi", 10, 5, "$100");

    private final Map<ResourceTier, ResourceTierConfig> tiers;

    private ResourceTierTable(Map<ResourceTier, ResourceTierConfig> tiers) {
        EnumMap<ResourceTier, ResourceTierConfig> copy = new EnumMap<>(ResourceTier.class);
        copy.putAll(tiers);
        this.tiers = Collections.unmodifiableMap(copy);
    }

    /**
     * 기본 등급 테이블.
     *
     * @return 네 등급이 모두 채워진 테이블
     */
    public static ResourceTierTable defaults() {
        Map<ResourceTier, ResourceTierConfig> tiers = new EnumMap<>(ResourceTier.class);
        tiers.put(ResourceTier.MICRO, new ResourceTierConfig("1", "2Gi", "10Gi", 5, 3, "$50"));
        tiers.put(ResourceTier.SMALL, DEFAULT_SMALL);
        tiers.put(ResourceTier.MEDIUM, new ResourceTierConfig("4", "8Gi", "50Gi", 20, 10, "$200"));
        tiers.put(ResourceTier.LARGE, new ResourceTierConfig("8", "16Gi", "100Gi", 50, 20, "$400"));
        return new ResourceTierTable(tiers);
    }

    /**
     * 임의 매핑으로 테이블 생성.
     *
     * @param tiers 등급별 설정 (일부 등급 누락 허용)
     * @return ResourceTierTable
     * @throws IllegalArgumentException tiers가 null인 경우
     */
    public static ResourceTierTable of(Map<ResourceTier, ResourceTierConfig> tiers) {
        if (tiers == null) {
            throw new IllegalArgumentException("tiers cannot be null");
        }
        return new ResourceTierTable(tiers);
    }

    /**
     * 특정 등급만 교체한 새 테이블 생성.
     */
    public ResourceTierTable withTier(ResourceTier tier, ResourceTierConfig config) {
        if (tier == null || config == null) {
            throw new IllegalArgumentException("tier and config cannot be null");
        }
        EnumMap<ResourceTier, ResourceTierConfig> copy = new EnumMap<>(ResourceTier.class);
        copy.putAll(tiers);
        copy.put(tier, config);
        return new ResourceTierTable(copy);
    }

    /**
     * 등급 한도 조회.
     *
     * @param tier 등급 (null 이면 폴백)
     * @return 등급 설정, 테이블에 없으면 small 값
     */
    public ResourceTierConfig lookup(ResourceTier tier) {
        ResourceTierConfig config = tier == null ? null : tiers.get(tier);
        if (config != null) {
            return config;
        }
        log.warn("Resource tier {} is not configured, falling back to {}", tier, FALLBACK_TIER.value());
        return fallback();
    }

    /**
     * 등급 이름으로 한도 조회.
     *
     * @param tierName 등급 이름 (대소문자 무시)
     * @return 등급 설정, 알 수 없는 이름이면 small 값
     */
    public ResourceTierConfig lookup(String tierName) {
        return ResourceTier.fromValue(tierName)
            .map(this::lookup)
            .orElseGet(() -> {
                log.warn("Unknown resource tier '{}', falling back to {}", tierName, FALLBACK_TIER.value());
                return fallback();
            });
    }

    /**
     * 현재 설정된 등급 매핑 (읽기 전용).
     */
    public Map<ResourceTier, ResourceTierConfig> asMap() {
        return tiers;
    }

    private ResourceTierConfig fallback() {
        ResourceTierConfig small = tiers.get(FALLBACK_TIER);
        return small != null ? small : DEFAULT_SMALL;
    }
}
