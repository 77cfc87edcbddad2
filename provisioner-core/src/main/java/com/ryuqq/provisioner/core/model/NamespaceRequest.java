package com.ryuqq.provisioner.core.model;

import java.util.Set;

/**
 * 테넌트가 제출한 네임스페이스 프로비저닝 요청 (검증 전 입력).
 *
 * <p>형식 검증 (이름 패턴, 쿼터, 기능 허용 목록 등)은 애플리케이션 계층의
 * 검증기가 수행합니다. 이 record 는 null 여부와 컬렉션 정규화만 담당합니다.</p>
 *
 * @param namespaceName 요청 네임스페이스 이름
 * @param team 소유 팀
 * @param environment 배포 환경
 * @param resourceTier 리소스 등급 이름 (알 수 없는 이름은 small 로 폴백)
 * @param networkPolicy 네트워크 정책
 * @param features 요청 기능 목록 (null 이면 빈 집합)
 * @param requestedBy 요청자 식별 (필수)
 * @param description 설명 (선택)
 * @param costCenter 비용 센터 (선택, 없으면 팀 이름)
 * @param ownerPrincipalId 소유자 디렉터리 객체 ID (선택)
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record NamespaceRequest(
    String namespaceName,
    String team,
    Environment environment,
    String resourceTier,
    NetworkPolicy networkPolicy,
    Set<String> features,
    String requestedBy,
    String description,
    String costCenter,
    String ownerPrincipalId
) {

    public NamespaceRequest {
        if (namespaceName == null) {
            throw new IllegalArgumentException("namespaceName cannot be null");
        }
        if (team == null) {
            throw new IllegalArgumentException("team cannot be null");
        }
        if (environment == null) {
            throw new IllegalArgumentException("environment cannot be null");
        }
        if (requestedBy == null || requestedBy.isBlank()) {
            throw new IllegalArgumentException("requestedBy cannot be null or blank");
        }
        if (resourceTier == null || resourceTier.isBlank()) {
            resourceTier = ResourceTierTable.FALLBACK_TIER.value();
        }
        if (networkPolicy == null) {
            networkPolicy = NetworkPolicy.ISOLATED;
        }
        features = features == null ? Set.of() : Set.copyOf(features);
        if (description != null && description.isBlank()) {
            description = null;
        }
        if (costCenter == null || costCenter.isBlank()) {
            costCenter = team;
        }
        if (ownerPrincipalId != null && ownerPrincipalId.isBlank()) {
            ownerPrincipalId = null;
        }
    }

    /**
     * 필수 필드만으로 요청 생성.
     */
    public static NamespaceRequest of(
        String namespaceName,
        String team,
        Environment environment,
        String resourceTier,
        String requestedBy
    ) {
        return new NamespaceRequest(
            namespaceName, team, environment, resourceTier, NetworkPolicy.ISOLATED,
            Set.of(), requestedBy, null, null, null
        );
    }

    public NamespaceRequest withFeatures(Set<String> features) {
        return new NamespaceRequest(
            namespaceName, team, environment, resourceTier, networkPolicy,
            features, requestedBy, description, costCenter, ownerPrincipalId
        );
    }

    public NamespaceRequest withNetworkPolicy(NetworkPolicy networkPolicy) {
        return new NamespaceRequest(
            namespaceName, team, environment, resourceTier, networkPolicy,
            features, requestedBy, description, costCenter, ownerPrincipalId
        );
    }

    public NamespaceRequest withOwnerPrincipalId(String ownerPrincipalId) {
        return new NamespaceRequest(
            namespaceName, team, environment, resourceTier, networkPolicy,
            features, requestedBy, description, costCenter, ownerPrincipalId
        );
    }

    public NamespaceRequest withDescription(String description) {
        return new NamespaceRequest(
            namespaceName, team, environment, resourceTier, networkPolicy,
            features, requestedBy, description, costCenter, ownerPrincipalId
        );
    }
}
