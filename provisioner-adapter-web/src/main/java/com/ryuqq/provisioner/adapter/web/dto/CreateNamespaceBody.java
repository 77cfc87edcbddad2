package com.ryuqq.provisioner.adapter.web.dto;

import com.ryuqq.provisioner.core.model.Environment;
import com.ryuqq.provisioner.core.model.NamespaceRequest;
import com.ryuqq.provisioner.core.model.NetworkPolicy;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.Set;

/**
 * {@code POST /namespaces} 요청 본문.
 *
 * <p>필수 항목만 여기서 검사하며, 이름/팀/기능/프로덕션 규칙은 서비스 검증기가 판정합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record CreateNamespaceBody(
    @NotNull String namespaceName,
    @NotNull String team,
    @NotBlank String environment,
    String resourceTier,
    String networkPolicy,
    Set<@NotNull String> features,
    @NotBlank String requestedBy,
    String description,
    String costCenter,
    String ownerPrincipalId
) {

    /**
     * 도메인 요청으로 변환.
     *
     * @throws IllegalArgumentException 알 수 없는 environment / networkPolicy 값인 경우
     */
    public NamespaceRequest toRequest() {
        return new NamespaceRequest(
            namespaceName,
            team,
            Environment.fromValue(environment),
            resourceTier,
            networkPolicy == null || networkPolicy.isBlank() ? null : NetworkPolicy.fromValue(networkPolicy),
            features,
            requestedBy,
            description,
            costCenter,
            ownerPrincipalId
        );
    }
}
