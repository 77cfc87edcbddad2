package com.ryuqq.provisioner.application.provisioning;

import com.ryuqq.provisioner.core.model.ResourceTierTable;

import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 프로비저닝 서비스 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>namePattern: 네임스페이스 이름 허용 패턴 (기본 DNS-1123 label)</li>
 *   <li>maxNameLength: 네임스페이스 이름 최대 길이 (기본 63)</li>
 *   <li>teamQuota: 팀별 활성 네임스페이스 상한 (기본 10)</li>
 *   <li>allowedFeatures: 요청 가능한 기능 목록</li>
 *   <li>tierTable: 리소스 등급 테이블</li>
 *   <li>workflowServiceAccount: 워크플로우 실행 서비스 계정 (기본 platform-provisioner)</li>
 *   <li>templateLibrary: 워크플로우 단계가 참조하는 템플릿 묶음 이름</li>
 * </ul>
 *
 * @param namePattern 이름 정규식
 * @param maxNameLength 이름 최대 길이 (1 이상)
 * @param teamQuota 팀 쿼터 (1 이상)
 * @param allowedFeatures 허용 기능 (null 이면 빈 집합)
 * @param tierTable 등급 테이블
 * @param workflowServiceAccount 서비스 계정
 * @param templateLibrary 템플릿 묶음 이름
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record ProvisioningConfig(
    String namePattern,
    int maxNameLength,
    int teamQuota,
    Set<String> allowedFeatures,
    ResourceTierTable tierTable,
    String workflowServiceAccount,
    String templateLibrary
) {

    public static final String DEFAULT_NAME_PATTERN = "^[a-z0-9]([a-z0-9-]*[a-z0-9])?$";

    public static final Set<String> DEFAULT_ALLOWED_FEATURES = Set.of(
        "istio-injection",
        "monitoring-enhanced",
        "backup-enabled",
        "gpu-access",
        "database-access",
        "external-ingress"
    );

    /**
     * 기본 설정 생성자.
     */
    public ProvisioningConfig() {
        this(
            DEFAULT_NAME_PATTERN,
            63,
            10,
            DEFAULT_ALLOWED_FEATURES,
            ResourceTierTable.defaults(),
            "platform-provisioner",
            "create-namespace-template"
        );
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ProvisioningConfig {
        if (namePattern == null || namePattern.isBlank()) {
            throw new IllegalArgumentException("namePattern cannot be null or blank");
        }
        try {
            Pattern.compile(namePattern);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("namePattern is not a valid regular expression: " + namePattern, e);
        }
        if (maxNameLength < 1) {
            throw new IllegalArgumentException("maxNameLength must be positive (current: " + maxNameLength + ")");
        }
        if (teamQuota < 1) {
            throw new IllegalArgumentException("teamQuota must be positive (current: " + teamQuota + ")");
        }
        allowedFeatures = allowedFeatures == null ? Set.of() : Set.copyOf(allowedFeatures);
        if (tierTable == null) {
            throw new IllegalArgumentException("tierTable cannot be null");
        }
        if (workflowServiceAccount == null || workflowServiceAccount.isBlank()) {
            throw new IllegalArgumentException("workflowServiceAccount cannot be null or blank");
        }
        if (templateLibrary == null || templateLibrary.isBlank()) {
            throw new IllegalArgumentException("templateLibrary cannot be null or blank");
        }
    }

    public ProvisioningConfig withTeamQuota(int teamQuota) {
        return new ProvisioningConfig(namePattern, maxNameLength, teamQuota, allowedFeatures,
            tierTable, workflowServiceAccount, templateLibrary);
    }

    public ProvisioningConfig withAllowedFeatures(Set<String> allowedFeatures) {
        return new ProvisioningConfig(namePattern, maxNameLength, teamQuota, allowedFeatures,
            tierTable, workflowServiceAccount, templateLibrary);
    }

    public ProvisioningConfig withTierTable(ResourceTierTable tierTable) {
        return new ProvisioningConfig(namePattern, maxNameLength, teamQuota, allowedFeatures,
            tierTable, workflowServiceAccount, templateLibrary);
    }

    public ProvisioningConfig withNamePattern(String namePattern, int maxNameLength) {
        return new ProvisioningConfig(namePattern, maxNameLength, teamQuota, allowedFeatures,
            tierTable, workflowServiceAccount, templateLibrary);
    }

    public ProvisioningConfig withWorkflowServiceAccount(String workflowServiceAccount) {
        return new ProvisioningConfig(namePattern, maxNameLength, teamQuota, allowedFeatures,
            tierTable, workflowServiceAccount, templateLibrary);
    }
}
