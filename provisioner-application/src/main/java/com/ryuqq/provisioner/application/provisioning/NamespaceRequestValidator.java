package com.ryuqq.provisioner.application.provisioning;

import com.ryuqq.provisioner.core.model.Environment;
import com.ryuqq.provisioner.core.model.NamespaceRequest;
import com.ryuqq.provisioner.core.model.NetworkPolicy;
import com.ryuqq.provisioner.core.model.ResourceTier;
import com.ryuqq.provisioner.core.model.ResourceTierTable;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 외부 호출 없이 수행하는 요청 형식 검증.
 *
 * <p>모든 위반을 모아서 반환합니다. 이름 중복과 팀 쿼터는 저장소 상태가 필요하므로
 * {@link DefaultProvisioningService} 가 별도로 검사합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class NamespaceRequestValidator {

    static final Pattern TEAM_PATTERN = Pattern.compile("^[a-z0-9-]+$");
    static final int TEAM_MIN_LENGTH = 2;
    static final int TEAM_MAX_LENGTH = 32;
    static final int DESCRIPTION_MAX_LENGTH = 500;
    static final int COST_CENTER_MAX_LENGTH = 50;

    private final ProvisioningConfig config;
    private final Pattern namePattern;

    public NamespaceRequestValidator(ProvisioningConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.namePattern = Pattern.compile(config.namePattern());
    }

    /**
     * 요청 검증.
     *
     * @param request 검증할 요청
     * @return 위반 목록 (통과 시 빈 목록)
     */
    public List<String> validate(NamespaceRequest request) {
        List<String> violations = new ArrayList<>();

        String name = request.namespaceName();
        if (!namePattern.matcher(name).matches()) {
            violations.add("Invalid namespace name '" + name
                + "'. Must be lowercase alphanumeric with hyphens, starting and ending with an alphanumeric character");
        }
        if (name.length() > config.maxNameLength()) {
            violations.add("Namespace name cannot exceed " + config.maxNameLength() + " characters");
        }

        String team = request.team();
        if (!TEAM_PATTERN.matcher(team).matches()
            || team.length() < TEAM_MIN_LENGTH
            || team.length() > TEAM_MAX_LENGTH) {
            violations.add("Invalid team '" + team + "'. Must be " + TEAM_MIN_LENGTH + "-" + TEAM_MAX_LENGTH
                + " lowercase alphanumeric characters or hyphens");
        }

        List<String> invalidFeatures = request.features().stream()
            .filter(feature -> !config.allowedFeatures().contains(feature))
            .sorted()
            .collect(Collectors.toList());
        if (!invalidFeatures.isEmpty()) {
            violations.add("Invalid features: " + String.join(", ", invalidFeatures));
        }

        if (request.environment() == Environment.PRODUCTION) {
            if (!resolveTier(request).isAtLeast(ResourceTier.SMALL)) {
                violations.add("Production environments require at least \"small\" resource tier");
            }
            if (request.networkPolicy() == NetworkPolicy.OPEN) {
                violations.add("Production environments cannot use \"open\" network policy");
            }
        }

        if (request.description() != null && request.description().length() > DESCRIPTION_MAX_LENGTH) {
            violations.add("Description cannot exceed " + DESCRIPTION_MAX_LENGTH + " characters");
        }
        if (request.costCenter().length() > COST_CENTER_MAX_LENGTH) {
            violations.add("Cost center cannot exceed " + COST_CENTER_MAX_LENGTH + " characters");
        }
        return violations;
    }

    /**
     * 요청의 등급 이름을 등급으로 해석. 알 수 없는 이름은 small.
     */
    public static ResourceTier resolveTier(NamespaceRequest request) {
        return ResourceTier.fromValue(request.resourceTier()).orElse(ResourceTierTable.FALLBACK_TIER);
    }
}
