package com.ryuqq.provisioner.adapter.web.config;

import com.ryuqq.provisioner.adapter.http.HttpEndpointConfig;
import com.ryuqq.provisioner.adapter.runner.StatusPollerConfig;
import com.ryuqq.provisioner.application.provisioning.ProvisioningConfig;
import com.ryuqq.provisioner.application.workflow.PollingPolicy;
import com.ryuqq.provisioner.core.model.ResourceTier;
import com.ryuqq.provisioner.core.model.ResourceTierConfig;
import com.ryuqq.provisioner.core.model.ResourceTierTable;
import com.ryuqq.provisioner.core.protection.CircuitBreaker;
import com.ryuqq.provisioner.core.protection.CircuitBreakerConfig;
import com.ryuqq.provisioner.core.protection.CircuitBreakerRegistry;
import com.ryuqq.provisioner.core.protection.noop.NoOpCircuitBreaker;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * {@code provisioner.*} 설정 바인딩.
 *
 * <p>비어 있는 항목은 라이브러리 설정 record 의 기본값을 그대로 사용합니다.</p>
 *
 * <pre>
 * provisioner:
 *   workflow-engine:
 *     base-url: https://workflows.internal
 *     token: ${WORKFLOW_ENGINE_TOKEN}
 *     namespace: platform
 *   directory:
 *     base-url: https://directory.internal/v1.0
 *   breakers:
 *     enabled: true
 *     workflow-engine:
 *       failure-threshold: 3
 *   provisioning:
 *     team-quota: 10
 *     tiers:
 *       large: { cpu-limit: "16", memory-limit: 32Gi, ... }
 *   poller:
 *     scan-interval-ms: 30000
 * </pre>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
@Validated
@ConfigurationProperties(prefix = "provisioner")
public record ProvisionerProperties(
    @Valid @DefaultValue WorkflowEngine workflowEngine,
    @Valid @DefaultValue Directory directory,
    @Valid @DefaultValue Breakers breakers,
    @Valid @DefaultValue Provisioning provisioning,
    @Valid @DefaultValue Poller poller
) {

    public record WorkflowEngine(
        @NotBlank @DefaultValue("http://localhost:2746") String baseUrl,
        @NotBlank String token,
        @NotBlank @DefaultValue("platform") String namespace,
        @DefaultValue("10s") Duration requestTimeout
    ) {

        public HttpEndpointConfig toEndpoint() {
            return HttpEndpointConfig.of(baseUrl).withRequestTimeout(requestTimeout);
        }
    }

    public record Directory(
        @NotBlank @DefaultValue("http://localhost:8089/v1.0") String baseUrl,
        @NotBlank String token,
        @DefaultValue("5s") Duration requestTimeout
    ) {

        public HttpEndpointConfig toEndpoint() {
            return HttpEndpointConfig.of(baseUrl).withRequestTimeout(requestTimeout);
        }
    }

    /**
     * 의존성별 브레이커 설정. enabled=false 이면 두 의존성 모두 보호 없이 호출합니다.
     */
    public record Breakers(
        @DefaultValue("true") boolean enabled,
        @Valid @DefaultValue Breaker identityDirectory,
        @Valid @DefaultValue Breaker workflowEngine
    ) {

        public CircuitBreaker identityDirectoryBreaker(CircuitBreakerRegistry registry) {
            return breaker(registry, identityDirectoryConfig());
        }

        public CircuitBreaker workflowEngineBreaker(CircuitBreakerRegistry registry) {
            return breaker(registry, workflowEngineConfig());
        }

        private CircuitBreaker breaker(CircuitBreakerRegistry registry, CircuitBreakerConfig config) {
            return enabled ? registry.getOrCreate(config) : new NoOpCircuitBreaker(config.name());
        }

        public CircuitBreakerConfig identityDirectoryConfig() {
            return identityDirectory.applyTo(CircuitBreakerConfig.forIdentityDirectory());
        }

        public CircuitBreakerConfig workflowEngineConfig() {
            return workflowEngine.applyTo(CircuitBreakerConfig.forWorkflowEngine());
        }
    }

    /**
     * 브레이커 설정 덮어쓰기. null 항목은 기본값 유지.
     */
    public record Breaker(
        @Positive Integer failureThreshold,
        Duration resetTimeout,
        Duration callTimeout
    ) {

        // applied in one step so partial overrides are validated against the merged values
        CircuitBreakerConfig applyTo(CircuitBreakerConfig base) {
            return new CircuitBreakerConfig(
                base.name(),
                failureThreshold != null ? failureThreshold : base.failureThreshold(),
                resetTimeout != null ? resetTimeout : base.resetTimeout(),
                callTimeout != null ? callTimeout : base.callTimeout()
            );
        }
    }

    public record Provisioning(
        @Positive @DefaultValue("10") int teamQuota,
        List<String> allowedFeatures,
        String workflowServiceAccount,
        Map<String, Tier> tiers
    ) {

        public ProvisioningConfig toConfig() {
            ProvisioningConfig config = new ProvisioningConfig().withTeamQuota(teamQuota);
            if (allowedFeatures != null && !allowedFeatures.isEmpty()) {
                config = config.withAllowedFeatures(new LinkedHashSet<>(allowedFeatures));
            }
            if (workflowServiceAccount != null && !workflowServiceAccount.isBlank()) {
                config = config.withWorkflowServiceAccount(workflowServiceAccount);
            }
            if (tiers != null && !tiers.isEmpty()) {
                ResourceTierTable table = config.tierTable();
                for (Map.Entry<String, Tier> entry : tiers.entrySet()) {
                    ResourceTier tier = ResourceTier.fromValue(entry.getKey())
                        .orElseThrow(() -> new IllegalArgumentException("Unknown resource tier: " + entry.getKey()));
                    table = table.withTier(tier, entry.getValue().toConfig());
                }
                config = config.withTierTable(table);
            }
            return config;
        }
    }

    public record Tier(
        @NotBlank String cpuLimit,
        @NotBlank String memoryLimit,
        @NotBlank String storageQuota,
        @Positive int maxPods,
        @Positive int maxServices,
        String estimatedMonthlyCost
    ) {

        ResourceTierConfig toConfig() {
            return new ResourceTierConfig(cpuLimit, memoryLimit, storageQuota, maxPods, maxServices, estimatedMonthlyCost);
        }
    }

    public record Poller(
        @DefaultValue("true") boolean enabled,
        @Positive @DefaultValue("30000") long scanIntervalMs,
        @Positive @DefaultValue("100") int batchSize,
        @DefaultValue("5s") Duration pollInterval,
        @DefaultValue("10m") Duration waitTimeout,
        @Positive @DefaultValue("4") int watcherThreads
    ) {

        public StatusPollerConfig toConfig() {
            return new StatusPollerConfig(batchSize);
        }

        public PollingPolicy toPollingPolicy() {
            return PollingPolicy.fixed(pollInterval, waitTimeout);
        }
    }
}
