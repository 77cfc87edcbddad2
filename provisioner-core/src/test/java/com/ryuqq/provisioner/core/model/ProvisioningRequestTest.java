package com.ryuqq.provisioner.core.model;

import com.ryuqq.provisioner.core.statemachine.ProvisioningStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProvisioningRequestTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private final NamespaceRequest input = NamespaceRequest
        .of("demo-team-dev", "demo", Environment.DEVELOPMENT, "small", "alice@example.com")
        .withFeatures(Set.of("monitoring-enhanced"));

    @Test
    void pending은_입력을_복사하고_costCenter는_팀으로_기본값() {
        ProvisioningRequest request = ProvisioningRequest.pending(RequestId.of("ns-1"), input, ResourceTier.SMALL, T0);

        assertThat(request.getStatus()).isEqualTo(ProvisioningStatus.PENDING);
        assertThat(request.getCostCenter()).isEqualTo("demo");
        assertThat(request.getFeatures()).containsExactly("monitoring-enhanced");
        assertThat(request.getWorkflowRef()).isEmpty();
        assertThat(request.getCreatedAt()).isEqualTo(T0);
    }

    @Test
    void 완료되면_completedAt이_있고_errorMessage는_없음() {
        ProvisioningRequest completed = ProvisioningRequest
            .pending(RequestId.of("ns-1"), input, ResourceTier.SMALL, T0)
            .markProvisioning(WorkflowRef.of("provision-namespace-ns-1"), "running", T0.plusSeconds(1))
            .markCompleted("ready", T0.plusSeconds(30));

        assertThat(completed.getStatus()).isEqualTo(ProvisioningStatus.COMPLETED);
        assertThat(completed.getCompletedAt()).contains(T0.plusSeconds(30));
        assertThat(completed.getErrorMessage()).isEmpty();
        assertThat(completed.getCreatedAt()).isEqualTo(T0);
    }

    @Test
    void 종료_상태는_다시_바뀌지_않음() {
        ProvisioningRequest failed = ProvisioningRequest
            .pending(RequestId.of("ns-1"), input, ResourceTier.SMALL, T0)
            .markFailed("quota exceeded", T0);

        assertThatThrownBy(() -> failed.markCancelled(T0)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> failed.withStatusMessage("x", T0)).isInstanceOf(IllegalStateException.class);
        assertThat(failed.getErrorMessage()).contains("quota exceeded");
    }

    @Test
    void workflowRef는_한_번만_설정() {
        ProvisioningRequest provisioning = ProvisioningRequest
            .pending(RequestId.of("ns-1"), input, ResourceTier.SMALL, T0)
            .markProvisioning(WorkflowRef.of("wf-1"), "running", T0);

        assertThatThrownBy(() -> provisioning.markProvisioning(WorkflowRef.of("wf-2"), "again", T0))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("workflowRef");
    }
}
