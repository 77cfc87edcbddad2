package com.ryuqq.provisioner.adapter.http.workflow;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.ryuqq.provisioner.adapter.http.HttpEndpointConfig;
import com.ryuqq.provisioner.adapter.http.auth.StaticAccessTokenProvider;
import com.ryuqq.provisioner.core.model.WorkflowPhase;
import com.ryuqq.provisioner.core.model.WorkflowRef;
import com.ryuqq.provisioner.core.model.WorkflowStatus;
import com.ryuqq.provisioner.core.result.CallResult;
import com.ryuqq.provisioner.core.result.NotFound;
import com.ryuqq.provisioner.core.result.ServiceError;
import com.ryuqq.provisioner.core.result.Success;
import com.ryuqq.provisioner.core.result.Unauthenticated;
import com.ryuqq.provisioner.core.workflow.StepResources;
import com.ryuqq.provisioner.core.workflow.WorkflowDefinition;
import com.ryuqq.provisioner.core.workflow.WorkflowStep;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.delete;
import static com.github.tomakehurst.wiremock.client.WireMock.deleteRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.equalToJson;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.matchingJsonPath;
import static com.github.tomakehurst.wiremock.client.WireMock.okJson;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * HttpWorkflowEngine 테스트 (WireMock).
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
class HttpWorkflowEngineTest {

    private static final String BASE = "/api/v1/workflows/platform";

    private WireMockServer server;
    private HttpWorkflowEngine engine;

    @BeforeEach
    void setUp() {
        server = new WireMockServer(options().dynamicPort());
        server.start();
        engine = new HttpWorkflowEngine(
            HttpEndpointConfig.of(server.baseUrl()).withRequestTimeout(Duration.ofSeconds(2)),
            "platform",
            new StaticAccessTokenProvider("engine-token")
        );
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    @Test
    void 제출은_DAG_본문을_POST하고_이름을_참조로_반환() {
        // given
        server.stubFor(post(urlEqualTo(BASE))
            .willReturn(okJson("{\"metadata\":{\"name\":\"provision-namespace-ns-1\",\"namespace\":\"platform\"}}")));

        // when
        CallResult<WorkflowRef> result = engine.submit(definition());

        // then
        assertThat(result).isEqualTo(CallResult.success(WorkflowRef.of("provision-namespace-ns-1")));
        server.verify(postRequestedFor(urlEqualTo(BASE))
            .withHeader("Authorization", equalTo("Bearer engine-token"))
            .withHeader("Content-Type", equalTo("application/json"))
            .withRequestBody(matchingJsonPath("$.metadata.name", equalTo("provision-namespace-ns-1")))
            .withRequestBody(matchingJsonPath("$.metadata.labels['platform.io/team']", equalTo("payments")))
            .withRequestBody(matchingJsonPath("$.spec.entrypoint", equalTo("provision-namespace")))
            .withRequestBody(matchingJsonPath("$.spec.serviceAccountName", equalTo("platform-provisioner")))
            .withRequestBody(matchingJsonPath("$.spec.arguments.parameters[0].name", equalTo("namespace-name")))
            .withRequestBody(matchingJsonPath("$.spec.templates[0].dag.tasks[1].dependencies[0]", equalTo("validate")))
            .withRequestBody(matchingJsonPath("$.spec.templates[0].dag.tasks[1].templateRef.name",
                equalTo("create-namespace-template")))
            .withRequestBody(matchingJsonPath("$.spec.templates[0].dag.tasks[0].resources.limits.cpu", equalTo("100m"))));
    }

    @Test
    void 상태_조회는_phase와_노드를_읽음() {
        // given
        server.stubFor(get(urlEqualTo(BASE + "/wf-1")).willReturn(okJson("""
            {
              "metadata": {"name": "wf-1"},
              "status": {
                "phase": "Running",
                "startedAt": "2024-01-01T00:00:00Z",
                "nodes": {
                  "wf-1-123": {"displayName": "validate", "phase": "Succeeded"},
                  "wf-1-456": {"displayName": "create-namespace", "phase": "Running"}
                }
              }
            }
            """)));

        // when
        CallResult<WorkflowStatus> result = engine.fetchStatus(WorkflowRef.of("wf-1"));

        // then
        assertThat(result).isInstanceOf(Success.class);
        WorkflowStatus status = ((Success<WorkflowStatus>) result).value();
        assertThat(status.phase()).isEqualTo(WorkflowPhase.RUNNING);
        assertThat(status.startedAt()).isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
        assertThat(status.finishedAt()).isNull();
        assertThat(status.nodes()).containsEntry("validate", "Succeeded").containsEntry("create-namespace", "Running");
    }

    @Test
    void 평평한_상태_본문도_읽음() {
        // given
        server.stubFor(get(urlEqualTo(BASE + "/wf-1")).willReturn(okJson("""
            {"phase": "Failed", "message": "child failed", "finishedAt": "2024-01-01T00:05:00Z",
             "nodes": {"apply-rbac": "Failed"}}
            """)));

        // when
        WorkflowStatus status = ((Success<WorkflowStatus>) engine.fetchStatus(WorkflowRef.of("wf-1"))).value();

        // then
        assertThat(status.phase()).isEqualTo(WorkflowPhase.FAILED);
        assertThat(status.message()).isEqualTo("child failed");
        assertThat(status.nodes()).containsExactly(Map.entry("apply-rbac", "Failed"));
    }

    @Test
    void 상태_코드_매핑() {
        // given
        server.stubFor(get(urlEqualTo(BASE + "/missing")).willReturn(aResponse().withStatus(404)));
        server.stubFor(get(urlEqualTo(BASE + "/forbidden")).willReturn(aResponse().withStatus(403)));
        server.stubFor(get(urlEqualTo(BASE + "/broken")).willReturn(aResponse().withStatus(500).withBody("boom")));
        server.stubFor(get(urlEqualTo(BASE + "/garbage")).willReturn(okJson("not json")));

        // then
        assertThat(engine.fetchStatus(WorkflowRef.of("missing"))).isInstanceOf(NotFound.class);
        assertThat(engine.fetchStatus(WorkflowRef.of("forbidden"))).isInstanceOf(Unauthenticated.class);
        assertThat(engine.fetchStatus(WorkflowRef.of("broken")))
            .isInstanceOf(ServiceError.class)
            .satisfies(r -> assertThat(r.describe()).contains("HTTP 500").contains("boom"));
        assertThat(engine.fetchStatus(WorkflowRef.of("garbage"))).isInstanceOf(ServiceError.class);
    }

    @Test
    void 종료는_DELETE() {
        // given
        server.stubFor(delete(urlEqualTo(BASE + "/wf-1")).willReturn(okJson("{}")));

        // when
        CallResult<Boolean> result = engine.delete(WorkflowRef.of("wf-1"));

        // then
        assertThat(result).isEqualTo(CallResult.success(Boolean.TRUE));
        server.verify(deleteRequestedFor(urlEqualTo(BASE + "/wf-1")));
    }

    @Test
    void 연결_실패는_ServiceError() {
        // given
        server.stop();

        // when / then
        assertThat(engine.fetchStatus(WorkflowRef.of("wf-1"))).isInstanceOf(ServiceError.class);
    }

    @Test
    void 토큰_조회_실패는_Unauthenticated() {
        // given
        HttpWorkflowEngine noToken = new HttpWorkflowEngine(
            HttpEndpointConfig.of(server.baseUrl()),
            "platform",
            () -> {
                throw new IllegalStateException("token endpoint down");
            }
        );

        // when / then
        assertThat(noToken.fetchStatus(WorkflowRef.of("wf-1"))).isInstanceOf(Unauthenticated.class);
        assertThat(server.getAllServeEvents()).isEmpty();
    }

    @Test
    void 제출_응답에_이름이_없으면_ServiceError() {
        // given
        server.stubFor(post(urlEqualTo(BASE)).willReturn(okJson("{\"metadata\":{}}")));

        // when / then
        assertThat(engine.submit(definition())).isInstanceOf(ServiceError.class);
    }

    private static WorkflowDefinition definition() {
        return WorkflowDefinition.builder("provision-namespace-ns-1")
            .entrypoint("provision-namespace")
            .templateLibrary("create-namespace-template")
            .serviceAccount("platform-provisioner")
            .label("platform.io/team", "payments")
            .parameter("namespace-name", "payments-dev")
            .step(new WorkflowStep("validate", "validate-request", List.of(),
                Map.of("namespace-name", "{{workflow.parameters.namespace-name}}"), StepResources.light()))
            .step(new WorkflowStep("create-namespace", "create-namespace", List.of("validate"),
                Map.of("namespace-name", "{{workflow.parameters.namespace-name}}"), StepResources.standard()))
            .build();
    }
}
