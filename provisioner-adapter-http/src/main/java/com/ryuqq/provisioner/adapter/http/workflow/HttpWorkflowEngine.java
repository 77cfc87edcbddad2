package com.ryuqq.provisioner.adapter.http.workflow;

import com.ryuqq.provisioner.adapter.http.HttpEndpointConfig;
import com.ryuqq.provisioner.adapter.http.JsonHttpAdapter;
import com.ryuqq.provisioner.adapter.http.auth.AccessTokenProvider;
import com.ryuqq.provisioner.core.model.WorkflowRef;
import com.ryuqq.provisioner.core.model.WorkflowStatus;
import com.ryuqq.provisioner.core.result.CallResult;
import com.ryuqq.provisioner.core.spi.WorkflowEngine;
import com.ryuqq.provisioner.core.workflow.WorkflowDefinition;

import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;

/**
 * 워크플로우 엔진 REST API 어댑터.
 *
 * <p><strong>경로:</strong></p>
 * <ul>
 *   <li>제출: {@code POST /api/v1/workflows/{engineNamespace}}</li>
 *   <li>조회: {@code GET /api/v1/workflows/{engineNamespace}/{name}}</li>
 *   <li>종료: {@code DELETE /api/v1/workflows/{engineNamespace}/{name}}</li>
 * </ul>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public class HttpWorkflowEngine extends JsonHttpAdapter implements WorkflowEngine {

    private final String basePath;
    private final WorkflowJsonMapper mapper;

    public HttpWorkflowEngine(HttpEndpointConfig endpoint, String engineNamespace, AccessTokenProvider tokenProvider) {
        this(endpoint, engineNamespace, tokenProvider, null);
    }

    public HttpWorkflowEngine(
        HttpEndpointConfig endpoint,
        String engineNamespace,
        AccessTokenProvider tokenProvider,
        HttpClient httpClient
    ) {
        super(endpoint, tokenProvider, httpClient);
        if (engineNamespace == null || engineNamespace.isBlank()) {
            throw new IllegalArgumentException("engineNamespace cannot be null or blank");
        }
        this.basePath = "/api/v1/workflows/" + encode(engineNamespace);
        this.mapper = new WorkflowJsonMapper(objectMapper);
    }

    @Override
    public CallResult<WorkflowRef> submit(WorkflowDefinition definition) {
        return post(basePath, mapper.toSubmitBody(definition), mapper::readRef);
    }

    @Override
    public CallResult<WorkflowStatus> fetchStatus(WorkflowRef ref) {
        return get(pathOf(ref), json -> mapper.readStatus(ref, json));
    }

    @Override
    public CallResult<Boolean> delete(WorkflowRef ref) {
        return delete(pathOf(ref), json -> Boolean.TRUE);
    }

    @Override
    protected String dependencyName() {
        return "workflow-engine";
    }

    private String pathOf(WorkflowRef ref) {
        return basePath + "/" + encode(ref.getValue());
    }

    static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
