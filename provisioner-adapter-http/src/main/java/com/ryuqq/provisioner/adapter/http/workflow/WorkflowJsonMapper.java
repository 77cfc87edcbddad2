package com.ryuqq.provisioner.adapter.http.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.provisioner.core.model.WorkflowPhase;
import com.ryuqq.provisioner.core.model.WorkflowRef;
import com.ryuqq.provisioner.core.model.WorkflowStatus;
import com.ryuqq.provisioner.core.workflow.StepResources;
import com.ryuqq.provisioner.core.workflow.WorkflowDefinition;
import com.ryuqq.provisioner.core.workflow.WorkflowStep;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 워크플로우 정의, 상태 ↔ 엔진 JSON.
 *
 * <p><strong>제출 본문:</strong></p>
 * <pre>
 * {
 *   "apiVersion": "argoproj.io/v1alpha1",
 *   "kind": "Workflow",
 *   "metadata": { "name", "labels", "annotations" },
 *   "spec": {
 *     "entrypoint", "serviceAccountName",
 *     "arguments": { "parameters": [ { "name", "value" } ] },
 *     "templates": [ { "name": entrypoint, "dag": { "tasks": [ ... ] } } ]
 *   }
 * }
 * </pre>
 *
 * <p><strong>상태 응답:</strong> {@code status.phase} 또는 최상위 {@code phase} 를 읽습니다.
 * 노드는 {@code {id: {displayName, phase}}} 형태와 {@code {name: phase}} 형태를 모두 받습니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class WorkflowJsonMapper {

    static final String API_VERSION = "argoproj.io/v1alpha1";
    static final String KIND = "Workflow";

    private final ObjectMapper objectMapper;

    public WorkflowJsonMapper(ObjectMapper objectMapper) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.objectMapper = objectMapper;
    }

    public ObjectNode toSubmitBody(WorkflowDefinition definition) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("apiVersion", API_VERSION);
        root.put("kind", KIND);

        ObjectNode metadata = root.putObject("metadata");
        metadata.put("name", definition.getName());
        putAll(metadata.putObject("labels"), definition.getLabels());
        putAll(metadata.putObject("annotations"), definition.getAnnotations());

        ObjectNode spec = root.putObject("spec");
        spec.put("entrypoint", definition.getEntrypoint());
        if (definition.getServiceAccount() != null) {
            spec.put("serviceAccountName", definition.getServiceAccount());
        }
        parameters(spec.putObject("arguments"), definition.getParameters());

        ObjectNode dagTemplate = spec.putArray("templates").addObject();
        dagTemplate.put("name", definition.getEntrypoint());
        ArrayNode tasks = dagTemplate.putObject("dag").putArray("tasks");
        for (WorkflowStep step : definition.getSteps()) {
            tasks.add(task(definition, step));
        }
        return root;
    }

    /**
     * 제출 응답에서 워크플로우 이름 추출.
     *
     * @throws IllegalArgumentException metadata.name 이 없는 경우
     */
    public WorkflowRef readRef(JsonNode response) {
        String name = response.path("metadata").path("name").asText("");
        if (name.isBlank()) {
            throw new IllegalArgumentException("response has no metadata.name");
        }
        return WorkflowRef.of(name);
    }

    public WorkflowStatus readStatus(WorkflowRef ref, JsonNode response) {
        JsonNode status = response.has("status") ? response.path("status") : response;
        return WorkflowStatus.of(
            ref,
            WorkflowPhase.fromValue(text(status, "phase")),
            text(status, "message"),
            instant(status, "startedAt"),
            instant(status, "finishedAt"),
            nodes(status.path("nodes"))
        );
    }

    private ObjectNode task(WorkflowDefinition definition, WorkflowStep step) {
        ObjectNode task = objectMapper.createObjectNode();
        task.put("name", step.name());
        ObjectNode templateRef = task.putObject("templateRef");
        templateRef.put("name", definition.getTemplateLibrary() != null ? definition.getTemplateLibrary() : step.template());
        templateRef.put("template", step.template());
        if (!step.dependencies().isEmpty()) {
            ArrayNode dependencies = task.putArray("dependencies");
            step.dependencies().forEach(dependencies::add);
        }
        parameters(task.putObject("arguments"), step.arguments());
        resources(task.putObject("resources"), step.resources());
        return task;
    }

    private void parameters(ObjectNode arguments, Map<String, String> values) {
        ArrayNode parameters = arguments.putArray("parameters");
        values.forEach((name, value) -> {
            ObjectNode parameter = parameters.addObject();
            parameter.put("name", name);
            parameter.put("value", value);
        });
    }

    private static void resources(ObjectNode node, StepResources resources) {
        ObjectNode requests = node.putObject("requests");
        requests.put("cpu", resources.cpuRequest());
        requests.put("memory", resources.memoryRequest());
        ObjectNode limits = node.putObject("limits");
        limits.put("cpu", resources.cpuLimit());
        limits.put("memory", resources.memoryLimit());
    }

    private static void putAll(ObjectNode node, Map<String, String> values) {
        values.forEach(node::put);
    }

    private static Map<String, String> nodes(JsonNode nodes) {
        Map<String, String> result = new LinkedHashMap<>();
        if (!nodes.isObject()) {
            return result;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = nodes.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value.isTextual()) {
                result.put(field.getKey(), value.asText());
            } else if (value.isObject()) {
                String name = value.path("displayName").asText(field.getKey());
                result.put(name, value.path("phase").asText(WorkflowPhase.UNKNOWN.value()));
            }
        }
        return result;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isTextual() && !value.asText().isBlank() ? value.asText() : null;
    }

    private static Instant instant(JsonNode node, String field) {
        String value = text(node, field);
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
