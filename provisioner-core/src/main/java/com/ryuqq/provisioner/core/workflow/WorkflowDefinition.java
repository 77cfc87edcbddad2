package com.ryuqq.provisioner.core.workflow;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 워크플로우 엔진에 제출할 선언적 DAG 명세.
 *
 * <p>생성 시점에 그래프를 검증합니다.</p>
 * <ul>
 *   <li>단계 이름은 고유해야 함</li>
 *   <li>의존 대상 단계는 모두 정의되어 있어야 함</li>
 *   <li>순환 의존이 없어야 함</li>
 * </ul>
 *
 * <p>파라미터는 삽입 순서를 유지합니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class WorkflowDefinition {

    private final String name;
    private final String entrypoint;
    private final String templateLibrary;
    private final String serviceAccount;
    private final Map<String, String> labels;
    private final Map<String, String> annotations;
    private final Map<String, String> parameters;
    private final List<WorkflowStep> steps;

    private WorkflowDefinition(Builder builder) {
        this.name = builder.name;
        this.entrypoint = builder.entrypoint;
        this.templateLibrary = builder.templateLibrary;
        this.serviceAccount = builder.serviceAccount;
        this.labels = Collections.unmodifiableMap(new LinkedHashMap<>(builder.labels));
        this.annotations = Collections.unmodifiableMap(new LinkedHashMap<>(builder.annotations));
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.parameters));
        this.steps = List.copyOf(builder.steps);
        validateGraph(steps);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    private static void validateGraph(List<WorkflowStep> steps) {
        if (steps.isEmpty()) {
            throw new IllegalArgumentException("Workflow must have at least one step");
        }
        Map<String, WorkflowStep> byName = new HashMap<>();
        for (WorkflowStep step : steps) {
            if (byName.put(step.name(), step) != null) {
                throw new IllegalArgumentException("Duplicate workflow step: " + step.name());
            }
        }
        for (WorkflowStep step : steps) {
            for (String dependency : step.dependencies()) {
                if (!byName.containsKey(dependency)) {
                    throw new IllegalArgumentException(
                        "Step '" + step.name() + "' depends on unknown step '" + dependency + "'"
                    );
                }
            }
        }

        // Kahn
        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (WorkflowStep step : steps) {
            inDegree.put(step.name(), step.dependencies().size());
            for (String dependency : step.dependencies()) {
                dependents.computeIfAbsent(dependency, k -> new ArrayList<>()).add(step.name());
            }
        }
        Deque<String> ready = new ArrayDeque<>();
        inDegree.forEach((stepName, degree) -> {
            if (degree == 0) {
                ready.add(stepName);
            }
        });
        Set<String> visited = new HashSet<>();
        while (!ready.isEmpty()) {
            String current = ready.poll();
            visited.add(current);
            for (String dependent : dependents.getOrDefault(current, List.of())) {
                if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }
        if (visited.size() != steps.size()) {
            throw new IllegalArgumentException("Workflow steps contain a dependency cycle");
        }
    }

    public String getName() {
        return name;
    }

    public String getEntrypoint() {
        return entrypoint;
    }

    public String getTemplateLibrary() {
        return templateLibrary;
    }

    public String getServiceAccount() {
        return serviceAccount;
    }

    public Map<String, String> getLabels() {
        return labels;
    }

    public Map<String, String> getAnnotations() {
        return annotations;
    }

    public Map<String, String> getParameters() {
        return parameters;
    }

    public List<WorkflowStep> getSteps() {
        return steps;
    }

    public Optional<WorkflowStep> findStep(String stepName) {
        return steps.stream().filter(step -> step.name().equals(stepName)).findFirst();
    }

    /**
     * WorkflowDefinition 빌더.
     */
    public static final class Builder {

        private final String name;
        private String entrypoint = "main";
        private String templateLibrary;
        private String serviceAccount;
        private final Map<String, String> labels = new LinkedHashMap<>();
        private final Map<String, String> annotations = new LinkedHashMap<>();
        private final Map<String, String> parameters = new LinkedHashMap<>();
        private final List<WorkflowStep> steps = new ArrayList<>();

        private Builder(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name cannot be null or blank");
            }
            this.name = name;
        }

        public Builder entrypoint(String entrypoint) {
            this.entrypoint = entrypoint;
            return this;
        }

        public Builder templateLibrary(String templateLibrary) {
            this.templateLibrary = templateLibrary;
            return this;
        }

        public Builder serviceAccount(String serviceAccount) {
            this.serviceAccount = serviceAccount;
            return this;
        }

        public Builder label(String key, String value) {
            labels.put(key, value);
            return this;
        }

        public Builder annotation(String key, String value) {
            annotations.put(key, value);
            return this;
        }

        public Builder parameter(String key, String value) {
            parameters.put(key, value);
            return this;
        }

        public Builder step(WorkflowStep step) {
            if (step == null) {
                throw new IllegalArgumentException("step cannot be null");
            }
            steps.add(step);
            return this;
        }

        /**
         * 명세 생성.
         *
         * @throws IllegalArgumentException 그래프가 유효하지 않은 경우
         */
        public WorkflowDefinition build() {
            return new WorkflowDefinition(this);
        }
    }
}
