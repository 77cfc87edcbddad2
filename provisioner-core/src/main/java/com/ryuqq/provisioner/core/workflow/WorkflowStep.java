package com.ryuqq.provisioner.core.workflow;

import java.util.List;
import java.util.Map;

/**
 * 워크플로우 DAG 의 단계 하나.
 *
 * <p>실제 실행은 외부 워크플로우 엔진이 담당하며, 이 record 는 단계의 선언만 표현합니다.</p>
 *
 * @param name 단계 이름 (DAG 내 고유)
 * @param template 엔진 쪽 템플릿 이름
 * @param dependencies 선행 단계 이름 목록
 * @param arguments 템플릿 인자
 * @param resources 단계 리소스
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record WorkflowStep(
    String name,
    String template,
    List<String> dependencies,
    Map<String, String> arguments,
    StepResources resources
) {

    public WorkflowStep {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (template == null || template.isBlank()) {
            throw new IllegalArgumentException("template cannot be null or blank");
        }
        if (resources == null) {
            throw new IllegalArgumentException("resources cannot be null");
        }
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        arguments = arguments == null ? Map.of() : Map.copyOf(arguments);
    }
}
