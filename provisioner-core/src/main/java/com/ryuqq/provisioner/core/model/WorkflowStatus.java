package com.ryuqq.provisioner.core.model;

import java.time.Instant;
import java.util.Map;

/**
 * 워크플로우 상태 스냅샷.
 *
 * <p>{@code waitTimedOut} 은 대기 시간 내에 종료 단계에 도달하지 못해
 * 마지막으로 관찰한 상태를 그대로 돌려준 경우 true 입니다.
 * 이 경우 워크플로우는 여전히 실행 중일 수 있으며, 요청을 열어둘지는 호출자가 결정합니다.</p>
 *
 * @param ref 워크플로우 식별자
 * @param phase 실행 단계
 * @param message 엔진 메시지 (nullable)
 * @param startedAt 시작 시각 (nullable)
 * @param finishedAt 종료 시각 (nullable)
 * @param nodes 단계 이름 → 단계 phase
 * @param waitTimedOut 대기 타임아웃으로 반환된 스냅샷 여부
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public record WorkflowStatus(
    WorkflowRef ref,
    WorkflowPhase phase,
    String message,
    Instant startedAt,
    Instant finishedAt,
    Map<String, String> nodes,
    boolean waitTimedOut
) {

    public WorkflowStatus {
        if (ref == null) {
            throw new IllegalArgumentException("ref cannot be null");
        }
        if (phase == null) {
            phase = WorkflowPhase.UNKNOWN;
        }
        nodes = nodes == null ? Map.of() : Map.copyOf(nodes);
    }

    public static WorkflowStatus of(
        WorkflowRef ref,
        WorkflowPhase phase,
        String message,
        Instant startedAt,
        Instant finishedAt,
        Map<String, String> nodes
    ) {
        return new WorkflowStatus(ref, phase, message, startedAt, finishedAt, nodes, false);
    }

    /**
     * 대기 타임아웃 시 반환하는 "아직 실행 중" 스냅샷.
     *
     * @param ref 워크플로우 식별자
     * @param lastObserved 마지막으로 관찰한 상태 (없으면 null)
     * @return waitTimedOut=true 인 상태
     */
    public static WorkflowStatus stillRunning(WorkflowRef ref, WorkflowStatus lastObserved) {
        if (lastObserved == null) {
            return new WorkflowStatus(ref, WorkflowPhase.UNKNOWN, null, null, null, Map.of(), true);
        }
        return new WorkflowStatus(
            ref,
            lastObserved.phase(),
            lastObserved.message(),
            lastObserved.startedAt(),
            lastObserved.finishedAt(),
            lastObserved.nodes(),
            true
        );
    }

    public boolean isTerminal() {
        return phase.isTerminal();
    }
}
