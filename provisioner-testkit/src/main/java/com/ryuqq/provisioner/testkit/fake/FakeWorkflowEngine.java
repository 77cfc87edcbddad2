package com.ryuqq.provisioner.testkit.fake;

import com.ryuqq.provisioner.core.model.WorkflowPhase;
import com.ryuqq.provisioner.core.model.WorkflowRef;
import com.ryuqq.provisioner.core.model.WorkflowStatus;
import com.ryuqq.provisioner.core.result.CallResult;
import com.ryuqq.provisioner.core.spi.WorkflowEngine;
import com.ryuqq.provisioner.core.workflow.WorkflowDefinition;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Scriptable in-process {@link WorkflowEngine}.
 *
 * <p>By default every submission succeeds with a reference equal to the workflow name and the
 * workflow reports {@code Running} until a test scripts another phase. Overrides let a test make
 * any call return a specific {@link CallResult}, or block for a given latency.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class FakeWorkflowEngine implements WorkflowEngine {

    private final List<WorkflowDefinition> submitted = new CopyOnWriteArrayList<>();
    private final List<WorkflowRef> deleted = new CopyOnWriteArrayList<>();
    private final Map<WorkflowRef, Deque<WorkflowStatus>> statuses = new ConcurrentHashMap<>();
    private final AtomicInteger submitCalls = new AtomicInteger();
    private final AtomicInteger fetchCalls = new AtomicInteger();
    private final AtomicInteger deleteCalls = new AtomicInteger();

    private volatile Function<WorkflowDefinition, CallResult<WorkflowRef>> submitOverride;
    private volatile Function<WorkflowRef, CallResult<WorkflowStatus>> fetchOverride;
    private volatile Function<WorkflowRef, CallResult<Boolean>> deleteOverride;
    private volatile Duration latency = Duration.ZERO;

    @Override
    public CallResult<WorkflowRef> submit(WorkflowDefinition definition) {
        submitCalls.incrementAndGet();
        pause();
        Function<WorkflowDefinition, CallResult<WorkflowRef>> override = submitOverride;
        if (override != null) {
            return override.apply(definition);
        }
        submitted.add(definition);
        WorkflowRef ref = WorkflowRef.of(definition.getName());
        statuses.putIfAbsent(ref, new ArrayDeque<>(List.of(status(ref, WorkflowPhase.RUNNING, null))));
        return CallResult.success(ref);
    }

    @Override
    public CallResult<WorkflowStatus> fetchStatus(WorkflowRef ref) {
        fetchCalls.incrementAndGet();
        pause();
        Function<WorkflowRef, CallResult<WorkflowStatus>> override = fetchOverride;
        if (override != null) {
            return override.apply(ref);
        }
        Deque<WorkflowStatus> queue = statuses.get(ref);
        if (queue == null) {
            return CallResult.notFound("workflow " + ref + " not found");
        }
        synchronized (queue) {
            WorkflowStatus next = queue.size() > 1 ? queue.poll() : queue.peek();
            return CallResult.success(next);
        }
    }

    @Override
    public CallResult<Boolean> delete(WorkflowRef ref) {
        deleteCalls.incrementAndGet();
        pause();
        Function<WorkflowRef, CallResult<Boolean>> override = deleteOverride;
        if (override != null) {
            return override.apply(ref);
        }
        if (statuses.remove(ref) == null) {
            return CallResult.notFound("workflow " + ref + " not found");
        }
        deleted.add(ref);
        return CallResult.success(Boolean.TRUE);
    }

    /**
     * Scripts the phases reported for a workflow, in order. The last phase repeats.
     */
    public void scriptPhases(WorkflowRef ref, WorkflowPhase... phases) {
        Deque<WorkflowStatus> queue = new ArrayDeque<>();
        for (WorkflowPhase phase : phases) {
            queue.add(status(ref, phase, null));
        }
        statuses.put(ref, queue);
    }

    /**
     * Sets the single status reported for a workflow from now on.
     */
    public void setStatus(WorkflowRef ref, WorkflowPhase phase, String message) {
        statuses.put(ref, new ArrayDeque<>(List.of(status(ref, phase, message))));
    }

    public void respondToSubmitWith(Function<WorkflowDefinition, CallResult<WorkflowRef>> override) {
        this.submitOverride = override;
    }

    public void respondToFetchWith(Function<WorkflowRef, CallResult<WorkflowStatus>> override) {
        this.fetchOverride = override;
    }

    public void respondToDeleteWith(Function<WorkflowRef, CallResult<Boolean>> override) {
        this.deleteOverride = override;
    }

    public void setLatency(Duration latency) {
        this.latency = latency == null ? Duration.ZERO : latency;
    }

    /**
     * Restores default behavior and forgets recorded calls.
     */
    public void reset() {
        submitted.clear();
        deleted.clear();
        statuses.clear();
        submitCalls.set(0);
        fetchCalls.set(0);
        deleteCalls.set(0);
        submitOverride = null;
        fetchOverride = null;
        deleteOverride = null;
        latency = Duration.ZERO;
    }

    public List<WorkflowDefinition> submitted() {
        return new ArrayList<>(submitted);
    }

    public List<WorkflowRef> deleted() {
        return new ArrayList<>(deleted);
    }

    public int submitCalls() {
        return submitCalls.get();
    }

    public int fetchCalls() {
        return fetchCalls.get();
    }

    public int deleteCalls() {
        return deleteCalls.get();
    }

    private void pause() {
        Duration current = latency;
        if (current.isZero()) {
            return;
        }
        try {
            Thread.sleep(current.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static WorkflowStatus status(WorkflowRef ref, WorkflowPhase phase, String message) {
        return WorkflowStatus.of(ref, phase, message, null, null, Map.of());
    }
}
