package com.ryuqq.provisioner.core.spi;

import com.ryuqq.provisioner.core.model.WorkflowRef;
import com.ryuqq.provisioner.core.model.WorkflowStatus;
import com.ryuqq.provisioner.core.result.CallResult;
import com.ryuqq.provisioner.core.workflow.WorkflowDefinition;

/**
 * Transport SPI for the external workflow engine.
 *
 * <p>Implementations perform exactly one remote call per method and never retry.
 * Expected outcomes are returned as {@link CallResult} values instead of exceptions:</p>
 * <ul>
 *   <li>{@code Success} - the call succeeded</li>
 *   <li>{@code NotFound} - the workflow does not exist</li>
 *   <li>{@code Unauthenticated} - the engine rejected the credentials</li>
 *   <li>{@code ServiceError} - transport failure or server error</li>
 * </ul>
 *
 * <p>Circuit breaking and timeouts are applied by the caller.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public interface WorkflowEngine {

    /**
     * Submits a workflow definition.
     *
     * @param definition the DAG to submit
     * @return the reference assigned by the engine
     */
    CallResult<WorkflowRef> submit(WorkflowDefinition definition);

    /**
     * Fetches the current status of a workflow.
     *
     * @param ref workflow reference
     * @return the status snapshot
     */
    CallResult<WorkflowStatus> fetchStatus(WorkflowRef ref);

    /**
     * Deletes (terminates) a workflow.
     *
     * @param ref workflow reference
     * @return {@code Success(true)} when deleted
     */
    CallResult<Boolean> delete(WorkflowRef ref);
}
