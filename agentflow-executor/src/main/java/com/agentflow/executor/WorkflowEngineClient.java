package com.agentflow.executor;

/**
 * Remote workflow engine operations used by {@link TemporalExecutor}. Implementations must be safe
 * for concurrent use; failures are propagated unchanged.
 */
public interface WorkflowEngineClient {

    /**
     * Starts a workflow execution.
     *
     * @param workflowType engine workflow type (e.g. the workflow interface simple name)
     * @param args         workflow arguments, already packed by the caller (may be empty)
     * @param workflowId   workflow id to use
     * @param taskQueue    task queue the workflow is routed to
     * @return handle to the started execution
     */
    WorkflowHandle startWorkflow(String workflowType, Object[] args, String workflowId, String taskQueue);

    /**
     * Handle to an existing execution.
     *
     * @param workflowId workflow id
     * @param runId      run id, or null for the latest run of {@code workflowId}
     */
    WorkflowHandle getWorkflowHandle(String workflowId, String runId);

    /** Releases the connection to the engine. Clients that own no connection do nothing. */
    default void shutdown() {
    }
}
