package com.agentflow.executor;

/**
 * Per-call overrides for {@link TemporalExecutor#startWorkflow(String, WorkflowStartOptions, Object...)}.
 * Null fields fall back to a generated workflow id and the configured task queue.
 */
public final class WorkflowStartOptions {

    private static final WorkflowStartOptions DEFAULTS = new WorkflowStartOptions(null, null);

    private final String workflowId;
    private final String taskQueue;

    private WorkflowStartOptions(String workflowId, String taskQueue) {
        this.workflowId = workflowId;
        this.taskQueue = taskQueue;
    }

    public static WorkflowStartOptions defaults() {
        return DEFAULTS;
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    /** Workflow id to use instead of a generated one, or null. */
    public String getWorkflowId() {
        return workflowId;
    }

    /** Task queue overriding the configured default, or null. */
    public String getTaskQueue() {
        return taskQueue;
    }

    public static final class Builder {
        private String workflowId;
        private String taskQueue;

        public Builder setWorkflowId(String workflowId) {
            this.workflowId = workflowId;
            return this;
        }

        public Builder setTaskQueue(String taskQueue) {
            this.taskQueue = taskQueue;
            return this;
        }

        public WorkflowStartOptions build() {
            return new WorkflowStartOptions(workflowId, taskQueue);
        }
    }
}
