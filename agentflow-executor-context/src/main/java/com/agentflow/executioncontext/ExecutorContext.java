package com.agentflow.executioncontext;

import java.util.Objects;

/**
 * Application context shared by the executor and the worker. Holds references only; the registries
 * are owned by the application.
 */
public final class ExecutorContext {

    private final WorkflowRegistry workflowRegistry;
    private final TaskRegistry taskRegistry;

    public ExecutorContext(WorkflowRegistry workflowRegistry, TaskRegistry taskRegistry) {
        this.workflowRegistry = Objects.requireNonNull(workflowRegistry, "workflowRegistry");
        this.taskRegistry = Objects.requireNonNull(taskRegistry, "taskRegistry");
    }

    /** Context with empty registries. */
    public static ExecutorContext create() {
        return new ExecutorContext(new WorkflowRegistry(), new TaskRegistry());
    }

    public WorkflowRegistry getWorkflowRegistry() {
        return workflowRegistry;
    }

    public TaskRegistry getTaskRegistry() {
        return taskRegistry;
    }
}
