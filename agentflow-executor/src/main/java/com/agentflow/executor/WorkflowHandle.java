package com.agentflow.executor;

import java.util.concurrent.CompletableFuture;

/** Reference to a workflow execution held by the engine. */
public interface WorkflowHandle {

    String getWorkflowId();

    /** Run id, or null when the handle targets the latest run. */
    String getRunId();

    /** Completes with the workflow result, or exceptionally with the engine's failure. */
    <R> CompletableFuture<R> result(Class<R> resultType);

    void terminate(String reason);

    void cancel();

    void signal(String signalName, Object... args);
}
