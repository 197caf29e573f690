package com.agentflow.executor.temporal;

import com.agentflow.executor.WorkflowHandle;
import io.temporal.client.WorkflowStub;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/** {@link WorkflowHandle} over an untyped Temporal {@link WorkflowStub}. */
public final class TemporalWorkflowHandle implements WorkflowHandle {

    private final WorkflowStub stub;
    private final String workflowId;
    private final String runId;

    TemporalWorkflowHandle(WorkflowStub stub, String workflowId, String runId) {
        this.stub = Objects.requireNonNull(stub, "stub");
        this.workflowId = Objects.requireNonNull(workflowId, "workflowId");
        this.runId = runId;
    }

    @Override
    public String getWorkflowId() {
        return workflowId;
    }

    @Override
    public String getRunId() {
        return runId;
    }

    @Override
    public <R> CompletableFuture<R> result(Class<R> resultType) {
        return stub.getResultAsync(resultType);
    }

    @Override
    public void terminate(String reason) {
        stub.terminate(reason);
    }

    @Override
    public void cancel() {
        stub.cancel();
    }

    @Override
    public void signal(String signalName, Object... args) {
        stub.signal(signalName, args);
    }

    /** Underlying Temporal stub (e.g. for queries). */
    public WorkflowStub getStub() {
        return stub;
    }
}
