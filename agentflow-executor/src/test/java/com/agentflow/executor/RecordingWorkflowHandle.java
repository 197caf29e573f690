package com.agentflow.executor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/** {@link WorkflowHandle} that records termination, cancellation and signals. */
final class RecordingWorkflowHandle implements WorkflowHandle {

    private final String workflowId;
    private final String runId;
    private final Object result;

    final List<String> terminateReasons = new ArrayList<>();
    final List<String> signals = new ArrayList<>();
    final List<List<Object>> signalArgs = new ArrayList<>();
    int cancelCount;
    int resultRequests;

    RecordingWorkflowHandle(String workflowId, String runId, Object result) {
        this.workflowId = workflowId;
        this.runId = runId;
        this.result = result;
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
        resultRequests++;
        return CompletableFuture.completedFuture(resultType.cast(result));
    }

    @Override
    public void terminate(String reason) {
        terminateReasons.add(reason);
    }

    @Override
    public void cancel() {
        cancelCount++;
    }

    @Override
    public void signal(String signalName, Object... args) {
        signals.add(signalName);
        signalArgs.add(Arrays.asList(args));
    }
}
