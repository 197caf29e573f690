package com.agentflow.executor;

import java.util.ArrayList;
import java.util.List;

/** In-memory {@link WorkflowEngineClient} that records every call. */
final class RecordingWorkflowEngineClient implements WorkflowEngineClient {

    static final class StartCall {
        final String workflowType;
        final Object[] args;
        final String workflowId;
        final String taskQueue;

        StartCall(String workflowType, Object[] args, String workflowId, String taskQueue) {
            this.workflowType = workflowType;
            this.args = args;
            this.workflowId = workflowId;
            this.taskQueue = taskQueue;
        }
    }

    static final class HandleLookup {
        final String workflowId;
        final String runId;

        HandleLookup(String workflowId, String runId) {
            this.workflowId = workflowId;
            this.runId = runId;
        }
    }

    final List<StartCall> starts = new ArrayList<>();
    int shutdownCount;
    final List<HandleLookup> lookups = new ArrayList<>();
    final List<RecordingWorkflowHandle> handles = new ArrayList<>();
    private Object nextResult;
    private RuntimeException startFailure;

    void willReturnResult(Object result) {
        this.nextResult = result;
    }

    void failStartsWith(RuntimeException failure) {
        this.startFailure = failure;
    }

    StartCall lastStart() {
        return starts.get(starts.size() - 1);
    }

    RecordingWorkflowHandle lastHandle() {
        return handles.get(handles.size() - 1);
    }

    @Override
    public WorkflowHandle startWorkflow(String workflowType, Object[] args, String workflowId, String taskQueue) {
        starts.add(new StartCall(workflowType, args, workflowId, taskQueue));
        if (startFailure != null) {
            throw startFailure;
        }
        RecordingWorkflowHandle handle = new RecordingWorkflowHandle(workflowId, "run-" + starts.size(), nextResult);
        handles.add(handle);
        return handle;
    }

    @Override
    public WorkflowHandle getWorkflowHandle(String workflowId, String runId) {
        lookups.add(new HandleLookup(workflowId, runId));
        RecordingWorkflowHandle handle = new RecordingWorkflowHandle(workflowId, runId, null);
        handles.add(handle);
        return handle;
    }

    @Override
    public void shutdown() {
        shutdownCount++;
    }
}
