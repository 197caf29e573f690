package com.agentflow.executor.temporal;

import com.agentflow.config.TemporalExecutorConfig;
import com.agentflow.executor.WorkflowEngineClient;
import com.agentflow.executor.WorkflowHandle;
import io.temporal.api.common.v1.WorkflowExecution;
import io.temporal.api.enums.v1.WorkflowIdReusePolicy;
import io.temporal.client.WorkflowClient;
import io.temporal.client.WorkflowClientOptions;
import io.temporal.client.WorkflowOptions;
import io.temporal.client.WorkflowStub;
import io.temporal.serviceclient.WorkflowServiceStubs;
import io.temporal.serviceclient.WorkflowServiceStubsOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link WorkflowEngineClient} backed by a Temporal {@link WorkflowClient}. Starts and looks up
 * executions through untyped workflow stubs.
 */
public final class TemporalWorkflowEngineClient implements WorkflowEngineClient {

    private static final Logger log = LoggerFactory.getLogger(TemporalWorkflowEngineClient.class);

    private final WorkflowClient workflowClient;
    private final WorkflowIdReusePolicy idReusePolicy;

    public TemporalWorkflowEngineClient(WorkflowClient workflowClient, String idReusePolicy) {
        this.workflowClient = Objects.requireNonNull(workflowClient, "workflowClient");
        this.idReusePolicy = toReusePolicy(idReusePolicy);
    }

    /** Connects to the Temporal frontend at {@code config.getHost()} in {@code config.getNamespace()}. */
    public static TemporalWorkflowEngineClient connect(TemporalExecutorConfig config) {
        Objects.requireNonNull(config, "config");
        WorkflowServiceStubs service = WorkflowServiceStubs.newServiceStubs(
                WorkflowServiceStubsOptions.newBuilder()
                        .setTarget(config.getHost())
                        .build()
        );
        WorkflowClient client = WorkflowClient.newInstance(
                service,
                WorkflowClientOptions.newBuilder()
                        .setNamespace(config.getNamespace())
                        .build()
        );
        log.info("Connected Temporal client | target: {} | namespace: {}", config.getHost(), config.getNamespace());
        return new TemporalWorkflowEngineClient(client, config.getIdReusePolicy());
    }

    @Override
    public WorkflowHandle startWorkflow(String workflowType, Object[] args, String workflowId, String taskQueue) {
        WorkflowOptions options = WorkflowOptions.newBuilder()
                .setWorkflowId(workflowId)
                .setTaskQueue(taskQueue)
                .setWorkflowIdReusePolicy(idReusePolicy)
                .build();
        WorkflowStub stub = workflowClient.newUntypedWorkflowStub(workflowType, options);
        WorkflowExecution execution = stub.start(args != null ? args : new Object[0]);
        return new TemporalWorkflowHandle(stub, execution.getWorkflowId(), execution.getRunId());
    }

    @Override
    public WorkflowHandle getWorkflowHandle(String workflowId, String runId) {
        Objects.requireNonNull(workflowId, "workflowId");
        WorkflowStub stub = workflowClient.newUntypedWorkflowStub(workflowId, Optional.ofNullable(runId), Optional.empty());
        return new TemporalWorkflowHandle(stub, workflowId, runId);
    }

    /** Shuts down the service stubs behind the Temporal client. Idempotent. */
    @Override
    public void shutdown() {
        WorkflowServiceStubs service = workflowClient.getWorkflowServiceStubs();
        if (!service.isShutdown()) {
            service.shutdown();
            log.info("Temporal service stubs shut down");
        }
    }

    /** Underlying Temporal client (e.g. for building a worker factory). */
    public WorkflowClient getWorkflowClient() {
        return workflowClient;
    }

    static WorkflowIdReusePolicy toReusePolicy(String name) {
        String policy = name != null && !name.isBlank() ? name.trim() : TemporalExecutorConfig.DEFAULT_ID_REUSE_POLICY;
        try {
            return WorkflowIdReusePolicy.valueOf("WORKFLOW_ID_REUSE_POLICY_" + policy.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown workflow id reuse policy: " + name, e);
        }
    }
}
