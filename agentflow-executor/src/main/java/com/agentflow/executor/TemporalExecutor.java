package com.agentflow.executor;

import com.agentflow.config.TemporalExecutorConfig;
import com.agentflow.executioncontext.ExecutorContext;
import com.agentflow.executioncontext.Task;
import com.agentflow.executioncontext.WorkflowRegistry;
import com.agentflow.executor.temporal.TemporalWorkflowEngineClient;
import io.temporal.activity.ActivityOptions;
import io.temporal.failure.ApplicationFailure;
import io.temporal.workflow.ActivityStub;
import io.temporal.workflow.Workflow;
import io.temporal.workflow.unsafe.WorkflowUnsafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Executor that forwards workflow and task execution to Temporal.
 * <p>
 * Workflows are looked up by name in the context's {@link WorkflowRegistry} and started through the
 * {@link WorkflowEngineClient}. Tasks run locally when called outside a workflow; inside a workflow
 * thread an activity-marked task is scheduled as a Temporal activity on the configured task queue.
 * Durability, retries and history are Temporal's; failures from the client pass through unchanged.
 * <p>
 * One instance may be shared by many callers. The client is supplied by the caller or connected
 * lazily by {@link #ensureClient()}.
 */
public final class TemporalExecutor {

    private static final Logger log = LoggerFactory.getLogger(TemporalExecutor.class);

    static final String DEFAULT_TERMINATE_REASON = "Workflow terminated";

    /** Failure type raised when a task without an activity name is executed inside a workflow. */
    public static final String TASK_NOT_ACTIVITY = "TaskNotActivity";

    private final TemporalExecutorConfig config;
    private final ExecutorContext context;
    private volatile WorkflowEngineClient client;

    /**
     * @param config  connection settings and defaults
     * @param client  engine client; null to connect from {@code config} on first use
     * @param context application context with workflow and task registries
     */
    public TemporalExecutor(TemporalExecutorConfig config, WorkflowEngineClient client, ExecutorContext context) {
        this.config = Objects.requireNonNull(config, "config");
        this.context = Objects.requireNonNull(context, "context");
        this.client = client;
    }

    public TemporalExecutor(TemporalExecutorConfig config, ExecutorContext context) {
        this(config, null, context);
    }

    public TemporalExecutorConfig getConfig() {
        return config;
    }

    public ExecutorContext getContext() {
        return context;
    }

    /** Current client, or null if not connected yet. */
    public WorkflowEngineClient getClient() {
        return client;
    }

    /**
     * Returns the client, connecting a {@link TemporalWorkflowEngineClient} from the configuration
     * if none is set. Idempotent.
     */
    public WorkflowEngineClient ensureClient() {
        WorkflowEngineClient current = client;
        if (current != null) {
            return current;
        }
        synchronized (this) {
            if (client == null) {
                client = TemporalWorkflowEngineClient.connect(config);
            }
            return client;
        }
    }

    /** Shuts down the client if one is connected. The executor can reconnect afterwards. */
    public void shutdown() {
        WorkflowEngineClient current;
        synchronized (this) {
            current = client;
            client = null;
        }
        if (current != null) {
            current.shutdown();
            log.info("Workflow engine client shut down");
        }
    }

    /**
     * Marks {@code task} as the activity {@code name} so the worker's dispatching activity can
     * resolve it. No execution happens here; register the result with the context's task registry
     * before starting a worker.
     */
    public <R> Task<R> wrapAsActivity(String name, Task<R> task) {
        Objects.requireNonNull(task, "task");
        return task.asActivity(name);
    }

    /**
     * Runs {@code task} locally. A sync body runs inline in the calling thread; an async body's future
     * is returned. The future fails with the task's own exception.
     */
    public <R> CompletableFuture<R> executeTaskAsync(Task<R> task, Object... args) {
        Objects.requireNonNull(task, "task");
        log.debug("Executing task {} locally with {} argument(s)", task, args != null ? args.length : 0);
        return task.invoke(args);
    }

    /**
     * Runs {@code task} and returns its result. Outside a workflow the task runs locally (see
     * {@link #executeTaskAsync(Task, Object...)}); inside a workflow thread it is scheduled as an
     * activity by its activity name.
     *
     * @throws ApplicationFailure     non-retryable, of type {@value #TASK_NOT_ACTIVITY}, if called inside a
     *                                workflow with a task that is not an activity; the workflow fails
     * @throws TaskExecutionException if the task threw a checked exception locally
     */
    public <R> R executeTask(Task<R> task, Object... args) {
        Objects.requireNonNull(task, "task");
        if (WorkflowUnsafe.isWorkflowThread()) {
            return executeTaskAsActivity(task, args);
        }
        try {
            return executeTaskAsync(task, args).join();
        } catch (CompletionException e) {
            throw propagate(e.getCause() != null ? e.getCause() : e);
        }
    }

    private <R> R executeTaskAsActivity(Task<R> task, Object... args) {
        if (!task.isActivity()) {
            throw ApplicationFailure.newNonRetryableFailure(
                    "Task must be wrapped as an activity to run inside a workflow: " + task, TASK_NOT_ACTIVITY);
        }
        ActivityOptions options = ActivityOptions.newBuilder()
                .setTaskQueue(config.getTaskQueue())
                .setScheduleToCloseTimeout(config.getTimeout())
                .build();
        ActivityStub stub = Workflow.newUntypedActivityStub(options);
        return stub.execute(task.getActivityName(), task.getResultType(), args != null ? args : new Object[0]);
    }

    /** Starts workflow {@code name} with a generated id on the configured task queue. */
    public WorkflowHandle startWorkflow(String name, Object... args) {
        return startWorkflow(name, WorkflowStartOptions.defaults(), args);
    }

    /**
     * Starts the workflow registered under {@code name}.
     * <p>
     * Arguments: none → no input; one → passed as-is; several → packed in order into one {@link List}
     * passed as the single workflow argument. The workflow id defaults to {@code <name>-<uuid>} and the
     * task queue to the configured one.
     *
     * @throws IllegalArgumentException if no workflow is registered under {@code name}
     */
    public WorkflowHandle startWorkflow(String name, WorkflowStartOptions options, Object... args) {
        Objects.requireNonNull(name, "name");
        WorkflowStartOptions opts = options != null ? options : WorkflowStartOptions.defaults();
        Class<?> workflowClass = context.getWorkflowRegistry().get(name);
        if (workflowClass == null) {
            throw new IllegalArgumentException("Workflow not found in registry: " + name);
        }
        String workflowType = WorkflowRegistry.workflowTypeOf(workflowClass);
        String workflowId = opts.getWorkflowId() != null ? opts.getWorkflowId() : name + "-" + UUID.randomUUID();
        String taskQueue = opts.getTaskQueue() != null ? opts.getTaskQueue() : config.getTaskQueue();
        Object[] input = packArguments(args);

        WorkflowHandle handle = ensureClient().startWorkflow(workflowType, input, workflowId, taskQueue);
        log.info("Started workflow {} (type={}) | workflowId: {} | runId: {} | taskQueue: {}",
                name, workflowType, handle.getWorkflowId(), handle.getRunId(), taskQueue);
        return handle;
    }

    /** Starts workflow {@code name} and completes with its result. */
    public <R> CompletableFuture<R> executeWorkflow(String name, Class<R> resultType, Object... args) {
        return executeWorkflow(name, resultType, WorkflowStartOptions.defaults(), args);
    }

    /** Same as {@link #startWorkflow(String, WorkflowStartOptions, Object...)}, then awaits the result. */
    public <R> CompletableFuture<R> executeWorkflow(String name, Class<R> resultType, WorkflowStartOptions options,
                                                    Object... args) {
        Objects.requireNonNull(resultType, "resultType");
        return startWorkflow(name, options, args).result(resultType);
    }

    /** Terminates the latest run of {@code workflowId}. */
    public void terminateWorkflow(String workflowId) {
        terminateWorkflow(workflowId, null, DEFAULT_TERMINATE_REASON);
    }

    /**
     * Terminates a workflow execution.
     *
     * @param workflowId workflow id
     * @param runId      run id, or null for the latest run
     * @param reason     reason recorded in the workflow history
     */
    public void terminateWorkflow(String workflowId, String runId, String reason) {
        Objects.requireNonNull(workflowId, "workflowId");
        WorkflowHandle handle = ensureClient().getWorkflowHandle(workflowId, runId);
        handle.terminate(reason);
        log.info("Terminated workflow | workflowId: {} | runId: {} | reason: {}", workflowId, runId, reason);
    }

    /** Requests cancellation of a workflow execution (run id null = latest run). */
    public void cancelWorkflow(String workflowId, String runId) {
        Objects.requireNonNull(workflowId, "workflowId");
        ensureClient().getWorkflowHandle(workflowId, runId).cancel();
        log.info("Requested cancellation of workflow | workflowId: {} | runId: {}", workflowId, runId);
    }

    /** Sends {@code signalName} with {@code args} to a workflow execution (run id null = latest run). */
    public void signalWorkflow(String workflowId, String runId, String signalName, Object... args) {
        Objects.requireNonNull(workflowId, "workflowId");
        Objects.requireNonNull(signalName, "signalName");
        ensureClient().getWorkflowHandle(workflowId, runId).signal(signalName, args != null ? args : new Object[0]);
        log.debug("Signalled workflow {} (runId={}) with {}", workflowId, runId, signalName);
    }

    static Object[] packArguments(Object... args) {
        if (args == null || args.length == 0) {
            return new Object[0];
        }
        if (args.length == 1) {
            return new Object[]{args[0]};
        }
        List<Object> packed = Collections.unmodifiableList(Arrays.asList(args.clone()));
        return new Object[]{packed};
    }

    private static RuntimeException propagate(Throwable failure) {
        if (failure instanceof RuntimeException) {
            return (RuntimeException) failure;
        }
        if (failure instanceof Error) {
            throw (Error) failure;
        }
        return new TaskExecutionException(failure);
    }
}
