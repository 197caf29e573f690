package com.agentflow.worker;

import com.agentflow.config.TemporalExecutorConfig;
import com.agentflow.executioncontext.ExecutorContext;
import com.agentflow.executor.TemporalExecutor;
import com.agentflow.executor.WorkflowEngineClient;
import com.agentflow.executor.temporal.TemporalWorkflowEngineClient;
import io.temporal.client.WorkflowClient;
import io.temporal.worker.Worker;
import io.temporal.worker.WorkerFactory;
import io.temporal.worker.WorkerOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Temporal worker for an executor's application: polls the configured task queue, hosts every
 * workflow in the workflow registry and runs registered tasks through {@link TaskDispatchActivity}.
 * <p>
 * {@link WorkerFactory#start()} returns immediately; {@link #run()} blocks the calling thread so the
 * JVM stays alive. A shutdown hook and InterruptedException handle graceful shutdown (e.g. Ctrl+C).
 */
public final class AgentflowWorker {

    private static final Logger log = LoggerFactory.getLogger(AgentflowWorker.class);
    private static final int SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final WorkerFactory factory;
    private final Worker worker;

    private AgentflowWorker(WorkerFactory factory, Worker worker) {
        this.factory = factory;
        this.worker = worker;
    }

    /**
     * Creates a worker using the executor's Temporal client (connecting it if needed).
     *
     * @throws IllegalStateException if the executor's client is not a {@link TemporalWorkflowEngineClient}
     */
    public static AgentflowWorker forExecutor(TemporalExecutor executor) {
        Objects.requireNonNull(executor, "executor");
        WorkflowEngineClient client = executor.ensureClient();
        if (!(client instanceof TemporalWorkflowEngineClient)) {
            throw new IllegalStateException("Worker requires a Temporal client, got " + client.getClass().getName());
        }
        WorkflowClient workflowClient = ((TemporalWorkflowEngineClient) client).getWorkflowClient();
        WorkerFactory factory = WorkerFactory.newInstance(workflowClient);
        Worker worker = newWorker(factory, executor.getConfig(), executor.getContext());
        return new AgentflowWorker(factory, worker);
    }

    /**
     * Creates a worker on {@code config.getTaskQueue()} in {@code factory} and registers all workflows
     * and the task dispatch activity. The factory is not started.
     */
    public static Worker newWorker(WorkerFactory factory, TemporalExecutorConfig config, ExecutorContext context) {
        Objects.requireNonNull(factory, "factory");
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(context, "context");
        WorkerOptions workerOptions = WorkerOptions.newBuilder()
                .setMaxConcurrentActivityExecutionSize(config.getMaxConcurrentActivities())
                .build();
        Worker worker = factory.newWorker(config.getTaskQueue(), workerOptions);

        Map<String, Class<?>> workflows = context.getWorkflowRegistry().getAll();
        for (Map.Entry<String, Class<?>> e : workflows.entrySet()) {
            worker.registerWorkflowImplementationTypes(e.getValue());
            log.info("Registered workflow {} ({})", e.getKey(), e.getValue().getName());
        }
        worker.registerActivitiesImplementations(new TaskDispatchActivity(context.getTaskRegistry()));
        log.info("Registered worker for task queue: {} | workflows: {} | activities: {}",
                config.getTaskQueue(), workflows.size(), context.getTaskRegistry().getActivityNames());
        return worker;
    }

    public WorkerFactory getFactory() {
        return factory;
    }

    public Worker getWorker() {
        return worker;
    }

    /** Starts polling and blocks until interrupted or the JVM shuts down. */
    public void run() {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down worker...");
            shutdown();
        }));

        factory.start();
        log.info("Worker started | task queue: {}", worker.getTaskQueue());

        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Interrupted, shutting down worker...");
            shutdown();
        }
    }

    /** Shuts the factory down and waits up to {@value #SHUTDOWN_TIMEOUT_SECONDS}s for in-flight tasks. */
    public void shutdown() {
        if (factory.isShutdown()) {
            return;
        }
        factory.shutdown();
        factory.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }
}
