package com.agentflow.worker;

import com.agentflow.executioncontext.Task;
import com.agentflow.executioncontext.TaskRegistry;
import io.temporal.activity.Activity;
import io.temporal.activity.DynamicActivity;
import io.temporal.common.converter.EncodedValues;
import io.temporal.failure.ApplicationFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletionException;

/**
 * Handles every activity invocation on the worker by activity type: the type is the activity name a
 * task was wrapped with, and the task is resolved from the {@link TaskRegistry}. Workflows schedule
 * these through {@link io.temporal.workflow.ActivityStub#execute(String, Class, Object...)}, so
 * Temporal event history shows the task's own name.
 */
public final class TaskDispatchActivity implements DynamicActivity {

    private static final Logger log = LoggerFactory.getLogger(TaskDispatchActivity.class);

    static final String TASK_NOT_FOUND = "TaskNotFound";

    private final TaskRegistry taskRegistry;

    public TaskDispatchActivity(TaskRegistry taskRegistry) {
        this.taskRegistry = Objects.requireNonNull(taskRegistry, "taskRegistry");
    }

    @Override
    public Object execute(EncodedValues args) {
        String activityType = Activity.getExecutionContext().getInfo().getActivityType();
        Task<?> task = taskRegistry.get(activityType);
        if (task == null) {
            throw ApplicationFailure.newNonRetryableFailure(
                    "No task registered for activity type: " + activityType, TASK_NOT_FOUND);
        }
        Object[] callArgs = new Object[args.getSize()];
        for (int i = 0; i < callArgs.length; i++) {
            callArgs[i] = args.get(i, Object.class);
        }
        log.debug("Dispatching activity {} with {} argument(s)", activityType, callArgs.length);
        try {
            return task.invoke(callArgs).join();
        } catch (CompletionException e) {
            throw Activity.wrap(e.getCause() != null ? e.getCause() : e);
        }
    }
}
