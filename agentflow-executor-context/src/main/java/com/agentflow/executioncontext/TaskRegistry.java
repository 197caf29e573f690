package com.agentflow.executioncontext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Activity-marked tasks by activity name. The worker's dispatching activity resolves incoming
 * activity invocations here.
 */
public final class TaskRegistry {

    private final Map<String, Task<?>> byActivityName = new ConcurrentHashMap<>();

    /**
     * @throws IllegalArgumentException if the task has no activity marker or the name is already registered
     */
    public void register(Task<?> task) {
        Objects.requireNonNull(task, "task");
        if (!task.isActivity()) {
            throw new IllegalArgumentException("Task must be wrapped as an activity before registration: " + task);
        }
        String name = task.getActivityName();
        if (byActivityName.putIfAbsent(name, task) != null) {
            throw new IllegalArgumentException("Activity already registered: " + name);
        }
    }

    /** Returns the task for {@code activityName}, or null. */
    public Task<?> get(String activityName) {
        if (activityName == null) {
            return null;
        }
        return byActivityName.get(activityName);
    }

    /** Registered activity names, sorted. */
    public List<String> getActivityNames() {
        List<String> names = new ArrayList<>(byActivityName.keySet());
        Collections.sort(names);
        return names;
    }

    public int size() {
        return byActivityName.size();
    }
}
