package com.agentflow.executioncontext;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * A unit of work the executor can run locally or, once marked with an activity name, schedule as a
 * Temporal activity. Exactly one of the sync or async bodies is set. Instances are immutable;
 * {@link #asActivity(String)} returns a marked copy.
 *
 * @param <R> result type
 */
public final class Task<R> {

    private final TaskFunction<R> syncBody;
    private final AsyncTaskFunction<R> asyncBody;
    private final Class<R> resultType;
    private final String activityName;

    private Task(TaskFunction<R> syncBody, AsyncTaskFunction<R> asyncBody, Class<R> resultType, String activityName) {
        this.syncBody = syncBody;
        this.asyncBody = asyncBody;
        this.resultType = resultType;
        this.activityName = activityName;
    }

    /** Synchronous task with an untyped (Object) result. */
    @SuppressWarnings("unchecked")
    public static <R> Task<R> of(TaskFunction<R> body) {
        return new Task<>(Objects.requireNonNull(body, "body"), null, (Class<R>) Object.class, null);
    }

    /**
     * Synchronous task with a declared result type. The type is used to decode the activity result
     * when the task runs inside a workflow.
     */
    public static <R> Task<R> of(Class<R> resultType, TaskFunction<R> body) {
        return new Task<>(Objects.requireNonNull(body, "body"), null,
                Objects.requireNonNull(resultType, "resultType"), null);
    }

    @SuppressWarnings("unchecked")
    public static <R> Task<R> ofAsync(AsyncTaskFunction<R> body) {
        return new Task<>(null, Objects.requireNonNull(body, "body"), (Class<R>) Object.class, null);
    }

    public static <R> Task<R> ofAsync(Class<R> resultType, AsyncTaskFunction<R> body) {
        return new Task<>(null, Objects.requireNonNull(body, "body"),
                Objects.requireNonNull(resultType, "resultType"), null);
    }

    /**
     * Returns a copy marked as the activity {@code name}. The body is unchanged.
     *
     * @throws IllegalArgumentException if name is blank
     */
    public Task<R> asActivity(String name) {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("activity name must be non-blank");
        }
        return new Task<>(syncBody, asyncBody, resultType, name);
    }

    public boolean isAsync() {
        return asyncBody != null;
    }

    /** Whether this task carries an activity marker (see {@link #asActivity(String)}). */
    public boolean isActivity() {
        return activityName != null;
    }

    /** Activity name, or null when the task is not marked. */
    public String getActivityName() {
        return activityName;
    }

    public Class<R> getResultType() {
        return resultType;
    }

    /**
     * Runs the body in the calling thread. A sync body's value (or exception) completes the returned future;
     * an async body's future is returned as-is. Never throws.
     */
    public CompletableFuture<R> invoke(Object... args) {
        Object[] callArgs = args != null ? args : new Object[0];
        if (asyncBody != null) {
            CompletableFuture<R> future;
            try {
                future = asyncBody.call(callArgs);
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
            if (future == null) {
                return CompletableFuture.failedFuture(
                        new IllegalStateException("Async task returned null future: " + describe()));
            }
            return future;
        }
        try {
            return CompletableFuture.completedFuture(syncBody.call(callArgs));
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private String describe() {
        return activityName != null ? activityName : "<anonymous>";
    }

    @Override
    public String toString() {
        return "Task{" + describe() + (isAsync() ? ", async" : ", sync") + "}";
    }
}
