package com.agentflow.executor;

/**
 * Unchecked carrier for a checked exception thrown by a locally executed task.
 * Unchecked task failures are rethrown as-is and never wrapped.
 */
public final class TaskExecutionException extends RuntimeException {

    public TaskExecutionException(Throwable cause) {
        super("Task failed: " + cause.getMessage(), cause);
    }
}
