package com.agentflow.executioncontext;

import java.util.concurrent.CompletableFuture;

/** Asynchronous task body. The executor awaits the returned future. */
@FunctionalInterface
public interface AsyncTaskFunction<R> {

    CompletableFuture<R> call(Object... args);
}
