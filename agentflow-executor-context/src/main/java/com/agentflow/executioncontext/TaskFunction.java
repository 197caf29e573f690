package com.agentflow.executioncontext;

/** Synchronous task body. Invoked inline by the executor. */
@FunctionalInterface
public interface TaskFunction<R> {

    R call(Object... args) throws Exception;
}
