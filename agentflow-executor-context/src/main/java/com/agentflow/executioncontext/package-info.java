/**
 * Application context consumed by the executor: the {@link com.agentflow.executioncontext.WorkflowRegistry}
 * of workflow implementations and the {@link com.agentflow.executioncontext.TaskRegistry} of activity-marked
 * {@link com.agentflow.executioncontext.Task}s.
 * <ul>
 *   <li>{@link com.agentflow.executioncontext.Task} – sync ({@link com.agentflow.executioncontext.TaskFunction})
 *       or async ({@link com.agentflow.executioncontext.AsyncTaskFunction}) unit of work, optionally named as an activity</li>
 *   <li>{@link com.agentflow.executioncontext.ExecutorContext} – holder passed to the executor and the worker</li>
 * </ul>
 */
package com.agentflow.executioncontext;
