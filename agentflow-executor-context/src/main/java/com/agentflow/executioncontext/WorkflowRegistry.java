package com.agentflow.executioncontext;

import io.temporal.common.metadata.POJOWorkflowImplMetadata;
import io.temporal.common.metadata.POJOWorkflowInterfaceMetadata;
import io.temporal.common.metadata.POJOWorkflowMethodMetadata;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Workflows known to the application, by name. Values are Temporal workflow implementation classes
 * (a class implementing an interface annotated with {@code @WorkflowInterface}).
 * The executor looks workflows up here to start them; the worker registers every class with Temporal.
 */
public final class WorkflowRegistry {

    private final Map<String, Class<?>> byName = Collections.synchronizedMap(new LinkedHashMap<>());

    /**
     * Registers an implementation under its Temporal workflow type (e.g. the interface's simple name).
     *
     * @return the name the workflow was registered under
     */
    public String register(Class<?> workflowImplementation) {
        Objects.requireNonNull(workflowImplementation, "workflowImplementation");
        String name = workflowTypeOf(workflowImplementation);
        register(name, workflowImplementation);
        return name;
    }

    /**
     * Registers an implementation under an application-chosen name.
     *
     * @throws IllegalArgumentException if the name is blank or already registered
     */
    public void register(String name, Class<?> workflowImplementation) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(workflowImplementation, "workflowImplementation");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must be non-blank");
        }
        if (byName.putIfAbsent(name, workflowImplementation) != null) {
            throw new IllegalArgumentException("Workflow already registered: " + name);
        }
    }

    /** Returns the implementation class registered under {@code name}, or null. */
    public Class<?> get(String name) {
        if (name == null) {
            return null;
        }
        return byName.get(name);
    }

    public boolean contains(String name) {
        return get(name) != null;
    }

    /** Snapshot of all registrations in registration order. */
    public Map<String, Class<?>> getAll() {
        synchronized (byName) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(byName));
        }
    }

    /**
     * Temporal workflow type for an implementation class or a {@code @WorkflowInterface} interface:
     * the {@code @WorkflowMethod} name when set, otherwise the interface simple name.
     *
     * @throws IllegalArgumentException if the class carries no workflow method
     */
    public static String workflowTypeOf(Class<?> workflowClass) {
        Objects.requireNonNull(workflowClass, "workflowClass");
        if (workflowClass.isInterface()) {
            return POJOWorkflowInterfaceMetadata.newInstance(workflowClass)
                    .getWorkflowType()
                    .orElseThrow(() -> new IllegalArgumentException(
                            "Workflow interface has no @WorkflowMethod: " + workflowClass.getName()));
        }
        List<POJOWorkflowMethodMetadata> methods = POJOWorkflowImplMetadata.newInstance(workflowClass).getWorkflowMethods();
        if (methods.isEmpty()) {
            throw new IllegalArgumentException("Workflow implementation has no @WorkflowMethod: " + workflowClass.getName());
        }
        return methods.get(0).getName();
    }
}
