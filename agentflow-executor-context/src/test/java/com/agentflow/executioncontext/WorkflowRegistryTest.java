package com.agentflow.executioncontext;

import io.temporal.workflow.WorkflowInterface;
import io.temporal.workflow.WorkflowMethod;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkflowRegistryTest {

    @WorkflowInterface
    public interface ReportWorkflow {
        @WorkflowMethod
        String run(String topic);
    }

    public static class ReportWorkflowImpl implements ReportWorkflow {
        @Override
        public String run(String topic) {
            return "report:" + topic;
        }
    }

    @WorkflowInterface
    public interface RenamedWorkflow {
        @WorkflowMethod(name = "summarize")
        String run();
    }

    public static class RenamedWorkflowImpl implements RenamedWorkflow {
        @Override
        public String run() {
            return "ok";
        }
    }

    public static class NotAWorkflow {
    }

    @Test
    void workflowTypeOf_usesInterfaceSimpleNameByDefault() {
        assertEquals("ReportWorkflow", WorkflowRegistry.workflowTypeOf(ReportWorkflowImpl.class));
        assertEquals("ReportWorkflow", WorkflowRegistry.workflowTypeOf(ReportWorkflow.class));
    }

    @Test
    void workflowTypeOf_usesExplicitWorkflowMethodName() {
        assertEquals("summarize", WorkflowRegistry.workflowTypeOf(RenamedWorkflowImpl.class));
    }

    @Test
    void workflowTypeOf_rejectsPlainClass() {
        assertThrows(IllegalArgumentException.class, () -> WorkflowRegistry.workflowTypeOf(NotAWorkflow.class));
    }

    @Test
    void register_byClassUsesWorkflowType() {
        WorkflowRegistry registry = new WorkflowRegistry();

        String name = registry.register(ReportWorkflowImpl.class);

        assertEquals("ReportWorkflow", name);
        assertSame(ReportWorkflowImpl.class, registry.get("ReportWorkflow"));
        assertTrue(registry.contains("ReportWorkflow"));
    }

    @Test
    void register_byNameKeepsOrder() {
        WorkflowRegistry registry = new WorkflowRegistry();
        registry.register("report", ReportWorkflowImpl.class);
        registry.register("summary", RenamedWorkflowImpl.class);

        assertEquals(List.of("report", "summary"), List.copyOf(registry.getAll().keySet()));
        assertNull(registry.get("unknown"));
        assertFalse(registry.contains(null));
    }

    @Test
    void register_rejectsDuplicateName() {
        WorkflowRegistry registry = new WorkflowRegistry();
        registry.register("report", ReportWorkflowImpl.class);

        assertThrows(IllegalArgumentException.class, () -> registry.register("report", RenamedWorkflowImpl.class));
    }
}
