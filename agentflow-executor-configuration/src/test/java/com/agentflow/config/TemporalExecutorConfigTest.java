package com.agentflow.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TemporalExecutorConfigTest {

    @Test
    void builder_appliesDefaults() {
        TemporalExecutorConfig config = TemporalExecutorConfig.builder().build();

        assertEquals("localhost:7233", config.getHost());
        assertEquals("default", config.getNamespace());
        assertEquals("agentflow", config.getTaskQueue());
        assertEquals(60, config.getTimeoutSeconds());
        assertEquals("allow_duplicate", config.getIdReusePolicy());
        assertEquals(10, config.getMaxConcurrentActivities());
    }

    @Test
    void builder_keepsExplicitValues() {
        TemporalExecutorConfig config = TemporalExecutorConfig.builder()
                .host("temporal.internal:7233")
                .namespace("test-namespace")
                .taskQueue("test-queue")
                .timeoutSeconds(10)
                .idReusePolicy("REJECT_DUPLICATE")
                .maxConcurrentActivities(4)
                .build();

        assertEquals("temporal.internal:7233", config.getHost());
        assertEquals("test-namespace", config.getNamespace());
        assertEquals("test-queue", config.getTaskQueue());
        assertEquals(10, config.getTimeout().getSeconds());
        assertEquals("reject_duplicate", config.getIdReusePolicy());
        assertEquals(4, config.getMaxConcurrentActivities());
    }

    @Test
    void toBuilder_copiesEveryField() {
        TemporalExecutorConfig original = TemporalExecutorConfig.builder()
                .namespace("ns")
                .taskQueue("q")
                .timeoutSeconds(5)
                .build();

        TemporalExecutorConfig copy = original.toBuilder().taskQueue("other").build();

        assertEquals("ns", copy.getNamespace());
        assertEquals("other", copy.getTaskQueue());
        assertEquals(5, copy.getTimeoutSeconds());
    }

    @Test
    void build_rejectsNonPositiveTimeout() {
        assertThrows(IllegalArgumentException.class,
                () -> TemporalExecutorConfig.builder().timeoutSeconds(0).build());
    }

    @Test
    void build_rejectsUnknownReusePolicy() {
        assertThrows(IllegalArgumentException.class,
                () -> TemporalExecutorConfig.builder().idReusePolicy("sometimes").build());
    }

    @Test
    void build_rejectsBlankTaskQueue() {
        assertThrows(IllegalArgumentException.class,
                () -> TemporalExecutorConfig.builder().taskQueue("  ").build());
    }
}
