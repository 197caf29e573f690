package com.agentflow.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Connection settings for the Temporal executor. Immutable once built.
 * <p>
 * Environment: AGENTFLOW_TEMPORAL_HOST, AGENTFLOW_TEMPORAL_NAMESPACE, AGENTFLOW_TEMPORAL_TASK_QUEUE,
 * AGENTFLOW_TEMPORAL_TIMEOUT_SECONDS, AGENTFLOW_TEMPORAL_ID_REUSE_POLICY,
 * AGENTFLOW_TEMPORAL_MAX_CONCURRENT_ACTIVITIES. File: the {@code temporal} section of a JSON config
 * (see {@link ExecutorConfigLoader}).
 */
public final class TemporalExecutorConfig {

    private static final Logger log = LoggerFactory.getLogger(TemporalExecutorConfig.class);

    private static final String ENV_HOST = "AGENTFLOW_TEMPORAL_HOST";
    private static final String ENV_NAMESPACE = "AGENTFLOW_TEMPORAL_NAMESPACE";
    private static final String ENV_TASK_QUEUE = "AGENTFLOW_TEMPORAL_TASK_QUEUE";
    private static final String ENV_TIMEOUT_SECONDS = "AGENTFLOW_TEMPORAL_TIMEOUT_SECONDS";
    private static final String ENV_ID_REUSE_POLICY = "AGENTFLOW_TEMPORAL_ID_REUSE_POLICY";
    private static final String ENV_MAX_CONCURRENT_ACTIVITIES = "AGENTFLOW_TEMPORAL_MAX_CONCURRENT_ACTIVITIES";

    public static final String DEFAULT_HOST = "localhost:7233";
    public static final String DEFAULT_NAMESPACE = "default";
    public static final String DEFAULT_TASK_QUEUE = "agentflow";
    public static final int DEFAULT_TIMEOUT_SECONDS = 60;
    public static final String DEFAULT_ID_REUSE_POLICY = "allow_duplicate";
    public static final int DEFAULT_MAX_CONCURRENT_ACTIVITIES = 10;

    /** Accepted values for {@link #getIdReusePolicy()}. */
    public static final List<String> ID_REUSE_POLICIES = List.of(
            "allow_duplicate", "allow_duplicate_failed_only", "reject_duplicate", "terminate_if_running");

    private final String host;
    private final String namespace;
    private final String taskQueue;
    private final int timeoutSeconds;
    private final String idReusePolicy;
    private final int maxConcurrentActivities;

    private TemporalExecutorConfig(Builder b) {
        this.host = b.host;
        this.namespace = b.namespace;
        this.taskQueue = b.taskQueue;
        this.timeoutSeconds = b.timeoutSeconds;
        this.idReusePolicy = b.idReusePolicy;
        this.maxConcurrentActivities = b.maxConcurrentActivities;
    }

    /** Temporal frontend target, e.g. {@code localhost:7233}. */
    public String getHost() {
        return host;
    }

    public String getNamespace() {
        return namespace;
    }

    /** Default task queue for workflow starts and activity scheduling. */
    public String getTaskQueue() {
        return taskQueue;
    }

    /** Schedule-to-close timeout (seconds) for activities scheduled by the executor. */
    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public Duration getTimeout() {
        return Duration.ofSeconds(timeoutSeconds);
    }

    /** Workflow id reuse policy name, lower snake case (one of {@link #ID_REUSE_POLICIES}). */
    public String getIdReusePolicy() {
        return idReusePolicy;
    }

    public int getMaxConcurrentActivities() {
        return maxConcurrentActivities;
    }

    public static TemporalExecutorConfig fromEnvironment() {
        return builder()
                .host(getEnv(ENV_HOST, DEFAULT_HOST))
                .namespace(getEnv(ENV_NAMESPACE, DEFAULT_NAMESPACE))
                .taskQueue(getEnv(ENV_TASK_QUEUE, DEFAULT_TASK_QUEUE))
                .timeoutSeconds(parseInt(ENV_TIMEOUT_SECONDS, DEFAULT_TIMEOUT_SECONDS))
                .idReusePolicy(getEnv(ENV_ID_REUSE_POLICY, DEFAULT_ID_REUSE_POLICY))
                .maxConcurrentActivities(parseInt(ENV_MAX_CONCURRENT_ACTIVITIES, DEFAULT_MAX_CONCURRENT_ACTIVITIES))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder pre-populated with this config's values. */
    public Builder toBuilder() {
        return new Builder()
                .host(host)
                .namespace(namespace)
                .taskQueue(taskQueue)
                .timeoutSeconds(timeoutSeconds)
                .idReusePolicy(idReusePolicy)
                .maxConcurrentActivities(maxConcurrentActivities);
    }

    private static int parseInt(String key, int defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring invalid {}={}; using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private static String getEnv(String key, String defaultValue) {
        String v = System.getenv(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    @Override
    public String toString() {
        return "TemporalExecutorConfig{host=" + host
                + ", namespace=" + namespace
                + ", taskQueue=" + taskQueue
                + ", timeoutSeconds=" + timeoutSeconds
                + ", idReusePolicy=" + idReusePolicy
                + ", maxConcurrentActivities=" + maxConcurrentActivities + "}";
    }

    public static final class Builder {
        private String host = DEFAULT_HOST;
        private String namespace = DEFAULT_NAMESPACE;
        private String taskQueue = DEFAULT_TASK_QUEUE;
        private int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
        private String idReusePolicy = DEFAULT_ID_REUSE_POLICY;
        private int maxConcurrentActivities = DEFAULT_MAX_CONCURRENT_ACTIVITIES;

        public Builder host(String host) {
            this.host = host != null ? host : DEFAULT_HOST;
            return this;
        }

        public Builder namespace(String namespace) {
            this.namespace = namespace != null ? namespace : DEFAULT_NAMESPACE;
            return this;
        }

        public Builder taskQueue(String taskQueue) {
            this.taskQueue = taskQueue != null ? taskQueue : DEFAULT_TASK_QUEUE;
            return this;
        }

        public Builder timeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
            return this;
        }

        public Builder idReusePolicy(String idReusePolicy) {
            this.idReusePolicy = idReusePolicy != null
                    ? idReusePolicy.trim().toLowerCase(Locale.ROOT)
                    : DEFAULT_ID_REUSE_POLICY;
            return this;
        }

        public Builder maxConcurrentActivities(int maxConcurrentActivities) {
            this.maxConcurrentActivities = maxConcurrentActivities;
            return this;
        }

        /**
         * @throws IllegalArgumentException if the timeout or concurrency limit is not positive, or the
         *                                  id reuse policy is not one of {@link #ID_REUSE_POLICIES}
         */
        public TemporalExecutorConfig build() {
            Objects.requireNonNull(host, "host");
            if (host.isBlank()) {
                throw new IllegalArgumentException("host must be non-blank");
            }
            if (taskQueue.isBlank()) {
                throw new IllegalArgumentException("taskQueue must be non-blank");
            }
            if (timeoutSeconds <= 0) {
                throw new IllegalArgumentException("timeoutSeconds must be positive: " + timeoutSeconds);
            }
            if (maxConcurrentActivities <= 0) {
                throw new IllegalArgumentException("maxConcurrentActivities must be positive: " + maxConcurrentActivities);
            }
            if (!ID_REUSE_POLICIES.contains(idReusePolicy)) {
                throw new IllegalArgumentException("Unknown idReusePolicy: " + idReusePolicy
                        + " (expected one of " + ID_REUSE_POLICIES + ")");
            }
            return new TemporalExecutorConfig(this);
        }
    }
}
