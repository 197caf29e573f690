package com.agentflow.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Reads {@link TemporalExecutorConfig} from the {@code temporal} section of a YAML or JSON config file.
 * Files ending in {@code .yaml} or {@code .yml} are read as YAML, anything else as JSON. Equivalent forms:
 * <pre>
 * execution_engine: temporal
 * temporal:
 *   host: "localhost:7233"
 *   namespace: "default"
 *   task_queue: "agentflow"
 * </pre>
 * <pre>
 * {
 *   "execution_engine": "temporal",
 *   "temporal": {
 *     "host": "localhost:7233",
 *     "namespace": "default",
 *     "task_queue": "agentflow",
 *     "timeout_seconds": 60,
 *     "id_reuse_policy": "allow_duplicate",
 *     "max_concurrent_activities": 10
 *   }
 * }
 * </pre>
 * Other top-level sections are ignored. Absent keys (or an absent {@code temporal} section) take defaults.
 */
public final class ExecutorConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ExecutorConfigLoader.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private ExecutorConfigLoader() {
    }

    /**
     * Loads the config file at {@code path}.
     *
     * @throws UncheckedIOException if the file cannot be read or is not valid YAML/JSON
     */
    public static TemporalExecutorConfig load(Path path) {
        Objects.requireNonNull(path, "path");
        String content;
        try {
            content = Files.readString(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read executor config " + path, e);
        }
        TemporalExecutorConfig config = parse(content, isYaml(path) ? YAML_MAPPER : MAPPER);
        log.info("Executor configuration loaded from file: {} ({})", path, config);
        return config;
    }

    /** Parses a JSON config document (the whole file, not only the temporal section). */
    public static TemporalExecutorConfig fromJson(String json) {
        return parse(json, MAPPER);
    }

    /** Parses a YAML config document such as {@code mcp_agent.config.yaml}. */
    public static TemporalExecutorConfig fromYaml(String yaml) {
        return parse(yaml, YAML_MAPPER);
    }

    static boolean isYaml(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return false;
        }
        String name = fileName.toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml");
    }

    private static TemporalExecutorConfig parse(String content, ObjectMapper mapper) {
        ConfigDocument doc;
        try {
            doc = mapper.readValue(content, ConfigDocument.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        TemporalSection t = doc != null && doc.temporal != null ? doc.temporal : new TemporalSection();
        return TemporalExecutorConfig.builder()
                .host(t.host)
                .namespace(t.namespace)
                .taskQueue(t.taskQueue)
                .timeoutSeconds(t.timeoutSeconds != null ? t.timeoutSeconds : TemporalExecutorConfig.DEFAULT_TIMEOUT_SECONDS)
                .idReusePolicy(t.idReusePolicy)
                .maxConcurrentActivities(t.maxConcurrentActivities != null
                        ? t.maxConcurrentActivities
                        : TemporalExecutorConfig.DEFAULT_MAX_CONCURRENT_ACTIVITIES)
                .build();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class ConfigDocument {
        @JsonProperty("temporal")
        TemporalSection temporal;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class TemporalSection {
        @JsonProperty("host")
        String host;
        @JsonProperty("namespace")
        String namespace;
        @JsonProperty("task_queue")
        String taskQueue;
        @JsonProperty("timeout_seconds")
        Integer timeoutSeconds;
        @JsonProperty("id_reuse_policy")
        String idReusePolicy;
        @JsonProperty("max_concurrent_activities")
        Integer maxConcurrentActivities;
    }
}
