package com.phillippitts.docassist.config.properties;

import com.phillippitts.docassist.domain.TaskType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Settings for inference capabilities: where the model server lives, how long each call may
 * take, and which models each task type prefers.
 *
 * <p>Properties:
 * <ul>
 *   <li>capability.base-url - local model server (default: http://127.0.0.1:11434)</li>
 *   <li>capability.pinned - capability the user pinned; empty for automatic ranking</li>
 *   <li>capability.request-timeout-ms - per-call timeout (default: 30000)</li>
 *   <li>capability.long-request-timeout-ms - per-call timeout for large payloads (default: 120000)</li>
 *   <li>capability.long-payload-threshold-chars - payload size that selects the long timeout (default: 2000)</li>
 *   <li>capability.probe-timeout-ms - availability probe timeout (default: 3000)</li>
 *   <li>capability.probe-ttl-ms - how long a probe result stays fresh (default: 30000)</li>
 *   <li>capability.priorities.&lt;TASK_TYPE&gt; - ordered hint list per task type</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "capability")
@Validated
public class CapabilityProperties {

    @NotBlank
    private String baseUrl = "http://127.0.0.1:11434";

    private String pinned = "";

    @Positive(message = "Request timeout must be positive")
    private long requestTimeoutMs = 30_000;

    @Positive(message = "Long request timeout must be positive")
    private long longRequestTimeoutMs = 120_000;

    @Positive(message = "Long payload threshold must be positive")
    private int longPayloadThresholdChars = 2_000;

    @Positive(message = "Probe timeout must be positive")
    private long probeTimeoutMs = 3_000;

    @Positive(message = "Probe TTL must be positive")
    private long probeTtlMs = 30_000;

    private Map<TaskType, List<String>> priorities = defaultPriorities();

    /** Default hint table: small models first for lookups, larger models first for long context. */
    public static Map<TaskType, List<String>> defaultPriorities() {
        Map<TaskType, List<String>> table = new EnumMap<>(TaskType.class);
        table.put(TaskType.WORD_LOOKUP, List.of("llama3.2:1b", "qwen2.5:1.5b", "llama3.2:3b"));
        table.put(TaskType.PAGE_SUMMARY, List.of("llama3.2:3b", "llama3.2:1b", "qwen2.5:1.5b"));
        table.put(TaskType.EMAIL_SUMMARY, List.of("llama3.2:3b", "llama3.2:1b", "qwen2.5:3b"));
        table.put(TaskType.QUESTION_ANSWER, List.of("llama3.2:3b", "qwen2.5:3b", "llama3.1:8b"));
        return table;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getPinned() {
        return pinned;
    }

    public void setPinned(String pinned) {
        this.pinned = pinned;
    }

    public long getRequestTimeoutMs() {
        return requestTimeoutMs;
    }

    public void setRequestTimeoutMs(long requestTimeoutMs) {
        this.requestTimeoutMs = requestTimeoutMs;
    }

    public long getLongRequestTimeoutMs() {
        return longRequestTimeoutMs;
    }

    public void setLongRequestTimeoutMs(long longRequestTimeoutMs) {
        this.longRequestTimeoutMs = longRequestTimeoutMs;
    }

    public int getLongPayloadThresholdChars() {
        return longPayloadThresholdChars;
    }

    public void setLongPayloadThresholdChars(int longPayloadThresholdChars) {
        this.longPayloadThresholdChars = longPayloadThresholdChars;
    }

    public long getProbeTimeoutMs() {
        return probeTimeoutMs;
    }

    public void setProbeTimeoutMs(long probeTimeoutMs) {
        this.probeTimeoutMs = probeTimeoutMs;
    }

    public long getProbeTtlMs() {
        return probeTtlMs;
    }

    public void setProbeTtlMs(long probeTtlMs) {
        this.probeTtlMs = probeTtlMs;
    }

    public Map<TaskType, List<String>> getPriorities() {
        return priorities;
    }

    /** Entries given in configuration replace the defaults for their task type only. */
    public void setPriorities(Map<TaskType, List<String>> priorities) {
        Map<TaskType, List<String>> merged = defaultPriorities();
        if (priorities != null) {
            merged.putAll(priorities);
        }
        this.priorities = merged;
    }
}
