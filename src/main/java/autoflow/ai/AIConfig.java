package autoflow.ai;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Settings for the model-backed compilation path, read from
 * {@code config.properties} (and {@code config.local.properties}, which wins)
 * on the classpath.
 */
public class AIConfig {

    private static final Logger log = LoggerFactory.getLogger(AIConfig.class);

    private final Properties props;

    public AIConfig() {
        props = new Properties();
        load("/config.properties", true);
        load("/config.local.properties", false);
    }

    /** Package-private constructor for tests. */
    AIConfig(Properties props) {
        this.props = props;
    }

    // ── Property accessors ────────────────────────────────────────────────

    /** Whether the model path may be used; defaults to {@code true}. */
    public boolean isAiEnabled() {
        return Boolean.parseBoolean(props.getProperty("ai.enabled", "true").trim());
    }

    /** Base URL of the OpenAI-compatible endpoint; defaults to Ollama's local address. */
    public String getLlmBaseUrl() {
        return props.getProperty("ai.llm.base.url", "http://localhost:11434/v1").trim();
    }

    /** Bearer token for hosted endpoints; empty for local servers. */
    public String getLlmApiKey() {
        return props.getProperty("ai.llm.api.key", "").trim();
    }

    public String getLlmModel() {
        return props.getProperty("ai.llm.model", "qwen2.5:14b").trim();
    }

    /** Sampling temperature; defaults to {@code 0.1}. */
    public double getTemperature() {
        return parseDouble("ai.llm.temperature", 0.1);
    }

    public int getMaxTokens() {
        return parseInt("ai.llm.max.tokens", 4096);
    }

    /** Read timeout per attempt in seconds; defaults to {@code 120}. */
    public int getTimeoutSec() {
        return parseInt("ai.llm.timeout.sec", 120);
    }

    /** Retries on 5xx or I/O errors; defaults to {@code 2}. */
    public int getRetryCount() {
        return parseInt("ai.llm.retry.count", 2);
    }

    public long getRetryDelayMs() {
        return parseLong("ai.llm.retry.delay.ms", 2000L);
    }

    // ── Factory methods ───────────────────────────────────────────────────

    public LLMClient createLLMClient() {
        return new LLMClient(
                getLlmBaseUrl(),
                getLlmApiKey(),
                getLlmModel(),
                getTemperature(),
                getMaxTokens(),
                getTimeoutSec(),
                getRetryCount(),
                getRetryDelayMs()
        );
    }

    /**
     * Creates a generator backed by a fresh client, or returns null when
     * {@code ai.enabled=false}.
     */
    public ModelWorkflowGenerator createWorkflowGenerator() {
        if (!isAiEnabled()) {
            log.info("Model-backed compilation disabled (ai.enabled=false)");
            return null;
        }
        return new ModelWorkflowGenerator(createLLMClient());
    }

    // ── Property parsing helpers ──────────────────────────────────────────

    private void load(String resource, boolean warnIfMissing) {
        try (InputStream is = getClass().getResourceAsStream(resource)) {
            if (is != null) {
                props.load(is);
                log.debug("AIConfig loaded {} from classpath", resource);
            } else if (warnIfMissing) {
                log.warn("{} not found on classpath, using all defaults", resource);
            }
        } catch (IOException e) {
            log.warn("Could not load {}: {}", resource, e.getMessage());
        }
    }

    private double parseDouble(String key, double defaultVal) {
        String val = props.getProperty(key);
        if (val == null || val.isBlank()) return defaultVal;
        try {
            return Double.parseDouble(val.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid value for '{}': '{}', using default {}", key, val, defaultVal);
            return defaultVal;
        }
    }

    private int parseInt(String key, int defaultVal) {
        String val = props.getProperty(key);
        if (val == null || val.isBlank()) return defaultVal;
        try {
            return Integer.parseInt(val.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid value for '{}': '{}', using default {}", key, val, defaultVal);
            return defaultVal;
        }
    }

    private long parseLong(String key, long defaultVal) {
        String val = props.getProperty(key);
        if (val == null || val.isBlank()) return defaultVal;
        try {
            return Long.parseLong(val.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid value for '{}': '{}', using default {}", key, val, defaultVal);
            return defaultVal;
        }
    }
}
