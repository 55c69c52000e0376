package autoflow.compiler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Reads {@code config.properties} from the classpath and exposes typed
 * compiler settings with documented defaults.
 *
 * <p>Values can be overridden by a {@code config.local.properties} file on the
 * classpath (higher priority, not committed to VCS).
 */
public class CompilerConfig {

    private static final Logger log = LoggerFactory.getLogger(CompilerConfig.class);

    private static final String CONFIG_FILE       = "config.properties";
    private static final String CONFIG_LOCAL_FILE = "config.local.properties";

    // Property keys
    private static final String KEY_WAIT_MIN_GAP     = "compiler.wait.min.threshold.sec";
    private static final String KEY_WAIT_BUFFER      = "compiler.wait.buffer.sec";
    private static final String KEY_WAIT_MAX         = "compiler.wait.max.sec";
    private static final String KEY_STEP_WAIT_AFTER  = "compiler.step.wait.after.sec";
    private static final String KEY_STEP_RETRY_COUNT = "compiler.step.retry.count";
    private static final String KEY_DEFAULT_APP      = "ingest.default.application";

    // Defaults
    private static final double DEFAULT_WAIT_MIN_GAP     = 2.0;
    private static final double DEFAULT_WAIT_BUFFER      = 1.0;
    private static final double DEFAULT_WAIT_MAX         = 10.0;
    private static final double DEFAULT_STEP_WAIT_AFTER  = 0.5;
    private static final int    DEFAULT_STEP_RETRY_COUNT = 3;
    private static final String DEFAULT_APP              = "Firefox Browser";

    private final Properties props;

    /**
     * Loads configuration from the classpath.
     * {@code config.local.properties} values override {@code config.properties};
     * a missing base file means all defaults.
     */
    public CompilerConfig() {
        props = new Properties();
        load(CONFIG_FILE, true);
        load(CONFIG_LOCAL_FILE, false);
    }

    /**
     * Package-private constructor for tests: accepts an already-populated
     * {@link Properties} instance.
     */
    CompilerConfig(Properties props) {
        this.props = props;
    }

    // ── Accessors ──────────────────────────────────────────────────────────

    /** Minimum gap in seconds that triggers a wait step (default: 2.0). */
    public double getWaitMinGapSec() {
        return getDouble(KEY_WAIT_MIN_GAP, DEFAULT_WAIT_MIN_GAP);
    }

    /** Seconds added to an observed gap (default: 1.0). */
    public double getWaitBufferSec() {
        return getDouble(KEY_WAIT_BUFFER, DEFAULT_WAIT_BUFFER);
    }

    /** Upper bound on a synthetic wait in seconds (default: 10.0). */
    public double getWaitMaxSec() {
        return getDouble(KEY_WAIT_MAX, DEFAULT_WAIT_MAX);
    }

    /** Post-step delay written into synthesized steps (default: 0.5). */
    public double getStepWaitAfterSec() {
        return getDouble(KEY_STEP_WAIT_AFTER, DEFAULT_STEP_WAIT_AFTER);
    }

    /** Retry count written into synthesized steps (default: 3). */
    public int getStepRetryCount() {
        return getInt(KEY_STEP_RETRY_COUNT, DEFAULT_STEP_RETRY_COUNT);
    }

    /** Application name given to sessions converted from third-party recordings. */
    public String getDefaultApplication() {
        String raw = props.getProperty(KEY_DEFAULT_APP);
        return raw == null || raw.isBlank() ? DEFAULT_APP : raw.trim();
    }

    /** Wait thresholds as a single value for {@link WaitInserter}. */
    public WaitSettings getWaitSettings() {
        return new WaitSettings(getWaitMinGapSec(), getWaitBufferSec(), getWaitMaxSec());
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private void load(String resource, boolean warnIfMissing) {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(resource)) {
            if (is != null) {
                props.load(is);
                log.debug("Loaded {} from classpath", resource);
            } else if (warnIfMissing) {
                log.warn("{} not found on classpath, using all defaults", resource);
            }
        } catch (IOException e) {
            log.warn("Failed to read {}, ignoring it: {}", resource, e.getMessage());
        }
    }

    private double getDouble(String key, double defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid number for key '{}': '{}', using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private int getInt(String key, int defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid integer for key '{}': '{}', using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }
}
