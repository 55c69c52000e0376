package autoflow.compiler;

import autoflow.ingest.RecorderFormatConverter;
import autoflow.model.SessionTimeline;
import org.testng.annotations.Test;

import java.io.IOException;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link CompilerConfig}.
 *
 * <p>Tests use the package-private {@code CompilerConfig(Properties)} constructor
 * to avoid classpath file I/O.
 */
public class CompilerConfigTest {

    // ── Defaults ──────────────────────────────────────────────────────────

    @Test(description = "All accessors return documented defaults when properties are empty")
    public void testAllDefaults() {
        CompilerConfig cfg = new CompilerConfig(new Properties());

        assertThat(cfg.getWaitMinGapSec()).as("wait min gap").isEqualTo(2.0);
        assertThat(cfg.getWaitBufferSec()).as("wait buffer").isEqualTo(1.0);
        assertThat(cfg.getWaitMaxSec()).as("wait max").isEqualTo(10.0);
        assertThat(cfg.getStepWaitAfterSec()).as("step wait after").isEqualTo(0.5);
        assertThat(cfg.getStepRetryCount()).as("step retry count").isEqualTo(3);
        assertThat(cfg.getDefaultApplication()).as("default application").isEqualTo("Firefox Browser");
        assertThat(cfg.getWaitSettings()).isEqualTo(WaitSettings.DEFAULTS);
    }

    // ── Overrides ─────────────────────────────────────────────────────────

    @Test(description = "Values are read from properties and trimmed")
    public void testOverrides() {
        Properties p = new Properties();
        p.setProperty("compiler.wait.min.threshold.sec", " 3.5 ");
        p.setProperty("compiler.wait.buffer.sec", "0.5");
        p.setProperty("compiler.wait.max.sec", "30");
        p.setProperty("compiler.step.retry.count", "5");
        p.setProperty("ingest.default.application", "  Notepad ");

        CompilerConfig cfg = new CompilerConfig(p);

        assertThat(cfg.getWaitSettings()).isEqualTo(new WaitSettings(3.5, 0.5, 30.0));
        assertThat(cfg.getStepRetryCount()).isEqualTo(5);
        assertThat(cfg.getDefaultApplication()).isEqualTo("Notepad");
    }

    @Test(description = "Unparsable values fall back to defaults")
    public void testInvalidValuesUseDefaults() {
        Properties p = new Properties();
        p.setProperty("compiler.wait.max.sec", "ten");
        p.setProperty("compiler.step.retry.count", "3.7");
        p.setProperty("ingest.default.application", "   ");

        CompilerConfig cfg = new CompilerConfig(p);

        assertThat(cfg.getWaitMaxSec()).isEqualTo(10.0);
        assertThat(cfg.getStepRetryCount()).isEqualTo(3);
        assertThat(cfg.getDefaultApplication()).isEqualTo("Firefox Browser");
    }

    @Test(description = "The classpath config.properties is loaded by the public constructor")
    public void testClasspathConfigLoads() {
        CompilerConfig cfg = new CompilerConfig();

        assertThat(cfg.getWaitSettings()).isEqualTo(WaitSettings.DEFAULTS);
        assertThat(cfg.getDefaultApplication()).isEqualTo("Firefox Browser");
    }

    // ── Consumers ─────────────────────────────────────────────────────────

    @Test(description = "The recorder converter stamps the configured application on sessions")
    public void testConverterUsesConfiguredApplication() throws IOException {
        Properties p = new Properties();
        p.setProperty("ingest.default.application", "Outlook");

        SessionTimeline converted = new RecorderFormatConverter(new CompilerConfig(p))
                .convert("{\"metadata\": {\"startTimeSeconds\": 7}, \"actions\": []}");

        assertThat(converted.getApplication()).isEqualTo("Outlook");
    }
}
