package autoflow.model;

import autoflow.SessionFixtures;
import autoflow.compiler.WorkflowCompiler;
import com.fasterxml.jackson.databind.JsonNode;
import org.testng.annotations.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link WorkflowIO}: canonical JSON output, schema
 * validation on read and file round trips.
 */
public class WorkflowIOTest {

    private static final String MINIMAL = """
            {"workflow_id": "wf", "name": "n", "description": "d", "steps": [
              {"step_id": "s1", "action": "PRESS_KEY", "description": "Press Enter key",
               "selector": null, "parameters": {"key": "enter"}}]}
            """;

    private static WorkflowDefinition compiled() {
        return new WorkflowCompiler().compileFromEvents(SessionFixtures.searchSession());
    }

    // ── Writing ───────────────────────────────────────────────────────────

    @Test
    public void toJson_usesSnakeCaseFieldNames() throws IOException {
        JsonNode tree = WorkflowIO.getMapper().readTree(WorkflowIO.toJson(compiled()));

        assertThat(tree.get("workflow_id").asText()).isEqualTo("session-1741974960-workflow");
        assertThat(tree.get("version").asText()).isEqualTo("1.0.0");
        JsonNode first = tree.get("steps").get(0);
        assertThat(first.get("step_id").asText()).isEqualTo("step-1");
        assertThat(first.get("wait_after").asDouble()).isEqualTo(0.5);
        assertThat(first.get("retry_count").asInt()).isEqualTo(3);
        assertThat(first.get("on_failure").asText()).isEqualTo("stop");
        assertThat(first.get("selector").get("type").asText()).isEqualTo("text");
        assertThat(first.get("selector").get("fallback").get("type").asText()).isEqualTo("coordinates");
    }

    @Test
    public void toJson_keyboardStepsCarryExplicitNullSelector() throws IOException {
        JsonNode tree = WorkflowIO.getMapper().readTree(WorkflowIO.toJson(compiled()));

        JsonNode typing = tree.get("steps").get(1);
        assertThat(typing.get("action").asText()).isEqualTo("TYPE_TEXT");
        assertThat(typing.has("selector")).isTrue();
        assertThat(typing.get("selector").isNull()).isTrue();
    }

    // ── Reading ───────────────────────────────────────────────────────────

    @Test
    public void fromJson_roundTripOfCompiledWorkflow_isEqual() throws IOException {
        WorkflowDefinition original = compiled();

        WorkflowDefinition back = WorkflowIO.fromJson(WorkflowIO.toJson(original));

        assertThat(back).isEqualTo(original);
    }

    @Test
    public void fromJson_missingOptionalFields_getDefaults() throws IOException {
        WorkflowDefinition wf = WorkflowIO.fromJson(MINIMAL);

        assertThat(wf.getVersion()).isEqualTo("1.0.0");
        assertThat(wf.getApplication()).isNull();
        WorkflowStep step = wf.getSteps().get(0);
        assertThat(step.getWaitAfter()).isEqualTo(WorkflowStep.DEFAULT_WAIT_AFTER);
        assertThat(step.getRetryCount()).isEqualTo(WorkflowStep.DEFAULT_RETRY_COUNT);
        assertThat(step.getOnFailure()).isEqualTo(FailurePolicy.STOP);
    }

    @Test
    public void fromJson_missingName_isSchemaViolation() {
        assertThatThrownBy(() -> WorkflowIO.fromJson(
                "{\"workflow_id\": \"wf\", \"description\": \"d\", \"steps\": []}"))
                .isInstanceOf(WorkflowSchemaException.class)
                .hasMessageContaining("name");
    }

    @Test
    public void fromJson_unknownAction_isSchemaViolation() {
        String json = MINIMAL.replace("PRESS_KEY", "HOVER");

        assertThatThrownBy(() -> WorkflowIO.fromJson(json))
                .isInstanceOf(WorkflowSchemaException.class);
    }

    @Test
    public void fromJson_keyboardStepWithSelector_isRejected() {
        String json = MINIMAL.replace("\"selector\": null",
                "\"selector\": {\"type\": \"text\", \"value\": \"Search\"}");

        assertThatThrownBy(() -> WorkflowIO.fromJson(json))
                .isInstanceOf(WorkflowSchemaException.class)
                .hasMessageContaining("must not carry a selector");
    }

    @Test
    public void fromJson_clickWithoutSelector_isRejected() {
        String json = MINIMAL.replace("PRESS_KEY", "CLICK");

        assertThatThrownBy(() -> WorkflowIO.fromJson(json))
                .isInstanceOf(WorkflowSchemaException.class)
                .hasMessageContaining("requires a selector");
    }

    @Test
    public void fromJson_dragWithoutEndPoint_isRejected() {
        String json = """
                {"workflow_id": "wf", "name": "n", "description": "d", "steps": [
                  {"step_id": "s1", "action": "DRAG", "description": "Drag",
                   "selector": {"type": "coordinates",
                                "value": {"start_x": 1, "start_y": 2, "end_x": 3, "end_y": 4}},
                   "parameters": {"end_x": 3}}]}
                """;

        assertThatThrownBy(() -> WorkflowIO.fromJson(json))
                .isInstanceOf(WorkflowSchemaException.class)
                .hasMessageContaining("end_y");
    }

    @Test
    public void fromJson_duplicateStepIds_isRejected() {
        String json = """
                {"workflow_id": "wf", "name": "n", "description": "d", "steps": [
                  {"step_id": "s1", "action": "PRESS_KEY", "description": "a", "selector": null,
                   "parameters": {"key": "tab"}},
                  {"step_id": "s1", "action": "PRESS_KEY", "description": "b", "selector": null,
                   "parameters": {"key": "enter"}}]}
                """;

        assertThatThrownBy(() -> WorkflowIO.fromJson(json))
                .isInstanceOf(WorkflowSchemaException.class)
                .hasMessageContaining("duplicate step_id 's1'");
    }

    @Test
    public void fromJson_negativeWaitAfter_isSchemaViolation() {
        String json = MINIMAL.replace("\"selector\": null", "\"selector\": null, \"wait_after\": -1");

        assertThatThrownBy(() -> WorkflowIO.fromJson(json))
                .isInstanceOf(WorkflowSchemaException.class);
    }

    @Test
    public void fromJson_notJson_throwsIOException() {
        assertThatThrownBy(() -> WorkflowIO.fromJson("{\"workflow_id\": "))
                .isInstanceOf(IOException.class);
    }

    @Test
    public void fromJson_topLevelArray_isSchemaViolation() {
        assertThatThrownBy(() -> WorkflowIO.fromJson("[]"))
                .isInstanceOf(WorkflowSchemaException.class)
                .hasMessageContaining("must be an object");
    }

    // ── Files ─────────────────────────────────────────────────────────────

    @Test
    public void writeThenRead_preservesWorkflow() throws IOException {
        Path dir = Files.createTempDirectory("autoflow-wf");
        Path file = dir.resolve("nested").resolve("search.json");
        WorkflowDefinition original = compiled();

        WorkflowIO.write(original, file);
        WorkflowDefinition back = WorkflowIO.read(file);

        assertThat(Files.exists(file)).isTrue();
        assertThat(back).isEqualTo(original);
    }

    @Test
    public void read_missingFile_throwsIOException() {
        Path missing = Path.of("does-not-exist-" + System.nanoTime() + ".json");

        assertThatThrownBy(() -> WorkflowIO.read(missing)).isInstanceOf(IOException.class);
    }
}
