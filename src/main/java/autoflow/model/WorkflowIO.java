package autoflow.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

/**
 * Reads and writes {@link WorkflowDefinition} objects in their canonical JSON form.
 *
 * <p>On read: validates the JSON against {@code workflow-schema.json} before
 * binding, then lets the model constructors enforce step invariants. Both
 * kinds of violation surface as {@link WorkflowSchemaException}; malformed JSON
 * surfaces as {@link IOException}.
 *
 * <p>On write: pretty-prints; field names are the snake_case names of the model.
 */
public class WorkflowIO {

    private static final Logger log = LoggerFactory.getLogger(WorkflowIO.class);
    private static final String SCHEMA_RESOURCE = "/workflow-schema.json";

    /** Singleton ObjectMapper; thread-safe after configuration. */
    private static final ObjectMapper MAPPER;

    static {
        MAPPER = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /** Loaded once from classpath; null if schema resource is missing. */
    private static volatile JsonSchema JSON_SCHEMA = null;

    private WorkflowIO() {}

    // ── Public API ────────────────────────────────────────────────────────

    /**
     * Reads a workflow from a JSON file.
     *
     * @throws IOException             if the file cannot be read or is not JSON
     * @throws WorkflowSchemaException if the JSON does not describe a valid workflow
     */
    public static WorkflowDefinition read(Path path) throws IOException {
        log.debug("Reading workflow from: {}", path);
        WorkflowDefinition workflow = fromJson(Files.readString(path));
        log.info("Loaded workflow '{}' with {} steps from {}", workflow.getWorkflowId(),
                workflow.getStepCount(), path);
        return workflow;
    }

    /**
     * Writes a workflow to a JSON file (pretty-printed). Parent directories are created.
     */
    public static void write(WorkflowDefinition workflow, Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        MAPPER.writeValue(path.toFile(), workflow);
        log.info("Wrote workflow '{}' ({} steps) to {}", workflow.getWorkflowId(),
                workflow.getStepCount(), path);
    }

    /** Serializes a workflow to its canonical JSON string. */
    public static String toJson(WorkflowDefinition workflow) throws IOException {
        return MAPPER.writeValueAsString(workflow);
    }

    /**
     * Parses and validates a workflow from a JSON string.
     *
     * @throws IOException             if the text is not JSON
     * @throws WorkflowSchemaException if the JSON does not describe a valid workflow
     */
    public static WorkflowDefinition fromJson(String json) throws IOException {
        return fromTree(MAPPER.readTree(json));
    }

    /**
     * Validates and binds an already-parsed JSON tree.
     *
     * @throws WorkflowSchemaException if the tree does not describe a valid workflow
     */
    public static WorkflowDefinition fromTree(JsonNode tree) {
        if (tree == null || !tree.isObject()) {
            throw new WorkflowSchemaException("Workflow JSON must be an object");
        }
        validateSchema(tree);
        try {
            return MAPPER.treeToValue(tree, WorkflowDefinition.class);
        } catch (JsonProcessingException e) {
            WorkflowSchemaException cause = findSchemaCause(e);
            if (cause != null) {
                throw cause;
            }
            if (e instanceof MismatchedInputException) {
                throw new WorkflowSchemaException("Workflow JSON has an invalid shape: "
                        + e.getOriginalMessage(), e);
            }
            throw new WorkflowSchemaException("Workflow JSON could not be bound: " + e.getOriginalMessage(), e);
        }
    }

    /** Returns the shared ObjectMapper (for use in tests and other modules). */
    public static ObjectMapper getMapper() { return MAPPER; }

    // ── Schema validation ─────────────────────────────────────────────────

    private static void validateSchema(JsonNode tree) {
        JsonSchema schema = getSchema();
        if (schema == null) {
            log.warn("workflow-schema.json not found on classpath, skipping schema validation");
            return;
        }
        Set<ValidationMessage> errors = schema.validate(tree);
        if (!errors.isEmpty()) {
            StringBuilder sb = new StringBuilder("Workflow schema validation failed:\n");
            errors.forEach(e -> sb.append("  ").append(e.getMessage()).append("\n"));
            throw new WorkflowSchemaException(sb.toString().trim());
        }
    }

    private static JsonSchema getSchema() {
        if (JSON_SCHEMA == null) {
            synchronized (WorkflowIO.class) {
                if (JSON_SCHEMA == null) {
                    try (InputStream is = WorkflowIO.class.getResourceAsStream(SCHEMA_RESOURCE)) {
                        if (is == null) {
                            log.warn("Schema resource not found: {}", SCHEMA_RESOURCE);
                            return null;
                        }
                        JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
                        JSON_SCHEMA = factory.getSchema(is);
                        log.debug("JSON schema loaded from classpath: {}", SCHEMA_RESOURCE);
                    } catch (IOException e) {
                        log.warn("Failed to load schema: {}", e.getMessage());
                    }
                }
            }
        }
        return JSON_SCHEMA;
    }

    private static WorkflowSchemaException findSchemaCause(Throwable t) {
        Throwable cur = t;
        while (cur != null) {
            if (cur instanceof WorkflowSchemaException) {
                return (WorkflowSchemaException) cur;
            }
            cur = cur.getCause();
        }
        return null;
    }
}
