package autoflow.ai;

import autoflow.model.SessionIO;
import autoflow.model.SessionTimeline;
import autoflow.model.WorkflowDefinition;
import autoflow.model.WorkflowIO;
import autoflow.model.WorkflowSchemaException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Produces a workflow by asking a language model to read a simplified session.
 * The model is treated as a black-box text generator: its answer is searched
 * for a JSON object, which is then schema-checked and bound like any other
 * externally produced workflow.
 */
public class ModelWorkflowGenerator {

    private static final Logger log = LoggerFactory.getLogger(ModelWorkflowGenerator.class);

    private static final Pattern JSON_FENCE = Pattern.compile(
            "```json\\s*([\\s\\S]*?)```", Pattern.CASE_INSENSITIVE);
    private static final Pattern ANY_FENCE = Pattern.compile(
            "```[a-zA-Z]*\\s*([\\s\\S]*?)```");

    private final LLMClient llm;

    public ModelWorkflowGenerator(LLMClient llm) {
        this.llm = llm;
    }

    /**
     * Generates a workflow for an already simplified session.
     *
     * @param session session whose events have been through the simplifier
     * @return the bound workflow, not yet enriched and without synthetic waits
     * @throws IOException             if the model call fails
     * @throws ModelResponseException  if no parseable JSON object can be extracted
     * @throws WorkflowSchemaException if the JSON does not describe a valid workflow
     */
    public WorkflowDefinition generate(SessionTimeline session) throws IOException {
        log.debug("Requesting workflow for session {} ({} events) from model {}",
                session.getSessionId(), session.getEventCount(), llm.getModel());

        String response = llm.complete(List.of(
                LLMClient.ChatMessage.system(buildSystemPrompt()),
                LLMClient.ChatMessage.user(buildUserPrompt(session))
        ));

        WorkflowDefinition workflow = parseResponse(response);
        log.info("Model produced workflow '{}' with {} steps for session {}",
                workflow.getWorkflowId(), workflow.getStepCount(), session.getSessionId());
        return workflow;
    }

    /**
     * Extracts and binds the workflow contained in a model answer.
     */
    WorkflowDefinition parseResponse(String response) {
        if (response == null || response.isBlank()) {
            throw new ModelResponseException("Model returned an empty response", response);
        }

        String json = extractJson(response);
        JsonNode tree;
        try {
            tree = WorkflowIO.getMapper().readTree(json);
        } catch (JsonProcessingException e) {
            throw new ModelResponseException("Model response is not valid JSON: "
                    + e.getOriginalMessage(), response, e);
        }
        if (tree == null || !tree.isObject()) {
            throw new ModelResponseException("Model response does not contain a JSON object", response);
        }

        try {
            return WorkflowIO.fromTree(tree);
        } catch (WorkflowSchemaException e) {
            log.warn("Model workflow rejected: {}", e.getMessage());
            log.debug("Rejected model response:\n{}", response);
            throw e;
        }
    }

    // ── Prompt builders ───────────────────────────────────────────────────

    String buildSystemPrompt() {
        return """
                You convert recorded desktop and browser user sessions into replayable workflow definitions.

                Output ONLY one JSON object with these fields:
                - workflow_id, name, description (strings, required)
                - version (default "1.0.0"), application (string)
                - steps (array, required), variables (object), preconditions (array of strings), metadata (object)

                Each step has:
                - step_id (unique string), description (human readable)
                - action: one of CLICK, RIGHT_CLICK, DOUBLE_CLICK, TYPE_TEXT, PRESS_KEY,
                  KEY_COMBINATION, SCROLL, DRAG, WAIT, NAVIGATE
                - selector: {"type": "text", "value": "<visible label>",
                  "fallback": {"type": "coordinates", "value": {"x": <number>, "y": <number>}}}
                  or {"type": "coordinates", "value": {"x": <number>, "y": <number>}}
                - parameters (object), wait_after (seconds, default 0.5), retry_count (default 3),
                  on_failure ("stop")

                Rules:
                - selector MUST be null for TYPE_TEXT, PRESS_KEY, KEY_COMBINATION, WAIT and NAVIGATE
                - CLICK, RIGHT_CLICK and DOUBLE_CLICK use a text selector with the element label and
                  a coordinates fallback taken from the event's x and y; use a bare coordinates
                  selector when the element has no name
                - DRAG uses a coordinates selector whose value has start_x, start_y, end_x, end_y,
                  and also puts end_x and end_y in parameters
                - TYPE_TEXT puts the text in parameters.text; PRESS_KEY puts the key in parameters.key;
                  KEY_COMBINATION puts the key list in parameters.keys
                - WAIT puts the duration in parameters.duration_seconds
                - Keep the order of the recorded events
                """;
    }

    String buildUserPrompt(SessionTimeline session) throws IOException {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Analyze this user session recording and generate a structured workflow definition.\n\n");
        sb.append("SESSION DATA:\n");
        sb.append(SessionIO.toJson(session)).append("\n\n");
        sb.append("Generate the workflow JSON:");
        return sb.toString();
    }

    // ── JSON extraction ───────────────────────────────────────────────────

    /**
     * Extracts the JSON text from a model answer: the body of a {@code ```json}
     * fence, else of any fence, else the outermost {@code {…}} span, else the
     * whole trimmed answer.
     */
    static String extractJson(String response) {
        Matcher json = JSON_FENCE.matcher(response);
        if (json.find()) {
            return json.group(1).strip();
        }
        Matcher any = ANY_FENCE.matcher(response);
        if (any.find()) {
            return any.group(1).strip();
        }
        int open = response.indexOf('{');
        int close = response.lastIndexOf('}');
        if (open >= 0 && close > open) {
            return response.substring(open, close + 1);
        }
        return response.strip();
    }
}
