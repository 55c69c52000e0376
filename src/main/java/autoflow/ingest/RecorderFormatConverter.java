package autoflow.ingest;

import autoflow.compiler.CompilerConfig;
import autoflow.model.EventData;
import autoflow.model.EventKind;
import autoflow.model.EventLog;
import autoflow.model.SessionTimeline;
import autoflow.model.UserIntent;
import autoflow.model.WorkflowIO;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Converts recordings made by the desktop action recorder into a
 * {@link SessionTimeline}.
 *
 * <p>The recorder writes {@code {"metadata": {...}, "actions": [...]}} where
 * each action has a {@code command}, a {@code timestamp}, an optional
 * {@code element} ({@code name}, {@code control_type}, {@code automation_id}),
 * {@code parameters} and an optional {@code screenshot}. Conversion is
 * best-effort: actions that cannot be converted are skipped with a warning.
 */
public class RecorderFormatConverter {

    private static final Logger log = LoggerFactory.getLogger(RecorderFormatConverter.class);

    private static final Map<String, EventKind> COMMANDS = Map.of(
            "CLICK",  EventKind.MOUSE_CLICK,
            "TYPE",   EventKind.TEXT_INPUT,
            "PRESS",  EventKind.KEY_PRESS,
            "SCROLL", EventKind.SCROLL,
            "DRAG",   EventKind.MOUSE_DRAG,
            "HOTKEY", EventKind.KEY_COMBINATION,
            "COPY",   EventKind.KEY_COMBINATION,
            "PASTE",  EventKind.KEY_COMBINATION);

    static final String CMD_STOP = "STOP";

    // Placeholders the recorder writes when UI Automation could not resolve the element
    private static final Set<String> IGNORED_NAMES          = Set.of("Error", "N/A", "Unknown", "");
    private static final Set<String> IGNORED_TYPES          = Set.of("Unknown", "");
    private static final Set<String> IGNORED_AUTOMATION_IDS = Set.of("N/A", "");

    private final String application;

    public RecorderFormatConverter(CompilerConfig config) {
        this(config.getDefaultApplication());
    }

    /**
     * @param application application name recorded on converted sessions
     */
    public RecorderFormatConverter(String application) {
        this.application = application;
    }

    // ── Public API ────────────────────────────────────────────────────────

    /**
     * Reads and converts a recorder file.
     *
     * @throws IOException if the file cannot be read or is not JSON
     */
    public SessionTimeline read(Path path) throws IOException {
        log.debug("Reading recorder file: {}", path);
        SessionTimeline session = convert(mapper().readTree(Files.readString(path)));
        log.info("Converted {} into session '{}' with {} events", path,
                session.getSessionId(), session.getEventCount());
        return session;
    }

    /**
     * Converts recorder JSON text.
     *
     * @throws IOException if the text is not JSON
     */
    public SessionTimeline convert(String json) throws IOException {
        return convert(mapper().readTree(json));
    }

    /** Converts an already-parsed recorder document. */
    public SessionTimeline convert(JsonNode root) {
        JsonNode metadata = root.path("metadata");
        JsonNode actions = root.path("actions");

        List<EventLog> events = new ArrayList<>();
        int index = 0;
        for (JsonNode action : actions) {
            convertAction(action, index++).ifPresent(events::add);
        }

        Instant start = parseStartTime(metadata.path("startTimeFormatted"));
        Instant end = events.isEmpty() ? start : events.get(events.size() - 1).getTimestamp();
        String sessionId = "session-" + (metadata.hasNonNull("startTimeSeconds")
                ? metadata.get("startTimeSeconds").asText()
                : "unknown");

        Map<String, Object> meta = metadata.isObject()
                ? mapper().convertValue(metadata, new TypeReference<LinkedHashMap<String, Object>>() {})
                : new LinkedHashMap<>();

        log.debug("Converted {} of {} recorder actions for session {}", events.size(), actions.size(), sessionId);
        return new SessionTimeline(sessionId, start, end, application, events, meta);
    }

    // ── Action conversion ─────────────────────────────────────────────────

    Optional<EventLog> convertAction(JsonNode action, int index) {
        String command = action.path("command").asText("");
        if (CMD_STOP.equals(command)) {
            return Optional.empty();
        }
        EventKind kind = COMMANDS.get(command);
        if (kind == null) {
            log.debug("Skipping action {} with unsupported command '{}'", index, command);
            return Optional.empty();
        }

        String rawTimestamp = action.path("timestamp").asText("");
        Instant timestamp;
        try {
            timestamp = parseTimestamp(rawTimestamp);
        } catch (DateTimeParseException e) {
            log.warn("Skipping action {} ({}): unparsable timestamp '{}'", index, command, rawTimestamp);
            return Optional.empty();
        }

        ObjectNode params = action.path("parameters").isObject()
                ? ((ObjectNode) action.get("parameters")).deepCopy()
                : mapper().createObjectNode();
        normalizeParameters(command, params);
        copyElement(action.path("element"), params);

        EventData data;
        try {
            data = mapper().treeToValue(params, EventData.class);
        } catch (JsonProcessingException e) {
            log.warn("Skipping action {} ({}): malformed parameters: {}", index, command, e.getOriginalMessage());
            return Optional.empty();
        }

        String screenshot = action.hasNonNull("screenshot") ? action.get("screenshot").asText() : null;
        return Optional.of(new EventLog(timestamp, kind, data, screenshot));
    }

    private static void normalizeParameters(String command, ObjectNode params) {
        JsonNode button = params.get("button");
        if (button != null && button.isTextual()) {
            params.put("button", button.asText().replace("Button.", "").toLowerCase(Locale.ROOT));
        }
        JsonNode key = params.get("key");
        if (key != null && key.isTextual() && key.asText().startsWith("Key.")) {
            params.put("key", key.asText().substring("Key.".length()).toLowerCase(Locale.ROOT));
        }

        if ("COPY".equals(command) || "PASTE".equals(command)) {
            UserIntent intent = "COPY".equals(command)
                    ? UserIntent.COPY_TO_CLIPBOARD
                    : UserIntent.PASTE_FROM_CLIPBOARD;
            params.set("user_intent", mapper().valueToTree(intent));
            params.put("clipboard_content", params.path("content").asText(""));
        }
    }

    private static void copyElement(JsonNode element, ObjectNode params) {
        String name = element.path("name").asText("");
        String type = element.path("control_type").asText("");
        String automationId = element.path("automation_id").asText("");

        if (!IGNORED_NAMES.contains(name)) {
            params.put("element_name", name);
        }
        if (!IGNORED_TYPES.contains(type)) {
            params.put("element_type", type);
        }
        if (!IGNORED_AUTOMATION_IDS.contains(automationId)) {
            params.put("automation_id", automationId);
        }
    }

    // ── Timestamps ────────────────────────────────────────────────────────

    /**
     * Parses a recorder timestamp. A stray {@code M} before a colon
     * ({@code 17:56M:47}) is removed; {@code Z} means UTC; a timestamp without
     * an offset is read as UTC.
     *
     * @throws DateTimeParseException if the text is not an ISO-8601 date-time
     */
    static Instant parseTimestamp(String raw) {
        String text = raw.trim().replace("M:", ":");
        if (text.length() > 10 && text.charAt(10) == ' ') {
            text = text.substring(0, 10) + 'T' + text.substring(11);
        }
        if (text.endsWith("Z")) {
            text = text.substring(0, text.length() - 1) + "+00:00";
        }
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
        }
    }

    private static Instant parseStartTime(JsonNode node) {
        if (node.isMissingNode() || node.isNull() || node.asText().isBlank()) {
            return Instant.now();
        }
        try {
            return parseTimestamp(node.asText());
        } catch (DateTimeParseException e) {
            log.warn("Unparsable startTimeFormatted '{}', using the current time", node.asText());
            return Instant.now();
        }
    }

    private static ObjectMapper mapper() {
        return WorkflowIO.getMapper();
    }
}
