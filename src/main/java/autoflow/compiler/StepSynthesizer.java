package autoflow.compiler;

import autoflow.model.ActionType;
import autoflow.model.CoordinateValue;
import autoflow.model.CoordinatesSelector;
import autoflow.model.EventData;
import autoflow.model.EventLog;
import autoflow.model.Selector;
import autoflow.model.TextSelector;
import autoflow.model.UserIntent;
import autoflow.model.WorkflowStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Turns one simplified event into one workflow step: picks the action,
 * builds the selector, writes the description and fills the parameters.
 *
 * <p>Output is fully determined by the event; descriptions come from fixed
 * templates keyed on element type and name.
 */
public class StepSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(StepSynthesizer.class);

    static final String STEP_ID_PREFIX    = "step-";
    static final int    CLIPBOARD_PREVIEW = 50;

    private final double waitAfter;
    private final int retryCount;

    public StepSynthesizer() {
        this(WorkflowStep.DEFAULT_WAIT_AFTER, WorkflowStep.DEFAULT_RETRY_COUNT);
    }

    /**
     * @param waitAfter  post-step delay in seconds applied to every synthesized step
     * @param retryCount retry count applied to every synthesized step
     */
    public StepSynthesizer(double waitAfter, int retryCount) {
        this.waitAfter  = waitAfter;
        this.retryCount = retryCount;
    }

    /**
     * Synthesizes steps for a whole event list. Step ids are {@code step-1},
     * {@code step-2}, … counting only events that produce a step.
     */
    public List<WorkflowStep> synthesizeAll(List<EventLog> events) {
        List<WorkflowStep> steps = new ArrayList<>();
        int number = 1;
        for (EventLog event : events) {
            Optional<WorkflowStep> step = synthesize(event, number);
            if (step.isPresent()) {
                steps.add(step.get());
                number++;
            }
        }
        log.debug("Synthesized {} steps from {} events", steps.size(), events.size());
        return steps;
    }

    /**
     * Synthesizes the step for a single event.
     *
     * @param event      simplified event
     * @param stepNumber 1-based number used for the step id
     * @return the step, or empty for events that are not actions (screenshots)
     */
    public Optional<WorkflowStep> synthesize(EventLog event, int stepNumber) {
        String id = STEP_ID_PREFIX + stepNumber;
        EventData data = event.getData();

        WorkflowStep step = switch (event.getKind()) {
            case MOUSE_CLICK        -> click(id, data);
            case MOUSE_DOUBLE_CLICK -> new WorkflowStep(id, ActionType.DOUBLE_CLICK,
                    describePointer(ActionType.DOUBLE_CLICK, data), selectorFor(data), Map.of());
            case MOUSE_DRAG         -> drag(id, data);
            case TEXT_INPUT         -> typeText(id, data);
            case KEY_PRESS          -> pressKey(id, data);
            case KEY_COMBINATION    -> keyCombination(id, data);
            case SCROLL             -> scroll(id, data);
            case NAVIGATION         -> navigate(id, data);
            case SCREENSHOT         -> null;
        };

        if (step == null) {
            return Optional.empty();
        }
        step.setWaitAfter(waitAfter);
        step.setRetryCount(retryCount);
        step.setScreenshotBefore(event.getScreenshotRef());
        return Optional.of(step);
    }

    // ── Per-kind builders ─────────────────────────────────────────────────

    private WorkflowStep click(String id, EventData data) {
        String button = data.getButton() != null ? data.getButton() : "left";
        ActionType action = "right".equalsIgnoreCase(button) ? ActionType.RIGHT_CLICK : ActionType.CLICK;

        Map<String, Object> params = new LinkedHashMap<>();
        if (!"left".equalsIgnoreCase(button)) {
            params.put("button", button);
        }
        return new WorkflowStep(id, action, describePointer(action, data), selectorFor(data), params);
    }

    private WorkflowStep drag(String id, EventData data) {
        Double startX = orZero(data.getStartX());
        Double startY = orZero(data.getStartY());
        Double endX   = orZero(data.getEndX());
        Double endY   = orZero(data.getEndY());

        String path = "from (" + CoordinateValue.format(startX) + ", " + CoordinateValue.format(startY)
                + ") to (" + CoordinateValue.format(endX) + ", " + CoordinateValue.format(endY) + ")";
        String description = data.getUserIntent() == UserIntent.SELECT_TEXT_FOR_COPY
                ? "Select text by dragging " + path
                : "Drag " + path;

        // end_x/end_y repeated in parameters for consumers that never read the selector
        Map<String, Object> params = new LinkedHashMap<>();
        params.put(WorkflowStep.PARAM_END_X, endX);
        params.put(WorkflowStep.PARAM_END_Y, endY);

        return new WorkflowStep(id, ActionType.DRAG, description,
                CoordinatesSelector.path(startX, startY, endX, endY), params);
    }

    private WorkflowStep typeText(String id, EventData data) {
        String text = data.getText() != null ? data.getText() : "";
        int grouped = data.getGroupedFrom() != null ? data.getGroupedFrom() : 0;

        StringBuilder description = new StringBuilder(grouped > 1
                ? "Type complete text: '" + text + "'"
                : "Type '" + text + "'");

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("text", text);
        if (data.hasElementName()) {
            description.append(" into '").append(data.getElementName()).append("'");
            params.put("target", data.getElementName());
        }
        return new WorkflowStep(id, ActionType.TYPE_TEXT, description.toString(), null, params);
    }

    private WorkflowStep pressKey(String id, EventData data) {
        String key = KeyNames.canonical(data.getKey());
        String display = KeyNames.display(key);
        String description = data.getUserIntent() == UserIntent.SUBMIT_INPUT
                ? "Submit by pressing " + display
                : "Press " + display + " key";

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("key", key);
        return new WorkflowStep(id, ActionType.PRESS_KEY, description, null, params);
    }

    private WorkflowStep keyCombination(String id, EventData data) {
        UserIntent intent = data.getUserIntent();
        String clipboard = data.getClipboardContent() != null ? data.getClipboardContent() : "";
        Map<String, Object> params = new LinkedHashMap<>();

        if (intent == UserIntent.COPY_TO_CLIPBOARD || intent == UserIntent.PASTE_FROM_CLIPBOARD) {
            boolean copy = intent == UserIntent.COPY_TO_CLIPBOARD;
            String preview = preview(clipboard);
            String description;
            if (!preview.isEmpty()) {
                description = (copy ? "Copy text to clipboard: '" : "Paste text from clipboard: '") + preview + "'";
            } else {
                description = copy ? "Copy selected text to clipboard (Ctrl+C)" : "Paste from clipboard (Ctrl+V)";
            }
            params.put("keys", List.of("Ctrl", copy ? "C" : "V"));
            params.put("clipboard_content", clipboard);
            return new WorkflowStep(id, ActionType.KEY_COMBINATION, description, null, params);
        }

        List<String> keys = data.getKeys() != null ? data.getKeys() : List.of();
        params.put("keys", new ArrayList<>(keys));
        return new WorkflowStep(id, ActionType.KEY_COMBINATION,
                "Press " + KeyNames.formatCombination(keys), null, params);
    }

    private WorkflowStep scroll(String id, EventData data) {
        Double deltaY = orZero(data.getDeltaY());
        String direction = deltaY > 0 ? "down" : "up";

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("delta_x", orZero(data.getDeltaX()));
        params.put("delta_y", deltaY);
        return new WorkflowStep(id, ActionType.SCROLL, "Scroll " + direction,
                CoordinatesSelector.point(orZero(data.getX()), orZero(data.getY())), params);
    }

    private WorkflowStep navigate(String id, EventData data) {
        String url = data.getUrl() != null ? data.getUrl() : "";
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("url", url);
        return new WorkflowStep(id, ActionType.NAVIGATE, "Navigate to " + url, null, params);
    }

    // ── Shared helpers ────────────────────────────────────────────────────

    /**
     * Text selector on the element name with a coordinate fallback, or a bare
     * coordinate selector when the element has no name.
     */
    static Selector selectorFor(EventData data) {
        CoordinatesSelector point = CoordinatesSelector.point(orZero(data.getX()), orZero(data.getY()));
        if (data.hasElementName()) {
            return new TextSelector(data.getElementName(), point);
        }
        return point;
    }

    /** Description of a click-family action from element name/type heuristics. */
    static String describePointer(ActionType action, EventData data) {
        String verb = switch (action) {
            case RIGHT_CLICK  -> "Right-click";
            case DOUBLE_CLICK -> "Double-click";
            default           -> "Click";
        };

        if (!data.hasElementName()) {
            return verb + " at coordinates (" + CoordinateValue.format(orZero(data.getX())) + ", "
                    + CoordinateValue.format(orZero(data.getY())) + ")";
        }

        String name = data.getElementName();
        String lower = name.toLowerCase(Locale.ROOT);
        if (lower.contains("search") || lower.contains("address")) {
            return action == ActionType.CLICK
                    ? "Click on search/address bar: '" + name + "'"
                    : verb + " on '" + name + "'";
        }

        String type = data.getElementType() != null ? data.getElementType() : "";
        switch (type) {
            case "Button":
                return verb + " the '" + name + "' button";
            case "Hyperlink":
                return verb + " on '" + name + "' link";
            case "ListItem":
                return "Select '" + name + "' from menu";
            case "Edit":
            case "ComboBox":
                return verb + " on '" + name + "' input field";
            default:
                return verb + " on '" + name + "'";
        }
    }

    private static String preview(String clipboard) {
        String trimmed = clipboard.strip();
        return trimmed.length() > CLIPBOARD_PREVIEW ? trimmed.substring(0, CLIPBOARD_PREVIEW) : trimmed;
    }

    private static Double orZero(Double value) {
        return value != null ? value : 0.0;
    }
}
