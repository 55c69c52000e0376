package autoflow.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One entry of a compiled workflow. List position in the owning
 * {@link WorkflowDefinition} is execution order.
 *
 * <p>The shape is checked when the step is built, whether by the synthesizer
 * or by JSON binding of a model-produced workflow:
 * <ul>
 *   <li>{@code step_id}, {@code action} and {@code description} are required</li>
 *   <li>keyboard actions carry no selector; mouse actions always carry one</li>
 *   <li>{@code DRAG} requires {@code end_x}/{@code end_y} parameters</li>
 *   <li>{@code WAIT} requires a {@code duration_seconds} parameter</li>
 * </ul>
 * Violations raise {@link WorkflowSchemaException}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WorkflowStep {

    public static final double DEFAULT_WAIT_AFTER  = 0.5;
    public static final int    DEFAULT_RETRY_COUNT = 3;

    public static final String PARAM_END_X            = "end_x";
    public static final String PARAM_END_Y            = "end_y";
    public static final String PARAM_DURATION_SECONDS = "duration_seconds";

    @JsonProperty("step_id")
    private final String stepId;

    @JsonProperty("action")
    private final ActionType action;

    @JsonProperty("description")
    private final String description;

    @JsonProperty("selector")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    private final Selector selector;

    @JsonProperty("parameters")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    private final Map<String, Object> parameters;

    /** Seconds the replay engine pauses after this step. */
    @JsonProperty("wait_after")
    private double waitAfter = DEFAULT_WAIT_AFTER;

    @JsonProperty("retry_count")
    private int retryCount = DEFAULT_RETRY_COUNT;

    @JsonProperty("on_failure")
    private FailurePolicy onFailure = FailurePolicy.STOP;

    @JsonProperty("screenshot_before")
    private String screenshotBefore;

    @JsonProperty("screenshot_after")
    private String screenshotAfter;

    @JsonCreator
    public WorkflowStep(@JsonProperty("step_id") String stepId,
                        @JsonProperty("action") ActionType action,
                        @JsonProperty("description") String description,
                        @JsonProperty("selector") Selector selector,
                        @JsonProperty("parameters") Map<String, Object> parameters) {
        this.stepId      = stepId;
        this.action      = action;
        this.description = description;
        this.selector    = selector;
        this.parameters  = parameters != null ? new LinkedHashMap<>(parameters) : new LinkedHashMap<>();
        validate();
    }

    // ── Getters ──────────────────────────────────────────────────────────

    public String              getStepId()           { return stepId; }
    public ActionType          getAction()           { return action; }
    public String              getDescription()      { return description; }
    public Selector            getSelector()         { return selector; }
    public Map<String, Object> getParameters()       { return parameters; }
    public double              getWaitAfter()        { return waitAfter; }
    public int                 getRetryCount()       { return retryCount; }
    public FailurePolicy       getOnFailure()        { return onFailure; }
    public String              getScreenshotBefore() { return screenshotBefore; }
    public String              getScreenshotAfter()  { return screenshotAfter; }

    // ── Setters (execution policy and screenshot refs only) ──────────────

    public void setWaitAfter(double waitAfter)              { this.waitAfter = waitAfter; }
    public void setRetryCount(int retryCount)               { this.retryCount = retryCount; }
    public void setOnFailure(FailurePolicy onFailure) {
        this.onFailure = onFailure != null ? onFailure : FailurePolicy.STOP;
    }
    public void setScreenshotBefore(String ref)             { this.screenshotBefore = ref; }
    public void setScreenshotAfter(String ref)              { this.screenshotAfter = ref; }

    // ── Convenience ──────────────────────────────────────────────────────

    /** String parameter, or {@code null} when absent. */
    public String stringParam(String name) {
        Object v = parameters.get(name);
        return v != null ? v.toString() : null;
    }

    /** Numeric parameter as a double, or {@code null} when absent or not a number. */
    public Double doubleParam(String name) {
        Object v = parameters.get(name);
        if (v instanceof Number) {
            return ((Number) v).doubleValue();
        }
        if (v instanceof String) {
            try {
                return Double.parseDouble(((String) v).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /** The fallback coordinates of a text selector, or {@code null}. */
    @JsonIgnore
    public CoordinateValue getFallbackCoordinates() {
        if (selector instanceof TextSelector && ((TextSelector) selector).hasFallback()) {
            return ((TextSelector) selector).getFallback().getValue();
        }
        return null;
    }

    /** Copy of this step with a different selector; execution settings are kept. */
    public WorkflowStep withSelector(Selector newSelector) {
        WorkflowStep copy = new WorkflowStep(stepId, action, description, newSelector, parameters);
        copy.waitAfter        = waitAfter;
        copy.retryCount       = retryCount;
        copy.onFailure        = onFailure;
        copy.screenshotBefore = screenshotBefore;
        copy.screenshotAfter  = screenshotAfter;
        return copy;
    }

    // ── Validation ───────────────────────────────────────────────────────

    private void validate() {
        if (stepId == null || stepId.isBlank()) {
            throw new WorkflowSchemaException("Workflow step is missing required field 'step_id'");
        }
        if (action == null) {
            throw new WorkflowSchemaException("Step '" + stepId + "' is missing required field 'action'");
        }
        if (description == null) {
            throw new WorkflowSchemaException("Step '" + stepId + "' is missing required field 'description'");
        }
        if (action.isKeyboard() && selector != null) {
            throw new WorkflowSchemaException(
                    "Step '" + stepId + "': keyboard action " + action + " must not carry a selector");
        }
        if (action.isMouse() && selector == null) {
            throw new WorkflowSchemaException(
                    "Step '" + stepId + "': mouse action " + action + " requires a selector");
        }
        if (action == ActionType.DRAG
                && (!parameters.containsKey(PARAM_END_X) || !parameters.containsKey(PARAM_END_Y))) {
            throw new WorkflowSchemaException(
                    "Step '" + stepId + "': DRAG requires 'end_x' and 'end_y' parameters");
        }
        if (action == ActionType.WAIT && !parameters.containsKey(PARAM_DURATION_SECONDS)) {
            throw new WorkflowSchemaException(
                    "Step '" + stepId + "': WAIT requires a 'duration_seconds' parameter");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WorkflowStep)) return false;
        WorkflowStep s = (WorkflowStep) o;
        return Double.compare(waitAfter, s.waitAfter) == 0 && retryCount == s.retryCount
                && stepId.equals(s.stepId) && action == s.action
                && description.equals(s.description) && Objects.equals(selector, s.selector)
                && parameters.equals(s.parameters) && onFailure == s.onFailure
                && Objects.equals(screenshotBefore, s.screenshotBefore)
                && Objects.equals(screenshotAfter, s.screenshotAfter);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stepId, action, description, selector, parameters,
                waitAfter, retryCount, onFailure, screenshotBefore, screenshotAfter);
    }

    @Override
    public String toString() {
        return String.format("WorkflowStep{%s %s '%s'}", stepId, action, description);
    }
}
