package autoflow.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A compiled, replayable workflow: ordered steps plus descriptive metadata.
 *
 * <p>{@code workflow_id}, {@code name}, {@code description} and {@code steps}
 * are required, and step ids must be unique. The metadata map is augmented
 * in place by compiler stages (step counts, inserted waits).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WorkflowDefinition {

    public static final String DEFAULT_VERSION = "1.0.0";

    @JsonProperty("workflow_id")
    private final String workflowId;

    @JsonProperty("name")
    private final String name;

    @JsonProperty("description")
    private final String description;

    @JsonProperty("version")
    private String version = DEFAULT_VERSION;

    @JsonProperty("application")
    private String application;

    @JsonProperty("steps")
    private List<WorkflowStep> steps;

    @JsonProperty("variables")
    private Map<String, Object> variables = new LinkedHashMap<>();

    @JsonProperty("preconditions")
    private List<String> preconditions = new ArrayList<>();

    @JsonProperty("metadata")
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @JsonCreator
    public WorkflowDefinition(@JsonProperty("workflow_id") String workflowId,
                              @JsonProperty("name") String name,
                              @JsonProperty("description") String description,
                              @JsonProperty("steps") List<WorkflowStep> steps) {
        if (workflowId == null || workflowId.isBlank()) {
            throw new WorkflowSchemaException("Workflow is missing required field 'workflow_id'");
        }
        if (name == null) {
            throw new WorkflowSchemaException("Workflow '" + workflowId + "' is missing required field 'name'");
        }
        if (description == null) {
            throw new WorkflowSchemaException("Workflow '" + workflowId + "' is missing required field 'description'");
        }
        if (steps == null) {
            throw new WorkflowSchemaException("Workflow '" + workflowId + "' is missing required field 'steps'");
        }
        this.workflowId  = workflowId;
        this.name        = name;
        this.description = description;
        setSteps(steps);
    }

    // ── Getters ──────────────────────────────────────────────────────────

    public String              getWorkflowId()    { return workflowId; }
    public String              getName()          { return name; }
    public String              getDescription()   { return description; }
    public String              getVersion()       { return version; }
    public String              getApplication()   { return application; }
    public List<WorkflowStep>  getSteps()         { return steps; }
    public Map<String, Object> getVariables()     { return variables; }
    public List<String>        getPreconditions() { return preconditions; }
    public Map<String, Object> getMetadata()      { return metadata; }

    // ── Setters ──────────────────────────────────────────────────────────

    public void setVersion(String version)         { this.version = version != null ? version : DEFAULT_VERSION; }
    public void setApplication(String application) { this.application = application; }

    /**
     * Replaces the step list.
     *
     * @throws WorkflowSchemaException if a step is null or two steps share an id
     */
    public void setSteps(List<WorkflowStep> newSteps) {
        Set<String> ids = new HashSet<>();
        for (WorkflowStep step : newSteps) {
            if (step == null) {
                throw new WorkflowSchemaException("Workflow '" + workflowId + "' contains a null step");
            }
            if (!ids.add(step.getStepId())) {
                throw new WorkflowSchemaException(
                        "Workflow '" + workflowId + "' has duplicate step_id '" + step.getStepId() + "'");
            }
        }
        this.steps = new ArrayList<>(newSteps);
    }

    public void setVariables(Map<String, Object> variables) {
        this.variables = variables != null ? new LinkedHashMap<>(variables) : new LinkedHashMap<>();
    }

    public void setPreconditions(List<String> preconditions) {
        this.preconditions = preconditions != null ? new ArrayList<>(preconditions) : new ArrayList<>();
    }

    public void setMetadata(Map<String, Object> metadata) {
        this.metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
    }

    // ── Convenience ──────────────────────────────────────────────────────

    @JsonIgnore
    public int getStepCount() {
        return steps.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WorkflowDefinition)) return false;
        WorkflowDefinition w = (WorkflowDefinition) o;
        return workflowId.equals(w.workflowId) && name.equals(w.name)
                && description.equals(w.description) && Objects.equals(version, w.version)
                && Objects.equals(application, w.application) && steps.equals(w.steps)
                && variables.equals(w.variables) && preconditions.equals(w.preconditions)
                && metadata.equals(w.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(workflowId, name, description, version, application,
                steps, variables, preconditions, metadata);
    }

    @Override
    public String toString() {
        return String.format("WorkflowDefinition{id='%s', name='%s', steps=%d}",
                workflowId, name, getStepCount());
    }
}
