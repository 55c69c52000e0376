package autoflow.compiler;

import autoflow.model.CoordinateValue;
import autoflow.model.EventData;
import autoflow.model.EventLog;
import autoflow.model.SessionTimeline;
import autoflow.model.TextSelector;
import autoflow.model.WorkflowDefinition;
import autoflow.model.WorkflowStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Repairs text selectors that came out with an empty label.
 *
 * <p>For each such step the session is scanned for an event recorded at the
 * selector's fallback coordinates; if that event names its element, the name
 * becomes the selector's value. Nothing else is changed and nothing is removed.
 */
public class WorkflowEnricher {

    private static final Logger log = LoggerFactory.getLogger(WorkflowEnricher.class);

    /**
     * @return the same workflow instance with repaired selectors
     */
    public WorkflowDefinition enrich(WorkflowDefinition workflow, SessionTimeline session) {
        List<WorkflowStep> repaired = new ArrayList<>(workflow.getSteps().size());
        int count = 0;

        for (WorkflowStep step : workflow.getSteps()) {
            WorkflowStep result = step;
            if (step.getSelector() instanceof TextSelector) {
                TextSelector selector = (TextSelector) step.getSelector();
                if (!selector.hasValue()) {
                    Optional<String> name = findElementName(step.getFallbackCoordinates(), session);
                    if (name.isPresent()) {
                        result = step.withSelector(selector.withValue(name.get()));
                        count++;
                        log.debug("Filled empty selector of {} with '{}'", step.getStepId(), name.get());
                    }
                }
            }
            repaired.add(result);
        }

        if (count > 0) {
            workflow.setSteps(repaired);
            log.info("Repaired {} empty selector(s) in workflow '{}'", count, workflow.getWorkflowId());
        }
        return workflow;
    }

    private static Optional<String> findElementName(CoordinateValue fallback, SessionTimeline session) {
        if (fallback == null) {
            return Optional.empty();
        }
        for (EventLog event : session.getEvents()) {
            EventData d = event.getData();
            double x = d.getX() != null ? d.getX() : 0.0;
            double y = d.getY() != null ? d.getY() : 0.0;
            if (StepEventMatchers.same(x, fallback.getX()) && StepEventMatchers.same(y, fallback.getY())) {
                return d.hasElementName() ? Optional.of(d.getElementName()) : Optional.empty();
            }
        }
        return Optional.empty();
    }
}
