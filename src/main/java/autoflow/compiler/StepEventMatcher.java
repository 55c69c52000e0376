package autoflow.compiler;

import autoflow.model.ActionType;
import autoflow.model.EventLog;
import autoflow.model.WorkflowStep;

/**
 * One strategy for recognising the event a workflow step was derived from.
 * Implementations are pure predicates and hold no state.
 */
public interface StepEventMatcher {

    /** Whether this matcher knows how to recognise events for the given action. */
    boolean appliesTo(ActionType action);

    /** Whether {@code event} is the origin of {@code step}. */
    boolean matches(WorkflowStep step, EventLog event);
}
