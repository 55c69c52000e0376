package autoflow.compiler;

import autoflow.model.EventLog;
import autoflow.model.WorkflowStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Recovers the event a synthesized step came from, so its timestamp can be used.
 *
 * <p>The kind-specific matchers are tried first, in list order, against every
 * candidate event. When none match, the event at the step's own position is
 * returned if there is one. That positional fallback is an approximation: it
 * trades precision for having a timestamp at all, and can pair a step with the
 * wrong event when many steps fail to match.
 */
public class StepEventCorrelator {

    private static final Logger log = LoggerFactory.getLogger(StepEventCorrelator.class);

    private final List<StepEventMatcher> matchers;

    public StepEventCorrelator() {
        this(StepEventMatchers.defaults());
    }

    public StepEventCorrelator(List<StepEventMatcher> matchers) {
        this.matchers = List.copyOf(matchers);
    }

    /**
     * @param step     the synthesized step
     * @param events   candidate events, in timestamp order
     * @param position index of the step within its workflow
     * @return the originating event, or empty when neither tier finds one
     */
    public Optional<EventLog> correlate(WorkflowStep step, List<EventLog> events, int position) {
        for (EventLog event : events) {
            for (StepEventMatcher matcher : matchers) {
                if (matcher.appliesTo(step.getAction()) && matcher.matches(step, event)) {
                    log.debug("Step {} matched {} via {}", step.getStepId(), event,
                            matcher.getClass().getSimpleName());
                    return Optional.of(event);
                }
            }
        }
        if (position >= 0 && position < events.size()) {
            log.debug("Step {} fell back to positional event #{}", step.getStepId(), position);
            return Optional.of(events.get(position));
        }
        log.debug("Step {} has no correlated event", step.getStepId());
        return Optional.empty();
    }
}
