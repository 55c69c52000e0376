package autoflow.compiler;

import autoflow.model.ActionType;
import autoflow.model.EventLog;
import autoflow.model.SessionTimeline;
import autoflow.model.WorkflowDefinition;
import autoflow.model.WorkflowStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Inserts synthetic {@code WAIT} steps where the recording shows the user
 * pausing, which usually means the UI was busy (page load, animation).
 *
 * <p>For each pair of consecutive steps both are correlated back to source
 * events. If both correlate and the gap is at least {@link WaitSettings#minGapSeconds()},
 * a wait of {@code min(gap + buffer, max)} seconds, rounded to one decimal,
 * is inserted after the first step with id {@code <step_id>-wait}. Pairs
 * where either side does not correlate get no wait, and so do pairs where
 * either step is already a {@code WAIT} or the {@code -wait} id is taken.
 *
 * <p>The workflow's step list is replaced and its metadata records
 * {@code total_steps} and {@code wait_steps_inserted}.
 */
public class WaitInserter {

    private static final Logger log = LoggerFactory.getLogger(WaitInserter.class);

    static final String WAIT_SUFFIX = "-wait";

    public static final String META_TOTAL_STEPS    = "total_steps";
    public static final String META_WAITS_INSERTED = "wait_steps_inserted";

    private final StepEventCorrelator correlator;

    public WaitInserter() {
        this(new StepEventCorrelator());
    }

    public WaitInserter(StepEventCorrelator correlator) {
        this.correlator = correlator;
    }

    /**
     * @return the same workflow instance, with waits inserted and metadata updated
     */
    public WorkflowDefinition insertWaits(WorkflowDefinition workflow, SessionTimeline session,
                                          WaitSettings settings) {
        List<WorkflowStep> steps = workflow.getSteps();
        if (steps.isEmpty() || session.getEvents().isEmpty()) {
            return workflow;
        }

        List<EventLog> events = session.getEventsByTime();
        List<WorkflowStep> expanded = new ArrayList<>(steps.size() * 2);
        Set<String> usedIds = new HashSet<>();
        steps.forEach(s -> usedIds.add(s.getStepId()));

        for (int i = 0; i < steps.size(); i++) {
            WorkflowStep step = steps.get(i);
            expanded.add(step);
            if (i + 1 < steps.size() && canWaitBetween(step, steps.get(i + 1), usedIds)) {
                waitBetween(step, i, steps.get(i + 1), events, settings).ifPresent(wait -> {
                    expanded.add(wait);
                    usedIds.add(wait.getStepId());
                });
            }
        }

        int original = steps.size();
        workflow.setSteps(expanded);
        workflow.getMetadata().put(META_TOTAL_STEPS, expanded.size());
        workflow.getMetadata().put(META_WAITS_INSERTED, expanded.size() - original);

        log.info("Inserted {} wait step(s) into workflow '{}' ({} steps total)",
                expanded.size() - original, workflow.getWorkflowId(), expanded.size());
        return workflow;
    }

    private static boolean canWaitBetween(WorkflowStep step, WorkflowStep next, Set<String> usedIds) {
        if (step.getAction() == ActionType.WAIT || next.getAction() == ActionType.WAIT) {
            return false;
        }
        if (usedIds.contains(step.getStepId() + WAIT_SUFFIX)) {
            log.debug("Step id {}{} already in use, no wait inserted", step.getStepId(), WAIT_SUFFIX);
            return false;
        }
        return true;
    }

    private Optional<WorkflowStep> waitBetween(WorkflowStep step, int index, WorkflowStep next,
                                               List<EventLog> events, WaitSettings settings) {
        Optional<EventLog> current = correlator.correlate(step, events, index);
        Optional<EventLog> following = correlator.correlate(next, events, index + 1);
        if (current.isEmpty() || following.isEmpty()) {
            return Optional.empty();
        }

        double gap = Math.max(0.0, Duration.between(current.get().getTimestamp(),
                following.get().getTimestamp()).toMillis() / 1000.0);
        if (gap < settings.minGapSeconds()) {
            return Optional.empty();
        }

        double duration = Math.min(round1(gap + settings.bufferSeconds()), settings.maxWaitSeconds());
        String reason = WaitReasonClassifier.classify(current.get(), following.get());

        Map<String, Object> params = new LinkedHashMap<>();
        params.put(WorkflowStep.PARAM_DURATION_SECONDS, duration);
        params.put("original_gap", round1(gap));

        log.debug("Gap of {}s after {} → wait {}s for {}", round1(gap), step.getStepId(), duration, reason);
        return Optional.of(new WorkflowStep(step.getStepId() + WAIT_SUFFIX, ActionType.WAIT,
                "Wait " + duration + "s for " + reason, null, params));
    }

    static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
