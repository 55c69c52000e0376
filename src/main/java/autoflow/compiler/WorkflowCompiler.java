package autoflow.compiler;

import autoflow.AutoflowException;
import autoflow.ai.ModelWorkflowGenerator;
import autoflow.model.EventLog;
import autoflow.model.SessionTimeline;
import autoflow.model.WorkflowDefinition;
import autoflow.model.WorkflowStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compiles a recorded session into a workflow definition.
 *
 * <p>Deterministic path: simplify, synthesize one step per event, name the
 * workflow, insert waits. Model path: simplify, let the model write the
 * workflow, repair empty selectors, insert waits. Both paths correlate waits
 * against the session as recorded, not the simplified copy.
 *
 * <p>Instances hold only configuration and stateless stages, so one compiler
 * may serve any number of sessions, concurrently or not.
 */
public class WorkflowCompiler {

    private static final Logger log = LoggerFactory.getLogger(WorkflowCompiler.class);

    static final String WORKFLOW_ID_SUFFIX = "-workflow";

    public static final String META_SOURCE_SESSION   = "source_session";
    public static final String META_GENERATED_AT     = "generated_at";
    public static final String META_EVENT_COUNT      = "event_count";
    public static final String META_SIMPLIFIED_COUNT = "simplified_count";

    private final EventSimplifier simplifier;
    private final StepSynthesizer synthesizer;
    private final WaitInserter waitInserter;
    private final WorkflowEnricher enricher;
    private final WaitSettings waitSettings;
    private final ModelWorkflowGenerator generator;

    /** Deterministic-only compiler with default settings. */
    public WorkflowCompiler() {
        this(new EventSimplifier(), new StepSynthesizer(), new WaitInserter(), new WorkflowEnricher(),
                WaitSettings.DEFAULTS, null);
    }

    /**
     * Compiler configured from {@code config.properties}.
     *
     * @param config    compiler settings
     * @param generator model-backed producer, or null when only the deterministic path is used
     */
    public WorkflowCompiler(CompilerConfig config, ModelWorkflowGenerator generator) {
        this(new EventSimplifier(),
                new StepSynthesizer(config.getStepWaitAfterSec(), config.getStepRetryCount()),
                new WaitInserter(),
                new WorkflowEnricher(),
                config.getWaitSettings(),
                generator);
    }

    public WorkflowCompiler(EventSimplifier simplifier, StepSynthesizer synthesizer, WaitInserter waitInserter,
                            WorkflowEnricher enricher, WaitSettings waitSettings,
                            ModelWorkflowGenerator generator) {
        this.simplifier   = simplifier;
        this.synthesizer  = synthesizer;
        this.waitInserter = waitInserter;
        this.enricher     = enricher;
        this.waitSettings = waitSettings;
        this.generator    = generator;
    }

    /**
     * Compiles a session without a model. Output is fully determined by the
     * session apart from the {@code generated_at} metadata entry.
     */
    public WorkflowDefinition compileFromEvents(SessionTimeline session) {
        List<EventLog> simplified = simplifier.simplify(session.getEvents());
        List<WorkflowStep> steps = synthesizer.synthesizeAll(simplified);
        WorkflowIntent intent = WorkflowIntent.infer(steps, session);

        WorkflowDefinition workflow = new WorkflowDefinition(
                session.getSessionId() + WORKFLOW_ID_SUFFIX, intent.name(), intent.description(), steps);
        workflow.setApplication(session.getApplication());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(META_SOURCE_SESSION, session.getSessionId());
        metadata.put(META_GENERATED_AT, Instant.now().toString());
        metadata.put(META_EVENT_COUNT, session.getEventCount());
        metadata.put(META_SIMPLIFIED_COUNT, simplified.size());
        workflow.setMetadata(metadata);

        waitInserter.insertWaits(workflow, session, waitSettings);

        log.info("Compiled session '{}' ({} events, {} after simplification) into {} steps",
                session.getSessionId(), session.getEventCount(), simplified.size(), workflow.getStepCount());
        return workflow;
    }

    /**
     * Compiles a session through the model-backed producer.
     *
     * @throws IOException if the model call fails
     * @throws autoflow.ai.ModelResponseException  if the answer holds no parseable JSON
     * @throws autoflow.model.WorkflowSchemaException if the answer is not a valid workflow
     */
    public WorkflowDefinition compileWithModel(SessionTimeline session) throws IOException {
        if (generator == null) {
            throw new AutoflowException("No model-backed workflow generator is configured");
        }
        List<EventLog> simplified = simplifier.simplify(session.getEvents());
        WorkflowDefinition workflow = generator.generate(session.withEvents(simplified));

        enricher.enrich(workflow, session);
        waitInserter.insertWaits(workflow, session, waitSettings);

        log.info("Compiled session '{}' with model into {} steps",
                session.getSessionId(), workflow.getStepCount());
        return workflow;
    }

    public boolean hasModel() {
        return generator != null;
    }
}
