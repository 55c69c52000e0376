package autoflow.model;

import java.util.Map;

/**
 * Renders a {@link WorkflowDefinition} as plain text for people to read.
 * The output is a one-way projection; it is not parsed back.
 */
public class WorkflowTextFormatter {

    private static final String RULE = "=".repeat(70);
    private static final String THIN = "-".repeat(70);

    private WorkflowTextFormatter() {}

    public static String format(WorkflowDefinition workflow) {
        StringBuilder sb = new StringBuilder(1024);

        banner(sb, "WORKFLOW: " + workflow.getName());
        sb.append("Description: ").append(workflow.getDescription()).append('\n');
        if (workflow.getApplication() != null && !workflow.getApplication().isBlank()) {
            sb.append("Application: ").append(workflow.getApplication()).append('\n');
        }
        sb.append("Version: ").append(workflow.getVersion()).append('\n');
        sb.append("Workflow ID: ").append(workflow.getWorkflowId()).append('\n');
        sb.append("Total Steps: ").append(workflow.getStepCount()).append("\n\n");

        banner(sb, "WORKFLOW STEPS");

        int idx = 1;
        for (WorkflowStep step : workflow.getSteps()) {
            sb.append(THIN).append('\n');
            sb.append("STEP ").append(idx++).append(": ").append(step.getStepId()).append('\n');
            sb.append(THIN).append('\n');
            sb.append("Action: ").append(step.getAction()).append('\n');
            sb.append("Description: ").append(step.getDescription()).append("\n\n");

            appendTarget(sb, step.getSelector());

            if (!step.getParameters().isEmpty()) {
                sb.append("Parameters:\n");
                for (Map.Entry<String, Object> e : step.getParameters().entrySet()) {
                    sb.append("  • ").append(e.getKey()).append(": ").append(e.getValue()).append('\n');
                }
                sb.append('\n');
            }

            sb.append("Execution Settings:\n");
            sb.append("  • Wait After: ").append(step.getWaitAfter()).append("s\n");
            sb.append("  • Retry Count: ").append(step.getRetryCount()).append('\n');
            sb.append("  • On Failure: ").append(step.getOnFailure().name().toLowerCase()).append("\n\n");
        }

        sb.append(RULE).append('\n');
        sb.append("   END OF WORKFLOW").append('\n');
        sb.append(RULE);
        return sb.toString();
    }

    private static void banner(StringBuilder sb, String title) {
        sb.append(RULE).append('\n');
        sb.append("   ").append(title).append('\n');
        sb.append(RULE).append("\n\n");
    }

    private static void appendTarget(StringBuilder sb, Selector selector) {
        if (selector == null) {
            return;
        }
        sb.append("Target:\n");
        if (selector instanceof CoordinatesSelector) {
            CoordinateValue v = ((CoordinatesSelector) selector).getValue();
            if (v.isPath()) {
                sb.append("  • Drag from (").append(CoordinateValue.format(v.getStartX())).append(", ")
                  .append(CoordinateValue.format(v.getStartY())).append(") to (")
                  .append(CoordinateValue.format(v.getEndX())).append(", ")
                  .append(CoordinateValue.format(v.getEndY())).append(")\n");
            } else {
                sb.append("  • Coordinates: ").append(v).append('\n');
            }
        } else if (selector instanceof TextSelector) {
            TextSelector text = (TextSelector) selector;
            sb.append("  • Text Selector: \"").append(text.getValue()).append("\"\n");
            if (text.hasFallback()) {
                sb.append("  • Fallback Coordinates: ").append(text.getFallback().getValue()).append('\n');
            }
        }
        sb.append('\n');
    }
}
