package autoflow.compiler;

import autoflow.model.ActionType;
import autoflow.model.SessionTimeline;
import autoflow.model.WorkflowStep;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Name and description inferred for a deterministically compiled workflow.
 */
public record WorkflowIntent(String name, String description) {

    /**
     * Search sessions (typing plus a search-related step) are named after the
     * first typed text; anything else is named after the application.
     */
    public static WorkflowIntent infer(List<WorkflowStep> steps, SessionTimeline session) {
        boolean hasTyping = steps.stream().anyMatch(s -> s.getAction() == ActionType.TYPE_TEXT);
        boolean hasSearch = steps.stream()
                .anyMatch(s -> s.getDescription().toLowerCase(Locale.ROOT).contains("search"));

        if (hasTyping && hasSearch) {
            String query = steps.stream()
                    .filter(s -> s.getAction() == ActionType.TYPE_TEXT)
                    .map(s -> s.stringParam("text"))
                    .filter(Objects::nonNull)
                    .findFirst()
                    .orElse("");
            if (!query.isBlank()) {
                return new WorkflowIntent("Search for '" + query + "'",
                        "User performs a web search for '" + query + "' and navigates results");
            }
            return new WorkflowIntent("Web Search and Navigation",
                    "User performs a web search and navigates through results");
        }

        String app = session.getApplication() != null ? session.getApplication() : "Unknown application";
        return new WorkflowIntent(app + " - User Session", "Recorded user session in " + app);
    }
}
