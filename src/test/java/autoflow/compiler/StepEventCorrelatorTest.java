package autoflow.compiler;

import autoflow.model.ActionType;
import autoflow.model.CoordinatesSelector;
import autoflow.model.EventLog;
import autoflow.model.TextSelector;
import autoflow.model.WorkflowStep;
import org.testng.annotations.Test;

import java.util.List;
import java.util.Map;

import static autoflow.SessionFixtures.click;
import static autoflow.SessionFixtures.combo;
import static autoflow.SessionFixtures.drag;
import static autoflow.SessionFixtures.key;
import static autoflow.SessionFixtures.scroll;
import static autoflow.SessionFixtures.text;
import static org.assertj.core.api.Assertions.assertThat;

public class StepEventCorrelatorTest {

    private final StepEventCorrelator correlator = new StepEventCorrelator();

    private static WorkflowStep clickAt(String id, double x, double y) {
        return new WorkflowStep(id, ActionType.CLICK, "Click",
                new TextSelector("Target", CoordinatesSelector.point(x, y)), Map.of());
    }

    // ── Kind-specific matches ─────────────────────────────────────────────

    @Test
    public void click_matchesEventAtFallbackCoordinates() {
        EventLog other = click(0, 1, 1, "Other", "Button");
        EventLog target = click(3, 540, 520, "Sign In", "Button");

        assertThat(correlator.correlate(clickAt("s1", 540, 520), List.of(other, target), 0))
                .contains(target);
    }

    @Test
    public void typeText_matchesIdenticalText() {
        EventLog typed = text(2, "hello");
        WorkflowStep step = new WorkflowStep("s", ActionType.TYPE_TEXT, "Type", null, Map.of("text", "hello"));

        assertThat(correlator.correlate(step, List.of(key(0, "Key.tab"), typed), 0)).contains(typed);
    }

    @Test
    public void pressKey_matchesCanonicalKey() {
        EventLog enter = key(4, "Key.enter");
        WorkflowStep step = new WorkflowStep("s", ActionType.PRESS_KEY, "Press", null, Map.of("key", "enter"));

        assertThat(correlator.correlate(step, List.of(text(0, "x"), enter), 0)).contains(enter);
    }

    @Test
    public void keyCombination_matchesAcrossSpellings() {
        EventLog copy = combo(5, "Key.ctrl_l", "'\\x03'");
        WorkflowStep step = new WorkflowStep("s", ActionType.KEY_COMBINATION, "Copy", null,
                Map.of("keys", List.of("Ctrl", "C")));

        assertThat(correlator.correlate(step, List.of(text(0, "x"), copy), 0)).contains(copy);
    }

    @Test
    public void drag_matchesStartOfSelectorPath() {
        EventLog d = drag(6, 100, 200, 300, 200);
        WorkflowStep step = new WorkflowStep("s", ActionType.DRAG, "Drag",
                CoordinatesSelector.path(100.0, 200.0, 300.0, 200.0), Map.of("end_x", 300.0, "end_y", 200.0));

        assertThat(correlator.correlate(step, List.of(text(0, "x"), d), 0)).contains(d);
    }

    @Test
    public void drag_matchesStartParameters() {
        EventLog d = drag(6, 10, 20, 30, 40);
        WorkflowStep step = new WorkflowStep("s", ActionType.DRAG, "Drag", CoordinatesSelector.point(0.0, 0.0),
                Map.of("start_x", 10, "start_y", 20, "end_x", 30, "end_y", 40));

        assertThat(correlator.correlate(step, List.of(text(0, "x"), d), 0)).contains(d);
    }

    @Test
    public void drag_matchesTextSelectorFallback() {
        EventLog d = drag(6, 15, 25, 30, 40);
        WorkflowStep step = new WorkflowStep("s", ActionType.DRAG, "Drag",
                new TextSelector("paragraph", CoordinatesSelector.point(15.0, 25.0)),
                Map.of("end_x", 30, "end_y", 40));

        assertThat(correlator.correlate(step, List.of(text(0, "x"), d), 0)).contains(d);
    }

    @Test
    public void scroll_matchesSelectorPoint() {
        EventLog s = scroll(7, 640, 400, 120);
        WorkflowStep step = new WorkflowStep("s", ActionType.SCROLL, "Scroll",
                CoordinatesSelector.point(640.0, 400.0), Map.of());

        assertThat(correlator.correlate(step, List.of(text(0, "x"), s), 0)).contains(s);
    }

    @Test
    public void firstMatchingEventWins() {
        EventLog first = click(1, 5, 5, "A", "Button");
        EventLog second = click(2, 5, 5, "A", "Button");

        assertThat(correlator.correlate(clickAt("s", 5, 5), List.of(first, second), 1)).contains(first);
    }

    // ── Positional fallback ───────────────────────────────────────────────

    @Test
    public void noMatch_fallsBackToEventAtPosition() {
        List<EventLog> events = List.of(text(0, "a"), text(1, "b"), text(2, "c"));

        assertThat(correlator.correlate(clickAt("s", 999, 999), events, 2)).contains(events.get(2));
    }

    @Test
    public void noMatch_positionOutOfRange_isEmpty() {
        List<EventLog> events = List.of(text(0, "a"));

        assertThat(correlator.correlate(clickAt("s", 999, 999), events, 3)).isEmpty();
    }

    @Test
    public void clickWithoutFallback_usesPosition() {
        EventLog typed = text(0, "x");
        EventLog unnamed = click(1, 12, 34, null, null);
        WorkflowStep step = new WorkflowStep("s", ActionType.CLICK, "Click",
                CoordinatesSelector.point(12.0, 34.0), Map.of());

        assertThat(correlator.correlate(step, List.of(typed, unnamed), 0)).contains(typed);
    }

    @Test
    public void customMatcherChain_isUsed() {
        StepEventMatcher never = new StepEventMatcher() {
            @Override public boolean appliesTo(ActionType action) { return true; }
            @Override public boolean matches(WorkflowStep step, EventLog event) { return false; }
        };
        StepEventCorrelator positionalOnly = new StepEventCorrelator(List.of(never));
        EventLog typed = text(0, "x");
        EventLog target = click(3, 540, 520, "Sign In", "Button");

        assertThat(positionalOnly.correlate(clickAt("s", 540, 520), List.of(typed, target), 0))
                .contains(typed);
    }
}
