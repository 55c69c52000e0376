package autoflow.compiler;

import autoflow.model.ActionType;
import autoflow.model.CoordinateValue;
import autoflow.model.CoordinatesSelector;
import autoflow.model.EventData;
import autoflow.model.EventKind;
import autoflow.model.EventLog;
import autoflow.model.WorkflowStep;

import java.util.List;
import java.util.Objects;

/**
 * The kind-specific matchers used by {@link StepEventCorrelator}, in priority order.
 */
public final class StepEventMatchers {

    private StepEventMatchers() {}

    /** Default matcher chain. Drag matchers are listed in the order their encodings are tried. */
    public static List<StepEventMatcher> defaults() {
        return List.of(
                new ClickMatcher(),
                new TypeTextMatcher(),
                new PressKeyMatcher(),
                new KeyCombinationMatcher(),
                new DragBySelectorMatcher(),
                new DragByParametersMatcher(),
                new DragByFallbackMatcher(),
                new ScrollMatcher());
    }

    /** Click-family step ↔ mouse click at the step's fallback coordinates. */
    public static class ClickMatcher implements StepEventMatcher {
        @Override public boolean appliesTo(ActionType action) { return action.isClickFamily(); }

        @Override
        public boolean matches(WorkflowStep step, EventLog event) {
            if (event.getKind() != EventKind.MOUSE_CLICK) return false;
            CoordinateValue fallback = step.getFallbackCoordinates();
            return fallback != null
                    && same(event.getData().getX(), fallback.getX())
                    && same(event.getData().getY(), fallback.getY());
        }
    }

    /** Type-text step ↔ text input with identical text. */
    public static class TypeTextMatcher implements StepEventMatcher {
        @Override public boolean appliesTo(ActionType action) { return action == ActionType.TYPE_TEXT; }

        @Override
        public boolean matches(WorkflowStep step, EventLog event) {
            return event.getKind() == EventKind.TEXT_INPUT
                    && Objects.equals(event.getData().getText(), step.stringParam("text"));
        }
    }

    /** Press-key step ↔ key press with the same canonical key. */
    public static class PressKeyMatcher implements StepEventMatcher {
        @Override public boolean appliesTo(ActionType action) { return action == ActionType.PRESS_KEY; }

        @Override
        public boolean matches(WorkflowStep step, EventLog event) {
            return event.getKind() == EventKind.KEY_PRESS
                    && KeyNames.canonical(event.getData().getKey())
                               .equals(KeyNames.canonical(step.stringParam("key")));
        }
    }

    /** Ctrl+C / Ctrl+V step ↔ combination event spelling the same shortcut. */
    public static class KeyCombinationMatcher implements StepEventMatcher {
        @Override public boolean appliesTo(ActionType action) { return action == ActionType.KEY_COMBINATION; }

        @Override
        public boolean matches(WorkflowStep step, EventLog event) {
            if (event.getKind() != EventKind.KEY_COMBINATION) return false;
            List<?> stepKeys  = keysOf(step);
            List<?> eventKeys = event.getData().getKeys();
            if (KeyNames.isCopy(stepKeys) && KeyNames.isCopy(eventKeys)) return true;
            return KeyNames.isPaste(stepKeys) && KeyNames.isPaste(eventKeys);
        }

        private static List<?> keysOf(WorkflowStep step) {
            Object keys = step.getParameters().get("keys");
            return keys instanceof List ? (List<?>) keys : List.of();
        }
    }

    /** Drag step ↔ drag starting at the path encoded in the selector. */
    public static class DragBySelectorMatcher implements StepEventMatcher {
        @Override public boolean appliesTo(ActionType action) { return action == ActionType.DRAG; }

        @Override
        public boolean matches(WorkflowStep step, EventLog event) {
            if (event.getKind() != EventKind.MOUSE_DRAG) return false;
            if (!(step.getSelector() instanceof CoordinatesSelector)) return false;
            CoordinateValue v = ((CoordinatesSelector) step.getSelector()).getValue();
            EventData d = event.getData();
            return same(d.getStartX(), v.getStartX()) && same(d.getStartY(), v.getStartY());
        }
    }

    /** Drag step ↔ drag starting at {@code start_x}/{@code start_y} parameters. */
    public static class DragByParametersMatcher implements StepEventMatcher {
        @Override public boolean appliesTo(ActionType action) { return action == ActionType.DRAG; }

        @Override
        public boolean matches(WorkflowStep step, EventLog event) {
            if (event.getKind() != EventKind.MOUSE_DRAG) return false;
            EventData d = event.getData();
            return same(d.getStartX(), step.doubleParam("start_x"))
                    && same(d.getStartY(), step.doubleParam("start_y"));
        }
    }

    /** Drag step ↔ drag starting at the step's fallback point. */
    public static class DragByFallbackMatcher implements StepEventMatcher {
        @Override public boolean appliesTo(ActionType action) { return action == ActionType.DRAG; }

        @Override
        public boolean matches(WorkflowStep step, EventLog event) {
            if (event.getKind() != EventKind.MOUSE_DRAG) return false;
            CoordinateValue fallback = step.getFallbackCoordinates();
            EventData d = event.getData();
            return fallback != null
                    && same(d.getStartX(), fallback.getX())
                    && same(d.getStartY(), fallback.getY());
        }
    }

    /** Scroll step ↔ scroll at the selector's point. */
    public static class ScrollMatcher implements StepEventMatcher {
        @Override public boolean appliesTo(ActionType action) { return action == ActionType.SCROLL; }

        @Override
        public boolean matches(WorkflowStep step, EventLog event) {
            if (event.getKind() != EventKind.SCROLL) return false;
            if (!(step.getSelector() instanceof CoordinatesSelector)) return false;
            CoordinateValue v = ((CoordinatesSelector) step.getSelector()).getValue();
            return same(event.getData().getX(), v.getX()) && same(event.getData().getY(), v.getY());
        }
    }

    static boolean same(Double a, Double b) {
        return a != null && b != null && a.doubleValue() == b.doubleValue();
    }
}
