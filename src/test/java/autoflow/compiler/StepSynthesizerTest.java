package autoflow.compiler;

import autoflow.model.ActionType;
import autoflow.model.CoordinateValue;
import autoflow.model.CoordinatesSelector;
import autoflow.model.EventData;
import autoflow.model.EventKind;
import autoflow.model.EventLog;
import autoflow.model.TextSelector;
import autoflow.model.UserIntent;
import autoflow.model.WorkflowStep;
import org.testng.annotations.Test;

import java.util.List;
import java.util.Optional;

import static autoflow.SessionFixtures.at;
import static autoflow.SessionFixtures.click;
import static autoflow.SessionFixtures.clickData;
import static autoflow.SessionFixtures.combo;
import static autoflow.SessionFixtures.drag;
import static autoflow.SessionFixtures.dragData;
import static autoflow.SessionFixtures.event;
import static autoflow.SessionFixtures.key;
import static autoflow.SessionFixtures.scroll;
import static autoflow.SessionFixtures.text;
import static org.assertj.core.api.Assertions.assertThat;

public class StepSynthesizerTest {

    private final StepSynthesizer synthesizer = new StepSynthesizer();

    private WorkflowStep synth(EventLog event) {
        return synthesizer.synthesize(event, 1).orElseThrow();
    }

    // ── Clicks ────────────────────────────────────────────────────────────

    @Test
    public void click_namedButton_textSelectorWithCoordinateFallback() {
        WorkflowStep step = synth(click(0, 540, 520, "Sign In", "Button"));

        assertThat(step.getStepId()).isEqualTo("step-1");
        assertThat(step.getAction()).isEqualTo(ActionType.CLICK);
        assertThat(step.getDescription()).isEqualTo("Click the 'Sign In' button");
        assertThat(step.getSelector()).isInstanceOf(TextSelector.class);

        TextSelector selector = (TextSelector) step.getSelector();
        assertThat(selector.getValue()).isEqualTo("Sign In");
        assertThat(selector.getFallback().getValue()).isEqualTo(CoordinateValue.point(540.0, 520.0));
        assertThat(step.getParameters()).doesNotContainKey("button");
    }

    @Test
    public void click_unnamedElement_coordinateSelectorOnly() {
        WorkflowStep step = synth(click(0, 12, 34, null, null));

        assertThat(step.getSelector()).isEqualTo(CoordinatesSelector.point(12.0, 34.0));
        assertThat(step.getDescription()).isEqualTo("Click at coordinates (12, 34)");
    }

    @Test
    public void click_rightButton_isRightClickWithButtonParameter() {
        EventData d = clickData(5, 5, "Row 1", "ListItem");
        d.setButton("right");
        EventLog event = event(0, EventKind.MOUSE_CLICK, d);

        WorkflowStep step = synth(event);

        assertThat(step.getAction()).isEqualTo(ActionType.RIGHT_CLICK);
        assertThat(step.getParameters()).containsEntry("button", "right");
        assertThat(step.getDescription()).isEqualTo("Select 'Row 1' from menu");
    }

    @Test
    public void click_descriptionTemplates_followElementType() {
        assertThat(synth(click(0, 1, 1, "Search with Google or enter address", "Edit")).getDescription())
                .isEqualTo("Click on search/address bar: 'Search with Google or enter address'");
        assertThat(synth(click(0, 1, 1, "Docs", "Hyperlink")).getDescription())
                .isEqualTo("Click on 'Docs' link");
        assertThat(synth(click(0, 1, 1, "Email", "Edit")).getDescription())
                .isEqualTo("Click on 'Email' input field");
        assertThat(synth(click(0, 1, 1, "Country", "ComboBox")).getDescription())
                .isEqualTo("Click on 'Country' input field");
        assertThat(synth(click(0, 1, 1, "Logo", "Image")).getDescription())
                .isEqualTo("Click on 'Logo'");
    }

    @Test
    public void doubleClick_usesDoubleClickVerb() {
        EventData d = EventData.atPoint(7, 8);
        d.setElementName("report.pdf");
        d.setElementType("ListItem");

        WorkflowStep step = synth(new EventLog(at(0), EventKind.MOUSE_DOUBLE_CLICK, d));

        assertThat(step.getAction()).isEqualTo(ActionType.DOUBLE_CLICK);
        assertThat(step.getSelector()).isInstanceOf(TextSelector.class);
    }

    // ── Keyboard ──────────────────────────────────────────────────────────

    @Test
    public void pressKey_libraryPrefixIsStripped() {
        WorkflowStep step = synth(key(0, "Key.enter"));

        assertThat(step.getAction()).isEqualTo(ActionType.PRESS_KEY);
        assertThat(step.getParameters()).containsEntry("key", "enter");
        assertThat(step.getDescription()).isEqualTo("Press Enter key");
        assertThat(step.getSelector()).isNull();
    }

    @Test
    public void pressKey_submitIntent_usesSubmitPhrasing() {
        EventData d = EventData.ofKey("Key.enter");
        d.setUserIntent(UserIntent.SUBMIT_INPUT);
        EventLog event = event(0, EventKind.KEY_PRESS, d);

        assertThat(synth(event).getDescription()).isEqualTo("Submit by pressing Enter");
    }

    @Test
    public void typeText_groupedRun_usesCompleteTextPhrasingWithoutSelector() {
        EventData d = EventData.ofText("never gonna give");
        d.setGroupedFrom(5);
        d.setElementName("Search");
        EventLog event = event(0, EventKind.TEXT_INPUT, d);

        WorkflowStep step = synth(event);

        assertThat(step.getAction()).isEqualTo(ActionType.TYPE_TEXT);
        assertThat(step.getSelector()).isNull();
        assertThat(step.getDescription()).isEqualTo("Type complete text: 'never gonna give' into 'Search'");
        assertThat(step.getParameters())
                .containsEntry("text", "never gonna give")
                .containsEntry("target", "Search");
    }

    @Test
    public void typeText_singleFragment_plainPhrasing() {
        WorkflowStep step = synth(text(0, "hello"));

        assertThat(step.getDescription()).isEqualTo("Type 'hello'");
        assertThat(step.getParameters()).doesNotContainKey("target");
    }

    @Test
    public void keyCombination_copyIntent_canonicalKeysAndPreview() {
        EventData d = EventData.ofKeys(List.of("Key.ctrl_l", "'\\x03'"));
        d.setUserIntent(UserIntent.COPY_TO_CLIPBOARD);
        d.setClipboardContent("  Hello world  ");
        EventLog event = event(0, EventKind.KEY_COMBINATION, d);

        WorkflowStep step = synth(event);

        assertThat(step.getAction()).isEqualTo(ActionType.KEY_COMBINATION);
        assertThat(step.getSelector()).isNull();
        assertThat(step.getParameters().get("keys")).isEqualTo(List.of("Ctrl", "C"));
        assertThat(step.getParameters()).containsEntry("clipboard_content", "  Hello world  ");
        assertThat(step.getDescription()).isEqualTo("Copy text to clipboard: 'Hello world'");
    }

    @Test
    public void keyCombination_pasteIntent_previewIsCappedAtFiftyCharacters() {
        String content = "x".repeat(80);
        EventData d = EventData.ofKeys(List.of("Key.ctrl", "v"));
        d.setUserIntent(UserIntent.PASTE_FROM_CLIPBOARD);
        d.setClipboardContent(content);
        EventLog event = event(0, EventKind.KEY_COMBINATION, d);

        WorkflowStep step = synth(event);

        assertThat(step.getParameters().get("keys")).isEqualTo(List.of("Ctrl", "V"));
        assertThat(step.getDescription()).isEqualTo("Paste text from clipboard: '" + "x".repeat(50) + "'");
    }

    @Test
    public void keyCombination_emptyClipboard_genericClipboardPhrasing() {
        EventData d = EventData.ofKeys(List.of("Key.ctrl", "c"));
        d.setUserIntent(UserIntent.COPY_TO_CLIPBOARD);
        EventLog event = event(0, EventKind.KEY_COMBINATION, d);

        assertThat(synth(event).getDescription()).isEqualTo("Copy selected text to clipboard (Ctrl+C)");
    }

    @Test
    public void keyCombination_noIntent_rawKeysAndPressPhrasing() {
        WorkflowStep step = synth(combo(0, "Key.ctrl_l", "Key.shift", "t"));

        assertThat(step.getParameters().get("keys")).isEqualTo(List.of("Key.ctrl_l", "Key.shift", "t"));
        assertThat(step.getDescription()).isEqualTo("Press Ctrl+Shift+T");
    }

    // ── Drag and scroll ───────────────────────────────────────────────────

    @Test
    public void drag_pathSelectorAndEndParameters() {
        WorkflowStep step = synth(drag(0, 100, 200, 300, 200));

        assertThat(step.getAction()).isEqualTo(ActionType.DRAG);
        assertThat(step.getSelector()).isEqualTo(CoordinatesSelector.path(100.0, 200.0, 300.0, 200.0));
        assertThat(step.getParameters())
                .containsEntry(WorkflowStep.PARAM_END_X, 300.0)
                .containsEntry(WorkflowStep.PARAM_END_Y, 200.0);
        assertThat(step.getDescription()).isEqualTo("Drag from (100, 200) to (300, 200)");
    }

    @Test
    public void drag_selectForCopyIntent_selectPhrasing() {
        EventData d = dragData(1, 2, 3, 4);
        d.setUserIntent(UserIntent.SELECT_TEXT_FOR_COPY);
        EventLog event = event(0, EventKind.MOUSE_DRAG, d);

        assertThat(synth(event).getDescription()).isEqualTo("Select text by dragging from (1, 2) to (3, 4)");
    }

    @Test
    public void scroll_directionFollowsVerticalDelta() {
        WorkflowStep down = synth(scroll(0, 640, 400, 120));
        WorkflowStep up = synth(scroll(0, 640, 400, -120));

        assertThat(down.getDescription()).isEqualTo("Scroll down");
        assertThat(up.getDescription()).isEqualTo("Scroll up");
        assertThat(down.getSelector()).isEqualTo(CoordinatesSelector.point(640.0, 400.0));
        assertThat(down.getParameters()).containsEntry("delta_y", 120.0);
    }

    @Test
    public void navigation_carriesUrl() {
        EventData d = new EventData();
        d.setUrl("https://example.com");

        WorkflowStep step = synth(new EventLog(at(0), EventKind.NAVIGATION, d));

        assertThat(step.getAction()).isEqualTo(ActionType.NAVIGATE);
        assertThat(step.getParameters()).containsEntry("url", "https://example.com");
        assertThat(step.getDescription()).isEqualTo("Navigate to https://example.com");
    }

    // ── Whole-list behaviour ──────────────────────────────────────────────

    @Test
    public void screenshot_producesNoStep() {
        Optional<WorkflowStep> step = synthesizer.synthesize(
                new EventLog(at(0), EventKind.SCREENSHOT, new EventData(), "shot-1.png"), 1);

        assertThat(step).isEmpty();
    }

    @Test
    public void synthesizeAll_numbersOnlyProducedSteps() {
        List<WorkflowStep> steps = synthesizer.synthesizeAll(List.of(
                click(0, 1, 1, "A", "Button"),
                new EventLog(at(1), EventKind.SCREENSHOT, new EventData(), "shot.png"),
                key(2, "Key.tab")));

        assertThat(steps).extracting(WorkflowStep::getStepId).containsExactly("step-1", "step-2");
    }

    @Test
    public void synthesizeAll_everyKind_respectsSelectorInvariants() {
        EventData dbl = EventData.atPoint(3, 3);
        List<WorkflowStep> steps = synthesizer.synthesizeAll(List.of(
                click(0, 1, 1, "A", "Button"),
                click(0, 1, 1, null, null),
                new EventLog(at(0), EventKind.MOUSE_DOUBLE_CLICK, dbl),
                drag(0, 1, 1, 2, 2),
                scroll(0, 1, 1, 5),
                text(0, "t"),
                key(0, "Key.esc"),
                combo(0, "Key.alt", "Key.tab")));

        for (WorkflowStep step : steps) {
            if (step.getAction().isKeyboard()) {
                assertThat(step.getSelector()).as(step.getStepId()).isNull();
            }
            if (step.getAction().isMouse()) {
                assertThat(step.getSelector()).as(step.getStepId()).isNotNull();
            }
            if (step.getAction() == ActionType.DRAG) {
                assertThat(step.getParameters()).containsKeys(WorkflowStep.PARAM_END_X, WorkflowStep.PARAM_END_Y);
            }
        }
    }

    @Test
    public void synthesize_appliesExecutionSettingsAndScreenshot() {
        StepSynthesizer custom = new StepSynthesizer(1.5, 7);
        EventLog event = new EventLog(at(0), EventKind.KEY_PRESS, EventData.ofKey("Key.f5"), "before.png");

        WorkflowStep step = custom.synthesize(event, 4).orElseThrow();

        assertThat(step.getStepId()).isEqualTo("step-4");
        assertThat(step.getWaitAfter()).isEqualTo(1.5);
        assertThat(step.getRetryCount()).isEqualTo(7);
        assertThat(step.getScreenshotBefore()).isEqualTo("before.png");
        assertThat(step.getDescription()).isEqualTo("Press F5 key");
    }
}
