package autoflow.compiler;

import autoflow.model.EventData;
import autoflow.model.EventKind;
import autoflow.model.EventLog;

import java.util.Locale;

/**
 * Guesses why the user paused between two events, for the description of a
 * synthetic wait step. Rules are checked in a fixed order; the first hit wins.
 */
public final class WaitReasonClassifier {

    private WaitReasonClassifier() {}

    /**
     * @param preceding the event before the gap
     * @param following the event after the gap (reserved; current rules look only backwards)
     */
    public static String classify(EventLog preceding, EventLog following) {
        EventData data = preceding.getData();
        EventKind kind = preceding.getKind();
        String name = lower(data.getElementName());

        if (kind == EventKind.KEY_PRESS && KeyNames.canonical(data.getKey()).contains("enter")) {
            return "page load and navigation";
        }
        if (name.contains("search") || name.contains("address")) {
            return "search results to load";
        }
        if (kind == EventKind.MOUSE_CLICK) {
            String type = lower(data.getElementType());
            if (name.contains("tab")) {
                return "new tab to open";
            }
            if (type.contains("button") || type.contains("link")) {
                return "page load after click";
            }
            if (name.contains("window")) {
                return "window to open";
            }
            return "UI response";
        }
        if (kind == EventKind.KEY_COMBINATION) {
            if (KeyNames.isCopy(data.getKeys()))  return "copy operation";
            if (KeyNames.isPaste(data.getKeys())) return "paste operation";
            return "keyboard shortcut";
        }
        if (kind == EventKind.MOUSE_DRAG) {
            return "text selection";
        }
        return "action to complete";
    }

    private static String lower(String s) {
        return s != null ? s.toLowerCase(Locale.ROOT) : "";
    }
}
