package autoflow.compiler;

import autoflow.model.EventData;
import autoflow.model.EventKind;
import autoflow.model.EventLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Collapses typing fragments into logical text entries.
 *
 * <p>A run {@code TEXT_INPUT, KEY_PRESS(space), TEXT_INPUT, KEY_PRESS(space), …, TEXT_INPUT}
 * becomes one {@code TEXT_INPUT} whose text is the fragments joined by single
 * spaces, trimmed, with {@code grouped_from} set to the number of source
 * events merged. Several space presses between two fragments count as one
 * separator, and the space presses that end a run are absorbed into it, so a
 * simplified list never has a text entry followed by a space press and a
 * second pass changes nothing. The merged event keeps the first fragment's
 * timestamp, element attributes and screenshot reference. Only the key
 * {@code space} separates words; {@code backspace} ends the run.
 *
 * <p>All other events pass through unchanged and in order; the input list is
 * never modified.
 */
public class EventSimplifier {

    private static final Logger log = LoggerFactory.getLogger(EventSimplifier.class);

    public List<EventLog> simplify(List<EventLog> events) {
        List<EventLog> out = new ArrayList<>(events.size());
        int i = 0;
        while (i < events.size()) {
            EventLog first = events.get(i);
            if (first.getKind() != EventKind.TEXT_INPUT) {
                out.add(first);
                i++;
                continue;
            }

            StringBuilder text = new StringBuilder(textOf(first));
            int j = i + 1;
            while (j < events.size() && isSpace(events.get(j))) {
                int k = j;
                while (k < events.size() && isSpace(events.get(k))) {
                    k++;
                }
                if (k < events.size() && events.get(k).getKind() == EventKind.TEXT_INPUT) {
                    text.append(' ').append(textOf(events.get(k)));
                    j = k + 1;
                } else {
                    // trailing spaces end the run
                    j = k;
                }
            }

            int merged = j - i;
            if (merged > 1) {
                out.add(merge(first, text.toString().trim(), merged));
                log.debug("Merged {} typing events into '{}'", merged, text.toString().trim());
            } else {
                out.add(first);
            }
            i = j;
        }
        return out;
    }

    private static EventLog merge(EventLog first, String text, int count) {
        EventData src = first.getData();
        EventData data = new EventData();
        data.setText(text);
        data.setElementName(src.getElementName());
        data.setElementType(src.getElementType());
        data.setAutomationId(src.getAutomationId());
        data.setGroupedFrom(count);
        return new EventLog(first.getTimestamp(), EventKind.TEXT_INPUT, data, first.getScreenshotRef());
    }

    private static boolean isSpace(EventLog event) {
        return event.getKind() == EventKind.KEY_PRESS
                && "space".equals(KeyNames.canonical(event.getData().getKey()));
    }

    private static String textOf(EventLog event) {
        String t = event.getData().getText();
        return t != null ? t : "";
    }
}
