package autoflow.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Kind-specific attributes of a single {@link EventLog}.
 *
 * <p>Only the fields relevant to the event's {@link EventKind} are populated;
 * everything else stays null and is omitted from JSON. Attributes a recorder
 * emits that have no typed field here are kept in {@link #getExtra()} so that
 * a session survives a read/write cycle unchanged.
 *
 * <p>Setters exist for binding and for building an event's data before the
 * {@link EventLog} that carries it is created. Once wrapped, the data is
 * treated as read-only; the key list and extra attributes are exposed as
 * read-only views.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EventData {

    @JsonProperty("x")
    private Double x;

    @JsonProperty("y")
    private Double y;

    /** Mouse button: "left", "right" or "middle". */
    @JsonProperty("button")
    private String button;

    @JsonProperty("text")
    private String text;

    /** Single key as recorded, e.g. "Key.enter" or "enter". */
    @JsonProperty("key")
    private String key;

    /** Raw key tokens of a combination, e.g. ["Key.ctrl_l", "'\x03'"]. */
    @JsonProperty("keys")
    private List<String> keys;

    @JsonProperty("element_name")
    private String elementName;

    /** Accessibility control type, e.g. Button, Hyperlink, Edit, ListItem. */
    @JsonProperty("element_type")
    private String elementType;

    @JsonProperty("automation_id")
    private String automationId;

    @JsonProperty("clipboard_content")
    private String clipboardContent;

    @JsonProperty("user_intent")
    private UserIntent userIntent;

    @JsonProperty("start_x")
    private Double startX;

    @JsonProperty("start_y")
    private Double startY;

    @JsonProperty("end_x")
    private Double endX;

    @JsonProperty("end_y")
    private Double endY;

    @JsonProperty("delta_x")
    private Double deltaX;

    @JsonProperty("delta_y")
    private Double deltaY;

    @JsonProperty("url")
    private String url;

    /** Number of source events merged into this one by the simplifier. */
    @JsonProperty("grouped_from")
    private Integer groupedFrom;

    private Map<String, Object> extra = new LinkedHashMap<>();

    public EventData() {}

    // ── Getters ──────────────────────────────────────────────────────────

    public Double       getX()                { return x; }
    public Double       getY()                { return y; }
    public String       getButton()           { return button; }
    public String       getText()             { return text; }
    public String       getKey()              { return key; }
    public List<String> getKeys()             { return keys != null ? Collections.unmodifiableList(keys) : null; }
    public String       getElementName()      { return elementName; }
    public String       getElementType()      { return elementType; }
    public String       getAutomationId()     { return automationId; }
    public String       getClipboardContent() { return clipboardContent; }
    public UserIntent   getUserIntent()       { return userIntent; }
    public Double       getStartX()           { return startX; }
    public Double       getStartY()           { return startY; }
    public Double       getEndX()             { return endX; }
    public Double       getEndY()             { return endY; }
    public Double       getDeltaX()           { return deltaX; }
    public Double       getDeltaY()           { return deltaY; }
    public String       getUrl()              { return url; }
    public Integer      getGroupedFrom()      { return groupedFrom; }

    @JsonAnyGetter
    public Map<String, Object> getExtra()     { return Collections.unmodifiableMap(extra); }

    // ── Setters ──────────────────────────────────────────────────────────

    public void setX(Double x)                         { this.x = x; }
    public void setY(Double y)                         { this.y = y; }
    public void setButton(String button)               { this.button = button; }
    public void setText(String text)                   { this.text = text; }
    public void setKey(String key)                     { this.key = key; }
    public void setKeys(List<String> keys)             { this.keys = keys != null ? new ArrayList<>(keys) : null; }
    public void setElementName(String elementName)     { this.elementName = elementName; }
    public void setElementType(String elementType)     { this.elementType = elementType; }
    public void setAutomationId(String automationId)   { this.automationId = automationId; }
    public void setClipboardContent(String content)    { this.clipboardContent = content; }
    public void setUserIntent(UserIntent userIntent)   { this.userIntent = userIntent; }
    public void setStartX(Double startX)               { this.startX = startX; }
    public void setStartY(Double startY)               { this.startY = startY; }
    public void setEndX(Double endX)                   { this.endX = endX; }
    public void setEndY(Double endY)                   { this.endY = endY; }
    public void setDeltaX(Double deltaX)               { this.deltaX = deltaX; }
    public void setDeltaY(Double deltaY)               { this.deltaY = deltaY; }
    public void setUrl(String url)                     { this.url = url; }
    public void setGroupedFrom(Integer groupedFrom)    { this.groupedFrom = groupedFrom; }

    @JsonAnySetter
    public void putExtra(String name, Object value)    { this.extra.put(name, value); }

    // ── Convenience ──────────────────────────────────────────────────────

    @JsonIgnore public boolean hasElementName() { return elementName != null && !elementName.isBlank(); }

    // ── Factories ────────────────────────────────────────────────────────

    /** Mouse position attributes. */
    public static EventData atPoint(double x, double y) {
        EventData d = new EventData();
        d.x = x;
        d.y = y;
        return d;
    }

    /** Typed text. */
    public static EventData ofText(String text) {
        EventData d = new EventData();
        d.text = text;
        return d;
    }

    /** Single key press. */
    public static EventData ofKey(String key) {
        EventData d = new EventData();
        d.key = key;
        return d;
    }

    /** Key combination tokens. */
    public static EventData ofKeys(List<String> keys) {
        EventData d = new EventData();
        d.setKeys(keys);
        return d;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventData)) return false;
        EventData d = (EventData) o;
        return Objects.equals(x, d.x) && Objects.equals(y, d.y)
                && Objects.equals(button, d.button) && Objects.equals(text, d.text)
                && Objects.equals(key, d.key) && Objects.equals(keys, d.keys)
                && Objects.equals(elementName, d.elementName) && Objects.equals(elementType, d.elementType)
                && Objects.equals(automationId, d.automationId)
                && Objects.equals(clipboardContent, d.clipboardContent)
                && userIntent == d.userIntent
                && Objects.equals(startX, d.startX) && Objects.equals(startY, d.startY)
                && Objects.equals(endX, d.endX) && Objects.equals(endY, d.endY)
                && Objects.equals(deltaX, d.deltaX) && Objects.equals(deltaY, d.deltaY)
                && Objects.equals(url, d.url) && Objects.equals(groupedFrom, d.groupedFrom)
                && Objects.equals(extra, d.extra);
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, button, text, key, keys, elementName, elementType, automationId,
                clipboardContent, userIntent, startX, startY, endX, endY, deltaX, deltaY, url,
                groupedFrom, extra);
    }
}
