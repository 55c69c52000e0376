package autoflow.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * A single user interaction captured during a recording session.
 *
 * <p>Instances are not modified after construction; passes that need a
 * different event (the simplifier, the ingestion adapter) build a new one.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EventLog {

    @JsonProperty("timestamp")
    private final Instant timestamp;

    @JsonProperty("event_type")
    private final EventKind kind;

    @JsonProperty("data")
    private final EventData data;

    /** Reference (file name or object key) of a screenshot taken with the event. */
    @JsonProperty("screenshot_ref")
    private final String screenshotRef;

    @JsonCreator
    public EventLog(@JsonProperty("timestamp") Instant timestamp,
                    @JsonProperty("event_type") EventKind kind,
                    @JsonProperty("data") EventData data,
                    @JsonProperty("screenshot_ref") String screenshotRef) {
        this.timestamp     = Objects.requireNonNull(timestamp, "timestamp");
        this.kind          = Objects.requireNonNull(kind, "event_type");
        this.data          = data != null ? data : new EventData();
        this.screenshotRef = screenshotRef;
    }

    public EventLog(Instant timestamp, EventKind kind, EventData data) {
        this(timestamp, kind, data, null);
    }

    public Instant   getTimestamp()     { return timestamp; }
    public EventKind getKind()          { return kind; }
    public EventData getData()          { return data; }
    public String    getScreenshotRef() { return screenshotRef; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventLog)) return false;
        EventLog e = (EventLog) o;
        return timestamp.equals(e.timestamp) && kind == e.kind
                && data.equals(e.data) && Objects.equals(screenshotRef, e.screenshotRef);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, kind, data, screenshotRef);
    }

    @Override
    public String toString() {
        return String.format("EventLog{%s at %s}", kind, timestamp);
    }
}
