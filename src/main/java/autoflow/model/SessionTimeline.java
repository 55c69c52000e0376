package autoflow.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One recorded user-interaction timeline. Event order is chronological order.
 *
 * <p>A session is owned by a single compilation request. Stages that need a
 * different event list (simplification) build a new session with
 * {@link #withEvents(List)} instead of editing this one. The event list and
 * metadata are handed out as read-only views.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SessionTimeline {

    @JsonProperty("session_id")
    private String sessionId;

    @JsonProperty("start_time")
    private Instant startTime;

    @JsonProperty("end_time")
    private Instant endTime;

    /** Name of the recorded application, e.g. "Firefox Browser". */
    @JsonProperty("application")
    private String application;

    @JsonProperty("events")
    private List<EventLog> events = new ArrayList<>();

    @JsonProperty("metadata")
    private Map<String, Object> metadata = new LinkedHashMap<>();

    public SessionTimeline() {}

    public SessionTimeline(String sessionId, Instant startTime, Instant endTime,
                           String application, List<EventLog> events, Map<String, Object> metadata) {
        this.sessionId   = sessionId;
        this.startTime   = startTime;
        this.endTime     = endTime;
        this.application = application;
        setEvents(events);
        setMetadata(metadata);
    }

    // ── Getters ──────────────────────────────────────────────────────────

    public String              getSessionId()   { return sessionId; }
    public Instant             getStartTime()   { return startTime; }
    public Instant             getEndTime()     { return endTime; }
    public String              getApplication() { return application; }
    public List<EventLog>      getEvents()      { return Collections.unmodifiableList(events); }
    public Map<String, Object> getMetadata()    { return Collections.unmodifiableMap(metadata); }

    // ── Setters ──────────────────────────────────────────────────────────

    public void setSessionId(String sessionId)       { this.sessionId = sessionId; }
    public void setStartTime(Instant startTime)      { this.startTime = startTime; }
    public void setEndTime(Instant endTime)          { this.endTime = endTime; }
    public void setApplication(String application)   { this.application = application; }
    public void setEvents(List<EventLog> evts) {
        this.events = evts != null ? new ArrayList<>(evts) : new ArrayList<>();
    }
    public void setMetadata(Map<String, Object> md) {
        this.metadata = md != null ? new LinkedHashMap<>(md) : new LinkedHashMap<>();
    }

    // ── Convenience ──────────────────────────────────────────────────────

    @JsonIgnore
    public int getEventCount() {
        return events.size();
    }

    /** Copy of this session carrying a different event list. */
    public SessionTimeline withEvents(List<EventLog> newEvents) {
        return new SessionTimeline(sessionId, startTime, endTime, application, newEvents, metadata);
    }

    /** Events ordered by timestamp; the sort is stable for equal timestamps. */
    @JsonIgnore
    public List<EventLog> getEventsByTime() {
        List<EventLog> sorted = new ArrayList<>(events);
        sorted.sort(Comparator.comparing(EventLog::getTimestamp));
        return sorted;
    }

    @Override
    public String toString() {
        return String.format("SessionTimeline{id='%s', application='%s', events=%d}",
                sessionId, application, getEventCount());
    }
}
