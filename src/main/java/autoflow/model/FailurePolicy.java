package autoflow.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** What the replay engine does when a step fails. */
public enum FailurePolicy {
    @JsonProperty("stop") STOP
}
