package autoflow.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Locates an element by its visible label or value. The coordinate fallback
 * is used by the replay engine when the label cannot be matched.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TextSelector extends Selector {

    public static final String TYPE = "text";

    @JsonProperty("value")
    private final String value;

    @JsonProperty("fallback")
    private final CoordinatesSelector fallback;

    @JsonCreator
    public TextSelector(@JsonProperty("value") String value,
                        @JsonProperty("fallback") CoordinatesSelector fallback) {
        this.value    = value != null ? value : "";
        this.fallback = fallback;
    }

    public String              getValue()    { return value; }
    public CoordinatesSelector getFallback() { return fallback; }

    @JsonIgnore public boolean hasValue()    { return !value.isBlank(); }
    @JsonIgnore public boolean hasFallback() { return fallback != null; }

    /** Same fallback, different label. */
    public TextSelector withValue(String newValue) {
        return new TextSelector(newValue, fallback);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TextSelector)) return false;
        TextSelector s = (TextSelector) o;
        return value.equals(s.value) && Objects.equals(fallback, s.fallback);
    }

    @Override
    public int hashCode() {
        return Objects.hash(TYPE, value, fallback);
    }

    @Override
    public String toString() {
        return "TextSelector{'" + value + "'" + (fallback != null ? ", fallback=" + fallback : "") + "}";
    }
}
