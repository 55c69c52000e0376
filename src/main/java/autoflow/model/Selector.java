package autoflow.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Target descriptor used to locate a UI element at replay time.
 *
 * <p>Closed hierarchy: a {@link TextSelector} (visible label with an optional
 * coordinate fallback) or a {@link CoordinatesSelector} (point or drag path).
 * Steps without a target carry a {@code null} selector.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = TextSelector.class,        name = TextSelector.TYPE),
        @JsonSubTypes.Type(value = CoordinatesSelector.class, name = CoordinatesSelector.TYPE)
})
public abstract class Selector {

    Selector() {}
}
