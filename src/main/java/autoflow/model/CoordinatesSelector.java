package autoflow.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Locates a target purely by screen position: a point for clicks and scrolls,
 * a start/end path for drags.
 */
public class CoordinatesSelector extends Selector {

    public static final String TYPE = "coordinates";

    @JsonProperty("value")
    private final CoordinateValue value;

    @JsonCreator
    public CoordinatesSelector(@JsonProperty("value") CoordinateValue value) {
        if (value == null) {
            throw new WorkflowSchemaException("Coordinates selector requires a value");
        }
        this.value = value;
    }

    public static CoordinatesSelector point(Double x, Double y) {
        return new CoordinatesSelector(CoordinateValue.point(x, y));
    }

    public static CoordinatesSelector path(Double startX, Double startY, Double endX, Double endY) {
        return new CoordinatesSelector(CoordinateValue.path(startX, startY, endX, endY));
    }

    public CoordinateValue getValue() { return value; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CoordinatesSelector)) return false;
        return value.equals(((CoordinatesSelector) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(TYPE, value);
    }

    @Override
    public String toString() {
        return "CoordinatesSelector{" + value + "}";
    }
}
