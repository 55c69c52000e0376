package autoflow.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Screen position carried by a {@link CoordinatesSelector}: either
 * {@code {x, y}} or, for drags, {@code {start_x, start_y, end_x, end_y}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CoordinateValue {

    @JsonProperty("x")
    private Double x;

    @JsonProperty("y")
    private Double y;

    @JsonProperty("start_x")
    private Double startX;

    @JsonProperty("start_y")
    private Double startY;

    @JsonProperty("end_x")
    private Double endX;

    @JsonProperty("end_y")
    private Double endY;

    public CoordinateValue() {}

    public static CoordinateValue point(Double x, Double y) {
        CoordinateValue v = new CoordinateValue();
        v.x = x;
        v.y = y;
        return v;
    }

    public static CoordinateValue path(Double startX, Double startY, Double endX, Double endY) {
        CoordinateValue v = new CoordinateValue();
        v.startX = startX;
        v.startY = startY;
        v.endX   = endX;
        v.endY   = endY;
        return v;
    }

    public Double getX()      { return x; }
    public Double getY()      { return y; }
    public Double getStartX() { return startX; }
    public Double getStartY() { return startY; }
    public Double getEndX()   { return endX; }
    public Double getEndY()   { return endY; }

    public void setX(Double x)           { this.x = x; }
    public void setY(Double y)           { this.y = y; }
    public void setStartX(Double startX) { this.startX = startX; }
    public void setStartY(Double startY) { this.startY = startY; }
    public void setEndX(Double endX)     { this.endX = endX; }
    public void setEndY(Double endY)     { this.endY = endY; }

    /** True when this value describes a drag path rather than a point. */
    @JsonIgnore
    public boolean isPath() {
        return startX != null || startY != null;
    }

    /**
     * Renders a coordinate for human-readable text: whole numbers without a
     * decimal part, everything else as recorded.
     */
    public static String format(Double value) {
        if (value == null) return "0";
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return Long.toString(value.longValue());
        }
        return value.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CoordinateValue)) return false;
        CoordinateValue v = (CoordinateValue) o;
        return Objects.equals(x, v.x) && Objects.equals(y, v.y)
                && Objects.equals(startX, v.startX) && Objects.equals(startY, v.startY)
                && Objects.equals(endX, v.endX) && Objects.equals(endY, v.endY);
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, startX, startY, endX, endY);
    }

    @Override
    public String toString() {
        if (isPath()) {
            return String.format("(%s, %s) -> (%s, %s)", format(startX), format(startY), format(endX), format(endY));
        }
        return String.format("(%s, %s)", format(x), format(y));
    }
}
