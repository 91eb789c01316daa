package guraa.diagramwatch.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

/**
 * Axis-aligned rectangle in page space (origin top-left, y increasing downward).
 * Serialized as a four element array {@code [x0, y0, x1, y1]}.
 */
@Value
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({"x0", "y0", "x1", "y1"})
public class BoundingBox {

    public static final BoundingBox EMPTY = new BoundingBox(0, 0, 0, 0);

    double x0;
    double y0;
    double x1;
    double y1;

    @JsonCreator
    public BoundingBox(@JsonProperty("x0") double x0,
                       @JsonProperty("y0") double y0,
                       @JsonProperty("x1") double x1,
                       @JsonProperty("y1") double y1) {
        this.x0 = x0;
        this.y0 = y0;
        this.x1 = x1;
        this.y1 = y1;
    }

    /**
     * Square of the given size anchored at a point, as used for legacy change markers.
     */
    public static BoundingBox anchoredAt(double x, double y, double size) {
        return new BoundingBox(x, y, x + size, y + size);
    }

    @JsonIgnore
    public double getCenterX() {
        return (x0 + x1) / 2;
    }

    @JsonIgnore
    public double getCenterY() {
        return (y0 + y1) / 2;
    }

    /**
     * Smallest box enclosing both this box and the other one.
     */
    public BoundingBox union(BoundingBox other) {
        return new BoundingBox(
                Math.min(x0, other.x0),
                Math.min(y0, other.y0),
                Math.max(x1, other.x1),
                Math.max(y1, other.y1));
    }
}
