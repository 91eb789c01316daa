package guraa.diagramwatch.compare;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

/**
 * A significant difference in the number of diagram line segments.
 */
@Value
@Builder
@JsonPropertyOrder({"change_type", "x", "y", "segment_delta", "description"})
public class GeometryChange {

    @JsonProperty("change_type")
    GeometryChangeType changeType;

    /**
     * Approximate location; segment counts carry no position, so this is 0.
     */
    @JsonProperty("x")
    double x;

    @JsonProperty("y")
    double y;

    /**
     * Number of segments added or removed, always positive.
     */
    @JsonProperty("segment_delta")
    int segmentDelta;

    @JsonProperty("description")
    String description;
}
