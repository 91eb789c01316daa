package guraa.diagramwatch.compare;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

/**
 * A detected change in runway presence or dimensions.
 * Lengths and widths are 0 on the side where the runway does not exist.
 */
@Value
@Builder
@JsonPropertyOrder({"change_type", "designator", "old_length", "new_length", "old_width", "new_width",
        "old_x", "old_y", "new_x", "new_y", "description"})
public class RunwayChange {

    @JsonProperty("change_type")
    RunwayChangeType changeType;

    /**
     * Canonical designator, lower heading first.
     */
    @JsonProperty("designator")
    String designator;

    @JsonProperty("old_length")
    int oldLength;

    @JsonProperty("new_length")
    int newLength;

    @JsonProperty("old_width")
    int oldWidth;

    @JsonProperty("new_width")
    int newWidth;

    /**
     * Position of the dimension text in the old diagram.
     */
    @JsonProperty("old_x")
    double oldX;

    @JsonProperty("old_y")
    double oldY;

    /**
     * Position of the dimension text in the new diagram.
     */
    @JsonProperty("new_x")
    double newX;

    @JsonProperty("new_y")
    double newY;

    @JsonProperty("description")
    String description;
}
