package guraa.diagramwatch.compare;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

/**
 * A detected change in taxiway designators.
 */
@Value
@Builder
@JsonPropertyOrder({"change_type", "designator", "old_designator", "x", "y", "description"})
public class TaxiwayChange {

    @JsonProperty("change_type")
    TaxiwayChangeType changeType;

    /**
     * The taxiway designator; for renames, the new name.
     */
    @JsonProperty("designator")
    String designator;

    /**
     * The previous name for renames, the designator itself for removals, empty for additions.
     */
    @JsonProperty("old_designator")
    String oldDesignator;

    @JsonProperty("x")
    double x;

    @JsonProperty("y")
    double y;

    @JsonProperty("description")
    String description;
}
