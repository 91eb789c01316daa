package guraa.diagramwatch.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * One occurrence of a taxiway designator on the diagram.
 * The same designator usually appears at several positions; occurrences are not merged.
 */
@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class TaxiwayLabel {

    /**
     * The taxiway name, e.g. "A", "YA", "KD".
     */
    @JsonProperty("designator")
    String designator;

    /**
     * Center x of the label text.
     */
    @JsonProperty("x")
    double x;

    /**
     * Center y of the label text.
     */
    @JsonProperty("y")
    double y;

    @JsonProperty("bbox")
    BoundingBox bbox;

    @Builder
    @JsonCreator
    public TaxiwayLabel(@JsonProperty("designator") String designator,
                        @JsonProperty("x") double x,
                        @JsonProperty("y") double y,
                        @JsonProperty("bbox") BoundingBox bbox) {
        this.designator = designator != null ? designator : "";
        this.x = x;
        this.y = y;
        this.bbox = bbox != null ? bbox : BoundingBox.EMPTY;
    }

    /**
     * Euclidean distance between the centers of two labels.
     */
    public double distanceTo(TaxiwayLabel other) {
        double dx = other.x - x;
        double dy = other.y - y;
        return Math.sqrt(dx * dx + dy * dy);
    }
}
