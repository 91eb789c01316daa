package guraa.diagramwatch.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * A straight line kept from the diagram interior.
 * Thicker strokes tend to be runways, thinner ones taxiways; the width is carried as data only.
 */
@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class PathSegment {

    @JsonProperty("x0")
    double x0;

    @JsonProperty("y0")
    double y0;

    @JsonProperty("x1")
    double x1;

    @JsonProperty("y1")
    double y1;

    @JsonProperty("width")
    double width;

    @JsonCreator
    public PathSegment(@JsonProperty("x0") double x0,
                       @JsonProperty("y0") double y0,
                       @JsonProperty("x1") double x1,
                       @JsonProperty("y1") double y1,
                       @JsonProperty("width") double width) {
        this.x0 = x0;
        this.y0 = y0;
        this.x1 = x1;
        this.y1 = y1;
        this.width = width;
    }
}
