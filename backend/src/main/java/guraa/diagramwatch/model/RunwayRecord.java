package guraa.diagramwatch.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * A runway entry read from the diagram's data block.
 */
@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class RunwayRecord {

    /**
     * Designator used when dimensions could not be tied to a runway name.
     */
    public static final String UNKNOWN_DESIGNATOR = "Unknown";

    /**
     * Runway designator as found on the page, e.g. "4L/22R". May be {@link #UNKNOWN_DESIGNATOR}.
     */
    @JsonProperty("designator")
    String designator;

    /**
     * Length in feet, 0 when unknown.
     */
    @JsonProperty("length_ft")
    int lengthFt;

    /**
     * Width in feet, 0 when unknown.
     */
    @JsonProperty("width_ft")
    int widthFt;

    /**
     * Center x of the dimension text, 0 when not located.
     */
    @JsonProperty("x")
    double x;

    /**
     * Center y of the dimension text, 0 when not located.
     */
    @JsonProperty("y")
    double y;

    /**
     * Surface type (ASPH, CONC...). Not populated by extraction yet.
     */
    @JsonProperty("surface")
    String surface;

    /**
     * The source text the record was built from.
     */
    @JsonProperty("raw_text")
    String rawText;

    @Builder
    @JsonCreator
    public RunwayRecord(@JsonProperty("designator") String designator,
                        @JsonProperty("length_ft") int lengthFt,
                        @JsonProperty("width_ft") int widthFt,
                        @JsonProperty("x") double x,
                        @JsonProperty("y") double y,
                        @JsonProperty("surface") String surface,
                        @JsonProperty("raw_text") String rawText) {
        this.designator = designator != null ? designator : "";
        this.lengthFt = lengthFt;
        this.widthFt = widthFt;
        this.x = x;
        this.y = y;
        this.surface = surface != null ? surface : "";
        this.rawText = rawText != null ? rawText : "";
    }

    @JsonIgnore
    public boolean isUnknown() {
        return UNKNOWN_DESIGNATOR.equals(designator);
    }
}
