package guraa.diagramwatch.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Everything extracted from one edition of an airport diagram.
 * Instances are immutable; a new extraction of the same airport and cycle yields a new snapshot.
 * Missing keys in a persisted snapshot fall back to 0, "" or an empty list.
 */
@Value
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"airport_code", "cycle", "source_file", "page_width", "page_height",
        "taxiway_labels", "runway_info", "paths", "raw_runway_text"})
public class DiagramSnapshot {

    public static final String UNKNOWN = "UNKNOWN";

    @JsonProperty("airport_code")
    String airportCode;

    /**
     * AIRAC cycle code, e.g. "2602".
     */
    @JsonProperty("cycle")
    String cycle;

    @JsonProperty("source_file")
    String sourceFile;

    @JsonProperty("page_width")
    double pageWidth;

    @JsonProperty("page_height")
    double pageHeight;

    @JsonProperty("taxiway_labels")
    List<TaxiwayLabel> taxiwayLabels;

    @JsonProperty("runway_info")
    List<RunwayRecord> runways;

    @JsonProperty("paths")
    List<PathSegment> paths;

    @JsonProperty("raw_runway_text")
    List<String> rawRunwayText;

    @Builder
    @JsonCreator
    public DiagramSnapshot(@JsonProperty("airport_code") String airportCode,
                           @JsonProperty("cycle") String cycle,
                           @JsonProperty("source_file") String sourceFile,
                           @JsonProperty("page_width") double pageWidth,
                           @JsonProperty("page_height") double pageHeight,
                           @JsonProperty("taxiway_labels") List<TaxiwayLabel> taxiwayLabels,
                           @JsonProperty("runway_info") List<RunwayRecord> runways,
                           @JsonProperty("paths") List<PathSegment> paths,
                           @JsonProperty("raw_runway_text") List<String> rawRunwayText) {
        this.airportCode = airportCode != null ? airportCode : "";
        this.cycle = cycle != null ? cycle : "";
        this.sourceFile = sourceFile != null ? sourceFile : "";
        this.pageWidth = pageWidth;
        this.pageHeight = pageHeight;
        this.taxiwayLabels = immutable(taxiwayLabels);
        this.runways = immutable(runways);
        this.paths = immutable(paths);
        this.rawRunwayText = immutable(rawRunwayText);
    }

    /**
     * Distinct taxiway designators in first-seen order.
     */
    @JsonIgnore
    public Set<String> getDesignators() {
        return taxiwayLabels.stream()
                .map(TaxiwayLabel::getDesignator)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static <T> List<T> immutable(List<T> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .filter(value -> value != null)
                .collect(Collectors.toUnmodifiableList());
    }
}
