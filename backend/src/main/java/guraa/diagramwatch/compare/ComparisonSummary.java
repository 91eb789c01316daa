package guraa.diagramwatch.compare;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * Counts describing one comparison.
 */
@Value
@Builder
public class ComparisonSummary {

    @JsonProperty("total_changes")
    int totalChanges;

    @JsonProperty("taxiways_added")
    int taxiwaysAdded;

    @JsonProperty("taxiways_removed")
    int taxiwaysRemoved;

    @JsonProperty("taxiways_renamed")
    int taxiwaysRenamed;

    @JsonProperty("runway_changes")
    int runwayChanges;

    @JsonProperty("runways_added")
    int runwaysAdded;

    @JsonProperty("runways_removed")
    int runwaysRemoved;

    @JsonProperty("runway_length_changes")
    int runwayLengthChanges;

    @JsonProperty("runway_width_changes")
    int runwayWidthChanges;

    @JsonProperty("geometry_changes")
    int geometryChanges;

    @JsonProperty("old_label_count")
    int oldLabelCount;

    @JsonProperty("new_label_count")
    int newLabelCount;

    @JsonProperty("old_unique_designators")
    int oldUniqueDesignators;

    @JsonProperty("new_unique_designators")
    int newUniqueDesignators;

    @JsonProperty("old_runway_count")
    int oldRunwayCount;

    @JsonProperty("new_runway_count")
    int newRunwayCount;
}
