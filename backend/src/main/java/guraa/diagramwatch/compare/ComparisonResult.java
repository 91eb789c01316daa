package guraa.diagramwatch.compare;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Result of comparing two diagram snapshots.
 * The typed change lists are authoritative; {@code changes} repeats them in the flat legacy shape.
 */
@Value
@Builder
@JsonPropertyOrder({"airport_code", "old_cycle", "new_cycle", "taxiway_changes", "runway_changes",
        "geometry_changes", "summary", "changes"})
public class ComparisonResult {

    @JsonProperty("airport_code")
    String airportCode;

    @JsonProperty("old_cycle")
    String oldCycle;

    @JsonProperty("new_cycle")
    String newCycle;

    @JsonProperty("taxiway_changes")
    List<TaxiwayChange> taxiwayChanges;

    @JsonProperty("runway_changes")
    List<RunwayChange> runwayChanges;

    @JsonProperty("geometry_changes")
    List<GeometryChange> geometryChanges;

    @JsonProperty("summary")
    ComparisonSummary summary;

    @JsonProperty("changes")
    List<LegacyChange> changes;

    /**
     * Whether the comparison found any change at all.
     */
    @JsonIgnore
    public boolean hasChanges() {
        return !taxiwayChanges.isEmpty() || !runwayChanges.isEmpty() || !geometryChanges.isEmpty();
    }

    /**
     * Whether there is a taxiway or runway change worth alerting on. Geometry swings alone are not.
     */
    @JsonIgnore
    public boolean hasMeaningfulChanges() {
        return !taxiwayChanges.isEmpty() || !runwayChanges.isEmpty();
    }

    /**
     * Count the taxiway changes of one kind.
     */
    public long countTaxiwayChanges(TaxiwayChangeType type) {
        return taxiwayChanges.stream().filter(change -> change.getChangeType() == type).count();
    }

    /**
     * Count the runway changes of one kind.
     */
    public long countRunwayChanges(RunwayChangeType type) {
        return runwayChanges.stream().filter(change -> change.getChangeType() == type).count();
    }
}
