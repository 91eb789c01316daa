package guraa.diagramwatch.history;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import guraa.diagramwatch.compare.ComparisonResult;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of searching back through cycles for the last change to an airport diagram.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HistoricalSearchResult {

    @JsonProperty("found")
    boolean found;

    @JsonProperty("current_cycle")
    String currentCycle;

    /**
     * The newest older cycle that differs from the current one, or null when none was found.
     */
    @JsonProperty("last_change_cycle")
    String lastChangeCycle;

    @JsonProperty("cycles_searched")
    int cyclesSearched;

    @Singular("taxiwayAdded")
    @JsonProperty("taxiways_added")
    List<String> taxiwaysAdded;

    @Singular("taxiwayRemoved")
    @JsonProperty("taxiways_removed")
    List<String> taxiwaysRemoved;

    @Singular
    @JsonProperty("runway_changes")
    List<String> runwayChanges;

    @JsonProperty("comparison")
    ComparisonResult comparison;

    @JsonProperty("message")
    String message;

    @JsonProperty("error")
    String error;

    public static HistoricalSearchResult error(String error) {
        return HistoricalSearchResult.builder().found(false).error(error).build();
    }
}
