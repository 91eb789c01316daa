package guraa.diagramwatch.classify;

import guraa.diagramwatch.model.RunwayRecord;
import lombok.Value;

import java.util.List;

/**
 * Runway records read from a page, tagged with the tier that produced them.
 */
@Value
public class RunwayExtraction {
    RunwayExtractionTier tier;
    List<RunwayRecord> runways;

    /**
     * Leading page text kept for troubleshooting extraction.
     */
    String rawText;

    public RunwayExtraction(RunwayExtractionTier tier, List<RunwayRecord> runways, String rawText) {
        this.tier = tier;
        this.runways = List.copyOf(runways);
        this.rawText = rawText;
    }
}
