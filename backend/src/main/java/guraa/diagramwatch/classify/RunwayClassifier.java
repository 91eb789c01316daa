package guraa.diagramwatch.classify;

import guraa.diagramwatch.model.RunwayRecord;
import guraa.diagramwatch.scan.PagePrimitives;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Reads runway designators and dimensions from the page text.
 * Unlike taxiway labels, runway data lives in the notes area, so the whole page is searched.
 */
@Slf4j
@Component
public class RunwayClassifier {

    static final int RAW_TEXT_LIMIT = 1500;

    /**
     * Run the extraction tiers in order and keep the first one that finds anything.
     *
     * @param page The scanned page
     * @return The runway records with the tier that produced them; tier NONE when nothing matched
     */
    public RunwayExtraction classify(PagePrimitives page) {
        RunwayTextContext context = RunwayTextContext.from(page);
        String fullText = context.getFullText();
        String rawText = fullText.length() > RAW_TEXT_LIMIT ? fullText.substring(0, RAW_TEXT_LIMIT) : fullText;

        for (RunwayExtractionTier tier : RunwayExtractionTier.values()) {
            List<RunwayRecord> runways = tier.extract(context);
            if (!runways.isEmpty() || tier == RunwayExtractionTier.NONE) {
                log.debug("Runway extraction tier {} produced {} records", tier, runways.size());
                return new RunwayExtraction(tier, runways, rawText);
            }
        }
        // NONE always terminates the loop
        throw new IllegalStateException("Runway extraction tiers exhausted");
    }
}
