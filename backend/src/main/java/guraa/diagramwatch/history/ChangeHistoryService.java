package guraa.diagramwatch.history;

import guraa.diagramwatch.compare.ComparisonResult;
import guraa.diagramwatch.compare.DiagramComparisonEngine;
import guraa.diagramwatch.compare.RunwayChange;
import guraa.diagramwatch.compare.TaxiwayChange;
import guraa.diagramwatch.compare.TaxiwayChangeType;
import guraa.diagramwatch.config.AirportRegistry;
import guraa.diagramwatch.config.DiagramWatchProperties;
import guraa.diagramwatch.cycle.AiracCycles;
import guraa.diagramwatch.model.DiagramSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Optional;

/**
 * Finds the most recent cycle in which an airport diagram changed, by comparing the current
 * snapshot against successively older ones.
 */
@Slf4j
@Service
public class ChangeHistoryService {

    private final SnapshotSource snapshotSource;
    private final DiagramComparisonEngine comparisonEngine;
    private final AirportRegistry airportRegistry;
    private final AiracCycles airacCycles;
    private final int maxCycles;

    public ChangeHistoryService(SnapshotSource snapshotSource, DiagramComparisonEngine comparisonEngine,
                                AirportRegistry airportRegistry, AiracCycles airacCycles, int maxCycles) {
        this.snapshotSource = snapshotSource;
        this.comparisonEngine = comparisonEngine;
        this.airportRegistry = airportRegistry;
        this.airacCycles = airacCycles;
        this.maxCycles = maxCycles;
    }

    @Autowired
    public ChangeHistoryService(SnapshotSource snapshotSource, DiagramComparisonEngine comparisonEngine,
                                AirportRegistry airportRegistry, AiracCycles airacCycles,
                                DiagramWatchProperties properties) {
        this(snapshotSource, comparisonEngine, airportRegistry, airacCycles,
                properties.getHistory().getMaxCycles());
    }

    /**
     * Search back from the current cycle for the last change.
     * The search stops early at the first cycle whose snapshot is not available.
     *
     * @param airportCode The airport code, case-insensitive
     * @return The search result; unknown airports and a missing current snapshot yield an error result
     */
    public HistoricalSearchResult findLastChange(String airportCode) {
        String code = airportCode == null ? "" : airportCode.toUpperCase(Locale.ROOT);
        if (!airportRegistry.contains(code)) {
            return HistoricalSearchResult.error("Unknown airport: " + code);
        }

        String currentCycle = airacCycles.current();
        log.info("Searching for last change in {} diagrams, current cycle {}", code, currentCycle);

        Optional<DiagramSnapshot> current = snapshotSource.find(code, currentCycle);
        if (current.isEmpty()) {
            return HistoricalSearchResult.error("Could not extract current diagram");
        }

        int cyclesSearched = 0;
        String cycle = airacCycles.previous(currentCycle);
        while (cyclesSearched < maxCycles) {
            cyclesSearched++;
            Optional<DiagramSnapshot> older = snapshotSource.find(code, cycle);
            if (older.isEmpty()) {
                log.info("Cycle {} not available, stopping search", cycle);
                break;
            }

            ComparisonResult comparison = comparisonEngine.compare(older.get(), current.get());
            if (differs(comparison)) {
                log.info("Found change for {} at cycle {}", code, cycle);
                return found(currentCycle, cycle, cyclesSearched, comparison);
            }
            cycle = airacCycles.previous(cycle);
        }

        log.info("No changes found for {} in last {} cycles", code, cyclesSearched);
        return HistoricalSearchResult.builder()
                .found(false)
                .currentCycle(currentCycle)
                .cyclesSearched(cyclesSearched)
                .message(String.format("No changes found in last %d cycles (~%d days)",
                        cyclesSearched, cyclesSearched * AiracCycles.CYCLE_DAYS))
                .build();
    }

    // Renames alone do not mark a change: a relabelled designator also shows up as added and removed.
    private static boolean differs(ComparisonResult comparison) {
        return comparison.countTaxiwayChanges(TaxiwayChangeType.ADDED) > 0
                || comparison.countTaxiwayChanges(TaxiwayChangeType.REMOVED) > 0
                || !comparison.getRunwayChanges().isEmpty();
    }

    private static HistoricalSearchResult found(String currentCycle, String changeCycle, int cyclesSearched,
                                                ComparisonResult comparison) {
        HistoricalSearchResult.HistoricalSearchResultBuilder builder = HistoricalSearchResult.builder()
                .found(true)
                .currentCycle(currentCycle)
                .lastChangeCycle(changeCycle)
                .cyclesSearched(cyclesSearched)
                .comparison(comparison);
        for (TaxiwayChange change : comparison.getTaxiwayChanges()) {
            if (change.getChangeType() == TaxiwayChangeType.ADDED) {
                builder.taxiwayAdded(change.getDesignator());
            } else if (change.getChangeType() == TaxiwayChangeType.REMOVED) {
                builder.taxiwayRemoved(change.getDesignator());
            }
        }
        for (RunwayChange change : comparison.getRunwayChanges()) {
            builder.runwayChange(change.getDescription());
        }
        return builder.build();
    }
}
