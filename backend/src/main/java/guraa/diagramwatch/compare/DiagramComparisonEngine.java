package guraa.diagramwatch.compare;

import guraa.diagramwatch.model.DiagramSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;

/**
 * Compares two snapshots of the same airport diagram and reports functional changes:
 * taxiway designators, runway dimensions and coarse geometry.
 * Label repositioning and incidental text are not reported.
 * Inputs are never modified; every call builds a fresh result.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DiagramComparisonEngine {

    private final TaxiwayComparator taxiwayComparator;
    private final RunwayComparator runwayComparator;
    private final GeometryComparator geometryComparator;
    private final ComparisonResultAggregator aggregator;

    /**
     * Engine wired with the default comparators, for use outside a Spring context.
     */
    public static DiagramComparisonEngine createDefault() {
        return new DiagramComparisonEngine(new TaxiwayComparator(), new RunwayComparator(),
                new GeometryComparator(), new ComparisonResultAggregator());
    }

    /**
     * Compare an older snapshot against a newer one.
     *
     * @param oldSnapshot The earlier edition
     * @param newSnapshot The later edition
     * @return The comparison result, possibly without any change
     */
    public ComparisonResult compare(DiagramSnapshot oldSnapshot, DiagramSnapshot newSnapshot) {
        Objects.requireNonNull(oldSnapshot, "oldSnapshot");
        Objects.requireNonNull(newSnapshot, "newSnapshot");

        List<TaxiwayChange> taxiwayChanges =
                taxiwayComparator.compare(oldSnapshot.getTaxiwayLabels(), newSnapshot.getTaxiwayLabels());
        List<RunwayChange> runwayChanges =
                runwayComparator.compare(oldSnapshot.getRunways(), newSnapshot.getRunways());
        List<GeometryChange> geometryChanges =
                geometryComparator.compare(oldSnapshot.getPaths(), newSnapshot.getPaths());

        ComparisonResult result = aggregator.aggregate(oldSnapshot, newSnapshot,
                taxiwayChanges, runwayChanges, geometryChanges);

        log.info("Compared {} {} -> {}: {} taxiway, {} runway, {} geometry changes",
                result.getAirportCode(), result.getOldCycle(), result.getNewCycle(),
                taxiwayChanges.size(), runwayChanges.size(), geometryChanges.size());
        return result;
    }
}
