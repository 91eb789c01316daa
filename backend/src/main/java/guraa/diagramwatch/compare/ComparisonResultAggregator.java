package guraa.diagramwatch.compare;

import guraa.diagramwatch.model.BoundingBox;
import guraa.diagramwatch.model.DiagramSnapshot;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Combines the per-category change lists into a {@link ComparisonResult} with summary counts
 * and the flat legacy change list.
 */
@Component
public class ComparisonResultAggregator {

    /**
     * Size of the marker square legacy consumers draw at a taxiway change.
     */
    static final double LEGACY_MARKER_SIZE = 10;

    public ComparisonResult aggregate(DiagramSnapshot oldSnapshot,
                                      DiagramSnapshot newSnapshot,
                                      List<TaxiwayChange> taxiwayChanges,
                                      List<RunwayChange> runwayChanges,
                                      List<GeometryChange> geometryChanges) {
        return ComparisonResult.builder()
                .airportCode(orUnknown(newSnapshot.getAirportCode()))
                .oldCycle(orUnknown(oldSnapshot.getCycle()))
                .newCycle(orUnknown(newSnapshot.getCycle()))
                .taxiwayChanges(List.copyOf(taxiwayChanges))
                .runwayChanges(List.copyOf(runwayChanges))
                .geometryChanges(List.copyOf(geometryChanges))
                .summary(summarize(oldSnapshot, newSnapshot, taxiwayChanges, runwayChanges, geometryChanges))
                .changes(flatten(taxiwayChanges, runwayChanges, geometryChanges))
                .build();
    }

    ComparisonSummary summarize(DiagramSnapshot oldSnapshot,
                                DiagramSnapshot newSnapshot,
                                List<TaxiwayChange> taxiwayChanges,
                                List<RunwayChange> runwayChanges,
                                List<GeometryChange> geometryChanges) {
        int[] taxiwayCounts = new int[TaxiwayChangeType.values().length];
        for (TaxiwayChange change : taxiwayChanges) {
            taxiwayCounts[change.getChangeType().ordinal()]++;
        }
        int[] runwayCounts = new int[RunwayChangeType.values().length];
        for (RunwayChange change : runwayChanges) {
            runwayCounts[change.getChangeType().ordinal()]++;
        }

        return ComparisonSummary.builder()
                .totalChanges(taxiwayChanges.size() + runwayChanges.size() + geometryChanges.size())
                .taxiwaysAdded(taxiwayCounts[TaxiwayChangeType.ADDED.ordinal()])
                .taxiwaysRemoved(taxiwayCounts[TaxiwayChangeType.REMOVED.ordinal()])
                .taxiwaysRenamed(taxiwayCounts[TaxiwayChangeType.RENAMED.ordinal()])
                .runwayChanges(runwayChanges.size())
                .runwaysAdded(runwayCounts[RunwayChangeType.RUNWAY_ADDED.ordinal()])
                .runwaysRemoved(runwayCounts[RunwayChangeType.RUNWAY_REMOVED.ordinal()])
                .runwayLengthChanges(runwayCounts[RunwayChangeType.LENGTH_CHANGED.ordinal()])
                .runwayWidthChanges(runwayCounts[RunwayChangeType.WIDTH_CHANGED.ordinal()])
                .geometryChanges(geometryChanges.size())
                .oldLabelCount(oldSnapshot.getTaxiwayLabels().size())
                .newLabelCount(newSnapshot.getTaxiwayLabels().size())
                .oldUniqueDesignators(oldSnapshot.getDesignators().size())
                .newUniqueDesignators(newSnapshot.getDesignators().size())
                .oldRunwayCount(oldSnapshot.getRunways().size())
                .newRunwayCount(newSnapshot.getRunways().size())
                .build();
    }

    List<LegacyChange> flatten(List<TaxiwayChange> taxiwayChanges,
                               List<RunwayChange> runwayChanges,
                               List<GeometryChange> geometryChanges) {
        List<LegacyChange> changes = new ArrayList<>();
        for (TaxiwayChange change : taxiwayChanges) {
            changes.add(toLegacy(change));
        }
        for (RunwayChange change : runwayChanges) {
            changes.add(toLegacy(change));
        }
        for (GeometryChange change : geometryChanges) {
            changes.add(toLegacy(change));
        }
        return List.copyOf(changes);
    }

    private static LegacyChange toLegacy(TaxiwayChange change) {
        BoundingBox marker = BoundingBox.anchoredAt(change.getX(), change.getY(), LEGACY_MARKER_SIZE);
        BoundingBox oldPosition;
        BoundingBox newPosition;
        switch (change.getChangeType()) {
            case REMOVED:
                oldPosition = marker;
                newPosition = BoundingBox.EMPTY;
                break;
            case ADDED:
            case RENAMED:
                oldPosition = BoundingBox.EMPTY;
                newPosition = marker;
                break;
            default:
                throw new IllegalStateException("Unhandled taxiway change type: " + change.getChangeType());
        }

        return LegacyChange.builder()
                .changeType(change.getChangeType().name())
                .category(ChangeCategory.TAXIWAY)
                .oldText(change.getOldDesignator())
                .newText(change.getDesignator())
                .oldPosition(oldPosition)
                .newPosition(newPosition)
                .description(change.getDescription())
                .build();
    }

    private static LegacyChange toLegacy(RunwayChange change) {
        return LegacyChange.builder()
                .changeType(change.getChangeType().name())
                .category(ChangeCategory.RUNWAY)
                .oldText(change.getOldLength() + " x " + change.getOldWidth())
                .newText(change.getNewLength() + " x " + change.getNewWidth())
                .oldPosition(BoundingBox.EMPTY)
                .newPosition(BoundingBox.EMPTY)
                .description(change.getDescription())
                .build();
    }

    private static LegacyChange toLegacy(GeometryChange change) {
        return LegacyChange.builder()
                .changeType(change.getChangeType().name())
                .category(ChangeCategory.GEOMETRY)
                .oldText("")
                .newText("")
                .oldPosition(BoundingBox.EMPTY)
                .newPosition(BoundingBox.EMPTY)
                .description(change.getDescription())
                .build();
    }

    private static String orUnknown(String value) {
        return value == null || value.isEmpty() ? DiagramSnapshot.UNKNOWN : value;
    }
}
