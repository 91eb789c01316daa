package guraa.diagramwatch.compare;

import guraa.diagramwatch.model.TaxiwayLabel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Compares taxiway labels of two diagram editions.
 * Designators are compared as sets, so moving a label around is not a change.
 */
@Slf4j
@Component
public class TaxiwayComparator {

    /**
     * Labels closer than this (in page units) are considered to be at the same location.
     */
    public static final double LOCATION_THRESHOLD = 15.0;

    /**
     * Compare the labels of the old and new edition.
     * <p>
     * Renames are reported for every old/new label pair within {@link #LOCATION_THRESHOLD} whose
     * designators exist on one side only. Pairs are not matched one-to-one, so a single rename
     * seen through several nearby labels is reported several times.
     *
     * @param oldLabels Labels of the old edition
     * @param newLabels Labels of the new edition
     * @return Additions, then removals, then renames
     */
    public List<TaxiwayChange> compare(List<TaxiwayLabel> oldLabels, List<TaxiwayLabel> newLabels) {
        Set<String> oldDesignators = designators(oldLabels);
        Set<String> newDesignators = designators(newLabels);
        List<TaxiwayChange> changes = new ArrayList<>();

        for (String designator : newDesignators) {
            if (oldDesignators.contains(designator)) continue;
            firstOccurrence(newLabels, designator).ifPresent(label -> changes.add(TaxiwayChange.builder()
                    .changeType(TaxiwayChangeType.ADDED)
                    .designator(designator)
                    .oldDesignator("")
                    .x(label.getX())
                    .y(label.getY())
                    .description("New taxiway '" + designator + "' added")
                    .build()));
        }

        for (String designator : oldDesignators) {
            if (newDesignators.contains(designator)) continue;
            firstOccurrence(oldLabels, designator).ifPresent(label -> changes.add(TaxiwayChange.builder()
                    .changeType(TaxiwayChangeType.REMOVED)
                    .designator(designator)
                    .oldDesignator(designator)
                    .x(label.getX())
                    .y(label.getY())
                    .description("Taxiway '" + designator + "' removed")
                    .build()));
        }

        for (TaxiwayLabel oldLabel : oldLabels) {
            if (newDesignators.contains(oldLabel.getDesignator())) continue;

            for (TaxiwayLabel newLabel : newLabels) {
                if (oldLabel.distanceTo(newLabel) >= LOCATION_THRESHOLD) continue;
                if (oldLabel.getDesignator().equals(newLabel.getDesignator())) continue;
                if (oldDesignators.contains(newLabel.getDesignator())) continue;

                log.debug("Rename candidate {} -> {} at ({}, {})", oldLabel.getDesignator(),
                        newLabel.getDesignator(), Math.round(newLabel.getX()), Math.round(newLabel.getY()));
                changes.add(TaxiwayChange.builder()
                        .changeType(TaxiwayChangeType.RENAMED)
                        .designator(newLabel.getDesignator())
                        .oldDesignator(oldLabel.getDesignator())
                        .x(newLabel.getX())
                        .y(newLabel.getY())
                        .description("Taxiway renamed from '" + oldLabel.getDesignator()
                                + "' to '" + newLabel.getDesignator() + "'")
                        .build());
            }
        }

        return changes;
    }

    private static Set<String> designators(List<TaxiwayLabel> labels) {
        return labels.stream()
                .map(TaxiwayLabel::getDesignator)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static Optional<TaxiwayLabel> firstOccurrence(List<TaxiwayLabel> labels, String designator) {
        return labels.stream().filter(label -> label.getDesignator().equals(designator)).findFirst();
    }
}
