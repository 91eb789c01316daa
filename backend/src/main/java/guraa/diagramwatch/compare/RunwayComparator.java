package guraa.diagramwatch.compare;

import guraa.diagramwatch.model.RunwayRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compares runway records of two diagram editions by canonical designator.
 * A dimension of 0 means "unknown" and never counts as a change.
 */
@Component
public class RunwayComparator {

    /**
     * Compare the runways of the old and new edition.
     *
     * @param oldRunways Runways of the old edition
     * @param newRunways Runways of the new edition
     * @return Added runways, then removed runways, then dimension changes
     */
    public List<RunwayChange> compare(List<RunwayRecord> oldRunways, List<RunwayRecord> newRunways) {
        Map<String, RunwayRecord> oldByDesignator = byDesignator(oldRunways);
        Map<String, RunwayRecord> newByDesignator = byDesignator(newRunways);
        List<RunwayChange> changes = new ArrayList<>();

        newByDesignator.forEach((designator, runway) -> {
            if (!oldByDesignator.containsKey(designator)) {
                changes.add(RunwayChange.builder()
                        .changeType(RunwayChangeType.RUNWAY_ADDED)
                        .designator(designator)
                        .newLength(runway.getLengthFt())
                        .newWidth(runway.getWidthFt())
                        .newX(runway.getX())
                        .newY(runway.getY())
                        .description("New runway " + designator + ": "
                                + runway.getLengthFt() + " x " + runway.getWidthFt() + " ft")
                        .build());
            }
        });

        oldByDesignator.forEach((designator, runway) -> {
            if (!newByDesignator.containsKey(designator)) {
                changes.add(RunwayChange.builder()
                        .changeType(RunwayChangeType.RUNWAY_REMOVED)
                        .designator(designator)
                        .oldLength(runway.getLengthFt())
                        .oldWidth(runway.getWidthFt())
                        .oldX(runway.getX())
                        .oldY(runway.getY())
                        .description("Runway " + designator + " removed (was "
                                + runway.getLengthFt() + " x " + runway.getWidthFt() + " ft)")
                        .build());
            }
        });

        newByDesignator.forEach((designator, newRunway) -> {
            RunwayRecord oldRunway = oldByDesignator.get(designator);
            if (oldRunway == null) {
                return;
            }

            int oldLength = oldRunway.getLengthFt();
            int newLength = newRunway.getLengthFt();
            if (isDimensionChange(oldLength, newLength)) {
                int diff = newLength - oldLength;
                String direction = diff > 0 ? "extended" : "shortened";
                changes.add(dimensionChange(RunwayChangeType.LENGTH_CHANGED, designator, oldRunway, newRunway,
                        "Runway " + designator + " " + direction + " by " + Math.abs(diff) + " ft ("
                                + oldLength + " → " + newLength + " ft)"));
            }

            int oldWidth = oldRunway.getWidthFt();
            int newWidth = newRunway.getWidthFt();
            if (isDimensionChange(oldWidth, newWidth)) {
                int diff = newWidth - oldWidth;
                String direction = diff > 0 ? "widened" : "narrowed";
                changes.add(dimensionChange(RunwayChangeType.WIDTH_CHANGED, designator, oldRunway, newRunway,
                        "Runway " + designator + " " + direction + " by " + Math.abs(diff) + " ft ("
                                + oldWidth + " → " + newWidth + " ft wide)"));
            }
        });

        return changes;
    }

    private static boolean isDimensionChange(int oldValue, int newValue) {
        return oldValue > 0 && newValue > 0 && oldValue != newValue;
    }

    private static RunwayChange dimensionChange(RunwayChangeType type, String designator,
                                                RunwayRecord oldRunway, RunwayRecord newRunway, String description) {
        return RunwayChange.builder()
                .changeType(type)
                .designator(designator)
                .oldLength(oldRunway.getLengthFt())
                .newLength(newRunway.getLengthFt())
                .oldWidth(oldRunway.getWidthFt())
                .newWidth(newRunway.getWidthFt())
                .oldX(oldRunway.getX())
                .oldY(oldRunway.getY())
                .newX(newRunway.getX())
                .newY(newRunway.getY())
                .description(description)
                .build();
    }

    /**
     * Index runways by canonical designator; unknown designators are left out and a later
     * record with the same designator replaces an earlier one.
     */
    private static Map<String, RunwayRecord> byDesignator(List<RunwayRecord> runways) {
        Map<String, RunwayRecord> index = new LinkedHashMap<>();
        for (RunwayRecord runway : runways) {
            String designator = RunwayDesignators.normalize(runway.getDesignator());
            if (RunwayDesignators.isComparable(designator)) {
                index.put(designator, runway);
            }
        }
        return index;
    }
}
