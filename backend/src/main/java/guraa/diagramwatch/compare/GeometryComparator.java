package guraa.diagramwatch.compare;

import guraa.diagramwatch.model.PathSegment;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Coarse geometry comparison: only a large swing in the number of line segments is reported.
 * Segments are not clustered into taxiway or runway shapes.
 */
@Component
public class GeometryComparator {

    /**
     * A segment count difference must exceed this to be reported.
     */
    public static final int SIGNIFICANT_SEGMENT_DELTA = 50;

    public List<GeometryChange> compare(List<PathSegment> oldPaths, List<PathSegment> newPaths) {
        int diff = newPaths.size() - oldPaths.size();
        if (Math.abs(diff) <= SIGNIFICANT_SEGMENT_DELTA) {
            return List.of();
        }

        if (diff > 0) {
            return List.of(GeometryChange.builder()
                    .changeType(GeometryChangeType.GEOMETRY_ADDED)
                    .segmentDelta(diff)
                    .description("Approximately " + diff
                            + " new path segments added (possible new taxiway geometry)")
                    .build());
        }
        return List.of(GeometryChange.builder()
                .changeType(GeometryChangeType.GEOMETRY_REMOVED)
                .segmentDelta(-diff)
                .description("Approximately " + (-diff) + " path segments removed (possible taxiway removal)")
                .build());
    }
}
