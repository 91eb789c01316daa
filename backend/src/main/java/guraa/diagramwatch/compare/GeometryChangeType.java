package guraa.diagramwatch.compare;

/**
 * Kinds of coarse geometry change.
 */
public enum GeometryChangeType {
    GEOMETRY_ADDED,
    GEOMETRY_REMOVED
}
