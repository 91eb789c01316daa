package guraa.diagramwatch.compare;

/**
 * Kinds of runway change.
 */
public enum RunwayChangeType {
    RUNWAY_ADDED,
    RUNWAY_REMOVED,
    LENGTH_CHANGED,
    WIDTH_CHANGED
}
