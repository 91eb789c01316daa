package guraa.diagramwatch.compare;

/**
 * Kinds of taxiway designator change.
 */
public enum TaxiwayChangeType {
    /**
     * Designator present only in the new diagram.
     */
    ADDED,
    /**
     * Designator present only in the old diagram.
     */
    REMOVED,
    /**
     * A disappearing designator and a new one at the same spot.
     */
    RENAMED
}
