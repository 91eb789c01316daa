package guraa.diagramwatch.history;

import guraa.diagramwatch.model.DiagramSnapshot;

import java.util.Optional;

/**
 * Supplies the snapshot of an airport diagram for a given cycle, from wherever snapshots are kept.
 */
public interface SnapshotSource {

    /**
     * Look up a snapshot.
     *
     * @param airportCode The airport code
     * @param cycle The AIRAC cycle
     * @return The snapshot, or empty if that cycle is not available
     */
    Optional<DiagramSnapshot> find(String airportCode, String cycle);
}
