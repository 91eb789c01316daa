package guraa.diagramwatch.snapshot;

import guraa.diagramwatch.model.DiagramSnapshot;
import lombok.Value;

import java.nio.file.Path;

/**
 * Airport code and cycle encoded in a diagram file name such as {@code JFK_2602.pdf}.
 */
@Value
public class SourceName {
    String airportCode;
    String cycle;

    /**
     * Parse a file name of the form {@code AIRPORT_CYCLE[_...].ext}. Missing parts become "UNKNOWN".
     */
    public static SourceName parse(Path path) {
        String fileName = path.getFileName() != null ? path.getFileName().toString() : "";
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;

        String[] parts = stem.split("_");
        String airportCode = parts.length >= 1 && !parts[0].isEmpty() ? parts[0] : DiagramSnapshot.UNKNOWN;
        String cycle = parts.length >= 2 && !parts[1].isEmpty() ? parts[1] : DiagramSnapshot.UNKNOWN;
        return new SourceName(airportCode, cycle);
    }
}
