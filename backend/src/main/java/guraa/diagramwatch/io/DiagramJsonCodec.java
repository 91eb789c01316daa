package guraa.diagramwatch.io;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import guraa.diagramwatch.compare.ComparisonResult;
import guraa.diagramwatch.history.HistoricalSearchResult;
import guraa.diagramwatch.model.DiagramSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes the JSON artifacts exchanged with storage and notification collaborators:
 * extracted snapshots and comparison results.
 * Snapshots written by older versions may lack keys; those read back as 0, "" or empty lists.
 */
@Slf4j
@Component
public class DiagramJsonCodec {

    private final ObjectMapper objectMapper;

    public DiagramJsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    /**
     * Read a snapshot from a JSON file.
     *
     * @param path The snapshot file
     * @return The snapshot
     * @throws IOException If the file cannot be read or is not valid JSON
     */
    public DiagramSnapshot readSnapshot(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            DiagramSnapshot snapshot = readSnapshot(in);
            log.debug("Read snapshot {} {} from {}", snapshot.getAirportCode(), snapshot.getCycle(), path);
            return snapshot;
        }
    }

    public DiagramSnapshot readSnapshot(InputStream in) throws IOException {
        return objectMapper.readValue(in, DiagramSnapshot.class);
    }

    public DiagramSnapshot readSnapshot(String json) throws IOException {
        return objectMapper.readValue(json, DiagramSnapshot.class);
    }

    public String writeSnapshot(DiagramSnapshot snapshot) throws IOException {
        return objectMapper.writeValueAsString(snapshot);
    }

    public String writeResult(ComparisonResult result) throws IOException {
        return objectMapper.writeValueAsString(result);
    }

    public String writeHistory(HistoricalSearchResult result) throws IOException {
        return objectMapper.writeValueAsString(result);
    }
}
